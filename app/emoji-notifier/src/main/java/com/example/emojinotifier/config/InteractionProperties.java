package com.example.emojinotifier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Hex-encoded Ed25519 application public key; blank turns signature checks off. */
@ConfigurationProperties(prefix = "emoji-notifier.interactions")
public record InteractionProperties(String publicKey) {

  public boolean verificationEnabled() {
    return publicKey != null && !publicKey.isBlank();
  }
}
