/*
 * Where: emoji-notifier API
 * What: Checks the Ed25519 signature the platform puts on every interaction request
 * Why: Without it anyone who knows a guild/channel pair could register or unregister it
 */
package com.example.emojinotifier.api;

import com.google.common.io.BaseEncoding;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Locale;

public class InteractionSignatureVerifier {

  private static final String ALGORITHM = "Ed25519";
  private static final int RAW_KEY_LENGTH = 32;
  // DER prefix of an X.509 SubjectPublicKeyInfo wrapping a raw Ed25519 key
  private static final byte[] X509_PREFIX =
      BaseEncoding.base16().lowerCase().decode("302a300506032b6570032100");

  private final PublicKey publicKey;

  /**
   * @param publicKeyHex the 32-byte raw key as the platform's developer console shows it
   * @throws IllegalArgumentException if the key is not 64 hex characters
   */
  public InteractionSignatureVerifier(String publicKeyHex) {
    final byte[] raw = decodeHex(publicKeyHex);
    if (raw == null || raw.length != RAW_KEY_LENGTH) {
      throw new IllegalArgumentException("interaction public key must be 32 hex-encoded bytes");
    }
    final byte[] encoded = new byte[X509_PREFIX.length + RAW_KEY_LENGTH];
    System.arraycopy(X509_PREFIX, 0, encoded, 0, X509_PREFIX.length);
    System.arraycopy(raw, 0, encoded, X509_PREFIX.length, RAW_KEY_LENGTH);
    try {
      this.publicKey =
          KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
    } catch (GeneralSecurityException ex) {
      throw new IllegalArgumentException("interaction public key is not a valid Ed25519 key", ex);
    }
  }

  /** The signed message is the timestamp header followed by the raw request body. */
  public boolean verify(String signatureHex, String timestamp, byte[] body) {
    if (timestamp == null || timestamp.isBlank()) {
      return false;
    }
    final byte[] signatureBytes = decodeHex(signatureHex);
    if (signatureBytes == null) {
      return false;
    }
    try {
      final Signature signature = Signature.getInstance(ALGORITHM);
      signature.initVerify(publicKey);
      signature.update(timestamp.getBytes(StandardCharsets.UTF_8));
      signature.update(body);
      return signature.verify(signatureBytes);
    } catch (GeneralSecurityException ex) {
      // malformed signature bytes are reported as a failed check
      return false;
    }
  }

  private static byte[] decodeHex(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return BaseEncoding.base16().lowerCase().decode(value.trim().toLowerCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return null;
    }
  }
}
