/*
 * Where: emoji-notifier web configuration
 * What: Registers the Ed25519 signature filter on the interaction endpoint
 * Why: Command requests must come from the platform, not from anyone who can reach the port
 */
package com.example.emojinotifier.config;

import com.example.emojinotifier.api.InteractionSignatureFilter;
import com.example.emojinotifier.api.InteractionSignatureVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

@Configuration
public class InteractionSignatureConfig {

  static final String INTERACTIONS_PATH = "/interactions";

  private static final Logger logger = LoggerFactory.getLogger(InteractionSignatureConfig.class);

  public InteractionSignatureConfig(InteractionProperties properties) {
    if (!properties.verificationEnabled()) {
      logger.warn(
          "emoji-notifier.interactions.public-key is blank; interaction signatures are not checked");
    }
  }

  @Bean
  @ConditionalOnExpression("'${emoji-notifier.interactions.public-key:}'.trim() != ''")
  public FilterRegistrationBean<InteractionSignatureFilter> interactionSignatureFilter(
      InteractionProperties properties, ObjectMapper objectMapper) {
    final InteractionSignatureFilter filter =
        new InteractionSignatureFilter(
            new InteractionSignatureVerifier(properties.publicKey()), objectMapper);
    final FilterRegistrationBean<InteractionSignatureFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.addUrlPatterns(INTERACTIONS_PATH);
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
    return registration;
  }
}
