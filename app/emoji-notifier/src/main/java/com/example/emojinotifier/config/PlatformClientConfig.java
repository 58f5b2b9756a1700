package com.example.emojinotifier.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class PlatformClientConfig {

  private static final String BOT_AUTH_SCHEME = "Bot ";

  @Bean
  RestClient platformRestClient(
      RestClient.Builder builder,
      PlatformApiProperties properties,
      EmojiNotifierProperties notifierProperties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    // every platform call carries the bot credential
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.AUTHORIZATION, BOT_AUTH_SCHEME + notifierProperties.botToken())
        .build();
  }
}
