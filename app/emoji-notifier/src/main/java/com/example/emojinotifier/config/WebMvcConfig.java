/*
 * Where: emoji-notifier web configuration
 * What: Applies RequestMdcInterceptor to the command and debug endpoints
 * Why: Command acknowledgments and their log lines share one request id
 */
package com.example.emojinotifier.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns("/interactions/**", "/debug/**");
  }
}
