package com.scholary.videoconcat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoconcat.transition.LlmTransitionClient;
import com.scholary.videoconcat.transition.PlaceholderTransitionClient;
import com.scholary.videoconcat.transition.TransitionClient;
import com.scholary.videoconcat.transition.TransitionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the transition text generator.
 *
 * <p>With {@code transition.enabled=false} no HTTP client is created and annotations carry
 * placeholder text.
 */
@Configuration
@EnableConfigurationProperties(TransitionProperties.class)
public class TransitionConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(TransitionConfig.class);

  @Bean
  public TransitionClient transitionClient(
      TransitionProperties properties, ObjectMapper objectMapper) {
    if (!properties.enabled()) {
      LOGGER.info("Transition generation disabled, using placeholder text");
      return new PlaceholderTransitionClient();
    }
    return new LlmTransitionClient(properties, objectMapper);
  }
}
