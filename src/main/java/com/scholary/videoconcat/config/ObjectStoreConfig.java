package com.scholary.videoconcat.config;

import com.scholary.videoconcat.objectstore.ObjectStoreClient;
import com.scholary.videoconcat.objectstore.ObjectStoreProperties;
import com.scholary.videoconcat.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the {@link ObjectStoreClient} used for catalogs, plans and annotations.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
