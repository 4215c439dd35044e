package com.scholary.videoconcat.config;

import com.scholary.videoconcat.catalog.CatalogProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the planner and catalog properties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({PlannerProperties.class, CatalogProperties.class})
public class PlannerConfig {}
