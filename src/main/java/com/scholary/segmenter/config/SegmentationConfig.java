package com.scholary.segmenter.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for segmentation-related beans.
 *
 * <p>Enables the SegmentationProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(SegmentationProperties.class)
public class SegmentationConfig {}
