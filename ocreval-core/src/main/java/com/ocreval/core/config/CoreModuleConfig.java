package com.ocreval.core.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 评估核心模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.ocreval.core")
@EnableConfigurationProperties({EvaluationProperties.class, EngineCatalogProperties.class})
public class CoreModuleConfig {
}
