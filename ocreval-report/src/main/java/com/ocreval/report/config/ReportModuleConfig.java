package com.ocreval.report.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 报告模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.ocreval.report")
@EnableConfigurationProperties(ReportProperties.class)
public class ReportModuleConfig {
}
