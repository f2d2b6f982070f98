package com.ocreval.engine.config;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 识别引擎模块自动配置。
 * <p>
 * 各引擎的选项通过 {@code ocreval.engines.<引擎名>} 配置，由核心模块的
 * {@link com.ocreval.core.engine.RecognitionEngineFactory} 合并后交给对应 Provider。
 */
@Configuration
@ComponentScan(basePackages = "com.ocreval.engine")
public class EngineModuleConfig {
}
