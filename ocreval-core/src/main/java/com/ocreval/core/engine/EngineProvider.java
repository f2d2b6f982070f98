package com.ocreval.core.engine;

import java.util.Map;

/**
 * 识别引擎提供者，每种后端注册一个 Spring Bean。
 * 通过适配器模式支持不同的识别后端（本地 OCR、多模态大模型等）。
 */
public interface EngineProvider {

    /**
     * 引擎名称（小写、以 - 分隔），命令行与配置中使用。
     */
    String engineName();

    /**
     * 展示用名称。
     */
    String displayName();

    /**
     * 默认选项，会被配置文件与命令行覆盖。
     */
    Map<String, Object> defaultOptions();

    /**
     * 按合并后的选项创建引擎实例，实例尚未初始化。
     */
    RecognitionEngine create(EngineOptions options);
}
