package com.ocreval.engine.vision;

/**
 * 多模态模型服务客户端接口。
 * 通过适配器模式支持不同的服务协议（OpenAI 兼容、Anthropic 等）。
 */
public interface VisionModelClient {

    /**
     * 对单张图片发送带视觉的 Chat 请求（阻塞式，等待完整响应）。
     *
     * @param imageBase64 图片的 Base64 编码
     * @param mimeType    图片 MIME 类型
     * @param prompt      提示词
     * @return 模型返回的原始文本
     */
    String complete(String imageBase64, String mimeType, String prompt);

    /**
     * 检查服务是否可达、模型列表是否可用，不可达时抛出
     * {@link com.ocreval.common.exception.EngineInitializationException}。
     */
    void checkConnection();

    /**
     * 获取协议名称。
     */
    String getProviderName();
}
