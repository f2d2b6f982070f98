package com.ocreval.core.engine;

import com.ocreval.common.dto.RecognitionOutcome;

import java.nio.file.Path;
import java.util.Map;

/**
 * 文字识别引擎接口。
 * <p>
 * 一次调用要么成功返回文本（可能为空串），要么返回带错误描述的失败结果，
 * 任何异常都不会越过这个边界。调用可以阻塞，长连接在 {@link #open()} 中建立并复用，
 * 连接断开只算单次调用失败，核心不会重试。
 */
public interface RecognitionEngine extends AutoCloseable {

    /**
     * 引擎名称，同时作为报告与对比中的标识。
     */
    String name();

    /**
     * 初始化引擎（加载模型、建立连接），失败时抛出
     * {@link com.ocreval.common.exception.EngineInitializationException}。
     */
    void open();

    /**
     * 识别单张图片中的文字。
     */
    RecognitionOutcome recognize(Path image);

    /**
     * 报告中展示的技术细节：模型名称、类型、关键配置等。
     */
    Map<String, Object> describe();

    @Override
    void close();
}
