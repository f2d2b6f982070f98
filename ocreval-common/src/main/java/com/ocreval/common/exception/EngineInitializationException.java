package com.ocreval.common.exception;

/**
 * 识别引擎初始化失败（模型未安装、服务不可达、配置缺失等）。
 */
public class EngineInitializationException extends OcrEvalException {

    public EngineInitializationException(String message) {
        super(ErrorCode.MODEL_INIT_ERROR, message);
    }

    public EngineInitializationException(String message, Throwable cause) {
        super(ErrorCode.MODEL_INIT_ERROR, message, cause);
    }
}
