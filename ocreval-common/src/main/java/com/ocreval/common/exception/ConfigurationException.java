package com.ocreval.common.exception;

/**
 * 配置或命令行参数错误。
 */
public class ConfigurationException extends OcrEvalException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIG_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIG_ERROR, message, cause);
    }
}
