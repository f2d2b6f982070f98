package com.ocreval.common.exception;

import java.time.Duration;

/**
 * 单次调用超过截止时间被取消。
 */
public class CallTimeoutException extends OcrEvalException {

    private final Duration timeout;

    public CallTimeoutException(String message, Duration timeout) {
        super(ErrorCode.EVALUATION_ERROR, message);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
