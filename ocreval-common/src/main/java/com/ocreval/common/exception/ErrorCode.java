package com.ocreval.common.exception;

/**
 * 错误码定义，每个错误码对应命令行的退出码。
 */
public enum ErrorCode {

    CONFIG_ERROR(1),
    MODEL_INIT_ERROR(2),
    DATA_ERROR(3),
    EVALUATION_ERROR(4),
    REPORT_ERROR(5),
    UNKNOWN_ERROR(99);

    private final int exitCode;

    ErrorCode(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
