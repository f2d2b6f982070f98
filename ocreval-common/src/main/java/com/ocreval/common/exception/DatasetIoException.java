package com.ocreval.common.exception;

/**
 * 数据集目录或标注文件缺失、不可读时抛出，属于致命错误，整次运行立即中止。
 */
public class DatasetIoException extends OcrEvalException {

    public DatasetIoException(String message) {
        super(ErrorCode.DATA_ERROR, message);
    }

    public DatasetIoException(String message, Throwable cause) {
        super(ErrorCode.DATA_ERROR, message, cause);
    }
}
