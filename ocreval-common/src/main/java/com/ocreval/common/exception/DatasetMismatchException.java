package com.ocreval.common.exception;

/**
 * 多模型对比时各汇总结果对应的图片集合不一致。
 * <p>
 * 只影响本次对比，不会破坏已经计算好的单模型汇总。
 */
public class DatasetMismatchException extends OcrEvalException {

    public DatasetMismatchException(String message) {
        super(ErrorCode.DATA_ERROR, message);
    }
}
