package com.ocreval.core.dataset;

/**
 * 一行标注中存在多个标注对象时的取舍策略。
 */
public enum AnnotationPolicy {

    /** 每行只取第一个格式正确的标注 */
    FIRST_WELL_FORMED,

    /** 每个格式正确的标注各生成一条记录，共享同一图片路径 */
    EVERY_ANNOTATION
}
