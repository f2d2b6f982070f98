package com.ocreval.core.config;

import com.ocreval.core.dataset.AnnotationPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 评估规则配置项。
 */
@Data
@ConfigurationProperties(prefix = "ocreval.evaluation")
public class EvaluationProperties {

    /** 一行多个标注时的取舍策略 */
    private AnnotationPolicy annotationPolicy = AnnotationPolicy.FIRST_WELL_FORMED;

    /** 是否排除标记为 difficult 的标注 */
    private boolean excludeDifficult = false;

    /** 比对时是否区分大小写 */
    private boolean caseSensitive = true;

    /** 标注文件名 */
    private String labelFileName = "Label.txt";
}
