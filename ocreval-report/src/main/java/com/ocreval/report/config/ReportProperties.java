package com.ocreval.report.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 报告输出相关配置。
 */
@Data
@ConfigurationProperties(prefix = "ocreval.report")
public class ReportProperties {

    /** 报告输出目录 */
    private String outputDir = "data/reports";

    /** 默认的测试图片根目录 */
    private String imagesDir = "data/images";

    private ReportFormat format = ReportFormat.BOTH;

    /** 每个目录在报告中展示的样本行数 */
    private int sampleRows = 10;

    /** 总体准确率达到此值评为"表现优异" */
    private double accuracyThreshold = 0.95;

    /** 总体准确率达到此值评为"表现良好" */
    private double goodThreshold = 0.8;

    /** 对比报告默认文件名（不含扩展名） */
    private String comparisonReportName = "model_comparison";
}
