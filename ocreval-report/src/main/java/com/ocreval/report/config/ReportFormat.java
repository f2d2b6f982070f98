package com.ocreval.report.config;

import com.ocreval.common.exception.ConfigurationException;

import java.util.Locale;

/**
 * 单引擎评估报告的输出格式。
 */
public enum ReportFormat {

    MARKDOWN,
    JSON,
    CSV,
    /** Markdown + JSON */
    BOTH,
    /** Markdown + JSON + CSV */
    ALL;

    public boolean includesMarkdown() {
        return this == MARKDOWN || this == BOTH || this == ALL;
    }

    public boolean includesJson() {
        return this == JSON || this == BOTH || this == ALL;
    }

    public boolean includesCsv() {
        return this == CSV || this == ALL;
    }

    /**
     * 解析命令行取值，不区分大小写。
     */
    public static ReportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return BOTH;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("不支持的报告格式: " + value + "（可选 markdown / json / csv / both / all）");
        }
    }
}
