package com.ocreval.report.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ocreval.common.dto.ComparisonResult;
import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.exception.ReportException;
import org.springframework.stereotype.Component;

/**
 * 评估报告与对比结果的 JSON 编解码。
 * <p>
 * 时间写为 ISO-8601 字符串（Instant 如 "2024-01-01T12:00:00Z"，Duration 如 "PT1.5S"）。
 */
@Component
public class JsonReportCodec {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String writeReport(EvaluationReport report) {
        return write(report);
    }

    public String writeComparison(ComparisonResult comparison) {
        return write(comparison);
    }

    public EvaluationReport readReport(String json) {
        return read(json, EvaluationReport.class);
    }

    public ComparisonResult readComparison(String json) {
        return read(json, ComparisonResult.class);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ReportException("JSON 序列化失败: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ReportException("JSON 解析失败: " + e.getOriginalMessage(), e);
        }
    }
}
