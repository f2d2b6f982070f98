package com.ocreval.report.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ocreval.common.dto.EvaluationRecord;
import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.dto.RecognitionOutcome;
import com.ocreval.common.exception.ReportException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 逐条评估记录导出为 CSV，便于在表格工具里筛选错例。
 */
@Component
public class CsvRecordExporter {

    static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn("image_path")
            .addColumn("ground_truth")
            .addColumn("recognized_text")
            .addBooleanColumn("succeeded")
            .addColumn("error_detail")
            .addNumberColumn("latency_ms")
            .addNumberColumn("accuracy")
            .addBooleanColumn("exact_match")
            .build()
            .withHeader();

    private final CsvMapper csvMapper = new CsvMapper();

    public String write(EvaluationReport report) {
        List<Map<String, Object>> rows = new ArrayList<>(report.getRecords().size());
        for (EvaluationRecord record : report.getRecords()) {
            RecognitionOutcome outcome = record.getOutcome();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("image_path", record.getImagePath());
            row.put("ground_truth", record.getGroundTruth().getTranscription());
            row.put("recognized_text", outcome.getRecognizedText());
            row.put("succeeded", outcome.isSucceeded());
            row.put("error_detail", outcome.getErrorDetail());
            row.put("latency_ms", outcome.getLatency() == null ? null : outcome.getLatency().toMillis());
            row.put("accuracy", record.getAccuracy());
            row.put("exact_match", record.isExactMatch());
            rows.add(row);
        }
        try {
            return csvMapper.writer(SCHEMA).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new ReportException("CSV 导出失败: " + e.getOriginalMessage(), e);
        }
    }
}
