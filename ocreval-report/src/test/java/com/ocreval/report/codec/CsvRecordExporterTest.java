package com.ocreval.report.codec;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ocreval.report.ReportFixtures;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CsvRecordExporterTest {

    private final CsvRecordExporter exporter = new CsvRecordExporter();

    @Test
    void writesOneRowPerRecordWithHeader() throws IOException {
        String csv = exporter.write(ReportFixtures.report("qwen-vl"));

        assertThat(csv).startsWith(
                "image_path,ground_truth,recognized_text,succeeded,error_detail,latency_ms,accuracy,exact_match\n");
        List<Map<String, String>> rows = readRows(csv);
        assertThat(rows).hasSize(3);
        assertThat(rows.get(0))
                .containsEntry("image_path", "batch1/a.jpg")
                .containsEntry("ground_truth", "P4P601#03")
                .containsEntry("succeeded", "true")
                .containsEntry("latency_ms", "120")
                .containsEntry("exact_match", "true");
        assertThat(rows.get(1)).containsEntry("recognized_text", "PLA196.1");
        assertThat(rows.get(2))
                .containsEntry("recognized_text", "")
                .containsEntry("succeeded", "false")
                .containsEntry("error_detail", "timeout")
                .containsEntry("accuracy", "0.0");
    }

    private static List<Map<String, String>> readRows(String csv) throws IOException {
        try (MappingIterator<Map<String, String>> it = new CsvMapper()
                .readerFor(Map.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(csv)) {
            return it.readAll();
        }
    }
}
