package com.ocreval.core.dataset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ocreval.common.dto.GroundTruthRecord;
import com.ocreval.common.dto.ManifestParseError;
import com.ocreval.common.dto.TextPoint;
import com.ocreval.common.exception.DatasetIoException;
import com.ocreval.core.config.EvaluationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 标注文件（Label.txt）解析器。
 * <p>
 * 每行格式为 {@code <图片路径>\t<标注 JSON 数组>}，标注对象包含
 * {@code transcription}、{@code points}、{@code difficult} 三个字段。
 * 无法解析的行记录为 {@link ManifestParseError} 并跳过，不会中断加载；
 * 只有文件本身不可读时才抛出 {@link DatasetIoException}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GroundTruthLoader {

    private static final char BOM = '\uFEFF';
    private static final int MAX_CONTENT_LENGTH = 200;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EvaluationProperties properties;

    public ManifestLoadResult load(Path manifest) {
        try (BufferedReader reader = Files.newBufferedReader(manifest, StandardCharsets.UTF_8)) {
            return load(reader, manifest.toString());
        } catch (IOException e) {
            throw new DatasetIoException("无法读取标注文件: " + manifest, e);
        }
    }

    public ManifestLoadResult load(Reader reader, String source) {
        return load(reader, source, properties.getAnnotationPolicy());
    }

    public ManifestLoadResult load(Reader reader, String source, AnnotationPolicy policy) {
        ManifestLoadResult.ManifestLoadResultBuilder result = ManifestLoadResult.builder().source(source);
        // 图片路径 -> 首次出现的行号
        Map<String, Integer> seenPaths = new HashMap<>();
        BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        int lineNumber = 0;
        int accepted = 0;
        try {
            String line;
            while ((line = lines.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BOM) {
                    line = line.substring(1);
                }
                if (line.isBlank()) {
                    continue;
                }
                ParsedLine parsed = parseLine(line, lineNumber, policy);
                if (parsed.error != null) {
                    result.error(parseError(source, lineNumber, parsed.error, line));
                    continue;
                }
                Integer firstSeen = seenPaths.putIfAbsent(parsed.imagePath, lineNumber);
                if (firstSeen != null) {
                    result.error(parseError(source, lineNumber,
                            "duplicate image path (first seen on line " + firstSeen + ")", line));
                    continue;
                }
                result.records(parsed.records);
                accepted++;
            }
        } catch (IOException e) {
            throw new DatasetIoException("读取标注文件出错: " + source + " (第 " + lineNumber + " 行)", e);
        }

        ManifestLoadResult loaded = result.build();
        log.info("标注文件 {} 加载完成: {} 行有效, {} 条标注, {} 行跳过",
                source, accepted, loaded.getRecords().size(), loaded.skippedLines());
        return loaded;
    }

    private ParsedLine parseLine(String line, int lineNumber, AnnotationPolicy policy) {
        int tab = line.indexOf('\t');
        if (tab < 0) {
            return ParsedLine.error("missing tab separator");
        }
        String imagePath = line.substring(0, tab).trim();
        if (imagePath.isEmpty()) {
            return ParsedLine.error("empty image path");
        }

        JsonNode annotations;
        try {
            annotations = objectMapper.readTree(line.substring(tab + 1));
        } catch (JsonProcessingException e) {
            return ParsedLine.error("invalid JSON: " + e.getOriginalMessage());
        }
        if (annotations == null || !annotations.isArray()) {
            return ParsedLine.error("annotations are not a JSON array");
        }

        List<GroundTruthRecord> records = new ArrayList<>();
        for (int i = 0; i < annotations.size(); i++) {
            Optional<GroundTruthRecord> record = toRecord(annotations.get(i), imagePath, i, lineNumber);
            if (record.isEmpty()) {
                log.debug("第 {} 行第 {} 个标注格式不正确，已忽略", lineNumber, i);
                continue;
            }
            records.add(record.get());
            if (policy == AnnotationPolicy.FIRST_WELL_FORMED) {
                break;
            }
        }
        if (records.isEmpty()) {
            return ParsedLine.error("no well-formed annotation");
        }
        return new ParsedLine(imagePath, records, null);
    }

    /**
     * 格式正确的标注：transcription 为非空字符串；points 缺省或为 4 个数值坐标对；difficult 缺省或为布尔值。
     */
    private Optional<GroundTruthRecord> toRecord(JsonNode node, String imagePath, int index, int lineNumber) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode transcription = node.get("transcription");
        if (transcription == null || !transcription.isTextual() || transcription.asText().isEmpty()) {
            return Optional.empty();
        }
        JsonNode difficult = node.get("difficult");
        if (difficult != null && !difficult.isNull() && !difficult.isBoolean()) {
            return Optional.empty();
        }

        GroundTruthRecord.GroundTruthRecordBuilder record = GroundTruthRecord.builder()
                .imagePath(imagePath)
                .transcription(transcription.asText())
                .difficult(difficult != null && difficult.asBoolean(false))
                .annotationIndex(index)
                .lineNumber(lineNumber);

        JsonNode points = node.get("points");
        if (points != null && !points.isNull()) {
            if (!points.isArray() || points.size() != 4) {
                return Optional.empty();
            }
            for (JsonNode point : points) {
                if (!point.isArray() || point.size() != 2 || !point.get(0).isNumber() || !point.get(1).isNumber()) {
                    return Optional.empty();
                }
                record.point(TextPoint.builder().x(point.get(0).asDouble()).y(point.get(1).asDouble()).build());
            }
        }
        return Optional.of(record.build());
    }

    private static ManifestParseError parseError(String source, int lineNumber, String reason, String line) {
        log.warn("{} 第 {} 行已跳过: {}", source, lineNumber, reason);
        String content = line.length() > MAX_CONTENT_LENGTH ? line.substring(0, MAX_CONTENT_LENGTH) + "..." : line;
        return ManifestParseError.builder()
                .source(source)
                .lineNumber(lineNumber)
                .reason(reason)
                .content(content)
                .build();
    }

    /**
     * 单行解析结果，error 非空表示该行无效。
     */
    private static final class ParsedLine {
        private final String imagePath;
        private final List<GroundTruthRecord> records;
        private final String error;

        private ParsedLine(String imagePath, List<GroundTruthRecord> records, String error) {
            this.imagePath = imagePath;
            this.records = records;
            this.error = error;
        }

        private static ParsedLine error(String reason) {
            return new ParsedLine(null, List.of(), reason);
        }
    }
}
