package com.ocreval.core.dataset;

import com.ocreval.common.dto.GroundTruthRecord;
import com.ocreval.common.dto.ManifestParseError;
import com.ocreval.common.exception.DatasetIoException;
import com.ocreval.common.util.ImageUtils;
import com.ocreval.core.config.EvaluationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 数据集发现：在图片目录中查找标注文件并加载全部标注。
 * <p>
 * 查找顺序：图片目录本身；否则每个一级子目录，一级子目录没有标注文件时再看它的下一级子目录。
 * 目录按名称排序，保证多次运行结果一致。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetLoader {

    private final GroundTruthLoader groundTruthLoader;
    private final EvaluationProperties properties;

    public Dataset load(Path imagesDir) {
        if (!Files.isDirectory(imagesDir)) {
            throw new DatasetIoException("图片目录不存在: " + imagesDir.toAbsolutePath());
        }
        Path root = imagesDir.toAbsolutePath().normalize();
        List<Path> labelDirs = discoverLabelDirectories(root);
        if (labelDirs.isEmpty()) {
            throw new DatasetIoException("在 " + root + " 下未找到标注文件 " + properties.getLabelFileName());
        }

        Dataset.DatasetBuilder dataset = Dataset.builder().imagesDir(root);
        for (Path labelDir : labelDirs) {
            Path manifest = labelDir.resolve(properties.getLabelFileName());
            ManifestLoadResult loaded = groundTruthLoader.load(manifest);
            dataset.manifest(manifest).parseErrors(loaded.getErrors());

            String directory = relativeKey(root, labelDir);
            // 数据集键 -> 首次占用它的行号
            Map<String, Integer> keyLines = new HashMap<>();
            Set<Integer> rejectedLines = new HashSet<>();
            for (GroundTruthRecord record : loaded.getRecords()) {
                Path imageFile = labelDir.resolve(ImageUtils.baseName(record.getImagePath()));
                String key = relativeKey(root, imageFile);
                Integer firstLine = keyLines.putIfAbsent(key, record.getLineNumber());
                if (firstLine != null && firstLine != record.getLineNumber()) {
                    if (rejectedLines.add(record.getLineNumber())) {
                        dataset.parseError(duplicateKey(loaded.getSource(), record, key, firstLine));
                    }
                    continue;
                }
                dataset.entry(DatasetEntry.builder()
                        .key(key)
                        .directory(directory)
                        .groundTruth(record)
                        .imageFile(imageFile)
                        .build());
            }
        }

        Dataset result = dataset.build();
        log.info("数据集加载完成: {} 个标注文件, {} 条标注, {} 张图片, {} 行跳过",
                result.getManifests().size(), result.getEntries().size(),
                result.imageKeys().size(), result.skippedLines());
        return result;
    }

    private static ManifestParseError duplicateKey(String source, GroundTruthRecord record, String key, int firstLine) {
        log.warn("{} 第 {} 行已跳过: 图片 {} 与第 {} 行指向同一文件 {}",
                source, record.getLineNumber(), record.getImagePath(), firstLine, key);
        return ManifestParseError.builder()
                .source(source)
                .lineNumber(record.getLineNumber())
                .reason("duplicate image key " + key + " (first seen on line " + firstLine + ")")
                .content(record.getImagePath())
                .build();
    }

    private List<Path> discoverLabelDirectories(Path root) {
        if (hasLabelFile(root)) {
            return List.of(root);
        }
        List<Path> found = new ArrayList<>();
        for (Path child : subdirectories(root)) {
            if (hasLabelFile(child)) {
                found.add(child);
                continue;
            }
            for (Path grandChild : subdirectories(child)) {
                if (hasLabelFile(grandChild)) {
                    found.add(grandChild);
                }
            }
        }
        return found;
    }

    private boolean hasLabelFile(Path dir) {
        return Files.isRegularFile(dir.resolve(properties.getLabelFileName()));
    }

    private static List<Path> subdirectories(Path dir) {
        try (Stream<Path> children = Files.list(dir)) {
            return children.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new DatasetIoException("无法读取目录: " + dir, e);
        }
    }

    private static String relativeKey(Path root, Path path) {
        String relative = root.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
        return relative.isEmpty() ? "." : relative;
    }
}
