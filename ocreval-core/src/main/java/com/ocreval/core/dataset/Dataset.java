package com.ocreval.core.dataset;

import com.ocreval.common.dto.ManifestParseError;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 从图片目录发现的评估数据集。
 */
@Value
@Builder
public class Dataset {

    Path imagesDir;

    @Singular
    List<Path> manifests;

    @Singular
    List<DatasetEntry> entries;

    @Singular
    List<ManifestParseError> parseErrors;

    public int skippedLines() {
        return parseErrors.size();
    }

    /**
     * 去重后的图片键，保持出现顺序。
     */
    public Set<String> imageKeys() {
        Set<String> keys = new LinkedHashSet<>();
        entries.forEach(entry -> keys.add(entry.getKey()));
        return keys;
    }
}
