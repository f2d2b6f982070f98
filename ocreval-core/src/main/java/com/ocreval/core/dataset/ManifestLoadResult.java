package com.ocreval.core.dataset;

import com.ocreval.common.dto.GroundTruthRecord;
import com.ocreval.common.dto.ManifestParseError;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一个标注文件的加载结果：有效标注与被跳过的行。
 */
@Value
@Builder
public class ManifestLoadResult {

    String source;

    @Singular
    List<GroundTruthRecord> records;

    @Singular
    List<ManifestParseError> errors;

    public int skippedLines() {
        return errors.size();
    }
}
