package com.ocreval.common.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 多引擎对比结果，按名次排列。
 */
@Value
@Builder
@Jacksonized
public class ComparisonResult {

    @Singular
    List<RankedEngine> entries;

    public RankedEngine top() {
        return entries.isEmpty() ? null : entries.get(0);
    }

    public List<String> rankedEngineNames() {
        return entries.stream().map(RankedEngine::getEngineName).toList();
    }
}
