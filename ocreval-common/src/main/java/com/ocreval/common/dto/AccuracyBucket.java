package com.ocreval.common.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 准确率分布区间。除最高区间包含 1.0 外，其余均为左闭右开。
 */
public enum AccuracyBucket {

    EXCELLENT("[0.9,1.0]", 0.9),
    GOOD("[0.8,0.9)", 0.8),
    FAIR("[0.7,0.8)", 0.7),
    PASSABLE("[0.6,0.7)", 0.6),
    LOW("[0,0.6)", 0.0);

    private final String label;
    private final double lowerBound;

    AccuracyBucket(String label, double lowerBound) {
        this.label = label;
        this.lowerBound = lowerBound;
    }

    public String getLabel() {
        return label;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    /**
     * 按准确率定位区间，NaN 与负数落入最低区间。
     */
    public static AccuracyBucket of(double accuracy) {
        for (AccuracyBucket bucket : values()) {
            if (accuracy >= bucket.lowerBound) {
                return bucket;
            }
        }
        return LOW;
    }

    /**
     * 所有区间计数为 0 的分布，按区间从高到低排列。
     */
    public static Map<String, Integer> emptyDistribution() {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (AccuracyBucket bucket : values()) {
            distribution.put(bucket.label, 0);
        }
        return distribution;
    }
}
