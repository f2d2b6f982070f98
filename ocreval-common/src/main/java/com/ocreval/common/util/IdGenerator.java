package com.ocreval.common.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 评估运行 ID 生成器。
 */
public final class IdGenerator {

    private static final DateTimeFormatter RUN_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private IdGenerator() {
    }

    /**
     * 生成形如 "tesseract-20240101-120000-1a2b3c" 的运行 ID。
     */
    public static String runId(String engineName) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        return engineName + "-" + LocalDateTime.now().format(RUN_TIME) + "-" + suffix;
    }
}
