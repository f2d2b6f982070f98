package com.ocreval.report.render;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Markdown 报告共用的格式化方法。
 */
final class MarkdownSupport {

    static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final String NO_DATA = "无数据";

    static final String ROOT_DIRECTORY = ".";

    private MarkdownSupport() {
    }

    /**
     * 比率格式化为 "0.8333 (83.33%)"，null 视为无数据。
     */
    static String ratio(Double value) {
        if (value == null) {
            return NO_DATA;
        }
        return String.format(Locale.ROOT, "%.4f (%.2f%%)", value, value * 100);
    }

    static String decimal(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    static String delta(Double value) {
        return value == null ? "-" : String.format(Locale.ROOT, "%+.4f", value);
    }

    static String percent(int count, int total) {
        double pct = total > 0 ? count * 100.0 / total : 0.0;
        return String.format(Locale.ROOT, "%.1f%%", pct);
    }

    static String seconds(Duration duration) {
        if (duration == null) {
            return "-";
        }
        return String.format(Locale.ROOT, "%.2f 秒", duration.toMillis() / 1000.0);
    }

    static String millis(Double value) {
        return value == null ? "-" : String.format(Locale.ROOT, "%.1f ms", value);
    }

    static String time(Instant instant) {
        if (instant == null) {
            return "-";
        }
        return DISPLAY_TIME.format(LocalDateTime.ofInstant(instant, ZoneId.systemDefault()));
    }

    static String now() {
        return DISPLAY_TIME.format(LocalDateTime.now());
    }

    static String directoryLabel(String directory) {
        return ROOT_DIRECTORY.equals(directory) ? "(根目录)" : directory;
    }

    /**
     * 表格单元格转义：竖线转义，换行折叠为空格。
     */
    static String cell(Object value) {
        if (value == null) {
            return "";
        }
        return value.toString()
                .replace("|", "\\|")
                .replaceAll("\\R", " ");
    }
}
