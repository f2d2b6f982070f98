package com.ocreval.engine.text;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 大模型响应清理：从带解释的回答中提取产品编号。
 * <p>
 * 步骤：去掉解释性前缀 -> 去掉首尾引号 -> 取第一行 -> 转大写后取最长的编号匹配；
 * 没有匹配时返回清理后的第一行。
 */
public final class ResponseCleaner {

    private static final Pattern CODE_PATTERN = Pattern.compile("[A-Z0-9]+[#.\\-A-Z0-9]*");

    private static final String QUOTE_CHARS = "\"'`";

    private static final List<String> EXPLANATION_PREFIXES = List.of(
            "The text shown in the image is:",
            "The code in the image is:",
            "The text appears to be:",
            "I can see:",
            "The image shows:",
            "The alphanumeric code is:",
            "The product number is:",
            "Looking at this image, I can see:");

    private ResponseCleaner() {
    }

    public static String clean(String response) {
        if (response == null) {
            return "";
        }
        String cleaned = response.strip();
        if (cleaned.isEmpty()) {
            return "";
        }

        for (String prefix : EXPLANATION_PREFIXES) {
            if (cleaned.toLowerCase(Locale.ROOT).startsWith(prefix.toLowerCase(Locale.ROOT))) {
                cleaned = cleaned.substring(prefix.length()).strip();
            }
        }

        cleaned = stripQuotes(cleaned);

        int newline = cleaned.indexOf('\n');
        if (newline >= 0) {
            cleaned = cleaned.substring(0, newline).strip();
        }

        String longest = null;
        Matcher matcher = CODE_PATTERN.matcher(cleaned.toUpperCase(Locale.ROOT));
        while (matcher.find()) {
            if (longest == null || matcher.group().length() > longest.length()) {
                longest = matcher.group();
            }
        }
        return longest != null ? longest : cleaned;
    }

    private static String stripQuotes(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && QUOTE_CHARS.indexOf(text.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && QUOTE_CHARS.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(start, end);
    }
}
