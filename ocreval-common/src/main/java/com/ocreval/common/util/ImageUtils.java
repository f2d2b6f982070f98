package com.ocreval.common.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Locale;

/**
 * 图片编码与文件名工具类。
 */
public final class ImageUtils {

    private ImageUtils() {
    }

    /**
     * 读取图片文件并转为 Base64 字符串。
     */
    public static String toBase64(Path imageFile) throws IOException {
        return Base64.getEncoder().encodeToString(Files.readAllBytes(imageFile));
    }

    /**
     * 文件扩展名（小写，含点），没有扩展名时返回空串。
     */
    public static String extension(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) return "";
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * 根据文件扩展名推断 MIME 类型。
     */
    public static String getMimeType(Path file) {
        switch (extension(file)) {
            case ".png":
                return "image/png";
            case ".gif":
                return "image/gif";
            case ".bmp":
                return "image/bmp";
            case ".webp":
                return "image/webp";
            case ".tif":
            case ".tiff":
                return "image/tiff";
            default:
                return "image/jpeg";
        }
    }

    /**
     * 取路径最后一段作为文件名，兼容 Windows 风格分隔符。
     */
    public static String baseName(String path) {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }
}
