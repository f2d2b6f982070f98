package com.ocreval.image.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 图片校验与 OCR 预处理相关配置。
 */
@Data
@ConfigurationProperties(prefix = "ocreval.image")
public class ImageProperties {

    /** 支持的图片扩展名（小写，含点） */
    private List<String> supportedFormats = new ArrayList<>(
            List.of(".jpg", ".jpeg", ".png", ".bmp", ".tif", ".tiff", ".webp"));

    /** 单张图片最大字节数，超过视为无效图片 */
    private long maxImageBytes = 10L * 1024 * 1024;

    /** 高斯模糊核大小（必须为奇数） */
    private int gaussianKernelSize = 3;

    /** 文字行高度低于此值（像素）时先放大，Tesseract 对过小的字形识别很差 */
    private int minTextHeight = 32;

    /** 是否做 Otsu 二值化 */
    private boolean binarizeEnabled = true;
}
