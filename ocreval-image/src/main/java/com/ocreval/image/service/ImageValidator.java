package com.ocreval.image.service;

import com.ocreval.common.util.ImageUtils;
import com.ocreval.image.config.ImageProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 图片文件校验：存在性、文件类型、扩展名、大小。
 * <p>
 * 校验不通过时返回问题描述，由调用方记为该图片的识别失败。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageValidator {

    private final ImageProperties properties;

    /**
     * @return 问题描述；图片有效时返回 empty
     */
    public Optional<String> validate(Path imageFile) {
        if (!Files.exists(imageFile)) {
            return problem("image not found: " + imageFile);
        }
        if (!Files.isRegularFile(imageFile)) {
            return problem("not a regular file: " + imageFile);
        }
        String extension = ImageUtils.extension(imageFile);
        if (!properties.getSupportedFormats().contains(extension)) {
            return problem("unsupported image format: " + (extension.isEmpty() ? "<none>" : extension));
        }
        try {
            long size = Files.size(imageFile);
            if (size > properties.getMaxImageBytes()) {
                return problem("image too large: " + size + " bytes");
            }
        } catch (IOException e) {
            return problem("unreadable image: " + e.getMessage());
        }
        return Optional.empty();
    }

    private Optional<String> problem(String detail) {
        log.warn("图片校验未通过: {}", detail);
        return Optional.of(detail);
    }
}
