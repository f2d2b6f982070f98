package com.ocreval.image.service;

import com.ocreval.image.config.ImageProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ImageValidatorTest {

    @TempDir
    Path tempDir;

    private ImageProperties properties;
    private ImageValidator validator;

    @BeforeEach
    void setUp() {
        properties = new ImageProperties();
        validator = new ImageValidator(properties);
    }

    @Test
    void acceptsSupportedImage() throws Exception {
        Path image = Files.write(tempDir.resolve("P4P601#03.jpg"), new byte[]{1, 2, 3});

        assertThat(validator.validate(image)).isEmpty();
    }

    @Test
    void reportsMissingFile() {
        assertThat(validator.validate(tempDir.resolve("missing.png")))
                .hasValueSatisfying(detail -> assertThat(detail).startsWith("image not found"));
    }

    @Test
    void rejectsDirectories() throws Exception {
        Path dir = Files.createDirectory(tempDir.resolve("folder.png"));

        assertThat(validator.validate(dir))
                .hasValueSatisfying(detail -> assertThat(detail).startsWith("not a regular file"));
    }

    @Test
    void rejectsUnsupportedExtension() throws Exception {
        Path gif = Files.write(tempDir.resolve("anim.gif"), new byte[]{1});

        assertThat(validator.validate(gif)).contains("unsupported image format: .gif");
    }

    @Test
    void rejectsOversizedImage() throws Exception {
        properties.setMaxImageBytes(2);
        Path image = Files.write(tempDir.resolve("big.png"), new byte[]{1, 2, 3});

        assertThat(validator.validate(image)).contains("image too large: 3 bytes");
    }
}
