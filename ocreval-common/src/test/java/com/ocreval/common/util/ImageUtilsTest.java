package com.ocreval.common.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ImageUtilsTest {

    @Test
    void resolvesMimeTypeFromExtension() {
        assertThat(ImageUtils.getMimeType(Path.of("x/Img.PNG"))).isEqualTo("image/png");
        assertThat(ImageUtils.getMimeType(Path.of("x/img.tiff"))).isEqualTo("image/tiff");
        assertThat(ImageUtils.getMimeType(Path.of("x/img"))).isEqualTo("image/jpeg");
    }

    @Test
    void extensionIsLowerCasedWithDot() {
        assertThat(ImageUtils.extension(Path.of("a/b.JPeG"))).isEqualTo(".jpeg");
        assertThat(ImageUtils.extension(Path.of("noext"))).isEmpty();
    }

    @Test
    void baseNameHandlesBothSeparators() {
        assertThat(ImageUtils.baseName("crop_img/P4P601#03.jpg")).isEqualTo("P4P601#03.jpg");
        assertThat(ImageUtils.baseName("dir\\sub\\x.png")).isEqualTo("x.png");
        assertThat(ImageUtils.baseName("plain.png")).isEqualTo("plain.png");
    }
}
