package com.ocreval.image.service;

import com.ocreval.common.exception.ImageProcessingException;
import com.ocreval.image.config.ImageProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * OCR 前的图像预处理：灰度化、小图放大、去噪、二值化。
 * <p>
 * 数据集图片多为单行产品编号的小截图，整页场景的透视矫正、网格去除在这里不需要。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImagePreprocessor {

    private final ImageProperties properties;

    /**
     * 从文件读取图片为 OpenCV Mat。
     */
    public Mat readImage(Path imageFile) {
        try {
            byte[] bytes = Files.readAllBytes(imageFile);
            Mat raw = opencv_imgcodecs.imdecode(new Mat(bytes), opencv_imgcodecs.IMREAD_COLOR);
            if (raw.empty()) {
                throw new ImageProcessingException("无法解码图片: " + imageFile);
            }
            log.debug("图片读取成功: {} ({}x{})", imageFile.getFileName(), raw.cols(), raw.rows());
            return raw;
        } catch (IOException e) {
            throw new ImageProcessingException("读取图片失败: " + imageFile, e);
        }
    }

    /**
     * 灰度化处理。
     */
    public Mat toGrayscale(Mat src) {
        if (src.channels() == 1) {
            return src;
        }
        Mat gray = new Mat();
        cvtColor(src, gray, COLOR_BGR2GRAY);
        return gray;
    }

    /**
     * 高度不足 minTextHeight 时按比例放大。
     */
    public Mat upscaleIfSmall(Mat gray) {
        int minHeight = properties.getMinTextHeight();
        if (minHeight <= 0 || gray.rows() >= minHeight) {
            return gray;
        }
        double scale = (double) minHeight / gray.rows();
        Mat resized = new Mat();
        resize(gray, resized, new Size((int) Math.round(gray.cols() * scale), minHeight), 0, 0, INTER_CUBIC);
        log.debug("小图放大 {}x{} -> {}x{}", gray.cols(), gray.rows(), resized.cols(), resized.rows());
        return resized;
    }

    /**
     * 高斯模糊去噪。
     */
    public Mat denoise(Mat gray) {
        int kSize = properties.getGaussianKernelSize();
        if (kSize <= 1) {
            return gray;
        }
        Mat blurred = new Mat();
        GaussianBlur(gray, blurred, new Size(kSize, kSize), 0);
        return blurred;
    }

    /**
     * Otsu 全局阈值二值化，保持深色文字、浅色背景。
     */
    public Mat binarize(Mat gray) {
        if (!properties.isBinarizeEnabled()) {
            return gray;
        }
        Mat binary = new Mat();
        threshold(gray, binary, 0, 255, THRESH_BINARY | THRESH_OTSU);
        return binary;
    }

    /**
     * 完整的预处理流水线：读取 -> 灰度 -> 放大 -> 去噪 -> 二值化，输出 PNG 字节。
     */
    public byte[] preprocess(Path imageFile) {
        Mat gray = toGrayscale(readImage(imageFile));
        Mat prepared = binarize(denoise(upscaleIfSmall(gray)));
        return matToBytes(prepared);
    }

    /**
     * Mat 转字节数组（PNG 格式）。
     */
    public byte[] matToBytes(Mat mat) {
        BytePointer buf = new BytePointer();
        try {
            boolean ok = opencv_imgcodecs.imencode(".png", mat, buf);
            if (!ok || buf.limit() == 0) {
                throw new ImageProcessingException("图片编码为 PNG 失败");
            }
            byte[] result = new byte[(int) buf.limit()];
            buf.get(result);
            return result;
        } finally {
            buf.deallocate();
        }
    }
}
