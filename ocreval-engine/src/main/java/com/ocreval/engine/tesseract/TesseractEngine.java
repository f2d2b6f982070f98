package com.ocreval.engine.tesseract;

import com.ocreval.common.exception.RecognitionException;
import com.ocreval.core.engine.AbstractRecognitionEngine;
import com.ocreval.core.engine.EngineOptions;
import com.ocreval.image.service.ImagePreprocessor;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import net.sourceforge.tess4j.util.LoadLibs;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 本地 Tesseract OCR 引擎（Tess4J）。
 * <p>
 * 识别前可选用 OpenCV 预处理（灰度、放大、去噪、二值化）；
 * 多行输出会被合并为以单个空格分隔的一行。
 * <p>
 * Tess4J 的 {@link Tesseract} 每次识别都会重建内部句柄，不能并发使用：
 * 预处理可以并行，识别调用在同一实例上串行执行。
 */
@Slf4j
public class TesseractEngine extends AbstractRecognitionEngine {

    private final ImagePreprocessor preprocessor;
    private ITesseract tesseract;
    private String resolvedDatapath;

    public TesseractEngine(String name, EngineOptions options, ImagePreprocessor preprocessor) {
        this(name, options, preprocessor, null);
    }

    TesseractEngine(String name, EngineOptions options, ImagePreprocessor preprocessor, ITesseract tesseract) {
        super(name, options);
        this.preprocessor = preprocessor;
        this.tesseract = tesseract;
    }

    @Override
    protected void doOpen() {
        if (tesseract == null) {
            tesseract = new Tesseract();
        }
        resolvedDatapath = resolveDatapath(options.getString("datapath", ""));
        tesseract.setDatapath(resolvedDatapath);
        tesseract.setLanguage(options.getString("language", "eng"));
        tesseract.setPageSegMode(options.getInt("page-seg-mode", 7));
        String whitelist = options.getString("whitelist", "");
        if (!whitelist.isBlank()) {
            tesseract.setVariable("tessedit_char_whitelist", whitelist);
        }
        tesseract.setVariable("user_defined_dpi", "300");
        log.info("Tesseract 数据目录: {}, 语言: {}", resolvedDatapath, options.getString("language", "eng"));
    }

    @Override
    protected String doRecognize(Path image) throws Exception {
        BufferedImage bufferedImage = loadImage(image);
        int minConfidence = options.getInt("min-confidence", 0);
        if (minConfidence > 0) {
            List<Word> words;
            synchronized (tesseract) {
                words = tesseract.getWords(bufferedImage, ITessAPI.TessPageIteratorLevel.RIL_WORD);
            }
            return words.stream()
                    .filter(word -> word.getConfidence() >= minConfidence)
                    .map(word -> word.getText().strip())
                    .filter(text -> !text.isEmpty())
                    .collect(Collectors.joining(" "));
        }
        String text;
        synchronized (tesseract) {
            text = tesseract.doOCR(bufferedImage);
        }
        return normalize(text);
    }

    @Override
    protected String engineType() {
        return "本地 OCR";
    }

    @Override
    protected Map<String, Object> technicalDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("language", options.getString("language", "eng"));
        details.put("page_seg_mode", options.getInt("page-seg-mode", 7));
        details.put("whitelist", options.getString("whitelist", ""));
        details.put("preprocess", options.getBoolean("preprocess", true));
        details.put("min_confidence", options.getInt("min-confidence", 0));
        if (resolvedDatapath != null) {
            details.put("datapath", resolvedDatapath);
        }
        return details;
    }

    private BufferedImage loadImage(Path image) throws IOException {
        BufferedImage bufferedImage;
        if (options.getBoolean("preprocess", true)) {
            byte[] png = preprocessor.preprocess(image);
            bufferedImage = ImageIO.read(new ByteArrayInputStream(png));
        } else {
            bufferedImage = ImageIO.read(image.toFile());
        }
        if (bufferedImage == null) {
            throw new RecognitionException("无法解码图片: " + image.getFileName());
        }
        return bufferedImage;
    }

    /**
     * 去掉首尾空白，多行合并为一行。
     */
    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return Arrays.stream(text.split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining(" "));
    }

    private static String resolveDatapath(String configured) {
        String candidate = configured == null ? "" : configured.trim();
        if (!candidate.isEmpty()) {
            try {
                Path path = Path.of(candidate);
                if (Files.isDirectory(path)) {
                    return path.toAbsolutePath().toString();
                }
                log.warn("Tesseract 数据目录 {} 不存在，改用内置 tessdata", path);
            } catch (InvalidPathException e) {
                log.warn("Tesseract 数据目录 {} 无效: {}，改用内置 tessdata", candidate, e.getMessage());
            }
        }
        return LoadLibs.extractTessResources("tessdata").getAbsolutePath();
    }
}
