package com.ocreval.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.ocreval.common.exception.ConfigurationException;
import com.ocreval.core.config.EvaluationProperties;
import com.ocreval.core.engine.RecognitionEngineFactory;
import com.ocreval.dispatcher.config.DispatcherProperties;
import com.ocreval.image.config.ImageProperties;
import com.ocreval.report.config.ReportProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@code config show [--key=a.b.c]} 与 {@code config generate [--output=config.yaml]}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigCommand implements CliCommand {

    private static final String MASK = "******";

    private static final TypeReference<Map<String, Object>> TREE_TYPE = new TypeReference<>() {
    };

    private final EvaluationProperties evaluationProperties;
    private final DispatcherProperties dispatcherProperties;
    private final ImageProperties imageProperties;
    private final ReportProperties reportProperties;
    private final RecognitionEngineFactory engineFactory;

    private final ObjectMapper kebabMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE);

    @Override
    public String name() {
        return "config";
    }

    @Override
    public String usage() {
        return "config show [--key=ocreval.engines.tesseract.language] | config generate [--output=config.yaml]";
    }

    @Override
    public int run(ApplicationArguments args, List<String> operands) {
        String action = operands.isEmpty() ? "show" : operands.get(0);
        switch (action) {
            case "show" -> System.out.print(show(CliOptions.value(args, "key", null)));
            case "generate" -> generate(Path.of(CliOptions.value(args, "output", "config.yaml")));
            default -> throw new ConfigurationException("未知的配置操作: " + action + "（可选 show / generate）");
        }
        return 0;
    }

    /**
     * 当前生效配置的 YAML 文本，给出 key 时只输出该节点。
     */
    String show(String key) {
        Map<String, Object> tree = configurationTree(evaluationProperties, dispatcherProperties,
                imageProperties, reportProperties, name -> engineFactory.effectiveOptions(name).asMap());
        if (key == null) {
            return toYaml(tree);
        }
        Object node = tree;
        for (String part : key.split("\\.")) {
            if (!(node instanceof Map<?, ?> map) || !map.containsKey(part)) {
                throw new ConfigurationException("配置项不存在: " + key);
            }
            node = map.get(part);
        }
        Map<String, Object> single = new LinkedHashMap<>();
        single.put(key, node);
        return toYaml(single);
    }

    /**
     * 以默认值写出一份完整配置文件。
     */
    Path generate(Path output) {
        Map<String, Object> tree = configurationTree(new EvaluationProperties(), new DispatcherProperties(),
                new ImageProperties(), new ReportProperties(),
                name -> engineFactory.findProvider(name).defaultOptions());
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(output)) {
                log.warn("覆盖已有配置文件: {}", output);
            }
            Files.writeString(output, toYaml(tree), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("写入配置文件失败: " + output, e);
        }
        log.info("默认配置已写入: {}", output);
        return output;
    }

    private Map<String, Object> configurationTree(EvaluationProperties evaluation, DispatcherProperties dispatcher,
                                                  ImageProperties image, ReportProperties report,
                                                  Function<String, Map<String, Object>> engineOptions) {
        Map<String, Object> engines = new LinkedHashMap<>();
        for (String engine : engineFactory.availableEngines()) {
            Map<String, Object> options = new LinkedHashMap<>(engineOptions.apply(engine));
            options.replaceAll((key, value) -> isSecret(key, value) ? MASK : value);
            engines.put(engine, options);
        }
        Map<String, Object> ocreval = new LinkedHashMap<>();
        ocreval.put("evaluation", toTree(evaluation));
        ocreval.put("engines", engines);
        ocreval.put("dispatcher", toTree(dispatcher));
        ocreval.put("image", toTree(image));
        ocreval.put("report", toTree(report));

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("ocreval", ocreval);
        return root;
    }

    private static boolean isSecret(String key, Object value) {
        return key.endsWith("api-key") && value instanceof String text && !text.isBlank();
    }

    private Map<String, Object> toTree(Object properties) {
        return kebabMapper.convertValue(properties, TREE_TYPE);
    }

    private static String toYaml(Map<String, Object> tree) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setPrettyFlow(true);
        return new Yaml(options).dump(tree);
    }
}
