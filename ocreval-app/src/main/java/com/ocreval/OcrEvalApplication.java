package com.ocreval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

/**
 * OCR 评估框架 - 命令行启动类。
 */
@SpringBootApplication(scanBasePackages = "com.ocreval")
public class OcrEvalApplication {

    static final String CONFIG_OPTION = "--config=";

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(OcrEvalApplication.class, withConfigLocation(args))));
    }

    /**
     * {@code --config=foo.yaml} 转为 Spring Boot 的附加配置位置，命令行其余参数原样保留。
     */
    static String[] withConfigLocation(String[] args) {
        return Arrays.stream(args)
                .map(arg -> arg.startsWith(CONFIG_OPTION)
                        ? "--spring.config.additional-location=file:" + arg.substring(CONFIG_OPTION.length())
                        : arg)
                .toArray(String[]::new);
    }
}
