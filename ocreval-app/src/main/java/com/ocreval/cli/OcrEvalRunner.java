package com.ocreval.cli;

import com.ocreval.common.exception.ConfigurationException;
import com.ocreval.common.exception.ErrorCode;
import com.ocreval.common.exception.OcrEvalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 命令行入口：分发子命令，并把异常映射为退出码。
 * <p>
 * 单张图片的识别失败不影响退出码，只有结构性错误（配置、引擎初始化、数据集、报告）才以非 0 退出。
 */
@Slf4j
@Component
public class OcrEvalRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String APP_LOGGER = "com.ocreval";

    private final List<CliCommand> commands;
    private final LoggingSystem loggingSystem;

    private int exitCode;

    public OcrEvalRunner(List<CliCommand> commands, LoggingSystem loggingSystem) {
        this.commands = commands;
        this.loggingSystem = loggingSystem;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        try {
            applyLogLevel(args);
            List<String> operands = args.getNonOptionArgs();
            if (args.containsOption("help")) {
                printUsage();
                return 0;
            }
            if (operands.isEmpty()) {
                log.error("缺少命令");
                printUsage();
                return ErrorCode.CONFIG_ERROR.getExitCode();
            }
            Optional<CliCommand> command = find(operands.get(0));
            if (command.isEmpty()) {
                log.error("未知命令: {}", operands.get(0));
                printUsage();
                return ErrorCode.CONFIG_ERROR.getExitCode();
            }
            return command.get().run(args, operands.subList(1, operands.size()));
        } catch (OcrEvalException e) {
            log.error("[{}] {}", e.getErrorCode(), e.getMessage());
            log.debug("异常详情", e);
            return e.getExitCode();
        } catch (IllegalArgumentException e) {
            log.error("参数错误: {}", e.getMessage());
            return ErrorCode.CONFIG_ERROR.getExitCode();
        } catch (RuntimeException e) {
            log.error("发生未预期的错误", e);
            return ErrorCode.UNKNOWN_ERROR.getExitCode();
        }
    }

    private void applyLogLevel(ApplicationArguments args) {
        String level = CliOptions.value(args, "log-level", null);
        if (level != null) {
            LogLevel logLevel;
            try {
                logLevel = LogLevel.valueOf(level.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("无效的日志级别: " + level);
            }
            loggingSystem.setLogLevel(APP_LOGGER, logLevel);
        }
        if (args.containsOption("verbose")) {
            loggingSystem.setLogLevel(APP_LOGGER, LogLevel.DEBUG);
        }
    }

    private Optional<CliCommand> find(String name) {
        return commands.stream().filter(c -> c.name().equalsIgnoreCase(name)).findFirst();
    }

    private void printUsage() {
        log.info("用法: ocr-eval <命令> [参数] [--config=配置文件] [--verbose] [--log-level=LEVEL]");
        commands.forEach(c -> log.info("  {}", c.usage()));
    }
}
