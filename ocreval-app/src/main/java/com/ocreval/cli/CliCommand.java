package com.ocreval.cli;

import org.springframework.boot.ApplicationArguments;

import java.util.List;

/**
 * 一个命令行子命令。
 */
public interface CliCommand {

    /** 子命令名称，如 evaluate */
    String name();

    /** 用法说明，一行 */
    String usage();

    /**
     * 执行子命令。
     *
     * @param args     完整的命令行参数（用于读取 --name=value 选项）
     * @param operands 子命令名之后的位置参数
     * @return 退出码
     */
    int run(ApplicationArguments args, List<String> operands);
}
