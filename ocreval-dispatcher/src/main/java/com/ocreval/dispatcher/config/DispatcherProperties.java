package com.ocreval.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 调度中心配置项。
 */
@Data
@ConfigurationProperties(prefix = "ocreval.dispatcher")
public class DispatcherProperties {

    /** 同一引擎同时进行的最大调用数 */
    private int maxConcurrent = 2;

    /** 单次调用的截止时间（秒） */
    private int callTimeoutSeconds = 30;

    /** 是否启用滑动窗口限流（调用远程模型服务时使用） */
    private boolean rateLimitEnabled = false;

    /** 滑动窗口限流的窗口大小（秒） */
    private int rateLimitWindowSeconds = 60;

    /** 窗口内的最大请求数 */
    private int rateLimitMaxRequests = 60;

    /** 达到限流后再次尝试的间隔（毫秒） */
    private long rateLimitPollMillis = 200;

    /** 每完成多少个任务打印一次进度 */
    private int progressLogInterval = 10;

    /** 调度结束后等待被中断调用退出的时间（秒） */
    private int shutdownGraceSeconds = 5;
}
