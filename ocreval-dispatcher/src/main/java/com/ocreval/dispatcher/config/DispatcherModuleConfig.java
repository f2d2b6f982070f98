package com.ocreval.dispatcher.config;

import com.ocreval.dispatcher.ratelimit.InMemoryRateLimiter;
import com.ocreval.dispatcher.ratelimit.NoOpRateLimiter;
import com.ocreval.dispatcher.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 调度模块自动配置。
 * <p>
 * 通过 {@code ocreval.dispatcher.rate-limit-enabled} 切换限流实现：
 * <ul>
 *   <li>{@code false}（默认）：不限流，本地模型只受并发数约束</li>
 *   <li>{@code true}：内存滑动窗口限流，适合有 QPS 限制的远程模型服务</li>
 * </ul>
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.ocreval.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    @Bean
    @ConditionalOnProperty(name = "ocreval.dispatcher.rate-limit-enabled", havingValue = "true")
    public RateLimiter inMemoryRateLimiter(DispatcherProperties properties) {
        log.info("启用内存限流器: {} 次 / {} 秒",
                properties.getRateLimitMaxRequests(), properties.getRateLimitWindowSeconds());
        return new InMemoryRateLimiter(properties);
    }

    @Bean
    @ConditionalOnProperty(name = "ocreval.dispatcher.rate-limit-enabled", havingValue = "false", matchIfMissing = true)
    public RateLimiter noOpRateLimiter() {
        return new NoOpRateLimiter();
    }
}
