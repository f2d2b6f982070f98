package com.ocreval.dispatcher.service;

import com.ocreval.common.exception.CallTimeoutException;
import com.ocreval.dispatcher.config.DispatcherProperties;
import com.ocreval.dispatcher.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 并发调度服务：固定大小的工作池 + 单次调用截止时间。
 * <p>
 * 核心策略：
 * - 每次调度新建 W 个守护线程，同一时刻最多 W 个调用在执行
 * - 调用开始时登记截止时间，超时后由看门狗中断该调用，结果立即按 fallback 处理
 * - 被中断的调用真正返回之前，它占用的线程不会接新任务；宽限期后仍未返回则补一个工作线程，
 *   排队中的任务不会被卡死的调用拖住
 * - 单个任务失败不影响其他任务，不做自动重试
 * - 带进度日志，方便跟踪长任务
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatcherService {

    private final RateLimiter rateLimiter;
    private final DispatcherProperties properties;

    /**
     * 并发执行一批任务，全部结束（完成、失败或超时）后按输入顺序返回结果。
     *
     * @param label    调度名称，用于线程名、限流维度与日志
     * @param items    待处理的数据列表
     * @param task     实际的任务逻辑
     * @param fallback 任务抛出异常或超时时的结果，超时时异常为 {@link CallTimeoutException}
     * @param <T>      输入类型
     * @param <R>      输出类型
     * @return 结果列表（与输入顺序一致）
     */
    public <T, R> List<R> dispatchAll(String label, List<T> items,
                                      Function<T, R> task, BiFunction<T, Throwable, R> fallback) {
        int totalTasks = items.size();
        if (totalTasks == 0) {
            return new ArrayList<>();
        }
        int concurrency = Math.max(1, Math.min(properties.getMaxConcurrent(), totalTasks));
        Duration timeout = Duration.ofSeconds(properties.getCallTimeoutSeconds());

        log.info("[{}] 开始调度 {} 个任务, 并发度: {}, 单次超时: {}s",
                label, totalTasks, concurrency, timeout.getSeconds());

        ThreadPoolExecutor workers = new ThreadPoolExecutor(concurrency, concurrency, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), daemonThreads("ocreval-" + label + "-"));
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(
                daemonThreads("ocreval-" + label + "-watchdog-"));
        Progress progress = new Progress(label, totalTasks);

        try {
            List<DeadlineCall<T, R>> calls = new ArrayList<>(totalTasks);
            for (T item : items) {
                DeadlineCall<T, R> call = new DeadlineCall<>(item, task, label, timeout, watchdog, workers, progress);
                calls.add(call);
                workers.execute(call);
            }

            List<R> results = new ArrayList<>(totalTasks);
            for (DeadlineCall<T, R> call : calls) {
                results.add(collect(call, fallback, timeout));
            }

            log.info("[{}] 调度完成, 成功: {}/{}, 超时: {}",
                    label, progress.succeeded.get(), totalTasks, progress.timedOut.get());
            return results;
        } finally {
            watchdog.shutdownNow();
            workers.shutdownNow();
            awaitWorkers(label, workers);
        }
    }

    private <T, R> R collect(DeadlineCall<T, R> call, BiFunction<T, Throwable, R> fallback, Duration timeout) {
        try {
            return call.get();
        } catch (CancellationException e) {
            if (call.timedOut) {
                return fallback.apply(call.item,
                        new CallTimeoutException("调用超过 " + timeout.getSeconds() + " 秒未返回", timeout));
            }
            return fallback.apply(call.item, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("任务失败: {}", cause.getMessage());
            return fallback.apply(call.item, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return fallback.apply(call.item, e);
        }
    }

    private void awaitWorkers(String label, ExecutorService workers) {
        try {
            if (!workers.awaitTermination(properties.getShutdownGraceSeconds(), TimeUnit.SECONDS)) {
                log.warn("[{}] 仍有被中断的调用未退出，放弃等待", label);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 补充一个工作线程，顶替被卡死调用占住的线程。只在看门狗线程中调用。
     */
    private static void replaceStuckWorker(String label, ThreadPoolExecutor workers) {
        if (workers.isShutdown()) {
            return;
        }
        int size = workers.getCorePoolSize() + 1;
        workers.setMaximumPoolSize(size);
        workers.setCorePoolSize(size);
        log.warn("[{}] 超时调用在宽限期内未退出，已补充工作线程 (当前 {})", label, size);
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    /**
     * 等待限流许可。
     */
    private void acquirePermit(String slot) throws InterruptedException {
        while (!rateLimiter.tryAcquire(slot)) {
            log.debug("[{}] 已达限流，等待后重试", slot);
            Thread.sleep(properties.getRateLimitPollMillis());
        }
    }

    /**
     * 进度计数。
     */
    private final class Progress {
        private final String label;
        private final int total;
        private final AtomicInteger completed = new AtomicInteger(0);
        private final AtomicInteger succeeded = new AtomicInteger(0);
        private final AtomicInteger timedOut = new AtomicInteger(0);

        private Progress(String label, int total) {
            this.label = label;
            this.total = total;
        }

        private void record(boolean success, boolean expired) {
            if (success) {
                succeeded.incrementAndGet();
            }
            if (expired) {
                timedOut.incrementAndGet();
            }
            int done = completed.incrementAndGet();
            int interval = Math.max(1, properties.getProgressLogInterval());
            if (done % interval == 0 || done == total) {
                log.info("[{}] 进度: {}/{} (成功 {}, 超时 {})",
                        label, done, total, succeeded.get(), timedOut.get());
            }
        }
    }

    /**
     * 带截止时间的调用：开始执行时登记看门狗，到期未完成则中断。
     */
    private final class DeadlineCall<T, R> extends FutureTask<R> {
        private final T item;
        private final String label;
        private final Duration timeout;
        private final ScheduledExecutorService watchdog;
        private final ThreadPoolExecutor workers;
        private final Progress progress;
        private volatile boolean timedOut;
        private volatile boolean returned;

        private DeadlineCall(T item, Function<T, R> task, String label, Duration timeout,
                             ScheduledExecutorService watchdog, ThreadPoolExecutor workers, Progress progress) {
            super(() -> task.apply(item));
            this.item = item;
            this.label = label;
            this.timeout = timeout;
            this.watchdog = watchdog;
            this.workers = workers;
            this.progress = progress;
        }

        @Override
        public void run() {
            if (isDone()) {
                return;
            }
            try {
                acquirePermit(label);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                setException(e);
                return;
            }
            ScheduledFuture<?> deadline = watchdog.schedule(this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                super.run();
            } finally {
                returned = true;
                deadline.cancel(false);
            }
        }

        private void expire() {
            if (isDone()) {
                return;
            }
            timedOut = true;
            if (cancel(true)) {
                log.warn("[{}] 调用超时 ({}s)，已中断: {}", label, timeout.getSeconds(), item);
                watchdog.schedule(this::abandonIfStuck, properties.getShutdownGraceSeconds(), TimeUnit.SECONDS);
            }
        }

        private void abandonIfStuck() {
            if (!returned) {
                replaceStuckWorker(label, workers);
            }
        }

        @Override
        protected void done() {
            progress.record(!isCancelled() && succeededNormally(), isCancelled() && timedOut);
        }

        private boolean succeededNormally() {
            try {
                get(0, TimeUnit.MILLISECONDS);
                return true;
            } catch (Exception e) {
                return false;
            }
        }
    }
}
