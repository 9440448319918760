package com.turnhub.turnservice.infrastructure.scheduler;

import com.turnhub.turnservice.platform.config.TurnHostProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 回合推进用的两个线程池，与计时调度线程分开，避免推进/备份阻塞 tick：
 * - turnWorkExecutor：执行到期、回合完成、进程退出等事件的编排流程；
 * - turnIoExecutor：执行备份拷贝与进程信号，编排线程在其上做带超时的等待。
 */
@Configuration
public class WorkExecutorConfig {

    @Bean(name = "turnWorkExecutor", destroyMethod = "shutdown")
    public ExecutorService turnWorkExecutor(TurnHostProperties props) {
        int poolSize = Math.max(2, props.getWork().getPoolSize());
        return new ThreadPoolExecutor(poolSize, poolSize, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(props.getWork().getQueueCapacity()),
                named("turn-work-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "turnIoExecutor", destroyMethod = "shutdown")
    public ExecutorService turnIoExecutor(TurnHostProperties props) {
        int poolSize = Math.max(2, props.getWork().getPoolSize());
        return new ThreadPoolExecutor(poolSize, poolSize, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(props.getWork().getQueueCapacity()),
                named("turn-io-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadFactory named(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + idx.getAndIncrement());
                // 设置为守护线程
                t.setDaemon(true);
                return t;
            }
        };
    }
}
