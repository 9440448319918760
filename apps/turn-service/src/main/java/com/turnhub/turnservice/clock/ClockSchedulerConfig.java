package com.turnhub.turnservice.clock;

import com.turnhub.turnservice.platform.config.TurnHostProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 定时线程池配置类，用于统一创建回合计时与轮询用的 ScheduledThreadPoolExecutor。
 *
 * 功能说明：
 * 1. 核心线程数取自 turnhost.clock.core-pool-size；
 * 2. 线程命名为 turn-clock-N，便于调试；
 * 3. 守护线程，JVM 退出时自动结束；
 * 4. DiscardPolicy 拒绝策略；
 * 5. setRemoveOnCancelPolicy(true)，清理已取消任务。
 */
@Configuration
public class ClockSchedulerConfig {

    @Bean(name = "turnClockScheduler")
    public ScheduledThreadPoolExecutor turnClockScheduler(TurnHostProperties props) {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "turn-clock-" + seq.getAndIncrement());
                // 非业务线程，允许JVM优雅退出时不用等它
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                props.getClock().getCorePoolSize(), tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * 统一时间源，测试中可替换为可控时钟。
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
