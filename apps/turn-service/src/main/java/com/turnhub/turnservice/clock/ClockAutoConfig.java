package com.turnhub.turnservice.clock;

import com.turnhub.turnservice.clock.scheduler.CountdownScheduler;
import com.turnhub.turnservice.clock.scheduler.CountdownSchedulerImpl;
import com.turnhub.turnservice.domain.repository.TimerRepository;
import com.turnhub.turnservice.platform.config.TurnHostProperties;
import com.turnhub.turnservice.session.SessionLockRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 倒计时相关 Bean 的装配：把调度线程池、工作线程池、计时仓储与会话锁注入到通用调度引擎中。
 *
 * 说明：
 *  - 调度线程池由 {@link ClockSchedulerConfig} 提供；
 *  - 工作线程池由 WorkExecutorConfig 提供，到期/提醒回调都在工作线程上执行，不占用 tick 线程。
 */
@Configuration
public class ClockAutoConfig {

    @Bean
    public CountdownScheduler countdownScheduler(TimerRepository timerRepository,
                                                 SessionLockRegistry locks,
                                                 @Qualifier("turnClockScheduler") ScheduledThreadPoolExecutor turnClockScheduler,
                                                 @Qualifier("turnWorkExecutor") ExecutorService turnWorkExecutor,
                                                 Clock clock,
                                                 TurnHostProperties props) {
        return new CountdownSchedulerImpl(timerRepository, locks, turnClockScheduler, turnWorkExecutor, clock,
                props.getClock().getTickMillis(), props.getClock().getWarningSeconds());
    }
}
