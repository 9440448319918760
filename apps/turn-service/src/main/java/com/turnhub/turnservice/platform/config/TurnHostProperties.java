package com.turnhub.turnservice.platform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 回合托管相关配置。
 *
 * 所有时长单位在字段名上标明；支持通过 application.yml 或环境变量覆盖。
 */
@Data
@Component
@ConfigurationProperties(prefix = "turnhost")
public class TurnHostProperties {

    private Clock clock = new Clock();
    private Monitor monitor = new Monitor();
    private Advance advance = new Advance();
    private Lock lock = new Lock();
    private Work work = new Work();
    private Process process = new Process();
    private Backup backup = new Backup();
    private Defaults defaults = new Defaults();
    private Store store = new Store();

    @Data
    public static class Clock {
        /** tick 间隔 */
        private long tickMillis = 1000;
        /** 临期提醒阈值（秒），剩余时间跨过该值时提醒一次 */
        private long warningSeconds = 3600;
        private int corePoolSize = 2;
    }

    @Data
    public static class Monitor {
        /** 状态文件轮询间隔 */
        private long pollMillis = 5000;
    }

    @Data
    public static class Advance {
        /** 单次推进信号后等待引擎确认的时长 */
        private long confirmTimeoutMillis = 60_000;
        /** 确认期间轮询状态文件的间隔 */
        private long pollMillis = 1000;
        /** 推进信号最大尝试次数（含首次） */
        private int maxAttempts = 3;
        private long backoffMillis = 2000;
        private double backoffMultiplier = 2.0;
        /** 单次备份的超时 */
        private long backupTimeoutMillis = 120_000;
    }

    @Data
    public static class Lock {
        /** 计时器操作等待会话锁的时长 */
        private long waitMillis = 5000;
        /** 推进入口等待会话锁的时长，超时即视为有推进在进行 */
        private long entryWaitMillis = 250;
        /** post-advance 钩子等待正在进行的推进完成的时长 */
        private long hookWaitMillis = 120_000;
    }

    @Data
    public static class Work {
        private int poolSize = 4;
        private int queueCapacity = 256;
    }

    @Data
    public static class Process {
        /** 引擎存档根目录，对局目录为 dataRoot/savedgames/<name> */
        private String dataRoot = "./data";
        /**
         * 启动命令，支持占位符 {name}、{sessionId}、{workDir} 以及对局配置中的任意 key
         */
        private List<String> command = new ArrayList<>();
        /** 引擎读取的命令文件 */
        private String commandFile = "domcmd";
        /** 推进信号：写入命令文件的内容 */
        private String advanceCommand = "settimeleft 5";
        private String statusFile = "statusdump.txt";
        private String errorLog = "dominions_error.log";
        /** 停止进程时等待其退出的时长 */
        private long stopTimeoutMillis = 10_000;
    }

    @Data
    public static class Backup {
        private String root = "./backups";
        /** 不参与备份/恢复的文件后缀（地图等静态资源） */
        private List<String> excludedExtensions = new ArrayList<>(List.of(".d6m", ".map"));
    }

    @Data
    public static class Defaults {
        private long turnSeconds = 3600;
    }

    @Data
    public static class Store {
        /** redis | memory */
        private String type = "redis";
    }
}
