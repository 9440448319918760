package com.turnhub.turnservice.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "turnhub:";

    private RedisKeys() {}

    // ---- 对局 ----
    public static String session(String sessionId) {
        return PFX + "session:" + sessionId;
    }

    /** 对局ID索引（SET） */
    public static String sessionIndex() {
        return PFX + "sessions";
    }

    // ---- 计时器 ----
    public static String timer(String sessionId) {
        return PFX + "session:" + sessionId + ":timer";
    }

    /** 有计时器的对局ID索引（SET） */
    public static String timerIndex() {
        return PFX + "timers";
    }

    // ---- 玩家时间银行（Hash：playerId -> PlayerTimeBank） ----
    public static String timeBanks(String sessionId) {
        return PFX + "session:" + sessionId + ":banks";
    }

    // ---- 回合记录（Hash：turnNumber -> TurnRecord） ----
    public static String turns(String sessionId) {
        return PFX + "session:" + sessionId + ":turns";
    }

    // ---- 备份快照索引（Hash："{turn}:{phase}" -> BackupSnapshot） ----
    public static String snapshots(String sessionId) {
        return PFX + "session:" + sessionId + ":snapshots";
    }

    public static String snapshotField(int turnNumber, String phase) {
        return turnNumber + ":" + phase;
    }
}
