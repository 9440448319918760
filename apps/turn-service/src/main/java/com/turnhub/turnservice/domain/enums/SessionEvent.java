package com.turnhub.turnservice.domain.enums;

public enum SessionEvent {

    LAUNCH,         // 启动游戏进程
    START_PLAY,     // 首次回合推进被接受
    END_GAME,       // 结束对局（需已开始）
    DELETE_LOBBY,   // 删除（需已结束）
    RESET_STARTED   // 特权：清除 started，仅用于运维救援卡死的对局
}
