package com.turnhub.turnservice.domain.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 创建对局的参数。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSettings {

    @NotBlank
    private String name;

    /** 不透明配置（地图、模组、引擎参数） */
    private Map<String, Object> config;

    /** 每回合默认时长（秒），为空则使用全局默认 */
    @Min(1)
    private Long defaultTurnSeconds;

    private boolean chessClockEnabled;

    @Min(0)
    private long chessClockStartingSeconds;

    @Min(0)
    private long chessClockPerTurnSeconds;

    @Min(0)
    private Integer maxExtensionsPerTurn;
}
