package com.turnhub.turnservice.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 状态文件里的一行国家状态。
 * playerStatus：1=人类，2=AI，-1=此前已被淘汰，-2=本回合被淘汰；
 * turnStatus：0=未动，1=已动未完成，2=已提交。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NationStatus {

    private int nationId;

    private int playerStatus;

    private int turnStatus;

    private String name;

    /** 未提交回合的人类玩家（AI 与已淘汰国家永远不算） */
    @JsonIgnore
    public boolean isOutstanding() {
        boolean human = playerStatus == 1 || playerStatus == -2;
        return human && (turnStatus == 0 || turnStatus == 1);
    }
}
