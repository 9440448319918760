package com.turnhub.turnservice.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 引擎状态文件的解析结果。turn=-1 表示仍在大厅。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameStatus {

    private int turn;

    private List<NationStatus> nations;

    @JsonIgnore
    public List<String> outstandingPlayers() {
        if (nations == null) return List.of();
        return nations.stream()
                .filter(NationStatus::isOutstanding)
                .map(NationStatus::getName)
                .toList();
    }
}
