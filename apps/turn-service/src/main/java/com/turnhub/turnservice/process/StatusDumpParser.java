package com.turnhub.turnservice.process;

import com.turnhub.turnservice.domain.model.GameStatus;
import com.turnhub.turnservice.domain.model.NationStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 引擎状态文件解析。
 *
 * <pre>
 * turn 3, era 1, mods 0, turnlimit 0
 * Nation	5	0	1	0	2	early_arcoscephale	Arcoscephale	Golden Era
 * </pre>
 * Nation 行以 TAB 分隔：[1] 国家编号 [3] 控制方 [5] 回合状态 [7] 国家名。
 * 没有 turn 行表示仍在大厅（turn = -1）。
 */
@Slf4j
public final class StatusDumpParser {

    private StatusDumpParser() {}

    public static GameStatus parse(List<String> lines) {
        int turn = -1;
        boolean turnSeen = false;
        List<NationStatus> nations = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (!turnSeen && line.startsWith("turn ")) {
                String head = line.split(",")[0].substring("turn ".length()).strip();
                try {
                    turn = Integer.parseInt(head);
                    turnSeen = true;
                } catch (NumberFormatException e) {
                    log.warn("状态文件 turn 行无法解析: {}", line);
                }
            } else if (line.startsWith("Nation")) {
                NationStatus n = parseNation(raw);
                if (n != null) nations.add(n);
            }
        }
        return GameStatus.builder().turn(turn).nations(nations).build();
    }

    private static NationStatus parseNation(String raw) {
        String[] cols = raw.strip().split("\t");
        if (cols.length < 7) {
            log.warn("状态文件 Nation 行列数不足: {}", raw);
            return null;
        }
        try {
            String name = cols.length > 7 ? cols[7].strip() : cols[6].strip();
            return NationStatus.builder()
                    .nationId(Integer.parseInt(cols[1].strip()))
                    .playerStatus(Integer.parseInt(cols[3].strip()))
                    .turnStatus(Integer.parseInt(cols[5].strip()))
                    .name(name)
                    .build();
        } catch (NumberFormatException e) {
            log.warn("状态文件 Nation 行无法解析: {}", raw);
            return null;
        }
    }
}
