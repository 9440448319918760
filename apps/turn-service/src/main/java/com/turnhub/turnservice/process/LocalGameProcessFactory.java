package com.turnhub.turnservice.process;

import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.platform.config.TurnHostProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 本机进程工厂：按配置的命令模板为对局生成 LocalGameProcessHandle。
 */
@Component
@RequiredArgsConstructor
public class LocalGameProcessFactory implements GameProcessFactory {

    private final TurnHostProperties props;

    @Override
    public GameProcessHandle create(GameSession session) {
        TurnHostProperties.Process cfg = props.getProcess();
        List<String> command = expand(cfg.getCommand(), session);
        return new LocalGameProcessHandle(session.getId(), Paths.get(session.getWorkDir()), command, cfg);
    }

    /**
     * 展开占位符 {name} {sessionId} {workDir} 以及对局配置中的任意 key。不用 ${} 形式，避免被 Spring 提前解析。
     */
    static List<String> expand(List<String> template, GameSession session) {
        Map<String, String> vars = new HashMap<>();
        if (session.getConfig() != null) {
            session.getConfig().forEach((k, v) -> vars.put(k, String.valueOf(v)));
        }
        vars.put("name", session.getName());
        vars.put("sessionId", session.getId());
        vars.put("workDir", session.getWorkDir());
        return template.stream().map(arg -> {
            String out = arg;
            for (Map.Entry<String, String> e : vars.entrySet()) {
                out = out.replace("{" + e.getKey() + "}", e.getValue());
            }
            return out;
        }).toList();
    }
}
