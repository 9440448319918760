package com.turnhub.turnservice.process;

import com.turnhub.turnservice.domain.model.GameStatus;
import com.turnhub.turnservice.platform.config.TurnHostProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 本机引擎进程。
 * - 推进信号：向工作目录写入命令文件（默认 domcmd，内容 settimeleft 5），引擎下次轮询时读取；
 * - 状态探测：解析引擎写出的状态文件；
 * - stderr 追加到工作目录下的错误日志，崩溃时从中提取摘要。
 */
@Slf4j
public class LocalGameProcessHandle implements GameProcessHandle {

    private final String sessionId;
    private final Path workDir;
    private final List<String> command;
    private final TurnHostProperties.Process cfg;

    private volatile Process process;

    public LocalGameProcessHandle(String sessionId, Path workDir, List<String> command, TurnHostProperties.Process cfg) {
        this.sessionId = sessionId;
        this.workDir = workDir;
        this.command = List.copyOf(command);
        this.cfg = cfg;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public synchronized void start() throws IOException {
        if (isAlive()) return;
        if (command.isEmpty()) {
            throw new IOException("未配置引擎启动命令 turnhost.process.command");
        }
        Files.createDirectories(workDir);
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.appendTo(workDir.resolve(cfg.getErrorLog()).toFile()));
        process = pb.start();
        log.info("引擎进程已启动: sessionId={}, pid={}, cmd={}", sessionId, process.pid(), command.get(0));
    }

    @Override
    public synchronized void stop() {
        Process p = process;
        if (p == null || !p.isAlive()) return;
        p.destroy();
        try {
            if (!p.waitFor(cfg.getStopTimeoutMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("引擎进程未在限期内退出，强制结束: sessionId={}, pid={}", sessionId, p.pid());
                p.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
        }
        log.info("引擎进程已停止: sessionId={}", sessionId);
    }

    @Override
    public boolean isAlive() {
        Process p = process;
        return p != null && p.isAlive();
    }

    @Override
    public void signalAdvance() throws IOException {
        // 上一回合的状态截图会干扰引擎写出新的状态产物
        try (DirectoryStream<Path> pngs = Files.newDirectoryStream(workDir, "*.png")) {
            for (Path png : pngs) {
                Files.deleteIfExists(png);
            }
        }
        Files.writeString(workDir.resolve(cfg.getCommandFile()), cfg.getAdvanceCommand(), StandardCharsets.UTF_8);
        log.info("已写入推进命令: sessionId={}, file={}", sessionId, cfg.getCommandFile());
    }

    @Override
    public Optional<GameStatus> probeStatus() throws IOException {
        Path status = workDir.resolve(cfg.getStatusFile());
        if (!Files.exists(status)) {
            return Optional.empty();
        }
        return Optional.of(StatusDumpParser.parse(Files.readAllLines(status, StandardCharsets.UTF_8)));
    }

    @Override
    public String readErrorSummary() {
        return ErrorLogReader.summarize(workDir.resolve(cfg.getErrorLog()));
    }
}
