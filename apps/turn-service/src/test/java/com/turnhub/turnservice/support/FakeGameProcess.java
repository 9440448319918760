package com.turnhub.turnservice.support;

import com.turnhub.turnservice.domain.model.GameStatus;
import com.turnhub.turnservice.domain.model.NationStatus;
import com.turnhub.turnservice.process.GameProcessHandle;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存中的引擎进程：收到推进信号时把回合号加一，并改写工作目录里的回合文件（内容形如 "turn 3"）。
 */
public class FakeGameProcess implements GameProcessHandle {

    public static final String TURN_FILE = "game.trn";

    private final String sessionId;
    private final Path workDir;

    private volatile boolean alive;
    private volatile int turn = -1;
    private volatile boolean advanceOnSignal = true;
    private volatile String errorSummary = "No log file found";
    private final List<NationStatus> nations = new CopyOnWriteArrayList<>();

    public final AtomicInteger starts = new AtomicInteger();
    public final AtomicInteger stops = new AtomicInteger();
    public final AtomicInteger signals = new AtomicInteger();

    public FakeGameProcess(String sessionId, Path workDir) {
        this.sessionId = sessionId;
        this.workDir = workDir;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    /** 启动时像真实引擎一样从存档读回当前回合 */
    @Override
    public void start() throws IOException {
        Path save = workDir.resolve(TURN_FILE);
        if (Files.exists(save)) {
            int saved = Integer.parseInt(Files.readString(save).substring("turn ".length()).strip());
            turn = saved > 0 ? saved : -1;
        }
        alive = true;
        starts.incrementAndGet();
    }

    @Override
    public void stop() {
        if (alive) {
            alive = false;
            stops.incrementAndGet();
        }
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public void signalAdvance() {
        signals.incrementAndGet();
        if (advanceOnSignal) {
            advanceTo(turn < 1 ? 1 : turn + 1);
        }
    }

    @Override
    public Optional<GameStatus> probeStatus() {
        return Optional.of(GameStatus.builder().turn(turn).nations(List.copyOf(nations)).build());
    }

    @Override
    public String readErrorSummary() {
        return errorSummary;
    }

    /** 模拟引擎自行处理完一个回合 */
    public void advanceTo(int newTurn) {
        turn = newTurn;
        try {
            Files.writeString(workDir.resolve(TURN_FILE), "turn " + newTurn);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** 进程意外退出 */
    public void crash(String summary) {
        alive = false;
        errorSummary = summary;
    }

    public void setAdvanceOnSignal(boolean advanceOnSignal) {
        this.advanceOnSignal = advanceOnSignal;
    }

    public void setErrorSummary(String errorSummary) {
        this.errorSummary = errorSummary;
    }

    public void addNation(int id, int playerStatus, int turnStatus, String name) {
        nations.add(NationStatus.builder().nationId(id).playerStatus(playerStatus).turnStatus(turnStatus).name(name).build());
    }

    public int turn() {
        return turn;
    }
}
