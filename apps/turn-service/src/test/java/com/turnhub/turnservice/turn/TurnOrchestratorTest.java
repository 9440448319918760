package com.turnhub.turnservice.turn;

import com.turnhub.turnkafkanotifier.event.TurnNotificationEvent;
import com.turnhub.turnkafkanotifier.event.TurnNotificationEvent.EventType;
import com.turnhub.turnservice.common.error.BackupFailureException;
import com.turnhub.turnservice.common.error.ConcurrentAdvanceInProgressException;
import com.turnhub.turnservice.common.error.InvalidStateTransitionException;
import com.turnhub.turnservice.common.error.ProcessUnresponsiveException;
import com.turnhub.turnservice.common.error.RecoveryRequiredException;
import com.turnhub.turnservice.common.error.SnapshotNotFoundException;
import com.turnhub.turnservice.domain.dto.AdvanceOutcome;
import com.turnhub.turnservice.domain.enums.AdvanceTrigger;
import com.turnhub.turnservice.domain.enums.BackupPhase;
import com.turnhub.turnservice.domain.enums.OrchestratorState;
import com.turnhub.turnservice.domain.enums.SessionPhase;
import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.domain.model.TurnRecord;
import com.turnhub.turnservice.support.FakeGameProcess;
import com.turnhub.turnservice.support.TurnHubTestRig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TurnOrchestratorTest {

    @TempDir
    Path tempDir;

    private TurnHubTestRig rig;
    private TurnOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        rig = new TurnHubTestRig(tempDir, Clock.systemUTC());
        orchestrator = rig.orchestrator;
    }

    @AfterEach
    void tearDown() {
        rig.close();
    }

    @Test
    void firstForcedAdvanceStartsTheGame() {
        String id = rig.launchedSession("Ragnarok", 600);

        AdvanceOutcome outcome = orchestrator.forceAdvance(id);

        assertThat(outcome.turnNumber()).isEqualTo(1);
        assertThat(outcome.alreadyCompleted()).isFalse();
        assertThat(outcome.remainingSeconds()).isEqualTo(600);
        assertThat(outcome.deadlineEpochMs()).isNotNull();
        assertThat(rig.sessions.get(id).getPhase()).isEqualTo(SessionPhase.STARTED);
        assertThat(rig.fake(id).signals).hasValue(1);

        List<TurnRecord> history = orchestrator.history(id);
        assertThat(history).hasSize(1);
        TurnRecord record = history.get(0);
        assertThat(record.getPhase()).isEqualTo(OrchestratorState.IDLE);
        assertThat(record.getTrigger()).isEqualTo(AdvanceTrigger.FORCE);
        assertThat(record.getPreBackupRef()).isNotNull();
        assertThat(record.getPostBackupRef()).isNotNull();
        assertThat(record.getCompletedAt()).isNotNull();

        assertThat(Path.of(record.getPreBackupRef()).resolve(FakeGameProcess.TURN_FILE)).hasContent("turn 0");
        assertThat(Path.of(record.getPostBackupRef()).resolve(FakeGameProcess.TURN_FILE)).hasContent("turn 1");
        assertThat(rig.notifier.ofType(EventType.GAME_STARTED)).hasSize(1);
        assertThat(rig.timers.get(id).isRunning()).isTrue();
        assertThat(orchestrator.stateOf(id)).isEqualTo(OrchestratorState.IDLE);
    }

    @Test
    void laterAdvanceNotifiesOutstandingPlayers() {
        String id = rig.launchedSession("Outstanding", 600);
        orchestrator.forceAdvance(id);
        rig.fake(id).addNation(5, 1, 2, "Arcoscephale");
        rig.fake(id).addNation(6, 1, 0, "Ermor");
        rig.fake(id).addNation(7, 2, 0, "Computer");

        AdvanceOutcome outcome = orchestrator.onDeadline(id);

        assertThat(outcome.turnNumber()).isEqualTo(2);
        assertThat(outcome.outstandingPlayers()).containsExactly("Ermor");
        List<TurnNotificationEvent> advanced = rig.notifier.ofType(EventType.TURN_ADVANCED);
        assertThat(advanced).hasSize(1);
        assertThat(advanced.get(0).getTurnNumber()).isEqualTo(2);
        assertThat(advanced.get(0).getOutstandingPlayers()).containsExactly("Ermor");
    }

    @Test
    void newTurnResetsTimerAndLedger() {
        String id = rig.launchedSession("Reset", 600);
        orchestrator.forceAdvance(id);
        rig.ledger.registerPlayer(id, "alice", "Ulm");
        rig.ledger.requestExtension(id, "alice", 300);
        rig.timers.setNextTurnDuration(id, 60);

        AdvanceOutcome outcome = orchestrator.forceAdvance(id);

        assertThat(outcome.remainingSeconds()).isEqualTo(60);
        assertThat(rig.bankRepo.find(id, "alice").orElseThrow().getExtensionsUsedThisTurn()).isZero();
    }

    @Test
    void backupFailureNeverSignalsTheEngine() throws IOException {
        String id = rig.launchedSession("NoBackup", 600);
        orchestrator.forceAdvance(id);
        FileSystemUtils.deleteRecursively(rig.workDir(id));

        assertThatThrownBy(() -> orchestrator.forceAdvance(id)).isInstanceOf(BackupFailureException.class);

        assertThat(rig.fake(id).signals).hasValue(1);
        TurnRecord failed = rig.recordRepo.latest(id).orElseThrow();
        assertThat(failed.getTurnNumber()).isEqualTo(2);
        assertThat(failed.getPhase()).isEqualTo(OrchestratorState.FAILED);
        assertThat(failed.getFailedPhase()).isEqualTo(OrchestratorState.PRE_BACKUP_IN_FLIGHT);
        assertThat(failed.getPreBackupRef()).isNull();
        assertThat(rig.notifier.ofType(EventType.ADVANCE_FAILED)).hasSize(1);
        assertThat(rig.backups.find(id, 2, BackupPhase.PRE)).isEmpty();
    }

    @Test
    void failedRecordBlocksAutomaticEntriesUntilResumed() throws IOException {
        String id = rig.launchedSession("Blocked", 600);
        orchestrator.forceAdvance(id);
        Path workDir = rig.workDir(id);
        FileSystemUtils.deleteRecursively(workDir);
        assertThatThrownBy(() -> orchestrator.forceAdvance(id)).isInstanceOf(BackupFailureException.class);

        assertThatThrownBy(() -> orchestrator.onDeadline(id)).isInstanceOf(RecoveryRequiredException.class);
        assertThatThrownBy(() -> orchestrator.onTurnCompleted(id, 2)).isInstanceOf(RecoveryRequiredException.class);

        Files.createDirectories(workDir);
        Files.writeString(workDir.resolve(FakeGameProcess.TURN_FILE), "turn 1");
        AdvanceOutcome resumed = orchestrator.resume(id);

        assertThat(resumed.turnNumber()).isEqualTo(2);
        assertThat(rig.fake(id).turn()).isEqualTo(2);
        assertThat(orchestrator.history(id)).extracting(TurnRecord::getPhase)
                .containsExactly(OrchestratorState.IDLE, OrchestratorState.IDLE);
    }

    @Test
    void unresponsiveEngineFailsAfterBoundedRetries() {
        String id = rig.launchedSession("Stuck", 600);
        FakeGameProcess fake = rig.fake(id);
        fake.setAdvanceOnSignal(false);
        fake.setErrorSummary("Error: out of memory");

        assertThatThrownBy(() -> orchestrator.forceAdvance(id))
                .isInstanceOf(ProcessUnresponsiveException.class)
                .hasMessageContaining("Error: out of memory");

        TurnRecord failed = rig.recordRepo.latest(id).orElseThrow();
        assertThat(failed.getAttempts()).isEqualTo(2);
        assertThat(failed.getFailedPhase()).isEqualTo(OrchestratorState.ADVANCING);
        assertThat(failed.getPreBackupRef()).isNotNull();
        assertThat(fake.signals).hasValue(2);
        assertThat(rig.notifier.ofType(EventType.ADVANCE_FAILED).get(0).getMessage()).contains("卡住");

        fake.setAdvanceOnSignal(true);
        AdvanceOutcome resumed = orchestrator.resume(id);

        assertThat(resumed.turnNumber()).isEqualTo(1);
        assertThat(rig.sessions.get(id).getPhase()).isEqualTo(SessionPhase.STARTED);
    }

    @Test
    void concurrentForceIsRejectedWhileAnotherAdvanceHoldsTheSession() throws Exception {
        String id = rig.launchedSession("Busy", 600);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            ReentrantLock lock = rig.locks.lockFor(id);
            lock.lock();
            try {
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                lock.unlock();
            }
        });
        holder.start();
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> orchestrator.forceAdvance(id))
                    .isInstanceOf(ConcurrentAdvanceInProgressException.class);
            assertThat(orchestrator.history(id)).isEmpty();
        } finally {
            release.countDown();
            holder.join(5000);
        }
        assertThat(orchestrator.forceAdvance(id).turnNumber()).isEqualTo(1);
    }

    @Test
    void forceQueuedBehindAnotherForceIsRejectedAfterThatAdvanceCompletes() throws Exception {
        String id = rig.launchedSession("Race", 600);
        rig.props.getLock().setEntryWaitMillis(5000);
        rig.props.getAdvance().setConfirmTimeoutMillis(5000);
        FakeGameProcess engine = rig.fake(id);
        engine.setAdvanceOnSignal(false);

        AtomicReference<Throwable> firstError = new AtomicReference<>();
        Thread first = new Thread(() -> {
            try {
                orchestrator.forceAdvance(id);
            } catch (Throwable t) {
                firstError.set(t);
            }
        });
        first.start();
        // 第一个推进已经发出信号，正持锁等待引擎确认
        awaitCondition(() -> engine.signals.get() == 1);

        AtomicReference<AdvanceOutcome> secondOutcome = new AtomicReference<>();
        AtomicReference<Throwable> secondError = new AtomicReference<>();
        Thread second = new Thread(() -> {
            try {
                secondOutcome.set(orchestrator.forceAdvance(id));
            } catch (Throwable t) {
                secondError.set(t);
            }
        });
        second.start();
        ReentrantLock lock = rig.locks.lockFor(id);
        awaitCondition(() -> lock.hasQueuedThread(second));

        engine.advanceTo(1);
        first.join(10_000);
        second.join(10_000);

        assertThat(firstError.get()).isNull();
        assertThat(secondOutcome.get()).isNull();
        assertThat(secondError.get()).isInstanceOf(ConcurrentAdvanceInProgressException.class);
        assertThat(orchestrator.history(id)).hasSize(1);
        assertThat(engine.signals).hasValue(1);
        assertThat(engine.turn()).isEqualTo(1);
    }

    @Test
    void forceAfterAnEarlierAdvanceFinishedStillRuns() {
        String id = rig.launchedSession("Sequential", 600);

        orchestrator.forceAdvance(id);
        orchestrator.forceAdvance(id);

        assertThat(orchestrator.history(id)).extracting(TurnRecord::getTurnNumber).containsExactly(1, 2);
        assertThat(rig.fake(id).signals).hasValue(2);
    }

    @Test
    void advanceRequiresHostingSession() {
        String id = rig.createSession("Lobby", 600);

        assertThatThrownBy(() -> orchestrator.forceAdvance(id)).isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void resumeWithNothingPendingIsRejected() {
        String id = rig.launchedSession("Idle", 600);
        orchestrator.forceAdvance(id);

        assertThatThrownBy(() -> orchestrator.resume(id)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void externallyCompletedTurnIsRecordedOnceWithoutSignal() {
        String id = rig.launchedSession("External", 600);
        orchestrator.forceAdvance(id);

        assertThat(orchestrator.onTurnCompleted(id, 1).alreadyCompleted()).isTrue();

        rig.fake(id).advanceTo(2);
        AdvanceOutcome outcome = orchestrator.onTurnCompleted(id, 2);

        assertThat(outcome.turnNumber()).isEqualTo(2);
        assertThat(outcome.alreadyCompleted()).isFalse();
        assertThat(rig.fake(id).signals).hasValue(1);
        assertThat(rig.recordRepo.latest(id).orElseThrow().getTrigger()).isEqualTo(AdvanceTrigger.TURN_COMPLETED);
        assertThat(orchestrator.onTurnCompleted(id, 2).alreadyCompleted()).isTrue();
        assertThat(orchestrator.history(id)).hasSize(2);
    }

    @Test
    void preAndPostHooksCompleteTheTurnExactlyOnce() {
        String id = rig.launchedSession("Hooks", 600);
        orchestrator.forceAdvance(id);
        rig.notifier.clear();

        AdvanceOutcome pre = orchestrator.preAdvanceHook(id);
        assertThat(pre.turnNumber()).isEqualTo(2);
        assertThat(pre.alreadyCompleted()).isFalse();
        assertThat(orchestrator.stateOf(id)).isEqualTo(OrchestratorState.ADVANCING);
        assertThat(rig.backups.find(id, 2, BackupPhase.PRE)).isPresent();
        assertThat(orchestrator.preAdvanceHook(id).alreadyCompleted()).isTrue();

        rig.fake(id).advanceTo(2);
        AdvanceOutcome post = orchestrator.postAdvanceHook(id);
        assertThat(post.turnNumber()).isEqualTo(2);
        assertThat(post.alreadyCompleted()).isFalse();

        AdvanceOutcome again = orchestrator.postAdvanceHook(id);
        assertThat(again.alreadyCompleted()).isTrue();
        assertThat(again.turnNumber()).isEqualTo(2);

        assertThat(rig.notifier.ofType(EventType.TURN_ADVANCED)).hasSize(1);
        assertThat(rig.fake(id).signals).hasValue(1);
    }

    @Test
    void postHookAloneRecordsTheTurn() {
        String id = rig.launchedSession("PostOnly", 600);
        rig.fake(id).advanceTo(1);

        AdvanceOutcome post = orchestrator.postAdvanceHook(id);

        assertThat(post.turnNumber()).isEqualTo(1);
        assertThat(rig.sessions.get(id).getPhase()).isEqualTo(SessionPhase.STARTED);
        assertThat(rig.notifier.ofType(EventType.GAME_STARTED)).hasSize(1);
        assertThat(rig.fake(id).signals).hasValue(0);
    }

    @Test
    void rollbackRestoresPostSnapshotAndRestartsEngine() {
        String id = rig.launchedSession("Rollback", 600);
        orchestrator.forceAdvance(id);
        orchestrator.forceAdvance(id);
        orchestrator.forceAdvance(id);
        FakeGameProcess fake = rig.fake(id);
        assertThat(rig.workDir(id).resolve(FakeGameProcess.TURN_FILE)).hasContent("turn 3");

        AdvanceOutcome outcome = orchestrator.rollback(id, 1);

        assertThat(outcome.turnNumber()).isEqualTo(1);
        assertThat(rig.workDir(id).resolve(FakeGameProcess.TURN_FILE)).hasContent("turn 1");
        assertThat(rig.workDir(id).resolve("world.map")).exists();
        assertThat(orchestrator.history(id)).extracting(TurnRecord::getTurnNumber).containsExactly(1);
        assertThat(rig.backups.find(id, 2, BackupPhase.POST)).isEmpty();
        assertThat(fake.stops).hasValue(1);
        assertThat(fake.starts).hasValue(2);
        assertThat(fake.turn()).isEqualTo(1);
        TimerState timer = rig.timers.get(id);
        assertThat(timer.isRunning()).isTrue();
        assertThat(timer.remainingSeconds()).isEqualTo(600);
        assertThat(rig.notifier.ofType(EventType.ROLLED_BACK)).hasSize(1);

        // 回滚后重新推进的回合重新备份
        orchestrator.forceAdvance(id);
        TurnRecord replayed = rig.recordRepo.latest(id).orElseThrow();
        assertThat(replayed.getTurnNumber()).isEqualTo(2);
        assertThat(Path.of(replayed.getPreBackupRef()).resolve(FakeGameProcess.TURN_FILE)).hasContent("turn 1");
    }

    @Test
    void rollbackRejectsUnknownTurnsAndMissingSnapshots() {
        String id = rig.launchedSession("Bounds", 600);
        orchestrator.forceAdvance(id);

        assertThatThrownBy(() -> orchestrator.rollback(id, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.rollback(id, 0)).isInstanceOf(IllegalArgumentException.class);

        rig.snapshotRepo.findBySession(id).forEach(rig.snapshotRepo::delete);
        assertThatThrownBy(() -> orchestrator.rollback(id, 1)).isInstanceOf(SnapshotNotFoundException.class);
    }

    @Test
    void processDeathIsReportedOnce() {
        String id = rig.launchedSession("Crash", 600);
        orchestrator.forceAdvance(id);
        rig.fake(id).crash("Error: segmentation fault");

        orchestrator.handleProcessDeath(id);
        orchestrator.handleProcessDeath(id);

        List<TurnNotificationEvent> died = rig.notifier.ofType(EventType.PROCESS_DIED);
        assertThat(died).hasSize(1);
        assertThat(died.get(0).getMessage()).isEqualTo("Error: segmentation fault");
        assertThat(rig.sessions.get(id).isProcessRunning()).isFalse();
        assertThat(rig.timers.get(id).isRunning()).isFalse();
    }

    @Test
    void relaunchOfStartedGameResumesTimer() {
        String id = rig.launchedSession("Relaunch", 600);
        orchestrator.forceAdvance(id);
        orchestrator.stopProcess(id);
        assertThat(rig.timers.get(id).isRunning()).isFalse();

        orchestrator.launch(id);

        assertThat(rig.sessions.get(id).isProcessRunning()).isTrue();
        assertThat(rig.timers.get(id).isRunning()).isTrue();
        assertThat(orchestrator.isProcessAlive(id)).isTrue();
    }

    @Test
    void endAndDeleteStopTheEngine() {
        String id = rig.launchedSession("Finale", 600);
        orchestrator.forceAdvance(id);

        orchestrator.endGame(id);
        assertThat(rig.sessions.get(id).getPhase()).isEqualTo(SessionPhase.ENDED);
        assertThat(orchestrator.isProcessAlive(id)).isFalse();

        ReentrantLock lockBeforeDelete = rig.locks.lockFor(id);
        orchestrator.deleteSession(id);
        assertThat(rig.sessions.get(id).getPhase()).isEqualTo(SessionPhase.DELETED);
        assertThat(rig.timerRepo.findById(id)).isEmpty();
        assertThat(orchestrator.history(id)).hasSize(1);
        // 删除后会话锁被释放，下次取到的是新锁
        assertThat(rig.locks.lockFor(id)).isNotSameAs(lockBeforeDelete);
    }

    @Test
    void recoverInFlightFinishesInterruptedRecords() {
        String id = rig.launchedSession("Crashed", 600);
        orchestrator.forceAdvance(id);
        // 模拟服务在后置备份前崩溃：引擎已到回合 2，记录停在 ADVANCING
        rig.fake(id).advanceTo(2);
        rig.recordRepo.append(TurnRecord.builder()
                .sessionId(id)
                .turnNumber(2)
                .phase(OrchestratorState.ADVANCING)
                .trigger(AdvanceTrigger.DEADLINE)
                .startedAt(System.currentTimeMillis())
                .build());

        int recovered = orchestrator.recoverInFlight();

        assertThat(recovered).isEqualTo(1);
        TurnRecord record = rig.recordRepo.latest(id).orElseThrow();
        assertThat(record.getPhase()).isEqualTo(OrchestratorState.IDLE);
        assertThat(record.getPostBackupRef()).isNotNull();
        assertThat(rig.fake(id).signals).hasValue(1);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("条件在 5s 内未满足");
            }
            Thread.sleep(5);
        }
    }
}
