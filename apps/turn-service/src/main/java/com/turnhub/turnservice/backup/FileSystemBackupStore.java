package com.turnhub.turnservice.backup;

import com.turnhub.turnservice.common.error.BackupFailureException;
import com.turnhub.turnservice.domain.enums.BackupPhase;
import com.turnhub.turnservice.domain.model.BackupSnapshot;
import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.repository.SnapshotRepository;
import com.turnhub.turnservice.platform.config.TurnHostProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 基于本地文件系统的备份实现。
 *
 * 目录布局：{backup.root}/{sessionId}/turn_{n}/{pre|post}/
 * 只备份工作目录下的普通文件，地图等静态资源（excludedExtensions）不参与备份与恢复。
 */
@Slf4j
@Component
public class FileSystemBackupStore implements BackupStore {

    private final SnapshotRepository snapshots;
    private final Path root;
    private final List<String> excludedExtensions;
    private final Clock clock;

    public FileSystemBackupStore(SnapshotRepository snapshots, TurnHostProperties props, Clock clock) {
        this.snapshots = snapshots;
        this.root = Paths.get(props.getBackup().getRoot()).toAbsolutePath().normalize();
        this.excludedExtensions = props.getBackup().getExcludedExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .toList();
        this.clock = clock;
    }

    @Override
    public BackupSnapshot write(GameSession session, int turnNumber, BackupPhase phase) {
        String sessionId = session.getId();
        Optional<BackupSnapshot> existing = snapshots.find(sessionId, turnNumber, phase);
        if (existing.isPresent()) {
            log.info("备份已存在，跳过: sessionId={}, turn={}, phase={}", sessionId, turnNumber, phase);
            return existing.get();
        }
        Path source = Paths.get(session.getWorkDir());
        Path target = snapshotDir(sessionId, turnNumber, phase);
        try {
            if (!Files.isDirectory(source)) {
                throw new BackupFailureException(sessionId, "对局工作目录不存在: " + source);
            }
            // 未进索引的目录是上次中断留下的半成品
            if (Files.exists(target)) {
                deleteRecursively(target);
            }
            Files.createDirectories(target);
            List<Path> files = listBackupFiles(source);
            for (Path f : files) {
                Files.copy(f, target.resolve(f.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING);
            }
            String sourceSum = checksum(source);
            String copiedSum = checksum(target);
            if (!sourceSum.equals(copiedSum)) {
                throw new BackupFailureException(sessionId,
                        "备份校验失败: turn=" + turnNumber + ", phase=" + phase);
            }
            BackupSnapshot snapshot = BackupSnapshot.builder()
                    .sessionId(sessionId)
                    .turnNumber(turnNumber)
                    .phase(phase)
                    .locationRef(target.toString())
                    .checksum(copiedSum)
                    .fileCount(files.size())
                    .writtenAt(clock.millis())
                    .build();
            if (!snapshots.save(snapshot)) {
                // 并发写入时以先写入索引的为准
                return snapshots.find(sessionId, turnNumber, phase).orElse(snapshot);
            }
            log.info("备份完成: sessionId={}, turn={}, phase={}, files={}, dir={}",
                    sessionId, turnNumber, phase, files.size(), target);
            return snapshot;
        } catch (IOException e) {
            throw new BackupFailureException(sessionId,
                    "备份写入失败: turn=" + turnNumber + ", phase=" + phase + ", " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<BackupSnapshot> find(String sessionId, int turnNumber, BackupPhase phase) {
        return snapshots.find(sessionId, turnNumber, phase);
    }

    @Override
    public List<BackupSnapshot> list(String sessionId) {
        return snapshots.findBySession(sessionId);
    }

    @Override
    public void restore(GameSession session, BackupSnapshot snapshot) {
        String sessionId = session.getId();
        Path from = Paths.get(snapshot.getLocationRef());
        Path workDir = Paths.get(session.getWorkDir());
        try {
            if (!Files.isDirectory(from)) {
                throw new BackupFailureException(sessionId, "快照目录不存在: " + from);
            }
            String actual = checksum(from);
            if (!actual.equals(snapshot.getChecksum())) {
                throw new BackupFailureException(sessionId,
                        "快照已损坏: turn=" + snapshot.getTurnNumber() + ", phase=" + snapshot.getPhase());
            }
            Files.createDirectories(workDir);
            for (Path f : listBackupFiles(workDir)) {
                Files.delete(f);
            }
            for (Path f : listBackupFiles(from)) {
                Files.copy(f, workDir.resolve(f.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING);
            }
            log.warn("存档已恢复: sessionId={}, turn={}, phase={}, dir={}",
                    sessionId, snapshot.getTurnNumber(), snapshot.getPhase(), workDir);
        } catch (IOException e) {
            throw new BackupFailureException(sessionId, "恢复存档失败: " + e.getMessage(), e);
        }
    }

    @Override
    public int discardAfter(String sessionId, int afterTurn) {
        int discarded = 0;
        for (BackupSnapshot s : snapshots.findBySession(sessionId)) {
            if (s.getTurnNumber() <= afterTurn) continue;
            snapshots.delete(s);
            Path dir = Paths.get(s.getLocationRef());
            try {
                if (Files.exists(dir)) {
                    deleteRecursively(dir);
                }
            } catch (IOException e) {
                // 索引已移除，残留目录在下次写入同一位置时会被清理
                log.warn("删除作废快照目录失败: sessionId={}, dir={}, err={}", sessionId, dir, e.getMessage());
            }
            discarded++;
        }
        if (discarded > 0) {
            log.info("已作废回滚点之后的快照: sessionId={}, afterTurn={}, count={}", sessionId, afterTurn, discarded);
        }
        return discarded;
    }

    Path snapshotDir(String sessionId, int turnNumber, BackupPhase phase) {
        return root.resolve(sessionId)
                .resolve("turn_" + turnNumber)
                .resolve(phase.name().toLowerCase(Locale.ROOT));
    }

    /** 目录下参与备份的普通文件，按文件名排序 */
    private List<Path> listBackupFiles(Path dir) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> !isExcluded(p))
                    .sorted()
                    .toList();
        }
    }

    private boolean isExcluded(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return excludedExtensions.stream().anyMatch(name::endsWith);
    }

    /**
     * SHA-256：按文件名顺序依次累加文件名与内容。
     */
    private String checksum(Path dir) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
        for (Path f : listBackupFiles(dir)) {
            digest.update(f.getFileName().toString().getBytes(StandardCharsets.UTF_8));
            try (InputStream in = new DigestInputStream(Files.newInputStream(f), digest)) {
                in.transferTo(OutputStream.nullOutputStream());
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted((a, b) -> b.getNameCount() - a.getNameCount()).toList()) {
                Files.delete(p);
            }
        }
    }
}
