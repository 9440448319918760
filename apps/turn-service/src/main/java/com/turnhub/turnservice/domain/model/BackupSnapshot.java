package com.turnhub.turnservice.domain.model;

import com.turnhub.turnservice.domain.enums.BackupPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 备份快照索引项（只保存指针，不保存文件内容）。写入索引后不可修改。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BackupSnapshot {

    private String sessionId;

    private int turnNumber;

    private BackupPhase phase;

    /** 快照所在目录 */
    private String locationRef;

    /** SHA-256（按相对路径排序后逐文件累加） */
    private String checksum;

    private int fileCount;

    private long writtenAt;
}
