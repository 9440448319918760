package com.turnhub.turnservice.domain.enums;

public enum BackupPhase {
    PRE,
    POST
}
