package com.ryuqq.fleet.core.spi;

/**
 * 워커 프로세스 상태.
 */
public enum WorkerStatus {
    RUNNING,
    COMPLETED,
    STOPPED,
    FAILED
}
