package com.ryuqq.fleet.core.spi;

/**
 * 워커 역할.
 */
public enum WorkerType {

    /**
     * 추출 유닛 (생산자).
     */
    EXTRACTION,

    /**
     * 운송 유닛 (소비자).
     */
    TRANSPORT
}
