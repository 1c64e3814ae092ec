package com.ryuqq.fleet.core.spi;

import com.ryuqq.fleet.core.model.OperationId;

/**
 * 워커 시작 명령.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param type 워커 역할
 * @param operationId 소속 Operation
 * @param shipSymbol 워커가 조종할 함선
 * @param siteSymbol 작업 지점 심볼
 * @param goodSymbol 대상 상품 (운송 워커가 대기할 상품, 추출 워커는 null 허용)
 */
public record WorkerCommand(
    WorkerType type,
    OperationId operationId,
    String shipSymbol,
    String siteSymbol,
    String goodSymbol
) {

    public WorkerCommand {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (shipSymbol == null || shipSymbol.isBlank()) {
            throw new IllegalArgumentException("shipSymbol cannot be null or blank");
        }
        if (siteSymbol == null || siteSymbol.isBlank()) {
            throw new IllegalArgumentException("siteSymbol cannot be null or blank");
        }
        if (type == WorkerType.TRANSPORT && (goodSymbol == null || goodSymbol.isBlank())) {
            throw new IllegalArgumentException("transport worker requires a good symbol");
        }
    }
}
