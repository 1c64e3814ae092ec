package com.ryuqq.fleet.application.operation;

import com.ryuqq.fleet.application.candidate.SearchRequest;
import com.ryuqq.fleet.core.model.OperationId;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Operation 실행 계획.
 *
 * <p>{@code siteSymbol}이 주어지면 후보 탐색을 건너뛰고, 없으면 {@code search}로 작업지를 고릅니다.
 * 추출 함선은 생산자, 운송 함선은 소비자로 배정 루프에 등록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param operationId Operation
 * @param siteSymbol 고정 작업지 (null이면 탐색)
 * @param search 후보 탐색 요청 (siteSymbol이 null일 때 필수)
 * @param goodSymbol 운송 워커가 대기할 상품
 * @param buffers 등록할 버퍼 리소스
 * @param extractionShips 추출 함선 (생산자)
 * @param transportShips 운송 함선 (소비자)
 */
public record OperationPlan(
    OperationId operationId,
    String siteSymbol,
    SearchRequest search,
    String goodSymbol,
    List<BufferSpec> buffers,
    List<String> extractionShips,
    List<String> transportShips
) {

    public OperationPlan {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if ((siteSymbol == null || siteSymbol.isBlank()) && search == null) {
            throw new IllegalArgumentException("either siteSymbol or search must be given");
        }
        buffers = buffers == null ? List.of() : List.copyOf(buffers);
        extractionShips = extractionShips == null ? List.of() : List.copyOf(extractionShips);
        transportShips = transportShips == null ? List.of() : List.copyOf(transportShips);
        if (!transportShips.isEmpty() && (goodSymbol == null || goodSymbol.isBlank())) {
            throw new IllegalArgumentException("goodSymbol is required when transport ships are planned");
        }

        Set<String> seen = new HashSet<>();
        for (BufferSpec buffer : buffers) {
            if (!seen.add(buffer.resourceSymbol())) {
                throw new IllegalArgumentException("duplicate buffer: " + buffer.resourceSymbol());
            }
        }
        seen.clear();
        for (String ship : extractionShips) {
            if (!seen.add(ship)) {
                throw new IllegalArgumentException("ship planned twice: " + ship);
            }
        }
        for (String ship : transportShips) {
            if (!seen.add(ship)) {
                throw new IllegalArgumentException("ship planned twice: " + ship);
            }
        }
    }

    public boolean needsCandidateSearch() {
        return siteSymbol == null || siteSymbol.isBlank();
    }

    public boolean needsAssignment() {
        return !extractionShips.isEmpty() && !transportShips.isEmpty();
    }
}
