package com.ryuqq.fleet.core.ledger;

import com.ryuqq.fleet.core.error.CoordinationException;
import com.ryuqq.fleet.core.model.OperationId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 버퍼 리소스(저장/운송 유닛) 하나의 화물 장부.
 *
 * <p>보유 재고, 용량, 입고 대기 중인 공간 예약, 출고 대기 중인 화물 예약을 관리합니다.
 * 모든 메서드는 이 레저 자체의 락으로 동기화되며, 호출자는 별도 락을 잡을 필요가 없습니다.
 * 한 레저의 느린 작업이 다른 레저 접근을 막지 않습니다 (조정기 락과 분리된 세밀한 락).</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>Σ inventory ≤ capacity</li>
 *   <li>모든 상품에 대해 reservedForWithdrawal[good] ≤ inventory[good]</li>
 *   <li>Σ inventory + reservedSpace ≤ capacity</li>
 * </ul>
 *
 * <p><strong>입고 흐름 (예약 후 확정):</strong></p>
 * <pre>
 * reserveSpace(n)          → reservedSpace += n   (API 전송 전)
 *   ├─ 전송 성공 → confirmDeposit(good, n)  → reservedSpace -= n, inventory[good] += n
 *   └─ 전송 실패 → releaseReservedSpace(n)  → reservedSpace -= n
 * </pre>
 *
 * <p><strong>출고 흐름:</strong></p>
 * <pre>
 * tryReserveCargo(good, min) → 가용 화물 전부 예약
 *   ├─ 전송 성공 → confirmWithdrawal(good, n)  → inventory, 예약 모두 차감
 *   └─ 전송 취소 → cancelReservation(good, n)  → 예약만 해제
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResourceLedger {

    private final String resourceSymbol;
    private final String locationSymbol;
    private final OperationId operationId;
    private final int capacity;

    private final Map<String, Integer> inventory = new HashMap<>();
    private final Map<String, Integer> reservedForWithdrawal = new HashMap<>();
    private int reservedSpace;

    /**
     * 빈 레저 생성.
     *
     * @param resourceSymbol 리소스 심볼
     * @param locationSymbol 리소스가 위치한 지점 심볼
     * @param operationId 소유 Operation
     * @param capacity 총 용량 (0 이상)
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     */
    public ResourceLedger(String resourceSymbol, String locationSymbol, OperationId operationId, int capacity) {
        this(resourceSymbol, locationSymbol, operationId, capacity, Map.of());
    }

    /**
     * 초기 재고가 있는 레저 생성 (재시작 후 외부 관측 상태로 복구할 때 사용).
     *
     * @param resourceSymbol 리소스 심볼
     * @param locationSymbol 리소스가 위치한 지점 심볼
     * @param operationId 소유 Operation
     * @param capacity 총 용량 (0 이상)
     * @param initialInventory 초기 재고 (good → units, null 허용)
     * @throws IllegalArgumentException 파라미터가 유효하지 않거나 초기 재고가 용량을 넘는 경우
     */
    public ResourceLedger(String resourceSymbol, String locationSymbol, OperationId operationId,
                          int capacity, Map<String, Integer> initialInventory) {
        if (resourceSymbol == null || resourceSymbol.isBlank()) {
            throw new IllegalArgumentException("resourceSymbol cannot be null or blank");
        }
        if (locationSymbol == null || locationSymbol.isBlank()) {
            throw new IllegalArgumentException("locationSymbol cannot be null or blank");
        }
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity cannot be negative (current: " + capacity + ")");
        }

        int total = 0;
        if (initialInventory != null) {
            for (Map.Entry<String, Integer> entry : initialInventory.entrySet()) {
                String good = entry.getKey();
                int units = entry.getValue() == null ? 0 : entry.getValue();
                requireGood(good);
                if (units < 0) {
                    throw new IllegalArgumentException("initial cargo for " + good + " cannot be negative");
                }
                if (units > 0) {
                    inventory.put(good, units);
                    total += units;
                }
            }
        }
        if (total > capacity) {
            throw new IllegalArgumentException("initial cargo (" + total + ") exceeds capacity (" + capacity + ")");
        }

        this.resourceSymbol = resourceSymbol;
        this.locationSymbol = locationSymbol;
        this.operationId = operationId;
        this.capacity = capacity;
    }

    public String resourceSymbol() {
        return resourceSymbol;
    }

    public String locationSymbol() {
        return locationSymbol;
    }

    public OperationId operationId() {
        return operationId;
    }

    public int capacity() {
        return capacity;
    }

    // ============================================================
    // 조회
    // ============================================================

    /**
     * 신규 입고에 쓸 수 있는 공간.
     *
     * @return capacity − Σinventory − reservedSpace
     */
    public synchronized int availableSpace() {
        return capacity - totalUnits() - reservedSpace;
    }

    /**
     * 예약되지 않은 화물 수량.
     *
     * @param goodSymbol 상품 심볼
     * @return max(0, inventory[good] − reservedForWithdrawal[good])
     */
    public synchronized int availableCargo(String goodSymbol) {
        return availableCargoUnsafe(goodSymbol);
    }

    public synchronized boolean hasAvailableCargo(String goodSymbol, int minUnits) {
        return availableCargoUnsafe(goodSymbol) >= minUnits;
    }

    public synchronized int totalCargoUnits() {
        return totalUnits();
    }

    public synchronized int cargoUnits(String goodSymbol) {
        return inventory.getOrDefault(goodSymbol, 0);
    }

    public synchronized int reservedCargo(String goodSymbol) {
        return reservedForWithdrawal.getOrDefault(goodSymbol, 0);
    }

    public synchronized int reservedSpace() {
        return reservedSpace;
    }

    /**
     * 현재 재고 사본.
     *
     * @return good → units (불변)
     */
    public synchronized Map<String, Integer> inventory() {
        return Map.copyOf(inventory);
    }

    /**
     * 현재 보유 중인 상품 목록.
     *
     * @return 상품 심볼 목록
     */
    public synchronized List<String> goods() {
        return new ArrayList<>(inventory.keySet());
    }

    /**
     * 일관된 시점의 스냅샷.
     *
     * @return 레저 스냅샷
     */
    public synchronized LedgerSnapshot snapshot() {
        return new LedgerSnapshot(
            resourceSymbol,
            operationId,
            capacity,
            Map.copyOf(inventory),
            Map.copyOf(reservedForWithdrawal),
            reservedSpace
        );
    }

    // ============================================================
    // 입고
    // ============================================================

    /**
     * 예약 없이 입고 (추출 유닛이 직접 전송한 뒤 호출).
     *
     * @param goodSymbol 상품 심볼
     * @param units 수량 (양수)
     * @throws CoordinationException INSUFFICIENT_SPACE - 남은 공간 부족
     */
    public synchronized void depositCargo(String goodSymbol, int units) {
        requireGood(goodSymbol);
        requirePositive(units, "deposit units");

        int available = capacity - totalUnits() - reservedSpace;
        if (units > available) {
            throw CoordinationException.insufficientSpace(units, available);
        }
        inventory.merge(goodSymbol, units, Integer::sum);
    }

    /**
     * 입고 공간 예약. 실제 전송 전에 호출해야 두 생산자가 같은 빈 공간을 노리지 않습니다.
     *
     * @param units 수량 (양수)
     * @throws CoordinationException INSUFFICIENT_SPACE - 남은 공간 부족
     */
    public synchronized void reserveSpace(int units) {
        requirePositive(units, "reserve units");

        int available = capacity - totalUnits() - reservedSpace;
        if (units > available) {
            throw CoordinationException.insufficientSpace(units, available);
        }
        reservedSpace += units;
    }

    /**
     * 공간 예약 해제 (전송 실패 시). 0 미만으로 내려가지 않습니다.
     *
     * @param units 수량 (0 이하면 무시)
     */
    public synchronized void releaseReservedSpace(int units) {
        if (units <= 0) {
            return;
        }
        reservedSpace = Math.max(0, reservedSpace - units);
    }

    /**
     * 공간 예약을 실제 재고로 전환 (전송 확인 후).
     *
     * @param goodSymbol 상품 심볼
     * @param units 수량 (양수)
     */
    public synchronized void confirmDeposit(String goodSymbol, int units) {
        requireGood(goodSymbol);
        requirePositive(units, "deposit units");

        reservedSpace = Math.max(0, reservedSpace - units);
        inventory.merge(goodSymbol, units, Integer::sum);
    }

    // ============================================================
    // 출고
    // ============================================================

    /**
     * 화물 예약 시도.
     *
     * <p>가용 수량이 minUnits 미만이면 0을 반환합니다 (오류 아님, 대기 여부는 호출자가 결정).
     * 충분하면 minUnits가 아니라 가용 수량 <strong>전부</strong>를 예약합니다.
     * 여러 상품이 섞인 버퍼에서 한 번의 운송 효율을 최대화하기 위함입니다.</p>
     *
     * @param goodSymbol 상품 심볼
     * @param minUnits 최소 수량 (양수)
     * @return 예약된 수량, 부족하면 0
     */
    public synchronized int tryReserveCargo(String goodSymbol, int minUnits) {
        requireGood(goodSymbol);
        requirePositive(minUnits, "min units");

        int available = availableCargoUnsafe(goodSymbol);
        if (available < minUnits) {
            return 0;
        }
        reservedForWithdrawal.merge(goodSymbol, available, Integer::sum);
        return available;
    }

    /**
     * 정확한 수량 예약.
     *
     * @param goodSymbol 상품 심볼
     * @param units 수량 (양수)
     * @throws CoordinationException INSUFFICIENT_CARGO - 가용 화물 부족
     */
    public synchronized void reserveCargo(String goodSymbol, int units) {
        requireGood(goodSymbol);
        requirePositive(units, "reserve units");

        int available = availableCargoUnsafe(goodSymbol);
        if (available < units) {
            throw CoordinationException.insufficientCargo(
                "insufficient cargo: need " + units + " " + goodSymbol + ", have " + available + " available");
        }
        reservedForWithdrawal.merge(goodSymbol, units, Integer::sum);
    }

    /**
     * 출고 확정: 재고와 예약을 함께 차감.
     *
     * @param goodSymbol 상품 심볼
     * @param units 수량 (양수)
     * @throws CoordinationException INSUFFICIENT_CARGO - 예약 또는 재고보다 많은 수량
     */
    public synchronized void confirmWithdrawal(String goodSymbol, int units) {
        requireGood(goodSymbol);
        requirePositive(units, "withdrawal units");

        int reserved = reservedForWithdrawal.getOrDefault(goodSymbol, 0);
        if (reserved < units) {
            throw CoordinationException.insufficientCargo(
                "cannot confirm withdrawal of " + units + " " + goodSymbol + ": only " + reserved + " reserved");
        }
        int held = inventory.getOrDefault(goodSymbol, 0);
        if (held < units) {
            throw CoordinationException.insufficientCargo(
                "cannot confirm withdrawal of " + units + " " + goodSymbol + ": only " + held + " in inventory");
        }

        subtract(reservedForWithdrawal, goodSymbol, units);
        subtract(inventory, goodSymbol, units);
    }

    /**
     * 출고 예약 취소 (재고는 그대로).
     *
     * @param goodSymbol 상품 심볼
     * @param units 수량 (양수)
     * @throws CoordinationException INSUFFICIENT_CARGO - 예약보다 많은 수량
     */
    public synchronized void cancelReservation(String goodSymbol, int units) {
        requireGood(goodSymbol);
        requirePositive(units, "cancel units");

        int reserved = reservedForWithdrawal.getOrDefault(goodSymbol, 0);
        if (reserved < units) {
            throw CoordinationException.insufficientCargo(
                "cannot cancel " + units + " " + goodSymbol + ": only " + reserved + " reserved");
        }
        subtract(reservedForWithdrawal, goodSymbol, units);
    }

    /**
     * 저가치 부산물 폐기. 예약은 건드리지 않습니다.
     *
     * @param goodSymbol 상품 심볼
     * @param units 수량 (양수)
     * @throws CoordinationException INSUFFICIENT_CARGO - 재고 부족
     */
    public synchronized void jettisonCargo(String goodSymbol, int units) {
        requireGood(goodSymbol);
        requirePositive(units, "jettison units");

        int held = inventory.getOrDefault(goodSymbol, 0);
        if (held < units) {
            throw CoordinationException.insufficientCargo(
                "insufficient cargo: want to remove " + units + " " + goodSymbol + ", have " + held);
        }
        subtract(inventory, goodSymbol, units);
    }

    // ============================================================
    // 내부 (락 보유 상태에서만 호출)
    // ============================================================

    private int totalUnits() {
        int total = 0;
        for (int units : inventory.values()) {
            total += units;
        }
        return total;
    }

    private int availableCargoUnsafe(String goodSymbol) {
        int held = inventory.getOrDefault(goodSymbol, 0);
        int reserved = reservedForWithdrawal.getOrDefault(goodSymbol, 0);
        return Math.max(0, held - reserved);
    }

    private static void subtract(Map<String, Integer> map, String goodSymbol, int units) {
        map.computeIfPresent(goodSymbol, (k, current) -> {
            int remaining = current - units;
            return remaining > 0 ? remaining : null;
        });
    }

    private static void requireGood(String goodSymbol) {
        if (goodSymbol == null || goodSymbol.isBlank()) {
            throw new IllegalArgumentException("good symbol cannot be null or blank");
        }
    }

    private static void requirePositive(int units, String name) {
        if (units <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + units + ")");
        }
    }

    @Override
    public synchronized String toString() {
        int reservedTotal = 0;
        for (int units : reservedForWithdrawal.values()) {
            reservedTotal += units;
        }
        return "ResourceLedger{" + resourceSymbol + ", op=" + operationId.getValue()
            + ", cargo=" + totalUnits() + "/" + capacity
            + ", reserved=" + reservedTotal + ", reservedSpace=" + reservedSpace + '}';
    }
}
