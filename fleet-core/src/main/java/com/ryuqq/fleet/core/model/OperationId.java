package com.ryuqq.fleet.core.model;

import java.util.regex.Pattern;

/**
 * 함대 Operation의 고유 식별자.
 *
 * <p>하나의 Operation은 같은 채굴/운송 목표를 위해 협업하는 버퍼 리소스와 워커의 묶음입니다.
 * 리소스 레저, 대기열 키, 배정 루프가 모두 이 식별자로 그룹핑됩니다.
 * 로그와 워커 스레드 이름에 그대로 들어가므로 영숫자, 하이픈(-), 언더스코어(_)만 허용하고
 * 최대 {@value #MAX_LENGTH}자로 제한합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationId {

    public static final int MAX_LENGTH = 255;

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]+");

    private final String value;

    private OperationId(String value) {
        this.value = value;
    }

    /**
     * OperationId 생성.
     *
     * @param value 식별자 값 (예: mining-ice-1)
     * @return OperationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("operation id cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "operation id cannot exceed " + MAX_LENGTH + " characters (current: " + value.length() + ")");
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "operation id '" + value + "' may only contain letters, digits, hyphen and underscore");
        }
        return new OperationId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof OperationId && value.equals(((OperationId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OperationId{" + value + '}';
    }
}
