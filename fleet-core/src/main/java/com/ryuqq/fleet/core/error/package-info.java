/**
 * 조정 엔진 오류 분류.
 *
 * <p>{@link com.ryuqq.fleet.core.error.CoordinationError}는 오류 코드와 복구 가능 여부를,
 * {@link com.ryuqq.fleet.core.error.CoordinationException}은 이를 전달하는 unchecked 예외를 정의합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.core.error;
