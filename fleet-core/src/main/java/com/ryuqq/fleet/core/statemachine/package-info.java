/**
 * Operation lifecycle state machine.
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → RUNNING | STOPPED | FAILED
 * RUNNING → COMPLETED | STOPPED | FAILED
 *
 * Forbidden:
 * - COMPLETED, STOPPED, FAILED → * (terminal states)
 * - RUNNING → PENDING
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.statemachine;
