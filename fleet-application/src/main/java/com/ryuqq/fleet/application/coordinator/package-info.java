/**
 * Resource coordination port.
 *
 * <p>{@link com.ryuqq.fleet.application.coordinator.ResourceCoordinator} groups buffer ledgers by
 * operation, reserves space and cargo atomically across them, and serves workers waiting for cargo in
 * strict arrival order.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.application.coordinator;
