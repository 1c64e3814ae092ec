/**
 * In-memory {@link com.ryuqq.fleet.application.coordinator.ResourceCoordinator} adapter.
 *
 * <p>Reference implementation used by single-process deployments and by the contract tests
 * in {@code fleet-testkit}.</p>
 *
 * <h2>Architecture</h2>
 *
 * <ul>
 *   <li><strong>Registry:</strong> ledgers by symbol and by operation, guarded by one read/write lock</li>
 *   <li><strong>Waiter queues:</strong> FIFO per (operation, good), served whenever cargo may have appeared</li>
 *   <li><strong>Subscriptions:</strong> bounded buffers per resource; a full buffer drops the notification</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ResourceCoordinator coordinator = new InMemoryResourceCoordinator();
 * coordinator.registerResource(new ResourceLedger("HAULER-1", "X1-SITE", operationId, 40));
 *
 * // transport unit
 * CargoReservation reservation = coordinator.waitForCargo(signal, operationId, "IRON_ORE", 10);
 *
 * // extraction unit, after transferring cargo
 * coordinator.notifyDeposit("HAULER-1", "IRON_ORE", 12);
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.adapter.inmemory.coordinator;
