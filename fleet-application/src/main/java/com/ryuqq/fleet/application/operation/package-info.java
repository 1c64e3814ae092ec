/**
 * Operation launch and lifecycle.
 *
 * <p>{@link com.ryuqq.fleet.application.operation.OperationLauncher} turns an
 * {@link com.ryuqq.fleet.application.operation.OperationPlan} into a running operation and hands back an
 * {@link com.ryuqq.fleet.application.operation.OperationHandle} that owns everything the launch acquired.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.application.operation;
