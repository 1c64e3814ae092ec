/**
 * Cooperative cancellation shared by blocking coordination calls.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.core.cancel;
