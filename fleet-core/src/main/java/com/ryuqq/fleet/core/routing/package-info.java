/**
 * Route model exchanged with the external routing oracle.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.routing;
