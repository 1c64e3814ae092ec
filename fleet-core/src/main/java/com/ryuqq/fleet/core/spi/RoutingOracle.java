package com.ryuqq.fleet.core.spi;

import com.ryuqq.fleet.core.routing.RoutePlan;
import com.ryuqq.fleet.core.routing.RouteRequest;

import java.util.Optional;

/**
 * Routing SPI used to cost candidate operating locations.
 *
 * <p>The pathfinding algorithm itself lives outside this library. Implementations receive the
 * ship's fuel state, tank capacity, engine speed and every known location of the region, and
 * answer with a fuel-feasible plan (travel legs and refuel stops) or an empty result when no
 * path exists.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: the candidate search calls this concurrently from its evaluator threads</li>
 *   <li>Failures may be signalled by throwing; callers treat them as "no route"</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RoutingOracle {

    /**
     * Plans a route.
     *
     * @param request origin, destination, fuel state and known locations
     * @return the plan, or empty when no fuel-feasible path exists
     */
    Optional<RoutePlan> planRoute(RouteRequest request);
}
