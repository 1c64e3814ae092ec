package com.ryuqq.fleet.testkit.fake;

import com.ryuqq.fleet.core.model.Location;
import com.ryuqq.fleet.core.routing.FlightMode;
import com.ryuqq.fleet.core.routing.RoutePlan;
import com.ryuqq.fleet.core.routing.RouteRequest;
import com.ryuqq.fleet.core.routing.RouteStep;
import com.ryuqq.fleet.core.spi.RoutingOracle;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * RoutingOracle test double.
 *
 * <p>Legs can be scripted with a fixed plan, marked unreachable, or made to throw. Any leg
 * that is not scripted gets a direct plan computed from the locations in the request:</p>
 * <ul>
 *   <li>fuel = ceil(distance)</li>
 *   <li>time = ceil(distance * 100 / engineSpeed) seconds</li>
 *   <li>no route if the fuel exceeds the tank</li>
 * </ul>
 *
 * <p>A fixed delay per call can be set to widen race windows in concurrency tests.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedRoutingOracle implements RoutingOracle {

    private final Map<String, Optional<RoutePlan>> scripted = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final List<RouteRequest> requests = new CopyOnWriteArrayList<>();
    private volatile long delayMillis;

    @Override
    public Optional<RoutePlan> planRoute(RouteRequest request) {
        requests.add(request);
        pause();

        String leg = leg(request.origin(), request.destination());
        RuntimeException failure = failures.get(leg);
        if (failure != null) {
            throw failure;
        }
        Optional<RoutePlan> plan = scripted.get(leg);
        if (plan != null) {
            return plan;
        }
        return direct(request);
    }

    public ScriptedRoutingOracle route(String origin, String destination, RoutePlan plan) {
        scripted.put(leg(origin, destination), Optional.of(plan));
        return this;
    }

    public ScriptedRoutingOracle unreachable(String origin, String destination) {
        scripted.put(leg(origin, destination), Optional.empty());
        return this;
    }

    public ScriptedRoutingOracle failing(String origin, String destination, RuntimeException failure) {
        failures.put(leg(origin, destination), failure);
        return this;
    }

    public ScriptedRoutingOracle withDelay(long millis) {
        this.delayMillis = millis;
        return this;
    }

    /**
     * Requests received so far, in arrival order.
     */
    public List<RouteRequest> requests() {
        return List.copyOf(requests);
    }

    public int callCount() {
        return requests.size();
    }

    private Optional<RoutePlan> direct(RouteRequest request) {
        Location from = find(request.locations(), request.origin());
        Location to = find(request.locations(), request.destination());
        if (from == null || to == null) {
            return Optional.empty();
        }

        double distance = from.distanceTo(to);
        int fuel = (int) Math.ceil(distance);
        if (fuel > request.fuelCapacity()) {
            return Optional.empty();
        }
        int time = (int) Math.ceil(distance * 100 / request.engineSpeed());
        return Optional.of(RoutePlan.of(List.of(RouteStep.travel(to.symbol(), fuel, time, FlightMode.CRUISE))));
    }

    private void pause() {
        long delay = delayMillis;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Location find(List<Location> locations, String symbol) {
        for (Location location : locations) {
            if (location.symbol().equals(symbol)) {
                return location;
            }
        }
        return null;
    }

    private static String leg(String origin, String destination) {
        return origin + "->" + destination;
    }
}
