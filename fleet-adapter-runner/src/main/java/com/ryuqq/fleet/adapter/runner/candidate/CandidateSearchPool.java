package com.ryuqq.fleet.adapter.runner.candidate;

import com.ryuqq.fleet.application.candidate.Candidate;
import com.ryuqq.fleet.application.candidate.CandidateEvaluation;
import com.ryuqq.fleet.application.candidate.CandidateSelection;
import com.ryuqq.fleet.application.candidate.CandidateSelector;
import com.ryuqq.fleet.application.candidate.SearchRequest;
import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.error.CoordinationException;
import com.ryuqq.fleet.core.model.Location;
import com.ryuqq.fleet.core.routing.RoutePlan;
import com.ryuqq.fleet.core.routing.RouteRequest;
import com.ryuqq.fleet.core.spi.CoordinationObserver;
import com.ryuqq.fleet.core.spi.RoutingOracle;
import com.ryuqq.fleet.core.spi.noop.NoOpCoordinationObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.DoubleAccumulator;

/**
 * 고정 크기 평가 스레드 풀로 (작업지, 목적지) 쌍을 병렬 평가하는 {@link CandidateSelector}.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * selectBestCandidate(signal, request)
 *   ↓
 * 작업지 = targetTrait 보유 위치, 목적지 = destinationTrait 보유 위치
 *   ↓
 * 작업지마다 가장 가까운 destinationsPerSite개 목적지 → 거리 오름차순 정렬 → 공유 큐
 *   ↓
 * 평가 스레드 (최대 evaluatorCount개) 각자 큐에서 꺼내며:
 *   1. 신호 취소 시 중단
 *   2. 지금까지 찾은 최단 실행 가능 거리보다 멀면 중단 (큐가 정렬되어 있으므로 남은 쌍도 모두 더 멂)
 *   3. 사전 필터: distance × 2 × prefilterFuelPerDistance &gt; 탱크 → 실행 불가 (추정 연료 보존)
 *   4. 라우팅 오라클 목적지→작업지, 작업지→목적지 (오류/경로 없음 → 실행 불가)
 *   5. 왕복 연료 &gt; 탱크 → 실행 불가, 아니면 실행 가능
 *   ↓
 * 실행 가능한 최단 거리 후보 선택
 *   (없으면 NO_FEASIBLE_CANDIDATE, allowInfeasible이면 경로가 계산된 후보, 그다음 사전 필터 후보 중
 *   왕복 연료가 가장 적은 후보 + WARN. 경로 없는 후보는 선택하지 않음)
 * </pre>
 *
 * <p>평가 스레드는 인스턴스가 소유하며 {@link #shutdown()}으로 정리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CandidateSearchPool implements CandidateSelector {

    private static final Logger log = LoggerFactory.getLogger(CandidateSearchPool.class);

    private static final Comparator<Candidate> BY_DISTANCE = Comparator
        .comparingDouble(Candidate::distance)
        .thenComparing(Candidate::siteSymbol)
        .thenComparing(Candidate::destinationSymbol);

    // 정확한 경로가 있는 쌍이 추정치 쌍보다 먼저 (enum 선언 순서)
    private static final Comparator<Candidate> BY_EVALUATION_THEN_FUEL = Comparator
        .comparing(Candidate::evaluation)
        .thenComparingInt(Candidate::roundTripFuel)
        .thenComparing(BY_DISTANCE);

    private final RoutingOracle routingOracle;
    private final CandidateSearchConfig config;
    private final CoordinationObserver observer;
    private final ExecutorService evaluators;

    /**
     * 생성자 (기본 설정).
     *
     * @param routingOracle 경로 계획 SPI
     */
    public CandidateSearchPool(RoutingOracle routingOracle) {
        this(routingOracle, new CandidateSearchConfig(), NoOpCoordinationObserver.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param routingOracle 경로 계획 SPI
     * @param config 설정
     * @param observer 후보 선택 관측자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public CandidateSearchPool(RoutingOracle routingOracle, CandidateSearchConfig config, CoordinationObserver observer) {
        if (routingOracle == null) {
            throw new IllegalArgumentException("routingOracle cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }

        this.routingOracle = routingOracle;
        this.config = config;
        this.observer = observer;
        this.evaluators = Executors.newFixedThreadPool(config.evaluatorCount(), evaluatorThreads());
    }

    @Override
    public CandidateSelection selectBestCandidate(CancellationSignal signal, SearchRequest request) {
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (signal.isCancelled()) {
            throw CoordinationException.searchCancelled(request.targetTrait());
        }

        List<Location> sites = withTrait(request.locations(), request.targetTrait());
        if (sites.isEmpty()) {
            throw CoordinationException.noFeasibleCandidate(
                "no locations with trait " + request.targetTrait());
        }
        List<Location> destinations = withTrait(request.locations(), config.destinationTrait());
        if (destinations.isEmpty()) {
            throw CoordinationException.noFeasibleCandidate(
                "no locations with trait " + config.destinationTrait());
        }

        List<Pair> pairs = nearestPairs(sites, destinations);
        log.debug("Evaluating {} pairs ({} sites x up to {} destinations) for {}",
            pairs.size(), sites.size(), config.destinationsPerSite(), request.targetTrait());

        Search search = new Search(signal.child(), request, pairs);
        try {
            runEvaluators(search);
        } finally {
            search.signal.cancel();
        }

        if (signal.isCancelled()) {
            throw CoordinationException.searchCancelled(request.targetTrait());
        }
        return select(search);
    }

    /**
     * 평가 스레드 종료 (진행 중인 평가는 최대 5초 대기).
     */
    public void shutdown() {
        evaluators.shutdown();
        try {
            if (!evaluators.awaitTermination(5, TimeUnit.SECONDS)) {
                evaluators.shutdownNow();
            }
        } catch (InterruptedException e) {
            evaluators.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ============================================================
    // 평가
    // ============================================================

    private void runEvaluators(Search search) {
        int workers = Math.min(config.evaluatorCount(), search.pairs.size());
        List<Future<?>> futures = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            futures.add(evaluators.submit(() -> evaluate(search)));
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                search.signal.cancel();
                throw CoordinationException.searchCancelled(search.request.targetTrait());
            } catch (ExecutionException e) {
                search.signal.cancel();
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("candidate evaluation failed", cause);
            }
        }
    }

    private void evaluate(Search search) {
        Pair pair;
        while (!search.signal.isCancelled() && (pair = search.queue.poll()) != null) {
            if (pair.distance() > search.bestFeasibleDistance.get()) {
                break;
            }

            search.evaluated.incrementAndGet();
            Candidate candidate = evaluatePair(pair, search.request);
            search.results.add(candidate);
            if (candidate.feasible()) {
                search.bestFeasibleDistance.accumulate(candidate.distance());
            }
        }
    }

    private Candidate evaluatePair(Pair pair, SearchRequest request) {
        int capacity = request.ship().fuelCapacity();
        String site = pair.site().symbol();
        String destination = pair.destination().symbol();

        int estimate = (int) (pair.distance() * 2 * config.prefilterFuelPerDistance());
        if (estimate > capacity) {
            return new Candidate(site, destination, pair.distance(), false, 0, estimate,
                CandidateEvaluation.PREFILTERED);
        }

        Optional<RoutePlan> outbound = route(destination, site, request);
        if (outbound.isEmpty()) {
            return new Candidate(site, destination, pair.distance(), false, 0, estimate,
                CandidateEvaluation.UNROUTABLE);
        }
        Optional<RoutePlan> inbound = route(site, destination, request);
        if (inbound.isEmpty()) {
            return new Candidate(site, destination, pair.distance(), false, 0, estimate,
                CandidateEvaluation.UNROUTABLE);
        }

        int fuel = outbound.get().totalFuelCost() + inbound.get().totalFuelCost();
        int time = outbound.get().totalTimeSeconds() + inbound.get().totalTimeSeconds();
        return new Candidate(site, destination, pair.distance(), fuel <= capacity, time, fuel,
            CandidateEvaluation.ROUTED);
    }

    private Optional<RoutePlan> route(String origin, String destination, SearchRequest request) {
        int capacity = request.ship().fuelCapacity();
        RouteRequest routeRequest = new RouteRequest(
            origin, destination, capacity, capacity, request.ship().engineSpeed(), request.locations());
        try {
            Optional<RoutePlan> plan = routingOracle.planRoute(routeRequest);
            if (plan == null || plan.isEmpty()) {
                log.debug("No route {} -> {}", origin, destination);
                return Optional.empty();
            }
            return plan;
        } catch (RuntimeException e) {
            log.debug("Routing {} -> {} failed: {}", origin, destination, e.getMessage());
            return Optional.empty();
        }
    }

    // ============================================================
    // 선택
    // ============================================================

    private CandidateSelection select(Search search) {
        List<Candidate> results = new ArrayList<>(search.results);
        int evaluated = search.evaluated.get();
        int capacity = search.request.ship().fuelCapacity();

        Optional<Candidate> best = results.stream()
            .filter(Candidate::feasible)
            .min(BY_DISTANCE);
        if (best.isPresent()) {
            Candidate candidate = best.get();
            observer.onCandidateSelected(candidate.siteSymbol(), candidate.destinationSymbol(), true, evaluated);
            log.info("Selected site {} via {} ({}s round trip, fuel {}/{}, {} pairs evaluated)",
                candidate.siteSymbol(), candidate.destinationSymbol(), candidate.roundTripTimeSeconds(),
                candidate.roundTripFuel(), capacity, evaluated);
            return new CandidateSelection(candidate, true, evaluated);
        }

        Optional<Candidate> cheapest = results.stream()
            .filter(candidate -> candidate.evaluation().isSelectable())
            .min(BY_EVALUATION_THEN_FUEL);
        if (!search.request.allowInfeasible() || cheapest.isEmpty()) {
            throw CoordinationException.noFeasibleCandidate(
                "no feasible candidate for " + search.request.targetTrait()
                    + " (requires round-trip fuel <= " + capacity + ", " + evaluated + " pairs evaluated)");
        }

        Candidate candidate = cheapest.get();
        observer.onCandidateSelected(candidate.siteSymbol(), candidate.destinationSymbol(), false, evaluated);
        log.warn("Site {} requires {} fuel for a round trip via {} but capacity is {}; proceeding as requested",
            candidate.siteSymbol(), candidate.roundTripFuel(), candidate.destinationSymbol(), capacity);
        return new CandidateSelection(candidate, false, evaluated);
    }

    private List<Pair> nearestPairs(List<Location> sites, List<Location> destinations) {
        List<Pair> pairs = new ArrayList<>();
        for (Location site : sites) {
            List<Pair> forSite = new ArrayList<>(destinations.size());
            for (Location destination : destinations) {
                forSite.add(new Pair(site, destination, site.distanceTo(destination)));
            }
            forSite.sort(Comparator.comparingDouble(Pair::distance));
            pairs.addAll(forSite.subList(0, Math.min(config.destinationsPerSite(), forSite.size())));
        }
        pairs.sort(Comparator.comparingDouble(Pair::distance));
        return pairs;
    }

    private static List<Location> withTrait(List<Location> locations, String trait) {
        List<Location> matching = new ArrayList<>();
        for (Location location : locations) {
            if (location.hasTrait(trait)) {
                matching.add(location);
            }
        }
        return matching;
    }

    private static ThreadFactory evaluatorThreads() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "candidate-evaluator-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Pair(Location site, Location destination, double distance) {
    }

    /**
     * 한 번의 탐색이 평가 스레드와 공유하는 상태.
     */
    private static final class Search {

        private final CancellationSignal signal;
        private final SearchRequest request;
        private final List<Pair> pairs;
        private final Queue<Pair> queue;
        private final Queue<Candidate> results = new ConcurrentLinkedQueue<>();
        private final AtomicInteger evaluated = new AtomicInteger();
        private final DoubleAccumulator bestFeasibleDistance =
            new DoubleAccumulator(Math::min, Double.POSITIVE_INFINITY);

        private Search(CancellationSignal signal, SearchRequest request, List<Pair> pairs) {
            this.signal = signal;
            this.request = request;
            this.pairs = pairs;
            this.queue = new ConcurrentLinkedQueue<>(pairs);
        }
    }
}
