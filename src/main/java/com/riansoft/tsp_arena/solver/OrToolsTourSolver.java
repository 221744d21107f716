package com.riansoft.tsp_arena.solver;

import com.google.ortools.Loader;
import com.google.ortools.constraintsolver.Assignment;
import com.google.ortools.constraintsolver.FirstSolutionStrategy;
import com.google.ortools.constraintsolver.RoutingIndexManager;
import com.google.ortools.constraintsolver.RoutingModel;
import com.google.ortools.constraintsolver.RoutingSearchParameters;
import com.google.ortools.constraintsolver.main;
import com.google.protobuf.Duration;
import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.DistanceModel;
import com.riansoft.tsp_arena.model.Route;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Google OR-Tools 라우팅 솔버를 차량 1대짜리 TSP로 사용합니다.
 * 노드 0이 집(차고지)이고 나머지는 방문 도시입니다.
 */
public class OrToolsTourSolver implements TourHeuristic {

    private static final Logger log = LoggerFactory.getLogger(OrToolsTourSolver.class);

    public static final String NAME = "ortools";

    private final long timeLimitMs;
    private volatile boolean available;

    public OrToolsTourSolver(long timeLimitMs) {
        this.timeLimitMs = timeLimitMs;
    }

    @PostConstruct
    public void init() {
        try {
            log.info("[SOLVER] Google OR-Tools 네이티브 라이브러리 로드를 시도합니다...");
            Loader.loadNativeLibraries();
            available = true;
            log.info("[SOLVER] 라이브러리 로드 성공!");
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            available = false;
            log.error("[SOLVER] OR-Tools 라이브러리 로드 실패. '{}' 알고리즘은 평가에서 제외됩니다.", NAME, e);
        }
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getComplexity() {
        return "Heuristic, time-limited (" + timeLimitMs + " ms): Google OR-Tools routing solver, "
                + "cheapest-arc construction followed by local search.";
    }

    @Override
    public Route solve(DistanceModel model, City home, List<City> selected) {
        if (selected.isEmpty()) {
            return Route.closed(home, selected);
        }
        List<City> nodes = new ArrayList<>(selected.size() + 1);
        nodes.add(home);
        nodes.addAll(selected);

        long[][] distances = new long[nodes.size()][nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            for (int j = 0; j < nodes.size(); j++) {
                distances[i][j] = model.distance(nodes.get(i), nodes.get(j));
            }
        }

        RoutingIndexManager manager = new RoutingIndexManager(nodes.size(), 1, 0);
        RoutingModel routing = new RoutingModel(manager);
        final int transitCallbackIndex = routing.registerTransitCallback(
                (long fromIndex, long toIndex) -> distances[manager.indexToNode(fromIndex)][manager.indexToNode(toIndex)]);
        routing.setArcCostEvaluatorOfAllVehicles(transitCallbackIndex);

        RoutingSearchParameters searchParameters = main.defaultRoutingSearchParameters().toBuilder()
                .setFirstSolutionStrategy(FirstSolutionStrategy.Value.PATH_CHEAPEST_ARC)
                .setTimeLimit(Duration.newBuilder()
                        .setSeconds(timeLimitMs / 1000)
                        .setNanos((int) (timeLimitMs % 1000) * 1_000_000)
                        .build())
                .build();

        Assignment solution = routing.solveWithParameters(searchParameters);
        if (solution == null) {
            log.warn("[SOLVER] OR-Tools 해를 찾지 못했습니다 (status={}). 선택 순서를 그대로 사용합니다.", routing.status());
            return Route.closed(home, selected);
        }

        List<City> visits = new ArrayList<>(selected.size());
        long index = solution.value(routing.nextVar(routing.start(0)));
        while (!routing.isEnd(index)) {
            visits.add(nodes.get(manager.indexToNode(index)));
            index = solution.value(routing.nextVar(index));
        }
        return Route.closed(home, visits);
    }
}
