package com.riansoft.tsp_arena.service;

import com.riansoft.tsp_arena.model.AlgorithmResult;
import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.DistanceModel;
import com.riansoft.tsp_arena.model.EvaluationReport;
import com.riansoft.tsp_arena.model.GameSession;
import com.riansoft.tsp_arena.model.Route;
import com.riansoft.tsp_arena.solver.BruteForceTourSolver;
import com.riansoft.tsp_arena.solver.TourHeuristic;
import com.riansoft.tsp_arena.solver.TourSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 제출 경로를 검증하고, 완전 탐색과 모든 휴리스틱을 같은 입력으로 돌려 비교 리포트를 만듭니다.
 * 경로 검증과 휴리스틱 설정 검사를 모두 통과해야 첫 솔버가 실행됩니다.
 * 시간은 각 알고리즘의 풀이 단계만 측정합니다.
 */
@Service
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    private final RouteValidationService validationService;
    private final BruteForceTourSolver exactSolver;
    private final List<TourHeuristic> heuristics;

    @Autowired
    public EvaluationService(RouteValidationService validationService, BruteForceTourSolver exactSolver,
                             List<TourHeuristic> heuristics) {
        this.validationService = validationService;
        this.exactSolver = exactSolver;
        this.heuristics = List.copyOf(heuristics);
    }

    public EvaluationReport evaluate(GameSession session, List<String> submittedRoute) {
        Route userRoute = validationService.validate(session, submittedRoute);
        DistanceModel model = session.model;
        City home = session.homeCity;
        List<City> selected = userRoute.getStops().subList(1, userRoute.getStops().size() - 1).stream()
                .sorted()
                .collect(Collectors.toList());

        List<TourHeuristic> runnable = new ArrayList<>(heuristics.size());
        for (TourHeuristic heuristic : heuristics) {
            if (!heuristic.isAvailable()) {
                log.warn("[EVALUATE] '{}' 알고리즘을 사용할 수 없어 건너뜁니다.", heuristic.getName());
                continue;
            }
            heuristic.checkConfiguration();
            runnable.add(heuristic);
        }

        log.info("[EVALUATE] 세션 #{} 평가 시작: 제출 경로 {} (방문 도시 {}개)", session.id, userRoute, selected.size());

        long userStart = System.nanoTime();
        long userDistance = userRoute.distanceIn(model);
        AlgorithmResult user = new AlgorithmResult(userRoute, userDistance, elapsedMs(userStart));

        Map<String, AlgorithmResult> algorithms = new LinkedHashMap<>();
        AlgorithmResult optimal = run(exactSolver, model, home, selected);
        algorithms.put(exactSolver.getName(), optimal);
        for (TourHeuristic heuristic : runnable) {
            algorithms.put(heuristic.getName(), run(heuristic, model, home, selected));
        }

        boolean correct = userDistance == optimal.totalDistance;
        log.info("[EVALUATE] 세션 #{} 평가 완료: 제출 {} / 최적 {} -> {}",
                session.id, userDistance, optimal.totalDistance, correct ? "정답" : "오답");
        return new EvaluationReport(user, optimal, correct, algorithms);
    }

    private AlgorithmResult run(TourSolver solver, DistanceModel model, City home, List<City> selected) {
        AlgorithmResult result = timed(model, () -> solver.solve(model, home, selected));
        log.debug("[SOLVER] {}: {} = {} ({} ms)", solver.getName(), result.route, result.totalDistance, result.elapsedMs);
        return result;
    }

    private static AlgorithmResult timed(DistanceModel model, Supplier<Route> step) {
        long start = System.nanoTime();
        Route route = step.get();
        double elapsed = elapsedMs(start);
        return new AlgorithmResult(route, route.distanceIn(model), elapsed);
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
