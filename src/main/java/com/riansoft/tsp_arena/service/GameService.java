package com.riansoft.tsp_arena.service;

import com.riansoft.tsp_arena.config.ArenaProperties;
import com.riansoft.tsp_arena.dto.CheckAnswerRequestDto;
import com.riansoft.tsp_arena.dto.CheckAnswerResponseDto;
import com.riansoft.tsp_arena.dto.NewGameResponseDto;
import com.riansoft.tsp_arena.exception.InvalidRouteException;
import com.riansoft.tsp_arena.exception.SessionNotFoundException;
import com.riansoft.tsp_arena.model.EvaluationReport;
import com.riansoft.tsp_arena.model.GameSession;
import com.riansoft.tsp_arena.model.GeneratedInstance;
import com.riansoft.tsp_arena.solver.BruteForceTourSolver;
import com.riansoft.tsp_arena.solver.TourHeuristic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 컨트롤러가 호출하는 두 가지 작업(새 게임, 정답 확인)과 복잡도 안내를 묶습니다.
 */
@Service
public class GameService {

    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    private final ArenaProperties properties;
    private final InstanceGeneratorService instanceGenerator;
    private final SessionStore sessionStore;
    private final EvaluationService evaluationService;
    private final SolutionFormatterService formatter;
    private final Map<String, String> complexity;

    @Autowired
    public GameService(ArenaProperties properties, InstanceGeneratorService instanceGenerator,
                       SessionStore sessionStore, EvaluationService evaluationService,
                       SolutionFormatterService formatter, BruteForceTourSolver exactSolver,
                       List<TourHeuristic> heuristics) {
        this.properties = properties;
        this.instanceGenerator = instanceGenerator;
        this.sessionStore = sessionStore;
        this.evaluationService = evaluationService;
        this.formatter = formatter;

        Map<String, String> table = new LinkedHashMap<>();
        table.put(exactSolver.getName(), exactSolver.getComplexity());
        heuristics.forEach(h -> table.put(h.getName(), h.getComplexity()));
        this.complexity = Collections.unmodifiableMap(table);
    }

    public NewGameResponseDto startNewGame() {
        GeneratedInstance instance = instanceGenerator.newInstance(
                properties.getPoolSize(), properties.getMinDistance(), properties.getMaxDistance());
        GameSession session = sessionStore.create(instance.model, instance.homeCity, instance.model.getCities());
        log.info("[NEW-GAME] 세션 #{} 생성 (도시 {}개, 집 {})", session.id, instance.model.size(), instance.homeCity);
        return formatter.formatNewGame(session);
    }

    public CheckAnswerResponseDto checkAnswer(CheckAnswerRequestDto request) {
        if (request == null || request.getSessionId() == null || request.getSessionId().isBlank()) {
            throw new SessionNotFoundException("Start a new game first.");
        }
        GameSession session = sessionStore.get(request.getSessionId());
        EvaluationReport report = evaluationService.evaluate(session, submittedRoute(request, session));
        return formatter.formatEvaluation(report, request.getPlayerName());
    }

    public Map<String, String> getComplexity() {
        return complexity;
    }

    // route가 우선, 없으면 routeBetween 앞뒤에 집을 붙입니다.
    private List<String> submittedRoute(CheckAnswerRequestDto request, GameSession session) {
        if (request.getRoute() != null) {
            return request.getRoute();
        }
        if (request.getRouteBetween() == null) {
            throw new InvalidRouteException("Build a route by clicking on selected cities.");
        }
        List<String> route = new ArrayList<>(request.getRouteBetween().size() + 2);
        route.add(session.homeCity.name);
        route.addAll(request.getRouteBetween());
        route.add(session.homeCity.name);
        return route;
    }
}
