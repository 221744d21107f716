package com.riansoft.tsp_arena.service;

import com.riansoft.tsp_arena.dto.AlgorithmResultDto;
import com.riansoft.tsp_arena.dto.CheckAnswerResponseDto;
import com.riansoft.tsp_arena.dto.NewGameResponseDto;
import com.riansoft.tsp_arena.model.AlgorithmResult;
import com.riansoft.tsp_arena.model.EvaluationReport;
import com.riansoft.tsp_arena.model.GameSession;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 내부 모델을 API 응답 DTO로 변환합니다.
 */
@Service
public class SolutionFormatterService {

    public NewGameResponseDto formatNewGame(GameSession session) {
        return new NewGameResponseDto(
                session.id,
                session.cities.stream().map(c -> c.name).collect(Collectors.toList()),
                session.homeCity.name,
                session.model.getMatrix());
    }

    public CheckAnswerResponseDto formatEvaluation(EvaluationReport report, String playerName) {
        Map<String, AlgorithmResultDto> algorithms = new LinkedHashMap<>();
        for (Map.Entry<String, AlgorithmResult> entry : report.algorithms.entrySet()) {
            algorithms.put(entry.getKey(), toDto(entry.getValue()));
        }
        return new CheckAnswerResponseDto(
                report.correct,
                buildMessage(report, playerName),
                report.user.route.names(),
                report.user.totalDistance,
                report.optimal.route.names(),
                report.optimal.totalDistance,
                algorithms);
    }

    String buildMessage(EvaluationReport report, String playerName) {
        String greeting = (playerName == null || playerName.isBlank()) ? "" : playerName.trim() + ", ";
        if (report.correct) {
            return greeting + "perfect route! " + report.user.totalDistance + " km is the shortest possible tour.";
        }
        long gap = report.user.totalDistance - report.optimal.totalDistance;
        return greeting + "a better path exists. Your route is " + report.user.totalDistance
                + " km, the optimum is " + report.optimal.totalDistance + " km (" + gap + " km shorter).";
    }

    private AlgorithmResultDto toDto(AlgorithmResult result) {
        return new AlgorithmResultDto(result.route.names(), result.totalDistance, result.elapsedMs);
    }
}
