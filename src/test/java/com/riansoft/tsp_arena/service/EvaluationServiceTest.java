package com.riansoft.tsp_arena.service;

import com.riansoft.tsp_arena.config.ArenaProperties;
import com.riansoft.tsp_arena.exception.InvalidRouteException;
import com.riansoft.tsp_arena.exception.SearchBudgetException;
import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.DistanceModel;
import com.riansoft.tsp_arena.model.EvaluationReport;
import com.riansoft.tsp_arena.model.GameSession;
import com.riansoft.tsp_arena.model.Route;
import com.riansoft.tsp_arena.solver.BruteForceTourSolver;
import com.riansoft.tsp_arena.solver.MstPrimTourSolver;
import com.riansoft.tsp_arena.solver.NearestNeighborTourSolver;
import com.riansoft.tsp_arena.solver.RandomSearchTourSolver;
import com.riansoft.tsp_arena.solver.TourHeuristic;
import com.riansoft.tsp_arena.testutil.DistanceFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static com.riansoft.tsp_arena.testutil.DistanceFixtures.A;
import static org.junit.jupiter.api.Assertions.*;

class EvaluationServiceTest {

    private final CountingHeuristic counting = new CountingHeuristic(true);

    private final EvaluationService evaluationService = new EvaluationService(
            new RouteValidationService(new ArenaProperties()),
            new BruteForceTourSolver(8),
            List.of(new NearestNeighborTourSolver(), new MstPrimTourSolver(),
                    new RandomSearchTourSolver(100, new Random(3)), counting, new CountingHeuristic(false)));

    @Test
    @DisplayName("세 도시 예제: 두 방향 모두 225로 정답 처리된다")
    void bothDirectionsOfTriangleAreCorrect() {
        GameSession session = DistanceFixtures.session(DistanceFixtures.triangle(), A);

        EvaluationReport forward = evaluationService.evaluate(session, List.of("A", "B", "C", "A"));
        EvaluationReport backward = evaluationService.evaluate(session, List.of("A", "C", "B", "A"));

        assertTrue(forward.correct);
        assertTrue(backward.correct);
        assertEquals(225, forward.optimal.totalDistance);
        assertEquals(225, backward.user.totalDistance);
        assertEquals(List.of("A", "B", "C", "A"), backward.optimal.route.names());
    }

    @Test
    @DisplayName("더 긴 경로는 오답이고 최적 경로와 거리가 함께 보고된다")
    void longerRouteIsIncorrect() {
        GameSession session = DistanceFixtures.session(DistanceFixtures.square(), A);

        EvaluationReport report = evaluationService.evaluate(session, List.of("A", "B", "C", "D", "A"));

        assertFalse(report.correct);
        assertEquals(80, report.user.totalDistance);
        assertEquals(67, report.optimal.totalDistance);
        assertEquals(List.of("A", "B", "D", "C", "A"), report.optimal.route.names());
    }

    @Test
    @DisplayName("완전 탐색과 사용 가능한 휴리스틱이 모두 리포트에 들어간다")
    void reportCoversEveryAvailableAlgorithm() {
        GameSession session = DistanceFixtures.session(DistanceFixtures.square(), A);

        EvaluationReport report = evaluationService.evaluate(session, List.of("A", "D", "C", "B", "A"));

        assertEquals(List.of("bruteforce", "nearest_neighbor", "mst_prim", "random_search", "counting"),
                List.copyOf(report.algorithms.keySet()));
        assertSame(report.optimal, report.algorithms.get("bruteforce"));
        report.algorithms.values().forEach(result -> {
            assertTrue(result.elapsedMs >= 0);
            assertTrue(report.optimal.totalDistance <= result.totalDistance);
            assertEquals(result.totalDistance, result.route.distanceIn(session.model));
        });
        assertTrue(report.user.elapsedMs >= 0);
    }

    @Test
    @DisplayName("완전 탐색이 돌려준 경로를 다시 제출하면 정답이다")
    void exactRouteRoundTrips() {
        DistanceModel model = new InstanceGeneratorService(new Random(17)).newInstance(10, 50, 100).model;
        GameSession session = DistanceFixtures.session(model, City.of("E"));

        EvaluationReport first = evaluationService.evaluate(session, List.of("E", "A", "B", "C", "D", "F", "E"));
        EvaluationReport second = evaluationService.evaluate(session, first.optimal.route.names());

        assertTrue(second.correct);
        assertEquals(first.optimal.totalDistance, second.user.totalDistance);
    }

    @Test
    @DisplayName("잘못된 경로면 어떤 솔버도 실행하지 않고 InvalidRouteException")
    void invalidRouteRunsNoSolver() {
        GameSession session = DistanceFixtures.session(DistanceFixtures.square(), A);

        assertThrows(InvalidRouteException.class, () -> evaluationService.evaluate(session, List.of("A", "A")));
        assertThrows(InvalidRouteException.class, () -> evaluationService.evaluate(session, List.of("A", "B", "B", "A")));
        assertEquals(0, counting.calls.get());
    }

    @Test
    @DisplayName("랜덤 탐색 예산이 잘못되면 완전 탐색을 포함해 어떤 솔버도 실행하지 않고 SearchBudgetException")
    void badSearchBudgetFailsBeforeAnySolver() {
        AtomicInteger exactCalls = new AtomicInteger();
        BruteForceTourSolver countingExact = new BruteForceTourSolver(8) {
            @Override
            public Route solve(DistanceModel model, City home, List<City> selected) {
                exactCalls.incrementAndGet();
                return super.solve(model, home, selected);
            }
        };
        CountingHeuristic before = new CountingHeuristic(true);
        EvaluationService misconfigured = new EvaluationService(
                new RouteValidationService(new ArenaProperties()),
                countingExact,
                List.of(before, new RandomSearchTourSolver(0, new Random(1))));
        GameSession session = DistanceFixtures.session(DistanceFixtures.square(), A);

        assertThrows(SearchBudgetException.class,
                () -> misconfigured.evaluate(session, List.of("A", "B", "C", "A")));
        assertEquals(0, exactCalls.get());
        assertEquals(0, before.calls.get());
    }

    /**
     * 호출 횟수를 세는 휴리스틱. 사용 불가로 만들면 평가에서 빠져야 합니다.
     */
    private static class CountingHeuristic implements TourHeuristic {
        private final boolean available;
        private final AtomicInteger calls = new AtomicInteger();

        CountingHeuristic(boolean available) {
            this.available = available;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public String getName() {
            return available ? "counting" : "unavailable";
        }

        @Override
        public String getComplexity() {
            return "O(k)";
        }

        @Override
        public Route solve(DistanceModel model, City home, List<City> selected) {
            calls.incrementAndGet();
            return Route.closed(home, selected);
        }
    }
}
