package com.riansoft.tsp_arena.solver;

import com.riansoft.tsp_arena.exception.InvalidRouteException;
import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.DistanceModel;
import com.riansoft.tsp_arena.model.Route;
import com.riansoft.tsp_arena.service.InstanceGeneratorService;
import com.riansoft.tsp_arena.testutil.DistanceFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.riansoft.tsp_arena.testutil.DistanceFixtures.A;
import static com.riansoft.tsp_arena.testutil.DistanceFixtures.B;
import static com.riansoft.tsp_arena.testutil.DistanceFixtures.C;
import static com.riansoft.tsp_arena.testutil.DistanceFixtures.D;
import static org.junit.jupiter.api.Assertions.*;

class BruteForceTourSolverTest {

    private final BruteForceTourSolver solver = new BruteForceTourSolver(8);

    @Test
    @DisplayName("세 도시 예제: 동점이면 먼저 나열된 A→B→C→A (225)")
    void triangleTieResolvedByEnumerationOrder() {
        DistanceModel model = DistanceFixtures.triangle();

        Route route = solver.solve(model, A, List.of(B, C));

        assertEquals(Route.closed(A, List.of(B, C)), route);
        assertEquals(225, route.distanceIn(model));
    }

    @Test
    @DisplayName("네 도시 예제: 최단 경로 A→B→D→C→A (67)")
    void squareOptimum() {
        DistanceModel model = DistanceFixtures.square();

        Route route = solver.solve(model, A, List.of(B, C, D));

        assertEquals(Route.closed(A, List.of(B, D, C)), route);
        assertEquals(67, route.distanceIn(model));
    }

    @Test
    @DisplayName("도시 하나면 집→도시→집")
    void singleCity() {
        Route route = solver.solve(DistanceFixtures.square(), C, List.of(D));

        assertEquals(List.of(C, D, C), route.getStops());
    }

    @Test
    @DisplayName("방문 도시가 없거나 상한을 넘으면 InvalidRouteException")
    void rejectsEmptyAndOversizedSelections() {
        DistanceModel model = DistanceFixtures.square();

        assertThrows(InvalidRouteException.class, () -> solver.solve(model, A, List.of()));
        assertThrows(InvalidRouteException.class,
                () -> new BruteForceTourSolver(2).solve(model, A, List.of(B, C, D)));
    }

    @Test
    @DisplayName("사전식 순열 나열은 k!개를 정확히 돈다")
    void nextPermutationEnumeratesAll() {
        int[] perm = {0, 1, 2, 3};
        int count = 1;
        while (BruteForceTourSolver.nextPermutation(perm)) count++;

        assertEquals(24, count);
        assertArrayEquals(new int[]{3, 2, 1, 0}, perm);
    }

    @Test
    @DisplayName("8개 도시도 모든 도시를 한 번씩 방문하는 경로를 반환한다")
    void eightCitiesVisitEachOnce() {
        DistanceModel model = new InstanceGeneratorService(new Random(11))
                .newInstance(10, 50, 100).model;
        List<City> selected = City.pool(9).subList(1, 9);

        Route route = solver.solve(model, A, selected);

        assertEquals(10, route.getStops().size());
        assertEquals(A, route.getStops().get(0));
        assertEquals(A, route.getStops().get(9));
        assertTrue(route.getStops().subList(1, 9).containsAll(selected));
    }
}
