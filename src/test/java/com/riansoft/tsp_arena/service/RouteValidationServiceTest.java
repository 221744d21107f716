package com.riansoft.tsp_arena.service;

import com.riansoft.tsp_arena.config.ArenaProperties;
import com.riansoft.tsp_arena.exception.InvalidRouteException;
import com.riansoft.tsp_arena.model.GameSession;
import com.riansoft.tsp_arena.model.Route;
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

class RouteValidationServiceTest {

    private final RouteValidationService validationService = new RouteValidationService(new ArenaProperties());
    private final GameSession session = DistanceFixtures.session(DistanceFixtures.square(), A);

    @Test
    @DisplayName("올바른 경로는 도시 목록으로 변환된다")
    void acceptsValidRoute() {
        Route route = validationService.validate(session, List.of("A", "C", "B", "A"));

        assertEquals(List.of(A, C, B, A), route.getStops());
    }

    @Test
    @DisplayName("집에서 시작하거나 끝나지 않으면 거부한다")
    void mustStartAndEndAtHome() {
        assertInvalid(List.of("B", "C", "A"), "Route must start and end at home city A.");
        assertInvalid(List.of("A", "C", "B"), "Route must start and end at home city A.");
        assertInvalid(List.of("A"), "Route must start and end at home city A.");
        assertInvalid(null, "Route must start and end at home city A.");
    }

    @Test
    @DisplayName("방문 도시가 없으면 거부한다")
    void emptySelection() {
        assertInvalid(List.of("A", "A"), "Choose at least one city to visit.");
    }

    @Test
    @DisplayName("중복 방문과 중간의 집 도시를 거부한다")
    void duplicates() {
        assertInvalid(List.of("A", "B", "C", "B", "A"), "City B appears more than once.");
        assertInvalid(List.of("A", "B", "A", "C", "A"), "Home city A may only appear at the start and the end.");
    }

    @Test
    @DisplayName("인스턴스에 없는 도시를 거부한다")
    void unknownCities() {
        assertInvalid(List.of("A", "E", "A"), "Unknown city 'E'.");
        assertInvalid(List.of("A", "zz", "A"), "Unknown city 'zz'.");
        assertInvalid(List.of("A", "B", "A", "X"), "Unknown city 'X'.");
    }

    @Test
    @DisplayName("선택 도시 수가 상한을 넘으면 거부한다")
    void tooManyCities() {
        GameSession big = DistanceFixtures.session(
                new InstanceGeneratorService(new Random(1)).newInstance(10, 50, 100).model, A);
        List<String> nine = List.of("A", "B", "C", "D", "E", "F", "G", "H", "I", "J", "A");
        List<String> eight = List.of("A", "B", "C", "D", "E", "F", "G", "H", "I", "A");

        assertThrows(InvalidRouteException.class, () -> validationService.validate(big, nine));
        assertEquals(10, validationService.validate(big, eight).getStops().size());
    }

    private void assertInvalid(List<String> route, String message) {
        InvalidRouteException e = assertThrows(InvalidRouteException.class, () -> validationService.validate(session, route));
        assertEquals(message, e.getMessage());
    }
}
