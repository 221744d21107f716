package com.riansoft.tsp_arena.service;

import com.riansoft.tsp_arena.config.ArenaProperties;
import com.riansoft.tsp_arena.exception.InvalidRouteException;
import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.GameSession;
import com.riansoft.tsp_arena.model.Route;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 플레이어가 제출한 경로를 검사합니다. 통과하지 못하면 어떤 솔버도 실행되지 않습니다.
 */
@Service
public class RouteValidationService {

    private final int maxSelectedCities;

    @Autowired
    public RouteValidationService(ArenaProperties properties) {
        this.maxSelectedCities = properties.getMaxSelectedCities();
    }

    /**
     * @param session        제출 대상 세션
     * @param submittedRoute 집에서 시작해 집으로 끝나는 도시 이름 목록
     * @return 검증된 경로
     * @throws InvalidRouteException 규칙 위반 시
     */
    public Route validate(GameSession session, List<String> submittedRoute) {
        String home = session.homeCity.name;
        if (submittedRoute == null || submittedRoute.size() < 2) {
            throw new InvalidRouteException("Route must start and end at home city " + home + ".");
        }

        List<City> stops = new ArrayList<>(submittedRoute.size());
        for (String name : submittedRoute) {
            City city = City.of(name);
            if (city == null || !session.model.contains(city)) {
                throw new InvalidRouteException("Unknown city '" + name + "'.");
            }
            stops.add(city);
        }

        if (stops.get(0) != session.homeCity || stops.get(stops.size() - 1) != session.homeCity) {
            throw new InvalidRouteException("Route must start and end at home city " + home + ".");
        }

        List<City> visits = stops.subList(1, stops.size() - 1);
        if (visits.isEmpty()) {
            throw new InvalidRouteException("Choose at least one city to visit.");
        }
        if (visits.size() > maxSelectedCities) {
            throw new InvalidRouteException("You can choose up to " + maxSelectedCities + " cities.");
        }

        Set<City> seen = new HashSet<>();
        for (City city : visits) {
            if (city == session.homeCity) {
                throw new InvalidRouteException("Home city " + home + " may only appear at the start and the end.");
            }
            if (!seen.add(city)) {
                throw new InvalidRouteException("City " + city + " appears more than once.");
            }
        }
        return new Route(stops);
    }
}
