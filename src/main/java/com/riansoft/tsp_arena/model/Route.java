package com.riansoft.tsp_arena.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 집 도시에서 출발해 집 도시로 돌아오는 닫힌 경로.
 */
public final class Route {

    private final List<City> stops;

    public Route(List<City> stops) {
        this.stops = Collections.unmodifiableList(new ArrayList<>(stops));
    }

    /**
     * {@code home → visits... → home} 형태의 경로를 만듭니다.
     */
    public static Route closed(City home, List<City> visits) {
        List<City> stops = new ArrayList<>(visits.size() + 2);
        stops.add(home);
        stops.addAll(visits);
        stops.add(home);
        return new Route(stops);
    }

    public List<City> getStops() {
        return stops;
    }

    public List<String> names() {
        return stops.stream().map(c -> c.name).collect(Collectors.toList());
    }

    public long distanceIn(DistanceModel model) {
        return model.routeDistance(stops);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return stops.equals(((Route) o).stops);
    }

    @Override
    public int hashCode() {
        return stops.hashCode();
    }

    @Override
    public String toString() {
        return names().stream().collect(Collectors.joining(" -> "));
    }
}
