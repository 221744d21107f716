package com.riansoft.tsp_arena.solver;

import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.DistanceModel;
import com.riansoft.tsp_arena.model.Route;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * 현재 위치에서 가장 가까운 미방문 도시로 계속 이동합니다.
 * 거리가 같으면 도시 순서(A, B, ...)가 앞선 쪽을 고릅니다.
 */
@Component
@Order(1)
public class NearestNeighborTourSolver implements TourHeuristic {

    public static final String NAME = "nearest_neighbor";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getComplexity() {
        return "O(k^2): always hops to the closest unvisited city. Very fast, no optimality guarantee.";
    }

    @Override
    public Route solve(DistanceModel model, City home, List<City> selected) {
        TreeSet<City> unvisited = new TreeSet<>(selected);
        List<City> visits = new ArrayList<>(selected.size());
        City current = home;
        while (!unvisited.isEmpty()) {
            City nearest = null;
            int nearestDistance = Integer.MAX_VALUE;
            // TreeSet 순회 순서 = 도시 순서이므로 엄격한 비교로 동점이 해결됩니다.
            for (City candidate : unvisited) {
                int d = model.distance(current, candidate);
                if (d < nearestDistance) {
                    nearest = candidate;
                    nearestDistance = d;
                }
            }
            visits.add(nearest);
            unvisited.remove(nearest);
            current = nearest;
        }
        return Route.closed(home, visits);
    }
}
