package com.riansoft.tsp_arena.solver;

import com.riansoft.tsp_arena.exception.SearchBudgetException;
import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.DistanceModel;
import com.riansoft.tsp_arena.model.Route;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 무작위 순열을 {@code budget}개 뽑아 가장 짧은 것을 고르는 몬테카를로 기준선.
 * 같은 시드와 같은 인스턴스라면 결과가 항상 같습니다.
 */
public class RandomSearchTourSolver implements TourHeuristic {

    public static final String NAME = "random_search";

    private final int budget;
    private final Random seedSource;

    /**
     * @param budget     평가할 순열 수
     * @param seedSource 호출마다 새 시드를 뽑을 난수원
     */
    public RandomSearchTourSolver(int budget, Random seedSource) {
        this.budget = budget;
        this.seedSource = seedSource;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getComplexity() {
        return "O(b * k): samples b random orderings (b = " + budget + ") and keeps the best one. "
                + "Quality depends on luck and budget.";
    }

    @Override
    public Route solve(DistanceModel model, City home, List<City> selected) {
        return solve(model, home, selected, seedSource.nextLong());
    }

    @Override
    public void checkConfiguration() {
        if (budget <= 0) {
            throw new SearchBudgetException("Random search budget must be positive, got " + budget + ".");
        }
    }

    public Route solve(DistanceModel model, City home, List<City> selected, long seed) {
        checkConfiguration();
        Random random = new Random(seed);
        List<City> candidate = new ArrayList<>(selected);
        List<City> best = new ArrayList<>(selected);
        long bestDistance = Long.MAX_VALUE;
        for (int i = 0; i < budget; i++) {
            Collections.shuffle(candidate, random);
            long total = tourDistance(model, home, candidate);
            if (total < bestDistance) {
                bestDistance = total;
                best = new ArrayList<>(candidate);
            }
        }
        return Route.closed(home, best);
    }

    public int getBudget() {
        return budget;
    }

    private static long tourDistance(DistanceModel model, City home, List<City> visits) {
        if (visits.isEmpty()) return 0;
        long total = model.distance(home, visits.get(0));
        for (int i = 0; i < visits.size() - 1; i++) {
            total += model.distance(visits.get(i), visits.get(i + 1));
        }
        return total + model.distance(visits.get(visits.size() - 1), home);
    }
}
