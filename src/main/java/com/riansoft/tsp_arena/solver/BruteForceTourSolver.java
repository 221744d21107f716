package com.riansoft.tsp_arena.solver;

import com.riansoft.tsp_arena.exception.InvalidRouteException;
import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.DistanceModel;
import com.riansoft.tsp_arena.model.Route;

import java.util.ArrayList;
import java.util.List;

/**
 * 모든 순열을 확인하는 완전 탐색. 항상 최단 경로를 찾습니다.
 * <p>
 * 순열은 사전식 순서(인덱스 기준)로 나열되며, 같은 거리라면 먼저 나온 순열이 결과가 됩니다.
 * 비용이 O(k!)이므로 방문 도시 수를 {@code maxCities} 이하로 제한합니다.
 */
public class BruteForceTourSolver implements TourSolver {

    public static final String NAME = "bruteforce";

    private final int maxCities;

    public BruteForceTourSolver(int maxCities) {
        this.maxCities = maxCities;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getComplexity() {
        return "O(k! * k): tries every ordering of the k chosen cities. Always optimal, "
                + "but 8 cities already means 40,320 tours.";
    }

    @Override
    public Route solve(DistanceModel model, City home, List<City> selected) {
        int k = selected.size();
        if (k == 0) {
            throw new InvalidRouteException("Choose at least one city to visit.");
        }
        if (k > maxCities) {
            throw new InvalidRouteException("You can choose up to " + maxCities + " cities.");
        }

        // 자주 쓰는 거리는 미리 배열로 꺼내둡니다.
        long[] fromHome = new long[k];
        long[] toHome = new long[k];
        long[][] between = new long[k][k];
        for (int i = 0; i < k; i++) {
            fromHome[i] = model.distance(home, selected.get(i));
            toHome[i] = model.distance(selected.get(i), home);
            for (int j = 0; j < k; j++) {
                between[i][j] = model.distance(selected.get(i), selected.get(j));
            }
        }

        int[] perm = new int[k];
        for (int i = 0; i < k; i++) perm[i] = i;

        int[] best = perm.clone();
        long bestDistance = Long.MAX_VALUE;
        do {
            long total = fromHome[perm[0]] + toHome[perm[k - 1]];
            for (int i = 0; i < k - 1 && total < bestDistance; i++) {
                total += between[perm[i]][perm[i + 1]];
            }
            if (total < bestDistance) {
                bestDistance = total;
                best = perm.clone();
            }
        } while (nextPermutation(perm));

        List<City> visits = new ArrayList<>(k);
        for (int i : best) visits.add(selected.get(i));
        return Route.closed(home, visits);
    }

    /**
     * 배열을 사전식 다음 순열로 바꿉니다. 마지막 순열이었다면 {@code false}.
     */
    static boolean nextPermutation(int[] a) {
        int i = a.length - 2;
        while (i >= 0 && a[i] >= a[i + 1]) i--;
        if (i < 0) return false;
        int j = a.length - 1;
        while (a[j] <= a[i]) j--;
        swap(a, i, j);
        for (int l = i + 1, r = a.length - 1; l < r; l++, r--) {
            swap(a, l, r);
        }
        return true;
    }

    private static void swap(int[] a, int i, int j) {
        int t = a[i];
        a[i] = a[j];
        a[j] = t;
    }
}
