package com.riansoft.tsp_arena.solver;

import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.DistanceModel;
import com.riansoft.tsp_arena.model.Route;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 최소 신장 트리(Prim) 기반 경로.
 * <ol>
 *   <li>집 도시에서 시작해 트리와 바깥 정점을 잇는 가장 짧은 간선을 하나씩 추가합니다.
 *       동점이면 도시 순서가 앞선 정점을 먼저 붙입니다.</li>
 *   <li>집에서 전위 순회합니다. 자식은 (부모와의 간선 길이, 도시 순서)로 정렬합니다.</li>
 *   <li>방문 순서대로 잇고 집으로 돌아옵니다.</li>
 * </ol>
 * 삼각 부등식이 성립하는 행렬에서는 최적의 2배 이내가 보장됩니다.
 */
@Component
@Order(2)
public class MstPrimTourSolver implements TourHeuristic {

    public static final String NAME = "mst_prim";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getComplexity() {
        return "O(k^2): builds a minimum spanning tree with Prim's algorithm and walks it in pre-order. "
                + "Within 2x of optimal when distances obey the triangle inequality.";
    }

    @Override
    public Route solve(DistanceModel model, City home, List<City> selected) {
        // 정점 0 = 집, 나머지는 도시 순서대로
        List<City> vertices = new ArrayList<>(selected.size() + 1);
        vertices.add(home);
        selected.stream().sorted().forEach(vertices::add);
        int n = vertices.size();

        long[] key = new long[n];
        int[] parent = new int[n];
        boolean[] inTree = new boolean[n];
        Arrays.fill(key, Long.MAX_VALUE);
        Arrays.fill(parent, -1);
        key[0] = 0;

        List<List<Integer>> children = new ArrayList<>(n);
        for (int i = 0; i < n; i++) children.add(new ArrayList<>());

        for (int step = 0; step < n; step++) {
            int u = -1;
            for (int v = 0; v < n; v++) {
                if (!inTree[v] && (u == -1 || key[v] < key[u])) {
                    u = v;
                }
            }
            inTree[u] = true;
            if (parent[u] != -1) {
                children.get(parent[u]).add(u);
            }
            for (int v = 0; v < n; v++) {
                if (inTree[v]) continue;
                long w = model.distance(vertices.get(u), vertices.get(v));
                if (w < key[v]) {
                    key[v] = w;
                    parent[v] = u;
                }
            }
        }

        // key[v]는 트리에 붙을 때 사용된 간선 길이 = 부모와의 거리
        Comparator<Integer> childOrder = Comparator.<Integer>comparingLong(v -> key[v])
                .thenComparing(vertices::get);
        for (List<Integer> list : children) {
            list.sort(childOrder);
        }

        List<City> visits = new ArrayList<>(n - 1);
        preOrder(0, children, vertices, visits);
        visits.remove(0); // 집
        return Route.closed(home, visits);
    }

    private void preOrder(int vertex, List<List<Integer>> children, List<City> vertices, List<City> out) {
        out.add(vertices.get(vertex));
        for (int child : children.get(vertex)) {
            preOrder(child, children, vertices, out);
        }
    }
}
