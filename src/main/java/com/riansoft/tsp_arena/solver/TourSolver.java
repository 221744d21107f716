package com.riansoft.tsp_arena.solver;

import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.DistanceModel;
import com.riansoft.tsp_arena.model.Route;

import java.util.List;

/**
 * 집 도시와 방문할 도시 목록이 주어졌을 때 닫힌 경로 하나를 만드는 알고리즘.
 */
public interface TourSolver {

    /**
     * 응답의 {@code algorithms} 맵에 쓰이는 키 (예: {@code nearest_neighbor}).
     */
    String getName();

    /**
     * 사람이 읽는 시간 복잡도 설명.
     */
    String getComplexity();

    /**
     * @param model    거리 행렬
     * @param home     출발/도착 도시
     * @param selected 집을 제외한 방문 도시 (중복 없음)
     * @return {@code home}으로 시작하고 끝나는 경로
     */
    Route solve(DistanceModel model, City home, List<City> selected);
}
