package com.riansoft.tsp_arena.model;

/**
 * 알고리즘 하나의 실행 결과: 경로, 총 거리, 소요 시간(밀리초).
 */
public class AlgorithmResult {
    public final Route route;
    public final long totalDistance;
    public final double elapsedMs;

    public AlgorithmResult(Route route, long totalDistance, double elapsedMs) {
        this.route = route;
        this.totalDistance = totalDistance;
        this.elapsedMs = elapsedMs;
    }
}
