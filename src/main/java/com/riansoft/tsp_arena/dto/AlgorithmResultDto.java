package com.riansoft.tsp_arena.dto;

import java.util.List;

public class AlgorithmResultDto {
    private List<String> route;
    private long distance;
    private double durationMs;

    public AlgorithmResultDto() {}

    public AlgorithmResultDto(List<String> route, long distance, double durationMs) {
        this.route = route;
        this.distance = distance;
        this.durationMs = durationMs;
    }

    public List<String> getRoute() { return route; }
    public void setRoute(List<String> route) { this.route = route; }
    public long getDistance() { return distance; }
    public void setDistance(long distance) { this.distance = distance; }
    public double getDurationMs() { return durationMs; }
    public void setDurationMs(double durationMs) { this.durationMs = durationMs; }
}
