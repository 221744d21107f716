package com.riansoft.tsp_arena.dto;

import java.util.List;

public class NewGameResponseDto {
    private String sessionId;
    private List<String> cities;
    private String homeCity;
    // distanceMatrix[i][j]는 cities[i], cities[j] 순서와 일치
    private int[][] distanceMatrix;

    public NewGameResponseDto() {}

    public NewGameResponseDto(String sessionId, List<String> cities, String homeCity, int[][] distanceMatrix) {
        this.sessionId = sessionId;
        this.cities = cities;
        this.homeCity = homeCity;
        this.distanceMatrix = distanceMatrix;
    }

    // --- Getters and Setters ---
    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public List<String> getCities() { return cities; }
    public void setCities(List<String> cities) { this.cities = cities; }
    public String getHomeCity() { return homeCity; }
    public void setHomeCity(String homeCity) { this.homeCity = homeCity; }
    public int[][] getDistanceMatrix() { return distanceMatrix; }
    public void setDistanceMatrix(int[][] distanceMatrix) { this.distanceMatrix = distanceMatrix; }
}
