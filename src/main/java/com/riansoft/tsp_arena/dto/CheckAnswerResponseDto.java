package com.riansoft.tsp_arena.dto;

import java.util.List;
import java.util.Map;

public class CheckAnswerResponseDto {
    private boolean correct;
    private String message;
    private List<String> yourRoute;
    private long yourDistance;
    private List<String> optimalRoute;
    private long optimalDistance;
    private Map<String, AlgorithmResultDto> algorithms;

    public CheckAnswerResponseDto() {}

    public CheckAnswerResponseDto(boolean correct, String message, List<String> yourRoute, long yourDistance,
                                  List<String> optimalRoute, long optimalDistance,
                                  Map<String, AlgorithmResultDto> algorithms) {
        this.correct = correct;
        this.message = message;
        this.yourRoute = yourRoute;
        this.yourDistance = yourDistance;
        this.optimalRoute = optimalRoute;
        this.optimalDistance = optimalDistance;
        this.algorithms = algorithms;
    }

    // --- Getters and Setters ---
    public boolean isCorrect() { return correct; }
    public void setCorrect(boolean correct) { this.correct = correct; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public List<String> getYourRoute() { return yourRoute; }
    public void setYourRoute(List<String> yourRoute) { this.yourRoute = yourRoute; }
    public long getYourDistance() { return yourDistance; }
    public void setYourDistance(long yourDistance) { this.yourDistance = yourDistance; }
    public List<String> getOptimalRoute() { return optimalRoute; }
    public void setOptimalRoute(List<String> optimalRoute) { this.optimalRoute = optimalRoute; }
    public long getOptimalDistance() { return optimalDistance; }
    public void setOptimalDistance(long optimalDistance) { this.optimalDistance = optimalDistance; }
    public Map<String, AlgorithmResultDto> getAlgorithms() { return algorithms; }
    public void setAlgorithms(Map<String, AlgorithmResultDto> algorithms) { this.algorithms = algorithms; }
}
