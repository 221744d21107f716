package com.riansoft.tsp_arena.dto;

import java.util.List;

/**
 * 제출 요청. {@code route}(집→...→집) 또는 {@code routeBetween}(집 제외) 중 하나를 보냅니다.
 * 둘 다 있으면 {@code route}를 사용합니다.
 */
public class CheckAnswerRequestDto {
    private String sessionId;
    private String playerName;
    private List<String> route;
    private List<String> routeBetween;

    // Getters and Setters
    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public String getPlayerName() { return playerName; }
    public void setPlayerName(String playerName) { this.playerName = playerName; }
    public List<String> getRoute() { return route; }
    public void setRoute(List<String> route) { this.route = route; }
    public List<String> getRouteBetween() { return routeBetween; }
    public void setRouteBetween(List<String> routeBetween) { this.routeBetween = routeBetween; }
}
