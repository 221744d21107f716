package com.riansoft.tsp_arena.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code arena.*} 설정 값.
 */
@ConfigurationProperties(prefix = "arena")
public class ArenaProperties {

    /**
     * 한 판에 생성할 도시 수 ("A"부터).
     */
    private int poolSize = 10;

    private int minDistance = 50;
    private int maxDistance = 100;

    /**
     * 플레이어가 고를 수 있는 최대 도시 수. 완전 탐색 비용(k!)을 묶어둡니다.
     */
    private int maxSelectedCities = 8;

    /**
     * 랜덤 탐색이 평가할 순열 개수.
     */
    private int randomSearchBudget = 1000;

    private long ortoolsTimeLimitMs = 1000;

    /**
     * 메모리에 보관할 최대 세션 수.
     */
    private int maxSessions = 1000;

    /**
     * 지정하면 인스턴스 생성과 랜덤 탐색이 재현 가능해집니다.
     */
    private Long seed;

    public int getPoolSize() { return poolSize; }
    public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
    public int getMinDistance() { return minDistance; }
    public void setMinDistance(int minDistance) { this.minDistance = minDistance; }
    public int getMaxDistance() { return maxDistance; }
    public void setMaxDistance(int maxDistance) { this.maxDistance = maxDistance; }
    public int getMaxSelectedCities() { return maxSelectedCities; }
    public void setMaxSelectedCities(int maxSelectedCities) { this.maxSelectedCities = maxSelectedCities; }
    public int getRandomSearchBudget() { return randomSearchBudget; }
    public void setRandomSearchBudget(int randomSearchBudget) { this.randomSearchBudget = randomSearchBudget; }
    public long getOrtoolsTimeLimitMs() { return ortoolsTimeLimitMs; }
    public void setOrtoolsTimeLimitMs(long ortoolsTimeLimitMs) { this.ortoolsTimeLimitMs = ortoolsTimeLimitMs; }
    public int getMaxSessions() { return maxSessions; }
    public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }
    public Long getSeed() { return seed; }
    public void setSeed(Long seed) { this.seed = seed; }
}
