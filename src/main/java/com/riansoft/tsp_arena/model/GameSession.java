package com.riansoft.tsp_arena.model;

import java.time.Instant;
import java.util.List;

/**
 * 한 판(라운드)의 인스턴스. 생성 후에는 읽기 전용입니다.
 */
public class GameSession {
    public final String id;
    public final DistanceModel model;
    public final City homeCity;
    public final List<City> cities;
    public final Instant createdAt;

    public GameSession(String id, DistanceModel model, City homeCity, List<City> cities, Instant createdAt) {
        this.id = id;
        this.model = model;
        this.homeCity = homeCity;
        this.cities = List.copyOf(cities);
        this.createdAt = createdAt;
    }
}
