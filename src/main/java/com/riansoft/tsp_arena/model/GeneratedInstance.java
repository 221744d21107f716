package com.riansoft.tsp_arena.model;

public class GeneratedInstance {
    public final DistanceModel model;
    public final City homeCity;

    public GeneratedInstance(DistanceModel model, City homeCity) {
        this.model = model;
        this.homeCity = homeCity;
    }
}
