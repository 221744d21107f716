package com.riansoft.tsp_arena.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class EvaluationReport {
    public final AlgorithmResult user;
    public final AlgorithmResult optimal;
    public final boolean correct;
    // 삽입 순서 유지 (표시용)
    public final Map<String, AlgorithmResult> algorithms;

    public EvaluationReport(AlgorithmResult user, AlgorithmResult optimal, boolean correct,
                            Map<String, AlgorithmResult> algorithms) {
        this.user = user;
        this.optimal = optimal;
        this.correct = correct;
        this.algorithms = Collections.unmodifiableMap(new LinkedHashMap<>(algorithms));
    }
}
