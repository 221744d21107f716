package com.riansoft.tsp_arena.solver;

/**
 * 최적을 보장하지 않는 비교용 알고리즘. 빈으로 등록하면 평가 대상에 자동으로 포함됩니다.
 */
public interface TourHeuristic extends TourSolver {

    /**
     * 외부 라이브러리 로드 실패 등으로 사용할 수 없는 경우 {@code false}.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * 풀이 전에 설정 값을 검사합니다. 평가기는 어떤 솔버도 실행하기 전에 모든 휴리스틱에 대해 호출합니다.
     */
    default void checkConfiguration() {
    }
}
