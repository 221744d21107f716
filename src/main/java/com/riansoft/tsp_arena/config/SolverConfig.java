package com.riansoft.tsp_arena.config;

import com.riansoft.tsp_arena.solver.BruteForceTourSolver;
import com.riansoft.tsp_arena.solver.OrToolsTourSolver;
import com.riansoft.tsp_arena.solver.RandomSearchTourSolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.util.Random;

/**
 * 설정 값이 필요한 솔버 빈. 파라미터가 없는 휴리스틱은 {@code @Component}로 직접 등록됩니다.
 */
@Configuration
public class SolverConfig {

    @Bean
    public BruteForceTourSolver bruteForceTourSolver(ArenaProperties properties) {
        return new BruteForceTourSolver(properties.getMaxSelectedCities());
    }

    @Bean
    @Order(3)
    public RandomSearchTourSolver randomSearchTourSolver(ArenaProperties properties, Random arenaRandom) {
        return new RandomSearchTourSolver(properties.getRandomSearchBudget(), arenaRandom);
    }

    @Bean
    @Order(4)
    public OrToolsTourSolver orToolsTourSolver(ArenaProperties properties) {
        return new OrToolsTourSolver(properties.getOrtoolsTimeLimitMs());
    }
}
