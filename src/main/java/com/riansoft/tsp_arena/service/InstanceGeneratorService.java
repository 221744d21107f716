package com.riansoft.tsp_arena.service;

import com.riansoft.tsp_arena.exception.ConfigurationException;
import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.DistanceModel;
import com.riansoft.tsp_arena.model.GeneratedInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Random;

@Service
public class InstanceGeneratorService {

    private final Random random;

    @Autowired
    public InstanceGeneratorService(Random arenaRandom) {
        this.random = arenaRandom;
    }

    /**
     * 풀의 앞 {@code poolSize}개 도시로 무작위 대칭 거리 행렬을 만들고 집 도시를 고릅니다.
     * 위 삼각 행렬을 [minDist, maxDist] 균등 난수로 채운 뒤 아래로 복사합니다.
     */
    public GeneratedInstance newInstance(int poolSize, int minDist, int maxDist) {
        if (poolSize < 2 || poolSize > City.ALPHABET_SIZE) {
            throw new ConfigurationException("Pool size must be between 2 and " + City.ALPHABET_SIZE + ", got " + poolSize + ".");
        }
        if (minDist < 0) {
            throw new ConfigurationException("Minimum distance must not be negative, got " + minDist + ".");
        }
        if (minDist > maxDist) {
            throw new ConfigurationException("Minimum distance " + minDist + " is greater than maximum distance " + maxDist + ".");
        }

        List<City> cities = City.pool(poolSize);
        int[][] matrix = new int[poolSize][poolSize];
        // [0, Integer.MAX_VALUE] 범위는 int로 표현되지 않으므로 long으로 계산합니다.
        long span = (long) maxDist - minDist + 1;
        for (int i = 0; i < poolSize; i++) {
            for (int j = i + 1; j < poolSize; j++) {
                int d = minDist + (int) random.nextLong(span);
                matrix[i][j] = d;
                matrix[j][i] = d;
            }
        }
        City home = cities.get(random.nextInt(poolSize));
        return new GeneratedInstance(new DistanceModel(cities, matrix), home);
    }
}
