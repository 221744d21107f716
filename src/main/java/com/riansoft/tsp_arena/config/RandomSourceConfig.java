package com.riansoft.tsp_arena.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

/**
 * 인스턴스 생성과 랜덤 탐색이 공유하는 난수원.
 * {@code arena.seed}가 있으면 고정 시드, 없으면 SecureRandom에서 시드를 뽑습니다.
 */
@Configuration
public class RandomSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(RandomSourceConfig.class);

    @Bean
    public Random arenaRandom(ArenaProperties properties) {
        if (properties.getSeed() != null) {
            log.info("[CONFIG] 고정 시드 {} 로 난수원을 생성합니다.", properties.getSeed());
            return new Random(properties.getSeed());
        }
        return new Random(new SecureRandom().nextLong());
    }
}
