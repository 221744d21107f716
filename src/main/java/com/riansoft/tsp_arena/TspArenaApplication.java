package com.riansoft.tsp_arena;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TspArenaApplication {

    public static void main(String[] args) {
        SpringApplication.run(TspArenaApplication.class, args);
    }
}
