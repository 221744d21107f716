package com.riansoft.tsp_arena.exception;

// 잘못된 생성기/서버 설정 (프로그래머 오류).
public class ConfigurationException extends ArenaException {

    public ConfigurationException(String message) {
        super(message);
    }
}
