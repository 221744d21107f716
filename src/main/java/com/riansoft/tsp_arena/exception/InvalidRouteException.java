package com.riansoft.tsp_arena.exception;

// 규칙을 어긴 제출 경로. 다시 제출하면 복구됩니다.
public class InvalidRouteException extends ArenaException {

    public InvalidRouteException(String message) {
        super(message);
    }
}
