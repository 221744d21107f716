package com.riansoft.tsp_arena.exception;

// 알 수 없거나 만료된 세션 ID. 새 게임을 시작하면 복구됩니다.
public class SessionNotFoundException extends ArenaException {

    public SessionNotFoundException(String message) {
        super(message);
    }
}
