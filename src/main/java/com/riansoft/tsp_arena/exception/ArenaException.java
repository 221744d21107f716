package com.riansoft.tsp_arena.exception;

/**
 * 게임 엔진이 호출자에게 돌려주는 모든 실패의 상위 타입.
 * 메시지는 그대로 사용자에게 노출됩니다.
 */
public abstract class ArenaException extends RuntimeException {

    protected ArenaException(String message) {
        super(message);
    }
}
