package com.riansoft.tsp_arena.exception;

// 랜덤 탐색 횟수가 0 이하인 경우.
public class SearchBudgetException extends ArenaException {

    public SearchBudgetException(String message) {
        super(message);
    }
}
