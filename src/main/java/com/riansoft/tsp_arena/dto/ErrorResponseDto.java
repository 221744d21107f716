package com.riansoft.tsp_arena.dto;

// 실패 응답 본문: { "error": "..." }
public class ErrorResponseDto {
    private String error;

    public ErrorResponseDto() {}

    public ErrorResponseDto(String error) {
        this.error = error;
    }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
}
