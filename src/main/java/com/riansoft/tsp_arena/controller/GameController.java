package com.riansoft.tsp_arena.controller;

import com.riansoft.tsp_arena.dto.CheckAnswerRequestDto;
import com.riansoft.tsp_arena.dto.CheckAnswerResponseDto;
import com.riansoft.tsp_arena.dto.NewGameResponseDto;
import com.riansoft.tsp_arena.service.GameService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class GameController {

    private final GameService gameService;

    @Autowired
    public GameController(GameService gameService) {
        this.gameService = gameService;
    }

    /**
     * 새 거리 행렬과 집 도시를 만들고 세션 ID를 발급합니다. 요청 본문은 사용하지 않습니다.
     */
    @PostMapping("/new-game")
    public ResponseEntity<NewGameResponseDto> newGame() {
        return ResponseEntity.ok(gameService.startNewGame());
    }

    /**
     * 제출 경로를 채점하고 알고리즘별 결과를 함께 반환합니다.
     */
    @PostMapping("/check-answer")
    public ResponseEntity<CheckAnswerResponseDto> checkAnswer(@RequestBody CheckAnswerRequestDto request) {
        return ResponseEntity.ok(gameService.checkAnswer(request));
    }

    @GetMapping("/complexity")
    public ResponseEntity<Map<String, String>> complexity() {
        return ResponseEntity.ok(gameService.getComplexity());
    }
}
