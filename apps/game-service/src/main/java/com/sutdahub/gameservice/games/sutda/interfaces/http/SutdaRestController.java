package com.sutdahub.gameservice.games.sutda.interfaces.http;

import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.GameSnapshot;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;
import com.sutdahub.gameservice.games.sutda.interfaces.http.dto.ActionRequest;
import com.sutdahub.gameservice.games.sutda.interfaces.http.dto.CreateGameRequest;
import com.sutdahub.gameservice.games.sutda.interfaces.http.dto.JoinGameRequest;
import com.sutdahub.gameservice.games.sutda.interfaces.http.dto.SelectCardsRequest;
import com.sutdahub.gameservice.games.sutda.service.CreatedGame;
import com.sutdahub.gameservice.games.sutda.service.SutdaService;
import com.sutdahub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 花斗 HTTP 接口控制器。
 * 业务异常由 WebExceptionAdvice 统一映射为 ApiResponse。
 */
@Slf4j
@RestController
@RequestMapping("/api/sutda")
public class SutdaRestController {

    private final SutdaService svc;

    public SutdaRestController(SutdaService svc) {
        this.svc = svc;
    }

    /**
     * 建局：房主自动入座 0 号位。
     */
    @PostMapping("/games")
    public ResponseEntity<ApiResponse<CreatedGame>> createGame(@Valid @RequestBody CreateGameRequest req) {
        CreatedGame created = svc.createGame(req.getHostName(), req.getBaseBet(), req.getMode());
        return ResponseEntity.ok(ApiResponse.success(created));
    }

    /**
     * 入座：仅等待中或上一局已结束时可加入。
     */
    @PostMapping("/games/{gameId}/join")
    public ResponseEntity<ApiResponse<PlayerState>> join(@PathVariable String gameId,
                                                         @Valid @RequestBody JoinGameRequest req) {
        PlayerState player = svc.joinGame(gameId, req.getName());
        return ResponseEntity.ok(ApiResponse.success(hideCards(player)));
    }

    @PostMapping("/games/{gameId}/start")
    public ResponseEntity<ApiResponse<GameSnapshot>> start(@PathVariable String gameId) {
        return ResponseEntity.ok(ApiResponse.success(svc.startGame(gameId)));
    }

    /**
     * 提交行动，返回该玩家视角的最新快照。
     */
    @PostMapping("/games/{gameId}/actions")
    public ResponseEntity<ApiResponse<GameSnapshot>> act(@PathVariable String gameId,
                                                         @Valid @RequestBody ActionRequest req) {
        log.debug("行动请求: game={}, player={}, type={}, amount={}",
                gameId, req.getPlayerId(), req.getType(), req.getAmount());
        GameSnapshot snap = svc.submitAction(gameId, req.getPlayerId(), req.getType(),
                req.getAmount(), req.getExpectedVersion());
        return ResponseEntity.ok(ApiResponse.success(snap));
    }

    /**
     * 三张模式：选定亮出的两张。
     */
    @PostMapping("/games/{gameId}/players/{playerId}/selection")
    public ResponseEntity<ApiResponse<GameSnapshot>> select(@PathVariable String gameId,
                                                            @PathVariable String playerId,
                                                            @Valid @RequestBody SelectCardsRequest req) {
        return ResponseEntity.ok(ApiResponse.success(svc.selectCards(gameId, playerId, req.getCardIds())));
    }

    /**
     * 对局快照：viewer 为观察者玩家ID，只能看到自己的手牌（结算亮牌后全部可见）。
     */
    @GetMapping("/games/{gameId}")
    public ResponseEntity<ApiResponse<GameSnapshot>> view(@PathVariable String gameId,
                                                          @RequestParam(name = "viewer", required = false) String viewer) {
        return ResponseEntity.ok(ApiResponse.success(svc.getGameState(gameId, viewer)));
    }

    @GetMapping("/games/{gameId}/actions")
    public ResponseEntity<ApiResponse<List<ActionRecord>>> actions(@PathVariable String gameId) {
        return ResponseEntity.ok(ApiResponse.success(svc.listActions(gameId)));
    }

    /** 入座返回值不带手牌 */
    private static PlayerState hideCards(PlayerState p) {
        return p.toBuilder().cards(List.of()).selected(List.of()).build();
    }
}
