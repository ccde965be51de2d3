package com.sutdahub.gameservice.games.sutda.service;

/**
 * 建局结果：对局 ID 与房主（0 号座位）的玩家 ID。
 */
public record CreatedGame(String gameId, String playerId) {
}
