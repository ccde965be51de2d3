package com.sutdahub.gameservice.games.sutda.domain.model;

/**
 * 对局变更通知（发布给 UI / 聊天等订阅方）。
 *
 * @param gameId 对局
 * @param version 变更后的版本
 * @param status 变更后的状态
 * @param cause 触发本次变更的动作类型
 */
public record GameChange(String gameId, long version, GameStatus status, ActionType cause) {
}
