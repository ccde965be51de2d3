package com.sutdahub.gameservice.games.sutda.domain.repository;

import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.GameTable;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 一次原子提交：对局 + 变化了的玩家 + 审计记录。
 * <p>
 * game / players 携带的 version 是读取时的版本，存储层据此做 CAS，
 * 成功后各自加一；任一版本不匹配则整体不写入。
 *
 * @param gameId 对局
 * @param expectedVersion 读取时的对局版本
 * @param game 新的对局记录
 * @param players 有变化的玩家（version 为读取时的值）
 * @param actions 本次追加的审计记录（gameVersion 已填为 expectedVersion + 1）
 */
public record GameTransition(String gameId,
                             long expectedVersion,
                             GameState game,
                             List<PlayerState> players,
                             List<ActionRecord> actions) {

    /**
     * 对比前后两张牌桌，只提交有变化的玩家。
     */
    public static GameTransition between(GameTable before, GameTable after, List<ActionRecord> actions) {
        Map<String, PlayerState> old = before.players().stream()
                .collect(Collectors.toMap(PlayerState::getPlayerId, Function.identity()));
        List<PlayerState> changed = after.players().stream()
                .filter(p -> !p.equals(old.get(p.getPlayerId())))
                .toList();
        long expected = before.game().getVersion();
        List<ActionRecord> stamped = new ArrayList<>(actions.size());
        for (ActionRecord a : actions) {
            stamped.add(a.toBuilder().gameVersion(expected + 1).build());
        }
        return new GameTransition(before.game().getGameId(), expected, after.game(), changed, List.copyOf(stamped));
    }
}
