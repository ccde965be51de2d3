package com.sutdahub.gameservice.games.sutda.domain.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 一次读取得到的完整牌桌：对局记录 + 按座位排序的玩家。
 * 规则层在它上面做纯计算，返回新的 GameTable。
 */
public record GameTable(GameState game, List<PlayerState> players) {

    public GameTable {
        players = players.stream()
                .sorted(Comparator.comparingInt(PlayerState::getSeat))
                .toList();
    }

    public Optional<PlayerState> player(String playerId) {
        if (playerId == null) {
            return Optional.empty();
        }
        return players.stream().filter(p -> playerId.equals(p.getPlayerId())).findFirst();
    }

    public GameTable withGame(GameState next) {
        return new GameTable(next, players);
    }

    /** 按 playerId 替换一名玩家 */
    public GameTable withPlayer(PlayerState next) {
        List<PlayerState> out = new ArrayList<>(players.size());
        for (PlayerState p : players) {
            out.add(p.getPlayerId().equals(next.getPlayerId()) ? next : p);
        }
        return new GameTable(game, out);
    }

    public GameTable withPlayers(List<PlayerState> next) {
        return new GameTable(game, next);
    }

    /** 本轮参与者投入之和 */
    public long totalRoundBets() {
        return players.stream().filter(PlayerState::isInRound).mapToLong(PlayerState::getRoundBet).sum();
    }
}
