package com.sutdahub.gameservice.games.sutda.domain.rule;

import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;

import java.util.List;
import java.util.Optional;

/**
 * 行动顺序与本轮完成判定。入参的玩家列表均按座位升序。
 */
public final class TurnOrder {

    private TurnOrder() {
    }

    /** 参与本轮且未弃牌 */
    public static boolean inPlay(PlayerState p) {
        return p.isInRound() && !p.isFolded();
    }

    /** 还能行动：未弃牌且余额 > 0（余额为 0 视为全下） */
    public static boolean canAct(PlayerState p) {
        return inPlay(p) && p.getBalance() > 0;
    }

    public static List<PlayerState> contenders(List<PlayerState> players) {
        return players.stream().filter(TurnOrder::inPlay).toList();
    }

    /** 未弃牌玩家中的最高本轮投入 */
    public static long highestBet(List<PlayerState> players) {
        return players.stream().filter(TurnOrder::inPlay).mapToLong(PlayerState::getRoundBet).max().orElse(0L);
    }

    /**
     * 本轮先手：上一局赢家仍可行动则由其先手，否则取座位最小的可行动玩家。
     */
    public static Optional<PlayerState> firstActor(List<PlayerState> players, String preferredId) {
        if (preferredId != null) {
            Optional<PlayerState> preferred = players.stream()
                    .filter(p -> preferredId.equals(p.getPlayerId()) && canAct(p))
                    .findFirst();
            if (preferred.isPresent()) {
                return preferred;
            }
        }
        return players.stream().filter(TurnOrder::canAct).findFirst();
    }

    /**
     * afterSeat 之后按座位循环的下一位可行动玩家（最后才轮回到 afterSeat 本人）。
     */
    public static Optional<PlayerState> nextActor(List<PlayerState> players, int afterSeat) {
        Optional<PlayerState> after = players.stream()
                .filter(p -> p.getSeat() > afterSeat && canAct(p))
                .findFirst();
        if (after.isPresent()) {
            return after;
        }
        return players.stream()
                .filter(p -> p.getSeat() <= afterSeat && canAct(p))
                .findFirst();
    }

    /**
     * 本轮是否结束：
     * 未弃牌人数 ≤ 1；或者每个未弃牌玩家都已行动（或已全下），
     * 且所有未全下玩家的投入都等于最高投入。
     */
    public static boolean isRoundComplete(List<PlayerState> players) {
        List<PlayerState> live = contenders(players);
        if (live.size() <= 1) {
            return true;
        }
        long highest = highestBet(players);
        for (PlayerState p : live) {
            boolean allIn = p.getBalance() == 0;
            if (!p.isActed() && !allIn) {
                return false;
            }
            if (!allIn && p.getRoundBet() != highest) {
                return false;
            }
        }
        return true;
    }
}
