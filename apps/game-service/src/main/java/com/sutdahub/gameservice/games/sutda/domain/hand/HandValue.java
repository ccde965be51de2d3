package com.sutdahub.gameservice.games.sutda.domain.hand;

/**
 * 两张牌的评估结果：牌型 + 分值。
 */
public record HandValue(HandRank rank, int score) {

    public static HandValue of(HandRank rank) {
        return new HandValue(rank, rank.score());
    }

    public boolean isVoid() {
        return rank.isVoid();
    }
}
