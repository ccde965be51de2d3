package com.sutdahub.gameservice.games.sutda.domain.model;

/**
 * 玩法：两张牌 / 三张牌（三选二）。
 */
public enum GameMode {
    TWO_CARD(2, 8),
    THREE_CARD(3, 6);

    private final int cardsPerPlayer;
    private final int capacity;

    GameMode(int cardsPerPlayer, int capacity) {
        this.cardsPerPlayer = cardsPerPlayer;
        this.capacity = capacity;
    }

    public int cardsPerPlayer() {
        return cardsPerPlayer;
    }

    /** 最大入座人数（受 20 张牌限制） */
    public int capacity() {
        return capacity;
    }
}
