package com.sutdahub.gameservice.games.sutda.domain.card;

import com.sutdahub.gameservice.common.error.GameStateException;
import com.sutdahub.gameservice.games.sutda.domain.constants.GameMessages;

import java.util.ArrayList;
import java.util.List;

/**
 * 一局用的牌堆：按给定顺序从顶部发牌，已发出的牌本局内不再出现。
 * 非线程安全，只在单次发牌流程中使用。
 */
public final class Deck {

    private final List<Card> cards;
    private int next;

    public Deck(List<Card> order) {
        this.cards = List.copyOf(order);
    }

    /**
     * 从顶部连续发 n 张。
     * @throws GameStateException 剩余牌不足
     */
    public List<Card> deal(int n) {
        if (n > remaining()) {
            throw new GameStateException(GameMessages.DECK_EXHAUSTED);
        }
        List<Card> out = new ArrayList<>(cards.subList(next, next + n));
        next += n;
        return List.copyOf(out);
    }

    public int remaining() {
        return cards.size() - next;
    }
}
