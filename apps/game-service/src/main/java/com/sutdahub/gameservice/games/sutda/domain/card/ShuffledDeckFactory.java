package com.sutdahub.gameservice.games.sutda.domain.card;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 默认牌堆工厂：20 张牌用注入的随机源洗牌（生产环境为 SecureRandom）。
 */
public class ShuffledDeckFactory implements DeckFactory {

    private final Random random;

    public ShuffledDeckFactory(Random random) {
        this.random = random;
    }

    @Override
    public Deck newDeck() {
        List<Card> cards = new ArrayList<>(Card.all());
        Collections.shuffle(cards, random);
        return new Deck(cards);
    }
}
