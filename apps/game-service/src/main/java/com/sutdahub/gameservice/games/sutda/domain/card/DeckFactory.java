package com.sutdahub.gameservice.games.sutda.domain.card;

/**
 * 牌堆工厂：每次发牌前提供一副新洗好的牌。
 * 测试中可替换为固定顺序实现。
 */
@FunctionalInterface
public interface DeckFactory {

    Deck newDeck();
}
