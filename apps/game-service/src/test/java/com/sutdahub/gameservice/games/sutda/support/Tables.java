package com.sutdahub.gameservice.games.sutda.support;

import com.sutdahub.gameservice.games.sutda.domain.card.Card;
import com.sutdahub.gameservice.games.sutda.domain.card.Deck;
import com.sutdahub.gameservice.games.sutda.domain.card.DeckFactory;
import com.sutdahub.gameservice.games.sutda.domain.model.GameMode;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.GameStatus;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 测试夹具：快速构造牌、玩家、对局与固定顺序的牌堆。
 */
public final class Tables {

    public static final String GAME_ID = "g-1";
    public static final long NOW = 1_700_000_000_000L;

    private Tables() {
    }

    public static List<Card> cards(int... ids) {
        return Arrays.stream(ids).mapToObj(Card::of).toList();
    }

    public static PlayerState player(String id, int seat, long balance, int... cardIds) {
        return PlayerState.builder()
                .gameId(GAME_ID)
                .playerId(id)
                .name(id)
                .seat(seat)
                .balance(balance)
                .cards(cards(cardIds))
                .inRound(true)
                .build();
    }

    public static GameState playing(String current, long baseBet) {
        return GameState.builder()
                .gameId(GAME_ID)
                .status(GameStatus.PLAYING)
                .mode(GameMode.TWO_CARD)
                .baseBet(baseBet)
                .currentPlayerId(current)
                .turnDeadline(NOW + 30_000)
                .round(1)
                .build();
    }

    /** 牌堆顶部为给定编号，其余按编号升序补齐 */
    public static Deck deckStartingWith(int... ids) {
        Set<Card> order = new LinkedHashSet<>(cards(ids));
        order.addAll(Card.all());
        return new Deck(new ArrayList<>(order));
    }

    /** 依次返回给定牌堆，用完后返回升序牌堆 */
    public static DeckFactory decks(Deck... decks) {
        Deque<Deck> queue = new ArrayDeque<>(Arrays.asList(decks));
        return () -> {
            Deck next = queue.poll();
            return next != null ? next : new Deck(Card.all());
        };
    }
}
