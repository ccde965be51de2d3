package com.sutdahub.gameservice.games.sutda.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 面向某个观察者的玩家视图：非本人且未亮牌时 cards 为 null，只给张数。
 */
@Value
@Builder
public class PlayerView {
    String playerId;
    String name;
    int seat;
    long balance;
    boolean inRound;
    boolean folded;
    long roundBet;
    int cardCount;
    List<Integer> cards;
    List<Integer> selected;
    /** 亮牌后的牌型 */
    String handRank;
}
