package com.sutdahub.gameservice.games.sutda.domain.model;

import com.sutdahub.gameservice.games.sutda.domain.card.Card;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 玩家记录（按版本不可变）。
 * 每次写入由存储层将 version 加一；引擎只通过 toBuilder 生成新值。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PlayerState {
    String gameId;
    String playerId;
    String name;
    /** 座位号，从 0 开始，决定行动顺序与同分先后 */
    int seat;
    /** 余额，永不为负 */
    long balance;
    /** 手牌：0 / 2 / 3 张 */
    @Builder.Default
    List<Card> cards = List.of();
    /** 三张模式下玩家选定亮出的两张；未选时为空 */
    @Builder.Default
    List<Card> selected = List.of();
    /** 是否参与本轮（开局时余额 > 0 的玩家） */
    boolean inRound;
    boolean folded;
    /** 本轮发牌后是否已行动 */
    boolean acted;
    /** 本轮累计投入 */
    long roundBet;
    long version;
    long joinedAt;
}
