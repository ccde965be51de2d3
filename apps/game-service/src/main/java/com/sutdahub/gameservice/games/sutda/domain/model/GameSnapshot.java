package com.sutdahub.gameservice.games.sutda.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 对局只读快照（对外返回）。
 */
@Value
@Builder
public class GameSnapshot {
    String gameId;
    GameStatus status;
    GameMode mode;
    long baseBet;
    long pot;
    long lastBet;
    /** 当前行动者可下的最低 BET/RAISE 金额 */
    long minimumBet;
    int round;
    String currentPlayerId;
    Long turnDeadline;
    String winnerId;
    long payout;
    Map<String, Long> bonusLedger;
    boolean revealCards;
    String winningRank;
    /** 流局倒计时（秒），非流局为 0 */
    long regameCountdownSeconds;
    long version;
    List<PlayerView> players;
    List<ActionRecord> recentActions;
}
