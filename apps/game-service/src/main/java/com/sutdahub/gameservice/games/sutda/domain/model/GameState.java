package com.sutdahub.gameservice.games.sutda.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * 对局记录（按版本不可变），CAS 写入的单位。
 * <p>
 * 不变式：pot = carryOver + 所有参与者 roundBet 之和；
 * PLAYING 时恰有一个 currentPlayerId，其余状态为 null。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GameState {
    String gameId;
    GameStatus status;
    GameMode mode;
    long baseBet;
    long pot;
    /** 流局带入本轮的底池 */
    long carryOver;
    /** 上一注金额（BET/RAISE/HALF/QUARTER/DOUBLE 的投入），本轮无注时为 0 */
    long lastBet;
    String hostId;
    String currentPlayerId;
    /** 当前回合截止时间（epoch ms） */
    Long turnDeadline;
    String winnerId;
    /** 上一局赢家，决定下一轮先手 */
    String lastWinnerId;
    /** 赢家实得：底池 + 奖励 */
    long payout;
    /** 奖励台账：输家 playerId → 实际扣除额 */
    @Builder.Default
    Map<String, Long> bonusLedger = Map.of();
    boolean revealCards;
    /** 赢家牌型（亮牌结算时） */
    String winningRank;
    /** 流局后重新发牌的时间（epoch ms） */
    Long regameAt;
    /** 发牌轮次，每次发牌加一 */
    int round;
    long version;
    long createdAt;
    long updatedAt;

    /** 当前需要被巡检的时间点：进行中为回合截止，流局为重开时间 */
    public Long dueAt() {
        if (status == GameStatus.PLAYING) {
            return turnDeadline;
        }
        if (status == GameStatus.REGAME) {
            return regameAt;
        }
        return null;
    }
}
