package com.sutdahub.gameservice.games.sutda.domain.rule;

import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.GameTable;

import java.util.Map;

/**
 * 结算结果。
 *
 * @param kind 结算方式
 * @param table 结算后的牌桌
 * @param winnerId 赢家（流局为 null）
 * @param payout 赢家实得（底池 + 奖励）
 * @param bonusLedger 输家 → 实际扣除的奖励
 * @param record SETTLE / REGAME 审计记录
 */
public record RoundResult(Kind kind,
                          GameTable table,
                          String winnerId,
                          long payout,
                          Map<String, Long> bonusLedger,
                          ActionRecord record) {

    public enum Kind {
        /** 只剩一人未弃牌，不比牌 */
        FOLD_WIN,
        /** 亮牌比大小 */
        SHOWDOWN,
        /** 流局 */
        REGAME
    }
}
