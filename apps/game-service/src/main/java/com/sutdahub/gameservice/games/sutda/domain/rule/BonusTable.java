package com.sutdahub.gameservice.games.sutda.domain.rule;

import com.sutdahub.gameservice.games.sutda.domain.hand.HandRank;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 奖励表：(赢家牌型, 输家牌型) → 底注倍数。
 * 金额向下取整到整数筹码。
 */
public class BonusTable {

    private final Map<HandRank, Map<HandRank, BigDecimal>> multipliers = new EnumMap<>(HandRank.class);

    /** 땡잡이 抓 N땡 的倍数，下标为月份 1..9 */
    private static final String[] TTAENGJABI_BY_MONTH = {
            null, "1", "1.25", "1.5", "2", "2.5", "3", "3.5", "4", "4.5"
    };

    /**
     * 默认规则：
     * 38광땡 胜 13/18광땡 ×2；암행어사 胜 13/18광땡 ×3；
     * 땡잡이 胜 N땡 按月份递增（1땡 ×1 … 9땡 ×4.5）。
     * 장땡 等普通胜局无奖励。
     */
    public static BonusTable standard() {
        BonusTable t = new BonusTable();
        t.put(HandRank.GWANG_38, HandRank.GWANG_13, "2");
        t.put(HandRank.GWANG_38, HandRank.GWANG_18, "2");
        t.put(HandRank.AMHAENG_EOSA, HandRank.GWANG_13, "3");
        t.put(HandRank.AMHAENG_EOSA, HandRank.GWANG_18, "3");
        for (int month = 1; month <= 9; month++) {
            t.put(HandRank.TTAENGJABI, HandRank.ttaeng(month), TTAENGJABI_BY_MONTH[month]);
        }
        return t;
    }

    private void put(HandRank winner, HandRank loser, String multiplier) {
        multipliers.computeIfAbsent(winner, k -> new EnumMap<>(HandRank.class)).put(loser, new BigDecimal(multiplier));
    }

    public BigDecimal multiplier(HandRank winner, HandRank loser) {
        return multipliers.getOrDefault(winner, Collections.emptyMap()).getOrDefault(loser, BigDecimal.ZERO);
    }

    /** 奖励金额（未按输家余额截断） */
    public long bonus(HandRank winner, HandRank loser, long baseBet) {
        return multiplier(winner, loser)
                .multiply(BigDecimal.valueOf(baseBet))
                .setScale(0, RoundingMode.DOWN)
                .longValueExact();
    }
}
