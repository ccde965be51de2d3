package com.sutdahub.gameservice.games.sutda.domain.hand;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 克制表：(胜方牌型, 负方牌型) → 强制胜负，优先于分值比较。
 * <ul>
 *   <li>땡잡이 克 1~9땡</li>
 *   <li>암행어사 克 13광땡、18광땡</li>
 * </ul>
 */
public final class RankOverrides {

    private static final Map<HandRank, Set<HandRank>> BEATS = new EnumMap<>(HandRank.class);
    static {
        Set<HandRank> ordinaryTtaeng = EnumSet.noneOf(HandRank.class);
        for (HandRank r : HandRank.values()) {
            if (r.isOrdinaryTtaeng()) {
                ordinaryTtaeng.add(r);
            }
        }
        BEATS.put(HandRank.TTAENGJABI, Collections.unmodifiableSet(ordinaryTtaeng));
        BEATS.put(HandRank.AMHAENG_EOSA,
                Collections.unmodifiableSet(EnumSet.of(HandRank.GWANG_13, HandRank.GWANG_18)));
    }

    private RankOverrides() {
    }

    /** winner 是否凭克制关系压过 loser */
    public static boolean beats(HandRank winner, HandRank loser) {
        return BEATS.getOrDefault(winner, Collections.emptySet()).contains(loser);
    }

    /**
     * 查表：命中则返回强制结果，否则返回 null 交给分值比较。
     */
    public static Outcome lookup(HandRank a, HandRank b) {
        if (beats(a, b)) {
            return Outcome.A_WINS;
        }
        if (beats(b, a)) {
            return Outcome.B_WINS;
        }
        return null;
    }
}
