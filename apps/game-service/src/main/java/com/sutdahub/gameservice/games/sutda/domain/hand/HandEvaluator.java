package com.sutdahub.gameservice.games.sutda.domain.hand;

import com.sutdahub.gameservice.common.error.ValidationException;
import com.sutdahub.gameservice.games.sutda.domain.card.Card;
import com.sutdahub.gameservice.games.sutda.domain.constants.GameMessages;

import java.util.HashSet;
import java.util.List;

/**
 * 花斗牌型评估器（纯函数，线程安全）。
 * <p>
 * 构造时预先计算全部 190 种两张组合，之后 evaluate 只查表。
 * 判定顺序：광땡 → 땡잡이/암행어사/구사 → 땡 → 特殊组合 → 끗。
 */
public class HandEvaluator {

    /** 按 (小编号, 大编号) 索引 */
    private final HandValue[][] table = new HandValue[Card.MAX_ID + 1][Card.MAX_ID + 1];

    public HandEvaluator() {
        for (int i = Card.MIN_ID; i <= Card.MAX_ID; i++) {
            for (int j = i + 1; j <= Card.MAX_ID; j++) {
                table[i][j] = HandValue.of(classify(Card.of(i), Card.of(j)));
            }
        }
    }

    /**
     * 评估两张牌，与输入顺序无关。
     * @throws ValidationException 两张为同一张牌
     */
    public HandValue evaluate(Card a, Card b) {
        if (a == null || b == null) {
            throw new ValidationException(GameMessages.HAND_SIZE_INVALID);
        }
        if (a.id() == b.id()) {
            throw new ValidationException(GameMessages.DUPLICATE_CARD);
        }
        int lo = Math.min(a.id(), b.id());
        int hi = Math.max(a.id(), b.id());
        return table[lo][hi];
    }

    public HandValue evaluate(List<Card> pair) {
        if (pair == null || pair.size() != 2) {
            throw new ValidationException(GameMessages.HAND_SIZE_INVALID);
        }
        return evaluate(pair.get(0), pair.get(1));
    }

    /**
     * 比较两手牌：任一方为 VOID 记平（留给结算阶段裁决）；
     * 其次查克制表；最后比分值。
     */
    public Outcome compare(HandValue a, HandValue b) {
        if (a.isVoid() || b.isVoid()) {
            return Outcome.TIE;
        }
        Outcome forced = RankOverrides.lookup(a.rank(), b.rank());
        if (forced != null) {
            return forced;
        }
        int c = Integer.compare(a.score(), b.score());
        return c > 0 ? Outcome.A_WINS : c < 0 ? Outcome.B_WINS : Outcome.TIE;
    }

    /**
     * 三张里选最优两张。
     * 非 VOID 组合总是优先于 VOID 组合；非 VOID 之间比分值（同分取先出现的）；
     * 都是 VOID 时멍텅구리구사优先于구사。
     */
    public List<Card> findBestPair(List<Card> three) {
        if (three == null || three.size() != 3) {
            throw new ValidationException(GameMessages.HAND_SIZE_INVALID);
        }
        if (new HashSet<>(three).size() != 3) {
            throw new ValidationException(GameMessages.DUPLICATE_CARD);
        }
        int[][] subsets = {{0, 1}, {0, 2}, {1, 2}};
        List<Card> best = null;
        HandValue bestValue = null;
        for (int[] s : subsets) {
            List<Card> cand = List.of(three.get(s[0]), three.get(s[1]));
            HandValue v = evaluate(cand);
            if (bestValue == null || preferred(v, bestValue)) {
                best = cand;
                bestValue = v;
            }
        }
        return best;
    }

    /**
     * 手牌的最终牌值：2 张直接评估，3 张取最优两张。
     */
    public HandValue bestValue(List<Card> cards) {
        if (cards != null && cards.size() == 3) {
            return evaluate(findBestPair(cards));
        }
        return evaluate(cards);
    }

    private static boolean preferred(HandValue cand, HandValue best) {
        if (cand.isVoid() != best.isVoid()) {
            return !cand.isVoid();
        }
        if (cand.isVoid()) {
            return cand.rank() == HandRank.MEONGTEONGGURI_GUSA && best.rank() == HandRank.GUSA;
        }
        return cand.score() > best.score();
    }

    private static HandRank classify(Card a, Card b) {
        int lo = Math.min(a.month(), b.month());
        int hi = Math.max(a.month(), b.month());

        if (a.isLight() && b.isLight()) {
            if (lo == 3 && hi == 8) return HandRank.GWANG_38;
            if (lo == 1 && hi == 3) return HandRank.GWANG_13;
            if (lo == 1 && hi == 8) return HandRank.GWANG_18;
        }
        if (a.isAnimal() && b.isAnimal()) {
            if (lo == 3 && hi == 7) return HandRank.TTAENGJABI;
            if (lo == 4 && hi == 7) return HandRank.AMHAENG_EOSA;
            if (lo == 4 && hi == 9) return HandRank.MEONGTEONGGURI_GUSA;
        }
        if (lo == 4 && hi == 9) {
            return HandRank.GUSA;
        }
        if (lo == hi) {
            return HandRank.ttaeng(lo);
        }
        if (lo == 1 && hi == 2) return HandRank.ALI;
        if (lo == 1 && hi == 4) return HandRank.DOKSA;
        if (lo == 1 && hi == 9) return HandRank.GUPPING;
        if (lo == 1 && hi == 10) return HandRank.JANGPPING;
        if (lo == 4 && hi == 10) return HandRank.JANGSA;
        if (lo == 4 && hi == 6) return HandRank.SERYUK;
        return HandRank.points((lo + hi) % 10);
    }
}
