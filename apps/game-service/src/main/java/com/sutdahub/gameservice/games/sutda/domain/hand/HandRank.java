package com.sutdahub.gameservice.games.sutda.domain.hand;

/**
 * 牌型（封闭枚举）。
 * score 为线性比较用的分值；TRAP / BEATER 的克制关系不在分值里体现，
 * 由 {@link RankOverrides} 单独裁决。
 */
public enum HandRank {
    GWANG_38("38광땡", HandCategory.LIGHT_PAIR, 2000),
    GWANG_13("13광땡", HandCategory.LIGHT_PAIR, 1900),
    GWANG_18("18광땡", HandCategory.LIGHT_PAIR, 1800),

    TTAENG_10("장땡", HandCategory.MATCHED_PAIR, 1500),
    TTAENG_9("9땡", HandCategory.MATCHED_PAIR, 1490),
    TTAENG_8("8땡", HandCategory.MATCHED_PAIR, 1480),
    TTAENG_7("7땡", HandCategory.MATCHED_PAIR, 1470),
    TTAENG_6("6땡", HandCategory.MATCHED_PAIR, 1460),
    TTAENG_5("5땡", HandCategory.MATCHED_PAIR, 1450),
    TTAENG_4("4땡", HandCategory.MATCHED_PAIR, 1440),
    TTAENG_3("3땡", HandCategory.MATCHED_PAIR, 1430),
    TTAENG_2("2땡", HandCategory.MATCHED_PAIR, 1420),
    TTAENG_1("1땡", HandCategory.MATCHED_PAIR, 1410),

    ALI("알리", HandCategory.SPECIAL_PAIR, 800),
    DOKSA("독사", HandCategory.SPECIAL_PAIR, 700),
    GUPPING("구삥", HandCategory.SPECIAL_PAIR, 600),
    JANGPPING("장삥", HandCategory.SPECIAL_PAIR, 500),
    JANGSA("장사", HandCategory.SPECIAL_PAIR, 400),
    SERYUK("세륙", HandCategory.SPECIAL_PAIR, 300),

    GABO("갑오", HandCategory.POINTS, 250),
    KKEUT_8("8끗", HandCategory.POINTS, 180),
    KKEUT_7("7끗", HandCategory.POINTS, 170),
    KKEUT_6("6끗", HandCategory.POINTS, 160),
    KKEUT_5("5끗", HandCategory.POINTS, 150),
    KKEUT_4("4끗", HandCategory.POINTS, 140),
    KKEUT_3("3끗", HandCategory.POINTS, 130),
    KKEUT_2("2끗", HandCategory.POINTS, 120),
    KKEUT_1("1끗", HandCategory.POINTS, 110),
    MANGTONG("망통", HandCategory.POINTS, 50),

    /**
     * 3·7 열끗：抓 1~9땡，其余按망통计。
     * 克制只在 {@link RankOverrides} 的配对内生效，分值不高于망통。
     */
    TTAENGJABI("땡잡이", HandCategory.TRAP, 50),
    /**
     * 4·7 열끗：抓 13/18광땡，其余按1끗计。
     * 克制只在 {@link RankOverrides} 的配对内生效，分值与1끗相同。
     */
    AMHAENG_EOSA("암행어사", HandCategory.BEATER, 110),
    /** 4·9 열끗 */
    MEONGTEONGGURI_GUSA("멍텅구리구사", HandCategory.VOID, 130),
    /** 其余 4·9 组合 */
    GUSA("구사", HandCategory.VOID, 130);

    private final String label;
    private final HandCategory category;
    private final int score;

    HandRank(String label, HandCategory category, int score) {
        this.label = label;
        this.category = category;
        this.score = score;
    }

    public String label() {
        return label;
    }

    public HandCategory category() {
        return category;
    }

    public int score() {
        return score;
    }

    public boolean isVoid() {
        return category == HandCategory.VOID;
    }

    /** 1~9땡（不含장땡） */
    public boolean isOrdinaryTtaeng() {
        return category == HandCategory.MATCHED_PAIR && this != TTAENG_10;
    }

    /** 同月对子 */
    public static HandRank ttaeng(int month) {
        return valueOf("TTAENG_" + month);
    }

    /** 끗数 0..9 */
    public static HandRank points(int n) {
        if (n == 0) {
            return MANGTONG;
        }
        if (n == 9) {
            return GABO;
        }
        return valueOf("KKEUT_" + n);
    }
}
