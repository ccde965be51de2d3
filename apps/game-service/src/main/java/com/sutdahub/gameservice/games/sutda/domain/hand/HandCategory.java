package com.sutdahub.gameservice.games.sutda.domain.hand;

/** 牌型大类 */
public enum HandCategory {
    /** 광땡 */
    LIGHT_PAIR,
    /** 땡（同月对子） */
    MATCHED_PAIR,
    /** 알리、독사、구삥、장삥、장사、세륙 */
    SPECIAL_PAIR,
    /** 땡잡이 */
    TRAP,
    /** 암행어사 */
    BEATER,
    /** 구사 / 멍텅구리구사：可能触发重开局 */
    VOID,
    /** 끗（含 갑오、망통） */
    POINTS
}
