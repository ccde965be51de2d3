package com.sutdahub.gameservice.games.sutda.domain.model;

/**
 * 行动类型。
 * 前八种为玩家下注动作，其余为系统写入审计记录时使用的类型。
 */
public enum ActionType {
    /** 过牌 */
    CHECK(true, false),
    /** 跟注 */
    CALL(true, false),
    /** 下注 */
    BET(true, true),
    /** 加注 */
    RAISE(true, true),
    /** 하프：底池一半 */
    HALF(true, true),
    /** 쿼터：底池四分之一 */
    QUARTER(true, true),
    /** 따당：上一注的两倍 */
    DOUBLE(true, true),
    /** 다이：弃牌 */
    DIE(true, false),

    JOIN(false, false),
    START(false, false),
    REDEAL(false, false),
    REGAME(false, false),
    SETTLE(false, false),
    TURN_CORRECTED(false, false),
    SELECT(false, false);

    private final boolean playerAction;
    private final boolean betType;

    ActionType(boolean playerAction, boolean betType) {
        this.playerAction = playerAction;
        this.betType = betType;
    }

    /** 玩家可以主动提交的动作 */
    public boolean isPlayerAction() {
        return playerAction;
    }

    /** 会刷新“上一注”金额的动作 */
    public boolean isBetType() {
        return betType;
    }
}
