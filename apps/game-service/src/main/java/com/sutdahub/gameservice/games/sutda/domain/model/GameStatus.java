package com.sutdahub.gameservice.games.sutda.domain.model;

/**
 * 对局状态：
 * WAITING → PLAYING → FINISHED / REGAME；REGAME 延时后回到 PLAYING；FINISHED 可再次开局。
 */
public enum GameStatus {
    /** 等待玩家加入 */
    WAITING,
    /** 发牌后下注进行中 */
    PLAYING,
    /** 本局已结算 */
    FINISHED,
    /** 流局：底池保留，倒计时后重新发牌 */
    REGAME;

    /** 是否允许加入 / 开局 */
    public boolean isIdle() {
        return this == WAITING || this == FINISHED;
    }
}
