package com.sutdahub.gameservice.common.error;

/**
 * 业务错误种类。
 * HTTP 状态码仅作为接口层映射参考，引擎内部只关心种类本身。
 */
public enum ErrorCode {
    /** 输入不合法（参数缺失、金额低于下限、未知动作等） */
    VALIDATION(400),
    /** 不是你的回合 / 回合已过期 / 已弃牌 */
    TURN(409),
    /** 当前局状态不允许该操作 */
    STATE(409),
    /** 余额不足 */
    INSUFFICIENT_FUNDS(400),
    /** 对局或玩家不存在 */
    NOT_FOUND(404),
    /** 乐观锁写入失败（版本已变化），可重读后重试 */
    CONFLICT(409);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
