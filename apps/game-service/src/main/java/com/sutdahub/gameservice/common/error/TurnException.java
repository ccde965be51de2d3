package com.sutdahub.gameservice.common.error;

/** 回合错误（非当前行动者、回合已过期或已弃牌） */
public class TurnException extends SutdaException {

    public TurnException(String message) {
        super(ErrorCode.TURN, message);
    }
}
