package com.sutdahub.gameservice.common.error;

/** 当前对局状态不允许该操作 */
public class GameStateException extends SutdaException {

    public GameStateException(String message) {
        super(ErrorCode.STATE, message);
    }
}
