package com.sutdahub.gameservice.common.error;

/** 对局或玩家不存在 */
public class NotFoundException extends SutdaException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
