package com.sutdahub.gameservice.common.error;

/** 输入不合法 */
public class ValidationException extends SutdaException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }
}
