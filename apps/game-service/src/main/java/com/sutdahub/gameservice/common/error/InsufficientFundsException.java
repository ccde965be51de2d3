package com.sutdahub.gameservice.common.error;

/** 余额不足 */
public class InsufficientFundsException extends SutdaException {

    public InsufficientFundsException(String message) {
        super(ErrorCode.INSUFFICIENT_FUNDS, message);
    }
}
