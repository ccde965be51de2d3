package com.sutdahub.gameservice.common.error;

/**
 * 花斗引擎的业务异常基类（非受检）。
 * 每个子类对应一种 {@link ErrorCode}，由接口层统一映射为 ApiResponse。
 */
public abstract class SutdaException extends RuntimeException {

    private final ErrorCode code;

    protected SutdaException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected SutdaException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
