package com.sutdahub.gameservice.common.error;

/**
 * 条件写入失败：存储中的版本已不是调用方读取时的版本。
 * 调用方可以重新读取、重新校验后再试一次。
 */
public class ConcurrencyConflictException extends SutdaException {

    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String message, long expectedVersion, long actualVersion) {
        super(ErrorCode.CONFLICT, message);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    /** 冲突时存储中的实际版本；未知时为 -1 */
    public long getActualVersion() {
        return actualVersion;
    }
}
