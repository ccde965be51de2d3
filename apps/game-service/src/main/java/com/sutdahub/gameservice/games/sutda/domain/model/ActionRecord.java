package com.sutdahub.gameservice.games.sutda.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 审计记录（只追加）。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ActionRecord {
    String gameId;
    int round;
    /** 写入后的对局版本 */
    long gameVersion;
    ActionType type;
    String playerId;
    long amount;
    /** 是否为超时巡检代为执行 */
    boolean forced;
    String note;
    long at;
}
