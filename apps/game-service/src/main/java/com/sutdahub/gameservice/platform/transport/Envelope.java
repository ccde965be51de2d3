package com.sutdahub.gameservice.platform.transport;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * 传输消息外壳（平台通用）
 * - 强类型泛型载荷：Envelope<T>
 * - 字段：kind / game / gameId / payload / ts / seq
 * - record 形式，Jackson 可直接序列化/反序列化（配合 TypeReference 还原泛型）
 *
 * 用法示例：
 *   Envelope<GameChange> msg = Envelope.event("sutda", gameId, change, change.version(), nowMs);
 */
public record Envelope<T>(Kind kind, String game, String gameId, T payload, long ts, long seq)
        implements Serializable {

    @Serial private static final long serialVersionUID = 1L;

    /** 消息类别：STATE=完整状态，EVENT=增量事件，ERROR=错误通知 */
    public enum Kind { STATE, EVENT, ERROR }

    public Envelope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(game, "game");
        Objects.requireNonNull(gameId, "gameId");
    }

    /** 增量事件（seq 使用对局版本号，接收端可据此丢弃乱序消息） */
    public static <T> Envelope<T> event(String game, String gameId, T payload, long seq, long ts) {
        return new Envelope<>(Kind.EVENT, game, gameId, payload, ts, seq);
    }
}
