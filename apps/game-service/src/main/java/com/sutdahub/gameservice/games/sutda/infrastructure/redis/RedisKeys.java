package com.sutdahub.gameservice.games.sutda.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "sutda:";

    private RedisKeys() {}

    // ---- 对局记录（String，JSON） ----
    public static String game(String gameId) {
        return PFX + "game:" + gameId;
    }

    // ---- 玩家记录（Hash：playerId -> JSON） ----
    public static String players(String gameId) {
        return PFX + "game:" + gameId + ":players";
    }

    // ---- 审计记录（List，JSON，只追加） ----
    public static String actions(String gameId) {
        return PFX + "game:" + gameId + ":actions";
    }

    // ---- 变更通知频道 ----
    public static String changes(String gameId) {
        return PFX + "game:" + gameId + ":changes";
    }

    /** 巡检索引（ZSET），score 为回合截止 / 重开时间（epoch millis） */
    public static String dueIndex() {
        return PFX + "games:due";
    }
}
