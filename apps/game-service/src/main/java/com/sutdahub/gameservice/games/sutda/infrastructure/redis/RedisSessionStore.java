package com.sutdahub.gameservice.games.sutda.infrastructure.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sutdahub.gameservice.common.error.ConcurrencyConflictException;
import com.sutdahub.gameservice.common.error.GameStateException;
import com.sutdahub.gameservice.common.error.NotFoundException;
import com.sutdahub.gameservice.games.sutda.domain.constants.GameMessages;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionType;
import com.sutdahub.gameservice.games.sutda.domain.model.GameChange;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;
import com.sutdahub.gameservice.games.sutda.domain.repository.GameTransition;
import com.sutdahub.gameservice.games.sutda.domain.repository.SessionStore;
import com.sutdahub.gameservice.games.sutda.domain.repository.Subscription;
import com.sutdahub.gameservice.infrastructure.redis.RedisOps;
import com.sutdahub.gameservice.platform.transport.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * RedisSessionStore
 * -------------------------------------------------------
 * SessionStore 的 Redis 实现（默认）。
 * - 对局：String JSON；玩家：Hash(playerId → JSON)；审计：List JSON；
 * - 条件写入：WATCH 对局键与玩家 Hash，读取校验版本后在 MULTI/EXEC 中整体写入，
 *   EXEC 返回 null 表示期间被其他请求改动，视为版本冲突；
 * - 巡检索引：ZSET，score = 回合截止或重开时间；
 * - 变更通知：提交成功后 PUBLISH 到对局频道，失败只记日志。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "sutda.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisSessionStore implements SessionStore {

    private static final Duration GAME_TTL = Duration.ofHours(48);
    private static final TypeReference<Envelope<GameChange>> CHANGE_ENVELOPE = new TypeReference<>() {};

    private final RedisOps ops;
    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;

    /** SessionCallback 内部的 CAS 结果，异常统一在回调外抛出 */
    private enum CasStatus { OK, MISSING, STALE, PLAYER_MISSING, PLAYER_STALE, EXISTS, RACED }

    private record Cas<T>(CasStatus status, T value, long actual) {
        static <T> Cas<T> ok(T value) {
            return new Cas<>(CasStatus.OK, value, -1);
        }

        static <T> Cas<T> fail(CasStatus status, long actual) {
            return new Cas<>(status, null, actual);
        }
    }

    @Override
    public Optional<GameState> readGameState(String gameId) {
        String json = ops.getString(RedisKeys.game(gameId));
        return Optional.ofNullable(json).map(j -> fromJson(j, GameState.class));
    }

    @Override
    public List<PlayerState> readPlayers(String gameId) {
        return ops.hGetAll(RedisKeys.players(gameId)).values().stream()
                .map(j -> fromJson(j, PlayerState.class))
                .sorted(Comparator.comparingInt(PlayerState::getSeat))
                .toList();
    }

    @Override
    public GameState conditionalUpdateGame(String gameId, long expectedVersion, UnaryOperator<GameState> patch) {
        final String gameKey = RedisKeys.game(gameId);
        Cas<GameState> res = redisTemplate.execute(new SessionCallback<Cas<GameState>>() {
            @SuppressWarnings("unchecked")
            @Override
            public <K, V> Cas<GameState> execute(RedisOperations<K, V> operations) throws DataAccessException {
                operations.watch((K) gameKey);
                GameState cur = readGame(operations, gameKey);
                if (cur == null) {
                    operations.unwatch();
                    return Cas.fail(CasStatus.MISSING, -1);
                }
                if (cur.getVersion() != expectedVersion) {
                    operations.unwatch();
                    return Cas.fail(CasStatus.STALE, cur.getVersion());
                }
                GameState next = patch.apply(cur).toBuilder().gameId(gameId).version(expectedVersion + 1).build();
                operations.multi();
                writeGame(operations, next);
                return operations.exec() == null ? Cas.fail(CasStatus.RACED, -1) : Cas.ok(next);
            }
        });
        GameState next = unwrap(res, expectedVersion);
        publish(next, null);
        return next;
    }

    @Override
    public PlayerState conditionalUpdatePlayer(String gameId, String playerId, long expectedVersion,
                                               UnaryOperator<PlayerState> patch) {
        final String playersKey = RedisKeys.players(gameId);
        Cas<PlayerState> res = redisTemplate.execute(new SessionCallback<Cas<PlayerState>>() {
            @SuppressWarnings("unchecked")
            @Override
            public <K, V> Cas<PlayerState> execute(RedisOperations<K, V> operations) throws DataAccessException {
                operations.watch((K) playersKey);
                Object raw = operations.opsForHash().get((K) playersKey, playerId);
                if (raw == null) {
                    operations.unwatch();
                    return Cas.fail(CasStatus.PLAYER_MISSING, -1);
                }
                PlayerState cur = fromJson(String.valueOf(raw), PlayerState.class);
                if (cur.getVersion() != expectedVersion) {
                    operations.unwatch();
                    return Cas.fail(CasStatus.PLAYER_STALE, cur.getVersion());
                }
                PlayerState next = patch.apply(cur).toBuilder()
                        .gameId(gameId).playerId(playerId).version(expectedVersion + 1).build();
                operations.multi();
                operations.opsForHash().put((K) playersKey, playerId, toJson(next));
                operations.expire((K) playersKey, GAME_TTL);
                return operations.exec() == null ? Cas.fail(CasStatus.RACED, -1) : Cas.ok(next);
            }
        });
        return unwrap(res, expectedVersion);
    }

    @Override
    public void appendAction(ActionRecord record) {
        if (ops.getString(RedisKeys.game(record.getGameId())) == null) {
            throw new NotFoundException(GameMessages.GAME_NOT_FOUND);
        }
        String key = RedisKeys.actions(record.getGameId());
        ops.rPush(key, toJson(record));
        ops.expire(key, GAME_TTL);
    }

    @Override
    public List<ActionRecord> listActions(String gameId) {
        if (ops.getString(RedisKeys.game(gameId)) == null) {
            throw new NotFoundException(GameMessages.GAME_NOT_FOUND);
        }
        return ops.lRange(RedisKeys.actions(gameId), 0, -1).stream()
                .map(j -> fromJson(j, ActionRecord.class))
                .toList();
    }

    @Override
    public Subscription subscribeToChanges(String gameId, Consumer<GameChange> callback) {
        ChannelTopic topic = new ChannelTopic(RedisKeys.changes(gameId));
        MessageListener listener = (message, pattern) -> {
            try {
                Envelope<GameChange> env = objectMapper.readValue(message.getBody(), CHANGE_ENVELOPE);
                callback.accept(env.payload());
            } catch (Exception e) {
                log.warn("处理变更通知失败: game={}", gameId, e);
            }
        };
        listenerContainer.addMessageListener(listener, topic);
        return () -> listenerContainer.removeMessageListener(listener, topic);
    }

    @Override
    public GameState createGame(GameState game) {
        GameState stored = game.toBuilder().version(0).build();
        boolean ok = ops.setStringNx(RedisKeys.game(game.getGameId()), toJson(stored), GAME_TTL);
        if (!ok) {
            throw new GameStateException(GameMessages.GAME_EXISTS);
        }
        return stored;
    }

    @Override
    public PlayerState addPlayer(long expectedGameVersion, PlayerState player) {
        final String gameKey = RedisKeys.game(player.getGameId());
        final String playersKey = RedisKeys.players(player.getGameId());
        final PlayerState stored = player.toBuilder().version(0).build();
        Cas<GameState> res = redisTemplate.execute(new SessionCallback<Cas<GameState>>() {
            @SuppressWarnings("unchecked")
            @Override
            public <K, V> Cas<GameState> execute(RedisOperations<K, V> operations) throws DataAccessException {
                operations.watch((List<K>) List.of(gameKey, playersKey));
                GameState cur = readGame(operations, gameKey);
                if (cur == null) {
                    operations.unwatch();
                    return Cas.fail(CasStatus.MISSING, -1);
                }
                if (cur.getVersion() != expectedGameVersion) {
                    operations.unwatch();
                    return Cas.fail(CasStatus.STALE, cur.getVersion());
                }
                if (Boolean.TRUE.equals(operations.opsForHash().hasKey((K) playersKey, player.getPlayerId()))) {
                    operations.unwatch();
                    return Cas.fail(CasStatus.EXISTS, -1);
                }
                GameState next = cur.toBuilder().version(expectedGameVersion + 1).build();
                operations.multi();
                writeGame(operations, next);
                operations.opsForHash().put((K) playersKey, player.getPlayerId(), toJson(stored));
                operations.expire((K) playersKey, GAME_TTL);
                return operations.exec() == null ? Cas.fail(CasStatus.RACED, -1) : Cas.ok(next);
            }
        });
        GameState next = unwrap(res, expectedGameVersion);
        publish(next, ActionType.JOIN);
        return stored;
    }

    /**
     * 原子提交：WATCH 对局键与玩家 Hash，校验对局与每个玩家的版本后整体写入。
     */
    @Override
    public GameState commit(GameTransition t) {
        final String gameKey = RedisKeys.game(t.gameId());
        final String playersKey = RedisKeys.players(t.gameId());
        final String actionsKey = RedisKeys.actions(t.gameId());
        Cas<GameState> res = redisTemplate.execute(new SessionCallback<Cas<GameState>>() {
            @SuppressWarnings("unchecked")
            @Override
            public <K, V> Cas<GameState> execute(RedisOperations<K, V> operations) throws DataAccessException {
                // 1) 监视对局与玩家
                operations.watch((List<K>) List.of(gameKey, playersKey));

                // 2) 读取并校验版本
                GameState cur = readGame(operations, gameKey);
                if (cur == null) {
                    operations.unwatch();
                    return Cas.fail(CasStatus.MISSING, -1);
                }
                if (cur.getVersion() != t.expectedVersion()) {
                    operations.unwatch();
                    return Cas.fail(CasStatus.STALE, cur.getVersion());
                }
                for (PlayerState p : t.players()) {
                    Object raw = operations.opsForHash().get((K) playersKey, p.getPlayerId());
                    if (raw == null) {
                        operations.unwatch();
                        return Cas.fail(CasStatus.PLAYER_MISSING, -1);
                    }
                    long stored = fromJson(String.valueOf(raw), PlayerState.class).getVersion();
                    if (stored != p.getVersion()) {
                        operations.unwatch();
                        return Cas.fail(CasStatus.PLAYER_STALE, stored);
                    }
                }

                // 3) 事务写入：对局 + 玩家 + 审计 + 巡检索引
                GameState next = t.game().toBuilder().gameId(t.gameId()).version(t.expectedVersion() + 1).build();
                operations.multi();
                writeGame(operations, next);
                for (PlayerState p : t.players()) {
                    PlayerState bumped = p.toBuilder().version(p.getVersion() + 1).build();
                    operations.opsForHash().put((K) playersKey, p.getPlayerId(), toJson(bumped));
                }
                operations.expire((K) playersKey, GAME_TTL);
                for (ActionRecord a : t.actions()) {
                    operations.opsForList().rightPush((K) actionsKey, (V) toJson(a));
                }
                operations.expire((K) actionsKey, GAME_TTL);

                // 4) 提交：exec 返回 null 代表被改动冲突
                return operations.exec() == null ? Cas.fail(CasStatus.RACED, -1) : Cas.ok(next);
            }
        });
        GameState next = unwrap(res, t.expectedVersion());
        publish(next, t.actions().isEmpty() ? null : t.actions().get(t.actions().size() - 1).getType());
        return next;
    }

    @Override
    public List<String> findDueGames(long nowEpochMs) {
        return new ArrayList<>(ops.zRangeByScore(RedisKeys.dueIndex(), 0, nowEpochMs));
    }

    // ------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private <K, V> GameState readGame(RedisOperations<K, V> operations, String gameKey) {
        Object raw = operations.opsForValue().get((K) gameKey);
        return raw == null ? null : fromJson(String.valueOf(raw), GameState.class);
    }

    /** 写对局记录并同步巡检索引（须在 MULTI 之后调用） */
    @SuppressWarnings("unchecked")
    private <K, V> void writeGame(RedisOperations<K, V> operations, GameState next) {
        operations.opsForValue().set((K) RedisKeys.game(next.getGameId()), (V) toJson(next), GAME_TTL);
        Long dueAt = next.dueAt();
        if (dueAt == null) {
            operations.opsForZSet().remove((K) RedisKeys.dueIndex(), next.getGameId());
        } else {
            operations.opsForZSet().add((K) RedisKeys.dueIndex(), (V) next.getGameId(), dueAt);
        }
    }

    private <T> T unwrap(Cas<T> res, long expectedVersion) {
        if (res == null) {
            throw new ConcurrencyConflictException(GameMessages.formatVersionConflict(expectedVersion, -1), expectedVersion, -1);
        }
        switch (res.status()) {
            case OK:
                return res.value();
            case MISSING:
                throw new NotFoundException(GameMessages.GAME_NOT_FOUND);
            case PLAYER_MISSING:
                throw new NotFoundException(GameMessages.PLAYER_NOT_FOUND);
            case EXISTS:
                throw new GameStateException(GameMessages.PLAYER_EXISTS);
            case PLAYER_STALE:
                throw new ConcurrencyConflictException(GameMessages.PLAYER_VERSION_CONFLICT, expectedVersion, res.actual());
            default:
                throw new ConcurrencyConflictException(
                        GameMessages.formatVersionConflict(expectedVersion, res.actual()), expectedVersion, res.actual());
        }
    }

    /** 发布变更通知：fire-and-forget，失败只记日志 */
    private void publish(GameState g, ActionType cause) {
        try {
            GameChange change = new GameChange(g.getGameId(), g.getVersion(), g.getStatus(), cause);
            Envelope<GameChange> env = Envelope.event("sutda", g.getGameId(), change, g.getVersion(), g.getUpdatedAt());
            ops.publish(RedisKeys.changes(g.getGameId()), toJson(env));
        } catch (RuntimeException e) {
            log.warn("发布变更通知失败: game={}, version={}", g.getGameId(), g.getVersion(), e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 序列化失败: " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 反序列化失败: " + type.getSimpleName(), e);
        }
    }
}
