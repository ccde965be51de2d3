package com.sutdahub.gameservice.games.sutda.infrastructure.memory;

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * 进程内 SessionStore：单锁串行化所有写入，语义与 Redis 实现一致。
 * 用于单元测试与本地运行（sutda.store.type=memory）。
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "sutda.store.type", havingValue = "memory")
public class InMemorySessionStore implements SessionStore {

    private final Object lock = new Object();
    private final Map<String, GameState> games = new HashMap<>();
    private final Map<String, Map<String, PlayerState>> players = new HashMap<>();
    private final Map<String, List<ActionRecord>> actions = new HashMap<>();
    /** 巡检索引：gameId → 截止时间 */
    private final Map<String, Long> due = new HashMap<>();
    private final Map<String, List<Consumer<GameChange>>> listeners = new ConcurrentHashMap<>();

    @Override
    public Optional<GameState> readGameState(String gameId) {
        synchronized (lock) {
            return Optional.ofNullable(games.get(gameId));
        }
    }

    @Override
    public List<PlayerState> readPlayers(String gameId) {
        synchronized (lock) {
            Map<String, PlayerState> m = players.getOrDefault(gameId, Map.of());
            return m.values().stream().sorted(Comparator.comparingInt(PlayerState::getSeat)).toList();
        }
    }

    @Override
    public GameState conditionalUpdateGame(String gameId, long expectedVersion, UnaryOperator<GameState> patch) {
        GameState next;
        synchronized (lock) {
            GameState cur = requireGame(gameId);
            checkVersion(cur.getVersion(), expectedVersion);
            next = patch.apply(cur).toBuilder().gameId(gameId).version(expectedVersion + 1).build();
            putGame(next);
        }
        publish(next, null);
        return next;
    }

    @Override
    public PlayerState conditionalUpdatePlayer(String gameId, String playerId, long expectedVersion,
                                               UnaryOperator<PlayerState> patch) {
        synchronized (lock) {
            requireGame(gameId);
            PlayerState cur = players.getOrDefault(gameId, Map.of()).get(playerId);
            if (cur == null) {
                throw new NotFoundException(GameMessages.PLAYER_NOT_FOUND);
            }
            if (cur.getVersion() != expectedVersion) {
                throw new ConcurrencyConflictException(GameMessages.PLAYER_VERSION_CONFLICT, expectedVersion, cur.getVersion());
            }
            PlayerState next = patch.apply(cur).toBuilder()
                    .gameId(gameId).playerId(playerId).version(expectedVersion + 1).build();
            players.get(gameId).put(playerId, next);
            return next;
        }
    }

    @Override
    public void appendAction(ActionRecord record) {
        synchronized (lock) {
            requireGame(record.getGameId());
            actions.computeIfAbsent(record.getGameId(), k -> new ArrayList<>()).add(record);
        }
    }

    @Override
    public List<ActionRecord> listActions(String gameId) {
        synchronized (lock) {
            requireGame(gameId);
            return List.copyOf(actions.getOrDefault(gameId, List.of()));
        }
    }

    @Override
    public Subscription subscribeToChanges(String gameId, Consumer<GameChange> callback) {
        List<Consumer<GameChange>> list = listeners.computeIfAbsent(gameId, k -> new CopyOnWriteArrayList<>());
        list.add(callback);
        return () -> list.remove(callback);
    }

    @Override
    public GameState createGame(GameState game) {
        synchronized (lock) {
            if (games.containsKey(game.getGameId())) {
                throw new GameStateException(GameMessages.GAME_EXISTS);
            }
            GameState stored = game.toBuilder().version(0).build();
            putGame(stored);
            players.put(game.getGameId(), new LinkedHashMap<>());
            return stored;
        }
    }

    @Override
    public PlayerState addPlayer(long expectedGameVersion, PlayerState player) {
        GameState next;
        PlayerState stored;
        synchronized (lock) {
            GameState cur = requireGame(player.getGameId());
            checkVersion(cur.getVersion(), expectedGameVersion);
            Map<String, PlayerState> seated = players.get(player.getGameId());
            if (seated.containsKey(player.getPlayerId())) {
                throw new GameStateException(GameMessages.PLAYER_EXISTS);
            }
            stored = player.toBuilder().version(0).build();
            seated.put(player.getPlayerId(), stored);
            next = cur.toBuilder().version(expectedGameVersion + 1).build();
            putGame(next);
        }
        publish(next, ActionType.JOIN);
        return stored;
    }

    @Override
    public GameState commit(GameTransition t) {
        GameState next;
        synchronized (lock) {
            GameState cur = requireGame(t.gameId());
            checkVersion(cur.getVersion(), t.expectedVersion());
            Map<String, PlayerState> seated = players.get(t.gameId());
            for (PlayerState p : t.players()) {
                PlayerState stored = seated.get(p.getPlayerId());
                if (stored == null) {
                    throw new NotFoundException(GameMessages.PLAYER_NOT_FOUND);
                }
                if (stored.getVersion() != p.getVersion()) {
                    throw new ConcurrencyConflictException(GameMessages.PLAYER_VERSION_CONFLICT,
                            p.getVersion(), stored.getVersion());
                }
            }
            for (PlayerState p : t.players()) {
                seated.put(p.getPlayerId(), p.toBuilder().version(p.getVersion() + 1).build());
            }
            next = t.game().toBuilder().gameId(t.gameId()).version(t.expectedVersion() + 1).build();
            putGame(next);
            actions.computeIfAbsent(t.gameId(), k -> new ArrayList<>()).addAll(t.actions());
        }
        publish(next, t.actions().isEmpty() ? null : t.actions().get(t.actions().size() - 1).getType());
        return next;
    }

    @Override
    public List<String> findDueGames(long nowEpochMs) {
        synchronized (lock) {
            return due.entrySet().stream()
                    .filter(e -> e.getValue() <= nowEpochMs)
                    .sorted(Map.Entry.comparingByValue())
                    .map(Map.Entry::getKey)
                    .toList();
        }
    }

    private GameState requireGame(String gameId) {
        GameState cur = games.get(gameId);
        if (cur == null) {
            throw new NotFoundException(GameMessages.GAME_NOT_FOUND);
        }
        return cur;
    }

    private static void checkVersion(long actual, long expected) {
        if (actual != expected) {
            throw new ConcurrencyConflictException(GameMessages.formatVersionConflict(expected, actual), expected, actual);
        }
    }

    private void putGame(GameState g) {
        games.put(g.getGameId(), g);
        Long dueAt = g.dueAt();
        if (dueAt == null) {
            due.remove(g.getGameId());
        } else {
            due.put(g.getGameId(), dueAt);
        }
    }

    /** 通知订阅方，回调异常只记日志 */
    private void publish(GameState g, ActionType cause) {
        List<Consumer<GameChange>> list = listeners.get(g.getGameId());
        if (list == null || list.isEmpty()) {
            return;
        }
        GameChange change = new GameChange(g.getGameId(), g.getVersion(), g.getStatus(), cause);
        for (Consumer<GameChange> c : list) {
            try {
                c.accept(change);
            } catch (RuntimeException e) {
                log.warn("变更通知回调失败: game={}, version={}", g.getGameId(), g.getVersion(), e);
            }
        }
    }
}
