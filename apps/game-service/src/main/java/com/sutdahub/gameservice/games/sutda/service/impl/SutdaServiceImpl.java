package com.sutdahub.gameservice.games.sutda.service.impl;

import com.sutdahub.gameservice.common.error.ConcurrencyConflictException;
import com.sutdahub.gameservice.common.error.GameStateException;
import com.sutdahub.gameservice.common.error.NotFoundException;
import com.sutdahub.gameservice.common.error.TurnException;
import com.sutdahub.gameservice.common.error.ValidationException;
import com.sutdahub.gameservice.games.sutda.domain.card.Card;
import com.sutdahub.gameservice.games.sutda.domain.constants.GameMessages;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionType;
import com.sutdahub.gameservice.games.sutda.domain.model.GameChange;
import com.sutdahub.gameservice.games.sutda.domain.model.GameMode;
import com.sutdahub.gameservice.games.sutda.domain.model.GameSnapshot;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.GameStatus;
import com.sutdahub.gameservice.games.sutda.domain.model.GameTable;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerView;
import com.sutdahub.gameservice.games.sutda.domain.repository.GameTransition;
import com.sutdahub.gameservice.games.sutda.domain.repository.SessionStore;
import com.sutdahub.gameservice.games.sutda.domain.repository.Subscription;
import com.sutdahub.gameservice.games.sutda.domain.rule.BettingStateMachine;
import com.sutdahub.gameservice.games.sutda.domain.rule.ResolutionEngine;
import com.sutdahub.gameservice.games.sutda.domain.rule.RoundDealer;
import com.sutdahub.gameservice.games.sutda.domain.rule.RoundResult;
import com.sutdahub.gameservice.games.sutda.domain.rule.Step;
import com.sutdahub.gameservice.games.sutda.domain.rule.TurnOrder;
import com.sutdahub.gameservice.games.sutda.service.CreatedGame;
import com.sutdahub.gameservice.games.sutda.service.SutdaService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

@Slf4j
@Service
public class SutdaServiceImpl implements SutdaService {

    /** 快照中附带的最近审计条数 */
    private static final int RECENT_ACTIONS = 20;

    private final SessionStore store;
    private final BettingStateMachine machine;
    private final RoundDealer dealer;
    private final ResolutionEngine resolution;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    /** 默认底注 */
    private final long defaultBaseBet;
    /** 入座初始余额 */
    private final long initialBalance;
    /** 未指定期望版本时，冲突后的最大尝试次数 */
    private final int maxAttempts;

    public SutdaServiceImpl(SessionStore store,
                            BettingStateMachine machine,
                            RoundDealer dealer,
                            ResolutionEngine resolution,
                            Clock clock,
                            @Qualifier("turnClockScheduler") ScheduledExecutorService scheduler,
                            @Value("${sutda.game.base-bet:1000}") long defaultBaseBet,
                            @Value("${sutda.player.initial-balance:100000}") long initialBalance,
                            @Value("${sutda.action.max-attempts:3}") int maxAttempts) {
        this.store = store;
        this.machine = machine;
        this.dealer = dealer;
        this.resolution = resolution;
        this.clock = clock;
        this.scheduler = scheduler;
        this.defaultBaseBet = defaultBaseBet;
        this.initialBalance = initialBalance;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    // ========== 建局 / 入座 / 开局 ==========

    @Override
    public CreatedGame createGame(String hostName, Long baseBet, GameMode mode) {
        String name = requireName(hostName);
        long bet = baseBet == null ? defaultBaseBet : baseBet;
        if (bet <= 0) {
            throw new ValidationException(GameMessages.BASE_BET_INVALID);
        }
        long now = clock.millis();
        String gameId = UUID.randomUUID().toString();
        String hostId = UUID.randomUUID().toString();
        GameState created = store.createGame(GameState.builder()
                .gameId(gameId)
                .status(GameStatus.WAITING)
                .mode(mode == null ? GameMode.TWO_CARD : mode)
                .baseBet(bet)
                .hostId(hostId)
                .createdAt(now)
                .updatedAt(now)
                .build());
        store.addPlayer(created.getVersion(), newPlayer(gameId, hostId, name, 0, now));
        audit(joinRecord(gameId, hostId, created.getRound(), now));
        log.info("建局: game={}, host={}, baseBet={}, mode={}", gameId, hostId, bet, created.getMode());
        return new CreatedGame(gameId, hostId);
    }

    @Override
    public PlayerState joinGame(String gameId, String name) {
        String trimmed = requireName(name);
        return withRetry(maxAttempts, gameId, () -> {
            GameState g = requireGame(gameId);
            if (!g.getStatus().isIdle()) {
                throw new GameStateException(GameMessages.JOIN_NOT_ALLOWED);
            }
            List<PlayerState> players = store.readPlayers(gameId);
            int capacity = g.getMode().capacity();
            if (players.size() >= capacity) {
                throw new GameStateException(GameMessages.formatGameFull(capacity));
            }
            int seat = players.stream().mapToInt(PlayerState::getSeat).max().orElse(-1) + 1;
            long now = clock.millis();
            PlayerState stored = store.addPlayer(g.getVersion(),
                    newPlayer(gameId, UUID.randomUUID().toString(), trimmed, seat, now));
            audit(joinRecord(gameId, stored.getPlayerId(), g.getRound(), now));
            log.info("入座: game={}, player={}, seat={}", gameId, stored.getPlayerId(), seat);
            return stored;
        });
    }

    @Override
    public GameSnapshot startGame(String gameId) {
        withRetry(maxAttempts, gameId, () -> {
            long now = clock.millis();
            GameTable table = loadTable(gameId);
            GameState committed = commitStep(table, dealer.startRound(table, now), now);
            log.info("开局: game={}, round={}, first={}", gameId, committed.getRound(), committed.getCurrentPlayerId());
            return committed;
        });
        return getGameState(gameId, null);
    }

    // ========== 行动 ==========

    @Override
    public GameSnapshot submitAction(String gameId, String playerId, ActionType type, Long amount, Long expectedVersion) {
        if (type == null) {
            throw new ValidationException(GameMessages.ACTION_REQUIRED);
        }
        if (!type.isPlayerAction()) {
            throw new ValidationException(GameMessages.formatNotAPlayerAction(type));
        }
        int attempts = expectedVersion == null ? maxAttempts : 1;
        withRetry(attempts, gameId, () -> {
            long now = clock.millis();
            GameTable table = loadTable(gameId);
            long actual = table.game().getVersion();
            if (expectedVersion != null && actual != expectedVersion) {
                throw new ConcurrencyConflictException(
                        GameMessages.formatVersionConflict(expectedVersion, actual), expectedVersion, actual);
            }
            return commitStep(table, machine.apply(table, playerId, type, amount, now, false), now);
        });
        return getGameState(gameId, playerId);
    }

    @Override
    public GameSnapshot selectCards(String gameId, String playerId, List<Integer> cardIds) {
        if (cardIds == null || cardIds.size() != 2) {
            throw new ValidationException(GameMessages.HAND_SIZE_INVALID);
        }
        List<Card> chosen = cardIds.stream().map(Card::of).toList();
        if (new HashSet<>(chosen).size() != 2) {
            throw new ValidationException(GameMessages.DUPLICATE_CARD);
        }
        withRetry(maxAttempts, gameId, () -> {
            long now = clock.millis();
            GameTable table = loadTable(gameId);
            GameState g = table.game();
            if (g.getMode() != GameMode.THREE_CARD || g.getStatus() != GameStatus.PLAYING) {
                throw new GameStateException(GameMessages.SELECT_NOT_ALLOWED);
            }
            PlayerState p = table.player(playerId)
                    .orElseThrow(() -> new NotFoundException(GameMessages.PLAYER_NOT_FOUND));
            if (!p.isInRound()) {
                throw new TurnException(GameMessages.NOT_IN_ROUND);
            }
            if (p.isFolded()) {
                throw new TurnException(GameMessages.ALREADY_FOLDED);
            }
            if (!p.getCards().containsAll(chosen)) {
                throw new ValidationException(GameMessages.SELECT_NOT_OWNED);
            }
            GameTable after = table
                    .withPlayer(p.toBuilder().selected(List.copyOf(chosen)).build())
                    .withGame(g.toBuilder().updatedAt(now).build());
            ActionRecord record = ActionRecord.builder()
                    .gameId(gameId)
                    .round(g.getRound())
                    .type(ActionType.SELECT)
                    .playerId(playerId)
                    .at(now)
                    .build();
            return store.commit(GameTransition.between(table, after, List.of(record)));
        });
        return getGameState(gameId, playerId);
    }

    // ========== 查询 / 订阅 ==========

    @Override
    public GameSnapshot getGameState(String gameId, String viewerPlayerId) {
        GameTable table = loadTable(gameId);
        return toSnapshot(table, viewerPlayerId, clock.millis(), recentActions(gameId));
    }

    @Override
    public List<ActionRecord> listActions(String gameId) {
        return store.listActions(gameId);
    }

    @Override
    public Subscription watchGame(String gameId, Consumer<GameChange> listener) {
        requireGame(gameId);
        return store.subscribeToChanges(gameId, listener);
    }

    // ========== 巡检入口 ==========

    @Override
    public boolean handleTurnTimeout(String gameId, long observedDeadline) {
        long now = clock.millis();
        GameTable table = loadTable(gameId);
        GameState g = table.game();
        if (g.getStatus() != GameStatus.PLAYING
                || g.getTurnDeadline() == null
                || g.getTurnDeadline() != observedDeadline
                || observedDeadline > now) {
            log.debug("超时跳过: game={}, status={}, deadline={}, observed={}",
                    gameId, g.getStatus(), g.getTurnDeadline(), observedDeadline);
            return false;
        }
        PlayerState actor = table.player(g.getCurrentPlayerId()).orElse(null);
        Step step;
        if (actor == null || !TurnOrder.canAct(actor)) {
            log.warn("当前行动者已弃牌或不存在，改派下一位: game={}, player={}", gameId, g.getCurrentPlayerId());
            step = machine.correctTurn(table, now);
        } else {
            log.info("回合超时，自动弃牌: game={}, player={}", gameId, actor.getPlayerId());
            step = machine.apply(table, actor.getPlayerId(), ActionType.DIE, null, now, true);
        }
        try {
            commitStep(table, step, now);
            return true;
        } catch (ConcurrencyConflictException e) {
            log.debug("超时处理期间对局已变化，跳过: game={}", gameId);
            return false;
        }
    }

    @Override
    public boolean redealAfterRegame(String gameId) {
        long now = clock.millis();
        GameTable table = loadTable(gameId);
        GameState g = table.game();
        if (g.getStatus() != GameStatus.REGAME || (g.getRegameAt() != null && g.getRegameAt() > now)) {
            return false;
        }
        try {
            GameState committed = commitStep(table, dealer.redeal(table, now), now);
            log.info("流局重发: game={}, round={}, pot={}", gameId, committed.getRound(), committed.getPot());
            return true;
        } catch (ConcurrencyConflictException e) {
            log.debug("重发已由其他调用完成: game={}", gameId);
            return false;
        }
    }

    // ========== 内部 ==========

    /**
     * 提交一步；本轮结束时先结算再一并提交。流局则安排一次延时重发。
     */
    private GameState commitStep(GameTable before, Step step, long now) {
        GameTable after = step.table();
        List<ActionRecord> records = new ArrayList<>();
        records.add(step.record());
        RoundResult result = null;
        if (step.roundComplete()) {
            result = resolution.resolve(after, now);
            after = result.table();
            records.add(result.record());
        }
        GameState committed = store.commit(GameTransition.between(before, after, records));
        if (result != null && result.kind() == RoundResult.Kind.REGAME) {
            scheduleRedeal(committed);
        }
        return committed;
    }

    private void scheduleRedeal(GameState regame) {
        String gameId = regame.getGameId();
        long delay = Math.max(0L, regame.getRegameAt() - clock.millis());
        scheduler.schedule(() -> {
            try {
                redealAfterRegame(gameId);
            } catch (RuntimeException e) {
                log.warn("流局重发失败，等待巡检补偿: game={}", gameId, e);
            }
        }, delay, TimeUnit.MILLISECONDS);
    }

    private <T> T withRetry(int attempts, String gameId, Supplier<T> body) {
        for (int i = 1; ; i++) {
            try {
                return body.get();
            } catch (ConcurrencyConflictException e) {
                if (i >= attempts) {
                    throw e;
                }
                log.debug("版本冲突，重读重试: game={}, attempt={}", gameId, i);
            }
        }
    }

    private GameState requireGame(String gameId) {
        return store.readGameState(gameId)
                .orElseThrow(() -> new NotFoundException(GameMessages.GAME_NOT_FOUND));
    }

    private GameTable loadTable(String gameId) {
        GameState g = requireGame(gameId);
        return new GameTable(g, store.readPlayers(gameId));
    }

    private PlayerState newPlayer(String gameId, String playerId, String name, int seat, long now) {
        return PlayerState.builder()
                .gameId(gameId)
                .playerId(playerId)
                .name(name)
                .seat(seat)
                .balance(initialBalance)
                .joinedAt(now)
                .build();
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(GameMessages.NAME_REQUIRED);
        }
        return name.trim();
    }

    private static ActionRecord joinRecord(String gameId, String playerId, int round, long now) {
        return ActionRecord.builder()
                .gameId(gameId)
                .round(round)
                .type(ActionType.JOIN)
                .playerId(playerId)
                .at(now)
                .build();
    }

    /** 入座审计为附带记录：写入失败只告警，不回滚入座 */
    private void audit(ActionRecord record) {
        try {
            store.appendAction(record);
        } catch (RuntimeException e) {
            log.warn("写入审计记录失败: game={}, type={}", record.getGameId(), record.getType(), e);
        }
    }

    /** 最近审计记录（尽力而为：查询失败返回空列表） */
    private List<ActionRecord> recentActions(String gameId) {
        try {
            List<ActionRecord> all = store.listActions(gameId);
            return all.subList(Math.max(0, all.size() - RECENT_ACTIONS), all.size());
        } catch (RuntimeException e) {
            log.warn("读取审计记录失败，快照不含最近行动: game={}", gameId, e);
            return List.of();
        }
    }

    private GameSnapshot toSnapshot(GameTable table, String viewer, long now, List<ActionRecord> recent) {
        GameState g = table.game();
        boolean showdown = g.getStatus() == GameStatus.FINISHED && g.isRevealCards();
        List<PlayerView> views = new ArrayList<>();
        for (PlayerState p : table.players()) {
            boolean visible = p.getPlayerId().equals(viewer) || (showdown && TurnOrder.inPlay(p));
            boolean hasHand = p.getCards().size() >= 2;
            views.add(PlayerView.builder()
                    .playerId(p.getPlayerId())
                    .name(p.getName())
                    .seat(p.getSeat())
                    .balance(p.getBalance())
                    .inRound(p.isInRound())
                    .folded(p.isFolded())
                    .roundBet(p.getRoundBet())
                    .cardCount(p.getCards().size())
                    .cards(visible ? p.getCards().stream().map(Card::id).toList() : null)
                    .selected(visible ? p.getSelected().stream().map(Card::id).toList() : null)
                    .handRank(visible && hasHand ? resolution.handOf(p).rank().name() : null)
                    .build());
        }
        long countdown = 0L;
        if (g.getStatus() == GameStatus.REGAME && g.getRegameAt() != null) {
            countdown = Math.max(0L, (g.getRegameAt() - now + 999) / 1000);
        }
        return GameSnapshot.builder()
                .gameId(g.getGameId())
                .status(g.getStatus())
                .mode(g.getMode())
                .baseBet(g.getBaseBet())
                .pot(g.getPot())
                .lastBet(g.getLastBet())
                .minimumBet(BettingStateMachine.minimumBet(g))
                .round(g.getRound())
                .currentPlayerId(g.getCurrentPlayerId())
                .turnDeadline(g.getTurnDeadline())
                .winnerId(g.getWinnerId())
                .payout(g.getPayout())
                .bonusLedger(g.getBonusLedger())
                .revealCards(g.isRevealCards())
                .winningRank(g.getWinningRank())
                .regameCountdownSeconds(countdown)
                .version(g.getVersion())
                .players(views)
                .recentActions(List.copyOf(recent))
                .build();
    }
}
