package com.sutdahub.gameservice.games.sutda.domain.rule;

import com.sutdahub.gameservice.common.error.GameStateException;
import com.sutdahub.gameservice.common.error.InsufficientFundsException;
import com.sutdahub.gameservice.common.error.NotFoundException;
import com.sutdahub.gameservice.common.error.TurnException;
import com.sutdahub.gameservice.common.error.ValidationException;
import com.sutdahub.gameservice.games.sutda.domain.constants.GameMessages;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionType;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.GameStatus;
import com.sutdahub.gameservice.games.sutda.domain.model.GameTable;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * 下注状态机：校验并应用一次玩家行动，轮转行动者，判定本轮是否结束。
 * <p>
 * 纯计算，不做 IO；任何校验失败都抛异常且不产生新状态。
 * 投入按本轮累计（roundBet）计算，跟注额 = 最高投入 - 自己的投入。
 */
@Slf4j
public class BettingStateMachine {

    private final Duration turnDuration;

    public BettingStateMachine(Duration turnDuration) {
        this.turnDuration = turnDuration;
    }

    /**
     * 应用一次行动。
     *
     * @param forced 超时巡检代为弃牌时为 true，此时不校验截止时间
     */
    public Step apply(GameTable table, String playerId, ActionType type, Long amount, long now, boolean forced) {
        if (type == null) {
            throw new ValidationException(GameMessages.ACTION_REQUIRED);
        }
        if (!type.isPlayerAction()) {
            throw new ValidationException(GameMessages.formatNotAPlayerAction(type));
        }
        GameState g = table.game();
        if (g.getStatus() != GameStatus.PLAYING) {
            throw new GameStateException(GameMessages.GAME_NOT_PLAYING);
        }
        PlayerState actor = table.player(playerId)
                .orElseThrow(() -> new NotFoundException(GameMessages.PLAYER_NOT_FOUND));
        if (!actor.isInRound()) {
            throw new TurnException(GameMessages.NOT_IN_ROUND);
        }
        if (actor.isFolded()) {
            throw new TurnException(GameMessages.ALREADY_FOLDED);
        }
        if (!playerId.equals(g.getCurrentPlayerId())) {
            throw new TurnException(GameMessages.formatNotYourTurn(g.getCurrentPlayerId()));
        }
        if (!forced && g.getTurnDeadline() != null && now > g.getTurnDeadline()) {
            throw new TurnException(GameMessages.TURN_EXPIRED);
        }

        long highest = TurnOrder.highestBet(table.players());
        long contribution = contributionFor(type, amount, g, actor, highest);

        PlayerState updated = actor.toBuilder()
                .balance(actor.getBalance() - contribution)
                .roundBet(actor.getRoundBet() + contribution)
                .folded(type == ActionType.DIE)
                .acted(true)
                .build();
        GameState nextGame = g.toBuilder()
                .pot(g.getPot() + contribution)
                .lastBet(type.isBetType() ? contribution : g.getLastBet())
                .updatedAt(now)
                .build();
        GameTable next = table.withPlayer(updated).withGame(nextGame);

        ActionRecord record = ActionRecord.builder()
                .gameId(g.getGameId())
                .round(g.getRound())
                .type(type)
                .playerId(playerId)
                .amount(contribution)
                .forced(forced)
                .at(now)
                .build();
        log.debug("行动: game={}, player={}, type={}, amount={}, pot={}",
                g.getGameId(), playerId, type, contribution, nextGame.getPot());

        return advance(next, record, updated.getSeat(), now);
    }

    /**
     * 修正行动者：记录中的当前行动者已弃牌或已不存在时，交给下一位可行动玩家，不做惩罚。
     */
    public Step correctTurn(GameTable table, long now) {
        GameState g = table.game();
        if (g.getStatus() != GameStatus.PLAYING) {
            throw new GameStateException(GameMessages.GAME_NOT_PLAYING);
        }
        String stale = g.getCurrentPlayerId();
        int fromSeat = table.player(stale).map(PlayerState::getSeat).orElse(-1);
        ActionRecord record = ActionRecord.builder()
                .gameId(g.getGameId())
                .round(g.getRound())
                .type(ActionType.TURN_CORRECTED)
                .playerId(stale)
                .forced(true)
                .at(now)
                .build();
        return advance(table.withGame(g.toBuilder().updatedAt(now).build()), record, fromSeat, now);
    }

    /** 本轮最低下注额：有上一注时为其两倍，否则为底注 */
    public static long minimumBet(GameState g) {
        return g.getLastBet() > 0 ? g.getLastBet() * 2 : g.getBaseBet();
    }

    private Step advance(GameTable next, ActionRecord record, int fromSeat, long now) {
        Optional<PlayerState> nextActor = TurnOrder.nextActor(next.players(), fromSeat);
        if (TurnOrder.isRoundComplete(next.players()) || nextActor.isEmpty()) {
            return new Step(next, record, true);
        }
        GameState g = next.game().toBuilder()
                .currentPlayerId(nextActor.get().getPlayerId())
                .turnDeadline(now + turnDuration.toMillis())
                .build();
        return new Step(next.withGame(g), record, false);
    }

    private long contributionFor(ActionType type, Long amount, GameState g, PlayerState actor, long highest) {
        long mine = actor.getRoundBet();
        long toCall = highest - mine;
        switch (type) {
            case CHECK:
                if (toCall > 0) {
                    throw new GameStateException(GameMessages.CHECK_NOT_ALLOWED);
                }
                return 0L;
            case CALL:
                if (toCall <= 0) {
                    throw new GameStateException(GameMessages.NOTHING_TO_CALL);
                }
                requireFunds(actor, toCall);
                return toCall;
            case BET:
            case RAISE: {
                if (amount == null) {
                    throw new ValidationException(GameMessages.AMOUNT_REQUIRED);
                }
                long min = minimumBet(g);
                if (amount < min) {
                    throw new ValidationException(GameMessages.formatBelowMinimum(min));
                }
                if (mine + amount <= highest) {
                    throw new ValidationException(GameMessages.formatNotAboveHighest(highest));
                }
                requireFunds(actor, amount);
                return amount;
            }
            case HALF:
                return sized(Math.max(g.getPot() / 2, g.getBaseBet()), actor, highest);
            case QUARTER:
                return sized(Math.max(g.getPot() / 4, g.getBaseBet()), actor, highest);
            case DOUBLE:
                return sized(g.getLastBet() > 0 ? g.getLastBet() * 2 : g.getBaseBet() * 2, actor, highest);
            case DIE:
                return 0L;
            default:
                throw new ValidationException(GameMessages.formatNotAPlayerAction(type));
        }
    }

    /** 按底池计算的下注：至少要跟上最高投入 */
    private static long sized(long amount, PlayerState actor, long highest) {
        if (actor.getRoundBet() + amount < highest) {
            throw new ValidationException(GameMessages.formatBelowCall(highest));
        }
        requireFunds(actor, amount);
        return amount;
    }

    private static void requireFunds(PlayerState actor, long need) {
        if (need > actor.getBalance()) {
            throw new InsufficientFundsException(GameMessages.formatInsufficient(need, actor.getBalance()));
        }
    }
}
