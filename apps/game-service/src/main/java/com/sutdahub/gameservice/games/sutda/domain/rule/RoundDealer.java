package com.sutdahub.gameservice.games.sutda.domain.rule;

import com.sutdahub.gameservice.common.error.GameStateException;
import com.sutdahub.gameservice.games.sutda.domain.card.Deck;
import com.sutdahub.gameservice.games.sutda.domain.card.DeckFactory;
import com.sutdahub.gameservice.games.sutda.domain.constants.GameMessages;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionType;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.GameStatus;
import com.sutdahub.gameservice.games.sutda.domain.model.GameTable;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 发牌：新开一局（WAITING/FINISHED → PLAYING）或流局后重发（REGAME → PLAYING）。
 */
public class RoundDealer {

    private final DeckFactory deckFactory;
    private final Duration turnDuration;

    public RoundDealer(DeckFactory deckFactory, Duration turnDuration) {
        this.deckFactory = deckFactory;
        this.turnDuration = turnDuration;
    }

    /**
     * 新开一局：底池清零，余额大于 0 的玩家入局。
     */
    public Step startRound(GameTable table, long now) {
        GameState g = table.game();
        if (!g.getStatus().isIdle()) {
            throw new GameStateException(GameMessages.START_NOT_ALLOWED);
        }
        long funded = table.players().stream().filter(p -> p.getBalance() > 0).count();
        if (funded < 2) {
            throw new GameStateException(GameMessages.NOT_ENOUGH_PLAYERS);
        }
        List<PlayerState> seated = table.players().stream()
                .map(p -> p.toBuilder().inRound(p.getBalance() > 0).build())
                .toList();
        GameState reset = g.toBuilder()
                .pot(0)
                .carryOver(0)
                .winnerId(null)
                .payout(0)
                .bonusLedger(Map.of())
                .revealCards(false)
                .winningRank(null)
                .build();
        return deal(new GameTable(reset, seated), ActionType.START, now);
    }

    /**
     * 流局重发：底池与入局玩家保持不变。
     */
    public Step redeal(GameTable table, long now) {
        if (table.game().getStatus() != GameStatus.REGAME) {
            throw new GameStateException(GameMessages.START_NOT_ALLOWED);
        }
        return deal(table, ActionType.REDEAL, now);
    }

    private Step deal(GameTable table, ActionType cause, long now) {
        GameState g = table.game();
        Deck deck = deckFactory.newDeck();
        int n = g.getMode().cardsPerPlayer();
        List<PlayerState> dealt = new ArrayList<>();
        for (PlayerState p : table.players()) {
            dealt.add(p.toBuilder()
                    .cards(p.isInRound() ? deck.deal(n) : List.of())
                    .selected(List.of())
                    .folded(false)
                    .acted(false)
                    .roundBet(0)
                    .build());
        }
        Optional<PlayerState> first = TurnOrder.firstActor(dealt, g.getLastWinnerId());
        GameState next = g.toBuilder()
                .status(GameStatus.PLAYING)
                .lastBet(0)
                .regameAt(null)
                .round(g.getRound() + 1)
                .currentPlayerId(first.map(PlayerState::getPlayerId).orElse(null))
                .turnDeadline(first.isPresent() ? now + turnDuration.toMillis() : null)
                .updatedAt(now)
                .build();
        ActionRecord record = ActionRecord.builder()
                .gameId(g.getGameId())
                .round(next.getRound())
                .type(cause)
                .playerId(next.getCurrentPlayerId())
                .amount(next.getPot())
                .at(now)
                .build();
        boolean complete = first.isEmpty() || TurnOrder.isRoundComplete(dealt);
        return new Step(new GameTable(next, dealt), record, complete);
    }
}
