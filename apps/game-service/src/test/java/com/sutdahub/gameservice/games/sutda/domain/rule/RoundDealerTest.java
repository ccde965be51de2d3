package com.sutdahub.gameservice.games.sutda.domain.rule;

import com.sutdahub.gameservice.common.error.GameStateException;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionType;
import com.sutdahub.gameservice.games.sutda.domain.model.GameMode;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.GameStatus;
import com.sutdahub.gameservice.games.sutda.domain.model.GameTable;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.sutdahub.gameservice.games.sutda.support.Tables.NOW;
import static com.sutdahub.gameservice.games.sutda.support.Tables.cards;
import static com.sutdahub.gameservice.games.sutda.support.Tables.deckStartingWith;
import static com.sutdahub.gameservice.games.sutda.support.Tables.decks;
import static com.sutdahub.gameservice.games.sutda.support.Tables.player;
import static com.sutdahub.gameservice.games.sutda.support.Tables.playing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoundDealerTest {

    private static GameState waiting() {
        return playing(null, 1000).toBuilder()
                .status(GameStatus.WAITING)
                .turnDeadline(null)
                .round(0)
                .build();
    }

    private static List<PlayerState> seated() {
        return List.of(
                player("a", 0, 5000).toBuilder().inRound(false).build(),
                player("b", 1, 0).toBuilder().inRound(false).build(),
                player("c", 2, 5000).toBuilder().inRound(false).build());
    }

    @Test
    void startDealsFundedPlayersAndOpensTheFirstTurn() {
        RoundDealer dealer = new RoundDealer(decks(deckStartingWith(19, 20, 11, 13)), Duration.ofSeconds(30));
        Step step = dealer.startRound(new GameTable(waiting(), seated()), NOW);
        GameTable t = step.table();

        assertThat(step.roundComplete()).isFalse();
        assertThat(step.record().getType()).isEqualTo(ActionType.START);
        assertThat(t.game().getStatus()).isEqualTo(GameStatus.PLAYING);
        assertThat(t.game().getRound()).isEqualTo(1);
        assertThat(t.game().getPot()).isZero();
        assertThat(t.game().getCurrentPlayerId()).isEqualTo("a");
        assertThat(t.game().getTurnDeadline()).isEqualTo(NOW + 30_000);
        assertThat(t.player("a").orElseThrow().getCards()).isEqualTo(cards(19, 20));
        assertThat(t.player("c").orElseThrow().getCards()).isEqualTo(cards(11, 13));
        PlayerState broke = t.player("b").orElseThrow();
        assertThat(broke.isInRound()).isFalse();
        assertThat(broke.getCards()).isEmpty();
    }

    @Test
    void lastWinnerOpensTheNextRound() {
        RoundDealer dealer = new RoundDealer(decks(), Duration.ofSeconds(30));
        GameState finished = waiting().toBuilder()
                .status(GameStatus.FINISHED)
                .lastWinnerId("c")
                .winnerId("c")
                .payout(4000)
                .bonusLedger(Map.of("a", 500L))
                .revealCards(true)
                .build();
        GameTable t = dealer.startRound(new GameTable(finished, seated()), NOW).table();
        assertThat(t.game().getCurrentPlayerId()).isEqualTo("c");
        assertThat(t.game().getWinnerId()).isNull();
        assertThat(t.game().getBonusLedger()).isEmpty();
        assertThat(t.game().isRevealCards()).isFalse();
    }

    @Test
    void threeCardModeDealsThree() {
        RoundDealer dealer = new RoundDealer(decks(), Duration.ofSeconds(30));
        GameState g = waiting().toBuilder().mode(GameMode.THREE_CARD).build();
        GameTable t = dealer.startRound(new GameTable(g, seated()), NOW).table();
        assertThat(t.player("a").orElseThrow().getCards()).hasSize(3);
    }

    @Test
    void startNeedsTwoFundedPlayers() {
        RoundDealer dealer = new RoundDealer(decks(), Duration.ofSeconds(30));
        List<PlayerState> one = List.of(player("a", 0, 5000), player("b", 1, 0));
        assertThatThrownBy(() -> dealer.startRound(new GameTable(waiting(), one), NOW))
                .isInstanceOf(GameStateException.class);
    }

    @Test
    void startIsRejectedWhilePlaying() {
        RoundDealer dealer = new RoundDealer(decks(), Duration.ofSeconds(30));
        assertThatThrownBy(() -> dealer.startRound(new GameTable(playing("a", 1000), seated()), NOW))
                .isInstanceOf(GameStateException.class);
    }

    @Test
    void redealKeepsThePotAndTheSeatedPlayers() {
        RoundDealer dealer = new RoundDealer(decks(), Duration.ofSeconds(30));
        GameState regame = playing(null, 1000).toBuilder()
                .status(GameStatus.REGAME)
                .turnDeadline(null)
                .pot(2000)
                .carryOver(2000)
                .regameAt(NOW)
                .build();
        List<PlayerState> players = seated().stream()
                .map(p -> p.toBuilder().inRound(p.getBalance() > 0).build())
                .toList();
        Step step = dealer.redeal(new GameTable(regame, players), NOW);
        GameState g = step.table().game();
        assertThat(step.record().getType()).isEqualTo(ActionType.REDEAL);
        assertThat(g.getStatus()).isEqualTo(GameStatus.PLAYING);
        assertThat(g.getPot()).isEqualTo(2000);
        assertThat(g.getCarryOver()).isEqualTo(2000);
        assertThat(g.getRegameAt()).isNull();
        assertThat(g.getRound()).isEqualTo(2);
        assertThat(step.table().player("b").orElseThrow().getCards()).isEmpty();
    }

    @Test
    void redealOnlyFromRegame() {
        RoundDealer dealer = new RoundDealer(decks(), Duration.ofSeconds(30));
        assertThatThrownBy(() -> dealer.redeal(new GameTable(waiting(), seated()), NOW))
                .isInstanceOf(GameStateException.class);
    }
}
