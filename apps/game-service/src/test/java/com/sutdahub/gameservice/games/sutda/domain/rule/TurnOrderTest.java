package com.sutdahub.gameservice.games.sutda.domain.rule;

import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.sutdahub.gameservice.games.sutda.support.Tables.player;
import static org.assertj.core.api.Assertions.assertThat;

class TurnOrderTest {

    private final List<PlayerState> players = List.of(
            player("a", 0, 1000),
            player("b", 1, 0),
            player("c", 2, 1000),
            player("d", 3, 1000).toBuilder().folded(true).build());

    @Test
    void firstActorPrefersTheLastWinnerWhenTheyCanAct() {
        assertThat(TurnOrder.firstActor(players, "c")).map(PlayerState::getPlayerId).contains("c");
        // b 余额为 0，视为全下
        assertThat(TurnOrder.firstActor(players, "b")).map(PlayerState::getPlayerId).contains("a");
        assertThat(TurnOrder.firstActor(players, null)).map(PlayerState::getPlayerId).contains("a");
    }

    @Test
    void nextActorSkipsAllInAndFoldedAndWraps() {
        assertThat(TurnOrder.nextActor(players, 0)).map(PlayerState::getPlayerId).contains("c");
        assertThat(TurnOrder.nextActor(players, 2)).map(PlayerState::getPlayerId).contains("a");
    }

    @Test
    void nextActorReturnsToSelfLast() {
        List<PlayerState> alone = List.of(player("a", 0, 1000), player("b", 1, 0));
        assertThat(TurnOrder.nextActor(alone, 0)).map(PlayerState::getPlayerId).contains("a");
    }

    @Test
    void highestBetIgnoresFoldedPlayers() {
        List<PlayerState> bets = List.of(
                player("a", 0, 1000).toBuilder().roundBet(500).build(),
                player("b", 1, 1000).toBuilder().roundBet(900).folded(true).build());
        assertThat(TurnOrder.highestBet(bets)).isEqualTo(500);
    }

    @Test
    void roundIsNotCompleteUntilEveryoneActs() {
        List<PlayerState> fresh = List.of(player("a", 0, 1000), player("c", 1, 1000));
        assertThat(TurnOrder.isRoundComplete(fresh)).isFalse();

        List<PlayerState> acted = List.of(
                player("a", 0, 1000).toBuilder().acted(true).build(),
                player("c", 1, 1000).toBuilder().acted(true).build());
        assertThat(TurnOrder.isRoundComplete(acted)).isTrue();
    }

    @Test
    void allInPlayersDoNotNeedToMatch() {
        List<PlayerState> ps = List.of(
                player("a", 0, 1000).toBuilder().acted(true).roundBet(2000).build(),
                player("b", 1, 0).toBuilder().roundBet(700).build());
        assertThat(TurnOrder.isRoundComplete(ps)).isTrue();
    }
}
