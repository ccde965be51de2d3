package com.sutdahub.gameservice.games.sutda.infrastructure.memory;

import com.sutdahub.gameservice.common.error.ConcurrencyConflictException;
import com.sutdahub.gameservice.common.error.GameStateException;
import com.sutdahub.gameservice.common.error.NotFoundException;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionType;
import com.sutdahub.gameservice.games.sutda.domain.model.GameChange;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.GameStatus;
import com.sutdahub.gameservice.games.sutda.domain.model.GameTable;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;
import com.sutdahub.gameservice.games.sutda.domain.repository.GameTransition;
import com.sutdahub.gameservice.games.sutda.domain.repository.Subscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.sutdahub.gameservice.games.sutda.support.Tables.GAME_ID;
import static com.sutdahub.gameservice.games.sutda.support.Tables.NOW;
import static com.sutdahub.gameservice.games.sutda.support.Tables.player;
import static com.sutdahub.gameservice.games.sutda.support.Tables.playing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySessionStoreTest {

    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
        store.createGame(playing(null, 1000).toBuilder()
                .status(GameStatus.WAITING)
                .turnDeadline(null)
                .version(42)
                .build());
        store.addPlayer(0, player("b", 1, 1000));
        store.addPlayer(1, player("a", 0, 1000));
    }

    private GameTable table() {
        return new GameTable(store.readGameState(GAME_ID).orElseThrow(), store.readPlayers(GAME_ID));
    }

    private static ActionRecord record(ActionType type) {
        return ActionRecord.builder().gameId(GAME_ID).type(type).at(NOW).build();
    }

    @Test
    void createStartsAtVersionZeroAndRejectsDuplicates() {
        assertThat(store.readGameState(GAME_ID)).get().extracting(GameState::getVersion).isEqualTo(2L);
        assertThatThrownBy(() -> store.createGame(playing(null, 1000)))
                .isInstanceOf(GameStateException.class);
        assertThat(store.readGameState("missing")).isEmpty();
    }

    @Test
    void playersAreReadInSeatOrder() {
        assertThat(store.readPlayers(GAME_ID)).extracting(PlayerState::getPlayerId).containsExactly("a", "b");
        assertThat(store.readPlayers("missing")).isEmpty();
    }

    @Test
    void addPlayerIsGuardedByTheGameVersion() {
        assertThatThrownBy(() -> store.addPlayer(0, player("c", 2, 1000)))
                .isInstanceOf(ConcurrencyConflictException.class);
        assertThatThrownBy(() -> store.addPlayer(2, player("a", 3, 1000)))
                .isInstanceOf(GameStateException.class);
        assertThat(store.readPlayers(GAME_ID)).hasSize(2);
    }

    @Test
    void conditionalUpdateGameBumpsVersionAndIgnoresPatchedVersion() {
        GameState next = store.conditionalUpdateGame(GAME_ID, 2, g -> g.toBuilder().pot(500).version(999).build());
        assertThat(next.getVersion()).isEqualTo(3);
        assertThat(next.getPot()).isEqualTo(500);
    }

    @Test
    void staleGameVersionWritesNothing() {
        assertThatThrownBy(() -> store.conditionalUpdateGame(GAME_ID, 1, g -> g.toBuilder().pot(500).build()))
                .isInstanceOfSatisfying(ConcurrencyConflictException.class, e -> {
                    assertThat(e.getExpectedVersion()).isEqualTo(1);
                    assertThat(e.getActualVersion()).isEqualTo(2);
                });
        assertThat(store.readGameState(GAME_ID).orElseThrow().getPot()).isZero();
    }

    @Test
    void conditionalUpdatePlayer() {
        PlayerState next = store.conditionalUpdatePlayer(GAME_ID, "a", 0, p -> p.toBuilder().balance(10).build());
        assertThat(next.getVersion()).isEqualTo(1);
        assertThatThrownBy(() -> store.conditionalUpdatePlayer(GAME_ID, "a", 0, p -> p))
                .isInstanceOf(ConcurrencyConflictException.class);
        assertThatThrownBy(() -> store.conditionalUpdatePlayer(GAME_ID, "zzz", 0, p -> p))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void commitWritesEverythingAtomically() {
        GameTable before = table();
        GameTable after = before
                .withGame(before.game().toBuilder().status(GameStatus.PLAYING).currentPlayerId("a")
                        .turnDeadline(NOW + 30_000).build())
                .withPlayer(before.player("a").orElseThrow().toBuilder().balance(0).build());
        GameState committed = store.commit(GameTransition.between(before, after, List.of(record(ActionType.START))));

        assertThat(committed.getVersion()).isEqualTo(3);
        assertThat(store.readPlayers(GAME_ID)).extracting(PlayerState::getVersion).containsExactly(1L, 0L);
        assertThat(store.listActions(GAME_ID)).singleElement()
                .satisfies(a -> assertThat(a.getGameVersion()).isEqualTo(3));
    }

    @Test
    void commitWithAStalePlayerWritesNothing() {
        GameTable before = table();
        store.conditionalUpdatePlayer(GAME_ID, "a", 0, p -> p.toBuilder().name("renamed").build());
        GameTable after = before.withPlayer(before.player("a").orElseThrow().toBuilder().balance(0).build());

        assertThatThrownBy(() -> store.commit(GameTransition.between(before, after, List.of(record(ActionType.BET)))))
                .isInstanceOf(ConcurrencyConflictException.class);
        assertThat(store.readGameState(GAME_ID).orElseThrow().getVersion()).isEqualTo(2);
        assertThat(store.listActions(GAME_ID)).isEmpty();
        assertThat(store.readPlayers(GAME_ID).get(0).getBalance()).isEqualTo(1000);
    }

    @Test
    void dueIndexFollowsDeadlineAndRegameTime() {
        store.conditionalUpdateGame(GAME_ID, 2, g -> g.toBuilder()
                .status(GameStatus.PLAYING).turnDeadline(NOW + 1000).build());
        assertThat(store.findDueGames(NOW)).isEmpty();
        assertThat(store.findDueGames(NOW + 1000)).containsExactly(GAME_ID);

        store.conditionalUpdateGame(GAME_ID, 3, g -> g.toBuilder()
                .status(GameStatus.REGAME).turnDeadline(null).regameAt(NOW + 5000).build());
        assertThat(store.findDueGames(NOW + 1000)).isEmpty();
        assertThat(store.findDueGames(NOW + 5000)).containsExactly(GAME_ID);

        store.conditionalUpdateGame(GAME_ID, 4, g -> g.toBuilder()
                .status(GameStatus.FINISHED).regameAt(null).build());
        assertThat(store.findDueGames(Long.MAX_VALUE)).isEmpty();
    }

    @Test
    void subscribersSeeCommittedVersionsUntilUnsubscribed() {
        List<GameChange> seen = new ArrayList<>();
        Subscription sub = store.subscribeToChanges(GAME_ID, seen::add);
        store.conditionalUpdateGame(GAME_ID, 2, g -> g);
        GameTable before = table();
        store.commit(GameTransition.between(before, before, List.of(record(ActionType.CHECK))));
        sub.unsubscribe();
        store.conditionalUpdateGame(GAME_ID, 4, g -> g);

        assertThat(seen).extracting(GameChange::version).containsExactly(3L, 4L);
        assertThat(seen.get(1).cause()).isEqualTo(ActionType.CHECK);
    }

    @Test
    void failingSubscriberDoesNotFailTheWrite() {
        List<GameChange> seen = new ArrayList<>();
        store.subscribeToChanges(GAME_ID, c -> {
            throw new IllegalStateException("boom");
        });
        store.subscribeToChanges(GAME_ID, seen::add);

        GameState next = store.conditionalUpdateGame(GAME_ID, 2, g -> g.toBuilder().pot(1).build());
        assertThat(next.getVersion()).isEqualTo(3);
        assertThat(seen).hasSize(1);
    }

    @Test
    void actionsOfUnknownGamesAreNotFound() {
        assertThatThrownBy(() -> store.listActions("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.appendAction(record(ActionType.JOIN).toBuilder().gameId("missing").build()))
                .isInstanceOf(NotFoundException.class);
        store.appendAction(record(ActionType.JOIN));
        assertThat(store.listActions(GAME_ID)).hasSize(1);
    }
}
