package com.sutdahub.gameservice;

import com.sutdahub.gameservice.games.sutda.application.TimeoutSupervisor;
import com.sutdahub.gameservice.games.sutda.domain.model.GameSnapshot;
import com.sutdahub.gameservice.games.sutda.domain.model.GameStatus;
import com.sutdahub.gameservice.games.sutda.domain.repository.SessionStore;
import com.sutdahub.gameservice.games.sutda.infrastructure.memory.InMemorySessionStore;
import com.sutdahub.gameservice.games.sutda.service.CreatedGame;
import com.sutdahub.gameservice.games.sutda.service.SutdaService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "sutda.store.type=memory",
        "sutda.timeout.enabled=false"
})
class GameServiceApplicationTest {

    @Autowired
    private SessionStore store;
    @Autowired
    private SutdaService service;
    @Autowired
    private TimeoutSupervisor supervisor;

    @Test
    void wiresTheInMemoryEngine() {
        assertThat(store).isInstanceOf(InMemorySessionStore.class);

        CreatedGame game = service.createGame("host", null, null);
        service.joinGame(game.gameId(), "bob");
        GameSnapshot started = service.startGame(game.gameId());

        assertThat(started.getStatus()).isEqualTo(GameStatus.PLAYING);
        assertThat(started.getBaseBet()).isEqualTo(1000);
        assertThat(started.getPlayers()).allSatisfy(p -> assertThat(p.getBalance()).isEqualTo(100_000));
        assertThat(supervisor.sweep()).isZero();
    }
}
