package com.sutdahub.gameservice.games.sutda.application;

import com.sutdahub.gameservice.common.error.NotFoundException;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.GameStatus;
import com.sutdahub.gameservice.games.sutda.domain.repository.SessionStore;
import com.sutdahub.gameservice.games.sutda.service.SutdaService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static com.sutdahub.gameservice.games.sutda.support.Tables.NOW;
import static com.sutdahub.gameservice.games.sutda.support.Tables.playing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeoutSupervisorTest {

    @Mock
    private SessionStore store;
    @Mock
    private SutdaService service;
    @Mock
    private ScheduledExecutorService scheduler;

    private TimeoutSupervisor supervisor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        supervisor = new TimeoutSupervisor(store, service, scheduler, clock);
        ReflectionTestUtils.setField(supervisor, "enabled", true);
        ReflectionTestUtils.setField(supervisor, "sweepIntervalMs", 1000L);
    }

    private static GameState game(String id, GameStatus status, Long deadline) {
        return playing("a", 1000).toBuilder().gameId(id).status(status).turnDeadline(deadline).build();
    }

    @Test
    void dispatchesByStatus() {
        when(store.findDueGames(NOW)).thenReturn(List.of("p", "r", "f"));
        when(store.readGameState("p")).thenReturn(Optional.of(game("p", GameStatus.PLAYING, NOW - 10)));
        when(store.readGameState("r")).thenReturn(Optional.of(game("r", GameStatus.REGAME, null)));
        when(store.readGameState("f")).thenReturn(Optional.of(game("f", GameStatus.FINISHED, null)));
        when(service.handleTurnTimeout("p", NOW - 10)).thenReturn(true);
        when(service.redealAfterRegame("r")).thenReturn(true);

        assertThat(supervisor.sweep()).isEqualTo(2);
        verify(service, never()).handleTurnTimeout(eq("f"), anyLong());
        verify(service, never()).redealAfterRegame("f");
    }

    @Test
    void oneFailingGameDoesNotStopTheSweep() {
        when(store.findDueGames(NOW)).thenReturn(List.of("boom", "gone", "bad", "ok"));
        when(store.readGameState("boom")).thenThrow(new IllegalStateException("redis down"));
        when(store.readGameState("gone")).thenReturn(Optional.empty());
        when(store.readGameState("bad")).thenReturn(Optional.of(game("bad", GameStatus.PLAYING, NOW - 1)));
        when(store.readGameState("ok")).thenReturn(Optional.of(game("ok", GameStatus.PLAYING, NOW - 1)));
        when(service.handleTurnTimeout("bad", NOW - 1)).thenThrow(new NotFoundException("玩家不存在"));
        when(service.handleTurnTimeout("ok", NOW - 1)).thenReturn(true);

        assertThat(supervisor.sweep()).isEqualTo(1);
        verify(service).handleTurnTimeout("ok", NOW - 1);
    }

    @Test
    void readySchedulesTheSweepAndStopCancelsIt() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler)
                .scheduleWithFixedDelay(any(Runnable.class), eq(1000L), eq(1000L), eq(TimeUnit.MILLISECONDS));

        supervisor.onReady();
        supervisor.stop();

        verify(future).cancel(false);
    }

    @Test
    void disabledSupervisorSchedulesNothing() {
        ReflectionTestUtils.setField(supervisor, "enabled", false);
        supervisor.onReady();
        supervisor.stop();
        verifyNoInteractions(scheduler);
        verify(service, never()).redealAfterRegame(anyString());
    }
}
