package com.sutdahub.gameservice.games.sutda.application;

import com.sutdahub.gameservice.common.error.SutdaException;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.GameStatus;
import com.sutdahub.gameservice.games.sutda.domain.repository.SessionStore;
import com.sutdahub.gameservice.games.sutda.service.SutdaService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * TimeoutSupervisor
 * -------------------------------------------------
 * 超时巡检（应用编排层）：固定间隔扫描巡检索引，对到期对局执行权威处理。
 *
 * 职责与边界：
 * 1) 应用就绪后在共享的 turnClockScheduler 上注册固定间隔任务；
 * 2) PLAYING 且回合截止已过：交给服务层 handleTurnTimeout，
 *    由其代为弃牌（或修正异常的行动者），并以读到的截止时间做幂等保护；
 * 3) REGAME 且重开时间已过：交给 redealAfterRegame 重新发牌（一次性延时任务的兜底）；
 * 4) 单个对局的任何异常只记日志并继续处理下一个，巡检本身不会中断。
 *
 * 不直接修改状态，所有写入都走服务层的校验 + CAS 路径。
 */
@Slf4j
@Component
public class TimeoutSupervisor {

    private final SessionStore store;
    private final SutdaService service;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    @Value("${sutda.timeout.enabled:true}")
    private boolean enabled;

    @Value("${sutda.timeout.sweep-interval-ms:1000}")
    private long sweepIntervalMs;

    private volatile ScheduledFuture<?> task;

    public TimeoutSupervisor(SessionStore store,
                             SutdaService service,
                             @Qualifier("turnClockScheduler") ScheduledExecutorService scheduler,
                             Clock clock) {
        this.store = store;
        this.service = service;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * 应用启动后注册巡检任务。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!enabled) {
            log.info("超时巡检已关闭（sutda.timeout.enabled=false）");
            return;
        }
        task = scheduler.scheduleWithFixedDelay(this::sweepSafely, sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
        log.info("超时巡检启动：间隔 {} ms", sweepIntervalMs);
    }

    @PreDestroy
    public void stop() {
        ScheduledFuture<?> t = task;
        if (t != null) {
            t.cancel(false);
        }
    }

    /**
     * 执行一次巡检。
     * @return 实际产生状态迁移的对局数
     */
    public int sweep() {
        long now = clock.millis();
        List<String> due = store.findDueGames(now);
        int handled = 0;
        for (String gameId : due) {
            try {
                if (process(gameId)) {
                    handled++;
                }
            } catch (SutdaException e) {
                log.info("巡检跳过对局: game={}, code={}, msg={}", gameId, e.getCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("巡检处理对局失败: game={}", gameId, e);
            }
        }
        if (handled > 0) {
            log.debug("本轮巡检处理 {} / {} 个到期对局", handled, due.size());
        }
        return handled;
    }

    private boolean process(String gameId) {
        Optional<GameState> read = store.readGameState(gameId);
        if (read.isEmpty()) {
            return false;
        }
        GameState g = read.get();
        if (g.getStatus() == GameStatus.PLAYING && g.getTurnDeadline() != null) {
            return service.handleTurnTimeout(gameId, g.getTurnDeadline());
        }
        if (g.getStatus() == GameStatus.REGAME) {
            return service.redealAfterRegame(gameId);
        }
        return false;
    }

    /** 调度线程入口：异常不能抛出，否则周期任务会被取消 */
    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.warn("超时巡检失败，下个周期重试", e);
        }
    }
}
