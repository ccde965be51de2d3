package com.sutdahub.gameservice.games.sutda.service;

import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionType;
import com.sutdahub.gameservice.games.sutda.domain.model.GameChange;
import com.sutdahub.gameservice.games.sutda.domain.model.GameMode;
import com.sutdahub.gameservice.games.sutda.domain.model.GameSnapshot;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;
import com.sutdahub.gameservice.games.sutda.domain.repository.Subscription;

import java.util.List;
import java.util.function.Consumer;

/**
 * 花斗对局服务：对 UI / 聊天等外部协作方暴露的全部操作。
 * 所有写操作都是一次“读取 → 校验 → 条件提交”。
 */
public interface SutdaService {

    /**
     * 建局，房主入座 0 号位。
     * @param baseBet 底注，null 取默认
     * @param mode 玩法，null 为两张牌
     */
    CreatedGame createGame(String hostName, Long baseBet, GameMode mode);

    /** 入座（仅 WAITING / FINISHED） */
    PlayerState joinGame(String gameId, String name);

    /** 开局发牌 */
    GameSnapshot startGame(String gameId);

    /**
     * 提交玩家行动。
     * @param expectedVersion 给出时只尝试一次 CAS；为 null 时冲突会重读重试
     */
    GameSnapshot submitAction(String gameId, String playerId, ActionType type, Long amount, Long expectedVersion);

    /** 三张模式：选择亮出的两张 */
    GameSnapshot selectCards(String gameId, String playerId, List<Integer> cardIds);

    /** 对局快照，viewerPlayerId 可为 null */
    GameSnapshot getGameState(String gameId, String viewerPlayerId);

    /** 审计记录 */
    List<ActionRecord> listActions(String gameId);

    /** 订阅变更通知 */
    Subscription watchGame(String gameId, Consumer<GameChange> listener);

    /**
     * 回合超时处理（由巡检调用）。
     * @param observedDeadline 巡检读到的截止时间；对局截止时间已变化则跳过
     * @return 是否产生了状态迁移
     */
    boolean handleTurnTimeout(String gameId, long observedDeadline);

    /**
     * 流局到时后重新发牌。
     * @return 是否产生了状态迁移
     */
    boolean redealAfterRegame(String gameId);
}
