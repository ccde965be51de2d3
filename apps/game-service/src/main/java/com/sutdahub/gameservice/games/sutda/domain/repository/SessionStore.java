package com.sutdahub.gameservice.games.sutda.domain.repository;

import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.GameChange;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * SessionStore
 * ----------------------------------------
 * 对局 / 玩家 / 审计记录的权威存储（唯一事实来源）。
 * - 每条对局与玩家记录都带单调递增的 version，每次写入加一；
 * - 条件写入在版本不匹配时抛出 ConcurrencyConflictException 且不写任何数据；
 * - 提交成功后发布变更通知，发布失败只记日志，不影响提交结果。
 * ----------------------------------------
 */
public interface SessionStore {

    /** 读取对局 */
    Optional<GameState> readGameState(String gameId);

    /** 读取对局的全部玩家（座位升序） */
    List<PlayerState> readPlayers(String gameId);

    /**
     * 条件更新对局记录。
     * @param expectedVersion 调用方读取时的版本
     * @param patch 基于当前值生成新值（version 字段由存储层覆盖）
     * @return 写入后的记录
     */
    GameState conditionalUpdateGame(String gameId, long expectedVersion, UnaryOperator<GameState> patch);

    /**
     * 条件更新单个玩家记录。
     * @return 写入后的记录
     */
    PlayerState conditionalUpdatePlayer(String gameId, String playerId, long expectedVersion,
                                        UnaryOperator<PlayerState> patch);

    /** 追加审计记录 */
    void appendAction(ActionRecord record);

    /** 按写入顺序列出审计记录 */
    List<ActionRecord> listActions(String gameId);

    /** 订阅对局变更 */
    Subscription subscribeToChanges(String gameId, Consumer<GameChange> callback);

    /**
     * 新建对局（version 从 0 开始）。
     */
    GameState createGame(GameState game);

    /**
     * 入座：以对局版本为条件，同时写入玩家并将对局版本加一。
     * @return 写入后的玩家
     */
    PlayerState addPlayer(long expectedGameVersion, PlayerState player);

    /**
     * 原子提交一次状态迁移（对局 + 玩家 + 审计记录 + 巡检索引）。
     * @return 写入后的对局记录
     */
    GameState commit(GameTransition transition);

    /**
     * 巡检索引中截止时间不晚于 nowEpochMs 的对局。
     */
    List<String> findDueGames(long nowEpochMs);
}
