package com.sutdahub.gameservice.games.sutda.domain.rule;

import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.GameTable;

/**
 * 规则层的一步计算结果。
 *
 * @param table 计算后的牌桌（尚未持久化）
 * @param record 本步的审计记录
 * @param roundComplete 本轮下注是否已结束，需要进入结算
 */
public record Step(GameTable table, ActionRecord record, boolean roundComplete) {
}
