package com.sutdahub.gameservice.games.sutda.interfaces.http.dto;

import com.sutdahub.gameservice.games.sutda.domain.model.ActionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * 玩家行动请求 DTO
 */
@Data
public class ActionRequest {

    /**
     * 行动玩家（必填）
     */
    @NotBlank(message = "玩家ID不能为空")
    private String playerId;

    /**
     * 行动类型（必填）：CHECK / CALL / BET / RAISE / HALF / QUARTER / DOUBLE / DIE
     */
    @NotNull(message = "行动类型不能为空")
    private ActionType type;

    /**
     * 金额（仅 BET / RAISE 需要）
     */
    @Positive(message = "金额必须大于0")
    private Long amount;

    /**
     * 期望版本（可选）：给出时仅在对局版本一致时提交，否则返回 409
     */
    @PositiveOrZero(message = "版本号不能为负")
    private Long expectedVersion;
}
