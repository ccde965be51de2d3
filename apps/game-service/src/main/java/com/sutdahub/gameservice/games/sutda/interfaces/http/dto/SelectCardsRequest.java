package com.sutdahub.gameservice.games.sutda.interfaces.http.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * 三张模式选牌请求 DTO
 */
@Data
public class SelectCardsRequest {

    /**
     * 选定亮出的两张牌编号
     */
    @NotNull(message = "请选择两张牌")
    @Size(min = 2, max = 2, message = "必须恰好选择两张牌")
    private List<Integer> cardIds;
}
