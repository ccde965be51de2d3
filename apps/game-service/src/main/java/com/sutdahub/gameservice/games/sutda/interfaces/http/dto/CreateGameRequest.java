package com.sutdahub.gameservice.games.sutda.interfaces.http.dto;

import com.sutdahub.gameservice.games.sutda.domain.model.GameMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 建局请求 DTO
 */
@Data
public class CreateGameRequest {

    /**
     * 房主名称（必填）
     */
    @NotBlank(message = "房主名称不能为空")
    @Size(max = 32, message = "名称长度不能超过32个字符")
    private String hostName;

    /**
     * 底注（可选，缺省取配置）
     */
    @Positive(message = "底注必须大于0")
    private Long baseBet;

    /**
     * 玩法（可选，缺省 TWO_CARD）
     */
    private GameMode mode;
}
