package com.sutdahub.gameservice.games.sutda.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 入座请求 DTO
 */
@Data
public class JoinGameRequest {

    @NotBlank(message = "玩家名称不能为空")
    @Size(max = 32, message = "名称长度不能超过32个字符")
    private String name;
}
