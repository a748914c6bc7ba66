package com.perizia.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 僵尸案件清理结果
 *
 * @author perizia
 * @since 2025-03-05
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "僵尸案件清理结果")
public class RescueResultVO {

    @Schema(description = "重置的案件数")
    private Integer rescued;

    @Schema(description = "使用的超时(分钟)")
    private Long timeoutMinutes;
}
