package com.perizia.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 案件 VO
 *
 * @author perizia
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "案件")
public class CaseVO {

    @Schema(description = "案件ID")
    private Long id;

    @Schema(description = "客户引用")
    private String clientRef;

    @Schema(description = "案件编号")
    private String referenceCode;

    @Schema(description = "状态: OPEN / PROCESSING / GENERATING / CLOSED / ERROR")
    private String status;

    @Schema(description = "创建时间")
    private LocalDateTime createTime;
}
