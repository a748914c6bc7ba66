package com.perizia.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 案件文档 VO
 *
 * @author perizia
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "案件文档")
public class DocumentVO {

    @Schema(description = "文档ID")
    private Long id;

    @Schema(description = "文件名")
    private String filename;

    @Schema(description = "MIME 类型")
    private String mimeType;

    @Schema(description = "文件大小(字节)")
    private Long fileSize;

    @Schema(description = "抽取状态: PENDING / PROCESSING / SUCCESS / ERROR / SKIPPED")
    private String aiStatus;

    @Schema(description = "错误信息")
    private String errorMessage;

    @Schema(description = "上传时间")
    private LocalDateTime createTime;
}
