package com.perizia.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 签名下载链接
 *
 * @author perizia
 * @since 2025-03-07
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "签名下载链接")
public class DownloadUrlVO {

    @Schema(description = "下载地址")
    private String url;

    @Schema(description = "有效期(秒)")
    private Long expiresInSeconds;
}
