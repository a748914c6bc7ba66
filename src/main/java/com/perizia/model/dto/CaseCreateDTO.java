package com.perizia.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 新建案件请求
 *
 * @author perizia
 * @since 2025-03-02
 */
@Data
@Schema(description = "新建案件请求")
public class CaseCreateDTO {

    @NotBlank(message = "客户引用不能为空")
    @Size(max = 128, message = "客户引用最长128个字符")
    @Schema(description = "客户引用")
    private String clientRef;

    @Size(max = 64, message = "案件编号最长64个字符")
    @Schema(description = "案件编号，为空时自动生成")
    private String referenceCode;
}
