package com.perizia.controller;

import cn.dev33.satoken.annotation.SaCheckLogin;
import com.perizia.model.dto.CaseCreateDTO;
import com.perizia.model.vo.CaseDetailVO;
import com.perizia.model.vo.CaseVO;
import com.perizia.model.vo.DocumentVO;
import com.perizia.model.vo.DownloadUrlVO;
import com.perizia.model.vo.PreliminaryReportVO;
import com.perizia.model.vo.ReportVersionVO;
import com.perizia.service.CaseService;
import com.perizia.service.PreliminaryReportService;
import com.perizia.utils.TenantContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.Map;

/**
 * 案件管理控制器
 *
 * @author perizia
 * @since 2025-03-02
 */
@Slf4j
@Tag(name = "案件管理", description = "案件创建、文档上传、报告生成与定稿")
@RestController
@RequestMapping("/api/cases")
@RequiredArgsConstructor
@SaCheckLogin
public class CaseController {

    private final CaseService caseService;

    private final PreliminaryReportService preliminaryReportService;

    @Operation(summary = "新建案件")
    @PostMapping
    public CaseVO openCase(@Validated @RequestBody CaseCreateDTO dto) {
        return caseService.openCase(dto, TenantContext.currentTenantId());
    }

    @Operation(summary = "获取案件详情", description = "包含文档抽取状态和报告版本")
    @GetMapping("/{caseId}")
    public CaseDetailVO getCase(@Parameter(description = "案件ID") @PathVariable Long caseId) {
        return caseService.getCaseDetail(caseId, TenantContext.currentTenantId());
    }

    /**
     * 上传文档，登记后立即投递抽取任务
     */
    @Operation(summary = "上传文档", description = "支持 PDF、图片、Word、Excel、邮件和纯文本")
    @PostMapping("/{caseId}/documents")
    public DocumentVO uploadDocument(@Parameter(description = "案件ID") @PathVariable Long caseId,
                                     @Parameter(description = "文件") @RequestParam("file") MultipartFile file) {
        return caseService.registerDocument(caseId, TenantContext.currentTenantId(), file);
    }

    @Operation(summary = "重新派发抽取", description = "为所有未成功的文档重新投递抽取任务")
    @PostMapping("/{caseId}/process")
    public Map<String, Integer> processCase(@Parameter(description = "案件ID") @PathVariable Long caseId) {
        int dispatched = caseService.processCase(caseId, TenantContext.currentTenantId());
        return Map.of("dispatched", dispatched);
    }

    @Operation(summary = "重试报告生成", description = "适用于生成失败(ERROR)或尚无初稿的案件")
    @PostMapping("/{caseId}/generate")
    public void retryGeneration(@Parameter(description = "案件ID") @PathVariable Long caseId) {
        caseService.retryGeneration(caseId, TenantContext.currentTenantId());
    }

    @Operation(summary = "获取初步报告", description = "返回最近一份初步报告以及当前能否生成")
    @GetMapping("/{caseId}/preliminary")
    public PreliminaryReportVO getPreliminaryReport(@Parameter(description = "案件ID") @PathVariable Long caseId) {
        return preliminaryReportService.getPreliminaryReport(caseId, TenantContext.currentTenantId());
    }

    /**
     * 同步调用模型；文档未变化时直接返回已有报告
     */
    @Operation(summary = "生成初步报告", description = "仍有文档在处理中时拒绝")
    @PostMapping("/{caseId}/preliminary")
    public PreliminaryReportVO generatePreliminaryReport(@Parameter(description = "案件ID") @PathVariable Long caseId,
                                                         @Parameter(description = "忽略已有报告重新生成")
                                                         @RequestParam(defaultValue = "false") boolean force) {
        return preliminaryReportService.generatePreliminaryReport(caseId, TenantContext.currentTenantId(), force);
    }

    @Operation(summary = "上传定稿", description = "上传人工修订后的 docx，案件关闭")
    @PostMapping("/{caseId}/finalize")
    public ReportVersionVO finalizeCase(@Parameter(description = "案件ID") @PathVariable Long caseId,
                                        @Parameter(description = "定稿文件") @RequestParam("file") MultipartFile file) {
        return caseService.finalizeCase(caseId, TenantContext.currentTenantId(), file);
    }

    @Operation(summary = "获取报告下载链接")
    @GetMapping("/{caseId}/versions/{versionId}/download-url")
    public DownloadUrlVO getDownloadUrl(@Parameter(description = "案件ID") @PathVariable Long caseId,
                                        @Parameter(description = "版本ID") @PathVariable Long versionId) {
        return caseService.getDownloadUrl(caseId, versionId, TenantContext.currentTenantId());
    }

    @Operation(summary = "删除案件")
    @DeleteMapping("/{caseId}")
    public void deleteCase(@Parameter(description = "案件ID") @PathVariable Long caseId) {
        caseService.deleteCase(caseId, TenantContext.currentTenantId());
    }
}
