package com.perizia.service;

import com.perizia.model.dto.CaseCreateDTO;
import com.perizia.model.vo.CaseDetailVO;
import com.perizia.model.vo.CaseVO;
import com.perizia.model.vo.DocumentVO;
import com.perizia.model.vo.DownloadUrlVO;
import com.perizia.model.vo.ReportVersionVO;
import org.springframework.web.multipart.MultipartFile;

/**
 * 案件服务
 *
 * @author perizia
 * @since 2025-03-02
 */
public interface CaseService {

    /**
     * 新建案件，案件编号为空时按日期自动生成
     *
     * @param dto      请求
     * @param tenantId 租户ID
     * @return 案件
     */
    CaseVO openCase(CaseCreateDTO dto, Long tenantId);

    /**
     * 上传文档：写入存储、登记 PENDING 文档，事务提交后投递抽取任务
     *
     * @param caseId   案件ID
     * @param tenantId 租户ID
     * @param file     文件
     * @return 文档
     */
    DocumentVO registerDocument(Long caseId, Long tenantId, MultipartFile file);

    /**
     * 为所有未成功的文档重新投递抽取任务。
     * 案件行锁防止重复派发，已在 PROCESSING 的案件直接跳过；没有文档的案件置为 ERROR。
     *
     * @return 投递的任务数
     */
    int processCase(Long caseId, Long tenantId);

    /**
     * 手动重试报告生成，仅适用于 ERROR 或尚无报告的 OPEN 案件
     */
    void retryGeneration(Long caseId, Long tenantId);

    /**
     * 上传人工定稿并关闭案件
     *
     * @return 定稿版本
     */
    ReportVersionVO finalizeCase(Long caseId, Long tenantId, MultipartFile file);

    CaseDetailVO getCaseDetail(Long caseId, Long tenantId);

    /**
     * 获取报告版本的签名下载链接
     */
    DownloadUrlVO getDownloadUrl(Long caseId, Long versionId, Long tenantId);

    /**
     * 软删除案件，进行中的案件不能删除
     */
    void deleteCase(Long caseId, Long tenantId);
}
