package com.perizia.mq;

import com.perizia.model.dto.GenerateReportPayload;
import com.perizia.model.dto.ProcessDocumentPayload;
import com.perizia.model.dto.TaskPayload;
import com.perizia.service.ExtractionWorkerService;
import com.perizia.service.ReportGenerationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 按载荷类型执行任务，本地线程池、队列消费者和任务回调端点共用
 *
 * @author perizia
 * @since 2025-03-03
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskHandlerRegistry {

    private final ExtractionWorkerService extractionWorkerService;

    private final ReportGenerationService reportGenerationService;

    public void execute(TaskPayload payload) {
        log.info("执行任务: task={}, payload={}", payload.taskName(), payload);
        if (payload instanceof ProcessDocumentPayload p) {
            extractionWorkerService.processDocument(p.documentId(), p.tenantId());
        } else if (payload instanceof GenerateReportPayload p) {
            reportGenerationService.generateReport(p.caseId(), p.tenantId());
        }
    }
}
