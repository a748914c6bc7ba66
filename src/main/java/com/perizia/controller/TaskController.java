package com.perizia.controller;

import com.perizia.model.dto.GenerateReportPayload;
import com.perizia.model.dto.ProcessDocumentPayload;
import com.perizia.model.dto.TaskNames;
import com.perizia.model.dto.TaskPayload;
import com.perizia.mq.TaskHandlerRegistry;
import com.perizia.service.TaskAuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

/**
 * 任务回调端点，供外部任务队列以 HTTP 方式投递
 * 不走用户登录，校验服务身份令牌；处理异常返回非 2xx，由队列重试
 *
 * @author perizia
 * @since 2025-03-03
 */
@Slf4j
@Tag(name = "任务回调", description = "外部任务队列投递的文档抽取与报告生成任务")
@RestController
@RequestMapping("/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskAuthService taskAuthService;

    private final TaskHandlerRegistry handlerRegistry;

    @Operation(summary = "文档抽取任务")
    @PostMapping("/" + TaskNames.PROCESS_DOCUMENT)
    public void processDocument(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                @RequestBody ProcessDocumentPayload payload) {
        run(authorization, payload);
    }

    @Operation(summary = "报告生成任务")
    @PostMapping("/" + TaskNames.GENERATE_REPORT)
    public void generateReport(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                               @RequestBody GenerateReportPayload payload) {
        run(authorization, payload);
    }

    private void run(String authorization, TaskPayload payload) {
        String caller = taskAuthService.verifyBearer(authorization);
        log.info("任务回调: caller={}, task={}", caller, payload.taskName());
        handlerRegistry.execute(payload);
    }
}
