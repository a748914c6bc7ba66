package com.perizia.service.llm;

import cn.hutool.core.util.StrUtil;
import com.perizia.Exception.GenerationException;
import com.perizia.Exception.LlmProviderException;
import com.perizia.config.LlmProperties;
import com.perizia.config.PipelineProperties;
import com.perizia.model.content.VisionContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * 报告生成编排
 * <p>
 * 依次尝试：主模型 + 提示词缓存；缓存被拒绝时主模型不带缓存重试一次；过载时切换备用模型不带缓存重试一次。
 * 每一步内部按 {@link RetryPolicy} 重试瞬时错误，全部失败时抛出 {@link GenerationException}。
 * 调用结束后尽力删除上传到提供方的临时文件，删除失败交给 {@link ProviderFileCleanupQueue}。
 * </p>
 *
 * @author perizia
 * @since 2025-03-06
 */
@Slf4j
@Service
public class GenerationOrchestrator {

    private final LlmProvider provider;

    private final PromptBuilder promptBuilder;

    private final PromptCacheService cacheService;

    private final ProviderFileCleanupQueue cleanupQueue;

    private final LlmProperties llmProperties;

    private final RetryPolicy retryPolicy;

    private final Semaphore generationGate;

    public GenerationOrchestrator(LlmProvider provider,
                                  PromptBuilder promptBuilder,
                                  PromptCacheService cacheService,
                                  ProviderFileCleanupQueue cleanupQueue,
                                  LlmProperties llmProperties,
                                  PipelineProperties pipelineProperties,
                                  RetryPolicy providerRetryPolicy) {
        this.provider = provider;
        this.promptBuilder = promptBuilder;
        this.cacheService = cacheService;
        this.cleanupQueue = cleanupQueue;
        this.llmProperties = llmProperties;
        this.retryPolicy = providerRetryPolicy;
        this.generationGate = new Semaphore(pipelineProperties.getGenerationConcurrency(), true);
    }

    public GenerationResult generate(GenerationRequest request) {
        try {
            generationGate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("等待生成名额时被中断: caseId=" + request.caseId(), e);
        }
        List<String> uploadedRefs = new ArrayList<>();
        try {
            List<PromptPart.File> files = new ArrayList<>();
            List<String> uploadErrors = new ArrayList<>();
            uploadVisionMaterials(request, uploadedRefs, files, uploadErrors);
            return runWaterfall(request, files, uploadErrors);
        } finally {
            cleanup(uploadedRefs);
            generationGate.release();
        }
    }

    private void uploadVisionMaterials(GenerationRequest request, List<String> uploadedRefs,
                                       List<PromptPart.File> files, List<String> uploadErrors) {
        for (VisionContent vision : PromptBuilder.visionMaterials(request.materials())) {
            try {
                String ref = retryPolicy.execute("上传文件 " + vision.filename(),
                    () -> provider.uploadFile(vision.storageRef(), vision.mimeType()));
                uploadedRefs.add(ref);
                files.add(new PromptPart.File(ref, vision.mimeType(), vision.filename()));
            } catch (LlmProviderException e) {
                log.warn("视觉文件上传失败，不纳入本次生成: caseId={}, file={}, code={}",
                    request.caseId(), vision.filename(), e.getCode());
                uploadErrors.add("文件 " + vision.filename() + " 上传失败，未能纳入分析");
            }
        }
    }

    private GenerationResult runWaterfall(GenerationRequest request, List<PromptPart.File> files,
                                          List<String> uploadErrors) {
        String primary = llmProperties.getModel();
        Optional<String> cacheRef = cacheService.getOrCreate(primary, promptBuilder.systemPrompt());

        LlmProviderException last;
        try {
            return attempt(request, primary, cacheRef.orElse(null), files, uploadErrors);
        } catch (LlmProviderException e) {
            last = e;
        }

        if (last.isCacheInvalidation() && cacheRef.isPresent()) {
            log.warn("提示词缓存被拒绝，改为不带缓存重试: caseId={}, model={}", request.caseId(), primary);
            cacheService.invalidate(cacheRef.get());
            try {
                return attempt(request, primary, null, files, uploadErrors);
            } catch (LlmProviderException e) {
                last = e;
            }
        }

        String fallback = llmProperties.getFallbackModel();
        if (last.getCode().isOverload() && StrUtil.isNotBlank(fallback) && !fallback.equals(primary)) {
            log.warn("主模型过载，切换备用模型: caseId={}, fallback={}", request.caseId(), fallback);
            try {
                return attempt(request, fallback, null, files, uploadErrors);
            } catch (LlmProviderException e) {
                last = e;
            }
        }

        throw new GenerationException("报告生成失败: caseId=" + request.caseId() + ", code=" + last.getCode(), last);
    }

    private GenerationResult attempt(GenerationRequest request, String model, String cacheRef,
                                     List<PromptPart.File> files, List<String> uploadErrors) {
        boolean useCache = cacheRef != null;
        List<PromptPart> parts = promptBuilder.build(request.materials(), files, uploadErrors, useCache);
        GenerationConfig config = new GenerationConfig(cacheRef, llmProperties.getTemperature(), llmProperties.getMaxTokens());

        LlmResponse response = retryPolicy.execute("生成报告 model=" + model, () -> {
            try {
                return provider.generate(model, parts, config);
            } catch (LlmProviderException e) {
                throw e.withCacheAttached(useCache);
            }
        });
        if (response == null || StrUtil.isBlank(response.text())) {
            throw new GenerationException("模型返回空内容: caseId=" + request.caseId() + ", model=" + model);
        }
        TokenUsage usage = TokenUsage.from(response, model);
        log.info("报告生成完成: caseId={}, model={}, cache={}, inputTokens={}, outputTokens={}, cachedTokens={}",
            request.caseId(), model, useCache, usage.inputTokens(), usage.outputTokens(), usage.cachedInputTokens());
        return new GenerationResult(response.text(), usage);
    }

    private void cleanup(List<String> uploadedRefs) {
        for (String ref : uploadedRefs) {
            try {
                provider.deleteFile(ref);
            } catch (RuntimeException e) {
                log.warn("临时文件删除失败，稍后重试: fileRef={}", ref, e);
                cleanupQueue.schedule(ref);
            }
        }
    }
}
