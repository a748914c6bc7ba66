package com.perizia.service.llm;

import com.perizia.Exception.GenerationException;
import com.perizia.Exception.LlmProviderException;
import com.perizia.config.LlmProperties;
import com.perizia.config.PipelineProperties;
import com.perizia.model.content.ExtractedContent;
import com.perizia.model.content.TextContent;
import com.perizia.model.content.VisionContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GenerationOrchestratorTest {

    private static final List<ExtractedContent> MATERIALS = List.of(new TextContent("perizia.docx", "danni al tetto"));

    private LlmProvider provider;

    private PromptCacheService cacheService;

    private ProviderFileCleanupQueue cleanupQueue;

    private GenerationOrchestrator orchestrator;

    /**
     * 每次调用使用的模型与是否带缓存
     */
    private final List<String> calls = new ArrayList<>();

    @BeforeEach
    void setUp() {
        provider = mock(LlmProvider.class);
        cacheService = mock(PromptCacheService.class);
        cleanupQueue = mock(ProviderFileCleanupQueue.class);
        when(cacheService.getOrCreate(anyString(), anyString())).thenReturn(Optional.of("cache-1"));

        LlmProperties llmProperties = new LlmProperties();
        llmProperties.setModel("primary");
        llmProperties.setFallbackModel("fallback");
        RetryPolicy retryPolicy = RetryPolicy.transientProviderErrors(3, Duration.ofMillis(1), Duration.ofMillis(1))
            .withSleeper(millis -> { });

        orchestrator = new GenerationOrchestrator(provider, new PromptBuilder("系统指令"), cacheService, cleanupQueue,
            llmProperties, new PipelineProperties(), retryPolicy);
    }

    private void recordCalls() {
        when(provider.generate(anyString(), anyList(), any())).thenAnswer(invocation -> {
            String model = invocation.getArgument(0);
            GenerationConfig config = invocation.getArgument(2);
            calls.add(model + (config.hasCache() ? "+cache" : ""));
            return null;
        });
    }

    @Test
    void cacheRejectionFallsBackToPrimaryWithoutCache() {
        when(provider.generate(anyString(), anyList(), any())).thenAnswer(invocation -> {
            GenerationConfig config = invocation.getArgument(2);
            calls.add(invocation.getArgument(0) + (config.hasCache() ? "+cache" : ""));
            if (config.hasCache()) {
                throw new LlmProviderException(ProviderErrorCode.INVALID_ARGUMENT, "cached content not found", null);
            }
            return new LlmResponse("# Relazione", 1200, 800, 0);
        });

        GenerationResult result = orchestrator.generate(new GenerationRequest(1L, 7L, MATERIALS));

        assertThat(result.text()).isEqualTo("# Relazione");
        assertThat(result.usage().model()).isEqualTo("primary");
        assertThat(calls).containsExactly("primary+cache", "primary");
        verify(cacheService).invalidate("cache-1");
    }

    @Test
    void invalidArgumentWithoutCacheIsNotRetried() {
        when(cacheService.getOrCreate(anyString(), anyString())).thenReturn(Optional.empty());
        when(provider.generate(anyString(), anyList(), any())).thenAnswer(invocation -> {
            calls.add(invocation.getArgument(0));
            throw new LlmProviderException(ProviderErrorCode.INVALID_ARGUMENT, "bad request", null);
        });

        assertThatThrownBy(() -> orchestrator.generate(new GenerationRequest(1L, 7L, MATERIALS)))
            .isInstanceOf(GenerationException.class);
        assertThat(calls).containsExactly("primary");
        verify(cacheService, never()).invalidate(anyString());
    }

    @Test
    void overloadSwitchesToFallbackModel() {
        when(provider.generate(anyString(), anyList(), any())).thenAnswer(invocation -> {
            String model = invocation.getArgument(0);
            calls.add(model);
            if (model.equals("primary")) {
                throw new LlmProviderException(ProviderErrorCode.OVERLOADED, "overloaded", null);
            }
            return LlmResponse.ofText("fallback report");
        });

        GenerationResult result = orchestrator.generate(new GenerationRequest(1L, 7L, MATERIALS));

        assertThat(result.text()).isEqualTo("fallback report");
        assertThat(result.usage().model()).isEqualTo("fallback");
        // 主模型按重试策略尝试 3 次后切换
        assertThat(calls).containsExactly("primary", "primary", "primary", "fallback");
    }

    @Test
    void transientErrorIsRetriedOnSameModel() {
        when(provider.generate(anyString(), anyList(), any()))
            .thenThrow(new LlmProviderException(ProviderErrorCode.UNAVAILABLE, "503", null))
            .thenReturn(LlmResponse.ofText("ok"));

        GenerationResult result = orchestrator.generate(new GenerationRequest(1L, 7L, MATERIALS));

        assertThat(result.text()).isEqualTo("ok");
        verify(provider, times(2)).generate(eq("primary"), anyList(), any());
        verify(provider, never()).generate(eq("fallback"), anyList(), any());
    }

    @Test
    void permanentFailureRaisesGenerationException() {
        when(provider.generate(anyString(), anyList(), any()))
            .thenThrow(new LlmProviderException(ProviderErrorCode.PERMISSION_DENIED, "denied", null));

        assertThatThrownBy(() -> orchestrator.generate(new GenerationRequest(1L, 7L, MATERIALS)))
            .isInstanceOf(GenerationException.class)
            .hasCauseInstanceOf(LlmProviderException.class);
        verify(provider, times(1)).generate(anyString(), anyList(), any());
    }

    @Test
    void emptyTextIsAGenerationFailure() {
        recordCalls();

        assertThatThrownBy(() -> orchestrator.generate(new GenerationRequest(1L, 7L, MATERIALS)))
            .isInstanceOf(GenerationException.class);
    }

    @Test
    void missingUsageDefaultsToZero() {
        when(provider.generate(anyString(), anyList(), any())).thenReturn(LlmResponse.ofText("report"));

        TokenUsage usage = orchestrator.generate(new GenerationRequest(1L, 7L, MATERIALS)).usage();

        assertThat(usage.inputTokens()).isZero();
        assertThat(usage.outputTokens()).isZero();
        assertThat(usage.cachedInputTokens()).isZero();
        assertThat(usage.totalTokens()).isZero();
    }

    @Test
    void uploadedFilesAreDeletedAndCleanupFailureIsTolerated() {
        List<ExtractedContent> materials = List.of(
            new TextContent("note.txt", "testo"),
            new VisionContent("foto.jpg", "image/jpeg", "cases/7/1/foto.jpg"));
        when(provider.uploadFile("cases/7/1/foto.jpg", "image/jpeg")).thenReturn("provider-files/foto.jpg");
        when(provider.generate(anyString(), anyList(), any())).thenAnswer(invocation -> {
            List<PromptPart> parts = invocation.getArgument(1);
            assertThat(parts).contains(new PromptPart.File("provider-files/foto.jpg", "image/jpeg", "foto.jpg"));
            return LlmResponse.ofText("report");
        });
        doThrow(new LlmProviderException(ProviderErrorCode.UNAVAILABLE, "down", null))
            .when(provider).deleteFile("provider-files/foto.jpg");

        GenerationResult result = orchestrator.generate(new GenerationRequest(1L, 7L, materials));

        assertThat(result.text()).isEqualTo("report");
        verify(cleanupQueue).schedule("provider-files/foto.jpg");
    }

    @Test
    void failedUploadBecomesANoteInThePrompt() {
        List<ExtractedContent> materials = List.of(new VisionContent("foto.jpg", "image/jpeg", "cases/7/1/foto.jpg"));
        when(provider.uploadFile(anyString(), anyString()))
            .thenThrow(new LlmProviderException(ProviderErrorCode.PERMISSION_DENIED, "denied", null));
        when(provider.generate(anyString(), anyList(), any())).thenAnswer(invocation -> {
            List<PromptPart> parts = invocation.getArgument(1);
            assertThat(parts).noneMatch(p -> p instanceof PromptPart.File);
            assertThat(parts).anyMatch(p -> p instanceof PromptPart.Text t && t.text().contains("foto.jpg"));
            return LlmResponse.ofText("report");
        });

        assertThat(orchestrator.generate(new GenerationRequest(1L, 7L, materials)).text()).isEqualTo("report");
        verify(provider, never()).deleteFile(anyString());
    }
}
