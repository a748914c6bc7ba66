package com.perizia.service.llm;

import cn.hutool.core.io.file.FileNameUtil;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.perizia.Exception.LlmProviderException;
import com.perizia.service.BlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于 Spring AI ChatModel 的模型提供方
 * <p>
 * 视觉文件的侧通道是对象存储中的临时副本（provider-files/ 前缀），调用时以字节形式附加到消息中，调用结束后删除。
 * OpenAI 兼容接口对相同前缀的提示词自动缓存，不支持显式创建缓存。
 * </p>
 *
 * @author perizia
 * @since 2025-03-06
 */
@Slf4j
@Component
public class SpringAiLlmProvider implements LlmProvider {

    static final String STAGING_PREFIX = "provider-files/";

    /**
     * Spring AI 默认错误处理器抛出的异常消息以 HTTP 状态码开头，如 "503 - {...}"
     */
    private static final Pattern LEADING_STATUS = Pattern.compile("^\\s*(\\d{3})\\b");

    private final ChatModel chatModel;

    private final BlobStore blobStore;

    public SpringAiLlmProvider(ChatModel chatModel, BlobStore blobStore) {
        this.chatModel = chatModel;
        this.blobStore = blobStore;
    }

    @Override
    public LlmResponse generate(String model, List<PromptPart> parts, GenerationConfig config) {
        StringBuilder text = new StringBuilder();
        List<Media> media = new ArrayList<>();
        for (PromptPart part : parts) {
            if (part instanceof PromptPart.Text t) {
                text.append(t.text());
            } else if (part instanceof PromptPart.File f) {
                byte[] bytes = loadStaged(f.fileRef());
                media.add(new Media(MimeType.valueOf(f.mimeType()), new ByteArrayResource(bytes)));
                text.append("[附件: ").append(f.label()).append("]\n");
            }
        }
        OpenAiChatOptions options = OpenAiChatOptions.builder()
            .model(model)
            .temperature(config.temperature())
            .maxTokens(config.maxOutputTokens())
            .build();
        UserMessage message = UserMessage.builder().text(text.toString()).media(media).build();

        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(List.of(message), options));
        } catch (RuntimeException e) {
            throw translate(e, "模型调用失败: model=" + model);
        }
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return new LlmResponse(null, null, null, null);
        }
        String output = response.getResult().getOutput().getText();
        Usage usage = response.getMetadata() == null ? null : response.getMetadata().getUsage();
        if (usage == null) {
            return LlmResponse.ofText(output);
        }
        return new LlmResponse(output, usage.getPromptTokens(), usage.getCompletionTokens(), cachedTokens(usage));
    }

    /**
     * OpenAI 兼容接口没有显式的缓存对象，相同前缀由服务端自动缓存，命中情况只体现在用量的 cachedTokens 中。
     * 因此这里始终返回空：生成编排中带缓存的尝试与缓存失效后的重试在本提供方下不会发生，系统指令总是内联发送。
     */
    @Override
    public Optional<String> createCache(String model, String systemInstruction, Duration ttl) {
        return Optional.empty();
    }

    @Override
    public String uploadFile(String storageRef, String mimeType) {
        String stagedRef = STAGING_PREFIX + IdUtil.fastSimpleUUID();
        String ext = FileNameUtil.extName(storageRef);
        if (StrUtil.isNotBlank(ext)) {
            stagedRef = stagedRef + "." + ext;
        }
        try {
            blobStore.put(blobStore.get(storageRef), stagedRef);
            return stagedRef;
        } catch (RuntimeException e) {
            throw new LlmProviderException(ProviderErrorCode.UNAVAILABLE, "文件暂存失败: " + storageRef, e);
        }
    }

    @Override
    public void deleteFile(String fileRef) {
        if (!fileRef.startsWith(STAGING_PREFIX)) {
            throw new IllegalArgumentException("不是临时文件引用: " + fileRef);
        }
        try {
            blobStore.delete(fileRef);
        } catch (RuntimeException e) {
            throw new LlmProviderException(ProviderErrorCode.UNAVAILABLE, "临时文件删除失败: " + fileRef, e);
        }
    }

    private byte[] loadStaged(String fileRef) {
        try {
            return blobStore.get(fileRef);
        } catch (RuntimeException e) {
            throw new LlmProviderException(ProviderErrorCode.NOT_FOUND, "临时文件不存在: " + fileRef, e);
        }
    }

    /**
     * 按 HTTP 状态码或异常类型映射错误码
     */
    static LlmProviderException translate(RuntimeException e, String message) {
        if (e instanceof LlmProviderException providerException) {
            return providerException;
        }
        ProviderErrorCode code;
        if (e instanceof HttpStatusCodeException httpException) {
            code = ProviderErrorCode.fromHttpStatus(httpException.getStatusCode().value());
        } else if (e instanceof ResourceAccessException) {
            code = ProviderErrorCode.DEADLINE_EXCEEDED;
        } else if (e instanceof TransientAiException || e instanceof NonTransientAiException) {
            code = statusFromMessage(e.getMessage())
                .map(ProviderErrorCode::fromHttpStatus)
                .orElse(e instanceof TransientAiException ? ProviderErrorCode.UNAVAILABLE : ProviderErrorCode.UNKNOWN);
        } else {
            code = ProviderErrorCode.UNKNOWN;
        }
        return new LlmProviderException(code, message + ", code=" + code, e);
    }

    private static Optional<Integer> statusFromMessage(String message) {
        if (message == null) {
            return Optional.empty();
        }
        Matcher matcher = LEADING_STATUS.matcher(message);
        return matcher.find() ? Optional.of(Integer.parseInt(matcher.group(1))) : Optional.empty();
    }

    private static Integer cachedTokens(Usage usage) {
        if (usage.getNativeUsage() instanceof OpenAiApi.Usage openAiUsage
            && openAiUsage.promptTokensDetails() != null) {
            return openAiUsage.promptTokensDetails().cachedTokens();
        }
        return null;
    }
}
