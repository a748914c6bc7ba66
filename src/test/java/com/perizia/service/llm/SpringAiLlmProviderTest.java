package com.perizia.service.llm;

import com.perizia.service.BlobStore;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class SpringAiLlmProviderTest {

    @Test
    void explicitCacheIsNeverCreated() {
        ChatModel chatModel = mock(ChatModel.class);
        SpringAiLlmProvider provider = new SpringAiLlmProvider(chatModel, mock(BlobStore.class));

        assertThat(provider.createCache("gpt-4o", "系统指令", Duration.ofDays(2))).isEmpty();
        // 系统指令随每次请求内联发送
        verifyNoInteractions(chatModel);
    }
}
