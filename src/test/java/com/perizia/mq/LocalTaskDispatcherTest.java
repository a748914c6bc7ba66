package com.perizia.mq;

import com.perizia.model.dto.GenerateReportPayload;
import com.perizia.model.dto.ProcessDocumentPayload;
import com.perizia.model.dto.TaskNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.task.SyncTaskExecutor;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class LocalTaskDispatcherTest {

    private TaskHandlerRegistry registry;

    private LocalTaskDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = mock(TaskHandlerRegistry.class);
        ObjectProvider<TaskHandlerRegistry> provider = mock(ObjectProvider.class);
        when(provider.getObject()).thenReturn(registry);
        dispatcher = new LocalTaskDispatcher(new SyncTaskExecutor(), provider);
    }

    @Test
    void runsTaskOnExecutor() {
        ProcessDocumentPayload payload = new ProcessDocumentPayload(11L, 7L);

        dispatcher.enqueue(TaskNames.PROCESS_DOCUMENT, payload);

        verify(registry).execute(payload);
    }

    @Test
    void rejectsMismatchedTaskName() {
        assertThatThrownBy(() -> dispatcher.enqueue(TaskNames.PROCESS_DOCUMENT, new GenerateReportPayload(1L, 7L)))
            .isInstanceOf(IllegalArgumentException.class);
        verify(registry, never()).execute(any());
    }

    @Test
    void handlerFailureDoesNotReachCaller() {
        GenerateReportPayload payload = new GenerateReportPayload(1L, 7L);
        doThrow(new IllegalStateException("boom")).when(registry).execute(payload);

        assertThatCode(() -> dispatcher.enqueue(TaskNames.GENERATE_REPORT, payload)).doesNotThrowAnyException();
    }
}
