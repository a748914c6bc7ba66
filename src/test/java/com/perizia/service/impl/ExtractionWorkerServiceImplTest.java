package com.perizia.service.impl;

import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perizia.Exception.ExtractionException;
import com.perizia.config.PipelineProperties;
import com.perizia.mapper.DocumentMapper;
import com.perizia.model.content.ExtractedContent;
import com.perizia.model.content.TextContent;
import com.perizia.model.entity.DocumentDO;
import com.perizia.model.enums.ExtractionErrorType;
import com.perizia.model.enums.ExtractionStatus;
import com.perizia.service.DocumentExtractionService;
import com.perizia.service.FanInCoordinatorService;
import com.perizia.support.MybatisPlusTestSupport;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class ExtractionWorkerServiceImplTest {

    private DocumentMapper documentMapper;

    private DocumentExtractionService extractionService;

    private FanInCoordinatorService fanIn;

    private ExtractionWorkerServiceImpl worker;

    private DocumentDO document;

    @BeforeAll
    static void initTableInfo() {
        MybatisPlusTestSupport.initTableInfo(DocumentDO.class);
    }

    @BeforeEach
    void setUp() {
        documentMapper = mock(DocumentMapper.class);
        extractionService = mock(DocumentExtractionService.class);
        fanIn = mock(FanInCoordinatorService.class);
        worker = new ExtractionWorkerServiceImpl(documentMapper, extractionService, fanIn,
            new ObjectMapper(), new PipelineProperties());

        document = DocumentDO.builder()
            .id(11L).caseId(1L).tenantId(7L)
            .filename("denuncia.docx").storageRef("cases/7/1/a.docx")
            .mimeType("application/vnd.openxmlformats-officedocument.wordprocessingml.document")
            .aiStatus(ExtractionStatus.PENDING)
            .build();
        when(documentMapper.selectOne(any())).thenReturn(document);
    }

    @Test
    void successfulExtractionStoresContentAndSignalsFanIn() throws Exception {
        when(extractionService.extract(anyString(), anyString(), anyString()))
            .thenReturn(List.of(new TextContent("denuncia.docx", "sinistro del 3 marzo")));

        worker.processDocument(11L, 7L);

        assertThat(document.getAiStatus()).isEqualTo(ExtractionStatus.SUCCESS);
        ArgumentCaptor<LambdaUpdateWrapper<DocumentDO>> captor = ArgumentCaptor.forClass(LambdaUpdateWrapper.class);
        verify(documentMapper, times(2)).update(isNull(), captor.capture());
        String json = MybatisPlusTestSupport.paramValues(captor.getValue()).stream()
            .filter(v -> v instanceof String s && s.startsWith("["))
            .map(String.class::cast)
            .findFirst()
            .orElseThrow();
        List<ExtractedContent> stored = new ObjectMapper().readValue(json, ExtractedContent.LIST_TYPE);
        assertThat(stored).containsExactly(new TextContent("denuncia.docx", "sinistro del 3 marzo"));
        verify(fanIn).checkCompletion(1L, 7L);
    }

    @Test
    void emptyResultIsSkipped() {
        when(extractionService.extract(anyString(), anyString(), anyString())).thenReturn(List.of());

        worker.processDocument(11L, 7L);

        assertThat(document.getAiStatus()).isEqualTo(ExtractionStatus.SKIPPED);
        verify(fanIn).checkCompletion(1L, 7L);
    }

    @Test
    void extractionFailureIsRecordedWithUserMessage() {
        when(extractionService.extract(anyString(), anyString(), anyString()))
            .thenThrow(new ExtractionException(ExtractionErrorType.UNSUPPORTED_TYPE, "application/x-foo"));

        worker.processDocument(11L, 7L);

        assertThat(document.getAiStatus()).isEqualTo(ExtractionStatus.ERROR);
        ArgumentCaptor<LambdaUpdateWrapper<DocumentDO>> captor = ArgumentCaptor.forClass(LambdaUpdateWrapper.class);
        verify(documentMapper, times(2)).update(isNull(), captor.capture());
        assertThat(MybatisPlusTestSupport.paramValues(captor.getValue()))
            .contains(ExtractionErrorType.UNSUPPORTED_TYPE.getUserMessage());
        verify(fanIn).checkCompletion(1L, 7L);
    }

    @Test
    void alreadySucceededDocumentOnlyRetriggersFanIn() {
        document.setAiStatus(ExtractionStatus.SUCCESS);

        worker.processDocument(11L, 7L);

        verify(extractionService, never()).extract(anyString(), anyString(), anyString());
        verify(documentMapper, never()).update(any(), any());
        verify(fanIn).checkCompletion(1L, 7L);
    }

    @Test
    void missingDocumentIsIgnored() {
        when(documentMapper.selectOne(any())).thenReturn(null);

        worker.processDocument(99L, 7L);

        verify(fanIn, never()).checkCompletion(any(), any());
    }

    @Test
    void databaseFailureOnResultWritePropagates() {
        when(extractionService.extract(anyString(), anyString(), anyString()))
            .thenReturn(List.of(new TextContent("denuncia.docx", "testo")));
        when(documentMapper.update(isNull(), any()))
            .thenReturn(1)
            .thenThrow(new DataAccessResourceFailureException("connection lost"));

        assertThatThrownBy(() -> worker.processDocument(11L, 7L))
            .isInstanceOf(DataAccessResourceFailureException.class);
        verify(fanIn, never()).checkCompletion(any(), any());
    }

    @Test
    void parserStackOverflowMarksOnlyThisDocumentFailed() {
        when(extractionService.extract(anyString(), anyString(), anyString())).thenThrow(new StackOverflowError());

        worker.processDocument(11L, 7L);

        assertThat(document.getAiStatus()).isEqualTo(ExtractionStatus.ERROR);
        verify(fanIn).checkCompletion(1L, 7L);
    }

    @Test
    void fatalErrorPropagatesAndReleasesTheExtractionSlot() {
        PipelineProperties properties = new PipelineProperties();
        properties.setExtractionConcurrency(1);
        worker = new ExtractionWorkerServiceImpl(documentMapper, extractionService, fanIn, new ObjectMapper(), properties);
        when(extractionService.extract(anyString(), anyString(), anyString()))
            .thenThrow(new OutOfMemoryError("Java heap space"))
            .thenReturn(List.of(new TextContent("denuncia.docx", "testo")));

        assertThatThrownBy(() -> worker.processDocument(11L, 7L)).isInstanceOf(OutOfMemoryError.class);
        // 停在 PROCESSING，重新派发后可以再次抽取
        assertThat(document.getAiStatus()).isEqualTo(ExtractionStatus.PROCESSING);
        verify(fanIn, never()).checkCompletion(any(), any());

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> worker.processDocument(11L, 7L));
        assertThat(document.getAiStatus()).isEqualTo(ExtractionStatus.SUCCESS);
    }
}
