package com.perizia.service.impl;

import com.perizia.Exception.ExtractionException;
import com.perizia.config.PipelineProperties;
import com.perizia.model.content.ExtractedContent;
import com.perizia.model.content.TextContent;
import com.perizia.model.content.VisionContent;
import com.perizia.model.enums.ExtractionErrorType;
import com.perizia.service.BlobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DocumentExtractionServiceImplTest {

    private BlobStore blobStore;

    private PipelineProperties properties;

    private DocumentExtractionServiceImpl service;

    @BeforeEach
    void setUp() {
        blobStore = mock(BlobStore.class);
        properties = new PipelineProperties();
        service = new DocumentExtractionServiceImpl(blobStore, properties);
    }

    private void stored(String ref, String content) {
        when(blobStore.get(ref)).thenReturn(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void plainTextBecomesCleanedTextContent() {
        stored("cases/1/1/a.txt", "Sinistro del 12/02\r\n\r\n\r\n\r\nVeicolo   tamponato in via Roma  ");

        List<ExtractedContent> contents = service.extract("cases/1/1/a.txt", "text/plain", "nota.txt");

        assertThat(contents).containsExactly(new TextContent("nota.txt", "Sinistro del 12/02\n\nVeicolo tamponato in via Roma"));
    }

    @Test
    void blankTextYieldsNoContent() {
        stored("cases/1/1/b.txt", "   \n\n  ");

        assertThat(service.extract("cases/1/1/b.txt", "text/plain", "vuoto.txt")).isEmpty();
    }

    @Test
    void emptyFileYieldsNoContent() {
        when(blobStore.get("cases/1/1/c.txt")).thenReturn(new byte[0]);

        assertThat(service.extract("cases/1/1/c.txt", "text/plain", "c.txt")).isEmpty();
    }

    @Test
    void pdfIsHandedToTheModelAsVisionContent() {
        stored("cases/1/1/d.pdf", "%PDF-1.4\n1 0 obj\n<<>>\nendobj\n");

        List<ExtractedContent> contents = service.extract("cases/1/1/d.pdf", "application/pdf", "perizia.pdf");

        assertThat(contents).containsExactly(new VisionContent("perizia.pdf", "application/pdf", "cases/1/1/d.pdf"));
    }

    @Test
    void declaredImageWithTextContentIsCorrupt() {
        stored("cases/1/1/e.jpg", "questo non e' un'immagine");

        assertThatThrownBy(() -> service.extract("cases/1/1/e.jpg", "image/jpeg", "foto.jpg"))
            .isInstanceOf(ExtractionException.class)
            .extracting(e -> ((ExtractionException) e).getErrorType())
            .isEqualTo(ExtractionErrorType.CORRUPT_FILE);
    }

    @Test
    void oversizedFileIsRejectedBeforeParsing() {
        properties.getExtraction().setMaxFileSizeMb(0);
        stored("cases/1/1/f.txt", "x");

        assertThatThrownBy(() -> service.extract("cases/1/1/f.txt", "text/plain", "f.txt"))
            .isInstanceOf(ExtractionException.class)
            .extracting(e -> ((ExtractionException) e).getErrorType())
            .isEqualTo(ExtractionErrorType.OVERSIZED);
    }

    @Test
    void unknownBinaryIsUnsupported() {
        when(blobStore.get("cases/1/1/g.bin")).thenReturn(new byte[]{(byte) 0xde, (byte) 0xad, 0x00, (byte) 0xbe, (byte) 0xef, 0x01, 0x02});

        assertThatThrownBy(() -> service.extract("cases/1/1/g.bin", "application/octet-stream", "dump.bin"))
            .isInstanceOf(ExtractionException.class)
            .extracting(e -> ((ExtractionException) e).getErrorType())
            .isEqualTo(ExtractionErrorType.UNSUPPORTED_TYPE);
    }
}
