package com.perizia.service;

import com.perizia.Exception.ExtractionException;
import com.perizia.model.enums.ExtractionErrorType;
import org.apache.tika.exception.EncryptedDocumentException;
import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.UnsupportedFormatException;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.util.zip.ZipException;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionErrorClassifierTest {

    @Test
    void explicitTypeWins() {
        assertThat(ExtractionErrorClassifier.classify(new ExtractionException(ExtractionErrorType.OVERSIZED, "big")))
            .isEqualTo(ExtractionErrorType.OVERSIZED);
    }

    @Test
    void tikaFailuresAreMapped() {
        assertThat(ExtractionErrorClassifier.classify(new UnsupportedFormatException("xyz")))
            .isEqualTo(ExtractionErrorType.UNSUPPORTED_TYPE);
        assertThat(ExtractionErrorClassifier.classify(new EncryptedDocumentException("password")))
            .isEqualTo(ExtractionErrorType.CORRUPT_FILE);
        assertThat(ExtractionErrorClassifier.classify(new TikaException("broken")))
            .isEqualTo(ExtractionErrorType.CORRUPT_FILE);
    }

    @Test
    void walksTheCauseChain() {
        RuntimeException wrapped = new IllegalStateException("outer",
            new UncheckedIOException(new ZipException("invalid CEN header")));
        assertThat(ExtractionErrorClassifier.classify(wrapped)).isEqualTo(ExtractionErrorType.CORRUPT_FILE);

        RuntimeException encoding = new IllegalStateException("outer", new MalformedInputException(3));
        assertThat(ExtractionErrorClassifier.classify(encoding)).isEqualTo(ExtractionErrorType.ENCODING);
    }

    @Test
    void unknownErrorsAreGeneric() {
        assertThat(ExtractionErrorClassifier.classify(new IllegalStateException("?")))
            .isEqualTo(ExtractionErrorType.GENERIC);
        assertThat(ExtractionErrorClassifier.classify(null)).isEqualTo(ExtractionErrorType.GENERIC);
    }
}
