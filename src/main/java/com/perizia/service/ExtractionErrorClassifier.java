package com.perizia.service;

import com.perizia.Exception.ExtractionException;
import com.perizia.model.enums.ExtractionErrorType;
import org.apache.tika.exception.EncryptedDocumentException;
import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.UnsupportedFormatException;

import java.io.EOFException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.CharacterCodingException;
import java.util.zip.ZipException;

/**
 * 将抽取异常归入面向用户的错误分类
 *
 * @author perizia
 * @since 2025-03-03
 */
public final class ExtractionErrorClassifier {

    /**
     * 防止异常链成环
     */
    private static final int MAX_DEPTH = 16;

    private ExtractionErrorClassifier() {
    }

    public static ExtractionErrorType classify(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_DEPTH; depth++) {
            ExtractionErrorType type = classifyOne(current);
            if (type != null) {
                return type;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return ExtractionErrorType.GENERIC;
    }

    private static ExtractionErrorType classifyOne(Throwable t) {
        if (t instanceof ExtractionException e) {
            return e.getErrorType();
        }
        if (t instanceof UnsupportedFormatException) {
            return ExtractionErrorType.UNSUPPORTED_TYPE;
        }
        if (t instanceof CharacterCodingException || t instanceof UnsupportedEncodingException) {
            return ExtractionErrorType.ENCODING;
        }
        if (t instanceof EncryptedDocumentException || t instanceof TikaException
            || t instanceof ZipException || t instanceof EOFException) {
            return ExtractionErrorType.CORRUPT_FILE;
        }
        return null;
    }
}
