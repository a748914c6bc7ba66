package com.perizia.service.impl;

import cn.hutool.core.net.URLDecoder;
import com.perizia.config.FileStorageProperties;
import com.perizia.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import top.continew.starter.core.exception.BusinessException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalBlobStoreImplTest {

    @TempDir
    Path baseDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-07T12:00:00Z"));

    private FileStorageProperties properties;

    private LocalBlobStoreImpl blobStore;

    @BeforeEach
    void setUp() {
        properties = new FileStorageProperties();
        properties.setBasePath(baseDir.toString());
        properties.setPublicBaseUrl("https://perizie.example.it/");
        properties.setSigningSecret("test-secret");
        blobStore = new LocalBlobStoreImpl(properties, clock);
    }

    private static Map<String, String> query(String url) {
        Map<String, String> params = new HashMap<>();
        for (String pair : url.substring(url.indexOf('?') + 1).split("&")) {
            String[] kv = pair.split("=", 2);
            params.put(kv[0], URLDecoder.decode(kv[1], StandardCharsets.UTF_8));
        }
        return params;
    }

    @Test
    void putGetExistsAndDelete() {
        String ref = blobStore.put("ciao".getBytes(StandardCharsets.UTF_8), "cases/7/1/denuncia.txt");

        assertThat(ref).isEqualTo("cases/7/1/denuncia.txt");
        assertThat(Files.isRegularFile(baseDir.resolve(ref))).isTrue();
        assertThat(blobStore.exists(ref)).isTrue();
        assertThat(new String(blobStore.get(ref), StandardCharsets.UTF_8)).isEqualTo("ciao");

        blobStore.delete(ref);
        assertThat(blobStore.exists(ref)).isFalse();
        // 重复删除不报错
        blobStore.delete(ref);
    }

    @Test
    void signedUrlVerifiesUntilExpiry() {
        String url = blobStore.signedUrl("reports/7/1/v1_ai_draft.docx", Duration.ofMinutes(15));

        assertThat(url).startsWith("https://perizie.example.it/files/download?ref=");
        Map<String, String> params = query(url);
        String ref = params.get("ref");
        long expires = Long.parseLong(params.get("expires"));
        assertThat(ref).isEqualTo("reports/7/1/v1_ai_draft.docx");
        assertThat(blobStore.verifySignature(ref, expires, params.get("signature"))).isTrue();

        clock.advance(Duration.ofMinutes(16));
        assertThat(blobStore.verifySignature(ref, expires, params.get("signature"))).isFalse();
    }

    @Test
    void tamperedLinkIsRejected() {
        Map<String, String> params = query(blobStore.signedUrl("reports/7/1/final.docx", Duration.ofMinutes(15)));
        long expires = Long.parseLong(params.get("expires"));
        String signature = params.get("signature");

        assertThat(blobStore.verifySignature("reports/7/2/final.docx", expires, signature)).isFalse();
        assertThat(blobStore.verifySignature("reports/7/1/final.docx", expires + 3600, signature)).isFalse();
        assertThat(blobStore.verifySignature("reports/7/1/final.docx", expires, "")).isFalse();

        properties.setSigningSecret("rotated");
        assertThat(blobStore.verifySignature("reports/7/1/final.docx", expires, signature)).isFalse();
    }

    @Test
    void pathTraversalIsRejected() {
        assertThatThrownBy(() -> blobStore.put(new byte[]{1}, "../escape.txt")).isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> blobStore.get("/etc/passwd")).isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> blobStore.signedUrl("cases\\7\\x", Duration.ofMinutes(1))).isInstanceOf(BusinessException.class);
    }

    @Test
    void missingObjectIsABusinessError() {
        assertThatThrownBy(() -> blobStore.get("cases/7/1/missing.pdf")).isInstanceOf(BusinessException.class);
    }

    @Test
    void signingWithoutSecretFails() {
        properties.setSigningSecret(null);

        assertThatThrownBy(() -> blobStore.signedUrl("cases/7/1/a.pdf", Duration.ofMinutes(1)))
            .isInstanceOf(IllegalStateException.class);
    }
}
