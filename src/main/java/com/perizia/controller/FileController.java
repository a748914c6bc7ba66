package com.perizia.controller;

import cn.hutool.core.io.file.FileNameUtil;
import com.perizia.service.BlobStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * 签名链接下载
 *
 * @author perizia
 * @since 2025-03-07
 */
@Slf4j
@Tag(name = "文件下载", description = "凭签名链接下载报告文件")
@RestController
@RequestMapping("/files")
@RequiredArgsConstructor
public class FileController {

    private final BlobStore blobStore;

    @Operation(summary = "下载文件")
    @GetMapping("/download")
    public ResponseEntity<byte[]> download(@Parameter(description = "对象引用") @RequestParam String ref,
                                           @Parameter(description = "过期时间(epoch 秒)") @RequestParam long expires,
                                           @Parameter(description = "签名") @RequestParam String signature) {
        if (!blobStore.verifySignature(ref, expires, signature)) {
            log.warn("下载链接签名无效或已过期: ref={}", ref);
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        if (!blobStore.exists(ref)) {
            return ResponseEntity.notFound().build();
        }
        ContentDisposition disposition = ContentDisposition.attachment()
            .filename(FileNameUtil.getName(ref), StandardCharsets.UTF_8)
            .build();
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
            .contentType(MediaType.APPLICATION_OCTET_STREAM)
            .body(blobStore.get(ref));
    }
}
