package com.perizia.service.llm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 提供方临时文件删除的重试队列
 * 删除失败的文件按 2^attempt 分钟退避重试，超过次数后进入有界死信列表
 *
 * @author perizia
 * @since 2025-03-07
 */
@Slf4j
@Component
public class ProviderFileCleanupQueue {

    static final int MAX_ATTEMPTS = 3;

    static final int DEAD_LETTER_CAPACITY = 100;

    private record PendingDeletion(String fileRef, int attempts, Instant nextAttemptAt) {
    }

    private final LlmProvider provider;

    private final Clock clock;

    private final PriorityQueue<PendingDeletion> pending =
        new PriorityQueue<>(Comparator.comparing(PendingDeletion::nextAttemptAt));

    private final Deque<String> deadLetters = new ArrayDeque<>();

    public ProviderFileCleanupQueue(LlmProvider provider, Clock clock) {
        this.provider = provider;
        this.clock = clock;
    }

    /**
     * 首次删除失败后登记
     */
    public synchronized void schedule(String fileRef) {
        enqueue(fileRef, 1);
    }

    /**
     * 重试到期的删除
     *
     * @return 本轮删除成功的数量
     */
    @Scheduled(fixedDelayString = "${llm.cleanup-interval:PT1M}")
    public int drain() {
        List<PendingDeletion> due = takeDue();
        int deleted = 0;
        for (PendingDeletion item : due) {
            try {
                provider.deleteFile(item.fileRef());
                deleted++;
                log.info("临时文件重试删除成功: fileRef={}, attempts={}", item.fileRef(), item.attempts() + 1);
            } catch (RuntimeException e) {
                log.warn("临时文件重试删除失败: fileRef={}, attempts={}", item.fileRef(), item.attempts() + 1, e);
                synchronized (this) {
                    enqueue(item.fileRef(), item.attempts() + 1);
                }
            }
        }
        return deleted;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized List<String> deadLetters() {
        return List.copyOf(deadLetters);
    }

    private synchronized List<PendingDeletion> takeDue() {
        Instant now = clock.instant();
        List<PendingDeletion> due = new ArrayList<>();
        while (!pending.isEmpty() && !pending.peek().nextAttemptAt().isAfter(now)) {
            due.add(pending.poll());
        }
        return due;
    }

    private void enqueue(String fileRef, int attempts) {
        if (attempts > MAX_ATTEMPTS) {
            if (deadLetters.size() >= DEAD_LETTER_CAPACITY) {
                deadLetters.pollFirst();
            }
            deadLetters.addLast(fileRef);
            log.error("临时文件删除多次失败，放弃: fileRef={}", fileRef);
            return;
        }
        Duration delay = Duration.ofMinutes(1L << attempts);
        pending.add(new PendingDeletion(fileRef, attempts, clock.instant().plus(delay)));
    }
}
