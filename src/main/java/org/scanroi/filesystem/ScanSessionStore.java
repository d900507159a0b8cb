package org.scanroi.filesystem;

import org.scanroi.scan.Scan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 已组装扫描的会话存储（内存版）。
 * <p>
 * 工作流：
 * <ol>
 *   <li>{@code scan_assemble}：读入扫描表与全部帧，生成 scanId 并把 {@link Scan} 暂存在内存。</li>
 *   <li>{@code scan_crop}/{@code scan_extract_roi}/{@code scan_track_roi} 等：用 scanId 取出同一个扫描继续处理。</li>
 *   <li>{@code scan_release}：主动释放；否则超过 TTL 后自动失效。</li>
 * </ol>
 * <p>
 * 一次扫描的所有帧都常驻内存，因此同时存在的会话数有上限；仅用于单实例/单进程场景。
 */
public class ScanSessionStore {

    private static final Logger log = LoggerFactory.getLogger(ScanSessionStore.class);

    private final Duration ttl;
    private final int maxSessions;
    private final ConcurrentHashMap<String, ScanSession> store = new ConcurrentHashMap<>();

    public ScanSessionStore(Duration ttl, int maxSessions) {
        this.ttl = ttl;
        this.maxSessions = maxSessions;
    }

    /**
     * 登记新会话。上限检查与写入在同一把锁内完成，并发组装不会越过 {@code maxSessions}；
     * {@link #require}/{@link #remove} 不加锁。
     */
    public synchronized ScanSession create(String rootId, String metadataPath, String frameFolder, List<String> frameIds, Scan scan) {
        cleanupExpired();
        if (store.size() >= maxSessions) {
            throw new IllegalStateException("扫描会话数已达上限 " + maxSessions + "，请先用 scan_release 释放不再使用的会话");
        }
        String scanId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        ScanSession session = new ScanSession(scanId, rootId, metadataPath, frameFolder, List.copyOf(frameIds), scan, now, now.plus(ttl));
        store.put(scanId, session);
        log.info("新建扫描会话 {}：{} 个扫描点，帧目录 {}", scanId, scan.size(), frameFolder);
        return session;
    }

    /**
     * 取出会话；不存在或已过期时抛出异常。
     */
    public ScanSession require(String scanId) {
        if (scanId == null || scanId.isBlank()) {
            throw new IllegalArgumentException("scanId 不能为空");
        }
        ScanSession session = store.get(scanId);
        if (session == null) {
            throw new IllegalArgumentException("未知的 scanId：" + scanId);
        }
        if (session.isExpired()) {
            store.remove(scanId);
            throw new IllegalArgumentException("扫描会话已过期，请重新 scan_assemble：" + scanId);
        }
        return session;
    }

    public boolean remove(String scanId) {
        if (scanId == null) {
            return false;
        }
        ScanSession removed = store.remove(scanId);
        if (removed != null) {
            log.info("释放扫描会话 {}", scanId);
        }
        return removed != null && !removed.isExpired();
    }

    public int size() {
        return store.size();
    }

    private void cleanupExpired() {
        Instant now = Instant.now();
        for (Map.Entry<String, ScanSession> entry : store.entrySet()) {
            if (entry.getValue().expiresAt().isBefore(now)) {
                store.remove(entry.getKey());
                log.debug("扫描会话 {} 已过期，清理", entry.getKey());
            }
        }
    }

    public record ScanSession(
            String scanId,
            String rootId,
            String metadataPath,
            String frameFolder,
            List<String> frameIds,
            Scan scan,
            Instant createdAt,
            Instant expiresAt
    ) {
        public boolean isExpired() {
            return Instant.now().isAfter(expiresAt);
        }
    }
}
