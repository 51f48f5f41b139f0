package com.jreinhal.veritas.workspace;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Long-lived pool of per-workspace store clients.
 *
 * <p>Lookups of a resident handle are lock-free. Creation is atomic per workspace key, so concurrent
 * first requests for a workspace build exactly one handle. Handles idle longer than the configured
 * window are evicted, and the pool never holds more than {@code maxSize} handles, dropping the least
 * recently used ones first. Evicted handles are closed.</p>
 */
@Component
public class TenantClientPool {
    private static final Logger log = LoggerFactory.getLogger(TenantClientPool.class);

    private final TenantClientFactory factory;
    private final Cache<String, TenantClients> clients;

    @Autowired
    public TenantClientPool(TenantClientFactory factory,
                            @Value("${veritas.pool.idle-minutes:30}") long idleMinutes,
                            @Value("${veritas.pool.max-size:50}") long maxSize) {
        this(factory, Duration.ofMinutes(Math.max(1L, idleMinutes)), maxSize, Ticker.systemTicker());
    }

    TenantClientPool(TenantClientFactory factory, Duration idleTimeout, long maxSize, Ticker ticker) {
        this.factory = factory;
        this.clients = Caffeine.newBuilder()
                .expireAfterAccess(idleTimeout)
                .maximumSize(Math.max(1L, maxSize))
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener((String key, TenantClients value, RemovalCause cause) -> {
                    if (value != null) {
                        log.info("Evicting store clients for workspace {} ({})", key, cause);
                        value.close();
                    }
                })
                .build();
        log.info("Tenant client pool initialized: idleTimeout={}, maxSize={}", idleTimeout, maxSize);
    }

    public TenantClients acquire(String workspaceId) {
        String key = WorkspaceContext.resolve(workspaceId);
        return this.clients.get(key, this.factory::create);
    }

    public long size() {
        this.clients.cleanUp();
        return this.clients.estimatedSize();
    }

    public boolean isResident(String workspaceId) {
        return this.clients.getIfPresent(WorkspaceContext.resolve(workspaceId)) != null;
    }

    public void evict(String workspaceId) {
        this.clients.invalidate(WorkspaceContext.resolve(workspaceId));
    }

    void cleanUp() {
        this.clients.cleanUp();
    }
}
