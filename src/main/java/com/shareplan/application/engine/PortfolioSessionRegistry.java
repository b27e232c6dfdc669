package com.shareplan.application.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.shareplan.infrastructure.config.EngineConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Engines of the portfolios loaded in this process, keyed by session id.
 * Sessions not used for the configured idle timeout, or beyond the maximum count, are evicted.
 */
@Slf4j
@ApplicationScoped
public class PortfolioSessionRegistry {

    private final Cache<UUID, PortfolioEngine> sessions;

    @Inject
    public PortfolioSessionRegistry(EngineConfig engineConfig) {
        this(engineConfig.sessions().idleTimeout(), engineConfig.sessions().maxSize(), Ticker.systemTicker());
    }

    public PortfolioSessionRegistry(Duration idleTimeout, long maxSize, Ticker ticker) {
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(idleTimeout)
                .maximumSize(maxSize)
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener((UUID sessionId, PortfolioEngine engine, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.info("Evicted portfolio session {} ({})", sessionId, cause);
                    }
                })
                .build();
    }

    public UUID register(PortfolioEngine engine) {
        UUID sessionId = UUID.randomUUID();
        sessions.put(sessionId, engine);
        log.info("Registered portfolio session {} ({} active)", sessionId, sessions.estimatedSize());
        return sessionId;
    }

    public Optional<PortfolioEngine> find(UUID sessionId) {
        return sessionId != null ? Optional.ofNullable(sessions.getIfPresent(sessionId)) : Optional.empty();
    }

    public boolean remove(UUID sessionId) {
        boolean removed = sessionId != null && sessions.asMap().remove(sessionId) != null;
        if (removed) {
            log.info("Removed portfolio session {}", sessionId);
        }
        return removed;
    }

    public long size() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }
}
