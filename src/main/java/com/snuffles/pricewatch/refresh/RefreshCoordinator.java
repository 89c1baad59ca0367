package com.snuffles.pricewatch.refresh;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs background refreshes with at most one in flight per scope. A request that finds its
 * scope busy is dropped, not queued.
 */
@Component
@Slf4j
public class RefreshCoordinator {

    private final ExecutorService executor;
    private final Map<RefreshScope, RefreshGuard> guards = new EnumMap<>(RefreshScope.class);

    public RefreshCoordinator(@Qualifier("refreshExecutor") ExecutorService executor) {
        this.executor = executor;
        for (RefreshScope scope : RefreshScope.values()) {
            guards.put(scope, new RefreshGuard());
        }
    }

    public boolean schedule(RefreshScope scope, Runnable task) {
        RefreshGuard guard = guards.get(scope);
        if (!guard.tryAcquire()) {
            log.debug("{} refresh already running; skipping", scope);
            return false;
        }
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException ex) {
                    log.error("{} background refresh failed: {}", scope, ex.toString(), ex);
                } finally {
                    guard.release();
                }
            });
            log.info("{} background refresh scheduled", scope);
            return true;
        } catch (RejectedExecutionException ex) {
            guard.release();
            log.warn("{} refresh rejected by executor: {}", scope, ex.toString());
            return false;
        }
    }

    public boolean isRefreshing(RefreshScope scope) {
        return guards.get(scope).isHeld();
    }
}
