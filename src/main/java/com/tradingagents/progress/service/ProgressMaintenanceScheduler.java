package com.tradingagents.progress.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressMaintenanceScheduler {

    private final MessageRouter router;
    private final TrackerRegistry trackerRegistry;
    private final ProgressViewerManager viewerManager;

    @Value("${progress.cleanup.retention-minutes:120}")
    private long retentionMinutes = 120;

    // Broker engines resubscribe on reconnect
    @Scheduled(fixedRate = 30000)
    public void reconnectBus() {
        if (router.isConnected()) {
            return;
        }
        log.warn("Message bus disconnected, reconnecting: engine={}", router.engineType().configName());
        if (router.reconnect()) {
            log.info("Message bus reconnected");
        }
    }

    // Run every 5 minutes
    @Scheduled(fixedRate = 300000)
    public void cleanupFinishedTrackers() {
        int cleaned = trackerRegistry.cleanupFinished(Duration.ofMinutes(retentionMinutes));
        if (cleaned > 0) {
            log.info("Evicted {} finished trackers", cleaned);
        }
    }

    // Log stats every minute
    @Scheduled(fixedRate = 60000)
    public void logStats() {
        TrackerRegistry.Stats stats = trackerRegistry.getStats();
        ProgressViewerManager.ViewerStats viewerStats = viewerManager.getStats();
        log.info("Trackers: total={}, running={}, paused={}, finished={}, viewers={}, bus={}",
                stats.totalTrackers(), stats.running(), stats.paused(), stats.finished(),
                viewerStats.totalViewers(), router.isConnected() ? "up" : "down");
    }
}
