package com.sandcastle.session;

import com.sandcastle.sandbox.SandboxProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically evicts sessions that have been idle past the retention window.
 */
@Component
public class SessionHousekeeper {

    private static final Logger log = LoggerFactory.getLogger(SessionHousekeeper.class);

    private final SessionRegistry registry;
    private final Duration retention;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sandcastle-housekeeper");
        t.setDaemon(true);
        return t;
    });

    public SessionHousekeeper(SessionRegistry registry, SandboxProperties properties) {
        this.registry = registry;
        this.retention = Duration.ofMinutes(properties.getIdleRetentionMinutes());
        this.intervalSeconds = properties.getSweepIntervalSeconds();
    }

    @PostConstruct
    void start() {
        scheduler.scheduleAtFixedRate(this::sweep, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        scheduler.shutdownNow();
    }

    int sweep() {
        try {
            int evicted = registry.evictIdle(retention);
            if (evicted > 0) {
                log.info("Housekeeping evicted {} idle session(s)", evicted);
            }
            return evicted;
        } catch (RuntimeException e) {
            log.warn("Housekeeping sweep failed: {}", e.getMessage(), e);
            return 0;
        }
    }
}
