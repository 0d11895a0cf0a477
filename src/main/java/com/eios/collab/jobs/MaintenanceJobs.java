package com.eios.collab.jobs;

import com.eios.collab.session.SessionManager;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Drives room maintenance and the graceful shutdown.
 */
@ApplicationScoped
public class MaintenanceJobs {

    private static final Logger LOG = Logger.getLogger(MaintenanceJobs.class);

    private final SessionManager sessionManager;

    @Inject
    public MaintenanceJobs(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Scheduled(every = "${collab.maintenance-interval:1s}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        sessionManager.maintain();
    }

    void onStop(@Observes ShutdownEvent event) {
        LOG.info("Persisting rooms before shutdown");
        sessionManager.shutdown();
    }
}
