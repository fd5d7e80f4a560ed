package org.neuralchilli.shardpool.service;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the registry's periodic maintenance sweep.
 */
@ApplicationScoped
public class WorkerMaintenanceJob {

    private static final Logger log = LoggerFactory.getLogger(WorkerMaintenanceJob.class);

    @Inject
    WorkerRegistryService registryService;

    @Scheduled(every = "{workers.maintenance-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        log.trace("Running worker maintenance sweep");
        registryService.updateState();
    }
}
