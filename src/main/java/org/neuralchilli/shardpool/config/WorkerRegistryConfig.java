package org.neuralchilli.shardpool.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;

@ConfigMapping(prefix = "workers")
public interface WorkerRegistryConfig {

    /**
     * How long after startup new task placement is withheld.
     */
    @WithName("initial-wait")
    @WithDefault("60s")
    Duration initialWait();

    @WithName("suspect-after")
    @WithDefault("15s")
    Duration suspectAfter();

    @WithName("lost-after")
    @WithDefault("45s")
    Duration lostAfter();

    @WithName("protocol-version")
    @WithDefault("1")
    int protocolVersion();

    /**
     * Period of the maintenance sweep.
     */
    @WithName("maintenance-interval")
    @WithDefault("5s")
    Duration maintenanceInterval();
}
