/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.docdb.driver.internal.cluster;

import static java.util.Objects.requireNonNull;
import static org.docdb.driver.internal.util.DaemonThreadFactory.daemon;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.docdb.driver.Config;
import org.docdb.driver.ConnectionString;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.internal.metrics.DevNullMetricsProvider;
import org.docdb.driver.internal.metrics.MetricsProvider;
import org.docdb.driver.internal.metrics.MicrometerMetricsProvider;
import org.docdb.driver.internal.spi.Authenticator;
import org.docdb.driver.internal.spi.ConnectionFactory;

public class ClusterFactory {
    public final Cluster newInstance(ConnectionString connectionString, ConnectionFactory connectionFactory) {
        return newInstance(connectionString, Config.builder(), connectionFactory, Authenticator.NONE);
    }

    /**
     * Create a cluster from a connection string. Options given in the connection string override the ones set on
     * the builder.
     */
    public final Cluster newInstance(
            ConnectionString connectionString,
            Config.ConfigBuilder configBuilder,
            ConnectionFactory connectionFactory,
            Authenticator authenticator) {
        var config = connectionString.applyTo(configBuilder).build();
        var log = config.logging().getLog(getClass());
        for (var option : connectionString.unknownOptions()) {
            log.warn("Ignoring unknown connection string option `%s`", option);
        }
        return newInstance(connectionString.seeds(), config, connectionFactory, authenticator);
    }

    public final Cluster newInstance(List<ServerAddress> seeds, Config config, ConnectionFactory connectionFactory) {
        return newInstance(seeds, config, connectionFactory, Authenticator.NONE);
    }

    public final Cluster newInstance(
            List<ServerAddress> seeds,
            Config config,
            ConnectionFactory connectionFactory,
            Authenticator authenticator) {
        requireNonNull(seeds, "seeds must not be null");
        requireNonNull(config, "config must not be null");
        requireNonNull(connectionFactory, "connectionFactory must not be null");
        requireNonNull(authenticator, "authenticator must not be null");

        var topology = new Topology(
                List.copyOf(seeds),
                config.replicaSetName(),
                config.directConnection(),
                config.loadBalanced(),
                config.logging());
        var cluster = createCluster(
                topology,
                config,
                connectionFactory,
                authenticator,
                getOrCreateMetricsProvider(config),
                createMaintenanceExecutor(),
                createClock());
        cluster.start();
        return cluster;
    }

    protected static MetricsProvider getOrCreateMetricsProvider(Config config) {
        return switch (config.metricsAdapter()) {
            case DEV_NULL -> DevNullMetricsProvider.INSTANCE;
            case MICROMETER -> MicrometerMetricsProvider.forGlobalRegistry();
        };
    }

    /**
     * <b>This method is protected only for testing</b>
     */
    protected ClusterImpl createCluster(
            Topology topology,
            Config config,
            ConnectionFactory connectionFactory,
            Authenticator authenticator,
            MetricsProvider metricsProvider,
            ScheduledExecutorService maintenanceExecutor,
            Clock clock) {
        return new ClusterImpl(
                topology, config, connectionFactory, authenticator, metricsProvider, maintenanceExecutor, clock);
    }

    /**
     * Creates new {@link Clock}.
     */
    protected Clock createClock() {
        return Clock.systemUTC();
    }

    /**
     * <b>This method is protected only for testing</b>
     */
    protected ScheduledExecutorService createMaintenanceExecutor() {
        return Executors.newSingleThreadScheduledExecutor(daemon("docdb-pool-maintenance-"));
    }
}
