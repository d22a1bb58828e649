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
package org.docdb.driver;

import static org.docdb.driver.internal.logging.DevNullLogging.DEV_NULL_LOGGING;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.docdb.driver.cluster.ClusterListener;

/**
 * A configuration class to config cluster monitoring, server selection and connection pooling.
 * <p>
 * To build a simple config with custom logging implementation:
 * <pre>
 * {@code
 * Config config = Config.builder()
 *                       .withLogging(Logging.slf4j())
 *                       .build();
 * }
 * </pre>
 * <p>
 * To build a more complicated config with tuned monitoring and pool options:
 * <pre>
 * {@code
 * Config config = Config.builder()
 *                       .withReplicaSetName("rs0")
 *                       .withHeartbeatInterval(5, TimeUnit.SECONDS)
 *                       .withServerSelectionTimeout(10, TimeUnit.SECONDS)
 *                       .withMaxConnectionPoolSize(50)
 *                       .withMaxConnectionIdleTime(10, TimeUnit.MINUTES)
 *                       .build();
 * }
 * </pre>
 *
 * @since 1.0
 */
public final class Config {
    private static final Config DEFAULT = builder().build();

    private final Logging logging;
    private final MetricsAdapter metricsAdapter;
    private final ClusterListener clusterListener;

    private final String replicaSetName;
    private final boolean directConnection;
    private final boolean loadBalanced;

    private final long heartbeatIntervalMillis;
    private final long minHeartbeatIntervalMillis;
    private final int connectTimeoutMillis;
    private final int socketTimeoutMillis;
    private final long serverSelectionTimeoutMillis;
    private final long localThresholdMillis;
    private final long stalenessCorrectionMillis;

    private final int maxConnectionPoolSize;
    private final int minConnectionPoolSize;
    private final long maxConnectionIdleTimeMillis;
    private final long maintenanceIntervalMillis;

    private Config(ConfigBuilder builder) {
        this.logging = builder.logging;
        this.metricsAdapter = builder.metricsAdapter;
        this.clusterListener = builder.clusterListener;

        this.replicaSetName = builder.replicaSetName;
        this.directConnection = builder.directConnection;
        this.loadBalanced = builder.loadBalanced;

        this.heartbeatIntervalMillis = builder.heartbeatIntervalMillis;
        this.minHeartbeatIntervalMillis = builder.minHeartbeatIntervalMillis;
        this.connectTimeoutMillis = builder.connectTimeoutMillis;
        this.socketTimeoutMillis = builder.socketTimeoutMillis;
        this.serverSelectionTimeoutMillis = builder.serverSelectionTimeoutMillis;
        this.localThresholdMillis = builder.localThresholdMillis;
        this.stalenessCorrectionMillis = builder.stalenessCorrectionMillis;

        this.maxConnectionPoolSize = builder.maxConnectionPoolSize;
        this.minConnectionPoolSize = builder.minConnectionPoolSize;
        this.maxConnectionIdleTimeMillis = builder.maxConnectionIdleTimeMillis;
        this.maintenanceIntervalMillis = builder.maintenanceIntervalMillis;
    }

    /**
     * Return a {@link ConfigBuilder} instance
     *
     * @return a {@link ConfigBuilder} instance
     */
    public static ConfigBuilder builder() {
        return new ConfigBuilder();
    }

    /**
     * Returns default config value
     *
     * @return default config value
     */
    public static Config defaultConfig() {
        return DEFAULT;
    }

    /**
     * Logging provider
     *
     * @return the Logging provider for the driver
     */
    public Logging logging() {
        return logging;
    }

    public MetricsAdapter metricsAdapter() {
        return metricsAdapter;
    }

    public ClusterListener clusterListener() {
        return clusterListener;
    }

    /**
     * @return the expected replica set name, {@code null} when it should be discovered
     */
    public String replicaSetName() {
        return replicaSetName;
    }

    public boolean directConnection() {
        return directConnection;
    }

    public boolean loadBalanced() {
        return loadBalanced;
    }

    public long heartbeatIntervalMillis() {
        return heartbeatIntervalMillis;
    }

    public long minHeartbeatIntervalMillis() {
        return minHeartbeatIntervalMillis;
    }

    public int connectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    /**
     * @return read timeout of pooled connections, {@code 0} for none
     */
    public int socketTimeoutMillis() {
        return socketTimeoutMillis;
    }

    public long serverSelectionTimeoutMillis() {
        return serverSelectionTimeoutMillis;
    }

    public long localThresholdMillis() {
        return localThresholdMillis;
    }

    /**
     * @return the correction term added to staleness estimates, the heartbeat interval unless configured
     */
    public long stalenessCorrectionMillis() {
        return stalenessCorrectionMillis >= 0 ? stalenessCorrectionMillis : heartbeatIntervalMillis;
    }

    public int maxConnectionPoolSize() {
        return maxConnectionPoolSize;
    }

    public int minConnectionPoolSize() {
        return minConnectionPoolSize;
    }

    /**
     * @return idle time after which pooled connections are closed, {@code 0} for never
     */
    public long maxConnectionIdleTimeMillis() {
        return maxConnectionIdleTimeMillis;
    }

    public long maintenanceIntervalMillis() {
        return maintenanceIntervalMillis;
    }

    /**
     * Used to build new config instances
     */
    public static final class ConfigBuilder {
        private Logging logging = DEV_NULL_LOGGING;
        private MetricsAdapter metricsAdapter = MetricsAdapter.DEV_NULL;
        private ClusterListener clusterListener = ClusterListener.NO_OP;

        private String replicaSetName;
        private boolean directConnection;
        private boolean loadBalanced;

        private long heartbeatIntervalMillis = TimeUnit.SECONDS.toMillis(10);
        private long minHeartbeatIntervalMillis = 500;
        private int connectTimeoutMillis = (int) TimeUnit.SECONDS.toMillis(10);
        private int socketTimeoutMillis;
        private long serverSelectionTimeoutMillis = TimeUnit.SECONDS.toMillis(30);
        private long localThresholdMillis = 15;
        private long stalenessCorrectionMillis = -1;

        private int maxConnectionPoolSize = 100;
        private int minConnectionPoolSize;
        private long maxConnectionIdleTimeMillis;
        private long maintenanceIntervalMillis = TimeUnit.SECONDS.toMillis(60);

        private ConfigBuilder() {}

        /**
         * Provide a logging implementation for the driver to use. Nothing is logged by default.
         *
         * @param logging the logging instance to use
         * @return this builder
         * @see Logging
         */
        public ConfigBuilder withLogging(Logging logging) {
            this.logging = Objects.requireNonNull(logging);
            return this;
        }

        /**
         * Enable connection pool metrics with the given adapter.
         *
         * @param metricsAdapter the adapter
         * @return this builder
         */
        public ConfigBuilder withMetricsAdapter(MetricsAdapter metricsAdapter) {
            this.metricsAdapter = Objects.requireNonNull(metricsAdapter);
            return this;
        }

        public ConfigBuilder withClusterListener(ClusterListener clusterListener) {
            this.clusterListener = Objects.requireNonNull(clusterListener);
            return this;
        }

        /**
         * Lock in the expected replica set name from the start. Members reporting any other name are removed from
         * the topology.
         *
         * @param replicaSetName the set name
         * @return this builder
         */
        public ConfigBuilder withReplicaSetName(String replicaSetName) {
            this.replicaSetName = replicaSetName;
            return this;
        }

        /**
         * Talk to the single seed only, whatever its role, and never discover other members.
         *
         * @param directConnection whether to connect directly
         * @return this builder
         */
        public ConfigBuilder withDirectConnection(boolean directConnection) {
            this.directConnection = directConnection;
            return this;
        }

        /**
         * The single seed is a load balancer in front of the cluster. No monitoring takes place.
         *
         * @param loadBalanced whether the seed is a load balancer
         * @return this builder
         */
        public ConfigBuilder withLoadBalanced(boolean loadBalanced) {
            this.loadBalanced = loadBalanced;
            return this;
        }

        /**
         * Interval between two heartbeats of the same server. Default is 10 seconds.
         *
         * @param value the interval
         * @param unit the unit in which the interval is given
         * @return this builder
         */
        public ConfigBuilder withHeartbeatInterval(long value, TimeUnit unit) {
            var millis = unit.toMillis(value);
            if (millis <= 0) {
                throw new IllegalArgumentException("The heartbeat interval must be positive, was " + millis + " ms");
            }
            this.heartbeatIntervalMillis = millis;
            return this;
        }

        /**
         * Minimum time between two heartbeats of the same server, honoured even when an immediate check is
         * requested. Default is 500 milliseconds.
         *
         * @param value the interval
         * @param unit the unit in which the interval is given
         * @return this builder
         */
        public ConfigBuilder withMinHeartbeatInterval(long value, TimeUnit unit) {
            var millis = unit.toMillis(value);
            if (millis < 0) {
                throw new IllegalArgumentException(
                        "The minimum heartbeat interval must not be negative, was " + millis + " ms");
            }
            this.minHeartbeatIntervalMillis = millis;
            return this;
        }

        /**
         * Socket connect timeout, also used as the read timeout of heartbeats. Default is 10 seconds.
         *
         * @param value the timeout
         * @param unit the unit in which the timeout is given
         * @return this builder
         */
        public ConfigBuilder withConnectionTimeout(long value, TimeUnit unit) {
            var millis = unit.toMillis(value);
            if (millis < 0 || millis > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("The connection timeout must be in [0, Integer.MAX_VALUE] ms, was "
                        + millis + " ms");
            }
            this.connectTimeoutMillis = (int) millis;
            return this;
        }

        /**
         * Read timeout of pooled connections. Zero, the default, means no timeout.
         *
         * @param value the timeout
         * @param unit the unit in which the timeout is given
         * @return this builder
         */
        public ConfigBuilder withSocketTimeout(long value, TimeUnit unit) {
            var millis = unit.toMillis(value);
            if (millis < 0 || millis > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(
                        "The socket timeout must be in [0, Integer.MAX_VALUE] ms, was " + millis + " ms");
            }
            this.socketTimeoutMillis = (int) millis;
            return this;
        }

        /**
         * How long server selection waits for a suitable server before giving up. Default is 30 seconds.
         *
         * @param value the timeout
         * @param unit the unit in which the timeout is given
         * @return this builder
         */
        public ConfigBuilder withServerSelectionTimeout(long value, TimeUnit unit) {
            var millis = unit.toMillis(value);
            if (millis < 0) {
                throw new IllegalArgumentException(
                        "The server selection timeout must not be negative, was " + millis + " ms");
            }
            this.serverSelectionTimeoutMillis = millis;
            return this;
        }

        /**
         * Width of the latency window above the fastest eligible server. Default is 15 milliseconds.
         *
         * @param value the window
         * @param unit the unit in which the window is given
         * @return this builder
         */
        public ConfigBuilder withLocalThreshold(long value, TimeUnit unit) {
            var millis = unit.toMillis(value);
            if (millis < 0) {
                throw new IllegalArgumentException("The local threshold must not be negative, was " + millis + " ms");
            }
            this.localThresholdMillis = millis;
            return this;
        }

        /**
         * Correction term added to secondary staleness estimates. Defaults to the heartbeat interval.
         *
         * @param value the correction
         * @param unit the unit in which the correction is given
         * @return this builder
         */
        public ConfigBuilder withStalenessCorrection(long value, TimeUnit unit) {
            var millis = unit.toMillis(value);
            if (millis < 0) {
                throw new IllegalArgumentException(
                        "The staleness correction must not be negative, was " + millis + " ms");
            }
            this.stalenessCorrectionMillis = millis;
            return this;
        }

        /**
         * Maximum amount of connections in the pool of every server. Default value is {@code 100}. Negative values
         * result in unlimited pools. Value of {@code 0} is not allowed.
         *
         * @param value the maximum connection pool size.
         * @return this builder
         */
        public ConfigBuilder withMaxConnectionPoolSize(int value) {
            if (value == 0) {
                throw new IllegalArgumentException("Zero value is not supported");
            } else if (value < 0) {
                this.maxConnectionPoolSize = Integer.MAX_VALUE;
            } else {
                this.maxConnectionPoolSize = value;
            }
            return this;
        }

        /**
         * Amount of connections the background maintenance keeps open towards every server. Default is {@code 0}.
         *
         * @param value the minimum connection pool size.
         * @return this builder
         */
        public ConfigBuilder withMinConnectionPoolSize(int value) {
            if (value < 0) {
                throw new IllegalArgumentException("The minimum pool size must not be negative, was " + value);
            }
            this.minConnectionPoolSize = value;
            return this;
        }

        /**
         * Pooled connections idle for longer than this are closed by the background maintenance. Zero, the default,
         * keeps idle connections forever.
         *
         * @param value the idle time
         * @param unit the unit in which the idle time is given
         * @return this builder
         */
        public ConfigBuilder withMaxConnectionIdleTime(long value, TimeUnit unit) {
            var millis = unit.toMillis(value);
            if (millis < 0) {
                throw new IllegalArgumentException("The idle time must not be negative, was " + millis + " ms");
            }
            this.maxConnectionIdleTimeMillis = millis;
            return this;
        }

        /**
         * How often idle connections are reaped and pools refilled to their minimum size. Default is 60 seconds.
         *
         * @param value the interval
         * @param unit the unit in which the interval is given
         * @return this builder
         */
        public ConfigBuilder withMaintenanceInterval(long value, TimeUnit unit) {
            var millis = unit.toMillis(value);
            if (millis <= 0) {
                throw new IllegalArgumentException("The maintenance interval must be positive, was " + millis + " ms");
            }
            this.maintenanceIntervalMillis = millis;
            return this;
        }

        /**
         * Create a config instance from this builder.
         *
         * @return a new {@link Config} instance.
         */
        public Config build() {
            if (minConnectionPoolSize > maxConnectionPoolSize) {
                throw new IllegalArgumentException(String.format(
                        "The minimum pool size %d exceeds the maximum pool size %d",
                        minConnectionPoolSize, maxConnectionPoolSize));
            }
            if (directConnection && loadBalanced) {
                throw new IllegalArgumentException("A direct connection can not be load balanced");
            }
            if (loadBalanced && replicaSetName != null) {
                throw new IllegalArgumentException("A replica set name can not be used with a load balancer");
            }
            return new Config(this);
        }
    }
}
