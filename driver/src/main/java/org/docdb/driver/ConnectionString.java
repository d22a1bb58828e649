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

import static java.lang.String.format;
import static java.util.Collections.unmodifiableList;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.docdb.driver.exceptions.ClientException;

/**
 * Parsed form of a {@code docdb://host1[:port1][,host2[:port2]...][/[database]][?options]} connection string.
 * <p>
 * Option names are case-insensitive. Recognized options are validated while parsing, unknown ones are kept in
 * {@link #unknownOptions()} for the caller to report.
 */
public final class ConnectionString {
    public static final String SCHEME = "docdb";
    private static final String PREFIX = SCHEME + "://";

    private final String value;
    private final List<ServerAddress> seeds;
    private final String database;
    private final List<String> unknownOptions = new ArrayList<>();

    private String replicaSet;
    private Boolean directConnection;
    private Boolean loadBalanced;
    private Long heartbeatFrequencyMillis;
    private Long serverSelectionTimeoutMillis;
    private Long connectTimeoutMillis;
    private Long socketTimeoutMillis;
    private Long localThresholdMillis;
    private Long maxIdleTimeMillis;
    private Integer maxPoolSize;
    private Integer minPoolSize;
    private ReadPreference.Mode readPreferenceMode;
    private final List<TagSet> readPreferenceTags = new ArrayList<>();
    private Duration maxStaleness;

    private ConnectionString(String value) {
        this.value = value;
        if (!value.startsWith(PREFIX)) {
            throw new ClientException(format("Connection string `%s` must start with `%s`", value, PREFIX));
        }
        var remainder = value.substring(PREFIX.length());
        var optionsStart = remainder.indexOf('?');
        var options = optionsStart >= 0 ? remainder.substring(optionsStart + 1) : "";
        remainder = optionsStart >= 0 ? remainder.substring(0, optionsStart) : remainder;

        var pathStart = remainder.indexOf('/');
        var hosts = pathStart >= 0 ? remainder.substring(0, pathStart) : remainder;
        var path = pathStart >= 0 ? remainder.substring(pathStart + 1) : "";
        if (hosts.contains("@")) {
            throw new ClientException("Credentials in the connection string are not supported");
        }
        this.seeds = parseHosts(hosts);
        this.database = path.isEmpty() ? null : decode(path);
        parseOptions(options);
        validate();
    }

    /**
     * Parse a connection string.
     *
     * @param connectionString the connection string
     * @return parsed connection string
     * @throws ClientException when the connection string or one of its recognized options is malformed
     */
    public static ConnectionString parse(String connectionString) {
        return new ConnectionString(connectionString);
    }

    public List<ServerAddress> seeds() {
        return seeds;
    }

    /**
     * @return the database given in the path, {@code null} when absent
     */
    public String database() {
        return database;
    }

    /**
     * @return names of options that were given but are not recognized, in the order they appeared
     */
    public List<String> unknownOptions() {
        return unmodifiableList(unknownOptions);
    }

    public String replicaSet() {
        return replicaSet;
    }

    /**
     * @return read preference described by the {@code readPreference}, {@code readPreferenceTags} and
     *         {@code maxStalenessSeconds} options, primary when none is given
     */
    public ReadPreference readPreference() {
        if (readPreferenceMode == null) {
            return ReadPreference.primary();
        }
        return ReadPreference.of(readPreferenceMode, readPreferenceTags, maxStaleness);
    }

    /**
     * Copy the options of this connection string onto a config builder, overriding what the builder holds.
     *
     * @param builder the builder
     * @return the same builder
     */
    public Config.ConfigBuilder applyTo(Config.ConfigBuilder builder) {
        if (replicaSet != null) {
            builder.withReplicaSetName(replicaSet);
        }
        if (directConnection != null) {
            builder.withDirectConnection(directConnection);
        }
        if (loadBalanced != null) {
            builder.withLoadBalanced(loadBalanced);
        }
        if (heartbeatFrequencyMillis != null) {
            builder.withHeartbeatInterval(heartbeatFrequencyMillis, TimeUnit.MILLISECONDS);
        }
        if (serverSelectionTimeoutMillis != null) {
            builder.withServerSelectionTimeout(serverSelectionTimeoutMillis, TimeUnit.MILLISECONDS);
        }
        if (connectTimeoutMillis != null) {
            builder.withConnectionTimeout(connectTimeoutMillis, TimeUnit.MILLISECONDS);
        }
        if (socketTimeoutMillis != null) {
            builder.withSocketTimeout(socketTimeoutMillis, TimeUnit.MILLISECONDS);
        }
        if (localThresholdMillis != null) {
            builder.withLocalThreshold(localThresholdMillis, TimeUnit.MILLISECONDS);
        }
        if (maxIdleTimeMillis != null) {
            builder.withMaxConnectionIdleTime(maxIdleTimeMillis, TimeUnit.MILLISECONDS);
        }
        if (maxPoolSize != null) {
            // zero means no limit
            builder.withMaxConnectionPoolSize(maxPoolSize == 0 ? -1 : maxPoolSize);
        }
        if (minPoolSize != null) {
            builder.withMinConnectionPoolSize(minPoolSize);
        }
        return builder;
    }

    public Config toConfig() {
        return applyTo(Config.builder()).build();
    }

    private void parseOptions(String options) {
        if (options.isEmpty()) {
            return;
        }
        for (var option : options.split("[&;]")) {
            if (option.isEmpty()) {
                continue;
            }
            var separator = option.indexOf('=');
            if (separator <= 0) {
                throw new ClientException(format("Malformed connection string option `%s`", option));
            }
            var name = option.substring(0, separator);
            var optionValue = decode(option.substring(separator + 1));
            applyOption(name, optionValue);
        }
    }

    private void applyOption(String name, String optionValue) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "replicaset" -> replicaSet = nonEmpty(name, optionValue);
            case "directconnection" -> directConnection = parseBoolean(name, optionValue);
            case "loadbalanced" -> loadBalanced = parseBoolean(name, optionValue);
            case "heartbeatfrequencyms" -> heartbeatFrequencyMillis = parsePositiveLong(name, optionValue);
            case "serverselectiontimeoutms" -> serverSelectionTimeoutMillis = parseNonNegativeLong(name, optionValue);
            case "connecttimeoutms" -> connectTimeoutMillis = parseNonNegativeLong(name, optionValue);
            case "sockettimeoutms" -> socketTimeoutMillis = parseNonNegativeLong(name, optionValue);
            case "localthresholdms" -> localThresholdMillis = parseNonNegativeLong(name, optionValue);
            case "maxidletimems" -> maxIdleTimeMillis = parseNonNegativeLong(name, optionValue);
            case "maxpoolsize" -> maxPoolSize = (int) parseNonNegativeLong(name, optionValue);
            case "minpoolsize" -> minPoolSize = (int) parseNonNegativeLong(name, optionValue);
            case "readpreference" -> readPreferenceMode = ReadPreference.Mode.fromName(optionValue);
            case "readpreferencetags" -> readPreferenceTags.add(parseTagSet(name, optionValue));
            case "maxstalenessseconds" -> {
                var seconds = parseLong(name, optionValue);
                if (seconds == -1) {
                    maxStaleness = null;
                } else if (seconds > 0) {
                    maxStaleness = Duration.ofSeconds(seconds);
                } else {
                    throw invalidOption(name, optionValue);
                }
            }
            default -> unknownOptions.add(name);
        }
    }

    private void validate() {
        if (Boolean.TRUE.equals(directConnection) && seeds.size() > 1) {
            throw new ClientException("directConnection=true can not be used with multiple hosts: " + value);
        }
        if (Boolean.TRUE.equals(loadBalanced)) {
            if (seeds.size() > 1) {
                throw new ClientException("loadBalanced=true can not be used with multiple hosts: " + value);
            }
            if (replicaSet != null) {
                throw new ClientException("loadBalanced=true can not be used with replicaSet: " + value);
            }
            if (Boolean.TRUE.equals(directConnection)) {
                throw new ClientException("loadBalanced=true can not be used with directConnection=true: " + value);
            }
        }
        if (readPreferenceMode == null && (!readPreferenceTags.isEmpty() || maxStaleness != null)) {
            throw new ClientException("readPreferenceTags and maxStalenessSeconds require a readPreference: " + value);
        }
        if (readPreferenceMode != null) {
            // fails for tags or staleness with the primary mode
            readPreference();
        }
    }

    private static List<ServerAddress> parseHosts(String hosts) {
        if (hosts.isEmpty()) {
            throw new ClientException("Connection string must name at least one host");
        }
        var result = new ArrayList<ServerAddress>();
        for (var host : hosts.split(",")) {
            try {
                var address = new ServerAddress(decode(host));
                if (!result.contains(address)) {
                    result.add(address);
                }
            } catch (IllegalArgumentException e) {
                throw new ClientException(format("Invalid host `%s` in connection string", host), e);
            }
        }
        return unmodifiableList(result);
    }

    private static TagSet parseTagSet(String name, String optionValue) {
        if (optionValue.isEmpty()) {
            return TagSet.empty();
        }
        var tags = new LinkedHashMap<String, String>();
        for (var pair : optionValue.split(",")) {
            var separator = pair.indexOf(':');
            if (separator <= 0 || separator == pair.length() - 1) {
                throw invalidOption(name, optionValue);
            }
            tags.put(pair.substring(0, separator), pair.substring(separator + 1));
        }
        return TagSet.of(tags);
    }

    private static String nonEmpty(String name, String optionValue) {
        if (optionValue.isEmpty()) {
            throw invalidOption(name, optionValue);
        }
        return optionValue;
    }

    private static boolean parseBoolean(String name, String optionValue) {
        if ("true".equalsIgnoreCase(optionValue)) {
            return true;
        }
        if ("false".equalsIgnoreCase(optionValue)) {
            return false;
        }
        throw invalidOption(name, optionValue);
    }

    private static long parseNonNegativeLong(String name, String optionValue) {
        var parsed = parseLong(name, optionValue);
        if (parsed < 0 || parsed > Integer.MAX_VALUE) {
            throw invalidOption(name, optionValue);
        }
        return parsed;
    }

    private static long parsePositiveLong(String name, String optionValue) {
        var parsed = parseNonNegativeLong(name, optionValue);
        if (parsed == 0) {
            throw invalidOption(name, optionValue);
        }
        return parsed;
    }

    private static long parseLong(String name, String optionValue) {
        try {
            return Long.parseLong(optionValue);
        } catch (NumberFormatException e) {
            throw invalidOption(name, optionValue);
        }
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new ClientException(format("Invalid percent-encoding in `%s`", value), e);
        }
    }

    private static ClientException invalidOption(String name, String optionValue) {
        return new ClientException(format("Invalid value `%s` for connection string option `%s`", optionValue, name));
    }

    @Override
    public String toString() {
        return value;
    }
}
