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

import java.util.logging.Level;
import org.docdb.driver.internal.logging.ConsoleLogging;
import org.docdb.driver.internal.logging.JULogging;
import org.docdb.driver.internal.logging.Slf4jLogging;

/**
 * Accessor for {@link Logger} instances. Configured once for a cluster instance using
 * {@link Config.ConfigBuilder#withLogging(Logging)} builder method.
 * <p>
 * The driver ships with a few implementations, available from the static factory methods of this interface:
 * <ul>
 * <li>{@link #slf4j()} - logging using SLF4J. Requires slf4j-api and a binding on the classpath</li>
 * <li>{@link #javaUtilLogging(Level)} - logging using {@link java.util.logging}</li>
 * <li>{@link #console(Level)} - logging to {@code System.err} using {@link java.util.logging}</li>
 * <li>{@link #none()} - no logging, the default</li>
 * </ul>
 * Monitors, pools and the topology state machine obtain loggers by their class; per-server loggers prefix every
 * message with the server address.
 */
public interface Logging {
    /**
     * Obtain a {@link Logger} instance by class, its name will be the fully qualified name of the class.
     *
     * @param clazz class whose name should be used as the {@link Logger} name.
     * @return {@link Logger} instance
     */
    default Logger getLog(Class<?> clazz) {
        var canonicalName = clazz.getCanonicalName();
        return getLog(canonicalName != null ? canonicalName : clazz.getName());
    }

    /**
     * Obtain a {@link Logger} instance by name.
     *
     * @param name name of a {@link Logger}
     * @return {@link Logger} instance
     */
    Logger getLog(String name);

    /**
     * Create logging implementation that uses SLF4J.
     *
     * @return new logging implementation.
     * @throws IllegalStateException if SLF4J is not available.
     */
    static Logging slf4j() {
        var unavailabilityError = Slf4jLogging.checkAvailability();
        if (unavailabilityError != null) {
            throw unavailabilityError;
        }
        return new Slf4jLogging();
    }

    /**
     * Create logging implementation that uses {@link java.util.logging}.
     *
     * @param level the log level.
     * @return new logging implementation.
     */
    static Logging javaUtilLogging(Level level) {
        return new JULogging(level);
    }

    /**
     * Create logging implementation that uses {@link java.util.logging} to log to {@code System.err}.
     *
     * @param level the log level.
     * @return new logging implementation.
     */
    static Logging console(Level level) {
        return new ConsoleLogging(level);
    }

    /**
     * Create logging implementation that discards all messages and logs nothing.
     *
     * @return new logging implementation.
     */
    static Logging none() {
        return DEV_NULL_LOGGING;
    }
}
