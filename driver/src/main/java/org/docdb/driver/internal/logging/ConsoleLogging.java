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
package org.docdb.driver.internal.logging;

import java.io.PrintWriter;
import java.io.Serial;
import java.io.Serializable;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import org.docdb.driver.Logger;
import org.docdb.driver.Logging;

/**
 * Logs to standard error through a dedicated {@code java.util.logging} handler, one line per record with the thread
 * name, so that output of the monitor threads can be told apart.
 *
 * @see Logging#console(Level)
 */
public class ConsoleLogging implements Logging, Serializable {
    @Serial
    private static final long serialVersionUID = -6318824290519237164L;

    private final Level level;

    public ConsoleLogging(Level level) {
        this.level = Objects.requireNonNull(level);
    }

    @Override
    public Logger getLog(String name) {
        configure(java.util.logging.Logger.getLogger(name), level);
        return new JULogger(name, level);
    }

    static void configure(java.util.logging.Logger logger, Level level) {
        logger.setUseParentHandlers(false);
        for (var handler : logger.getHandlers()) {
            logger.removeHandler(handler);
        }
        var handler = new ConsoleHandler();
        handler.setFormatter(new LineFormatter());
        handler.setLevel(level);
        logger.addHandler(handler);
        logger.setLevel(level);
    }

    static final class LineFormatter extends Formatter {
        private static final DateTimeFormatter TIMESTAMP =
                DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            var line = new StringBuilder()
                    .append(TIMESTAMP.format(Instant.ofEpochMilli(record.getMillis())))
                    .append(' ')
                    .append(record.getLevel())
                    .append(" [")
                    .append(Thread.currentThread().getName())
                    .append("] ")
                    .append(record.getLoggerName())
                    .append(" - ")
                    .append(formatMessage(record));
            if (record.getThrown() != null) {
                var stackTrace = new StringWriter();
                try (var writer = new PrintWriter(stackTrace)) {
                    writer.println();
                    record.getThrown().printStackTrace(writer);
                }
                line.append(stackTrace);
            }
            return line.append(System.lineSeparator()).toString();
        }
    }
}
