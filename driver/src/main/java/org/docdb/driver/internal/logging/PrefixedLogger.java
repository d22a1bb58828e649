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

import static java.util.Objects.requireNonNull;

import org.docdb.driver.Logger;

/**
 * Prepends a fixed prefix, usually a server address, to every message of the delegate.
 */
public class PrefixedLogger implements Logger {
    private final Logger delegate;
    private final String messagePrefix;

    public PrefixedLogger(Logger delegate, String messagePrefix) {
        this.delegate = requireNonNull(delegate);
        this.messagePrefix = messagePrefix;
    }

    @Override
    public void error(String message, Throwable cause) {
        delegate.error(plainMessageWithPrefix(message), cause);
    }

    @Override
    public void info(String message, Object... params) {
        delegate.info(messageWithPrefix(message), params);
    }

    @Override
    public void warn(String message, Object... params) {
        delegate.warn(messageWithPrefix(message), params);
    }

    @Override
    public void warn(String message, Throwable cause) {
        delegate.warn(plainMessageWithPrefix(message), cause);
    }

    @Override
    public void debug(String message, Object... params) {
        if (isDebugEnabled()) {
            delegate.debug(messageWithPrefix(message), params);
        }
    }

    @Override
    public void trace(String message, Object... params) {
        if (isTraceEnabled()) {
            delegate.trace(messageWithPrefix(message), params);
        }
    }

    @Override
    public boolean isTraceEnabled() {
        return delegate.isTraceEnabled();
    }

    @Override
    public boolean isDebugEnabled() {
        return delegate.isDebugEnabled();
    }

    private String messageWithPrefix(String template) {
        if (messagePrefix == null) {
            return template;
        }
        // the delegate formats templates, a '%' in the prefix (IPv6 zone id) must stay literal
        return "[" + messagePrefix.replace("%", "%%") + "] " + template;
    }

    private String plainMessageWithPrefix(String message) {
        return messagePrefix == null ? message : "[" + messagePrefix + "] " + message;
    }
}
