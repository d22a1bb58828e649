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

import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.docdb.driver.exceptions.CommandException;
import org.docdb.driver.exceptions.ServiceUnavailableException;
import org.docdb.driver.internal.pool.ClearCause;

/**
 * Classifies errors returned by servers by whether they invalidate what is known about the server.
 */
public final class ServerErrors {
    static final Set<Integer> NOT_PRIMARY_CODES = Set.of(10107, 13435, 10058);
    static final Set<Integer> RECOVERING_CODES = Set.of(11600, 11602, 13436, 189, 91);
    static final Set<Integer> SHUTDOWN_CODES = Set.of(11600, 91);

    private static final List<String> NOT_PRIMARY_MESSAGES =
            List.of("not master", "not writable primary", "not primary");
    private static final List<String> RECOVERING_MESSAGES =
            List.of("node is recovering", "not master or secondary", "not primary or secondary");

    private ServerErrors() {}

    /**
     * @return {@code true} when the server reported it is no longer the primary
     */
    public static boolean isNotPrimary(Throwable error) {
        if (!(error instanceof CommandException commandError)) {
            return false;
        }
        if (isRecovering(error)) {
            return false;
        }
        return NOT_PRIMARY_CODES.contains(commandError.code()) || messageContains(error, NOT_PRIMARY_MESSAGES);
    }

    /**
     * @return {@code true} when the server reported it is recovering, stepping down or shutting down
     */
    public static boolean isRecovering(Throwable error) {
        if (!(error instanceof CommandException commandError)) {
            return false;
        }
        return RECOVERING_CODES.contains(commandError.code()) || messageContains(error, RECOVERING_MESSAGES);
    }

    public static boolean isShutdown(Throwable error) {
        return error instanceof CommandException commandError && SHUTDOWN_CODES.contains(commandError.code());
    }

    public static boolean isNetworkError(Throwable error) {
        return error instanceof ServiceUnavailableException;
    }

    /**
     * @return how the pool of the failing server is to be cleared, {@code null} when the error says nothing about
     *         the state of the server
     */
    public static ClearCause clearCause(Throwable error) {
        if (isNetworkError(error)) {
            return ClearCause.NETWORK_ERROR;
        }
        if (isShutdown(error)) {
            return ClearCause.SHUTDOWN;
        }
        if (isNotPrimary(error) || isRecovering(error)) {
            return ClearCause.STATE_CHANGE;
        }
        return null;
    }

    private static boolean messageContains(Throwable error, List<String> texts) {
        var message = error.getMessage();
        if (message == null) {
            return false;
        }
        var lowerCase = message.toLowerCase(Locale.ROOT);
        return texts.stream().anyMatch(lowerCase::contains);
    }
}
