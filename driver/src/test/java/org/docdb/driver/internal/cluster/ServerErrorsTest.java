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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.docdb.driver.exceptions.ClientException;
import org.docdb.driver.exceptions.CommandException;
import org.docdb.driver.exceptions.ServiceUnavailableException;
import org.docdb.driver.internal.pool.ClearCause;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ServerErrorsTest {
    @ParameterizedTest
    @ValueSource(ints = {10107, 13435, 10058})
    void shouldClassifyNotPrimaryCodes(int code) {
        var error = new CommandException(code, "NotWritablePrimary", "failed");

        assertTrue(ServerErrors.isNotPrimary(error));
        assertFalse(ServerErrors.isRecovering(error));
        assertEquals(ClearCause.STATE_CHANGE, ServerErrors.clearCause(error));
    }

    @ParameterizedTest
    @ValueSource(ints = {11602, 13436, 189})
    void shouldClassifyRecoveringCodes(int code) {
        var error = new CommandException(code, "InterruptedDueToReplStateChange", "failed");

        assertTrue(ServerErrors.isRecovering(error));
        assertFalse(ServerErrors.isNotPrimary(error));
        assertFalse(ServerErrors.isShutdown(error));
        assertEquals(ClearCause.STATE_CHANGE, ServerErrors.clearCause(error));
    }

    @ParameterizedTest
    @ValueSource(ints = {11600, 91})
    void shouldClassifyShutdownCodes(int code) {
        var error = new CommandException(code, "ShutdownInProgress", "failed");

        assertTrue(ServerErrors.isShutdown(error));
        assertTrue(ServerErrors.isRecovering(error));
        assertEquals(ClearCause.SHUTDOWN, ServerErrors.clearCause(error));
    }

    @Test
    void shouldFallBackToMessageWhenCodeIsMissing() {
        assertTrue(ServerErrors.isNotPrimary(new CommandException(0, null, "not master")));
        assertTrue(ServerErrors.isRecovering(new CommandException(0, null, "Node is recovering")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"not master", "not writable primary", "Not primary"})
    void shouldRecognizeCurrentAndLegacyNotPrimaryMessages(String message) {
        var error = new CommandException(0, null, message);

        assertTrue(ServerErrors.isNotPrimary(error));
        assertEquals(ClearCause.STATE_CHANGE, ServerErrors.clearCause(error));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "not master or secondary; cannot currently read from this replSet",
                "not primary or secondary; cannot currently read from this replSet"
            })
    void notPrimaryOrSecondaryMessageShouldMeanRecovering(String message) {
        var error = new CommandException(0, null, message);

        assertTrue(ServerErrors.isRecovering(error));
        assertFalse(ServerErrors.isNotPrimary(error));
    }

    @Test
    void networkErrorsShouldClearPoolImmediately() {
        var error = new ServiceUnavailableException("Connection reset");

        assertTrue(ServerErrors.isNetworkError(error));
        assertEquals(ClearCause.NETWORK_ERROR, ServerErrors.clearCause(error));
    }

    @Test
    void otherErrorsShouldNotAffectServerState() {
        assertNull(ServerErrors.clearCause(new CommandException(11000, "DuplicateKey", "duplicate key")));
        assertNull(ServerErrors.clearCause(new ClientException("bad argument")));
        assertFalse(ServerErrors.isNotPrimary(new ClientException("not master")));
    }
}
