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

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.docdb.driver.exceptions.ClientException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConnectionStringTest {
    @Test
    void shouldParseSeedsWithDefaultPort() {
        var connectionString = ConnectionString.parse("docdb://h1,h2:27018,H1/");

        assertEquals(
                List.of(new ServerAddress("h1", 27017), new ServerAddress("h2", 27018)), connectionString.seeds());
        assertNull(connectionString.database());
    }

    @Test
    void shouldParseDatabaseAndOptions() {
        var connectionString = ConnectionString.parse(
                "docdb://h1/orders?replicaSet=rs0&heartbeatFrequencyMS=5000&SERVERSELECTIONTIMEOUTMS=2000"
                        + "&maxPoolSize=20&minPoolSize=2&localThresholdMS=30&connectTimeoutMS=1500");

        var config = connectionString.toConfig();

        assertEquals("orders", connectionString.database());
        assertEquals("rs0", config.replicaSetName());
        assertEquals(5000, config.heartbeatIntervalMillis());
        assertEquals(2000, config.serverSelectionTimeoutMillis());
        assertEquals(20, config.maxConnectionPoolSize());
        assertEquals(2, config.minConnectionPoolSize());
        assertEquals(30, config.localThresholdMillis());
        assertEquals(1500, config.connectTimeoutMillis());
    }

    @Test
    void shouldOverrideBuilderSettings() {
        var builder = Config.builder().withReplicaSetName("other").withLocalThreshold(1, SECONDS);

        var config = ConnectionString.parse("docdb://h1/?replicaSet=rs0").applyTo(builder).build();

        assertEquals("rs0", config.replicaSetName());
        assertEquals(1000, config.localThresholdMillis());
    }

    @Test
    void shouldTreatZeroMaxPoolSizeAsUnlimited() {
        var config = ConnectionString.parse("docdb://h1/?maxPoolSize=0").toConfig();

        assertEquals(Integer.MAX_VALUE, config.maxConnectionPoolSize());
    }

    @Test
    void shouldParseBooleans() {
        var config = ConnectionString.parse("docdb://h1/?directConnection=TRUE").toConfig();

        assertTrue(config.directConnection());
        assertFalse(config.loadBalanced());
    }

    @Test
    void shouldParseReadPreference() {
        var connectionString = ConnectionString.parse("docdb://h1,h2/?readPreference=secondaryPreferred"
                + "&readPreferenceTags=dc:east,rack:1&readPreferenceTags=&maxStalenessSeconds=120");

        var readPreference = connectionString.readPreference();

        assertEquals(ReadPreference.Mode.SECONDARY_PREFERRED, readPreference.mode());
        assertEquals(
                List.of(TagSet.of(Map.of("dc", "east", "rack", "1")), TagSet.empty()),
                readPreference.tagSets());
        assertEquals(Duration.ofSeconds(120), readPreference.maxStaleness());
    }

    @Test
    void shouldDefaultToPrimaryReadPreference() {
        assertEquals(ReadPreference.primary(), ConnectionString.parse("docdb://h1").readPreference());
    }

    @Test
    void shouldTreatNegativeOneMaxStalenessAsNone() {
        var readPreference = ConnectionString.parse("docdb://h1/?readPreference=secondary&maxStalenessSeconds=-1")
                .readPreference();

        assertNull(readPreference.maxStaleness());
    }

    @Test
    void shouldCollectUnknownOptions() {
        var connectionString = ConnectionString.parse("docdb://h1/?appName=reports&replicaSet=rs0&retryWrites=true");

        assertThat(connectionString.unknownOptions(), contains("appName", "retryWrites"));
    }

    @Test
    void shouldDecodePercentEncodedValues() {
        var connectionString = ConnectionString.parse("docdb://h1/?replicaSet=rs%2D0");

        assertEquals("rs-0", connectionString.replicaSet());
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "mongodb://h1",
                "docdb://",
                "docdb://h1/?heartbeatFrequencyMS=abc",
                "docdb://h1/?heartbeatFrequencyMS=0",
                "docdb://h1/?connectTimeoutMS=-5",
                "docdb://h1/?directConnection=yes",
                "docdb://h1/?readPreference=fastest",
                "docdb://h1/?readPreference=primary&readPreferenceTags=dc:east",
                "docdb://h1/?readPreferenceTags=dc:east",
                "docdb://h1/?readPreference=secondary&readPreferenceTags=dc",
                "docdb://h1/?readPreference=secondary&maxStalenessSeconds=0",
                "docdb://h1/?replicaSet",
                "docdb://h1,h2/?directConnection=true",
                "docdb://h1,h2/?loadBalanced=true",
                "docdb://h1/?loadBalanced=true&replicaSet=rs0",
                "docdb://user:secret@h1",
                "docdb://h1:99999"
            })
    void shouldRejectMalformedConnectionStrings(String value) {
        assertThrows(ClientException.class, () -> ConnectionString.parse(value));
    }

    @Test
    void shouldNameTheOffendingOption() {
        var error = assertThrows(
                ClientException.class, () -> ConnectionString.parse("docdb://h1/?socketTimeoutMS=soon"));

        assertThat(error.getMessage(), containsString("socketTimeoutMS"));
    }
}
