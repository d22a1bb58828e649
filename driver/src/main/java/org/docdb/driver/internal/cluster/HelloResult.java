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

import static java.util.Collections.emptyMap;
import static java.util.Collections.emptySet;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.cluster.ElectionId;
import org.docdb.driver.cluster.ServerDescription;
import org.docdb.driver.cluster.ServerType;

/**
 * Reply to the {@code hello} command, parsed once into typed fields.
 *
 * @param ok whether the command succeeded
 * @param writablePrimary {@code isWritablePrimary}, or the legacy {@code ismaster}
 * @param secondary {@code secondary}
 * @param arbiterOnly {@code arbiterOnly}
 * @param replicaSetGhost {@code isreplicaset}, set by members that are not initialized yet
 * @param hidden {@code hidden}
 * @param msg {@code msg}, {@code isdbgrid} for routers
 * @param setName {@code setName}
 * @param hosts {@code hosts}
 * @param passives {@code passives}
 * @param arbiters {@code arbiters}
 * @param primary {@code primary}
 * @param me {@code me}
 * @param tags {@code tags}
 * @param electionId {@code electionId}
 * @param setVersion {@code setVersion}
 * @param minWireVersion {@code minWireVersion}
 * @param maxWireVersion {@code maxWireVersion}
 * @param lastWriteDate {@code lastWrite.lastWriteDate} in epoch millis
 * @param logicalSessionTimeoutMinutes {@code logicalSessionTimeoutMinutes}
 */
public record HelloResult(
        boolean ok,
        boolean writablePrimary,
        boolean secondary,
        boolean arbiterOnly,
        boolean replicaSetGhost,
        boolean hidden,
        String msg,
        String setName,
        Set<ServerAddress> hosts,
        Set<ServerAddress> passives,
        Set<ServerAddress> arbiters,
        ServerAddress primary,
        ServerAddress me,
        Map<String, String> tags,
        ElectionId electionId,
        Integer setVersion,
        int minWireVersion,
        int maxWireVersion,
        Long lastWriteDate,
        Integer logicalSessionTimeoutMinutes) {
    private static final String ROUTER_MESSAGE = "isdbgrid";

    /**
     * Parse a reply document.
     *
     * @param reply the reply
     * @return parsed result
     * @throws IllegalArgumentException when a recognized field has a value of the wrong type
     */
    public static HelloResult parse(Map<String, ?> reply) {
        return new HelloResult(
                isOk(reply.get("ok")),
                bool(reply, "isWritablePrimary") || bool(reply, "ismaster"),
                bool(reply, "secondary"),
                bool(reply, "arbiterOnly"),
                bool(reply, "isreplicaset"),
                bool(reply, "hidden"),
                string(reply, "msg"),
                string(reply, "setName"),
                addresses(reply, "hosts"),
                addresses(reply, "passives"),
                addresses(reply, "arbiters"),
                address(reply, "primary"),
                address(reply, "me"),
                tags(reply),
                electionId(reply.get("electionId")),
                integer(reply, "setVersion"),
                intOrZero(reply, "minWireVersion"),
                intOrZero(reply, "maxWireVersion"),
                lastWriteDate(reply.get("lastWrite")),
                integer(reply, "logicalSessionTimeoutMinutes"));
    }

    /**
     * Classify the server. Conditions are evaluated in order, the first match wins.
     *
     * @return server type
     */
    public ServerType serverType() {
        if (!ok) {
            return ServerType.UNKNOWN;
        }
        if (replicaSetGhost) {
            return ServerType.RS_GHOST;
        }
        if (ROUTER_MESSAGE.equals(msg)) {
            return ServerType.MONGOS;
        }
        if (setName != null) {
            if (hidden) {
                return ServerType.RS_OTHER;
            }
            if (writablePrimary) {
                return ServerType.RS_PRIMARY;
            }
            if (secondary) {
                return ServerType.RS_SECONDARY;
            }
            if (arbiterOnly) {
                return ServerType.RS_ARBITER;
            }
            return ServerType.RS_OTHER;
        }
        return ServerType.STANDALONE;
    }

    public ServerDescription toServerDescription(ServerAddress address, Duration roundTripTime, long updateTime) {
        return ServerDescription.builder(address)
                .type(serverType())
                .roundTripTime(roundTripTime)
                .wireVersions(minWireVersion, maxWireVersion)
                .setName(setName)
                .hosts(hosts)
                .passives(passives)
                .arbiters(arbiters)
                .primary(primary)
                .me(me)
                .tags(tags)
                .electionId(electionId)
                .setVersion(setVersion)
                .lastWriteDate(lastWriteDate)
                .logicalSessionTimeoutMinutes(logicalSessionTimeoutMinutes)
                .lastUpdateTime(updateTime)
                .build();
    }

    private static boolean isOk(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue() == 1.0;
        }
        return Boolean.TRUE.equals(value);
    }

    private static boolean bool(Map<String, ?> reply, String key) {
        var value = reply.get(key);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        throw invalidField(key, value);
    }

    private static String string(Map<String, ?> reply, String key) {
        var value = reply.get(key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw invalidField(key, value);
    }

    private static Integer integer(Map<String, ?> reply, String key) {
        var value = reply.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw invalidField(key, value);
    }

    private static int intOrZero(Map<String, ?> reply, String key) {
        var value = integer(reply, key);
        return value == null ? 0 : value;
    }

    private static ServerAddress address(Map<String, ?> reply, String key) {
        var value = string(reply, key);
        return value == null ? null : new ServerAddress(value);
    }

    private static Set<ServerAddress> addresses(Map<String, ?> reply, String key) {
        var value = reply.get(key);
        if (value == null) {
            return emptySet();
        }
        if (!(value instanceof Collection<?> collection)) {
            throw invalidField(key, value);
        }
        var result = new LinkedHashSet<ServerAddress>();
        for (var host : collection) {
            result.add(new ServerAddress(String.valueOf(host)));
        }
        return result;
    }

    private static Map<String, String> tags(Map<String, ?> reply) {
        var value = reply.get("tags");
        if (value == null) {
            return emptyMap();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw invalidField("tags", value);
        }
        var result = new LinkedHashMap<String, String>();
        map.forEach((name, tag) -> result.put(String.valueOf(name), String.valueOf(tag)));
        return result;
    }

    private static ElectionId electionId(Object value) {
        if (value == null || value instanceof ElectionId) {
            return (ElectionId) value;
        }
        if (value instanceof byte[] bytes) {
            return ElectionId.fromBytes(bytes);
        }
        if (value instanceof String hex) {
            return ElectionId.fromHexString(hex);
        }
        throw invalidField("electionId", value);
    }

    private static Long lastWriteDate(Object lastWrite) {
        if (lastWrite == null) {
            return null;
        }
        if (!(lastWrite instanceof Map<?, ?> map)) {
            throw invalidField("lastWrite", lastWrite);
        }
        var value = map.get("lastWriteDate");
        if (value == null) {
            return null;
        }
        if (value instanceof Date date) {
            return date.getTime();
        }
        if (value instanceof Instant instant) {
            return instant.toEpochMilli();
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw invalidField("lastWrite.lastWriteDate", value);
    }

    private static IllegalArgumentException invalidField(String key, Object value) {
        return new IllegalArgumentException(String.format(
                "Unexpected value of hello reply field `%s`: %s (%s)",
                key, value, value.getClass().getSimpleName()));
    }
}
