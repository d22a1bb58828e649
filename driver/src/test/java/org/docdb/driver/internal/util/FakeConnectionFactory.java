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
package org.docdb.driver.internal.util;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.exceptions.ServiceUnavailableException;
import org.docdb.driver.internal.spi.Connection;
import org.docdb.driver.internal.spi.ConnectionFactory;

/**
 * Connection factory backed by scripted servers. Every server answers {@code hello} with its current reply or fails
 * with its current error, other commands are answered by the command handler.
 */
public class FakeConnectionFactory implements ConnectionFactory {
    private static final Map<String, Object> OK = Map.of("ok", 1);

    private final Map<ServerAddress, Map<String, Object>> helloReplies = new ConcurrentHashMap<>();
    private final Map<ServerAddress, RuntimeException> failures = new ConcurrentHashMap<>();
    private final Map<ServerAddress, AtomicInteger> helloCounts = new ConcurrentHashMap<>();
    private final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
    private volatile Function<Map<String, Object>, Map<String, Object>> commandHandler = command -> OK;

    public FakeConnectionFactory reply(ServerAddress address, Map<String, Object> helloReply) {
        failures.remove(address);
        helloReplies.put(address, helloReply);
        return this;
    }

    /**
     * Make the server unreachable: new connections fail and open ones fail on their next command.
     */
    public FakeConnectionFactory fail(ServerAddress address) {
        return fail(address, new ServiceUnavailableException("Connection to " + address + " refused"));
    }

    public FakeConnectionFactory fail(ServerAddress address, RuntimeException error) {
        failures.put(address, error);
        return this;
    }

    public FakeConnectionFactory commandHandler(Function<Map<String, Object>, Map<String, Object>> commandHandler) {
        this.commandHandler = commandHandler;
        return this;
    }

    public int helloCount(ServerAddress address) {
        var count = helloCounts.get(address);
        return count == null ? 0 : count.get();
    }

    public List<FakeConnection> connections() {
        return connections;
    }

    public long openConnections(ServerAddress address) {
        return connections.stream()
                .filter(connection -> connection.address.equals(address) && connection.isOpen())
                .count();
    }

    @Override
    public Connection connect(ServerAddress address, int connectTimeoutMillis, int readTimeoutMillis) {
        var failure = failures.get(address);
        if (failure != null) {
            throw failure;
        }
        var connection = new FakeConnection(address);
        connections.add(connection);
        return connection;
    }

    public class FakeConnection implements Connection {
        private final ServerAddress address;
        private volatile boolean open = true;

        private FakeConnection(ServerAddress address) {
            this.address = address;
        }

        public ServerAddress address() {
            return address;
        }

        @Override
        public Map<String, Object> sendCommand(Map<String, Object> command) {
            if (!open) {
                throw new ServiceUnavailableException("Connection to " + address + " is closed");
            }
            var failure = failures.get(address);
            if (failure != null) {
                open = false;
                throw failure;
            }
            if (command.containsKey("hello")) {
                helloCounts.computeIfAbsent(address, ignored -> new AtomicInteger()).incrementAndGet();
                var reply = helloReplies.get(address);
                if (reply == null) {
                    throw new ServiceUnavailableException("No reply scripted for " + address);
                }
                return reply;
            }
            return commandHandler.apply(command);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }

        @Override
        public String toString() {
            return "FakeConnection{" + address + "}";
        }
    }
}
