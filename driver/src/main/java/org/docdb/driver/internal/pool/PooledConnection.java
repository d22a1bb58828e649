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
package org.docdb.driver.internal.pool;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.docdb.driver.ServerAddress;
import org.docdb.driver.internal.metrics.ListenerEvent;
import org.docdb.driver.internal.spi.Connection;

/**
 * A connection owned by a {@link ConnectionPool}. Closing it returns it to the pool.
 */
public class PooledConnection implements Connection {
    private final ConnectionPool pool;
    private final Connection delegate;
    private final int generation;
    private final ListenerEvent<?> inUseEvent;
    private final AtomicBoolean checkedOut = new AtomicBoolean();
    private volatile long lastUsedMillis;

    PooledConnection(
            ConnectionPool pool, Connection delegate, int generation, long createdMillis, ListenerEvent<?> inUseEvent) {
        this.pool = pool;
        this.delegate = delegate;
        this.generation = generation;
        this.lastUsedMillis = createdMillis;
        this.inUseEvent = inUseEvent;
    }

    public ServerAddress address() {
        return pool.address();
    }

    /**
     * @return pool generation this connection was opened in
     */
    public int generation() {
        return generation;
    }

    @Override
    public Map<String, Object> sendCommand(Map<String, Object> command) {
        if (!checkedOut.get()) {
            throw new IllegalStateException("Connection to " + address() + " was already returned to the pool");
        }
        return delegate.sendCommand(command);
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    /**
     * Return the connection to its pool. Only the first call has an effect.
     */
    @Override
    public void close() {
        if (checkedOut.compareAndSet(true, false)) {
            pool.checkin(this);
        }
    }

    void markCheckedOut() {
        checkedOut.set(true);
    }

    ListenerEvent<?> inUseEvent() {
        return inUseEvent;
    }

    long lastUsedMillis() {
        return lastUsedMillis;
    }

    void touch(long nowMillis) {
        lastUsedMillis = nowMillis;
    }

    void closeDelegate() {
        delegate.close();
    }

    @Override
    public String toString() {
        return "PooledConnection{address=" + address() + ", generation=" + generation + "}";
    }
}
