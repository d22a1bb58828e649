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

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates named daemon threads so that background work never keeps the JVM alive.
 */
public class DaemonThreadFactory implements ThreadFactory {
    private final String namePrefix;
    private final AtomicInteger threadCount = new AtomicInteger();

    private DaemonThreadFactory(String namePrefix) {
        this.namePrefix = namePrefix;
    }

    public static ThreadFactory daemon(String namePrefix) {
        return new DaemonThreadFactory(namePrefix);
    }

    public static Thread newDaemonThread(String name, Runnable runnable) {
        var thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        return newDaemonThread(namePrefix + threadCount.incrementAndGet(), runnable);
    }
}
