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

import java.util.function.Consumer;
import org.docdb.driver.Logger;
import org.docdb.driver.Logging;
import org.docdb.driver.cluster.ClusterListener;

/**
 * Hands events to the configured {@link ClusterListener}, a failing listener never breaks monitoring.
 */
public class ClusterEventPublisher {
    private final ClusterListener listener;
    private final Logger log;

    public ClusterEventPublisher(ClusterListener listener, Logging logging) {
        this.listener = listener;
        this.log = logging.getLog(getClass());
    }

    public ClusterListener listener() {
        return listener;
    }

    public void publish(Consumer<ClusterListener> event) {
        if (listener == ClusterListener.NO_OP) {
            return;
        }
        try {
            event.accept(listener);
        } catch (RuntimeException e) {
            log.warn("Cluster listener " + listener + " failed to handle an event", e);
        }
    }
}
