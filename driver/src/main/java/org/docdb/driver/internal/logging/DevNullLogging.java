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

import java.io.Serial;
import java.io.Serializable;
import org.docdb.driver.Logger;
import org.docdb.driver.Logging;

public class DevNullLogging implements Logging, Serializable {
    @Serial
    private static final long serialVersionUID = -4318370532815614410L;

    public static final Logging DEV_NULL_LOGGING = new DevNullLogging();

    private DevNullLogging() {}

    @Override
    public Logger getLog(String name) {
        return DevNullLogger.DEV_NULL_LOGGER;
    }

    // Keeps the singleton on deserialization.
    @Serial
    @SuppressWarnings("SameReturnValue")
    private Object readResolve() {
        return DEV_NULL_LOGGING;
    }
}
