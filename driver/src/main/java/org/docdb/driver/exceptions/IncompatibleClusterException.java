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
package org.docdb.driver.exceptions;

import java.io.Serial;

/**
 * Raised when at least one cluster member speaks a wire protocol range this driver does not support. Retrying does
 * not help until the member is upgraded, downgraded or removed.
 *
 * @since 1.0
 */
public class IncompatibleClusterException extends ClientException {
    @Serial
    private static final long serialVersionUID = -6325212658384632016L;

    public IncompatibleClusterException(String message) {
        super(message);
    }
}
