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
 * A command was received by the server and failed there. Carries the server error code and code name.
 *
 * @since 1.0
 */
public class CommandException extends DriverException {
    @Serial
    private static final long serialVersionUID = -4712846529738130167L;

    private final int code;
    private final String codeName;

    public CommandException(int code, String codeName, String message) {
        super(message);
        this.code = code;
        this.codeName = codeName;
    }

    /**
     * Returns the server error code.
     *
     * @return the error code, {@code 0} when the server did not report one
     */
    public int code() {
        return code;
    }

    /**
     * Returns the symbolic server error name.
     *
     * @return the code name, may be {@code null}
     */
    public String codeName() {
        return codeName;
    }
}
