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
package org.docdb.driver.cluster;

import org.docdb.driver.ServerAddress;

/**
 * Published when the description of a tracked server changed in content.
 *
 * @param address the server
 * @param previous description before the change
 * @param current description after the change
 */
public record ServerDescriptionChangedEvent(
        ServerAddress address, ServerDescription previous, ServerDescription current) {}
