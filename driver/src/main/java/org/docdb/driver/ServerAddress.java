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

import static java.util.Objects.requireNonNull;

import java.io.Serial;
import java.io.Serializable;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * Holds a host and port pair that denotes a database server address.
 * <p>
 * Host names are case-insensitive and always kept in lower case, so that addresses reported by
 * cluster members compare equal to the ones given as seeds.
 */
public final class ServerAddress implements Serializable {
    @Serial
    private static final long serialVersionUID = 3513247356217743871L;

    public static final int DEFAULT_PORT = 27017;
    public static final ServerAddress LOCAL_DEFAULT = new ServerAddress("localhost", DEFAULT_PORT);

    private final String host;
    private final int port;
    private final String stringValue;

    public ServerAddress(String address) {
        this(uriFrom(address));
    }

    private ServerAddress(URI uri) {
        this(hostFrom(uri), portFrom(uri));
    }

    public ServerAddress(String host, int port) {
        this.host = requireNonNull(host, "host").toLowerCase(Locale.ROOT);
        this.port = requireValidPort(port);
        this.stringValue = this.host.indexOf(':') >= 0
                ? String.format("[%s]:%d", this.host, port)
                : String.format("%s:%d", this.host, port);
    }

    public static ServerAddress of(String address) {
        return new ServerAddress(address);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var address = (ServerAddress) o;
        return port == address.port && host.equals(address.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return stringValue;
    }

    private static String hostFrom(URI uri) {
        var host = uri.getHost();
        if (host == null) {
            throw invalidAddressFormat(uri.toString());
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        return host;
    }

    private static int portFrom(URI uri) {
        var port = uri.getPort();
        return port == -1 ? DEFAULT_PORT : port;
    }

    private static URI uriFrom(String address) {
        requireNonNull(address, "address");
        if (address.isBlank() || address.contains("://") || address.contains("/")) {
            throw invalidAddressFormat(address);
        }
        try {
            // URI can't parse addresses without scheme, prepend fake "docdb://" to reuse the parsing facility
            return URI.create("docdb://" + hostPortFrom(address.trim()));
        } catch (IllegalArgumentException e) {
            throw invalidAddressFormat(address);
        }
    }

    private static String hostPortFrom(String address) {
        if (address.startsWith("[")) {
            // expected to be an IPv6 address like [::1] or [::1]:27017
            return address;
        }

        var containsSingleColon = address.indexOf(":") == address.lastIndexOf(":");
        if (containsSingleColon) {
            // expected to be a host name or IPv4 address with or without port like 127.0.0.1 or 127.0.0.1:27017
            return address;
        }

        // address contains multiple colons and does not start with '['
        // expected to be an IPv6 address without brackets
        return "[" + address + "]";
    }

    private static IllegalArgumentException invalidAddressFormat(String address) {
        return new IllegalArgumentException("Invalid address format `" + address + "`");
    }

    private static int requireValidPort(int port) {
        if (port >= 0 && port <= 65_535) {
            return port;
        }
        throw new IllegalArgumentException("Illegal port: " + port);
    }
}
