/*
 * Copyright (c) 2010-2025. Axon Framework
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.axonframework.extensions.tenantconnection.core;

import java.util.Locale;

/**
 * The kinds of backend a tenant connection can be opened against. Two relational flavours and one document store are
 * supported.
 *
 * @since 4.9.0
 */
public enum DriverKind {

    /**
     * A PostgreSQL database.
     */
    POSTGRESQL(true, 5432),
    /**
     * A MySQL database.
     */
    MYSQL(true, 3306),
    /**
     * A MongoDB document store.
     */
    MONGODB(false, 27017);

    private final boolean sql;
    private final int defaultPort;

    DriverKind(boolean sql, int defaultPort) {
        this.sql = sql;
        this.defaultPort = defaultPort;
    }

    /**
     * Indicates whether this kind is a relational backend accessed through SQL.
     *
     * @return {@code true} for relational backends, {@code false} for document stores
     */
    public boolean isSql() {
        return sql;
    }

    /**
     * The port the backend listens on by default.
     *
     * @return the default port of this kind of backend
     */
    public int defaultPort() {
        return defaultPort;
    }

    /**
     * Resolve a {@link DriverKind} from its textual name, ignoring case. Besides the constant names, the aliases
     * {@code postgres} and {@code mongo} are accepted.
     *
     * @param name the textual driver name
     * @return the matching {@link DriverKind}
     * @throws UnsupportedDriverException if no kind matches the given {@code name}
     */
    public static DriverKind fromName(String name) {
        if (name == null) {
            throw new UnsupportedDriverException((String) null);
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "postgresql":
            case "postgres":
                return POSTGRESQL;
            case "mysql":
                return MYSQL;
            case "mongodb":
            case "mongo":
                return MONGODB;
            default:
                throw new UnsupportedDriverException(name);
        }
    }
}
