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

import java.util.Objects;

/**
 * Read view combining the {@link TenantMetadata} of a tenant with its open {@link TenantConnection}.
 * <p>
 * A context is assembled per lookup and never cached. Only the connection it refers to is.
 *
 * @since 4.9.0
 */
public final class TenantContext {

    private final TenantKey tenantKey;
    private final TenantMetadata metadata;
    private final TenantConnection connection;

    /**
     * Construct a {@link TenantContext} for the given {@code tenantKey}, {@code metadata} and {@code connection}.
     *
     * @param tenantKey  the key of the tenant
     * @param metadata   the metadata snapshot of the tenant
     * @param connection the open connection of the tenant
     */
    public TenantContext(TenantKey tenantKey, TenantMetadata metadata, TenantConnection connection) {
        this.tenantKey = Objects.requireNonNull(tenantKey, "The tenant key may not be null");
        this.metadata = Objects.requireNonNull(metadata, "The tenant metadata may not be null");
        this.connection = Objects.requireNonNull(connection, "The tenant connection may not be null");
    }

    public TenantKey tenantKey() {
        return tenantKey;
    }

    public TenantMetadata metadata() {
        return metadata;
    }

    public TenantConnection connection() {
        return connection;
    }

    /**
     * Shorthand for {@code connection().unwrap(type)}.
     *
     * @param type the type of backend object to return
     * @param <T>  the type of backend object to return
     * @return the backend object of this context's connection
     */
    public <T> T connection(Class<T> type) {
        return connection.unwrap(type);
    }

    @Override
    public String toString() {
        return "TenantContext{tenantKey=" + tenantKey + ", driverKind=" + connection.driverKind() + '}';
    }
}
