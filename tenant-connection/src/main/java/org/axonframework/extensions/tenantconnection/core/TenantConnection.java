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

/**
 * An open, usable connection to the backend of a single tenant.
 * <p>
 * The concrete backend object (a {@code javax.sql.DataSource}, a MongoDB client, etc.) is obtained through
 * {@link #unwrap(Class)}, using the {@link #driverKind()} to decide which type to narrow to. This keeps the connection
 * cache itself agnostic of the backend in use.
 * <p>
 * Implementations should make {@link #close()} idempotent.
 *
 * @since 4.9.0
 */
public interface TenantConnection extends AutoCloseable {

    /**
     * The key of the tenant this connection belongs to.
     *
     * @return the key of the tenant this connection belongs to
     */
    TenantKey tenantKey();

    /**
     * The kind of backend this connection is opened against.
     *
     * @return the kind of backend this connection is opened against
     */
    DriverKind driverKind();

    /**
     * Indicates whether this connection is still usable. Returns {@code false} once {@link #close()} was invoked.
     *
     * @return {@code true} if this connection is open, {@code false} otherwise
     */
    boolean isOpen();

    /**
     * Narrows this connection to the backend object of the given {@code type}.
     *
     * @param type the type of backend object to return
     * @param <T>  the type of backend object to return
     * @return the backend object of this connection
     * @throws IllegalArgumentException if the backend object is not an instance of the given {@code type}
     */
    <T> T unwrap(Class<T> type);

    /**
     * Indicates whether {@link #unwrap(Class)} succeeds for the given {@code type}.
     *
     * @param type the type of backend object to check
     * @return {@code true} if this connection wraps an instance of the given {@code type}
     */
    boolean isWrapperFor(Class<?> type);

    /**
     * Closes this connection, releasing all backend resources it holds.
     *
     * @throws Exception if the backend fails to close
     */
    @Override
    void close() throws Exception;
}
