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
package org.axonframework.extensions.tenantconnection.connector;

import org.axonframework.extensions.tenantconnection.core.DriverKind;
import org.axonframework.extensions.tenantconnection.core.TenantConnection;
import org.axonframework.extensions.tenantconnection.core.TenantMetadata;

/**
 * Opens and closes backend connections for tenants. This is the pluggable part of the connection cache: the cache
 * decides <em>when</em> a connection is opened or closed, the connector decides <em>how</em>.
 * <p>
 * Example usage:
 * <pre>{@code
 * BackendConnector connector = (metadata, settings) -> {
 *     HikariDataSource dataSource = createDataSource(metadata, settings);
 *     return new SimpleTenantConnection(metadata.tenantKey(), settings.driverKind(), dataSource, dataSource::close);
 * };
 * }</pre>
 *
 * @since 4.9.0
 */
@FunctionalInterface
public interface BackendConnector {

    /**
     * Opens a connection to the backend described by the given {@code metadata}. Implementations may block while the
     * connection is being established.
     *
     * @param metadata the metadata of the tenant to connect to
     * @param settings the settings to connect with, including the {@link DriverKind}
     * @return an open {@link TenantConnection}
     * @throws Exception if the connection could not be established
     */
    TenantConnection open(TenantMetadata metadata, ConnectorSettings settings) throws Exception;

    /**
     * Closes the given {@code connection}. Defaults to {@link TenantConnection#close()}.
     *
     * @param connection the connection to close
     * @throws Exception if the backend fails to close
     */
    default void close(TenantConnection connection) throws Exception {
        connection.close();
    }

    /**
     * Indicates whether this connector can open connections of the given {@code driverKind}. Defaults to
     * {@code true}.
     *
     * @param driverKind the kind of backend to check
     * @return {@code true} if this connector supports the given {@code driverKind}
     */
    default boolean supports(DriverKind driverKind) {
        return true;
    }
}
