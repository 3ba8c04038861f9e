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

import java.time.Duration;
import java.util.Objects;

/**
 * The settings a {@link BackendConnector} opens a tenant connection with. The connection cache passes these through
 * untouched; enforcing the timeouts and pool size is up to the connector and its backend driver.
 *
 * @since 4.9.0
 */
public final class ConnectorSettings {

    /**
     * The default number of physical connections per tenant connection pool.
     */
    public static final int DEFAULT_POOL_SIZE = 10;
    /**
     * The default time to wait for a backend connection to be established.
     */
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);
    /**
     * The default time after which an unused connection is closed.
     */
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(5);

    private final DriverKind driverKind;
    private final Duration connectionTimeout;
    private final Duration idleTimeout;
    private final int poolSize;

    /**
     * Construct {@link ConnectorSettings} with the given values.
     *
     * @param driverKind        the kind of backend to connect to
     * @param connectionTimeout the time to wait for a connection to be established
     * @param idleTimeout       the time after which an unused connection may be closed
     * @param poolSize          the number of physical connections a connector may pool per tenant
     */
    public ConnectorSettings(DriverKind driverKind, Duration connectionTimeout, Duration idleTimeout, int poolSize) {
        this.driverKind = Objects.requireNonNull(driverKind, "The DriverKind may not be null");
        this.connectionTimeout = Objects.requireNonNull(connectionTimeout, "The connection timeout may not be null");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "The idle timeout may not be null");
        this.poolSize = poolSize;
    }

    /**
     * Construct {@link ConnectorSettings} for the given {@code driverKind} using the default timeouts and pool size.
     *
     * @param driverKind the kind of backend to connect to
     * @return {@link ConnectorSettings} for the given {@code driverKind}
     */
    public static ConnectorSettings defaults(DriverKind driverKind) {
        return new ConnectorSettings(driverKind, DEFAULT_CONNECTION_TIMEOUT, DEFAULT_IDLE_TIMEOUT, DEFAULT_POOL_SIZE);
    }

    public DriverKind driverKind() {
        return driverKind;
    }

    public Duration connectionTimeout() {
        return connectionTimeout;
    }

    public Duration idleTimeout() {
        return idleTimeout;
    }

    public int poolSize() {
        return poolSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConnectorSettings that = (ConnectorSettings) o;
        return poolSize == that.poolSize
                && driverKind == that.driverKind
                && connectionTimeout.equals(that.connectionTimeout)
                && idleTimeout.equals(that.idleTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(driverKind, connectionTimeout, idleTimeout, poolSize);
    }

    @Override
    public String toString() {
        return "ConnectorSettings{" +
                "driverKind=" + driverKind +
                ", connectionTimeout=" + connectionTimeout +
                ", idleTimeout=" + idleTimeout +
                ", poolSize=" + poolSize +
                '}';
    }
}
