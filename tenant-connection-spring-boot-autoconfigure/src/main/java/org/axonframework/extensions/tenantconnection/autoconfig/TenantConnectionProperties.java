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
package org.axonframework.extensions.tenantconnection.autoconfig;

import org.axonframework.extensions.tenantconnection.cache.TenantConnectionCache;
import org.axonframework.extensions.tenantconnection.connector.ConnectorSettings;
import org.axonframework.extensions.tenantconnection.core.DriverKind;
import org.axonframework.extensions.tenantconnection.core.TenantMetadata;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Configuration properties for the Axon Framework tenant connection extension.
 * <p>
 * These properties configure how tenant connections are opened and cached, and optionally provide a static registry
 * of tenants for deployments where tenants are known at configuration time:
 * <pre>
 * axon.tenant-connection.driver=postgresql
 * axon.tenant-connection.idle-timeout=10m
 * axon.tenant-connection.tenants.tenant-1.host=db.internal
 * axon.tenant-connection.tenants.tenant-1.database=tenant_1
 * </pre>
 *
 * @since 4.9.0
 */
@ConfigurationProperties("axon.tenant-connection")
public class TenantConnectionProperties {

    /**
     * Whether the tenant connection extension is enabled. Defaults to {@code true}.
     */
    private boolean enabled = true;

    /**
     * The kind of backend tenants connect to: {@code postgresql}, {@code mysql} or {@code mongodb}. Defaults to
     * {@code postgresql}.
     */
    private String driver = "postgresql";

    /**
     * Whether tenant connections are cached. When disabled, every acquire opens a new connection. Defaults to
     * {@code true}.
     */
    private boolean cachingEnabled = true;

    /**
     * The maximum number of cached tenant connections. Defaults to {@code 100}.
     */
    private int maxConnections = TenantConnectionCache.DEFAULT_MAX_CONNECTIONS;

    /**
     * The number of physical connections pooled per tenant. Defaults to {@code 10}.
     */
    private int poolSize = ConnectorSettings.DEFAULT_POOL_SIZE;

    /**
     * The time to wait for a tenant connection to be established. Defaults to 30 seconds.
     */
    private Duration connectionTimeout = ConnectorSettings.DEFAULT_CONNECTION_TIMEOUT;

    /**
     * The time a cached tenant connection may remain unused before it is closed. Defaults to 5 minutes.
     */
    private Duration idleTimeout = ConnectorSettings.DEFAULT_IDLE_TIMEOUT;

    /**
     * The time to wait for tenant connections to close on shutdown. Defaults to 30 seconds.
     */
    private Duration shutdownTimeout = TenantConnectionCache.DEFAULT_SHUTDOWN_TIMEOUT;

    /**
     * Static registry of tenants, keyed by tenant identifier. Only used when no
     * {@link org.axonframework.extensions.tenantconnection.directory.TenantDirectory} bean is defined.
     */
    private Map<String, Tenant> tenants = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDriver() {
        return driver;
    }

    public void setDriver(String driver) {
        this.driver = driver;
    }

    /**
     * Returns the configured {@link #getDriver() driver} as a {@link DriverKind}.
     *
     * @return the configured driver kind
     * @throws org.axonframework.extensions.tenantconnection.core.UnsupportedDriverException if the configured driver
     *                                                                                       is unknown
     */
    public DriverKind driverKind() {
        return DriverKind.fromName(driver);
    }

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public void setCachingEnabled(boolean cachingEnabled) {
        this.cachingEnabled = cachingEnabled;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public void setConnectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Map<String, Tenant> getTenants() {
        return tenants;
    }

    public void setTenants(Map<String, Tenant> tenants) {
        this.tenants = tenants;
    }

    /**
     * Converts the static tenant registry into {@link TenantMetadata}, one per configured tenant.
     *
     * @return the metadata of all configured tenants, ordered by tenant key
     * @throws org.axonframework.extensions.tenantconnection.core.InvalidTenantKeyException if a configured tenant
     *                                                                                      identifier is not a valid
     *                                                                                      tenant key
     */
    public List<TenantMetadata> tenantMetadata() {
        return tenants.entrySet()
                      .stream()
                      .map(entry -> entry.getValue().toMetadata(entry.getKey()))
                      .sorted(Comparator.comparing(TenantMetadata::tenantKey))
                      .collect(Collectors.toList());
    }

    /**
     * Connection details of a single, statically configured tenant.
     */
    public static class Tenant {

        /**
         * Human-readable name of the tenant. Defaults to the tenant identifier.
         */
        private String name;

        /**
         * Host of the tenant's backend.
         */
        private String host;

        /**
         * Port of the tenant's backend. Defaults to the default port of the configured driver.
         */
        private int port;

        private String username;

        private String password;

        /**
         * Name of the tenant's database.
         */
        private String database;

        /**
         * Schema within the tenant's database, for SQL backends.
         */
        private String schema;

        /**
         * Whether the tenant is active. Connections are refused for inactive tenants. Defaults to {@code true}.
         */
        private boolean active = true;

        /**
         * Free-form, backend specific properties. A {@code jdbcUrl} property overrides the derived JDBC URL.
         */
        private Map<String, String> properties = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public Map<String, String> getProperties() {
            return properties;
        }

        public void setProperties(Map<String, String> properties) {
            this.properties = properties;
        }

        TenantMetadata toMetadata(String tenantId) {
            return TenantMetadata.builder()
                                 .tenantId(tenantId)
                                 .displayName(name)
                                 .host(host)
                                 .port(port)
                                 .credentials(username, password)
                                 .database(database)
                                 .schema(schema)
                                 .active(active)
                                 .properties(properties)
                                 .build();
        }
    }
}
