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

import org.axonframework.common.AxonConfigurationException;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static org.axonframework.common.BuilderUtils.assertNonEmpty;
import static org.axonframework.common.BuilderUtils.assertNonNull;
import static org.axonframework.common.BuilderUtils.assertThat;

/**
 * Immutable snapshot of everything needed to connect to the backend of a single tenant.
 * <p>
 * Instances are owned by a tenant directory and handed to the connection cache per lookup. Updating a tenant means
 * replacing its snapshot, for which {@link #toBuilder()} serves as a starting point.
 *
 * @since 4.9.0
 */
public final class TenantMetadata {

    private final TenantKey tenantKey;
    private final String displayName;
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String database;
    private final String schema;
    private final boolean active;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Map<String, String> properties;

    /**
     * Instantiate a {@link TenantMetadata} based on the fields contained in the {@link Builder}.
     *
     * @param builder the {@link Builder} used to instantiate a {@link TenantMetadata} instance
     */
    private TenantMetadata(Builder builder) {
        builder.validate();
        this.tenantKey = builder.tenantKey;
        this.displayName = builder.displayName != null ? builder.displayName : builder.tenantKey.value();
        this.host = builder.host;
        this.port = builder.port;
        this.username = builder.username;
        this.password = builder.password;
        this.database = builder.database;
        this.schema = builder.schema;
        this.active = builder.active;
        Instant now = Instant.now();
        this.createdAt = builder.createdAt != null ? builder.createdAt : now;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.properties = Collections.unmodifiableMap(new HashMap<>(builder.properties));
    }

    /**
     * Instantiate a Builder to be able to create a {@link TenantMetadata}.
     * <p>
     * The {@link TenantKey}, host and database are <b>hard requirements</b> and as such should be provided. A tenant is
     * active by default.
     *
     * @return a Builder to be able to create a {@link TenantMetadata}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Instantiate a Builder prefilled with the values of this snapshot.
     *
     * @return a Builder prefilled with the values of this snapshot
     */
    public Builder toBuilder() {
        Builder builder = new Builder().tenantKey(tenantKey)
                                       .displayName(displayName)
                                       .host(host)
                                       .port(port)
                                       .database(database)
                                       .active(active)
                                       .createdAt(createdAt)
                                       .updatedAt(updatedAt)
                                       .properties(properties);
        builder.username = username;
        builder.password = password;
        builder.schema = schema;
        return builder;
    }

    public TenantKey tenantKey() {
        return tenantKey;
    }

    public String displayName() {
        return displayName;
    }

    public String host() {
        return host;
    }

    /**
     * The port of the tenant's backend.
     *
     * @return the configured port, or {@code 0} if none was configured
     */
    public int port() {
        return port;
    }

    /**
     * The port of the tenant's backend, falling back to the {@link DriverKind#defaultPort() default port} of the given
     * {@code driverKind} if none was configured.
     *
     * @param driverKind the kind of backend to connect with
     * @return the port to connect to
     */
    public int portOrDefault(DriverKind driverKind) {
        return port > 0 ? port : driverKind.defaultPort();
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public String database() {
        return database;
    }

    public Optional<String> schema() {
        return Optional.ofNullable(schema);
    }

    public boolean isActive() {
        return active;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /**
     * Free-form, tenant-specific properties, for example backend specific connection options.
     *
     * @return an unmodifiable view of the tenant's properties
     */
    public Map<String, String> properties() {
        return properties;
    }

    /**
     * Returns the property stored under the given {@code key}, if any.
     *
     * @param key the key of the property
     * @return the property value, or an empty {@link Optional} if absent
     */
    public Optional<String> property(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TenantMetadata that = (TenantMetadata) o;
        return port == that.port
                && active == that.active
                && Objects.equals(tenantKey, that.tenantKey)
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(host, that.host)
                && Objects.equals(username, that.username)
                && Objects.equals(password, that.password)
                && Objects.equals(database, that.database)
                && Objects.equals(schema, that.schema)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(updatedAt, that.updatedAt)
                && Objects.equals(properties, that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantKey, displayName, host, port, database, schema, active, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        // never print the password
        return "TenantMetadata{" +
                "tenantKey=" + tenantKey +
                ", displayName='" + displayName + '\'' +
                ", host='" + host + '\'' +
                ", port=" + port +
                ", username='" + username + '\'' +
                ", database='" + database + '\'' +
                ", schema='" + schema + '\'' +
                ", active=" + active +
                ", createdAt=" + createdAt +
                ", updatedAt=" + updatedAt +
                '}';
    }

    /**
     * Builder class to instantiate a {@link TenantMetadata}.
     * <p>
     * The {@link TenantKey}, host and database are <b>hard requirements</b> and as such should be provided.
     */
    public static class Builder {

        private TenantKey tenantKey;
        private String displayName;
        private String host;
        private int port;
        private String username;
        private String password;
        private String database;
        private String schema;
        private boolean active = true;
        private Instant createdAt;
        private Instant updatedAt;
        private final Map<String, String> properties = new HashMap<>();

        /**
         * Sets the {@link TenantKey} identifying the tenant.
         *
         * @param tenantKey the key of the tenant
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder tenantKey(TenantKey tenantKey) {
            assertNonNull(tenantKey, "The TenantKey is a hard requirement");
            this.tenantKey = tenantKey;
            return this;
        }

        /**
         * Sets the {@link TenantKey} identifying the tenant from its textual form.
         *
         * @param tenantId the textual identifier of the tenant
         * @return the current Builder instance, for fluent interfacing
         * @throws InvalidTenantKeyException if the given {@code tenantId} is not a valid {@link TenantKey}
         */
        public Builder tenantId(String tenantId) {
            return tenantKey(TenantKey.of(tenantId));
        }

        /**
         * Sets the human-readable name of the tenant. Defaults to the textual tenant key.
         *
         * @param displayName the human-readable name of the tenant
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        /**
         * Sets the host of the tenant's backend.
         *
         * @param host the host of the tenant's backend
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder host(String host) {
            assertNonEmpty(host, "The host may not be null or empty");
            this.host = host;
            return this;
        }

        /**
         * Sets the port of the tenant's backend. Defaults to {@code 0}, meaning the driver's default port is used.
         *
         * @param port the port of the tenant's backend
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder port(int port) {
            assertThat(port, p -> p >= 0 && p <= 65535, "The port should be between 0 and 65535");
            this.port = port;
            return this;
        }

        /**
         * Sets the credentials used to authenticate against the tenant's backend.
         *
         * @param username the user name
         * @param password the password
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder credentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        /**
         * Sets the name of the tenant's database.
         *
         * @param database the name of the tenant's database
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder database(String database) {
            assertNonEmpty(database, "The database may not be null or empty");
            this.database = database;
            return this;
        }

        /**
         * Sets the schema within the tenant's database. Optional.
         *
         * @param schema the schema within the tenant's database
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        /**
         * Sets whether the tenant is active. Defaults to {@code true}.
         *
         * @param active whether the tenant is active
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        /**
         * Adds the given {@code properties} to the free-form properties of the tenant.
         *
         * @param properties the properties to add
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder properties(Map<String, String> properties) {
            assertNonNull(properties, "The properties may not be null");
            this.properties.putAll(properties);
            return this;
        }

        /**
         * Adds a single free-form property to the tenant.
         *
         * @param key   the key of the property
         * @param value the value of the property
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder property(String key, String value) {
            this.properties.put(key, value);
            return this;
        }

        /**
         * Initializes a {@link TenantMetadata} as specified through this Builder.
         *
         * @return a {@link TenantMetadata} as specified through this Builder
         */
        public TenantMetadata build() {
            return new TenantMetadata(this);
        }

        /**
         * Validates whether the fields contained in this Builder are set accordingly.
         *
         * @throws AxonConfigurationException if one field is asserted to be incorrect according to the Builder's
         *                                    specifications
         */
        protected void validate() {
            assertNonNull(tenantKey, "The TenantKey is a hard requirement");
            assertNonEmpty(host, "The host is a hard requirement");
            assertNonEmpty(database, "The database is a hard requirement");
        }
    }
}
