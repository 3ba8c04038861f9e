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

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.axonframework.extensions.tenantconnection.connector.BackendConnector;
import org.axonframework.extensions.tenantconnection.connector.ConnectorSettings;
import org.axonframework.extensions.tenantconnection.connector.SimpleTenantConnection;
import org.axonframework.extensions.tenantconnection.core.DriverKind;
import org.axonframework.extensions.tenantconnection.core.TenantConnection;
import org.axonframework.extensions.tenantconnection.core.TenantMetadata;
import org.axonframework.extensions.tenantconnection.core.UnsupportedDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;

/**
 * {@link BackendConnector} opening a pooled {@link DataSource} per tenant for SQL backends.
 * <p>
 * The JDBC URL is derived from the tenant's host, port, database and schema, unless the tenant carries a
 * {@value #JDBC_URL_PROPERTY} property, which is used as is. All other tenant properties are passed to the JDBC driver
 * as connection properties. Every opened data source is verified by borrowing a single connection before it is handed
 * out. A data source failing that check is closed again.
 * <p>
 * The returned {@link TenantConnection} unwraps to {@link DataSource} and {@link HikariDataSource}.
 *
 * @since 4.9.0
 */
public class DataSourceBackendConnector implements BackendConnector {

    private static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    /**
     * The tenant property overriding the derived JDBC URL.
     */
    public static final String JDBC_URL_PROPERTY = "jdbcUrl";

    @Override
    public TenantConnection open(TenantMetadata metadata, ConnectorSettings settings) throws SQLException {
        HikariDataSource dataSource = new HikariDataSource(hikariConfig(metadata, settings));
        try (Connection ignored = dataSource.getConnection()) {
            logger.info("Data source for tenant [{}] opened.", metadata.tenantKey());
        } catch (SQLException e) {
            dataSource.close();
            throw e;
        }
        return new SimpleTenantConnection(metadata.tenantKey(), settings.driverKind(), dataSource, dataSource::close);
    }

    @Override
    public boolean supports(DriverKind driverKind) {
        return driverKind.isSql();
    }

    /**
     * Builds the pool configuration of the given tenant.
     *
     * @param metadata the tenant to build the pool configuration for
     * @param settings the settings to apply to the pool
     * @return the pool configuration of the tenant
     */
    protected HikariConfig hikariConfig(TenantMetadata metadata, ConnectorSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("tenant-" + metadata.tenantKey());
        config.setJdbcUrl(jdbcUrl(metadata, settings.driverKind()));
        config.setUsername(metadata.username());
        config.setPassword(metadata.password());
        config.setMaximumPoolSize(settings.poolSize());
        config.setMinimumIdle(0);
        config.setConnectionTimeout(settings.connectionTimeout().toMillis());
        config.setIdleTimeout(settings.idleTimeout().toMillis());
        // verified through the first borrowed connection instead
        config.setInitializationFailTimeout(-1);
        metadata.properties().forEach((key, value) -> {
            if (!JDBC_URL_PROPERTY.equals(key)) {
                config.addDataSourceProperty(key, value);
            }
        });
        return config;
    }

    /**
     * Derives the JDBC URL of the given tenant.
     *
     * @param metadata   the tenant to derive the JDBC URL for
     * @param driverKind the kind of SQL backend
     * @return the JDBC URL of the tenant
     * @throws UnsupportedDriverException if the given {@code driverKind} is not a SQL kind
     */
    public static String jdbcUrl(TenantMetadata metadata, DriverKind driverKind) {
        String override = metadata.property(JDBC_URL_PROPERTY).orElse(null);
        if (override != null) {
            return override;
        }
        String hostAndPort = metadata.host() + ":" + metadata.portOrDefault(driverKind);
        switch (driverKind) {
            case POSTGRESQL:
                return "jdbc:postgresql://" + hostAndPort + "/" + metadata.database()
                        + metadata.schema().map(schema -> "?currentSchema=" + schema).orElse("");
            case MYSQL:
                return "jdbc:mysql://" + hostAndPort + "/" + metadata.database();
            default:
                throw new UnsupportedDriverException(driverKind);
        }
    }
}
