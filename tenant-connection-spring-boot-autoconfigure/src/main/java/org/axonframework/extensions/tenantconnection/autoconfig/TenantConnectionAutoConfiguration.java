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

import com.mongodb.client.MongoClient;
import com.zaxxer.hikari.HikariDataSource;
import org.axonframework.common.AxonConfigurationException;
import org.axonframework.extensions.tenantconnection.cache.TenantConnectionCache;
import org.axonframework.extensions.tenantconnection.connector.BackendConnector;
import org.axonframework.extensions.tenantconnection.core.DriverKind;
import org.axonframework.extensions.tenantconnection.directory.SimpleTenantDirectory;
import org.axonframework.extensions.tenantconnection.directory.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

import java.lang.invoke.MethodHandles;

/**
 * Autoconfiguration constructing the {@link TenantConnectionCache} and its collaborators.
 * <p>
 * Unless defined by the application, a {@link SimpleTenantDirectory} is created from the
 * {@code axon.tenant-connection.tenants} properties, and a {@link BackendConnector} is chosen based on the configured
 * driver: a {@link DataSourceBackendConnector} for SQL backends and a {@link MongoBackendConnector} for MongoDB.
 *
 * @since 4.9.0
 */
@AutoConfiguration
@ConditionalOnProperty(value = "axon.tenant-connection.enabled", matchIfMissing = true)
@EnableConfigurationProperties(TenantConnectionProperties.class)
public class TenantConnectionAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    @Bean
    @ConditionalOnMissingBean(TenantDirectory.class)
    public SimpleTenantDirectory tenantDirectory(TenantConnectionProperties properties) {
        SimpleTenantDirectory directory = new SimpleTenantDirectory(properties.tenantMetadata());
        logger.debug("Registered {} tenant(s) from properties.", directory.getTenants().size());
        return directory;
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public TenantConnectionCache tenantConnectionCache(TenantConnectionProperties properties,
                                                       TenantDirectory tenantDirectory,
                                                       ObjectProvider<BackendConnector> backendConnector) {
        DriverKind driverKind = properties.driverKind();
        BackendConnector connector = backendConnector.getIfAvailable(() -> {
            throw new AxonConfigurationException(
                    "No BackendConnector available for driver [" + driverKind + "]. "
                            + "Add the driver's client library to the classpath or define a BackendConnector bean."
            );
        });
        TenantConnectionCache cache = TenantConnectionCache.builder()
                                                           .tenantDirectory(tenantDirectory)
                                                           .backendConnector(connector)
                                                           .driverKind(driverKind)
                                                           .cachingEnabled(properties.isCachingEnabled())
                                                           .maxConnections(properties.getMaxConnections())
                                                           .poolSize(properties.getPoolSize())
                                                           .connectionTimeout(properties.getConnectionTimeout())
                                                           .idleTimeout(properties.getIdleTimeout())
                                                           .shutdownTimeout(properties.getShutdownTimeout())
                                                           .build();
        if (tenantDirectory instanceof SimpleTenantDirectory) {
            cache.evictOnDirectoryChanges((SimpleTenantDirectory) tenantDirectory);
        }
        return cache;
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HikariDataSource.class)
    @Conditional(DriverKindCondition.OnSqlDriver.class)
    static class DataSourceConnectorConfiguration {

        @Bean
        @ConditionalOnMissingBean(BackendConnector.class)
        public DataSourceBackendConnector dataSourceBackendConnector() {
            return new DataSourceBackendConnector();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoClient.class)
    @Conditional(DriverKindCondition.OnMongoDriver.class)
    static class MongoConnectorConfiguration {

        @Bean
        @ConditionalOnMissingBean(BackendConnector.class)
        public MongoBackendConnector mongoBackendConnector() {
            return new MongoBackendConnector();
        }
    }
}
