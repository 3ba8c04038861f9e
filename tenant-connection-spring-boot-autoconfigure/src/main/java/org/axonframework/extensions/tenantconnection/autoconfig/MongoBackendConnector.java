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

import com.mongodb.ConnectionString;
import com.mongodb.MongoCredential;
import com.mongodb.MongoClientSettings;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import org.axonframework.extensions.tenantconnection.connector.BackendConnector;
import org.axonframework.extensions.tenantconnection.connector.ConnectorSettings;
import org.axonframework.extensions.tenantconnection.connector.SimpleTenantConnection;
import org.axonframework.extensions.tenantconnection.core.DriverKind;
import org.axonframework.extensions.tenantconnection.core.TenantConnection;
import org.axonframework.extensions.tenantconnection.core.TenantMetadata;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * {@link BackendConnector} opening a {@link MongoClient} per tenant.
 * <p>
 * Tenants authenticate against their own database. Tenant properties are applied as connection string options, for
 * example {@code replicaSet} or {@code retryWrites}, and take precedence over the configured settings. Every opened
 * client is verified with a {@code ping} command before it is handed out. A client failing that check is closed again.
 * <p>
 * The returned {@link TenantConnection} unwraps to {@link MongoClient}. Use {@link #database(TenantConnection, String)}
 * to get hold of the tenant's {@link MongoDatabase}.
 *
 * @since 4.9.0
 */
public class MongoBackendConnector implements BackendConnector {

    private static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    @Override
    public TenantConnection open(TenantMetadata metadata, ConnectorSettings settings) {
        MongoClient client = MongoClients.create(clientSettings(metadata, settings));
        try {
            client.getDatabase(metadata.database()).runCommand(new Document("ping", 1));
            logger.info("Mongo client for tenant [{}] opened.", metadata.tenantKey());
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
        return new SimpleTenantConnection(metadata.tenantKey(), DriverKind.MONGODB, client, client::close);
    }

    @Override
    public boolean supports(DriverKind driverKind) {
        return driverKind == DriverKind.MONGODB;
    }

    /**
     * Builds the client settings of the given tenant.
     *
     * @param metadata the tenant to build the client settings for
     * @param settings the settings to apply to the client
     * @return the client settings of the tenant
     */
    protected MongoClientSettings clientSettings(TenantMetadata metadata, ConnectorSettings settings) {
        long connectionTimeout = settings.connectionTimeout().toMillis();
        MongoClientSettings.Builder builder =
                MongoClientSettings.builder()
                                   .applicationName("tenant-" + metadata.tenantKey())
                                   .applyToClusterSettings(cluster -> cluster.hosts(List.of(new ServerAddress(
                                           metadata.host(), metadata.portOrDefault(DriverKind.MONGODB)
                                   ))).serverSelectionTimeout(connectionTimeout, TimeUnit.MILLISECONDS))
                                   .applyToSocketSettings(socket -> socket.connectTimeout(
                                           connectionTimeout, TimeUnit.MILLISECONDS
                                   ))
                                   .applyToConnectionPoolSettings(pool -> pool
                                           .maxSize(settings.poolSize())
                                           .maxConnectionIdleTime(settings.idleTimeout().toMillis(),
                                                                  TimeUnit.MILLISECONDS));
        if (metadata.username() != null) {
            String password = metadata.password() != null ? metadata.password() : "";
            builder.credential(MongoCredential.createCredential(
                    metadata.username(), metadata.database(), password.toCharArray()
            ));
        }
        if (!metadata.properties().isEmpty()) {
            builder.applyConnectionString(connectionString(metadata));
        }
        return builder.build();
    }

    /**
     * Builds a connection string carrying the properties of the given tenant as options.
     */
    private static ConnectionString connectionString(TenantMetadata metadata) {
        String options = metadata.properties()
                                 .entrySet()
                                 .stream()
                                 .sorted(Map.Entry.comparingByKey())
                                 .map(option -> option.getKey() + "="
                                         + URLEncoder.encode(option.getValue(), StandardCharsets.UTF_8))
                                 .collect(Collectors.joining("&"));
        return new ConnectionString("mongodb://" + metadata.host() + ":" + metadata.portOrDefault(DriverKind.MONGODB)
                                            + "/?" + options);
    }

    /**
     * Returns the database with the given {@code databaseName} of the client wrapped by the given {@code connection}.
     *
     * @param connection   a connection opened by this connector
     * @param databaseName the name of the database
     * @return the database with the given name
     */
    public static MongoDatabase database(TenantConnection connection, String databaseName) {
        return connection.unwrap(MongoClient.class).getDatabase(databaseName);
    }
}
