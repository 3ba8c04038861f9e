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

import org.axonframework.common.AxonTransientException;

/**
 * Exception thrown when a new tenant connection would exceed the configured maximum number of open connections.
 * <p>
 * The limit frees up as soon as cached connections are released or evicted after their idle timeout.
 *
 * @since 4.9.0
 */
public class ConnectionLimitExceededException extends AxonTransientException {

    private static final long serialVersionUID = 2286379508150476170L;

    private final TenantKey tenantKey;
    private final int maxConnections;

    /**
     * Construct a {@link ConnectionLimitExceededException} for the given {@code tenantKey}.
     *
     * @param tenantKey      the key of the tenant for which a connection was requested
     * @param maxConnections the configured maximum number of open connections
     */
    public ConnectionLimitExceededException(TenantKey tenantKey, int maxConnections) {
        super("Cannot open connection for tenant [" + tenantKey + "]. The maximum of " + maxConnections
                      + " open tenant connections has been reached");
        this.tenantKey = tenantKey;
        this.maxConnections = maxConnections;
    }

    /**
     * The key of the tenant for which a connection was requested.
     *
     * @return the key of the tenant for which a connection was requested
     */
    public TenantKey tenantKey() {
        return tenantKey;
    }

    /**
     * The configured maximum number of open connections.
     *
     * @return the configured maximum number of open connections
     */
    public int maxConnections() {
        return maxConnections;
    }
}
