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
 * Exception thrown when a backend connection could not be established for a tenant.
 * <p>
 * The cause of this exception is the failure reported by the backend connector. Failed attempts are never cached,
 * hence a subsequent attempt may succeed once the backend becomes reachable.
 *
 * @since 4.9.0
 */
public class ConnectionFailedException extends AxonTransientException {

    private static final long serialVersionUID = 8440637785346418245L;

    private final TenantKey tenantKey;

    /**
     * Construct a {@link ConnectionFailedException} for the given {@code tenantKey} and {@code cause}.
     *
     * @param tenantKey the key of the tenant for which the connection failed
     * @param cause     the failure reported by the backend connector
     */
    public ConnectionFailedException(TenantKey tenantKey, Throwable cause) {
        super("Failed to establish connection for tenant [" + tenantKey + "]"
                      + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.tenantKey = tenantKey;
    }

    /**
     * Construct a {@link ConnectionFailedException} for the given {@code tenantKey} with a custom {@code message}.
     *
     * @param tenantKey the key of the tenant for which the connection failed
     * @param message   a description of the failure
     */
    public ConnectionFailedException(TenantKey tenantKey, String message) {
        super(message);
        this.tenantKey = tenantKey;
    }

    /**
     * The key of the tenant for which the connection failed.
     *
     * @return the key of the tenant for which the connection failed
     */
    public TenantKey tenantKey() {
        return tenantKey;
    }
}
