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
 * Exception thrown by a tenant directory when its backing store cannot be read.
 * <p>
 * Contrary to a {@link TenantNotFoundException}, this failure says nothing about the existence of the tenant. It is
 * transient, as the directory may become available again.
 *
 * @since 4.9.0
 */
public class TenantDirectoryUnavailableException extends AxonTransientException {

    private static final long serialVersionUID = -6419012765221950913L;

    private final TenantKey tenantKey;

    /**
     * Construct a {@link TenantDirectoryUnavailableException} for the given {@code tenantKey} and {@code cause}.
     *
     * @param tenantKey the key of the tenant that was being looked up
     * @param cause     the failure of the backing store
     */
    public TenantDirectoryUnavailableException(TenantKey tenantKey, Throwable cause) {
        super("Tenant directory unavailable while looking up tenant [" + tenantKey + "]", cause);
        this.tenantKey = tenantKey;
    }

    /**
     * The key of the tenant that was being looked up.
     *
     * @return the key of the tenant that was being looked up
     */
    public TenantKey tenantKey() {
        return tenantKey;
    }
}
