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

import org.axonframework.common.AxonNonTransientException;

/**
 * Exception thrown when a tenant exists but has been deactivated. No connection is opened for inactive tenants.
 *
 * @since 4.9.0
 */
public class TenantInactiveException extends AxonNonTransientException {

    private static final long serialVersionUID = -1807735929114985342L;

    private final TenantKey tenantKey;

    /**
     * Construct a {@link TenantInactiveException} for the given {@code tenantKey}.
     *
     * @param tenantKey the key of the inactive tenant
     */
    public TenantInactiveException(TenantKey tenantKey) {
        super("Tenant [" + tenantKey + "] is inactive");
        this.tenantKey = tenantKey;
    }

    /**
     * The key of the inactive tenant.
     *
     * @return the key of the inactive tenant
     */
    public TenantKey tenantKey() {
        return tenantKey;
    }
}
