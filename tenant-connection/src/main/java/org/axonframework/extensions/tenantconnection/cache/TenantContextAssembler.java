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
package org.axonframework.extensions.tenantconnection.cache;

import org.axonframework.extensions.tenantconnection.core.TenantConnection;
import org.axonframework.extensions.tenantconnection.core.TenantContext;
import org.axonframework.extensions.tenantconnection.core.TenantInactiveException;
import org.axonframework.extensions.tenantconnection.core.TenantKey;
import org.axonframework.extensions.tenantconnection.core.TenantMetadata;
import org.axonframework.extensions.tenantconnection.core.TenantNotFoundException;

import static java.util.Objects.requireNonNull;

/**
 * Assembles a {@link TenantContext} from a tenant's metadata and its cached connection.
 * <p>
 * The metadata is looked up first, so a {@link TenantNotFoundException} or {@link TenantInactiveException} takes
 * precedence over any connection failure. The fetched metadata is handed to the cache, which uses it when the
 * connection still has to be created, rather than querying the tenant directory a second time.
 *
 * @since 4.9.0
 */
public class TenantContextAssembler {

    private final TenantConnectionCache connectionCache;

    /**
     * Construct a {@link TenantContextAssembler} acquiring connections from the given {@code connectionCache}.
     *
     * @param connectionCache the cache to look up metadata and connections with
     */
    public TenantContextAssembler(TenantConnectionCache connectionCache) {
        this.connectionCache = requireNonNull(connectionCache, "The TenantConnectionCache may not be null");
    }

    /**
     * Assemble the {@link TenantContext} of the tenant with the given {@code tenantKey}.
     *
     * @param tenantKey the key of the tenant
     * @return the context of the tenant
     */
    public TenantContext assemble(TenantKey tenantKey) {
        requireNonNull(tenantKey, "The tenant key may not be null");
        TenantMetadata metadata = connectionCache.lookupActiveTenant(tenantKey);
        TenantConnection connection = connectionCache.acquire(tenantKey, metadata);
        return new TenantContext(tenantKey, metadata, connection);
    }
}
