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

import org.axonframework.extensions.tenantconnection.core.TenantKey;

import java.util.List;

/**
 * Read-only snapshot of the connections held by a {@link TenantConnectionCache}.
 *
 * @param keys the keys of the tenants with an open, cached connection, in natural order
 * @since 4.9.0
 */
public record ConnectionStats(List<TenantKey> keys) {

    /**
     * Compact constructor copying the given {@code keys}.
     */
    public ConnectionStats {
        keys = List.copyOf(keys);
    }

    /**
     * The number of open, cached connections.
     *
     * @return the number of open, cached connections
     */
    public int count() {
        return keys.size();
    }

    /**
     * Indicates whether a connection for the given {@code tenantKey} is part of this snapshot.
     *
     * @param tenantKey the key of the tenant to check
     * @return {@code true} if the snapshot holds a connection for the given tenant
     */
    public boolean contains(TenantKey tenantKey) {
        return keys.contains(tenantKey);
    }
}
