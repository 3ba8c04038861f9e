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
package org.axonframework.extensions.tenantconnection.directory;

import org.axonframework.extensions.tenantconnection.core.TenantDirectoryUnavailableException;
import org.axonframework.extensions.tenantconnection.core.TenantKey;
import org.axonframework.extensions.tenantconnection.core.TenantMetadata;

import java.util.Optional;

/**
 * Contract towards a component that knows the connection details of every tenant.
 * <p>
 * Lookups should be free of side effects. A directory backed by a remote store should throw a
 * {@link TenantDirectoryUnavailableException} if the store cannot be read, rather than reporting the tenant as absent.
 *
 * @since 4.9.0
 */
@FunctionalInterface
public interface TenantDirectory {

    /**
     * Find the {@link TenantMetadata} of the tenant with the given {@code tenantKey}.
     *
     * @param tenantKey the key of the tenant to look up
     * @return the metadata of the tenant, or an empty {@link Optional} if the tenant is unknown
     * @throws TenantDirectoryUnavailableException if the directory's backing store cannot be read
     */
    Optional<TenantMetadata> findTenant(TenantKey tenantKey);
}
