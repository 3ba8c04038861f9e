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

import org.axonframework.extensions.tenantconnection.core.TenantKey;

/**
 * Listener notified by a {@link SimpleTenantDirectory} when a tenant can no longer be connected to.
 *
 * @since 4.9.0
 */
@FunctionalInterface
public interface TenantDirectoryListener {

    /**
     * Invoked after the tenant with the given {@code tenantKey} was removed from the directory or deactivated.
     *
     * @param tenantKey the key of the tenant that became unavailable
     */
    void onTenantUnavailable(TenantKey tenantKey);
}
