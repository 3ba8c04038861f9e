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

import jakarta.annotation.Nonnull;
import org.axonframework.common.Registration;
import org.axonframework.extensions.tenantconnection.core.TenantKey;
import org.axonframework.extensions.tenantconnection.core.TenantMetadata;
import org.axonframework.extensions.tenantconnection.core.TenantNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A simple implementation of {@link TenantDirectory} that keeps all tenants in memory and allows programmatic
 * management of them.
 * <p>
 * Tenants can be added, updated, (de)activated and removed at runtime. Subscribed
 * {@link TenantDirectoryListener TenantDirectoryListeners} are notified whenever a tenant is removed or deactivated,
 * allowing a connection cache to close the tenant's connection right away instead of waiting for it to become idle.
 * <p>
 * Example usage:
 * <pre>{@code
 * SimpleTenantDirectory directory = new SimpleTenantDirectory();
 * directory.addTenant(TenantMetadata.builder()
 *                                   .tenantId("tenant-1")
 *                                   .host("db.internal")
 *                                   .database("tenant_1")
 *                                   .credentials("app", "secret")
 *                                   .build());
 *
 * // When a tenant is suspended:
 * directory.deactivateTenant(TenantKey.of("tenant-1"));
 * }</pre>
 * <p>
 * This implementation is thread-safe.
 *
 * @since 4.9.0
 */
public class SimpleTenantDirectory implements TenantDirectory {

    private static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final ConcurrentHashMap<TenantKey, TenantMetadata> tenants = new ConcurrentHashMap<>();
    private final List<TenantDirectoryListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    /**
     * Creates a new {@link SimpleTenantDirectory} with no initial tenants.
     */
    public SimpleTenantDirectory() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a new {@link SimpleTenantDirectory} with the given initial tenants.
     *
     * @param initialTenants the tenants to register initially
     */
    public SimpleTenantDirectory(@Nonnull Collection<TenantMetadata> initialTenants) {
        this(Clock.systemUTC());
        requireNonNull(initialTenants, "Initial tenants cannot be null");
        initialTenants.forEach(this::addTenant);
    }

    /**
     * Creates a new {@link SimpleTenantDirectory} using the given {@code clock} to stamp tenant updates.
     *
     * @param clock the clock used to stamp tenant updates
     */
    public SimpleTenantDirectory(@Nonnull Clock clock) {
        this.clock = requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public Optional<TenantMetadata> findTenant(TenantKey tenantKey) {
        return Optional.ofNullable(tenants.get(tenantKey));
    }

    /**
     * Adds a tenant to this directory.
     * <p>
     * If a tenant with the same key is already registered, this method has no effect.
     *
     * @param tenant the tenant to add
     * @return {@code true} if the tenant was added, {@code false} if it was already registered
     */
    public boolean addTenant(@Nonnull TenantMetadata tenant) {
        requireNonNull(tenant, "Tenant cannot be null");
        boolean added = tenants.putIfAbsent(tenant.tenantKey(), tenant) == null;
        if (added) {
            logger.debug("Tenant [{}] added to the directory.", tenant.tenantKey());
        }
        return added;
    }

    /**
     * Replaces the metadata of an already registered tenant, stamping it with the current time as its update moment.
     * <p>
     * If the update deactivates the tenant, subscribed listeners are notified.
     *
     * @param tenant the new metadata of the tenant
     * @return the stored metadata
     * @throws TenantNotFoundException if no tenant with the same key is registered
     */
    public TenantMetadata updateTenant(@Nonnull TenantMetadata tenant) {
        requireNonNull(tenant, "Tenant cannot be null");
        TenantKey tenantKey = tenant.tenantKey();
        TenantMetadata updated = tenant.toBuilder().updatedAt(clock.instant()).build();
        TenantMetadata stored = tenants.computeIfPresent(tenantKey, (key, current) -> updated);
        if (stored == null) {
            throw new TenantNotFoundException(tenantKey);
        }
        if (!updated.isActive()) {
            notifyUnavailable(tenantKey);
        }
        return updated;
    }

    /**
     * Marks the tenant with the given {@code tenantKey} as active.
     *
     * @param tenantKey the key of the tenant to activate
     * @return the stored metadata
     * @throws TenantNotFoundException if the tenant is not registered
     */
    public TenantMetadata activateTenant(@Nonnull TenantKey tenantKey) {
        return updateTenant(requireTenant(tenantKey).toBuilder().active(true).build());
    }

    /**
     * Marks the tenant with the given {@code tenantKey} as inactive. New connections are refused for inactive tenants,
     * and subscribed listeners are notified so existing connections can be closed.
     *
     * @param tenantKey the key of the tenant to deactivate
     * @return the stored metadata
     * @throws TenantNotFoundException if the tenant is not registered
     */
    public TenantMetadata deactivateTenant(@Nonnull TenantKey tenantKey) {
        return updateTenant(requireTenant(tenantKey).toBuilder().active(false).build());
    }

    /**
     * Removes the tenant with the given {@code tenantKey} from this directory and notifies subscribed listeners.
     *
     * @param tenantKey the key of the tenant to remove
     * @return {@code true} if the tenant was removed, {@code false} if it was not registered
     */
    public boolean removeTenant(@Nonnull TenantKey tenantKey) {
        requireNonNull(tenantKey, "Tenant key cannot be null");
        if (tenants.remove(tenantKey) != null) {
            logger.debug("Tenant [{}] removed from the directory.", tenantKey);
            notifyUnavailable(tenantKey);
            return true;
        }
        return false;
    }

    /**
     * Checks if a tenant with the given {@code tenantKey} is registered with this directory.
     *
     * @param tenantKey the key of the tenant to check
     * @return {@code true} if the tenant is registered, {@code false} otherwise
     */
    public boolean hasTenant(@Nonnull TenantKey tenantKey) {
        requireNonNull(tenantKey, "Tenant key cannot be null");
        return tenants.containsKey(tenantKey);
    }

    /**
     * Get all registered tenants, ordered by their key.
     *
     * @return the registered tenants, ordered by their key
     */
    public List<TenantMetadata> getTenants() {
        return tenants.values()
                      .stream()
                      .sorted(Comparator.comparing(TenantMetadata::tenantKey))
                      .collect(Collectors.toList());
    }

    /**
     * Subscribes the given {@code listener} to tenant removals and deactivations.
     *
     * @param listener the listener to subscribe
     * @return a {@link Registration} to unsubscribe the listener
     */
    public Registration subscribe(@Nonnull TenantDirectoryListener listener) {
        requireNonNull(listener, "Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private TenantMetadata requireTenant(TenantKey tenantKey) {
        requireNonNull(tenantKey, "Tenant key cannot be null");
        return findTenant(tenantKey).orElseThrow(() -> new TenantNotFoundException(tenantKey));
    }

    private void notifyUnavailable(TenantKey tenantKey) {
        listeners.forEach(listener -> listener.onTenantUnavailable(tenantKey));
    }
}
