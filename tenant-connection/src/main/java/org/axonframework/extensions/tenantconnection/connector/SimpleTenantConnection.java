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
package org.axonframework.extensions.tenantconnection.connector;

import org.axonframework.extensions.tenantconnection.core.DriverKind;
import org.axonframework.extensions.tenantconnection.core.TenantConnection;
import org.axonframework.extensions.tenantconnection.core.TenantKey;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link TenantConnection} wrapping an arbitrary backend object together with the action closing it.
 * <p>
 * The close action is invoked at most once, regardless of how often {@link #close()} is called. If the close action
 * fails, the connection is still regarded as closed.
 *
 * @since 4.9.0
 */
public class SimpleTenantConnection implements TenantConnection {

    private final TenantKey tenantKey;
    private final DriverKind driverKind;
    private final Object backend;
    private final CloseAction closeAction;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Construct a {@link SimpleTenantConnection}.
     *
     * @param tenantKey   the key of the tenant the connection belongs to
     * @param driverKind  the kind of backend of the connection
     * @param backend     the backend object, returned by {@link #unwrap(Class)}
     * @param closeAction the action releasing the {@code backend}
     */
    public SimpleTenantConnection(TenantKey tenantKey,
                                  DriverKind driverKind,
                                  Object backend,
                                  CloseAction closeAction) {
        this.tenantKey = Objects.requireNonNull(tenantKey, "The tenant key may not be null");
        this.driverKind = Objects.requireNonNull(driverKind, "The driver kind may not be null");
        this.backend = Objects.requireNonNull(backend, "The backend may not be null");
        this.closeAction = Objects.requireNonNull(closeAction, "The close action may not be null");
    }

    @Override
    public TenantKey tenantKey() {
        return tenantKey;
    }

    @Override
    public DriverKind driverKind() {
        return driverKind;
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public <T> T unwrap(Class<T> type) {
        if (!isWrapperFor(type)) {
            throw new IllegalArgumentException(
                    "Connection of tenant [" + tenantKey + "] wraps a " + backend.getClass().getName()
                            + ", which is not a " + type.getName()
            );
        }
        return type.cast(backend);
    }

    @Override
    public boolean isWrapperFor(Class<?> type) {
        return type.isInstance(backend);
    }

    @Override
    public void close() throws Exception {
        if (closed.compareAndSet(false, true)) {
            closeAction.close();
        }
    }

    @Override
    public String toString() {
        return "SimpleTenantConnection{" +
                "tenantKey=" + tenantKey +
                ", driverKind=" + driverKind +
                ", open=" + isOpen() +
                '}';
    }

    /**
     * Action releasing the resources of a backend object.
     */
    @FunctionalInterface
    public interface CloseAction {

        /**
         * Releases the backend resources.
         *
         * @throws Exception if releasing fails
         */
        void close() throws Exception;
    }
}
