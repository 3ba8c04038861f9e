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

import org.axonframework.extensions.tenantconnection.core.ConnectionFailedException;
import org.axonframework.extensions.tenantconnection.core.TenantConnection;
import org.axonframework.extensions.tenantconnection.core.TenantKey;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single slot of a {@link TenantConnectionCache} for one tenant.
 * <p>
 * An entry starts out pending, while its connection is being created by exactly one thread. Other threads requesting
 * the same tenant wait for that creation through {@link #await()}. Once the connection is open, the entry becomes
 * ready and carries an idle task that evicts it after inactivity.
 * <p>
 * All state transitions other than the creation claim happen while the cache holds the lock of this entry's key, in
 * a {@code ConcurrentHashMap#compute} call.
 */
final class CacheEntry {

    private final TenantKey key;
    private final AtomicBoolean creationClaimed = new AtomicBoolean(false);
    private final CompletableFuture<TenantConnection> creation = new CompletableFuture<>();

    private volatile TenantConnection connection;
    private volatile Instant lastAccess;
    private ScheduledFuture<?> idleTask;
    private long idleGeneration;

    CacheEntry(TenantKey key) {
        this.key = key;
    }

    TenantKey key() {
        return key;
    }

    /**
     * Claims the right to create this entry's connection. Only the first caller receives {@code true}.
     */
    boolean claimCreation() {
        return creationClaimed.compareAndSet(false, true);
    }

    boolean isReady() {
        return connection != null;
    }

    TenantConnection connection() {
        return connection;
    }

    Instant lastAccess() {
        return lastAccess;
    }

    void ready(TenantConnection connection, Instant now) {
        this.connection = connection;
        this.lastAccess = now;
    }

    void touch(Instant now) {
        this.lastAccess = now;
    }

    /**
     * Starts a new idle period. Returns the generation the next idle task should be armed for.
     */
    long nextIdleGeneration() {
        cancelIdleTask();
        return ++idleGeneration;
    }

    boolean isIdleGeneration(long generation) {
        return idleGeneration == generation;
    }

    void idleTask(ScheduledFuture<?> idleTask) {
        this.idleTask = idleTask;
    }

    void cancelIdleTask() {
        if (idleTask != null) {
            idleTask.cancel(false);
            idleTask = null;
        }
    }

    void complete(TenantConnection connection) {
        creation.complete(connection);
    }

    void fail(Throwable failure) {
        creation.completeExceptionally(failure);
    }

    /**
     * Waits for the pending creation of this entry's connection, rethrowing the creation failure to the caller.
     */
    TenantConnection await() {
        try {
            return creation.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ConnectionFailedException(key, cause);
        }
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key + ", ready=" + isReady() + ", lastAccess=" + lastAccess + '}';
    }
}
