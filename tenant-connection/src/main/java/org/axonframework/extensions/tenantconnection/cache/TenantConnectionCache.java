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

import org.axonframework.common.AxonConfigurationException;
import org.axonframework.common.AxonThreadFactory;
import org.axonframework.common.Registration;
import org.axonframework.extensions.tenantconnection.connector.BackendConnector;
import org.axonframework.extensions.tenantconnection.connector.ConnectorSettings;
import org.axonframework.extensions.tenantconnection.core.ConnectionFailedException;
import org.axonframework.extensions.tenantconnection.core.ConnectionLimitExceededException;
import org.axonframework.extensions.tenantconnection.core.DriverKind;
import org.axonframework.extensions.tenantconnection.core.TenantConnection;
import org.axonframework.extensions.tenantconnection.core.TenantContext;
import org.axonframework.extensions.tenantconnection.core.TenantDirectoryUnavailableException;
import org.axonframework.extensions.tenantconnection.core.TenantInactiveException;
import org.axonframework.extensions.tenantconnection.core.TenantKey;
import org.axonframework.extensions.tenantconnection.core.TenantMetadata;
import org.axonframework.extensions.tenantconnection.core.TenantNotFoundException;
import org.axonframework.extensions.tenantconnection.core.UnsupportedDriverException;
import org.axonframework.extensions.tenantconnection.directory.SimpleTenantDirectory;
import org.axonframework.extensions.tenantconnection.directory.TenantDirectory;
import org.axonframework.lifecycle.Phase;
import org.axonframework.lifecycle.ShutdownHandler;
import org.axonframework.lifecycle.ShutdownInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;
import static org.axonframework.common.BuilderUtils.assertNonNull;
import static org.axonframework.common.BuilderUtils.assertStrictPositive;
import static org.axonframework.common.BuilderUtils.assertThat;

/**
 * Keyed store of open {@link TenantConnection TenantConnections}, creating them on first use and closing them once
 * they have been idle for too long.
 * <p>
 * On a cache miss, the tenant's {@link TenantMetadata} is looked up in the {@link TenantDirectory} and handed to the
 * {@link BackendConnector} to open a connection. Creation is single-flight per tenant: concurrent requests for the
 * same tenant converge on one connector invocation and all receive the same connection, or the same exception.
 * Requests for different tenants never wait on one another. Failures are never cached, so every failed
 * {@link #acquire(TenantKey)} can be retried.
 * <p>
 * Every cached connection carries an idle task, which is replaced on each access. A connection that is not accessed
 * for the configured idle timeout is evicted and closed. Each idle task only evicts the entry it was armed for, so a
 * replaced task never evicts a connection that has been accessed since.
 * <p>
 * Closing connections is best-effort: failures to close are logged, but the connection is removed from the cache
 * regardless.
 * <p>
 * When caching is disabled, every {@link #acquire(TenantKey)} opens a fresh connection which the caller owns and should
 * close itself. Nothing is stored in that case.
 *
 * @since 4.9.0
 */
public class TenantConnectionCache {

    private static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    /**
     * The default maximum number of cached and in-flight connections.
     */
    public static final int DEFAULT_MAX_CONNECTIONS = 100;
    /**
     * The default time {@link #shutdown()} waits for all connections to close.
     */
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final TenantDirectory tenantDirectory;
    private final BackendConnector backendConnector;
    private final ConnectorSettings connectorSettings;
    private final boolean cachingEnabled;
    private final int maxConnections;
    private final Duration idleTimeout;
    private final Duration shutdownTimeout;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ExecutorService closeExecutor;
    private final boolean ownsCloseExecutor;
    private final Clock clock;
    private final TenantContextAssembler contextAssembler;

    private final ConcurrentHashMap<TenantKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Semaphore connectionPermits;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /**
     * Instantiate a {@link TenantConnectionCache} based on the fields contained in the {@link Builder}.
     *
     * @param builder the {@link Builder} used to instantiate a {@link TenantConnectionCache} instance
     */
    protected TenantConnectionCache(Builder builder) {
        builder.validate();
        this.tenantDirectory = builder.tenantDirectory;
        this.backendConnector = builder.backendConnector;
        this.connectorSettings = new ConnectorSettings(
                builder.driverKind, builder.connectionTimeout, builder.idleTimeout, builder.poolSize
        );
        this.cachingEnabled = builder.cachingEnabled;
        this.maxConnections = builder.maxConnections;
        this.idleTimeout = builder.idleTimeout;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler
                ? Executors.newSingleThreadScheduledExecutor(new AxonThreadFactory("TenantConnectionIdleTimer"))
                : builder.scheduler;
        this.ownsCloseExecutor = builder.closeExecutor == null;
        this.closeExecutor = ownsCloseExecutor
                ? Executors.newCachedThreadPool(new AxonThreadFactory("TenantConnectionCloser"))
                : builder.closeExecutor;
        this.clock = builder.clock;
        this.connectionPermits = new Semaphore(maxConnections);
        this.contextAssembler = new TenantContextAssembler(this);
    }

    /**
     * Instantiate a Builder to be able to create a {@link TenantConnectionCache}.
     * <p>
     * The {@link TenantDirectory} and {@link BackendConnector} are <b>hard requirements</b> and as such should be
     * provided. Caching is enabled by default, connecting to {@link DriverKind#POSTGRESQL} backends with an idle timeout
     * of {@link ConnectorSettings#DEFAULT_IDLE_TIMEOUT five minutes}.
     *
     * @return a Builder to be able to create a {@link TenantConnectionCache}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the open connection of the tenant with the given {@code tenantKey}, opening one if none is cached.
     * <p>
     * A cached connection has its idle timeout reset by this call.
     *
     * @param tenantKey the key of the tenant to return a connection for
     * @return an open connection of the tenant
     * @throws TenantNotFoundException             if the tenant is unknown to the tenant directory
     * @throws TenantInactiveException             if the tenant is not active
     * @throws TenantDirectoryUnavailableException if the tenant directory could not be consulted
     * @throws ConnectionLimitExceededException    if opening a connection would exceed the maximum number of
     *                                             connections
     * @throws ConnectionFailedException           if the backend connector failed to open a connection
     * @throws ShutdownInProgressException         if this cache is shut down
     */
    public TenantConnection acquire(TenantKey tenantKey) {
        return acquire(tenantKey, null);
    }

    /**
     * Returns the open connection of the tenant with the given textual {@code tenantId}. See
     * {@link #acquire(TenantKey)}.
     *
     * @param tenantId the textual identifier of the tenant
     * @return an open connection of the tenant
     * @throws org.axonframework.extensions.tenantconnection.core.InvalidTenantKeyException if the given
     *                                                                                      {@code tenantId} is not a
     *                                                                                      valid tenant key
     */
    public TenantConnection acquire(String tenantId) {
        return acquire(TenantKey.of(tenantId));
    }

    /**
     * Returns the {@link TenantContext} of the tenant with the given {@code tenantKey}, combining its metadata with its
     * open connection. Metadata failures take precedence over connection failures.
     *
     * @param tenantKey the key of the tenant to return the context of
     * @return the context of the tenant
     * @see TenantContextAssembler
     */
    public TenantContext acquireContext(TenantKey tenantKey) {
        return contextAssembler.assemble(tenantKey);
    }

    /**
     * Returns the {@link TenantContext} of the tenant with the given textual {@code tenantId}. See
     * {@link #acquireContext(TenantKey)}.
     *
     * @param tenantId the textual identifier of the tenant
     * @return the context of the tenant
     */
    public TenantContext acquireContext(String tenantId) {
        return acquireContext(TenantKey.of(tenantId));
    }

    /**
     * Acquires a connection, using the given {@code knownMetadata} instead of consulting the directory if a connection
     * has to be opened.
     */
    TenantConnection acquire(TenantKey tenantKey, TenantMetadata knownMetadata) {
        requireNonNull(tenantKey, "The tenant key may not be null");
        if (!cachingEnabled) {
            assertRunning();
            return openConnection(tenantKey, knownMetadata);
        }
        while (true) {
            assertRunning();
            CacheEntry entry = entries.computeIfAbsent(tenantKey, CacheEntry::new);
            if (entry.claimCreation()) {
                return create(entry, knownMetadata);
            }
            TenantConnection connection = entry.await();
            if (touch(entry)) {
                logger.debug("Using cached connection for tenant [{}].", tenantKey);
                return connection;
            }
            // evicted between creation and access, start over
        }
    }

    /**
     * Looks up the metadata of the tenant with the given {@code tenantKey}, verifying it is active.
     */
    TenantMetadata lookupActiveTenant(TenantKey tenantKey) {
        TenantMetadata metadata;
        try {
            metadata = tenantDirectory.findTenant(tenantKey)
                                      .orElseThrow(() -> new TenantNotFoundException(tenantKey));
        } catch (TenantNotFoundException | TenantDirectoryUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TenantDirectoryUnavailableException(tenantKey, e);
        }
        if (!metadata.isActive()) {
            throw new TenantInactiveException(tenantKey);
        }
        return metadata;
    }

    /**
     * Evicts the cached connection of the tenant with the given {@code tenantKey} and closes it.
     * <p>
     * This operation is idempotent. If no connection is cached, or one is still being opened, nothing happens. Failures
     * to close the connection are logged, not rethrown.
     *
     * @param tenantKey the key of the tenant to evict the connection of
     * @return {@code true} if a connection was evicted, {@code false} otherwise
     */
    public boolean release(TenantKey tenantKey) {
        requireNonNull(tenantKey, "The tenant key may not be null");
        CacheEntry evicted = evict(tenantKey, entry -> true);
        if (evicted == null) {
            return false;
        }
        logger.debug("Releasing connection of tenant [{}].", tenantKey);
        close(evicted);
        return true;
    }

    /**
     * Subscribes this cache to the given {@code directory}, so that the connection of a tenant is released as soon as
     * the tenant is removed from the directory or deactivated.
     *
     * @param directory the directory to follow
     * @return the {@link Registration} of this cache with the given {@code directory}
     */
    public Registration evictOnDirectoryChanges(SimpleTenantDirectory directory) {
        requireNonNull(directory, "The directory may not be null");
        return directory.subscribe(this::release);
    }

    /**
     * Shuts down this cache, closing all cached connections concurrently.
     * <p>
     * Pending idle tasks are cancelled before any connection is closed. This method waits for all connections to be
     * closed, or for the configured shutdown timeout to elapse, whichever comes first. Any
     * {@link #acquire(TenantKey)} invoked after shutdown fails with a {@link ShutdownInProgressException}, and any
     * connection whose creation completes after shutdown started is closed right away. Invoking this method more than
     * once has no further effect.
     */
    @ShutdownHandler(phase = Phase.EXTERNAL_CONNECTIONS)
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        List<CacheEntry> evicted = new ArrayList<>();
        for (TenantKey tenantKey : entries.keySet()) {
            CacheEntry entry = evict(tenantKey, e -> true);
            if (entry != null) {
                evicted.add(entry);
            }
        }
        logger.info("Shutting down tenant connection cache, closing {} connection(s).", evicted.size());

        CompletableFuture<?>[] closeTasks =
                evicted.stream()
                       .map(entry -> CompletableFuture.runAsync(() -> close(entry), closeExecutor))
                       .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(closeTasks).get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.info("All tenant connections closed.");
        } catch (TimeoutException e) {
            logger.warn("Timed out after {} waiting for tenant connections to close.", shutdownTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for tenant connections to close.", e);
        } catch (ExecutionException e) {
            logger.warn("Failed to close all tenant connections.", e.getCause());
        } finally {
            if (ownsScheduler) {
                scheduler.shutdownNow();
            }
            if (ownsCloseExecutor) {
                closeExecutor.shutdown();
            }
        }
    }

    /**
     * Returns a snapshot of the open, cached connections. Connections still being opened are not included.
     *
     * @return a snapshot of the open, cached connections
     */
    public ConnectionStats stats() {
        List<TenantKey> keys = entries.values()
                                      .stream()
                                      .filter(CacheEntry::isReady)
                                      .map(CacheEntry::key)
                                      .sorted()
                                      .collect(Collectors.toList());
        return new ConnectionStats(keys);
    }

    /**
     * Indicates whether an open connection of the tenant with the given {@code tenantKey} is cached.
     *
     * @param tenantKey the key of the tenant to check
     * @return {@code true} if an open connection of the tenant is cached
     */
    public boolean isCached(TenantKey tenantKey) {
        CacheEntry entry = entries.get(tenantKey);
        return entry != null && entry.isReady();
    }

    /**
     * Indicates whether {@link #shutdown()} has been invoked on this cache.
     *
     * @return {@code true} if this cache is shut down
     */
    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * The settings connections are opened with.
     *
     * @return the settings connections are opened with
     */
    public ConnectorSettings connectorSettings() {
        return connectorSettings;
    }

    private TenantConnection create(CacheEntry entry, TenantMetadata knownMetadata) {
        TenantKey tenantKey = entry.key();
        boolean permitHeld = false;
        TenantConnection connection = null;
        try {
            if (!connectionPermits.tryAcquire()) {
                throw new ConnectionLimitExceededException(tenantKey, maxConnections);
            }
            permitHeld = true;
            connection = openConnection(tenantKey, knownMetadata);
            if (!register(entry, connection)) {
                throw new ShutdownInProgressException(
                        "Connection cache shut down while opening connection for tenant [" + tenantKey + "]"
                );
            }
        } catch (Throwable failure) {
            // the pending entry never outlives a failed creation
            entries.remove(tenantKey, entry);
            entry.cancelIdleTask();
            if (connection != null) {
                closeQuietly(tenantKey, connection);
            }
            if (permitHeld) {
                connectionPermits.release();
            }
            entry.fail(failure);
            throw failure;
        }
        logger.debug("Cached connection for tenant [{}].", tenantKey);
        entry.complete(connection);
        return connection;
    }

    /**
     * Makes the given pending {@code entry} ready with the given {@code connection}, unless the entry is no longer
     * mapped or the cache is shut down.
     */
    private boolean register(CacheEntry entry, TenantConnection connection) {
        AtomicBoolean registered = new AtomicBoolean(false);
        entries.compute(entry.key(), (key, current) -> {
            if (current != entry || shutdown.get()) {
                return current == entry ? null : current;
            }
            scheduleIdleEviction(entry);
            entry.ready(connection, clock.instant());
            registered.set(true);
            return entry;
        });
        return registered.get();
    }

    private TenantConnection openConnection(TenantKey tenantKey, TenantMetadata knownMetadata) {
        TenantMetadata metadata = knownMetadata != null ? knownMetadata : lookupActiveTenant(tenantKey);
        TenantConnection connection;
        try {
            connection = backendConnector.open(metadata, connectorSettings);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionFailedException(tenantKey, e);
        } catch (Exception e) {
            throw new ConnectionFailedException(tenantKey, e);
        }
        if (connection == null || !connection.isOpen()) {
            throw new ConnectionFailedException(
                    tenantKey, "Backend connector returned no open connection for tenant [" + tenantKey + "]"
            );
        }
        logger.debug("Opened {} connection for tenant [{}].", connectorSettings.driverKind(), tenantKey);
        return connection;
    }

    /**
     * Resets the idle timeout of the given {@code entry}, provided it is still the cached entry of its tenant.
     */
    private boolean touch(CacheEntry entry) {
        AtomicBoolean alive = new AtomicBoolean(false);
        entries.computeIfPresent(entry.key(), (key, current) -> {
            if (current == entry && entry.isReady()) {
                entry.touch(clock.instant());
                scheduleIdleEviction(entry);
                alive.set(true);
            }
            return current;
        });
        return alive.get();
    }

    /**
     * Replaces the idle task of the given {@code entry}. Must be invoked while holding the lock of the entry's key.
     */
    private void scheduleIdleEviction(CacheEntry entry) {
        long generation = entry.nextIdleGeneration();
        entry.idleTask(scheduler.schedule(
                () -> evictIdle(entry, generation), idleTimeout.toMillis(), TimeUnit.MILLISECONDS
        ));
    }

    private void evictIdle(CacheEntry entry, long generation) {
        CacheEntry evicted = evict(entry.key(), current -> current == entry && entry.isIdleGeneration(generation));
        if (evicted != null) {
            logger.debug("Connection of tenant [{}] idle since [{}], closing it.",
                         evicted.key(), evicted.lastAccess());
            try {
                closeExecutor.execute(() -> close(evicted));
            } catch (RejectedExecutionException e) {
                close(evicted);
            }
        }
    }

    /**
     * Removes the ready entry of the given {@code tenantKey} if it matches the given {@code condition}, cancelling its
     * idle task. Pending entries are never removed.
     */
    private CacheEntry evict(TenantKey tenantKey, Predicate<CacheEntry> condition) {
        AtomicReference<CacheEntry> evicted = new AtomicReference<>();
        entries.computeIfPresent(tenantKey, (key, current) -> {
            if (current.isReady() && condition.test(current)) {
                current.cancelIdleTask();
                evicted.set(current);
                return null;
            }
            return current;
        });
        return evicted.get();
    }

    private void close(CacheEntry entry) {
        try {
            closeQuietly(entry.key(), entry.connection());
        } finally {
            connectionPermits.release();
        }
    }

    private void closeQuietly(TenantKey tenantKey, TenantConnection connection) {
        try {
            backendConnector.close(connection);
            logger.debug("Connection closed for tenant [{}].", tenantKey);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing connection for tenant [{}].", tenantKey, e);
        } catch (Exception e) {
            logger.warn("Failed to close connection for tenant [{}]. Removing it regardless.", tenantKey, e);
        }
    }

    private void assertRunning() {
        if (shutdown.get()) {
            throw new ShutdownInProgressException("Tenant connection cache is shut down");
        }
    }

    /**
     * Builder class to instantiate a {@link TenantConnectionCache}.
     * <p>
     * The {@link TenantDirectory} and {@link BackendConnector} are <b>hard requirements</b> and as such should be
     * provided. The {@link DriverKind} defaults to {@link DriverKind#POSTGRESQL}, caching is enabled, the maximum number
     * of connections defaults to {@value #DEFAULT_MAX_CONNECTIONS}, the connection timeout to
     * {@link ConnectorSettings#DEFAULT_CONNECTION_TIMEOUT thirty seconds} and the idle timeout to
     * {@link ConnectorSettings#DEFAULT_IDLE_TIMEOUT five minutes}.
     */
    public static class Builder {

        private TenantDirectory tenantDirectory;
        private BackendConnector backendConnector;
        private DriverKind driverKind = DriverKind.POSTGRESQL;
        private boolean cachingEnabled = true;
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private int poolSize = ConnectorSettings.DEFAULT_POOL_SIZE;
        private Duration connectionTimeout = ConnectorSettings.DEFAULT_CONNECTION_TIMEOUT;
        private Duration idleTimeout = ConnectorSettings.DEFAULT_IDLE_TIMEOUT;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        private ScheduledExecutorService scheduler;
        private ExecutorService closeExecutor;
        private Clock clock = Clock.systemUTC();

        /**
         * Sets the {@link TenantDirectory} used to look up the metadata of tenants without a cached connection.
         *
         * @param tenantDirectory the directory to look up tenant metadata in
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder tenantDirectory(TenantDirectory tenantDirectory) {
            assertNonNull(tenantDirectory, "The TenantDirectory is a hard requirement");
            this.tenantDirectory = tenantDirectory;
            return this;
        }

        /**
         * Sets the {@link BackendConnector} used to open and close tenant connections.
         *
         * @param backendConnector the connector opening and closing tenant connections
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder backendConnector(BackendConnector backendConnector) {
            assertNonNull(backendConnector, "The BackendConnector is a hard requirement");
            this.backendConnector = backendConnector;
            return this;
        }

        /**
         * Sets the {@link DriverKind} connections are opened with. Defaults to {@link DriverKind#POSTGRESQL}.
         *
         * @param driverKind the kind of backend to connect to
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder driverKind(DriverKind driverKind) {
            assertNonNull(driverKind, "The DriverKind may not be null");
            this.driverKind = driverKind;
            return this;
        }

        /**
         * Sets whether connections are cached. Defaults to {@code true}. When disabled, every acquire opens a new
         * connection, owned by the caller.
         *
         * @param cachingEnabled whether connections are cached
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder cachingEnabled(boolean cachingEnabled) {
            this.cachingEnabled = cachingEnabled;
            return this;
        }

        /**
         * Sets the maximum number of connections that may be cached or being opened at the same time. Requests that
         * need a new connection beyond this limit are rejected with a {@link ConnectionLimitExceededException}.
         * Defaults to {@value #DEFAULT_MAX_CONNECTIONS}.
         *
         * @param maxConnections the maximum number of cached connections
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder maxConnections(int maxConnections) {
            assertStrictPositive(maxConnections, "The maximum number of connections should be strictly positive");
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * Sets the number of physical connections a {@link BackendConnector} may pool per tenant. Passed to the
         * connector through the {@link ConnectorSettings}. Defaults to {@value ConnectorSettings#DEFAULT_POOL_SIZE}.
         *
         * @param poolSize the pool size per tenant connection
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder poolSize(int poolSize) {
            assertStrictPositive(poolSize, "The pool size should be strictly positive");
            this.poolSize = poolSize;
            return this;
        }

        /**
         * Sets the time a {@link BackendConnector} should wait for a connection to be established. Passed to the
         * connector through the {@link ConnectorSettings}, not enforced by the cache.
         *
         * @param connectionTimeout the time to wait for a connection to be established
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder connectionTimeout(Duration connectionTimeout) {
            assertPositiveDuration(connectionTimeout, "The connection timeout should be strictly positive");
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        /**
         * Sets the time a cached connection may remain unused before it is evicted and closed.
         *
         * @param idleTimeout the time a cached connection may remain unused
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder idleTimeout(Duration idleTimeout) {
            assertPositiveDuration(idleTimeout, "The idle timeout should be strictly positive");
            this.idleTimeout = idleTimeout;
            return this;
        }

        /**
         * Sets the time {@link #shutdown()} waits for all connections to close. Defaults to thirty seconds.
         *
         * @param shutdownTimeout the time to wait for connections to close on shutdown
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            assertPositiveDuration(shutdownTimeout, "The shutdown timeout should be strictly positive");
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        /**
         * Sets the {@link ScheduledExecutorService} running the idle tasks. If not set, the cache creates a
         * single-threaded scheduler of its own, which is stopped on {@link #shutdown()}. A provided scheduler is left
         * running.
         *
         * @param scheduler the scheduler running the idle tasks
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            assertNonNull(scheduler, "The ScheduledExecutorService may not be null");
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Sets the {@link ExecutorService} closing idle connections, and closing connections concurrently on
         * {@link #shutdown()}. If not set, the cache creates a thread pool of its own, which is stopped on shutdown. A
         * provided executor is left running.
         *
         * @param closeExecutor the executor closing evicted connections
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder closeExecutor(ExecutorService closeExecutor) {
            assertNonNull(closeExecutor, "The close ExecutorService may not be null");
            this.closeExecutor = closeExecutor;
            return this;
        }

        /**
         * Sets the {@link Clock} used to stamp the last access of cached connections. Defaults to the system UTC clock.
         *
         * @param clock the clock used to stamp the last access of connections
         * @return the current Builder instance, for fluent interfacing
         */
        public Builder clock(Clock clock) {
            assertNonNull(clock, "The Clock may not be null");
            this.clock = clock;
            return this;
        }

        /**
         * Initializes a {@link TenantConnectionCache} as specified through this Builder.
         *
         * @return a {@link TenantConnectionCache} as specified through this Builder
         */
        public TenantConnectionCache build() {
            return new TenantConnectionCache(this);
        }

        /**
         * Validates whether the fields contained in this Builder are set accordingly.
         *
         * @throws AxonConfigurationException  if one field is asserted to be incorrect according to the Builder's
         *                                     specifications
         * @throws UnsupportedDriverException if the {@link BackendConnector} does not support the {@link DriverKind}
         */
        protected void validate() {
            assertNonNull(tenantDirectory, "The TenantDirectory is a hard requirement");
            assertNonNull(backendConnector, "The BackendConnector is a hard requirement");
            if (!backendConnector.supports(driverKind)) {
                throw new UnsupportedDriverException(driverKind);
            }
        }

        private static void assertPositiveDuration(Duration duration, String exceptionMessage) {
            assertThat(duration, d -> d != null && !d.isNegative() && !d.isZero(), exceptionMessage);
        }
    }
}
