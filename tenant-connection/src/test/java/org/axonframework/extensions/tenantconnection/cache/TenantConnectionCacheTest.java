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
import org.axonframework.common.Registration;
import org.axonframework.extensions.tenantconnection.connector.BackendConnector;
import org.axonframework.extensions.tenantconnection.connector.ConnectorSettings;
import org.axonframework.extensions.tenantconnection.connector.SimpleTenantConnection;
import org.axonframework.extensions.tenantconnection.core.ConnectionFailedException;
import org.axonframework.extensions.tenantconnection.core.ConnectionLimitExceededException;
import org.axonframework.extensions.tenantconnection.core.DriverKind;
import org.axonframework.extensions.tenantconnection.core.InvalidTenantKeyException;
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
import org.axonframework.lifecycle.ShutdownInProgressException;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Test class validating the {@link TenantConnectionCache}.
 */
class TenantConnectionCacheTest {

    private static final TenantKey TENANT_1 = TenantKey.of("tenant-1");
    private static final TenantKey TENANT_2 = TenantKey.of("tenant-2");
    private static final TenantKey TENANT_3 = TenantKey.of("tenant-3");

    private SimpleTenantDirectory directory;
    private RecordingConnector connector;
    private ExecutorService workers;
    private TenantConnectionCache testSubject;

    @BeforeEach
    void setUp() {
        directory = new SimpleTenantDirectory();
        directory.addTenant(tenant(TENANT_1));
        directory.addTenant(tenant(TENANT_2));
        directory.addTenant(tenant(TENANT_3));
        connector = new RecordingConnector();
        workers = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        if (testSubject != null) {
            testSubject.shutdown();
        }
        workers.shutdownNow();
    }

    private static TenantMetadata tenant(TenantKey tenantKey) {
        return TenantMetadata.builder()
                             .tenantKey(tenantKey)
                             .host("localhost")
                             .database(tenantKey.value().replace('-', '_'))
                             .build();
    }

    private TenantConnectionCache.Builder cacheBuilder() {
        return TenantConnectionCache.builder()
                                    .tenantDirectory(directory)
                                    .backendConnector(connector);
    }

    @Test
    void acquireOpensConnectionOnFirstUseAndCachesIt() {
        testSubject = cacheBuilder().build();

        TenantConnection first = testSubject.acquire(TENANT_1);
        TenantConnection second = testSubject.acquire(TENANT_1);

        assertSame(first, second);
        assertTrue(first.isOpen());
        assertEquals(TENANT_1, first.tenantKey());
        assertEquals(1, connector.openCount.get());
        assertTrue(testSubject.isCached(TENANT_1));
        assertEquals(List.of(TENANT_1), testSubject.stats().keys());
    }

    @Test
    void acquireByTenantIdValidatesTheKey() {
        testSubject = cacheBuilder().build();

        assertThrows(InvalidTenantKeyException.class, () -> testSubject.acquire("not a key"));
        assertEquals(0, connector.openCount.get());
        assertEquals(TENANT_2, testSubject.acquire("tenant-2").tenantKey());
    }

    @Test
    void connectorReceivesConfiguredSettings() {
        testSubject = cacheBuilder().driverKind(DriverKind.MYSQL)
                                    .poolSize(3)
                                    .connectionTimeout(Duration.ofSeconds(5))
                                    .idleTimeout(Duration.ofMinutes(2))
                                    .build();

        testSubject.acquire(TENANT_1);

        assertEquals(new ConnectorSettings(DriverKind.MYSQL, Duration.ofSeconds(5), Duration.ofMinutes(2), 3),
                     connector.lastSettings);
    }

    @Test
    void concurrentColdAcquireOpensSingleConnection() throws Exception {
        CountDownLatch openStarted = new CountDownLatch(1);
        CountDownLatch mayOpen = new CountDownLatch(1);
        connector.beforeOpen = tenantKey -> {
            openStarted.countDown();
            mayOpen.await();
        };
        testSubject = cacheBuilder().build();

        List<Future<TenantConnection>> results = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            results.add(workers.submit(() -> testSubject.acquire(TENANT_1)));
        }
        assertTrue(openStarted.await(5, TimeUnit.SECONDS));
        assertFalse(testSubject.isCached(TENANT_1));
        mayOpen.countDown();

        Set<TenantConnection> distinct = ConcurrentHashMap.newKeySet();
        for (Future<TenantConnection> result : results) {
            distinct.add(result.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, distinct.size());
        assertEquals(1, connector.openCount.get());
        assertEquals(1, testSubject.stats().count());
    }

    @Test
    void concurrentWaitersReceiveTheCreationFailure() throws Exception {
        CountDownLatch openStarted = new CountDownLatch(1);
        CountDownLatch mayOpen = new CountDownLatch(1);
        connector.beforeOpen = tenantKey -> {
            openStarted.countDown();
            mayOpen.await();
            throw new IllegalStateException("backend down");
        };
        testSubject = cacheBuilder().build();

        List<Future<TenantConnection>> results = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            results.add(workers.submit(() -> testSubject.acquire(TENANT_1)));
        }
        assertTrue(openStarted.await(5, TimeUnit.SECONDS));
        mayOpen.countDown();

        for (Future<TenantConnection> result : results) {
            Exception failure = assertThrows(Exception.class, () -> result.get(5, TimeUnit.SECONDS));
            assertInstanceOf(ConnectionFailedException.class, failure.getCause());
        }
        assertFalse(testSubject.isCached(TENANT_1));
        assertEquals(0, testSubject.stats().count());
    }

    @Test
    void slowCreationDoesNotBlockOtherTenants() throws Exception {
        CountDownLatch mayOpenTenant1 = new CountDownLatch(1);
        connector.beforeOpen = tenantKey -> {
            if (TENANT_1.equals(tenantKey)) {
                mayOpenTenant1.await();
            }
        };
        testSubject = cacheBuilder().build();

        Future<TenantConnection> slow = workers.submit(() -> testSubject.acquire(TENANT_1));
        TenantConnection other = workers.submit(() -> testSubject.acquire(TENANT_2)).get(5, TimeUnit.SECONDS);

        assertTrue(other.isOpen());
        assertFalse(slow.isDone());
        mayOpenTenant1.countDown();
        assertTrue(slow.get(5, TimeUnit.SECONDS).isOpen());
    }

    @Test
    void failedCreationIsNotCached() {
        connector.failuresRemaining.set(1);
        testSubject = cacheBuilder().build();

        ConnectionFailedException failure =
                assertThrows(ConnectionFailedException.class, () -> testSubject.acquire(TENANT_1));

        assertEquals(TENANT_1, failure.tenantKey());
        assertInstanceOf(IllegalStateException.class, failure.getCause());
        assertFalse(testSubject.isCached(TENANT_1));
        assertTrue(testSubject.acquire(TENANT_1).isOpen());
        assertEquals(2, connector.openCount.get());
    }

    @Test
    void unknownTenantIsRejectedWithoutOpeningConnection() {
        testSubject = cacheBuilder().build();

        TenantNotFoundException failure =
                assertThrows(TenantNotFoundException.class, () -> testSubject.acquire(TenantKey.of("unknown")));

        assertEquals(TenantKey.of("unknown"), failure.tenantKey());
        assertEquals(0, connector.openCount.get());
        assertEquals(0, testSubject.stats().count());
    }

    @Test
    void inactiveTenantIsRejectedWithoutOpeningConnection() {
        directory.deactivateTenant(TENANT_1);
        testSubject = cacheBuilder().build();

        assertThrows(TenantInactiveException.class, () -> testSubject.acquire(TENANT_1));
        assertEquals(0, connector.openCount.get());
        assertFalse(testSubject.isCached(TENANT_1));
    }

    @Test
    void directoryFailureIsReportedAsUnavailable() {
        TenantDirectory failingDirectory = mock(TenantDirectory.class);
        IllegalStateException cause = new IllegalStateException("registry offline");
        when(failingDirectory.findTenant(any())).thenThrow(cause);
        testSubject = TenantConnectionCache.builder()
                                           .tenantDirectory(failingDirectory)
                                           .backendConnector(connector)
                                           .build();

        TenantDirectoryUnavailableException failure =
                assertThrows(TenantDirectoryUnavailableException.class, () -> testSubject.acquire(TENANT_1));

        assertSame(cause, failure.getCause());
        assertEquals(TENANT_1, failure.tenantKey());
        assertEquals(0, connector.openCount.get());
    }

    @Test
    void nullConnectionIsTreatedAsFailure() {
        testSubject = TenantConnectionCache.builder()
                                           .tenantDirectory(directory)
                                           .backendConnector((metadata, settings) -> null)
                                           .build();

        assertThrows(ConnectionFailedException.class, () -> testSubject.acquire(TENANT_1));
        assertFalse(testSubject.isCached(TENANT_1));
    }

    @Test
    void closedConnectionIsTreatedAsFailure() {
        testSubject = TenantConnectionCache.builder()
                                           .tenantDirectory(directory)
                                           .backendConnector((metadata, settings) -> {
                                               TenantConnection connection = new SimpleTenantConnection(
                                                       metadata.tenantKey(), settings.driverKind(), "backend",
                                                       () -> {
                                                       });
                                               connection.close();
                                               return connection;
                                           })
                                           .build();

        assertThrows(ConnectionFailedException.class, () -> testSubject.acquire(TENANT_1));
    }

    @Test
    void connectionLimitRejectsNewConnections() {
        testSubject = cacheBuilder().maxConnections(1).build();
        testSubject.acquire(TENANT_1);

        ConnectionLimitExceededException failure =
                assertThrows(ConnectionLimitExceededException.class, () -> testSubject.acquire(TENANT_2));

        assertEquals(1, failure.maxConnections());
        assertEquals(TENANT_2, failure.tenantKey());
        assertSame(testSubject.acquire(TENANT_1), testSubject.acquire(TENANT_1));

        assertTrue(testSubject.release(TENANT_1));
        assertTrue(testSubject.acquire(TENANT_2).isOpen());
    }

    @Test
    void creationFailingWithAnErrorCanBeRetried() throws Exception {
        AtomicBoolean firstOpen = new AtomicBoolean(true);
        connector.beforeOpen = tenantKey -> {
            if (firstOpen.compareAndSet(true, false)) {
                throw new NoClassDefFoundError("org/example/MissingDriver");
            }
        };
        testSubject = cacheBuilder().maxConnections(1).build();

        assertThrows(NoClassDefFoundError.class, () -> testSubject.acquire(TENANT_1));
        assertFalse(testSubject.isCached(TENANT_1));

        Future<TenantConnection> retry = workers.submit(() -> testSubject.acquire(TENANT_1));
        assertTrue(retry.get(5, TimeUnit.SECONDS).isOpen());
        assertEquals(2, connector.openCount.get());
    }

    @Test
    void rejectedIdleTimerClosesTheNewConnection() throws Exception {
        ScheduledExecutorService stoppedScheduler = Executors.newSingleThreadScheduledExecutor();
        stoppedScheduler.shutdown();
        testSubject = cacheBuilder().scheduler(stoppedScheduler).maxConnections(1).build();

        assertThrows(RejectedExecutionException.class, () -> testSubject.acquire(TENANT_1));
        assertFalse(connector.opened.get(0).isOpen());
        assertFalse(testSubject.isCached(TENANT_1));

        Future<TenantConnection> retry = workers.submit(() -> testSubject.acquire(TENANT_1));
        ExecutionException failure =
                assertThrows(ExecutionException.class, () -> retry.get(5, TimeUnit.SECONDS));
        assertInstanceOf(RejectedExecutionException.class, failure.getCause());
        assertEquals(2, connector.openCount.get());
        assertEquals(2, connector.closeCount.get());
    }

    @Test
    void failedCreationReturnsItsConnectionPermit() {
        connector.failuresRemaining.set(1);
        testSubject = cacheBuilder().maxConnections(1).build();

        assertThrows(ConnectionFailedException.class, () -> testSubject.acquire(TENANT_1));

        assertTrue(testSubject.acquire(TENANT_2).isOpen());
    }

    @Test
    void idleConnectionIsEvictedAndClosed() {
        testSubject = cacheBuilder().idleTimeout(Duration.ofMillis(100)).build();

        TenantConnection connection = testSubject.acquire(TENANT_1);

        await().atMost(Duration.ofSeconds(5)).until(() -> !testSubject.isCached(TENANT_1));
        await().atMost(Duration.ofSeconds(5)).until(() -> !connection.isOpen());
        assertEquals(0, testSubject.stats().count());
        assertNotSame(connection, testSubject.acquire(TENANT_1));
    }

    @Test
    void regularAccessKeepsConnectionAliveUntilItGoesIdle() throws Exception {
        testSubject = cacheBuilder().idleTimeout(Duration.ofMillis(300)).build();

        TenantConnection connection = testSubject.acquire(TENANT_1);
        for (int i = 0; i < 6; i++) {
            Thread.sleep(100);
            assertSame(connection, testSubject.acquire(TENANT_1));
        }
        assertTrue(connection.isOpen());

        await().atLeast(Duration.ofMillis(100))
               .atMost(Duration.ofSeconds(5))
               .until(() -> !connection.isOpen());
        assertFalse(testSubject.isCached(TENANT_1));
        assertEquals(1, connector.openCount.get());
    }

    @Test
    void slowIdleCloseDoesNotDelayOtherEvictions() throws Exception {
        CountDownLatch closeStarted = new CountDownLatch(1);
        CountDownLatch mayClose = new CountDownLatch(1);
        AtomicBoolean firstClose = new AtomicBoolean(true);
        connector.beforeClose = () -> {
            if (firstClose.compareAndSet(true, false)) {
                closeStarted.countDown();
                mayClose.await();
            }
        };
        testSubject = cacheBuilder().idleTimeout(Duration.ofMillis(100)).build();
        try {
            testSubject.acquire(TENANT_1);
            assertTrue(closeStarted.await(5, TimeUnit.SECONDS));

            TenantConnection other = testSubject.acquire(TENANT_2);

            await().atMost(Duration.ofSeconds(5)).until(() -> !other.isOpen());
            assertFalse(testSubject.isCached(TENANT_2));
        } finally {
            mayClose.countDown();
        }
    }

    @Test
    void accessResetsIdleTimer() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        when(scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class)))
                .thenAnswer(invocation -> mock(ScheduledFuture.class));
        testSubject = cacheBuilder().scheduler(scheduler).idleTimeout(Duration.ofSeconds(10)).build();

        TenantConnection connection = testSubject.acquire(TENANT_1);
        testSubject.acquire(TENANT_1);

        ArgumentCaptor<Runnable> idleTasks = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler, times(2)).schedule(idleTasks.capture(), eq(10_000L), eq(TimeUnit.MILLISECONDS));
        Runnable expired = idleTasks.getAllValues().get(0);
        Runnable current = idleTasks.getAllValues().get(1);

        expired.run();
        assertTrue(testSubject.isCached(TENANT_1));
        assertTrue(connection.isOpen());

        current.run();
        assertFalse(testSubject.isCached(TENANT_1));
        await().atMost(Duration.ofSeconds(5)).until(() -> !connection.isOpen());
        assertEquals(1, connector.closeCount.get());

        current.run();
        assertEquals(1, connector.closeCount.get());
    }

    @Test
    void idleTaskOfReleasedConnectionDoesNotEvictItsSuccessor() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        when(scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class)))
                .thenAnswer(invocation -> mock(ScheduledFuture.class));
        testSubject = cacheBuilder().scheduler(scheduler).build();

        testSubject.acquire(TENANT_1);
        testSubject.release(TENANT_1);
        TenantConnection successor = testSubject.acquire(TENANT_1);

        ArgumentCaptor<Runnable> idleTasks = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler, times(2)).schedule(idleTasks.capture(), anyLong(), any(TimeUnit.class));
        idleTasks.getAllValues().get(0).run();

        assertTrue(testSubject.isCached(TENANT_1));
        assertTrue(successor.isOpen());
    }

    @Test
    void releaseIsIdempotent() {
        testSubject = cacheBuilder().build();
        TenantConnection connection = testSubject.acquire(TENANT_1);

        assertTrue(testSubject.release(TENANT_1));
        assertFalse(testSubject.release(TENANT_1));
        assertFalse(testSubject.release(TENANT_2));

        assertFalse(connection.isOpen());
        assertEquals(1, connector.closeCount.get());
        assertFalse(testSubject.isCached(TENANT_1));
    }

    @Test
    void releaseSwallowsCloseFailures() {
        connector.failOnClose = true;
        testSubject = cacheBuilder().build();
        testSubject.acquire(TENANT_1);

        assertTrue(testSubject.release(TENANT_1));

        assertFalse(testSubject.isCached(TENANT_1));
    }

    @Test
    void releaseDuringCreationLeavesNewConnectionCached() throws Exception {
        CountDownLatch openStarted = new CountDownLatch(1);
        CountDownLatch mayOpen = new CountDownLatch(1);
        connector.beforeOpen = tenantKey -> {
            openStarted.countDown();
            mayOpen.await();
        };
        testSubject = cacheBuilder().build();

        Future<TenantConnection> creation = workers.submit(() -> testSubject.acquire(TENANT_1));
        assertTrue(openStarted.await(5, TimeUnit.SECONDS));

        assertFalse(testSubject.release(TENANT_1));
        mayOpen.countDown();

        TenantConnection connection = creation.get(5, TimeUnit.SECONDS);
        assertTrue(connection.isOpen());
        assertTrue(testSubject.isCached(TENANT_1));
    }

    @Test
    void directoryChangesEvictCachedConnections() {
        testSubject = cacheBuilder().build();
        Registration registration = testSubject.evictOnDirectoryChanges(directory);
        TenantConnection first = testSubject.acquire(TENANT_1);
        TenantConnection second = testSubject.acquire(TENANT_2);

        directory.deactivateTenant(TENANT_1);
        directory.removeTenant(TENANT_2);

        assertFalse(first.isOpen());
        assertFalse(second.isOpen());
        assertEquals(0, testSubject.stats().count());
        assertThrows(TenantInactiveException.class, () -> testSubject.acquire(TENANT_1));

        registration.cancel();
        TenantConnection third = testSubject.acquire(TENANT_3);
        directory.removeTenant(TENANT_3);
        assertTrue(third.isOpen());
    }

    @Test
    void statsListsCachedTenantsInOrder() {
        testSubject = cacheBuilder().build();

        testSubject.acquire(TENANT_3);
        testSubject.acquire(TENANT_1);

        ConnectionStats result = testSubject.stats();
        assertEquals(2, result.count());
        assertEquals(List.of(TENANT_1, TENANT_3), result.keys());
        assertTrue(result.contains(TENANT_3));
        assertFalse(result.contains(TENANT_2));
    }

    @Test
    void shutdownClosesAllConnections() {
        testSubject = cacheBuilder().build();
        List<TenantConnection> connections = List.of(
                testSubject.acquire(TENANT_1), testSubject.acquire(TENANT_2), testSubject.acquire(TENANT_3)
        );

        testSubject.shutdown();

        connections.forEach(connection -> assertFalse(connection.isOpen()));
        assertEquals(3, connector.closeCount.get());
        assertEquals(0, testSubject.stats().count());
        assertTrue(testSubject.isShutdown());
    }

    @Test
    void shutdownCompletesDespiteCloseFailures() {
        connector.failOnClose = true;
        testSubject = cacheBuilder().build();
        testSubject.acquire(TENANT_1);
        testSubject.acquire(TENANT_2);

        assertDoesNotThrow(testSubject::shutdown);

        assertEquals(0, testSubject.stats().count());
    }

    @Test
    void shutdownGivesUpAfterTimeout() {
        CountDownLatch mayClose = new CountDownLatch(1);
        connector.beforeClose = mayClose::await;
        testSubject = cacheBuilder().shutdownTimeout(Duration.ofMillis(100)).build();
        testSubject.acquire(TENANT_1);

        long start = System.nanoTime();
        testSubject.shutdown();

        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(5)) < 0);
        assertEquals(0, testSubject.stats().count());
        mayClose.countDown();
    }

    @Test
    void shutdownIsIdempotent() {
        testSubject = cacheBuilder().build();
        testSubject.acquire(TENANT_1);

        testSubject.shutdown();
        testSubject.shutdown();

        assertEquals(1, connector.closeCount.get());
    }

    @Test
    void acquireAfterShutdownIsRejected() {
        testSubject = cacheBuilder().build();
        testSubject.shutdown();

        assertThrows(ShutdownInProgressException.class, () -> testSubject.acquire(TENANT_1));
        assertEquals(0, connector.openCount.get());
    }

    @Test
    void creationCompletingAfterShutdownIsClosed() throws Exception {
        CountDownLatch openStarted = new CountDownLatch(1);
        CountDownLatch mayOpen = new CountDownLatch(1);
        connector.beforeOpen = tenantKey -> {
            openStarted.countDown();
            mayOpen.await();
        };
        testSubject = cacheBuilder().build();

        Future<TenantConnection> creation = workers.submit(() -> testSubject.acquire(TENANT_1));
        assertTrue(openStarted.await(5, TimeUnit.SECONDS));
        testSubject.shutdown();
        mayOpen.countDown();

        Exception failure = assertThrows(Exception.class, () -> creation.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ShutdownInProgressException.class, failure.getCause());
        assertEquals(1, connector.closeCount.get());
        assertFalse(connector.opened.get(0).isOpen());
        assertFalse(testSubject.isCached(TENANT_1));
    }

    @Test
    void providedExecutorsAreLeftRunning() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        ExecutorService closeExecutor = Executors.newSingleThreadExecutor();
        try {
            testSubject = cacheBuilder().scheduler(scheduler).closeExecutor(closeExecutor).build();
            testSubject.acquire(TENANT_1);

            testSubject.shutdown();

            assertFalse(scheduler.isShutdown());
            assertFalse(closeExecutor.isShutdown());
            assertEquals(1, connector.closeCount.get());
        } finally {
            scheduler.shutdownNow();
            closeExecutor.shutdownNow();
        }
    }

    @Test
    void disabledCachingOpensFreshConnectionEveryTime() {
        testSubject = cacheBuilder().cachingEnabled(false).build();

        TenantConnection first = testSubject.acquire(TENANT_1);
        TenantConnection second = testSubject.acquire(TENANT_1);

        assertNotSame(first, second);
        assertEquals(2, connector.openCount.get());
        assertFalse(testSubject.isCached(TENANT_1));
        assertEquals(0, testSubject.stats().count());
        assertFalse(testSubject.release(TENANT_1));
    }

    @Test
    void disabledCachingStillValidatesTenants() {
        directory.deactivateTenant(TENANT_1);
        testSubject = cacheBuilder().cachingEnabled(false).build();

        assertThrows(TenantInactiveException.class, () -> testSubject.acquire(TENANT_1));
        assertThrows(TenantNotFoundException.class, () -> testSubject.acquire(TenantKey.of("unknown")));
    }

    @Test
    void buildRejectsMissingHardRequirements() {
        assertThrows(AxonConfigurationException.class,
                     () -> TenantConnectionCache.builder().backendConnector(connector).build());
        assertThrows(AxonConfigurationException.class,
                     () -> TenantConnectionCache.builder().tenantDirectory(directory).build());
    }

    @Test
    void buildRejectsInvalidSettings() {
        TenantConnectionCache.Builder builder = TenantConnectionCache.builder();

        assertThrows(AxonConfigurationException.class, () -> builder.idleTimeout(Duration.ZERO));
        assertThrows(AxonConfigurationException.class, () -> builder.idleTimeout(Duration.ofSeconds(-1)));
        assertThrows(AxonConfigurationException.class, () -> builder.maxConnections(0));
        assertThrows(AxonConfigurationException.class, () -> builder.poolSize(0));
    }

    @Test
    void buildRejectsDriverUnsupportedByConnector() {
        BackendConnector sqlOnly = new BackendConnector() {
            @Override
            public TenantConnection open(TenantMetadata metadata, ConnectorSettings settings) {
                throw new UnsupportedOperationException();
            }

            @Override
            public boolean supports(DriverKind driverKind) {
                return driverKind.isSql();
            }
        };

        UnsupportedDriverException failure = assertThrows(UnsupportedDriverException.class, () ->
                TenantConnectionCache.builder()
                                     .tenantDirectory(directory)
                                     .backendConnector(sqlOnly)
                                     .driverKind(DriverKind.MONGODB)
                                     .build());
        assertEquals("MONGODB", failure.driver());
    }

    @Test
    void acquireContextCombinesMetadataAndConnection() {
        testSubject = cacheBuilder().build();

        TenantContext result = testSubject.acquireContext("tenant-1");

        assertEquals(TENANT_1, result.tenantKey());
        assertEquals("tenant_1", result.metadata().database());
        assertSame(testSubject.acquire(TENANT_1), result.connection());
        assertEquals("backend-tenant-1", result.connection(String.class));
    }

    /**
     * Connector recording every open and close, with hooks to block or fail them.
     */
    private static class RecordingConnector implements BackendConnector {

        private final AtomicInteger openCount = new AtomicInteger();
        private final AtomicInteger closeCount = new AtomicInteger();
        private final AtomicInteger failuresRemaining = new AtomicInteger();
        private final List<TenantConnection> opened = new CopyOnWriteArrayList<>();
        private volatile OpenHook beforeOpen = tenantKey -> {
        };
        private volatile Hook beforeClose = () -> {
        };
        private volatile boolean failOnClose;
        private volatile ConnectorSettings lastSettings;

        @Override
        public TenantConnection open(TenantMetadata metadata, ConnectorSettings settings) throws Exception {
            openCount.incrementAndGet();
            lastSettings = settings;
            beforeOpen.run(metadata.tenantKey());
            if (failuresRemaining.getAndUpdate(remaining -> Math.max(0, remaining - 1)) > 0) {
                throw new IllegalStateException("backend down");
            }
            TenantConnection connection = new SimpleTenantConnection(
                    metadata.tenantKey(), settings.driverKind(), "backend-" + metadata.tenantKey().value(),
                    () -> {
                    }
            );
            opened.add(connection);
            return connection;
        }

        @Override
        public void close(TenantConnection connection) throws Exception {
            closeCount.incrementAndGet();
            connection.close();
            beforeClose.run();
            if (failOnClose) {
                throw new IllegalStateException("close failed");
            }
        }
    }

    @FunctionalInterface
    private interface Hook {

        void run() throws Exception;
    }

    @FunctionalInterface
    private interface OpenHook {

        void run(TenantKey tenantKey) throws Exception;
    }
}
