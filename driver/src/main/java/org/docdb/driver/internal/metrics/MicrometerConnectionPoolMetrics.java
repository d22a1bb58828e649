/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.docdb.driver.internal.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;
import org.docdb.driver.ConnectionPoolMetrics;
import org.docdb.driver.ServerAddress;

/**
 * Meters of one connection pool, all tagged with the address of the pool's server.
 * <p>
 * Pool sizes are read from the pool when the registry is scraped, counts of in-flight opens and checkouts are kept
 * here. Durations of opens, checkouts and connection usage are recorded by timers.
 */
final class MicrometerConnectionPoolMetrics implements ConnectionPoolMetricsListener, ConnectionPoolMetrics {
    public static final String PREFIX = "docdb.driver.connections";
    public static final String IN_USE = PREFIX + ".in.use";
    public static final String IDLE = PREFIX + ".idle";
    public static final String CREATING = PREFIX + ".creating";
    public static final String FAILED = PREFIX + ".failed";
    public static final String CLOSED = PREFIX + ".closed";
    public static final String ACQUIRING = PREFIX + ".acquiring";
    public static final String ACQUISITION_TIMEOUT = PREFIX + ".acquisition.timeout";
    public static final String ACQUISITION = PREFIX + ".acquisition";
    public static final String CREATION = PREFIX + ".creation";
    public static final String USAGE = PREFIX + ".usage";

    private static final String ADDRESS_TAG = "address";

    private final String id;
    private final IntSupplier inUse;
    private final IntSupplier idle;
    private final MeterRegistry registry;

    private final AtomicInteger opening = new AtomicInteger();
    private final AtomicInteger checkingOut = new AtomicInteger();
    private final Counter openFailures;
    private final Counter destroyed;
    private final Counter checkoutTimeouts;
    private final Timer openTimer;
    private final Timer checkoutTimer;
    private final Timer usageTimer;
    private final List<Meter> meters;

    MicrometerConnectionPoolMetrics(
            String poolId, ServerAddress address, IntSupplier inUse, IntSupplier idle, MeterRegistry registry) {
        this.id = Objects.requireNonNull(poolId);
        this.inUse = Objects.requireNonNull(inUse);
        this.idle = Objects.requireNonNull(idle);
        this.registry = Objects.requireNonNull(registry);
        var tags = Tags.of(ADDRESS_TAG, address.toString());

        openFailures = Counter.builder(FAILED)
                .description("Connections that failed to open or to authenticate")
                .tags(tags)
                .register(registry);
        destroyed = Counter.builder(CLOSED)
                .description("Connections closed by the pool")
                .tags(tags)
                .register(registry);
        checkoutTimeouts = Counter.builder(ACQUISITION_TIMEOUT)
                .description("Checkouts that gave up on an exhausted pool")
                .tags(tags)
                .register(registry);
        openTimer = Timer.builder(CREATION).tags(tags).register(registry);
        checkoutTimer = Timer.builder(ACQUISITION).tags(tags).register(registry);
        usageTimer = Timer.builder(USAGE).tags(tags).register(registry);

        meters = List.of(
                Gauge.builder(IN_USE, inUse, IntSupplier::getAsInt).tags(tags).register(registry),
                Gauge.builder(IDLE, idle, IntSupplier::getAsInt).tags(tags).register(registry),
                Gauge.builder(CREATING, opening, AtomicInteger::get).tags(tags).register(registry),
                Gauge.builder(ACQUIRING, checkingOut, AtomicInteger::get).tags(tags).register(registry),
                openFailures,
                destroyed,
                checkoutTimeouts,
                openTimer,
                checkoutTimer,
                usageTimer);
    }

    @Override
    public void beforeOpening(ListenerEvent<?> openEvent) {
        opening.incrementAndGet();
        openEvent.start();
    }

    @Override
    public void afterOpened(ListenerEvent<?> openEvent) {
        opening.decrementAndGet();
        stop(openEvent, openTimer);
    }

    @Override
    public void afterFailedToOpen() {
        opening.decrementAndGet();
        openFailures.increment();
    }

    @Override
    public void afterDestroyed() {
        destroyed.increment();
    }

    @Override
    public void beforeCheckout(ListenerEvent<?> checkoutEvent) {
        checkingOut.incrementAndGet();
        checkoutEvent.start();
    }

    @Override
    public void afterCheckout() {
        checkingOut.decrementAndGet();
    }

    @Override
    public void afterCheckedOut(ListenerEvent<?> checkoutEvent) {
        stop(checkoutEvent, checkoutTimer);
    }

    @Override
    public void afterCheckoutTimedOut() {
        checkoutTimeouts.increment();
    }

    @Override
    public void connectionCheckedOut(ListenerEvent<?> inUseEvent) {
        inUseEvent.start();
    }

    @Override
    public void connectionCheckedIn(ListenerEvent<?> inUseEvent) {
        stop(inUseEvent, usageTimer);
    }

    void unregister() {
        meters.forEach(registry::remove);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public int inUse() {
        return inUse.getAsInt();
    }

    @Override
    public int idle() {
        return idle.getAsInt();
    }

    @Override
    public int creating() {
        return opening.get();
    }

    @Override
    public long created() {
        return openTimer.count();
    }

    @Override
    public long failedToCreate() {
        return (long) openFailures.count();
    }

    @Override
    public long closed() {
        return (long) destroyed.count();
    }

    @Override
    public int acquiring() {
        return checkingOut.get();
    }

    @Override
    public long acquired() {
        return checkoutTimer.count();
    }

    @Override
    public long timedOutToAcquire() {
        return (long) checkoutTimeouts.count();
    }

    @Override
    public long totalAcquisitionTime() {
        return (long) checkoutTimer.totalTime(TimeUnit.MILLISECONDS);
    }

    @Override
    public long totalConnectionTime() {
        return (long) openTimer.totalTime(TimeUnit.MILLISECONDS);
    }

    @Override
    public long totalInUseTime() {
        return (long) usageTimer.totalTime(TimeUnit.MILLISECONDS);
    }

    @Override
    public long totalInUseCount() {
        return usageTimer.count();
    }

    @Override
    public String toString() {
        return String.format(
                "%s=[inUse=%d, idle=%d, opening=%d, opened=%d, failedToOpen=%d, closed=%d, checkingOut=%d, "
                        + "checkedOut=%d, checkoutTimeouts=%d]",
                id,
                inUse(),
                idle(),
                creating(),
                created(),
                failedToCreate(),
                closed(),
                acquiring(),
                acquired(),
                timedOutToAcquire());
    }

    private static void stop(ListenerEvent<?> event, Timer timer) {
        if (event instanceof MicrometerTimerListenerEvent timerEvent && timerEvent.getSample() != null) {
            timerEvent.getSample().stop(timer);
        }
    }
}
