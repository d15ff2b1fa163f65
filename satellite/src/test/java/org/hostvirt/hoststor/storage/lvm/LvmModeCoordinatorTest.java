package org.hostvirt.hoststor.storage.lvm;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.hostvirt.ImplementationError;
import org.hostvirt.hoststor.storage.StorageException;
import org.hostvirt.hoststor.testutils.FakeDeviceView;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class LvmModeCoordinatorTest
{
    private static final long WAIT_MS = 5000;
    private static final long BLOCKED_CHECK_MS = 200;

    private LvmCommandCache cache;
    private LvmModeCoordinator coordinator;
    private ExecutorService executor;

    @Before
    public void setUp()
    {
        LvmSettings settings = LvmSettings.builder().build();
        cache = new LvmCommandCache(settings);
        coordinator = new LvmModeCoordinator(cache, settings);
        executor = Executors.newCachedThreadPool();
    }

    @After
    public void tearDown()
    {
        executor.shutdownNow();
    }

    @Test
    public void initialModeFromSettings()
    {
        LvmSettings settings = LvmSettings.builder().initialMode(LockingMode.SHARED).build();
        assertEquals(LockingMode.SHARED, new LvmModeCoordinator(cache, settings).getMode());
        assertEquals(LockingMode.EXCLUSIVE, coordinator.getMode());
    }

    @Test
    public void enterAndLeaveCount() throws Exception
    {
        assertEquals(LockingMode.EXCLUSIVE, coordinator.enter());
        assertEquals(LockingMode.EXCLUSIVE, coordinator.enter());
        assertEquals(2, coordinator.getInFlightCount());
        coordinator.leave();
        coordinator.leave();
        assertEquals(0, coordinator.getInFlightCount());
    }

    @Test
    public void leaveWithoutEnter()
    {
        assertThatThrownBy(coordinator::leave).isInstanceOf(ImplementationError.class);
    }

    @Test
    public void sameModeIsNoOp() throws Exception
    {
        cache.getOrBuild(new FakeDeviceView("/dev/mapper/a")::getDevices, LockingMode.EXCLUSIVE);

        assertNull(coordinator.setMode(LockingMode.EXCLUSIVE));
        assertNotNull(cache.getCachedEntry());
    }

    @Test
    public void switchInvalidatesCache() throws Exception
    {
        cache.getOrBuild(new FakeDeviceView("/dev/mapper/a")::getDevices, LockingMode.EXCLUSIVE);

        assertEquals(LockingMode.EXCLUSIVE, coordinator.setMode(LockingMode.SHARED));
        assertEquals(LockingMode.SHARED, coordinator.getMode());
        assertNull(cache.getCachedEntry());
    }

    @Test
    public void switchDrainsInFlightCommands() throws Exception
    {
        assertEquals(LockingMode.EXCLUSIVE, coordinator.enter());

        Future<LockingMode> switchFuture = executor.submit(() -> coordinator.setMode(LockingMode.SHARED));
        waitForSwitchPending();

        // the switch waits for the command that entered under the old mode
        assertSwitchBlocked(switchFuture);
        assertEquals(LockingMode.EXCLUSIVE, coordinator.getMode());

        // new commands are not admitted while the switch is pending
        Future<LockingMode> enterFuture = executor.submit(coordinator::enter);
        try
        {
            enterFuture.get(BLOCKED_CHECK_MS, TimeUnit.MILLISECONDS);
            throw new AssertionError("enter() returned during a pending mode switch");
        }
        catch (TimeoutException expected)
        {
            // still blocked
        }

        coordinator.leave();

        assertEquals(LockingMode.EXCLUSIVE, switchFuture.get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertEquals(LockingMode.SHARED, enterFuture.get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertFalse(coordinator.isSwitchPending());
        assertEquals(1, coordinator.getInFlightCount());
        coordinator.leave();
    }

    @Test
    public void concurrentSwitchesAreSerialized() throws Exception
    {
        coordinator.enter();

        Future<LockingMode> toShared = executor.submit(() -> coordinator.setMode(LockingMode.SHARED));
        waitForSwitchPending();
        Future<LockingMode> toExclusive = executor.submit(() -> coordinator.setMode(LockingMode.EXCLUSIVE));
        assertSwitchBlocked(toExclusive);

        coordinator.leave();

        assertEquals(LockingMode.EXCLUSIVE, toShared.get(WAIT_MS, TimeUnit.MILLISECONDS));
        // the second switch reports the mode the first one installed
        assertEquals(LockingMode.SHARED, toExclusive.get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertEquals(LockingMode.EXCLUSIVE, coordinator.getMode());
    }

    @Test
    public void interruptedEnter() throws Exception
    {
        coordinator.enter();
        Future<LockingMode> switchFuture = executor.submit(() -> coordinator.setMode(LockingMode.SHARED));
        waitForSwitchPending();

        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicReference<Boolean> interruptFlag = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        Thread waiter = new Thread(() ->
        {
            try
            {
                coordinator.enter();
            }
            catch (StorageException exc)
            {
                failure.set(exc);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
            done.countDown();
        });
        waiter.start();
        Thread.sleep(BLOCKED_CHECK_MS);
        waiter.interrupt();

        assertTrue(done.await(WAIT_MS, TimeUnit.MILLISECONDS));
        assertTrue(failure.get() instanceof StorageException);
        assertTrue(interruptFlag.get());

        coordinator.leave();
        assertEquals(LockingMode.EXCLUSIVE, switchFuture.get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertEquals(0, coordinator.getInFlightCount());
    }

    private void waitForSwitchPending() throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + WAIT_MS;
        while (!coordinator.isSwitchPending())
        {
            if (System.currentTimeMillis() > deadline)
            {
                throw new AssertionError("Mode switch did not start");
            }
            Thread.sleep(5);
        }
    }

    private void assertSwitchBlocked(Future<LockingMode> switchFuture) throws Exception
    {
        try
        {
            switchFuture.get(BLOCKED_CHECK_MS, TimeUnit.MILLISECONDS);
            throw new AssertionError("Mode switch completed while commands were in flight");
        }
        catch (TimeoutException expected)
        {
            // still draining
        }
    }
}
