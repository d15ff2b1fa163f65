package org.hostvirt.locks;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.junit.Test;

public class LockGuardTest
{
    @Test
    public void lockedUntilClosed()
    {
        ReentrantLock first = new ReentrantLock();
        ReentrantLock second = new ReentrantLock();
        try (LockGuard lg = LockGuard.createLocked(first, second))
        {
            assertTrue(first.isHeldByCurrentThread());
            assertTrue(second.isHeldByCurrentThread());
        }
        assertFalse(first.isLocked());
        assertFalse(second.isLocked());
    }

    @Test
    public void deferred()
    {
        ReentrantLock lock = new ReentrantLock();
        try (LockGuard lg = LockGuard.createDeferred(lock))
        {
            assertFalse(lock.isLocked());
            lg.lock();
            assertTrue(lock.isHeldByCurrentThread());
        }
        assertFalse(lock.isLocked());
    }

    @Test
    public void closeWithoutLockIsNoOp()
    {
        ReentrantLock lock = new ReentrantLock();
        LockGuard lg = LockGuard.createDeferred(lock);
        lg.close();
        lg.close();
        assertFalse(lock.isLocked());
    }

    @Test
    public void readWriteLock()
    {
        ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
        try (LockGuard lg = LockGuard.createLocked(rwLock.readLock()))
        {
            assertTrue(rwLock.getReadHoldCount() == 1);
            assertFalse(rwLock.isWriteLocked());
        }
        assertTrue(rwLock.getReadLockCount() == 0);
    }
}
