package org.hostvirt.locks;

import java.util.concurrent.locks.Lock;

/**
 * Scoped acquisition of one or more locks for use in try-with-resources blocks
 *
 * Locks are acquired in the given order and released in reverse order. If acquiring one of
 * the locks fails, the locks acquired so far are released again before the exception is rethrown.
 */
public final class LockGuard implements AutoCloseable
{
    private final Lock[] lockBundle;
    private int acquiredCount = 0;

    private LockGuard(final Lock... locksRef)
    {
        lockBundle = locksRef;
    }

    /**
     * Acquires all locks managed by this instance
     */
    public void lock()
    {
        try
        {
            while (acquiredCount < lockBundle.length)
            {
                lockBundle[acquiredCount].lock();
                ++acquiredCount;
            }
        }
        catch (RuntimeException exc)
        {
            close();
            throw exc;
        }
    }

    /**
     * Releases the locks acquired by this instance. No-op if no lock is held.
     */
    @Override
    public void close()
    {
        RuntimeException savedExc = null;
        while (acquiredCount > 0)
        {
            --acquiredCount;
            try
            {
                lockBundle[acquiredCount].unlock();
            }
            catch (RuntimeException rtExc)
            {
                if (savedExc == null)
                {
                    savedExc = rtExc;
                }
            }
        }
        // rethrow, an unlock failure is an implementation error
        if (savedExc != null)
        {
            throw savedExc;
        }
    }

    public static LockGuard createLocked(final Lock... locks)
    {
        LockGuard guard = new LockGuard(locks);
        guard.lock();
        return guard;
    }

    public static LockGuard createDeferred(final Lock... locks)
    {
        return new LockGuard(locks);
    }
}
