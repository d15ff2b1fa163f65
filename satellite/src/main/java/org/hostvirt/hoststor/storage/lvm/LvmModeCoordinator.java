package org.hostvirt.hoststor.storage.lvm;

import org.hostvirt.ImplementationError;
import org.hostvirt.hoststor.annotation.Nullable;
import org.hostvirt.hoststor.storage.StorageException;
import org.hostvirt.locks.LockGuard;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Barrier between LVM commands and changes of the locking mode
 *
 * While a switch is pending, no new command is admitted. The switch waits until all commands
 * that entered under the old mode have left, then invalidates the command cache and publishes
 * the new mode.
 */
@Singleton
public class LvmModeCoordinator
{
    private final LvmCommandCache cache;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition drained = stateLock.newCondition();
    private final Condition switchDone = stateLock.newCondition();

    private LockingMode mode;
    private boolean switchPending = false;
    private int inFlight = 0;

    @Inject
    public LvmModeCoordinator(LvmCommandCache cacheRef, LvmSettings settingsRef)
    {
        cache = cacheRef;
        mode = settingsRef.getInitialMode();
    }

    /**
     * Registers a command as in flight. Blocks while a mode switch is pending.
     *
     * @return the mode the command has to run with
     */
    public LockingMode enter() throws StorageException
    {
        try (LockGuard lg = LockGuard.createLocked(stateLock))
        {
            while (switchPending)
            {
                awaitSignal(switchDone, "waiting for a locking mode switch");
            }
            ++inFlight;
            return mode;
        }
    }

    public void leave()
    {
        try (LockGuard lg = LockGuard.createLocked(stateLock))
        {
            if (inFlight <= 0)
            {
                throw new ImplementationError("LvmModeCoordinator.leave() called without a matching enter()");
            }
            --inFlight;
            if (inFlight == 0)
            {
                drained.signalAll();
            }
        }
    }

    /**
     * Switches the locking mode after all in-flight commands have completed
     *
     * @return the mode that was replaced, or null if the requested mode already was the current mode
     */
    @Nullable
    public LockingMode setMode(LockingMode newMode) throws StorageException
    {
        LockingMode prevMode = null;
        try (LockGuard lg = LockGuard.createLocked(stateLock))
        {
            while (switchPending)
            {
                awaitSignal(switchDone, "waiting for a concurrent locking mode switch");
            }
            if (newMode != mode)
            {
                switchPending = true;
                try
                {
                    while (inFlight > 0)
                    {
                        awaitSignal(drained, "draining LVM commands for a locking mode switch");
                    }
                    cache.invalidate();
                    prevMode = mode;
                    mode = newMode;
                }
                finally
                {
                    switchPending = false;
                    switchDone.signalAll();
                }
            }
        }
        return prevMode;
    }

    public LockingMode getMode()
    {
        try (LockGuard lg = LockGuard.createLocked(stateLock))
        {
            return mode;
        }
    }

    public boolean isSwitchPending()
    {
        try (LockGuard lg = LockGuard.createLocked(stateLock))
        {
            return switchPending;
        }
    }

    public int getInFlightCount()
    {
        try (LockGuard lg = LockGuard.createLocked(stateLock))
        {
            return inFlight;
        }
    }

    private void awaitSignal(Condition cond, String activity) throws StorageException
    {
        try
        {
            cond.await();
        }
        catch (InterruptedException intrExc)
        {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while " + activity, intrExc);
        }
    }
}
