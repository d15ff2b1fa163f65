package org.hostvirt.hoststor.storage.lvm;

import org.hostvirt.hoststor.storage.StorageException;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Limits the number of concurrently running LVM processes
 */
@Singleton
public class LvmConcurrencyGate
{
    private final int maxCommands;
    private final Semaphore slots;

    @Inject
    public LvmConcurrencyGate(LvmSettings settingsRef)
    {
        maxCommands = settingsRef.getMaxCommands();
        slots = new Semaphore(maxCommands, true);
    }

    /**
     * Blocks until a slot is free
     */
    public Slot acquire() throws StorageException
    {
        try
        {
            slots.acquire();
        }
        catch (InterruptedException intrExc)
        {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for a free LVM command slot", intrExc);
        }
        return new Slot();
    }

    public int availableSlots()
    {
        return slots.availablePermits();
    }

    public int getMaxCommands()
    {
        return maxCommands;
    }

    public final class Slot implements AutoCloseable
    {
        private final AtomicBoolean held = new AtomicBoolean(true);

        private Slot()
        {
        }

        @Override
        public void close()
        {
            if (held.compareAndSet(true, false))
            {
                slots.release();
            }
        }
    }
}
