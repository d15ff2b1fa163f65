package org.hostvirt.hoststor.storage.lvm;

import org.hostvirt.hoststor.annotation.Nullable;
import org.hostvirt.hoststor.storage.StorageException;
import org.hostvirt.locks.LockGuard;
import org.hostvirt.utils.ExceptionThrowingSupplier;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches the LVM configuration text together with the device snapshot its filter was built from
 *
 * The lock only guards reading and replacing the entry. The device supplier is queried
 * without holding it, so a slow device scan never blocks other callers of the cache.
 */
@Singleton
public class LvmCommandCache
{
    private final LvmSettings settings;
    private final ReentrantLock cacheLock = new ReentrantLock();

    private @Nullable LvmCacheEntry entry;
    // incremented on every invalidation, keeps a build that raced an invalidation from being stored
    private long generation;

    @Inject
    public LvmCommandCache(LvmSettings settingsRef)
    {
        settings = settingsRef;
    }

    /**
     * Returns the cached entry for the given mode, or builds and stores a new one from the
     * devices returned by the supplier.
     */
    public LvmCacheEntry getOrBuild(
        ExceptionThrowingSupplier<Collection<String>, StorageException> deviceSupplier,
        LockingMode mode
    )
        throws StorageException
    {
        LvmCacheEntry result;
        long buildGeneration;
        try (LockGuard lg = LockGuard.createLocked(cacheLock))
        {
            result = entry;
            buildGeneration = generation;
        }

        if (result == null || result.getLockingMode() != mode)
        {
            result = build(deviceSupplier.supply(), mode);
            try (LockGuard lg = LockGuard.createLocked(cacheLock))
            {
                if (generation == buildGeneration)
                {
                    entry = result;
                }
            }
        }
        return result;
    }

    /**
     * Builds an entry without storing it
     */
    public LvmCacheEntry build(Collection<String> devices, LockingMode mode)
    {
        List<String> snapshot = LvmFilterBuilder.normalizeDevices(devices, settings.getExtraDevices());
        String filter = LvmFilterBuilder.buildFilterNormalized(snapshot);
        return new LvmCacheEntry(snapshot, mode, filter, LvmConfigBuilder.buildConfig(filter, mode));
    }

    /**
     * @return true if the live devices (merged with the extra devices) differ from the entry's snapshot
     */
    public boolean isStale(LvmCacheEntry cacheEntry, Collection<String> liveDevices)
    {
        return !cacheEntry.getDevices().equals(
            LvmFilterBuilder.normalizeDevices(liveDevices, settings.getExtraDevices())
        );
    }

    public void invalidate()
    {
        try (LockGuard lg = LockGuard.createLocked(cacheLock))
        {
            entry = null;
            ++generation;
        }
    }

    @Nullable
    public LvmCacheEntry getCachedEntry()
    {
        try (LockGuard lg = LockGuard.createLocked(cacheLock))
        {
            return entry;
        }
    }
}
