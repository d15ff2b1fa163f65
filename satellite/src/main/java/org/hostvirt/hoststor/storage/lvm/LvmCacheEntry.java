package org.hostvirt.hoststor.storage.lvm;

import java.util.List;

/**
 * Immutable pair of the device snapshot a filter was built from and the resulting config text
 */
public final class LvmCacheEntry
{
    private final List<String> devices;
    private final LockingMode lockingMode;
    private final String filter;
    private final String config;

    LvmCacheEntry(List<String> devicesRef, LockingMode lockingModeRef, String filterRef, String configRef)
    {
        devices = devicesRef;
        lockingMode = lockingModeRef;
        filter = filterRef;
        config = configRef;
    }

    /**
     * @return the sorted device snapshot, including the configured extra devices
     */
    public List<String> getDevices()
    {
        return devices;
    }

    public LockingMode getLockingMode()
    {
        return lockingMode;
    }

    public String getFilter()
    {
        return filter;
    }

    public String getConfig()
    {
        return config;
    }

    @Override
    public String toString()
    {
        return "LvmCacheEntry [devices=" + devices + ", lockingMode=" + lockingMode + "]";
    }
}
