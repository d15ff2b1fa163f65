package org.hostvirt.hoststor.storage.lvm;

import org.hostvirt.hoststor.storage.StorageException;

import java.util.List;

/**
 * Live view of the shared block devices visible to this host
 */
public interface DeviceView
{
    /**
     * @throws StorageException if the devices cannot be determined. Implementations must not
     *     report an empty list instead, an empty filter would hide devices that are in use.
     */
    List<String> getDevices() throws StorageException;
}
