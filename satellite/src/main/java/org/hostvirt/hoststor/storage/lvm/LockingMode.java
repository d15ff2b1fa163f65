package org.hostvirt.hoststor.storage.lvm;

/**
 * LVM locking mode of this host
 */
public enum LockingMode
{
    /**
     * This host is the storage pool master and may take the cluster wide write lock
     */
    EXCLUSIVE(1),

    /**
     * This host never locks and has to tolerate transient read failures caused by the
     * concurrent writer on the master host
     */
    SHARED(4);

    private final int lockingType;

    LockingMode(int lockingTypeRef)
    {
        lockingType = lockingTypeRef;
    }

    /**
     * @return the value of LVM's <code>global/locking_type</code> setting for this mode
     */
    public int getLockingType()
    {
        return lockingType;
    }
}
