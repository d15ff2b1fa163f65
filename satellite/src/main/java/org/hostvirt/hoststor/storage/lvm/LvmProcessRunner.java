package org.hostvirt.hoststor.storage.lvm;

import org.hostvirt.extproc.ExtCmd.OutputData;
import org.hostvirt.hoststor.storage.StorageException;

/**
 * Runs one fully composed LVM command line
 */
public interface LvmProcessRunner
{
    /**
     * Never throws for a non-zero exit code, the caller classifies the result.
     *
     * @param command the command line, starting with the path of the lvm binary
     * @param privileged whether the command has to be run with elevated privileges
     *
     * @throws StorageException if the process could not be started, timed out or its output could not be read
     */
    OutputData run(String[] command, boolean privileged) throws StorageException;
}
