package org.hostvirt.extproc;

import org.hostvirt.ChildProcessTimeoutException;
import org.hostvirt.hoststor.storage.StorageException;
import org.hostvirt.utils.ShellUtils;

import java.io.IOException;

/**
 * Thrown if an external command could not be run to completion
 */
public class ExtCmdFailedException extends StorageException
{
    private static final long serialVersionUID = 5779506237459279868L;

    private static final String EXCEPTION_DESCR_FORMAT = "Execution of the external command '%s' failed.";
    private static final String EXCEPTION_DETAILS_FORMAT = "The full command line executed was:\n%s";

    public ExtCmdFailedException(String[] command, ChildProcessTimeoutException cause)
    {
        super(
            String.format("The external command '%s' did not complete within the timeout", command[0]),
            String.format(EXCEPTION_DESCR_FORMAT, command[0]),
            cause.isTerminated() ?
                "The external command did not complete within the timeout and was terminated." :
                "The external command did not complete within the timeout and could not be terminated.",
            "Check whether the external program and the operating system are still operating properly.\n" +
            "Check whether the system's load is within normal parameters.",
            String.format(EXCEPTION_DETAILS_FORMAT, ShellUtils.joinShellQuote(command)),
            cause
        );
    }

    public ExtCmdFailedException(String[] command, IOException cause)
    {
        super(
            String.format("Data exchange with the external command '%s' failed", command[0]),
            String.format(EXCEPTION_DESCR_FORMAT, command[0]),
            "The external command could not be started, data exchange with it failed before the execution " +
            "completed, or the amount of data sent by the external command exceeded the size limit.",
            "Check whether the external program is installed and operating properly.",
            String.format(EXCEPTION_DETAILS_FORMAT, ShellUtils.joinShellQuote(command)),
            cause
        );
    }
}
