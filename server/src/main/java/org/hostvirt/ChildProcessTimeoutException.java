package org.hostvirt;

/**
 * Thrown if an external process did not exit within its wait timeout
 */
public class ChildProcessTimeoutException extends Exception
{
    private static final long serialVersionUID = -6373590318466224911L;

    private final boolean termFlag;

    public ChildProcessTimeoutException()
    {
        termFlag = false;
    }

    public ChildProcessTimeoutException(boolean terminated)
    {
        termFlag = terminated;
    }

    public ChildProcessTimeoutException(String message, boolean terminated)
    {
        super(message);
        termFlag = terminated;
    }

    /**
     * @return true if the child process was terminated after the timeout,
     *     false if it may still be running
     */
    public boolean isTerminated()
    {
        return termFlag;
    }
}
