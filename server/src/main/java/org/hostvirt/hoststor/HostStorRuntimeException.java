package org.hostvirt.hoststor;

import org.hostvirt.hoststor.annotation.Nullable;

public class HostStorRuntimeException extends RuntimeException
{
    private static final long serialVersionUID = 1735922846375110352L;

    public HostStorRuntimeException(String message)
    {
        super(message);
    }

    public HostStorRuntimeException(String message, @Nullable Throwable cause)
    {
        super(message, cause);
    }
}
