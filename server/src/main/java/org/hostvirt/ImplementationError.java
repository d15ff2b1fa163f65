package org.hostvirt;

import org.hostvirt.hoststor.annotation.Nullable;

/**
 * Thrown when a component detects a violation of its own invariants, e.g. a
 * release call without a matching acquire
 */
public class ImplementationError extends Error
{
    private static final long serialVersionUID = 2213470546270452384L;

    public ImplementationError(String message)
    {
        super(message);
    }

    public ImplementationError(Throwable cause)
    {
        super(cause);
    }

    public ImplementationError(String message, @Nullable Throwable cause)
    {
        super(message, cause);
    }
}
