package org.hostvirt.hoststor.storage;

import org.hostvirt.hoststor.HostStorException;
import org.hostvirt.hoststor.annotation.Nullable;

public class StorageException extends HostStorException
{
    private static final long serialVersionUID = 8123604466723358907L;

    public StorageException(String message)
    {
        super(message);
    }

    public StorageException(String message, @Nullable Exception nestedException)
    {
        super(message, nestedException);
    }

    public StorageException(
        String message,
        @Nullable String descriptionText,
        @Nullable String causeText,
        @Nullable String correctionText,
        @Nullable String detailsText
    )
    {
        super(message, descriptionText, causeText, correctionText, detailsText, null);
    }

    public StorageException(
        String message,
        @Nullable String descriptionText,
        @Nullable String causeText,
        @Nullable String correctionText,
        @Nullable String detailsText,
        @Nullable Throwable cause
    )
    {
        super(message, descriptionText, causeText, correctionText, detailsText, cause);
    }
}
