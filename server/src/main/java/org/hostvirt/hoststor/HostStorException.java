package org.hostvirt.hoststor;

import org.hostvirt.hoststor.annotation.Nullable;

/**
 * Exception base class that carries a description, the cause, a possible correction
 * and additional details of a problem, so that error reports can explain it to an operator.
 */
public class HostStorException extends Exception
{
    private static final long serialVersionUID = -4920312719431526011L;

    private @Nullable String excDescription;
    private @Nullable String excCause;
    private @Nullable String excCorrection;
    private @Nullable String excDetails;

    public HostStorException(String message)
    {
        super(message);
    }

    public HostStorException(String message, @Nullable Throwable cause)
    {
        super(message, cause);
    }

    public HostStorException(
        String message,
        @Nullable String descriptionText,
        @Nullable String causeText,
        @Nullable String correctionText,
        @Nullable String detailsText
    )
    {
        this(message, descriptionText, causeText, correctionText, detailsText, null);
    }

    public HostStorException(
        String message,
        @Nullable String descriptionText,
        @Nullable String causeText,
        @Nullable String correctionText,
        @Nullable String detailsText,
        @Nullable Throwable cause
    )
    {
        super(message, cause);
        excDescription = descriptionText;
        excCause = causeText;
        excCorrection = correctionText;
        excDetails = detailsText;
    }

    /**
     * Returns a text that describes the problem for which the exception was generated
     *
     * @return Problem description, or null if no such information is available
     */
    public @Nullable String getDescriptionText()
    {
        return excDescription;
    }

    /**
     * Returns the text that describes what caused the problem
     *
     * @return Problem cause description, or null if no such information is available
     */
    public @Nullable String getCauseText()
    {
        return excCause;
    }

    /**
     * Returns the text that describes possible resolutions to the problem
     *
     * @return Correction instructions, or null if no such information is available
     */
    public @Nullable String getCorrectionText()
    {
        return excCorrection;
    }

    /**
     * Returns the text that contains additional information for error reports
     *
     * @return Additional information, or null if no such information is available
     */
    public @Nullable String getDetailsText()
    {
        return excDetails;
    }

    public void setDetailsText(@Nullable String text)
    {
        excDetails = text;
    }
}
