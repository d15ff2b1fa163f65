package org.hostvirt.extproc;

import org.hostvirt.extproc.ExtCmd.OutputData;
import org.hostvirt.hoststor.annotation.Nullable;
import org.hostvirt.utils.ShellUtils;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

public class ExtCmdUtils
{
    public static final int DEFAULT_RET_CODE_OK = 0;

    @FunctionalInterface
    public interface ExceptionFactory<EXC extends Exception>
    {
        EXC createException(
            String message,
            @Nullable String descriptionText,
            @Nullable String causeText,
            @Nullable String correctionText,
            String detailsText
        );
    }

    public static <EXC extends Exception> void checkExitCode(
        OutputData output,
        ExceptionFactory<EXC> excFactory,
        @Nullable String format,
        Object... args
    )
        throws EXC
    {
        checkExitCode(output, Collections.singletonList(DEFAULT_RET_CODE_OK), excFactory, format, args);
    }

    /**
     * Throws the exception created by the given {@link ExceptionFactory} if the exit code
     * is not one of the expected return codes.
     *
     * @param output
     *            The {@link OutputData} which contains the exit code
     * @param expectedRetCodes
     *            The expected return codes, usually only 0
     * @param excFactory
     *            Creates the exception if the exit code is unexpected
     * @param format
     *            Optional message, "External command failed" if null or empty
     * @param args
     *            The arguments for the format parameter
     */
    public static <EXC extends Exception> void checkExitCode(
        OutputData output,
        List<Integer> expectedRetCodes,
        ExceptionFactory<EXC> excFactory,
        @Nullable String format,
        Object... args
    )
        throws EXC
    {
        if (!expectedRetCodes.contains(output.exitCode))
        {
            throw excFactory.createException(
                format != null && !format.isEmpty() ?
                    String.format(format, args) :
                    "External command failed",
                null,
                null,
                null,
                String.format(
                    "Command '%s' returned with exitcode %d. %n%n" +
                        "Standard out: %n" +
                        "%s" +
                        "%n%n" +
                        "Error message: %n" +
                        "%s" +
                        "%n",
                    ShellUtils.joinShellQuote(output.executedCommand),
                    output.exitCode,
                    new String(output.stdoutData, StandardCharsets.UTF_8),
                    new String(output.stderrData, StandardCharsets.UTF_8)
                )
            );
        }
    }

    private ExtCmdUtils()
    {
    }
}
