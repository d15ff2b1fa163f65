package org.hostvirt.hoststor.logging;

import org.hostvirt.hoststor.HostStorException;
import org.hostvirt.hoststor.annotation.Nullable;

import java.nio.file.Path;
import java.util.Random;

import org.slf4j.event.Level;

/**
 * Logs messages and generates / formats error reports
 */
public interface ErrorReporter
{
    String LOGID = "logid";

    /**
     * Indicates if at least the given log level is enabled.
     * ERROR &lt; WARN &lt; INFO &lt; DEBUG &lt; TRACE
     */
    boolean hasAtLeastLogLevel(Level level);

    /**
     * @return the current log level, or null if logging is turned off
     */
    @Nullable
    Level getCurrentLogLevel();

    /**
     * Sets the log level, if the backing logging framework supports that.
     *
     * @param level
     *     The level for frameworks and libraries, or null to leave it unchanged
     * @param hostStorLevel
     *     The level for HostStor's own messages, or null to leave it unchanged
     */
    void setLogLevel(@Nullable Level level, @Nullable Level hostStorLevel);

    void logTrace(String format, Object... args);

    void logDebug(String format, Object... args);

    void logInfo(String format, Object... args);

    void logWarning(String format, Object... args);

    void logError(String format, Object... args);

    /**
     * Returns the instance ID of the error reporter instance
     *
     * @return Instance ID of this error reporter instance
     */
    String getInstanceId();

    /**
     * Reports any kind of error, especially ones that are not expected during normal operation,
     * such as implementation errors or failures of the operating environment.
     *
     * Implementations are not supposed to throw any exceptions, not even RuntimeExceptions,
     * because if the ErrorReporter is not working, there is no way to report such exceptions anyway.
     *
     * @return the name of the generated report; may be null if no report was created
     */
    @Nullable
    String reportError(Throwable errorInfo);

    @Nullable
    String reportError(Level logLevel, Throwable errorInfo);

    /**
     * Reports an error together with information about the context it occurred in, e.g. the
     * command that was being executed
     */
    @Nullable
    String reportError(Level logLevel, Throwable errorInfo, @Nullable String contextInfo);

    /**
     * Reports less severe problems, such as the ones expected during normal operation,
     * e.g. an external command that failed after all retries. No stack trace is included.
     */
    @Nullable
    String reportProblem(Level logLevel, HostStorException errorInfo, @Nullable String contextInfo);

    Path getLogDirectory();

    static String getNewLogId()
    {
        String zeros = "000000";
        Random rnd = new Random();
        String str = Integer.toString(rnd.nextInt(0x1000000), 16);
        return zeros.substring(str.length()) + str;
    }
}
