package org.hostvirt.hoststor.logging;

import org.hostvirt.hoststor.HostStorException;
import org.hostvirt.hoststor.annotation.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.event.Level;

/**
 * Prints log messages and error reports to the standard error output, used by tests and
 * before the configured reporter is available
 */
public class StderrErrorReporter extends BaseErrorReporter implements ErrorReporter
{
    private final AtomicLong errorNr = new AtomicLong(0L);

    public StderrErrorReporter(String moduleName)
    {
        super(moduleName, false, "");
    }

    @Override
    public boolean hasAtLeastLogLevel(Level levelRef)
    {
        return true;
    }

    @Override
    public Level getCurrentLogLevel()
    {
        return Level.TRACE;
    }

    @Override
    public void setLogLevel(@Nullable Level levelRef, @Nullable Level hostStorLevelRef)
    {
        // always TRACE
    }

    @Override
    public void logTrace(String format, Object... args)
    {
        System.err.println("TRACE:   " + String.format(format, args));
    }

    @Override
    public void logDebug(String format, Object... args)
    {
        System.err.println("DEBUG:   " + String.format(format, args));
    }

    @Override
    public void logInfo(String format, Object... args)
    {
        System.err.println("INFO:    " + String.format(format, args));
    }

    @Override
    public void logWarning(String format, Object... args)
    {
        System.err.println("WARNING: " + String.format(format, args));
    }

    @Override
    public void logError(String format, Object... args)
    {
        System.err.println("ERROR:   " + String.format(format, args));
    }

    @Override
    public String getInstanceId()
    {
        return instanceId;
    }

    @Override
    public @Nullable String reportError(Throwable errorInfo)
    {
        return reportImpl(errorInfo, null, true);
    }

    @Override
    public @Nullable String reportError(Level logLevel, Throwable errorInfo)
    {
        return reportImpl(errorInfo, null, true);
    }

    @Override
    public @Nullable String reportError(Level logLevel, Throwable errorInfo, @Nullable String contextInfo)
    {
        return reportImpl(errorInfo, contextInfo, true);
    }

    @Override
    public @Nullable String reportProblem(Level logLevel, HostStorException errorInfo, @Nullable String contextInfo)
    {
        return reportImpl(errorInfo, contextInfo, false);
    }

    private @Nullable String reportImpl(
        @Nullable Throwable errorInfoRef,
        @Nullable String contextInfo,
        boolean includeStackTrace
    )
    {
        try
        {
            Throwable errorInfo = errorInfoRef;
            if (errorInfo == null)
            {
                errorInfo = new NullPointerException();
            }
            ErrorReportRenderer renderer = new ErrorReportRenderer();
            renderReport(
                renderer,
                errorNr.getAndIncrement(),
                errorInfo,
                LocalDateTime.now(),
                contextInfo,
                includeStackTrace
            );
            System.err.print(renderer.getErrorReport());
        }
        catch (Exception exc)
        {
            exc.printStackTrace(System.err);
        }
        return null;
    }

    @Override
    public Path getLogDirectory()
    {
        return Paths.get(System.getProperty("java.io.tmpdir"));
    }
}
