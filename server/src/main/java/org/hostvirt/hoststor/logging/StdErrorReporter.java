package org.hostvirt.hoststor.logging;

import org.hostvirt.ImplementationError;
import org.hostvirt.hoststor.HostStorException;
import org.hostvirt.hoststor.annotation.Nullable;
import org.hostvirt.hoststor.core.HostStor;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Standard error report generator
 * Logs to SLF4J and writes detailed problem report files into the log directory
 */
public final class StdErrorReporter extends BaseErrorReporter implements ErrorReporter
{
    public static final String RPT_PREFIX = "ErrorReport-";
    public static final String RPT_SUFFIX = ".log";

    private final Logger mainLogger;
    private final AtomicLong errorNr = new AtomicLong();
    private final Path baseLogDirectory;

    public StdErrorReporter(
        String moduleName,
        Path logDirectory,
        boolean printStackTracesRef,
        String nodeNameRef,
        @Nullable String logLevelRef,
        @Nullable String hostStorLogLevelRef
    )
    {
        super(moduleName, printStackTracesRef, nodeNameRef);
        baseLogDirectory = logDirectory;
        mainLogger = LoggerFactory.getLogger(HostStor.PROGRAM + "/" + moduleName);

        try
        {
            Files.createDirectories(baseLogDirectory);
        }
        catch (IOException ioExc)
        {
            logError("Unable to create log directory: %s (%s)", baseLogDirectory, ioExc.getMessage());
        }

        if (logLevelRef != null)
        {
            try
            {
                String hostStorLogLevel = hostStorLogLevelRef == null ? logLevelRef : hostStorLogLevelRef;
                setLogLevel(
                    Level.valueOf(logLevelRef.toUpperCase()),
                    Level.valueOf(hostStorLogLevel.toUpperCase())
                );
            }
            catch (IllegalArgumentException exc)
            {
                logError("Invalid log level '%s'", logLevelRef);
            }
        }

        logInfo("Log directory set to: '%s'", baseLogDirectory);
    }

    @Override
    public String getInstanceId()
    {
        return instanceId;
    }

    @Override
    public boolean hasAtLeastLogLevel(Level levelRef)
    {
        boolean hasRequiredLevel;
        switch (levelRef)
        {
            case ERROR:
                hasRequiredLevel = mainLogger.isErrorEnabled();
                break;
            case WARN:
                hasRequiredLevel = mainLogger.isWarnEnabled();
                break;
            case INFO:
                hasRequiredLevel = mainLogger.isInfoEnabled();
                break;
            case DEBUG:
                hasRequiredLevel = mainLogger.isDebugEnabled();
                break;
            case TRACE:
                hasRequiredLevel = mainLogger.isTraceEnabled();
                break;
            default:
                throw new ImplementationError("Unknown logging level: " + levelRef);
        }
        return hasRequiredLevel;
    }

    @Override
    public @Nullable Level getCurrentLogLevel()
    {
        Level level = null; // no logging, aka OFF
        if (mainLogger.isTraceEnabled())
        {
            level = Level.TRACE;
        }
        else
        if (mainLogger.isDebugEnabled())
        {
            level = Level.DEBUG;
        }
        else
        if (mainLogger.isInfoEnabled())
        {
            level = Level.INFO;
        }
        else
        if (mainLogger.isWarnEnabled())
        {
            level = Level.WARN;
        }
        else
        if (mainLogger.isErrorEnabled())
        {
            level = Level.ERROR;
        }
        return level;
    }

    /**
     * Sets the log level if the logger uses Logback as a backend, no effect otherwise
     */
    @Override
    public void setLogLevel(@Nullable Level level, @Nullable Level hostStorLevel)
    {
        Logger rootLogger = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (rootLogger instanceof ch.qos.logback.classic.Logger)
        {
            if (level != null)
            {
                ((ch.qos.logback.classic.Logger) rootLogger).setLevel(
                    ch.qos.logback.classic.Level.toLevel(level.toString())
                );
            }
            if (hostStorLevel != null)
            {
                if (mainLogger instanceof ch.qos.logback.classic.Logger)
                {
                    ((ch.qos.logback.classic.Logger) mainLogger).setLevel(
                        ch.qos.logback.classic.Level.toLevel(hostStorLevel.toString())
                    );
                }
                else
                {
                    logError("Main logger is not a logback logger but the ROOT logger is!");
                }
            }
        }
    }

    @Override
    public void logTrace(String format, Object... args)
    {
        if (mainLogger.isTraceEnabled())
        {
            mainLogger.trace(String.format(format, args));
        }
    }

    @Override
    public void logDebug(String format, Object... args)
    {
        if (mainLogger.isDebugEnabled())
        {
            mainLogger.debug(String.format(format, args));
        }
    }

    @Override
    public void logInfo(String format, Object... args)
    {
        if (mainLogger.isInfoEnabled())
        {
            mainLogger.info(String.format(format, args));
        }
    }

    @Override
    public void logWarning(String format, Object... args)
    {
        if (mainLogger.isWarnEnabled())
        {
            mainLogger.warn(String.format(format, args));
        }
    }

    @Override
    public void logError(String format, Object... args)
    {
        if (mainLogger.isErrorEnabled())
        {
            mainLogger.error(String.format(format, args));
        }
    }

    @Override
    public String reportError(Throwable errorInfo)
    {
        return reportImpl(Level.ERROR, errorInfo, null, true);
    }

    @Override
    public String reportError(Level logLevel, Throwable errorInfo)
    {
        return reportImpl(logLevel, errorInfo, null, true);
    }

    @Override
    public String reportError(Level logLevel, Throwable errorInfo, @Nullable String contextInfo)
    {
        return reportImpl(logLevel, errorInfo, contextInfo, true);
    }

    @Override
    public String reportProblem(Level logLevel, HostStorException errorInfo, @Nullable String contextInfo)
    {
        return reportImpl(logLevel, errorInfo, contextInfo, false);
    }

    private String reportImpl(
        Level logLevel,
        Throwable errorInfo,
        @Nullable String contextInfo,
        boolean includeStackTrace
    )
    {
        long reportNr = errorNr.getAndIncrement();
        final String logName = String.format("%s-%06d", instanceId, reportNr);

        ErrorReportRenderer renderer = new ErrorReportRenderer();
        renderReport(renderer, reportNr, errorInfo, LocalDateTime.now(), contextInfo, includeStackTrace);
        String renderedReport = renderer.getErrorReport();

        Path reportPath = baseLogDirectory.resolve(RPT_PREFIX + logName + RPT_SUFFIX);
        try (PrintStream output = new PrintStream(new FileOutputStream(reportPath.toFile()), true, "UTF-8"))
        {
            output.print(renderedReport);
        }
        catch (IOException ioExc)
        {
            System.err.printf("Unable to create error report file for error report %s:%n", logName);
            System.err.println(ioExc.getMessage());
            System.err.println("The error report will be written to the standard error stream instead.\n");
            byte[] reportData = renderedReport.getBytes(StandardCharsets.UTF_8);
            System.err.write(reportData, 0, reportData.length);
            System.err.flush();
        }

        if (printStackTraces)
        {
            errorInfo.printStackTrace(System.err);
        }

        logReport(reportNr, errorInfo, logLevel);
        return logName;
    }

    private void logReport(long reportNr, Throwable errorInfo, Level logLevel)
    {
        final String logMsg = formatLogMsg(reportNr, errorInfo);
        switch (logLevel)
        {
            case WARN:
                logWarning("%s", logMsg);
                break;
            case INFO:
                logInfo("%s", logMsg);
                break;
            case DEBUG:
                logDebug("%s", logMsg);
                break;
            case TRACE:
                logTrace("%s", logMsg);
                break;
            case ERROR:
                // fall-through
            default:
                logError("%s", logMsg);
                break;
        }
    }

    @Override
    public Path getLogDirectory()
    {
        return baseLogDirectory;
    }
}
