package org.hostvirt.hoststor.logging;

import org.hostvirt.hoststor.HostStorException;
import org.hostvirt.hoststor.annotation.Nullable;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Report rendering shared by the error reporter implementations
 */
public abstract class BaseErrorReporter
{
    protected static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    protected final String dmModule;
    protected final boolean printStackTraces;
    protected final String nodeName;
    protected final String instanceId;
    protected final LocalDateTime instanceEpoch;

    protected BaseErrorReporter(String moduleName, boolean printStackTracesRef, String nodeNameRef)
    {
        dmModule = moduleName;
        printStackTraces = printStackTracesRef;
        nodeName = nodeNameRef;
        instanceEpoch = LocalDateTime.now();
        instanceId = ErrorReporter.getNewLogId().toUpperCase();
    }

    protected void renderReport(
        ErrorReportRenderer output,
        long reportNr,
        Throwable errorInfo,
        LocalDateTime errorTime,
        @Nullable String contextInfo,
        boolean includeStackTrace
    )
    {
        output.println("ERROR REPORT %s-%06d", instanceId, reportNr);
        output.println();
        output.println("Module:                             %s", dmModule);
        output.println("Node:                               %s", nodeName);
        output.println("Instance start time:                %s", TIMESTAMP_FORMAT.format(instanceEpoch));
        output.println("Error time:                         %s", TIMESTAMP_FORMAT.format(errorTime));
        output.println("Thread:                             %s", Thread.currentThread().getName());
        output.println();
        output.printSection("Context", contextInfo);

        Throwable curErr = errorInfo;
        int level = 0;
        while (curErr != null)
        {
            output.println(level == 0 ? "Reported error:" : "Caused by:");
            output.println("===============");
            output.increaseIndent();
            output.println("Category:                           %s", categoryOf(curErr));
            output.println("Class name:                         %s", curErr.getClass().getSimpleName());
            output.println("Class canonical name:               %s", curErr.getClass().getCanonicalName());
            output.decreaseIndent();
            output.println();
            output.printSection("Error message", curErr.getMessage());
            if (curErr instanceof HostStorException)
            {
                HostStorException hsExc = (HostStorException) curErr;
                output.printSection("Description", hsExc.getDescriptionText());
                output.printSection("Cause", hsExc.getCauseText());
                output.printSection("Correction", hsExc.getCorrectionText());
                output.printSection("Additional information", hsExc.getDetailsText());
            }
            if (includeStackTrace)
            {
                output.println("Call backtrace:");
                output.increaseIndent();
                for (StackTraceElement traceElem : curErr.getStackTrace())
                {
                    output.println("%s", traceElem);
                }
                output.decreaseIndent();
            }
            output.println();
            curErr = curErr.getCause();
            ++level;
        }
        output.println("END OF ERROR REPORT.");
    }

    protected String formatLogMsg(long reportNr, Throwable errorInfo)
    {
        String excMsg = errorInfo.getMessage();
        if (excMsg == null)
        {
            excMsg = errorInfo.getClass().getSimpleName();
        }
        return String.format("%s [Report number %s-%06d]", excMsg, instanceId, reportNr);
    }

    private static String categoryOf(Throwable errorInfo)
    {
        String category;
        if (errorInfo instanceof RuntimeException)
        {
            category = "RuntimeException";
        }
        else
        if (errorInfo instanceof Exception)
        {
            category = "Exception";
        }
        else
        if (errorInfo instanceof Error)
        {
            category = "Error";
        }
        else
        {
            category = "Throwable";
        }
        return category;
    }
}
