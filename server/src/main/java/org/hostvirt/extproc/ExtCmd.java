package org.hostvirt.extproc;

import org.hostvirt.ChildProcessTimeoutException;
import org.hostvirt.hoststor.logging.ErrorReporter;
import org.hostvirt.utils.ShellUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.TimeUnit;

import org.slf4j.MDC;

/**
 * Runs an external command, logs and saves its output
 *
 * If the command does not exit within the wait timeout, it is terminated, and if it does not
 * exit within the termination timeout either, it is killed.
 */
public class ExtCmd
{
    // Default: Wait up to 45 seconds for a child process to exit
    public static final long DFLT_WAIT_TIMEOUT = 45000;

    // Default: Wait up to 15 seconds for a child process to exit after receiving a signal
    public static final long DFLT_TERM_TIMEOUT = 15000;

    // Default: Wait up to 5 seconds for a child process to exit after being killed
    public static final long DFLT_KILL_TIMEOUT = 5000;

    private final ErrorReporter errLog;

    private long waitTimeout = DFLT_WAIT_TIMEOUT;
    private long termTimeout = DFLT_TERM_TIMEOUT;
    private long killTimeout = DFLT_KILL_TIMEOUT;

    private boolean logExecution = true;

    public ExtCmd(ErrorReporter errLogRef)
    {
        errLog = errLogRef;
    }

    public ExtCmd setTimeout(long waitTimeoutRef)
    {
        if (waitTimeoutRef < 0)
        {
            throw new IllegalArgumentException("Bad timeout value: " + waitTimeoutRef);
        }
        waitTimeout = waitTimeoutRef;
        return this;
    }

    public ExtCmd logExecution(boolean logRef)
    {
        logExecution = logRef;
        return this;
    }

    public OutputData exec(String... command)
        throws IOException, ChildProcessTimeoutException
    {
        final String execCommandStr = ShellUtils.joinShellQuote(command);
        if (logExecution)
        {
            errLog.logDebug("Executing command: %s", execCommandStr);
        }

        ProcessBuilder pBuilder = new ProcessBuilder(command);
        pBuilder.redirectError(ProcessBuilder.Redirect.PIPE);
        pBuilder.redirectOutput(ProcessBuilder.Redirect.PIPE);
        pBuilder.redirectInput(ProcessBuilder.Redirect.INHERIT);

        final long startTime = System.currentTimeMillis();
        Process child = pBuilder.start();
        OutputReceiver outReceiver = new OutputReceiver(
            child.getInputStream(), errLog, logExecution, MDC.get(ErrorReporter.LOGID)
        );
        OutputReceiver errReceiver = new OutputReceiver(
            child.getErrorStream(), errLog, logExecution, MDC.get(ErrorReporter.LOGID)
        );
        new Thread(outReceiver, "ExtCmdOut").start();
        new Thread(errReceiver, "ExtCmdErr").start();

        int exitCode = waitFor(child, execCommandStr);
        outReceiver.finish();
        errReceiver.finish();

        if (logExecution)
        {
            errLog.logTrace(
                "External command finished in %dms: %s",
                System.currentTimeMillis() - startTime,
                execCommandStr
            );
        }
        return new OutputData(command, outReceiver.getData(), errReceiver.getData(), exitCode);
    }

    private int waitFor(Process child, String execCommandStr)
        throws ChildProcessTimeoutException, IOException
    {
        int exitCode;
        try
        {
            if (child.waitFor(waitTimeout, TimeUnit.MILLISECONDS))
            {
                exitCode = child.exitValue();
            }
            else
            {
                errLog.logWarning(
                    "External command did not exit within %dms, terminating: %s",
                    waitTimeout,
                    execCommandStr
                );
                child.destroy();
                boolean terminated = child.waitFor(termTimeout, TimeUnit.MILLISECONDS);
                if (!terminated)
                {
                    child.destroyForcibly();
                    terminated = child.waitFor(killTimeout, TimeUnit.MILLISECONDS);
                }
                throw new ChildProcessTimeoutException(
                    "External command timed out: " + execCommandStr,
                    terminated
                );
            }
        }
        catch (InterruptedException intrExc)
        {
            child.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for external command: " + execCommandStr, intrExc);
        }
        return exitCode;
    }

    public static class OutputData
    {
        public final String[] executedCommand;
        public final byte[] stdoutData;
        public final byte[] stderrData;
        public final int exitCode;

        public OutputData(String[] executeCmd, byte[] out, byte[] err, int retCode)
        {
            executedCommand = executeCmd;
            stdoutData = out;
            stderrData = err;
            exitCode = retCode;
        }

        public InputStream getStdoutStream()
        {
            return new ByteArrayInputStream(stdoutData);
        }

        public InputStream getStderrStream()
        {
            return new ByteArrayInputStream(stderrData);
        }
    }
}
