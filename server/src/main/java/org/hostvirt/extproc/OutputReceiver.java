package org.hostvirt.extproc;

import org.hostvirt.hoststor.annotation.Nullable;
import org.hostvirt.hoststor.logging.ErrorReporter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.MDC;
import org.slf4j.event.Level;

/**
 * Logs and saves the output of external commands
 */
public class OutputReceiver implements Runnable
{
    public static final int READ_BUFFER_SIZE = 0x10000;

    // Maximum data size 4 MiB
    public static final int MAX_DATA_SIZE = 0x400000;

    private final InputStream dataIn;
    private final ErrorReporter errLog;
    private final boolean logExecution;
    private final @Nullable String logId;
    private final ByteArrayOutputStream data = new ByteArrayOutputStream();

    private boolean finished = false;
    private boolean overflow = false;
    private @Nullable IOException savedIoExc = null;

    public OutputReceiver(
        InputStream in,
        ErrorReporter errLogRef,
        boolean logExecutionRef,
        @Nullable String logIdRef
    )
    {
        dataIn = in;
        errLog = errLogRef;
        logExecution = logExecutionRef;
        logId = logIdRef;
    }

    /**
     * Reads data until end of stream. Data beyond MAX_DATA_SIZE is read and discarded so that
     * the child process never blocks on a full pipe.
     */
    @Override
    public void run()
    {
        if (logId != null)
        {
            MDC.put(ErrorReporter.LOGID, logId);
        }
        try
        {
            byte[] buffer = new byte[READ_BUFFER_SIZE];
            int lineOffset = 0;
            int readCount;
            while ((readCount = dataIn.read(buffer)) != -1)
            {
                int keepCount = Math.min(readCount, MAX_DATA_SIZE - data.size());
                if (keepCount < readCount)
                {
                    overflow = true;
                }
                if (keepCount > 0)
                {
                    data.write(buffer, 0, keepCount);
                    lineOffset = logLines(lineOffset);
                }
            }
        }
        catch (IOException ioExc)
        {
            savedIoExc = ioExc;
        }
        finally
        {
            MDC.remove(ErrorReporter.LOGID);
            synchronized (this)
            {
                finished = true;
                notifyAll();
            }
        }
    }

    /**
     * Returns the data that has been read. Call {@link #finish()} first.
     *
     * @throws IOException If the data exceeded the maximum size, if reading failed,
     *     or if I/O is still in progress
     */
    public synchronized byte[] getData() throws IOException
    {
        if (!finished)
        {
            throw new IOException("Attempt to access data before I/O is finished");
        }
        if (overflow)
        {
            throw new IOException("Data buffer size limit exceeded");
        }
        if (savedIoExc != null)
        {
            throw savedIoExc;
        }
        return data.toByteArray();
    }

    /**
     * Waits until the end of the stream has been reached
     */
    public synchronized void finish() throws IOException
    {
        try
        {
            while (!finished)
            {
                wait();
            }
        }
        catch (InterruptedException intrExc)
        {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for the output of an external command", intrExc);
        }
    }

    private int logLines(final int lineOffset)
    {
        int updLineOffset = lineOffset;
        if (logExecution && errLog.hasAtLeastLogLevel(Level.TRACE))
        {
            byte[] current = data.toByteArray();
            for (int idx = updLineOffset; idx < current.length; ++idx)
            {
                if (current[idx] == '\n')
                {
                    errLog.logTrace("%s", new String(current, updLineOffset, idx - updLineOffset, StandardCharsets.UTF_8));
                    updLineOffset = idx + 1;
                }
            }
        }
        return updLineOffset;
    }
}
