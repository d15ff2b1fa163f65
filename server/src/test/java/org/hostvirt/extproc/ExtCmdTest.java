package org.hostvirt.extproc;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.hostvirt.ChildProcessTimeoutException;
import org.hostvirt.extproc.ExtCmd.OutputData;
import org.hostvirt.hoststor.logging.ErrorReporter;
import org.hostvirt.hoststor.logging.StderrErrorReporter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.Test;

public class ExtCmdTest
{
    private final ErrorReporter errLog = new StderrErrorReporter("HostStor-UnitTests");

    @Test
    public void capturesOutputAndExitCode() throws Exception
    {
        String[] command = {"/bin/sh", "-c", "echo out; echo err 1>&2; exit 3"};
        OutputData output = new ExtCmdFactory(errLog).create().exec(command);

        assertEquals(3, output.exitCode);
        assertEquals("out\n", new String(output.stdoutData, StandardCharsets.UTF_8));
        assertEquals("err\n", new String(output.stderrData, StandardCharsets.UTF_8));
        assertArrayEquals(command, output.executedCommand);
    }

    @Test
    public void timeout()
    {
        ExtCmd extCmd = new ExtCmd(errLog).setTimeout(200);

        assertThatThrownBy(() -> extCmd.exec("/bin/sh", "-c", "sleep 10"))
            .isInstanceOf(ChildProcessTimeoutException.class);
    }

    @Test
    public void missingProgram()
    {
        assertThatThrownBy(() -> new ExtCmd(errLog).exec("/nonexistent/hoststor-test-binary"))
            .isInstanceOf(IOException.class);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeTimeout()
    {
        new ExtCmd(errLog).setTimeout(-1);
    }
}
