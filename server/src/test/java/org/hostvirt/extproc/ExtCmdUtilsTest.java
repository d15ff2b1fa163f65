package org.hostvirt.extproc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.hostvirt.extproc.ExtCmd.OutputData;
import org.hostvirt.hoststor.storage.StorageException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.Test;

public class ExtCmdUtilsTest
{
    private static OutputData output(int exitCode)
    {
        return new OutputData(
            new String[] {"/sbin/lvm", "lvs", "vg 0"},
            "some output".getBytes(StandardCharsets.UTF_8),
            "some error".getBytes(StandardCharsets.UTF_8),
            exitCode
        );
    }

    @Test
    public void zeroExitCodePasses() throws Exception
    {
        ExtCmdUtils.checkExitCode(output(0), StorageException::new, "never thrown");
    }

    @Test
    public void nonZeroExitCodeThrows()
    {
        assertThatThrownBy(() -> ExtCmdUtils.checkExitCode(output(5), StorageException::new, "lvs of %s failed", "vg 0"))
            .isInstanceOfSatisfying(
                StorageException.class,
                exc ->
                {
                    assertThat(exc.getMessage()).isEqualTo("lvs of vg 0 failed");
                    assertThat(exc.getDetailsText())
                        .contains("Command '/sbin/lvm lvs 'vg 0'' returned with exitcode 5")
                        .contains("some output")
                        .contains("some error");
                }
            );
    }

    @Test
    public void defaultMessage()
    {
        assertThatThrownBy(() -> ExtCmdUtils.checkExitCode(output(1), StorageException::new, null))
            .hasMessage("External command failed");
    }

    @Test
    public void expectedExitCodes() throws Exception
    {
        ExtCmdUtils.checkExitCode(output(5), Arrays.asList(0, 5), StorageException::new, null);
        assertThatThrownBy(
            () -> ExtCmdUtils.checkExitCode(output(3), Arrays.asList(0, 5), StorageException::new, null)
        ).isInstanceOf(StorageException.class);
    }
}
