package org.hostvirt.hoststor.logging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import org.hostvirt.hoststor.storage.StorageException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.event.Level;

public class StdErrorReporterTest
{
    @Rule
    public TemporaryFolder tmpFolder = new TemporaryFolder();

    @Test
    public void writesReportFile() throws Exception
    {
        Path logDir = tmpFolder.getRoot().toPath().resolve("logs");
        StdErrorReporter errorReporter = new StdErrorReporter("UnitTest", logDir, false, "node1", "WARN", null);

        StorageException exc = new StorageException(
            "Failed to list devices",
            "The devices could not be determined",
            "sysfs is not mounted",
            "Mount sysfs",
            "Path: /sys/block",
            new IOException("no such directory")
        );
        String logName = errorReporter.reportProblem(Level.WARN, exc, "Running lvs");

        assertNotNull(logName);
        assertEquals(logDir, errorReporter.getLogDirectory());
        Path reportFile = logDir.resolve(StdErrorReporter.RPT_PREFIX + logName + StdErrorReporter.RPT_SUFFIX);
        assertTrue(Files.exists(reportFile));

        String report = new String(Files.readAllBytes(reportFile), StandardCharsets.UTF_8);
        assertThat(report)
            .contains("ERROR REPORT " + logName)
            .contains("node1")
            .contains("Running lvs")
            .contains("Failed to list devices")
            .contains("sysfs is not mounted")
            .contains("no such directory")
            .doesNotContain("Call backtrace:")
            .contains("END OF ERROR REPORT.");
    }

    @Test
    public void reportNumbersIncrease()
    {
        StdErrorReporter errorReporter = new StdErrorReporter(
            "UnitTest", tmpFolder.getRoot().toPath(), false, "node1", null, null
        );
        String first = errorReporter.reportError(new IllegalStateException("first"));
        String second = errorReporter.reportError(Level.ERROR, new IllegalStateException("second"), "ctx");

        assertThat(first).startsWith(errorReporter.getInstanceId()).endsWith("-000000");
        assertThat(second).endsWith("-000001");
        assertTrue(Files.exists(tmpFolder.getRoot().toPath().resolve("ErrorReport-" + second + ".log")));
    }

    @Test
    public void logLevel()
    {
        StdErrorReporter errorReporter = new StdErrorReporter(
            "UnitTest", tmpFolder.getRoot().toPath(), false, "node1", "INFO", "DEBUG"
        );
        assertEquals(Level.DEBUG, errorReporter.getCurrentLogLevel());
        assertTrue(errorReporter.hasAtLeastLogLevel(Level.INFO));

        errorReporter.setLogLevel(null, Level.ERROR);
        assertEquals(Level.ERROR, errorReporter.getCurrentLogLevel());
    }
}
