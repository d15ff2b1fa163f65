package org.hostvirt.hoststor.core.cfg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.hostvirt.hoststor.HostStorRuntimeException;
import org.hostvirt.hoststor.storage.lvm.LockingMode;
import org.hostvirt.hoststor.storage.lvm.LvmSettings;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class AgentConfigTest
{
    @Rule
    public TemporaryFolder tmpFolder = new TemporaryFolder();

    private Path cfgDir;
    private Map<String, String> env;

    @Before
    public void setUp() throws IOException
    {
        cfgDir = tmpFolder.newFolder("cfg").toPath();
        env = new HashMap<>();
        env.put(HostStorEnvParser.HOSTSTOR_CONFIG_DIR, cfgDir.toString());
    }

    private void writeToml(String content) throws IOException
    {
        Files.write(cfgDir.resolve(AgentConfig.SATELLITE_CONFIG_FILE), content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void defaults()
    {
        AgentConfig cfg = new AgentConfig(new String[0], env);

        assertEquals(cfgDir.toString(), cfg.getConfigDir());
        assertEquals(HostStorConfig.DEFAULT_LOG_DIRECTORY, cfg.getLogDirectory());
        assertEquals("INFO", cfg.getLogLevel());
        assertEquals(LvmSettings.DFLT_LVM_PATH, cfg.getLvmPath());
        assertEquals(LvmSettings.DFLT_MAX_COMMANDS, cfg.getMaxCommands());
        assertEquals(LvmSettings.DFLT_READ_ONLY_RETRIES, cfg.getReadOnlyRetries());
        assertEquals(LvmSettings.DFLT_RETRY_DELAY_MS, cfg.getRetryDelayMs());
        assertEquals(LockingMode.EXCLUSIVE, cfg.getLockingMode());
        assertThat(cfg.getExtraDevices()).isEmpty();
        assertThat(cfg.getLvmArgs()).isEmpty();
        assertFalse(cfg.isUsageHelpRequested());
    }

    @Test
    public void tomlFile() throws Exception
    {
        writeToml(
            "[lvm]\n" +
            "path = \"/usr/sbin/lvm\"\n" +
            "sudo_command = \"/usr/local/bin/sudo -n\"\n" +
            "max_commands = 4\n" +
            "read_only_retries = 2\n" +
            "retry_delay_ms = 250\n" +
            "command_timeout_ms = 60000\n" +
            "extra_devices = [\"/dev/sda2\", \"/dev/sdb1\"]\n" +
            "locking_mode = \"shared\"\n" +
            "\n" +
            "[logging]\n" +
            "dir = \"/tmp/hoststor-logs\"\n" +
            "level = \"debug\"\n" +
            "hoststor_level = \"trace\"\n" +
            "print_stack_trace = true\n"
        );

        AgentConfig cfg = new AgentConfig(new String[0], env);

        assertEquals("/usr/sbin/lvm", cfg.getLvmPath());
        assertEquals("/usr/local/bin/sudo -n", cfg.getSudoCommand());
        assertEquals(4, cfg.getMaxCommands());
        assertEquals(2, cfg.getReadOnlyRetries());
        assertEquals(250, cfg.getRetryDelayMs());
        assertEquals(60000, cfg.getCommandTimeoutMs());
        assertThat(cfg.getExtraDevices()).containsExactly("/dev/sda2", "/dev/sdb1");
        assertEquals(LockingMode.SHARED, cfg.getLockingMode());
        assertEquals("/tmp/hoststor-logs", cfg.getLogDirectory());
        assertEquals("debug", cfg.getLogLevel());
        assertEquals("trace", cfg.getLogLevelHostStor());
        assertTrue(cfg.isLogPrintStackTrace());
    }

    @Test
    public void partialTomlFile() throws Exception
    {
        writeToml("[logging]\nlevel = \"warn\"\n");

        AgentConfig cfg = new AgentConfig(new String[0], env);

        assertEquals("warn", cfg.getLogLevel());
        assertEquals(LvmSettings.DFLT_LVM_PATH, cfg.getLvmPath());
    }

    @Test
    public void envOverridesToml() throws Exception
    {
        writeToml("[lvm]\nmax_commands = 4\nread_only_retries = 2\n");
        env.put(AgentEnvParser.HOSTSTOR_MAX_COMMANDS, "6");
        env.put(AgentEnvParser.HOSTSTOR_RETRY_DELAY_MS, "50");
        env.put(AgentEnvParser.HOSTSTOR_EXTRA_DEVICES, "/dev/sda2, /dev/sdb1 /dev/sdc1");
        env.put(AgentEnvParser.HOSTSTOR_LOCKING_MODE, "SHARED");
        env.put(HostStorEnvParser.HOSTSTOR_LOG_LEVEL, "ERROR");

        AgentConfig cfg = new AgentConfig(new String[0], env);

        assertEquals(6, cfg.getMaxCommands());
        assertEquals(2, cfg.getReadOnlyRetries());
        assertEquals(50, cfg.getRetryDelayMs());
        assertThat(cfg.getExtraDevices()).containsExactly("/dev/sda2", "/dev/sdb1", "/dev/sdc1");
        assertEquals(LockingMode.SHARED, cfg.getLockingMode());
        assertEquals("ERROR", cfg.getLogLevel());
    }

    @Test
    public void invalidEnvNumberIsIgnored()
    {
        env.put(AgentEnvParser.HOSTSTOR_MAX_COMMANDS, "many");
        assertEquals(LvmSettings.DFLT_MAX_COMMANDS, new AgentConfig(new String[0], env).getMaxCommands());
    }

    @Test
    public void cmdLineOverridesEnv() throws Exception
    {
        writeToml("[lvm]\nmax_commands = 4\n");
        env.put(AgentEnvParser.HOSTSTOR_MAX_COMMANDS, "6");

        AgentConfig cfg = new AgentConfig(
            new String[]
            {
                "--max-commands", "8",
                "--shared",
                "--extra-device", "/dev/sda2",
                "--extra-device", "/dev/sdb1",
                "--log-level", "TRACE",
                "--", "lvs", "-o", "+tags"
            },
            env
        );

        assertEquals(8, cfg.getMaxCommands());
        assertEquals(LockingMode.SHARED, cfg.getLockingMode());
        assertThat(cfg.getExtraDevices()).containsExactly("/dev/sda2", "/dev/sdb1");
        assertEquals("TRACE", cfg.getLogLevel());
        assertThat(cfg.getLvmArgs()).containsExactly("lvs", "-o", "+tags");
    }

    @Test
    public void configDirFromCmdLine() throws Exception
    {
        Path otherDir = tmpFolder.newFolder("other").toPath();
        Files.write(
            otherDir.resolve(AgentConfig.SATELLITE_CONFIG_FILE),
            "[lvm]\nread_only_retries = 7\n".getBytes(StandardCharsets.UTF_8)
        );
        writeToml("[lvm]\nread_only_retries = 1\n");

        AgentConfig cfg = new AgentConfig(new String[] {"-c", otherDir.toString()}, env);

        assertEquals(7, cfg.getReadOnlyRetries());
    }

    @Test
    public void toLvmSettings()
    {
        AgentConfig cfg = new AgentConfig(
            new String[] {"--lvm-path", "/opt/lvm", "--read-only-retries", "3", "--retry-delay-ms", "10"},
            env
        );
        LvmSettings settings = cfg.toLvmSettings();

        assertEquals("/opt/lvm", settings.getLvmPath());
        assertEquals(3, settings.getReadOnlyRetries());
        assertEquals(10, settings.getRetryDelayMs());
        assertEquals(LvmSettings.DFLT_MAX_COMMANDS, settings.getMaxCommands());
        assertEquals(LvmSettings.DFLT_SUDO_COMMAND, settings.getSudoCommand());
        assertEquals(LockingMode.EXCLUSIVE, settings.getInitialMode());
        assertEquals(Collections.emptyList(), settings.getExtraDevices());
    }

    @Test
    public void helpRequested()
    {
        assertTrue(new AgentConfig(new String[] {"-h"}, env).isUsageHelpRequested());
    }

    @Test
    public void usage()
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        AgentConfig.printUsage(new PrintStream(out, true));
        assertThat(out.toString()).contains("--max-commands").contains("--shared");
    }

    @Test
    public void unknownOption()
    {
        assertThatThrownBy(() -> new AgentConfig(new String[] {"--no-such-option"}, env))
            .isInstanceOf(HostStorRuntimeException.class);
    }

    @Test
    public void invalidValues() throws Exception
    {
        assertThatThrownBy(() -> new AgentConfig(new String[] {"--max-commands", "0"}, env))
            .isInstanceOf(HostStorRuntimeException.class);

        writeToml("[lvm]\nlocking_mode = \"sometimes\"\n");
        assertThatThrownBy(() -> new AgentConfig(new String[0], env))
            .isInstanceOf(HostStorRuntimeException.class)
            .hasMessageContaining("sometimes");
    }

    @Test
    public void malformedToml() throws Exception
    {
        writeToml("[lvm\nmax_commands = \n");
        assertThatThrownBy(() -> new AgentConfig(new String[0], env))
            .isInstanceOf(HostStorRuntimeException.class)
            .hasMessageContaining(AgentConfig.SATELLITE_CONFIG_FILE);
    }
}
