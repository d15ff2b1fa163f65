package org.hostvirt.hoststor.core.cfg;

import org.hostvirt.hoststor.HostStorRuntimeException;
import org.hostvirt.hoststor.annotation.Nullable;
import org.hostvirt.hoststor.storage.lvm.LockingMode;
import org.hostvirt.hoststor.storage.lvm.LvmSettings;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.moandjiezana.toml.Toml;

/**
 * Configuration of the HostStor satellite
 */
public class AgentConfig extends HostStorConfig
{
    public static final String SATELLITE_CONFIG_FILE = "hoststor_satellite.toml";

    /*
     * LVM
     */
    private String lvmPath;
    private String sudoCommand;
    private int maxCommands;
    private int readOnlyRetries;
    private long retryDelayMs;
    private long commandTimeoutMs;
    private List<String> extraDevices;
    private LockingMode lockingMode;

    /*
     * Invocation
     */
    private List<String> lvmArgs = Collections.emptyList();
    private boolean usageHelpRequested;

    public AgentConfig(String[] args)
    {
        this(args, System.getenv());
    }

    public AgentConfig(String[] args, Map<String, String> env)
    {
        load(args, env);
    }

    @Override
    protected void applyDefaultValues()
    {
        super.applyDefaultValues();

        setLvmPath(LvmSettings.DFLT_LVM_PATH);
        setSudoCommand(LvmSettings.DFLT_SUDO_COMMAND);
        setMaxCommands(LvmSettings.DFLT_MAX_COMMANDS);
        setReadOnlyRetries(LvmSettings.DFLT_READ_ONLY_RETRIES);
        setRetryDelayMs(LvmSettings.DFLT_RETRY_DELAY_MS);
        setCommandTimeoutMs(LvmSettings.DFLT_COMMAND_TIMEOUT_MS);
        setExtraDevices(Collections.emptyList());
        setLockingMode(LockingMode.EXCLUSIVE);
    }

    @Override
    protected void applyCmdLineArgs(String[] args)
    {
        AgentCmdLineArgsParser.parseCommandLine(args, this);
    }

    @Override
    protected void applyTomlArgs()
    {
        Path cfgPath = Paths.get(configDir, SATELLITE_CONFIG_FILE).normalize();
        if (Files.exists(cfgPath))
        {
            try
            {
                AgentTomlConfig agentToml = new Toml().read(cfgPath.toFile()).to(AgentTomlConfig.class);
                agentToml.applyTo(this);
            }
            catch (RuntimeException tomlExc)
            {
                throw new HostStorRuntimeException(
                    String.format("Error parsing '%s': %s", cfgPath, tomlExc.getMessage()),
                    tomlExc
                );
            }
        }
    }

    @Override
    protected void applyEnvVars(Map<String, String> env)
    {
        AgentEnvParser.applyTo(env, this);
    }

    public LvmSettings toLvmSettings()
    {
        return LvmSettings.builder()
            .lvmPath(lvmPath)
            .sudoCommand(sudoCommand)
            .maxCommands(maxCommands)
            .readOnlyRetries(readOnlyRetries)
            .retryDelayMs(retryDelayMs)
            .commandTimeoutMs(commandTimeoutMs)
            .extraDevices(extraDevices)
            .initialMode(lockingMode)
            .build();
    }

    public static void printUsage(PrintStream out)
    {
        AgentCmdLineArgsParser.usage(out);
    }

    public static LockingMode parseLockingMode(String value)
    {
        try
        {
            return LockingMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException exc)
        {
            throw new HostStorRuntimeException(
                "Invalid locking mode '" + value + "', expected 'exclusive' or 'shared'",
                exc
            );
        }
    }

    public String getLvmPath()
    {
        return lvmPath;
    }

    public void setLvmPath(@Nullable String lvmPathRef)
    {
        if (lvmPathRef != null)
        {
            lvmPath = lvmPathRef;
        }
    }

    public String getSudoCommand()
    {
        return sudoCommand;
    }

    public void setSudoCommand(@Nullable String sudoCommandRef)
    {
        if (sudoCommandRef != null)
        {
            sudoCommand = sudoCommandRef;
        }
    }

    public int getMaxCommands()
    {
        return maxCommands;
    }

    public void setMaxCommands(@Nullable Integer maxCommandsRef)
    {
        if (maxCommandsRef != null)
        {
            if (maxCommandsRef < 1)
            {
                throw new HostStorRuntimeException("max_commands must be at least 1, was " + maxCommandsRef);
            }
            maxCommands = maxCommandsRef;
        }
    }

    public int getReadOnlyRetries()
    {
        return readOnlyRetries;
    }

    public void setReadOnlyRetries(@Nullable Integer readOnlyRetriesRef)
    {
        if (readOnlyRetriesRef != null)
        {
            if (readOnlyRetriesRef < 0)
            {
                throw new HostStorRuntimeException(
                    "read_only_retries must not be negative, was " + readOnlyRetriesRef
                );
            }
            readOnlyRetries = readOnlyRetriesRef;
        }
    }

    public long getRetryDelayMs()
    {
        return retryDelayMs;
    }

    public void setRetryDelayMs(@Nullable Long retryDelayMsRef)
    {
        if (retryDelayMsRef != null)
        {
            if (retryDelayMsRef < 0)
            {
                throw new HostStorRuntimeException("retry_delay_ms must not be negative, was " + retryDelayMsRef);
            }
            retryDelayMs = retryDelayMsRef;
        }
    }

    public long getCommandTimeoutMs()
    {
        return commandTimeoutMs;
    }

    public void setCommandTimeoutMs(@Nullable Long commandTimeoutMsRef)
    {
        if (commandTimeoutMsRef != null)
        {
            if (commandTimeoutMsRef < 0)
            {
                throw new HostStorRuntimeException(
                    "command_timeout_ms must not be negative, was " + commandTimeoutMsRef
                );
            }
            commandTimeoutMs = commandTimeoutMsRef;
        }
    }

    public List<String> getExtraDevices()
    {
        return extraDevices;
    }

    public void setExtraDevices(@Nullable List<String> extraDevicesRef)
    {
        if (extraDevicesRef != null)
        {
            extraDevices = Collections.unmodifiableList(new ArrayList<>(extraDevicesRef));
        }
    }

    public LockingMode getLockingMode()
    {
        return lockingMode;
    }

    public void setLockingMode(@Nullable LockingMode lockingModeRef)
    {
        if (lockingModeRef != null)
        {
            lockingMode = lockingModeRef;
        }
    }

    /**
     * @return the LVM command and its arguments given on the command line, may be empty
     */
    public List<String> getLvmArgs()
    {
        return lvmArgs;
    }

    public void setLvmArgs(@Nullable List<String> lvmArgsRef)
    {
        if (lvmArgsRef != null)
        {
            lvmArgs = Collections.unmodifiableList(new ArrayList<>(lvmArgsRef));
        }
    }

    public boolean isUsageHelpRequested()
    {
        return usageHelpRequested;
    }

    public void setUsageHelpRequested(@Nullable Boolean usageHelpRequestedRef)
    {
        if (usageHelpRequestedRef != null)
        {
            usageHelpRequested = usageHelpRequestedRef;
        }
    }
}
