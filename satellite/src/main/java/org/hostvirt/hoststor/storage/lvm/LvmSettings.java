package org.hostvirt.hoststor.storage.lvm;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Immutable tunables of the LVM command coordination
 */
public final class LvmSettings
{
    public static final String DFLT_LVM_PATH = "/sbin/lvm";
    public static final String DFLT_SUDO_COMMAND = "/usr/bin/sudo -n";
    public static final int DFLT_MAX_COMMANDS = 10;
    public static final int DFLT_READ_ONLY_RETRIES = 4;
    public static final long DFLT_RETRY_DELAY_MS = 1000;
    public static final long DFLT_COMMAND_TIMEOUT_MS = 45000;

    private final String lvmPath;
    private final String sudoCommand;
    private final int maxCommands;
    private final int readOnlyRetries;
    private final long retryDelayMs;
    private final long commandTimeoutMs;
    private final List<String> extraDevices;
    private final LockingMode initialMode;

    private LvmSettings(Builder builder)
    {
        lvmPath = builder.lvmPath;
        sudoCommand = builder.sudoCommand;
        maxCommands = builder.maxCommands;
        readOnlyRetries = builder.readOnlyRetries;
        retryDelayMs = builder.retryDelayMs;
        commandTimeoutMs = builder.commandTimeoutMs;
        extraDevices = Collections.unmodifiableList(new ArrayList<>(builder.extraDevices));
        initialMode = builder.initialMode;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public String getLvmPath()
    {
        return lvmPath;
    }

    public String getSudoCommand()
    {
        return sudoCommand;
    }

    public int getMaxCommands()
    {
        return maxCommands;
    }

    public int getReadOnlyRetries()
    {
        return readOnlyRetries;
    }

    public long getRetryDelayMs()
    {
        return retryDelayMs;
    }

    public long getCommandTimeoutMs()
    {
        return commandTimeoutMs;
    }

    /**
     * @return devices that are always merged into the filter, e.g. the host's own root PV
     */
    public List<String> getExtraDevices()
    {
        return extraDevices;
    }

    public LockingMode getInitialMode()
    {
        return initialMode;
    }

    public static final class Builder
    {
        private String lvmPath = DFLT_LVM_PATH;
        private String sudoCommand = DFLT_SUDO_COMMAND;
        private int maxCommands = DFLT_MAX_COMMANDS;
        private int readOnlyRetries = DFLT_READ_ONLY_RETRIES;
        private long retryDelayMs = DFLT_RETRY_DELAY_MS;
        private long commandTimeoutMs = DFLT_COMMAND_TIMEOUT_MS;
        private List<String> extraDevices = new ArrayList<>();
        private LockingMode initialMode = LockingMode.EXCLUSIVE;

        private Builder()
        {
        }

        public Builder lvmPath(String lvmPathRef)
        {
            lvmPath = lvmPathRef;
            return this;
        }

        public Builder sudoCommand(String sudoCommandRef)
        {
            sudoCommand = sudoCommandRef;
            return this;
        }

        public Builder maxCommands(int maxCommandsRef)
        {
            if (maxCommandsRef < 1)
            {
                throw new IllegalArgumentException("maxCommands must be at least 1, was " + maxCommandsRef);
            }
            maxCommands = maxCommandsRef;
            return this;
        }

        public Builder readOnlyRetries(int readOnlyRetriesRef)
        {
            if (readOnlyRetriesRef < 0)
            {
                throw new IllegalArgumentException("readOnlyRetries must not be negative, was " + readOnlyRetriesRef);
            }
            readOnlyRetries = readOnlyRetriesRef;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMsRef)
        {
            if (retryDelayMsRef < 0)
            {
                throw new IllegalArgumentException("retryDelayMs must not be negative, was " + retryDelayMsRef);
            }
            retryDelayMs = retryDelayMsRef;
            return this;
        }

        public Builder commandTimeoutMs(long commandTimeoutMsRef)
        {
            if (commandTimeoutMsRef < 0)
            {
                throw new IllegalArgumentException(
                    "commandTimeoutMs must not be negative, was " + commandTimeoutMsRef
                );
            }
            commandTimeoutMs = commandTimeoutMsRef;
            return this;
        }

        public Builder extraDevices(Collection<String> extraDevicesRef)
        {
            extraDevices = new ArrayList<>(extraDevicesRef);
            return this;
        }

        public Builder initialMode(LockingMode initialModeRef)
        {
            initialMode = initialModeRef;
            return this;
        }

        public LvmSettings build()
        {
            return new LvmSettings(this);
        }
    }
}
