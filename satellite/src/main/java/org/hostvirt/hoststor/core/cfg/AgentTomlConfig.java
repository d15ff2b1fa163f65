package org.hostvirt.hoststor.core.cfg;

import org.hostvirt.hoststor.annotation.Nullable;

import java.util.List;

@SuppressWarnings("checkstyle:MemberName")
public class AgentTomlConfig
{
    static class Lvm
    {
        private @Nullable String path;
        private @Nullable String sudo_command;
        private @Nullable Integer max_commands;
        private @Nullable Integer read_only_retries;
        private @Nullable Long retry_delay_ms;
        private @Nullable Long command_timeout_ms;
        private @Nullable List<String> extra_devices;
        private @Nullable String locking_mode;

        public void applyTo(AgentConfig cfg)
        {
            cfg.setLvmPath(path);
            cfg.setSudoCommand(sudo_command);
            cfg.setMaxCommands(max_commands);
            cfg.setReadOnlyRetries(read_only_retries);
            cfg.setRetryDelayMs(retry_delay_ms);
            cfg.setCommandTimeoutMs(command_timeout_ms);
            cfg.setExtraDevices(extra_devices);
            if (locking_mode != null)
            {
                cfg.setLockingMode(AgentConfig.parseLockingMode(locking_mode));
            }
        }
    }

    static class Logging
    {
        private @Nullable String dir;
        private @Nullable String level;
        private @Nullable String hoststor_level;
        private @Nullable Boolean print_stack_trace;

        public void applyTo(AgentConfig cfg)
        {
            cfg.setLogDirectory(dir);
            cfg.setLogLevel(level);
            cfg.setLogLevelHostStor(hoststor_level);
            cfg.setLogPrintStackTrace(print_stack_trace);
        }
    }

    private Lvm lvm = new Lvm();
    private Logging logging = new Logging();

    public void applyTo(AgentConfig cfg)
    {
        lvm.applyTo(cfg);
        logging.applyTo(cfg);
    }
}
