package org.hostvirt.hoststor.core.cfg;

import org.hostvirt.hoststor.annotation.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.hostvirt.hoststor.core.cfg.HostStorEnvParser.getEnv;
import static org.hostvirt.hoststor.core.cfg.HostStorEnvParser.getEnvInt;

class AgentEnvParser
{
    public static final String HOSTSTOR_LVM_PATH = "HOSTSTOR_LVM_PATH";
    public static final String HOSTSTOR_MAX_COMMANDS = "HOSTSTOR_MAX_COMMANDS";
    public static final String HOSTSTOR_READ_ONLY_RETRIES = "HOSTSTOR_READ_ONLY_RETRIES";
    public static final String HOSTSTOR_RETRY_DELAY_MS = "HOSTSTOR_RETRY_DELAY_MS";
    public static final String HOSTSTOR_EXTRA_DEVICES = "HOSTSTOR_EXTRA_DEVICES";
    public static final String HOSTSTOR_LOCKING_MODE = "HOSTSTOR_LOCKING_MODE";

    private AgentEnvParser()
    {
    }

    static void applyTo(Map<String, String> env, AgentConfig cfg)
    {
        HostStorEnvParser.applyTo(env, cfg);

        cfg.setLvmPath(getEnv(env, HOSTSTOR_LVM_PATH));
        cfg.setMaxCommands(getEnvInt(env, HOSTSTOR_MAX_COMMANDS));
        cfg.setReadOnlyRetries(getEnvInt(env, HOSTSTOR_READ_ONLY_RETRIES));

        Integer retryDelay = getEnvInt(env, HOSTSTOR_RETRY_DELAY_MS);
        cfg.setRetryDelayMs(retryDelay == null ? null : retryDelay.longValue());

        cfg.setExtraDevices(splitDevices(getEnv(env, HOSTSTOR_EXTRA_DEVICES)));

        String lockingMode = getEnv(env, HOSTSTOR_LOCKING_MODE);
        if (lockingMode != null)
        {
            cfg.setLockingMode(AgentConfig.parseLockingMode(lockingMode));
        }
    }

    /**
     * Splits a comma or whitespace separated device list
     */
    static @Nullable List<String> splitDevices(@Nullable String devices)
    {
        List<String> result = null;
        if (devices != null)
        {
            result = Arrays.stream(devices.split("[,\\s]+"))
                .filter(dev -> !dev.isEmpty())
                .collect(Collectors.toList());
        }
        return result;
    }
}
