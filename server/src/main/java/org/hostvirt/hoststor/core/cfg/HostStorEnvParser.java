package org.hostvirt.hoststor.core.cfg;

import org.hostvirt.hoststor.annotation.Nullable;

import java.util.Map;

/**
 * Applies the environment variables that all HostStor modules understand
 */
public class HostStorEnvParser
{
    public static final String HOSTSTOR_CONFIG_DIR = "HOSTSTOR_CONFIG_DIR";
    public static final String HOSTSTOR_LOG_DIRECTORY = "HOSTSTOR_LOG_DIRECTORY";
    public static final String HOSTSTOR_LOG_LEVEL = "HOSTSTOR_LOG_LEVEL";

    private HostStorEnvParser()
    {
    }

    public static void applyTo(Map<String, String> env, HostStorConfig cfg)
    {
        cfg.setLogDirectory(getEnv(env, HOSTSTOR_LOG_DIRECTORY));
        cfg.setLogLevel(getEnv(env, HOSTSTOR_LOG_LEVEL));
    }

    /**
     * @return the value of the variable, or null if it is unset or blank
     */
    public static @Nullable String getEnv(Map<String, String> env, String key)
    {
        String value = env.get(key);
        if (value != null && value.isBlank())
        {
            value = null;
        }
        return value;
    }

    public static @Nullable Integer getEnvInt(Map<String, String> env, String key)
    {
        Integer result = null;
        String value = getEnv(env, key);
        if (value != null)
        {
            try
            {
                result = Integer.valueOf(value.trim());
            }
            catch (NumberFormatException nfExc)
            {
                System.err.printf("Ignoring environment variable %s, not a number: '%s'%n", key, value);
            }
        }
        return result;
    }
}
