package org.hostvirt.hoststor.core.cfg;

import org.hostvirt.hoststor.annotation.Nullable;

import java.util.Map;

/**
 * Configuration values shared by all HostStor modules
 *
 * Values are applied in layers: defaults, the TOML configuration file, environment variables,
 * and finally the command line. A layer only overrides a value if it actually specifies it, which is
 * why every setter ignores null.
 */
public abstract class HostStorConfig
{
    public static final String DEFAULT_CONFIG_DIR = "/etc/hoststor";
    public static final String DEFAULT_LOG_DIRECTORY = "/var/log/hoststor";

    protected @Nullable String configDir;

    /*
     * Logging
     */
    private @Nullable String logDirectory;
    private @Nullable String logLevel;
    private @Nullable String logLevelHostStor;
    private boolean logPrintStackTrace;

    protected HostStorConfig()
    {
    }

    /**
     * Applies all configuration layers. The configuration directory, which determines the TOML file
     * to read, is taken from the environment and the command line before the file is read, and the
     * command line is applied again last to override all other layers.
     */
    protected void load(String[] args, Map<String, String> env)
    {
        applyDefaultValues();
        setConfigDir(HostStorEnvParser.getEnv(env, HostStorEnvParser.HOSTSTOR_CONFIG_DIR));
        applyCmdLineArgs(args);
        applyTomlArgs();
        applyEnvVars(env);
        applyCmdLineArgs(args);
    }

    protected void applyDefaultValues()
    {
        setConfigDir(DEFAULT_CONFIG_DIR);
        setLogDirectory(DEFAULT_LOG_DIRECTORY);
        setLogLevel("INFO");
        setLogPrintStackTrace(false);
    }

    protected abstract void applyCmdLineArgs(String[] args);

    protected abstract void applyTomlArgs();

    protected abstract void applyEnvVars(Map<String, String> env);

    public String getConfigDir()
    {
        return configDir;
    }

    public void setConfigDir(@Nullable String configDirRef)
    {
        if (configDirRef != null)
        {
            configDir = configDirRef;
        }
    }

    public String getLogDirectory()
    {
        return logDirectory;
    }

    public void setLogDirectory(@Nullable String logDirectoryRef)
    {
        if (logDirectoryRef != null)
        {
            logDirectory = logDirectoryRef;
        }
    }

    public @Nullable String getLogLevel()
    {
        return logLevel;
    }

    public void setLogLevel(@Nullable String logLevelRef)
    {
        if (logLevelRef != null)
        {
            logLevel = logLevelRef;
        }
    }

    public @Nullable String getLogLevelHostStor()
    {
        return logLevelHostStor;
    }

    public void setLogLevelHostStor(@Nullable String logLevelHostStorRef)
    {
        if (logLevelHostStorRef != null)
        {
            logLevelHostStor = logLevelHostStorRef;
        }
    }

    public boolean isLogPrintStackTrace()
    {
        return logPrintStackTrace;
    }

    public void setLogPrintStackTrace(@Nullable Boolean logPrintStackTraceRef)
    {
        if (logPrintStackTraceRef != null)
        {
            logPrintStackTrace = logPrintStackTraceRef;
        }
    }
}
