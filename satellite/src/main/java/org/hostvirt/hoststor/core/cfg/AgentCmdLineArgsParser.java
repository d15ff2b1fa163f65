package org.hostvirt.hoststor.core.cfg;

import org.hostvirt.hoststor.HostStorRuntimeException;
import org.hostvirt.hoststor.annotation.Nullable;
import org.hostvirt.hoststor.core.HostStor;
import org.hostvirt.hoststor.storage.lvm.LockingMode;

import java.io.File;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import picocli.CommandLine;

class AgentCmdLineArgsParser
{
    @CommandLine.Option(names = {"-c", "--config-directory"},
        description = "Configuration directory for the satellite"
    )
    private @Nullable String configurationDirectory;

    @CommandLine.Option(
        names = {"-p", "--stack-traces"},
        description = "print error stack traces on standard error"
    )
    private @Nullable Boolean printStackTrace;

    @CommandLine.Option(names = {"-l", "--logs"}, description = "Path to the log directory")
    private @Nullable String logDirectory;

    @CommandLine.Option(names = {"--log-level"},
        description = "The desired log level. Options: ERROR, WARN, INFO, DEBUG, TRACE")
    private @Nullable String logLevel;

    @CommandLine.Option(names = {"--log-level-hoststor"},
        description = "The desired log level. Options: ERROR, WARN, INFO, DEBUG, TRACE")
    private @Nullable String logLevelHostStor;

    @CommandLine.Option(names = {"--shared"}, description = "Run LVM commands in shared locking mode")
    private @Nullable Boolean shared;

    @CommandLine.Option(names = {"--lvm-path"}, description = "Path to the lvm binary")
    private @Nullable String lvmPath;

    @CommandLine.Option(names = {"--max-commands"},
        description = "Maximum number of concurrently running LVM commands")
    private @Nullable Integer maxCommands;

    @CommandLine.Option(names = {"--read-only-retries"},
        description = "Number of retries of a failed LVM command in shared locking mode")
    private @Nullable Integer readOnlyRetries;

    @CommandLine.Option(names = {"--retry-delay-ms"},
        description = "Delay between retries of a failed LVM command in milliseconds")
    private @Nullable Long retryDelayMs;

    @CommandLine.Option(names = {"--extra-device"},
        description = "Device that is always included in the LVM filter, may be given multiple times")
    private @Nullable List<String> extraDevices;

    @CommandLine.Option(names = {"-h", "--help"}, usageHelp = true, description = "display this help message")
    private @Nullable Boolean usageHelpRequested;

    @CommandLine.Parameters(paramLabel = "LVM_ARGS",
        description = "LVM command and arguments to run, e.g. -- lvs -o +tags")
    private @Nullable List<String> lvmArgs;

    @SuppressFBWarnings("ISC_INSTANTIATE_STATIC_CLASS")
    static void parseCommandLine(String[] args, AgentConfig agentCfgRef)
    {
        AgentCmdLineArgsParser agentArgParser = new AgentCmdLineArgsParser();
        CommandLine cmd = createCommandLine(agentArgParser);

        try
        {
            cmd.parseArgs(args);
        }
        catch (CommandLine.ParameterException exc)
        {
            throw new HostStorRuntimeException(exc.getMessage(), exc);
        }

        agentCfgRef.setUsageHelpRequested(cmd.isUsageHelpRequested());

        if (agentArgParser.configurationDirectory != null)
        {
            agentCfgRef.setConfigDir(agentArgParser.configurationDirectory + "/");
            File workingDir = Paths.get(agentCfgRef.getConfigDir()).toAbsolutePath().toFile();
            if (workingDir.exists() && !workingDir.isDirectory())
            {
                throw new HostStorRuntimeException("Given configuration directory is no directory");
            }
        }

        agentCfgRef.setLogDirectory(agentArgParser.logDirectory);
        agentCfgRef.setLogPrintStackTrace(agentArgParser.printStackTrace);
        agentCfgRef.setLogLevel(agentArgParser.logLevel);
        agentCfgRef.setLogLevelHostStor(agentArgParser.logLevelHostStor);

        if (Boolean.TRUE.equals(agentArgParser.shared))
        {
            agentCfgRef.setLockingMode(LockingMode.SHARED);
        }
        agentCfgRef.setLvmPath(agentArgParser.lvmPath);
        agentCfgRef.setMaxCommands(agentArgParser.maxCommands);
        agentCfgRef.setReadOnlyRetries(agentArgParser.readOnlyRetries);
        agentCfgRef.setRetryDelayMs(agentArgParser.retryDelayMs);
        agentCfgRef.setExtraDevices(agentArgParser.extraDevices);
        agentCfgRef.setLvmArgs(agentArgParser.lvmArgs);
    }

    static void usage(PrintStream out)
    {
        createCommandLine(new AgentCmdLineArgsParser()).usage(out);
    }

    private static CommandLine createCommandLine(AgentCmdLineArgsParser agentArgParser)
    {
        CommandLine cmd = new CommandLine(agentArgParser);
        cmd.setCommandName(HostStor.SATELLITE_MODULE);
        cmd.setOverwrittenOptionsAllowed(true);
        return cmd;
    }

    private AgentCmdLineArgsParser()
    {
    }
}
