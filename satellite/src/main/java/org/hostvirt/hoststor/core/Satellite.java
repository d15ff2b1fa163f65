package org.hostvirt.hoststor.core;

import org.hostvirt.extproc.ExtCmd.OutputData;
import org.hostvirt.hoststor.HostStorRuntimeException;
import org.hostvirt.hoststor.core.cfg.AgentConfig;
import org.hostvirt.hoststor.core.cfg.AgentConfigModule;
import org.hostvirt.hoststor.logging.ErrorReporter;
import org.hostvirt.hoststor.logging.LoggingModule;
import org.hostvirt.hoststor.logging.StdErrorReporter;
import org.hostvirt.hoststor.storage.StorageException;
import org.hostvirt.hoststor.storage.lvm.LvmCommandExecutor;
import org.hostvirt.hoststor.storage.lvm.LvmModule;

import javax.inject.Inject;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.MDC;
import org.slf4j.event.Level;

/**
 * HostStor satellite entry point
 *
 * Runs one LVM command through the command coordination and relays its output and exit code.
 * Without an LVM command, the LVM configuration for the current device view is printed.
 */
public final class Satellite
{
    private final ErrorReporter errorReporter;
    private final LvmCommandExecutor lvmExecutor;

    @Inject
    Satellite(ErrorReporter errorReporterRef, LvmCommandExecutor lvmExecutorRef)
    {
        errorReporter = errorReporterRef;
        lvmExecutor = lvmExecutorRef;
    }

    /**
     * @return the exit code of the LVM command, or 0 if only the configuration was printed
     */
    int run(List<String> lvmArgs, PrintStream out, PrintStream err) throws StorageException, IOException
    {
        int exitCode = HostStor.EXIT_CODE_SHUTDOWN;
        if (lvmArgs.isEmpty())
        {
            errorReporter.logDebug("No LVM command given, printing the LVM configuration");
            out.println(lvmExecutor.getConfig());
        }
        else
        {
            errorReporter.logDebug(
                "Running LVM command '%s' in %s locking mode",
                lvmArgs.get(0),
                lvmExecutor.getLockingMode().name()
            );
            OutputData output = lvmExecutor.cmd(lvmArgs.toArray(new String[0]));
            out.write(output.stdoutData);
            err.write(output.stderrData);
            out.flush();
            err.flush();
            exitCode = output.exitCode;
        }
        return exitCode;
    }

    public static void main(String[] args)
    {
        AgentConfig cfg = null;
        try
        {
            cfg = new AgentConfig(args);
        }
        catch (HostStorRuntimeException cfgExc)
        {
            System.err.println(cfgExc.getMessage());
            AgentConfig.printUsage(System.err);
            System.exit(HostStor.EXIT_CODE_CMDLINE_ERROR);
        }

        if (cfg.isUsageHelpRequested())
        {
            AgentConfig.printUsage(System.out);
            System.exit(HostStor.EXIT_CODE_SHUTDOWN);
        }

        System.setProperty("log.module", HostStor.SATELLITE_MODULE);
        System.setProperty("log.directory", cfg.getLogDirectory());

        MDC.put(ErrorReporter.LOGID, "ff" + ErrorReporter.getNewLogId().substring(2));
        StdErrorReporter errorLog = new StdErrorReporter(
            HostStor.SATELLITE_MODULE,
            Paths.get(cfg.getLogDirectory()),
            cfg.isLogPrintStackTrace(),
            HostStor.getHostName(),
            cfg.getLogLevel(),
            cfg.getLogLevelHostStor()
        );

        int exitCode;
        try
        {
            Thread.currentThread().setName("Main");

            final Injector injector = Guice.createInjector(
                new LoggingModule(errorLog),
                new AgentConfigModule(cfg),
                new LvmModule()
            );

            Satellite instance = injector.getInstance(Satellite.class);
            exitCode = instance.run(cfg.getLvmArgs(), System.out, System.err);
        }
        catch (StorageException storExc)
        {
            errorLog.reportProblem(Level.ERROR, storExc, "Running LVM command " + cfg.getLvmArgs());
            exitCode = HostStor.EXIT_CODE_STORAGE_ERROR;
        }
        catch (Throwable error)
        {
            errorLog.reportError(error);
            exitCode = HostStor.EXIT_CODE_IMPL_ERROR;
        }

        System.exit(exitCode);
    }
}
