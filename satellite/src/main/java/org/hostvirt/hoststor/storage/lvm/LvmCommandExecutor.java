package org.hostvirt.hoststor.storage.lvm;

import org.hostvirt.ImplementationError;
import org.hostvirt.extproc.ExtCmd.OutputData;
import org.hostvirt.hoststor.logging.ErrorReporter;
import org.hostvirt.hoststor.storage.StorageException;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Runs LVM commands with a device filter and locking configuration matching this host
 *
 * A failed command is retried once with a rebuilt filter if the device view changed since the
 * cached filter was built. In shared locking mode a failed command is additionally retried up to
 * {@link LvmSettings#getReadOnlyRetries()} times, since a concurrent writer on the master host
 * may cause transient read failures. The result of the last attempt is returned, a non-zero
 * exit code is never turned into an exception here.
 */
@Singleton
public class LvmCommandExecutor
{
    public static final String CONFIG_OPTION = "--config";

    private final ErrorReporter errorReporter;
    private final LvmSettings settings;
    private final LvmCommandCache cache;
    private final LvmModeCoordinator coordinator;
    private final LvmConcurrencyGate gate;
    private final DeviceView deviceView;
    private final LvmProcessRunner processRunner;

    @Inject
    public LvmCommandExecutor(
        ErrorReporter errorReporterRef,
        LvmSettings settingsRef,
        LvmCommandCache cacheRef,
        LvmModeCoordinator coordinatorRef,
        LvmConcurrencyGate gateRef,
        DeviceView deviceViewRef,
        LvmProcessRunner processRunnerRef
    )
    {
        errorReporter = errorReporterRef;
        settings = settingsRef;
        cache = cacheRef;
        coordinator = coordinatorRef;
        gate = gateRef;
        deviceView = deviceViewRef;
        processRunner = processRunnerRef;
    }

    /**
     * Runs an LVM command restricted to the devices of the current device view
     *
     * @param args the LVM command (e.g. "lvs") followed by its arguments
     */
    public OutputData cmd(String... args) throws StorageException
    {
        return cmd(Collections.emptyList(), args);
    }

    /**
     * Runs an LVM command restricted to the given devices. The filter for those devices is
     * not cached. If no devices are given, the filter of the current device view is used.
     */
    public OutputData cmd(Collection<String> devices, String... args) throws StorageException
    {
        if (args.length == 0)
        {
            throw new ImplementationError("No LVM command specified");
        }

        LockingMode mode = coordinator.enter();
        try
        {
            OutputData output;
            if (devices.isEmpty())
            {
                output = runWithCachedFilter(mode, args);
            }
            else
            {
                LvmCacheEntry entry = cache.build(devices, mode);
                output = runAttempt(entry, args);
                if (output.exitCode != 0)
                {
                    output = retryShared(entry, args, output);
                }
            }
            return output;
        }
        finally
        {
            coordinator.leave();
        }
    }

    /**
     * Switches the locking mode once all running commands have completed
     */
    public void setLockingMode(LockingMode mode) throws StorageException
    {
        LockingMode prevMode = coordinator.setMode(mode);
        if (prevMode != null)
        {
            errorReporter.logInfo("LVM locking mode changed from %s to %s", prevMode.name(), mode.name());
        }
    }

    public LockingMode getLockingMode()
    {
        return coordinator.getMode();
    }

    /**
     * Drops the cached filter, e.g. after physical volumes were created
     */
    public void invalidateFilter()
    {
        cache.invalidate();
    }

    /**
     * @return the configuration text the next command without explicit devices would use
     */
    public String getConfig() throws StorageException
    {
        return cache.getOrBuild(deviceView::getDevices, coordinator.getMode()).getConfig();
    }

    private OutputData runWithCachedFilter(LockingMode mode, String[] args) throws StorageException
    {
        LvmCacheEntry entry = cache.getOrBuild(deviceView::getDevices, mode);
        OutputData output = runAttempt(entry, args);
        if (output.exitCode != 0)
        {
            final List<String> liveDevices = deviceView.getDevices();
            if (cache.isStale(entry, liveDevices))
            {
                errorReporter.logDebug(
                    "LVM command '%s' failed with a stale device filter, retrying with a rebuilt filter",
                    args[0]
                );
                cache.invalidate();
                entry = cache.getOrBuild(() -> liveDevices, mode);
                output = runAttempt(entry, args);
            }
            if (output.exitCode != 0)
            {
                output = retryShared(entry, args, output);
            }
        }
        return output;
    }

    private OutputData retryShared(LvmCacheEntry entry, String[] args, OutputData failedOutput)
        throws StorageException
    {
        OutputData output = failedOutput;
        if (entry.getLockingMode() == LockingMode.SHARED)
        {
            final int maxRetries = settings.getReadOnlyRetries();
            for (int retry = 1; retry <= maxRetries && output.exitCode != 0; ++retry)
            {
                errorReporter.logDebug(
                    "LVM command '%s' failed with exit code %d in shared mode, retry %d of %d",
                    args[0], output.exitCode, retry, maxRetries
                );
                delay();
                output = runAttempt(entry, args);
            }
        }
        if (output.exitCode != 0)
        {
            errorReporter.logDebug("LVM command '%s' failed with exit code %d", args[0], output.exitCode);
        }
        return output;
    }

    private OutputData runAttempt(LvmCacheEntry entry, String[] args) throws StorageException
    {
        String[] command = composeCommand(entry.getConfig(), args);
        try (LvmConcurrencyGate.Slot slot = gate.acquire())
        {
            return processRunner.run(command, true);
        }
    }

    String[] composeCommand(String config, String[] args)
    {
        String[] command = new String[args.length + 3];
        command[0] = settings.getLvmPath();
        command[1] = args[0];
        command[2] = CONFIG_OPTION;
        command[3] = config;
        System.arraycopy(args, 1, command, 4, args.length - 1);
        return command;
    }

    private void delay() throws StorageException
    {
        try
        {
            Thread.sleep(settings.getRetryDelayMs());
        }
        catch (InterruptedException intrExc)
        {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting to retry an LVM command", intrExc);
        }
    }
}
