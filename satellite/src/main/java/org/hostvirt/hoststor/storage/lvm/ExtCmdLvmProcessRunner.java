package org.hostvirt.hoststor.storage.lvm;

import org.hostvirt.ChildProcessTimeoutException;
import org.hostvirt.extproc.ExtCmd.OutputData;
import org.hostvirt.extproc.ExtCmdFactory;
import org.hostvirt.extproc.ExtCmdFailedException;
import org.hostvirt.hoststor.storage.StorageException;
import org.hostvirt.utils.ShellUtils;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Singleton
public class ExtCmdLvmProcessRunner implements LvmProcessRunner
{
    private final ExtCmdFactory extCmdFactory;
    private final LvmSettings settings;

    @Inject
    public ExtCmdLvmProcessRunner(ExtCmdFactory extCmdFactoryRef, LvmSettings settingsRef)
    {
        extCmdFactory = extCmdFactoryRef;
        settings = settingsRef;
    }

    @Override
    public OutputData run(String[] command, boolean privileged) throws StorageException
    {
        String[] fullCommand = privileged ? prefixSudo(command) : command;
        try
        {
            return extCmdFactory.create()
                .setTimeout(settings.getCommandTimeoutMs())
                .exec(fullCommand);
        }
        catch (ChildProcessTimeoutException timeoutExc)
        {
            throw new ExtCmdFailedException(fullCommand, timeoutExc);
        }
        catch (IOException ioExc)
        {
            throw new ExtCmdFailedException(fullCommand, ioExc);
        }
    }

    String[] prefixSudo(String[] command)
    {
        List<String> fullCommand = new ArrayList<>(ShellUtils.shellSplit(settings.getSudoCommand()));
        fullCommand.addAll(Arrays.asList(command));
        return fullCommand.toArray(new String[0]);
    }
}
