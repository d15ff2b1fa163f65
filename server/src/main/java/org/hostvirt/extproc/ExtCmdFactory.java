package org.hostvirt.extproc;

import org.hostvirt.hoststor.logging.ErrorReporter;

import javax.inject.Inject;
import javax.inject.Singleton;

@Singleton
public class ExtCmdFactory
{
    protected final ErrorReporter errlog;

    @Inject
    public ExtCmdFactory(ErrorReporter errorReporterRef)
    {
        errlog = errorReporterRef;
    }

    public ExtCmd create()
    {
        return new ExtCmd(errlog);
    }
}
