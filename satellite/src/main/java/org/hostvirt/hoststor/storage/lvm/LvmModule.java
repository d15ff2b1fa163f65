package org.hostvirt.hoststor.storage.lvm;

import com.google.inject.AbstractModule;

public class LvmModule extends AbstractModule
{
    @Override
    protected void configure()
    {
        bind(DeviceView.class).to(MultipathDeviceView.class);
        bind(LvmProcessRunner.class).to(ExtCmdLvmProcessRunner.class);
    }
}
