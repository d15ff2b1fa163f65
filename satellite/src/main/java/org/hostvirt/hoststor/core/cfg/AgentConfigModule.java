package org.hostvirt.hoststor.core.cfg;

import org.hostvirt.hoststor.storage.lvm.LvmSettings;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

public class AgentConfigModule extends AbstractModule
{
    private final AgentConfig agentConfig;

    public AgentConfigModule(AgentConfig agentConfigRef)
    {
        agentConfig = agentConfigRef;
    }

    @Provides
    AgentConfig getAgentConfig()
    {
        return agentConfig;
    }

    @Provides
    @Singleton
    LvmSettings getLvmSettings()
    {
        return agentConfig.toLvmSettings();
    }
}
