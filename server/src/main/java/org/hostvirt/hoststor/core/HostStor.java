package org.hostvirt.hoststor.core;

import java.net.InetAddress;
import java.net.UnknownHostException;

public final class HostStor
{
    public static final String PROGRAM = "HostStor";
    public static final String SATELLITE_MODULE = "Satellite";

    public static final int EXIT_CODE_SHUTDOWN = 0;
    public static final int EXIT_CODE_CMDLINE_ERROR = 2;
    public static final int EXIT_CODE_CONFIG_PARSE_ERROR = 3;
    public static final int EXIT_CODE_STORAGE_ERROR = 4;
    public static final int EXIT_CODE_IMPL_ERROR = 199;

    private HostStor()
    {
    }

    public static String getHostName()
    {
        String hostName;
        try
        {
            hostName = InetAddress.getLocalHost().getHostName();
        }
        catch (UnknownHostException unknownHostExc)
        {
            hostName = "localhost";
        }
        return hostName;
    }
}
