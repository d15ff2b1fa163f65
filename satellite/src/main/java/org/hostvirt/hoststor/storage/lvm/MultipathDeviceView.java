package org.hostvirt.hoststor.storage.lvm;

import org.hostvirt.hoststor.storage.StorageException;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lists the multipath devices of this host by scanning the device mapper entries in sysfs
 *
 * A device mapper device is a multipath device if its <code>dm/uuid</code> starts with
 * <code>mpath-</code>. It is reported by its <code>/dev/mapper/&lt;name&gt;</code> path.
 */
@Singleton
public class MultipathDeviceView implements DeviceView
{
    public static final Path DFLT_SYS_BLOCK = Paths.get("/sys/block");
    public static final String DEV_MAPPER_DIR = "/dev/mapper/";
    public static final String MPATH_UUID_PREFIX = "mpath-";

    private final Path sysBlock;

    @Inject
    public MultipathDeviceView()
    {
        this(DFLT_SYS_BLOCK);
    }

    public MultipathDeviceView(Path sysBlockRef)
    {
        sysBlock = sysBlockRef;
    }

    @Override
    public List<String> getDevices() throws StorageException
    {
        List<String> devices = new ArrayList<>();
        // no /sys/block means no multipath devices at all
        if (Files.isDirectory(sysBlock))
        {
            try (DirectoryStream<Path> dmEntries = Files.newDirectoryStream(sysBlock, "dm-*"))
            {
                for (Path dmEntry : dmEntries)
                {
                    Path dmDir = dmEntry.resolve("dm");
                    try
                    {
                        if (readValue(dmDir.resolve("uuid")).startsWith(MPATH_UUID_PREFIX))
                        {
                            devices.add(DEV_MAPPER_DIR + readValue(dmDir.resolve("name")));
                        }
                    }
                    catch (NoSuchFileException noFileExc)
                    {
                        // no uuid, or the device was removed while scanning
                    }
                }
            }
            catch (IOException ioExc)
            {
                throw new StorageException(
                    "Failed to list the multipath devices",
                    "The multipath devices of this host could not be determined",
                    "Reading the device mapper entries in " + sysBlock + " failed",
                    "Check whether sysfs is mounted and readable",
                    null,
                    ioExc
                );
            }
        }
        Collections.sort(devices);
        return devices;
    }

    private static String readValue(Path file) throws IOException
    {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8).trim();
    }
}
