package org.hostvirt.hoststor.storage.utils;

import org.hostvirt.extproc.ExtCmd.OutputData;
import org.hostvirt.extproc.ExtCmdUtils;
import org.hostvirt.hoststor.annotation.Nullable;
import org.hostvirt.hoststor.storage.StorageException;
import org.hostvirt.hoststor.storage.lvm.LvmCommandExecutor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * LVM commands run through the {@link LvmCommandExecutor}
 *
 * Modifying commands throw a {@link StorageException} if the final attempt exits with a non-zero
 * exit code. Query commands return the raw output.
 */
public class LvmCommands
{
    public static final String SEPARATOR = "|";

    public static final String PVS_FIELDS =
        "uuid,name,size,vg_name,vg_uuid,pe_start,pe_count,pe_alloc_count,mda_count,dev_size";
    public static final String VGS_FIELDS =
        "uuid,name,attr,size,free,extent_size,extent_count,free_count,tags,vg_mda_size,vg_mda_free,lv_count,pv_name";
    public static final String LVS_FIELDS =
        "uuid,name,vg_name,attr,size,seg_start_pe,devices,tags";

    private static final String[] QUERY_OPTIONS =
    {
        "--noheadings",
        "--units", "b",
        "--nosuffix",
        "--separator", SEPARATOR,
        "--ignoreskippedcluster"
    };

    private LvmCommands()
    {
    }

    public static OutputData pvs(LvmCommandExecutor lvm, String... devices) throws StorageException
    {
        return lvm.cmd(queryCommand("pvs", PVS_FIELDS, devices));
    }

    public static OutputData vgs(LvmCommandExecutor lvm, String... vgNames) throws StorageException
    {
        return lvm.cmd(queryCommand("vgs", VGS_FIELDS, vgNames));
    }

    public static OutputData lvs(LvmCommandExecutor lvm, String vgName) throws StorageException
    {
        return lvm.cmd(queryCommand("lvs", LVS_FIELDS, vgName));
    }

    /**
     * Initializes the given devices as physical volumes. Since the devices may not be part
     * of the cached filter yet, the command is restricted to exactly these devices.
     */
    public static void pvCreate(LvmCommandExecutor lvm, Collection<String> devices, long metadataSizeMb)
        throws StorageException
    {
        List<String> command = new ArrayList<>(Arrays.asList(
            "pvcreate",
            "--metadatasize", metadataSizeMb + "m",
            "--metadatacopies", "2",
            "--metadataignore", "y"
        ));
        command.addAll(devices);
        try
        {
            execute(lvm, devices, "Failed to create physical volumes on " + devices, command);
        }
        finally
        {
            lvm.invalidateFilter();
        }
    }

    public static void vgCreate(
        LvmCommandExecutor lvm,
        String vgName,
        Collection<String> devices,
        String initialTag,
        long extentSizeMb
    )
        throws StorageException
    {
        List<String> command = new ArrayList<>(Arrays.asList(
            "vgcreate",
            "--physicalextentsize", extentSizeMb + "m",
            "--addtag", initialTag,
            vgName
        ));
        command.addAll(devices);
        try
        {
            execute(lvm, devices, "Failed to create volume group " + vgName, command);
        }
        finally
        {
            lvm.invalidateFilter();
        }
    }

    /**
     * Adds the given devices to the volume group. The filter is rebuilt first, so that it
     * includes both the volume group's current physical volumes and the new devices.
     */
    public static void vgExtend(LvmCommandExecutor lvm, String vgName, Collection<String> devices)
        throws StorageException
    {
        lvm.invalidateFilter();
        List<String> command = new ArrayList<>(Arrays.asList("vgextend", vgName));
        command.addAll(devices);
        execute(lvm, "Failed to extend volume group " + vgName, command);
    }

    public static void vgReduce(LvmCommandExecutor lvm, String vgName, String device) throws StorageException
    {
        execute(lvm, "Failed to remove " + device + " from volume group " + vgName, "vgreduce", vgName, device);
    }

    public static void vgRemove(LvmCommandExecutor lvm, String vgName) throws StorageException
    {
        execute(lvm, "Failed to remove volume group " + vgName, "vgremove", "-f", vgName);
    }

    public static void vgChangeTags(
        LvmCommandExecutor lvm,
        String vgName,
        Collection<String> delTags,
        Collection<String> addTags
    )
        throws StorageException
    {
        List<String> command = new ArrayList<>();
        command.add("vgchange");
        addTagOptions(command, delTags, addTags);
        command.add(vgName);
        execute(lvm, "Failed to change the tags of volume group " + vgName, command);
    }

    public static void lvChangeTags(
        LvmCommandExecutor lvm,
        String vgName,
        String lvName,
        Collection<String> delTags,
        Collection<String> addTags
    )
        throws StorageException
    {
        List<String> command = new ArrayList<>(Arrays.asList("lvchange", "--autobackup", "n"));
        addTagOptions(command, delTags, addTags);
        command.add(lvPath(vgName, lvName));
        execute(lvm, "Failed to change the tags of logical volume " + lvPath(vgName, lvName), command);
    }

    /**
     * @param device if not null, the physical volume to allocate the logical volume on
     */
    public static void lvCreate(
        LvmCommandExecutor lvm,
        String vgName,
        String lvName,
        long sizeMb,
        boolean activate,
        @Nullable String device
    )
        throws StorageException
    {
        List<String> command = new ArrayList<>(Arrays.asList(
            "lvcreate",
            "--autobackup", "n",
            "--contiguous", "n",
            "--size", sizeMb + "m",
            "--activate", activate ? "y" : "n",
            "--name", lvName,
            vgName
        ));
        if (device != null)
        {
            command.add(device);
        }
        execute(lvm, "Failed to create logical volume " + lvPath(vgName, lvName), command);
    }

    public static void lvRemove(LvmCommandExecutor lvm, String vgName, Collection<String> lvNames)
        throws StorageException
    {
        List<String> command = new ArrayList<>(Arrays.asList("lvremove", "-f", "--autobackup", "n"));
        command.addAll(lvPaths(vgName, lvNames));
        execute(lvm, "Failed to remove logical volumes " + lvNames + " of volume group " + vgName, command);
    }

    public static void lvExtend(LvmCommandExecutor lvm, String vgName, String lvName, long sizeMb)
        throws StorageException
    {
        execute(
            lvm,
            "Failed to extend logical volume " + lvPath(vgName, lvName),
            "lvextend", "--autobackup", "n", "--size", sizeMb + "m", lvPath(vgName, lvName)
        );
    }

    public static void lvReduce(LvmCommandExecutor lvm, String vgName, String lvName, long sizeMb, boolean force)
        throws StorageException
    {
        List<String> command = new ArrayList<>(Arrays.asList("lvreduce", "--autobackup", "n"));
        if (force)
        {
            command.add("--force");
        }
        command.add("--size");
        command.add(sizeMb + "m");
        command.add(lvPath(vgName, lvName));
        execute(lvm, "Failed to reduce logical volume " + lvPath(vgName, lvName), command);
    }

    public static void lvRename(LvmCommandExecutor lvm, String vgName, String oldName, String newName)
        throws StorageException
    {
        execute(
            lvm,
            "Failed to rename logical volume " + lvPath(vgName, oldName) + " to " + newName,
            "lvrename", "--autobackup", "n", vgName, oldName, newName
        );
    }

    public static void lvActivate(LvmCommandExecutor lvm, String vgName, Collection<String> lvNames)
        throws StorageException
    {
        lvChange(lvm, vgName, lvNames, "Failed to activate", "--available", "y");
    }

    public static void lvDeactivate(LvmCommandExecutor lvm, String vgName, Collection<String> lvNames)
        throws StorageException
    {
        lvChange(lvm, vgName, lvNames, "Failed to deactivate", "--available", "n");
    }

    public static void lvRefresh(LvmCommandExecutor lvm, String vgName, Collection<String> lvNames)
        throws StorageException
    {
        lvChange(lvm, vgName, lvNames, "Failed to refresh", "--refresh");
    }

    private static void lvChange(
        LvmCommandExecutor lvm,
        String vgName,
        Collection<String> lvNames,
        String failMsg,
        String... options
    )
        throws StorageException
    {
        List<String> command = new ArrayList<>(Arrays.asList("lvchange", "--autobackup", "n"));
        command.addAll(Arrays.asList(options));
        command.addAll(lvPaths(vgName, lvNames));
        execute(lvm, failMsg + " logical volumes " + lvNames + " of volume group " + vgName, command);
    }

    private static String[] queryCommand(String lvmCmd, String fields, String... targets)
    {
        List<String> command = new ArrayList<>();
        command.add(lvmCmd);
        command.addAll(Arrays.asList(QUERY_OPTIONS));
        command.add("-o");
        command.add(fields);
        command.addAll(Arrays.asList(targets));
        return command.toArray(new String[0]);
    }

    private static void addTagOptions(List<String> command, Collection<String> delTags, Collection<String> addTags)
    {
        for (String tag : delTags)
        {
            command.add("--deltag");
            command.add(tag);
        }
        for (String tag : addTags)
        {
            command.add("--addtag");
            command.add(tag);
        }
    }

    private static String lvPath(String vgName, String lvName)
    {
        return vgName + "/" + lvName;
    }

    private static List<String> lvPaths(String vgName, Collection<String> lvNames)
    {
        List<String> paths = new ArrayList<>();
        for (String lvName : lvNames)
        {
            paths.add(lvPath(vgName, lvName));
        }
        return paths;
    }

    private static OutputData execute(LvmCommandExecutor lvm, String failMsg, String... command)
        throws StorageException
    {
        return execute(lvm, Collections.emptyList(), failMsg, Arrays.asList(command));
    }

    private static OutputData execute(LvmCommandExecutor lvm, String failMsg, List<String> command)
        throws StorageException
    {
        return execute(lvm, Collections.emptyList(), failMsg, command);
    }

    private static OutputData execute(
        LvmCommandExecutor lvm,
        Collection<String> devices,
        String failMsg,
        List<String> command
    )
        throws StorageException
    {
        OutputData output = lvm.cmd(devices, command.toArray(new String[0]));
        ExtCmdUtils.checkExitCode(output, StorageException::new, "%s", failMsg);
        return output;
    }
}
