package org.hostvirt.hoststor.storage.lvm;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * Builds the <code>devices/filter</code> value that restricts LVM to the given devices
 *
 * Example: <code>["a|^/dev/mapper/a$|^/dev/mapper/b$|", "r|.*|"]</code>
 */
public final class LvmFilterBuilder
{
    public static final String REJECT_ALL = "\"r|.*|\"";

    private static final String REGEX_META_CHARS = ".^$*+?()[]{}|";

    private LvmFilterBuilder()
    {
    }

    /**
     * Merges both device collections, trims the identifiers, drops empty ones and returns them sorted
     * and without duplicates. Identical device sets always yield identical lists.
     */
    public static List<String> normalizeDevices(Collection<String> devices, Collection<String> extraDevices)
    {
        TreeSet<String> sortedDevices = new TreeSet<>();
        addTrimmed(sortedDevices, devices);
        addTrimmed(sortedDevices, extraDevices);
        return Collections.unmodifiableList(new ArrayList<>(sortedDevices));
    }

    public static String buildFilter(Collection<String> devices)
    {
        return buildFilter(devices, Collections.emptyList());
    }

    public static String buildFilter(Collection<String> devices, Collection<String> extraDevices)
    {
        return buildFilterNormalized(normalizeDevices(devices, extraDevices));
    }

    /**
     * Builds the filter for a device list that {@link #normalizeDevices} already sorted and deduplicated
     */
    static String buildFilterNormalized(List<String> normalizedDevices)
    {
        StringBuilder filter = new StringBuilder("[");
        if (!normalizedDevices.isEmpty())
        {
            StringJoiner accept = new StringJoiner("|", "\"a|", "|\", ");
            for (String device : normalizedDevices)
            {
                accept.add("^" + escape(device) + "$");
            }
            filter.append(accept);
        }
        filter.append(REJECT_ALL).append("]");
        return filter.toString();
    }

    /**
     * Escapes a device identifier so that LVM matches it literally. Backslashes are doubled,
     * regex metacharacters and double quotes get a backslash prefix.
     */
    static String escape(String device)
    {
        StringBuilder escaped = new StringBuilder(device.length() + 8);
        for (int idx = 0; idx < device.length(); ++idx)
        {
            final char chr = device.charAt(idx);
            if (chr == '\\')
            {
                escaped.append("\\\\");
            }
            else
            if (chr == '"' || REGEX_META_CHARS.indexOf(chr) != -1)
            {
                escaped.append('\\').append(chr);
            }
            else
            {
                escaped.append(chr);
            }
        }
        return escaped.toString();
    }

    private static void addTrimmed(TreeSet<String> target, Collection<String> devices)
    {
        for (String device : devices)
        {
            String trimmed = device.trim();
            if (!trimmed.isEmpty())
            {
                target.add(trimmed);
            }
        }
    }
}
