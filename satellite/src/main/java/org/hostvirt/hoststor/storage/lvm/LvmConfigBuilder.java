package org.hostvirt.hoststor.storage.lvm;

/**
 * Builds the text passed to LVM's <code>--config</code> option
 *
 * The layout has to stay byte-identical for identical input, LVM parses it and the tests
 * compare it verbatim.
 */
public final class LvmConfigBuilder
{
    public static final String PREFERRED_NAMES = "[\"^/dev/mapper/\"]";
    public static final int IGNORE_SUSPENDED_DEVICES = 1;
    public static final int WRITE_CACHE_STATE = 0;
    public static final int DISABLE_AFTER_ERROR_COUNT = 3;

    public static final int PRIORITISE_WRITE_LOCKS = 1;
    public static final int WAIT_FOR_LOCKS = 1;
    public static final int USE_LVMETAD = 0;

    public static final int RETAIN_MIN = 50;
    public static final int RETAIN_DAYS = 0;

    private LvmConfigBuilder()
    {
    }

    public static String buildConfig(String devFilter, LockingMode mode)
    {
        return "devices { " +
            " preferred_names=" + PREFERRED_NAMES + " " +
            " ignore_suspended_devices=" + IGNORE_SUSPENDED_DEVICES + " " +
            " write_cache_state=" + WRITE_CACHE_STATE + " " +
            " disable_after_error_count=" + DISABLE_AFTER_ERROR_COUNT + " " +
            " filter=" + devFilter + " " +
            "} " +
            "global { " +
            " locking_type=" + mode.getLockingType() + " " +
            " prioritise_write_locks=" + PRIORITISE_WRITE_LOCKS + " " +
            " wait_for_locks=" + WAIT_FOR_LOCKS + " " +
            " use_lvmetad=" + USE_LVMETAD + " " +
            "} " +
            "backup { " +
            " retain_min=" + RETAIN_MIN + " " +
            " retain_days=" + RETAIN_DAYS + " " +
            "}";
    }
}
