package org.hostvirt.utils;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class ShellUtilsTest
{
    @Test
    public void shellSplit()
    {
        assertEquals(Arrays.asList("/usr/bin/sudo", "-n"), ShellUtils.shellSplit("/usr/bin/sudo -n"));
        assertEquals(Arrays.asList("a", "b c", "d e", "f"), ShellUtils.shellSplit("  a 'b c'  \"d e\" f "));
        assertEquals(Arrays.asList("a b", "c\\d"), ShellUtils.shellSplit("a\\ b 'c\\d'"));
        assertEquals(Collections.emptyList(), ShellUtils.shellSplit("   "));
    }

    @Test
    public void shellQuote()
    {
        assertEquals("''", ShellUtils.shellQuote(""));
        assertEquals("/dev/mapper/a", ShellUtils.shellQuote("/dev/mapper/a"));
        assertEquals("'a b'", ShellUtils.shellQuote("a b"));
        assertEquals("'it'\"'\"'s'", ShellUtils.shellQuote("it's"));
    }

    @Test
    public void joinShellQuote()
    {
        assertEquals(
            "/sbin/lvm lvs --config 'devices { filter=[\"r|.*|\"] }'",
            ShellUtils.joinShellQuote("/sbin/lvm", "lvs", "--config", "devices { filter=[\"r|.*|\"] }")
        );
    }
}
