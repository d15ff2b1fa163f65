package org.hostvirt.hoststor.storage.lvm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.junit.Test;

public class LvmFilterBuilderTest
{
    @Test
    public void buildFilter()
    {
        assertEquals(
            "[\"a|^/dev/mapper/a$|^/dev/mapper/b$|\", \"r|.*|\"]",
            LvmFilterBuilder.buildFilter(Arrays.asList("/dev/mapper/a", "/dev/mapper/b"))
        );
    }

    @Test
    public void buildFilterNoDevices()
    {
        // a host without any multipath device
        assertEquals("[\"r|.*|\"]", LvmFilterBuilder.buildFilter(Collections.emptyList()));
    }

    @Test
    public void buildFilterQuoting()
    {
        assertEquals(
            "[\"a|^\\\\x20\\\\x24\\\\x7c\\\\x22\\\\x28$|\", \"r|.*|\"]",
            LvmFilterBuilder.buildFilter(Collections.singletonList("\\x20\\x24\\x7c\\x22\\x28"))
        );
    }

    @Test
    public void escapeRegexMetaCharacters()
    {
        assertEquals("/dev/mapper/a\\.b\\|c\\$", LvmFilterBuilder.escape("/dev/mapper/a.b|c$"));
        assertEquals("\\(x\\)\\[y\\]\\{z\\}\\*\\+\\?\\^", LvmFilterBuilder.escape("(x)[y]{z}*+?^"));
        assertEquals("quote\\\"d", LvmFilterBuilder.escape("quote\"d"));
        assertEquals("/dev/sda-1_2", LvmFilterBuilder.escape("/dev/sda-1_2"));
    }

    @Test
    public void buildFilterWithExtraDevices()
    {
        assertEquals(
            "[\"a|^/dev/a$|^/dev/b$|^/dev/c$|\", \"r|.*|\"]",
            LvmFilterBuilder.buildFilter(Arrays.asList("/dev/a", "/dev/c"), Collections.singletonList("/dev/b"))
        );
    }

    @Test
    public void buildFilterOnlyExtraDevices()
    {
        assertEquals(
            "[\"a|^/dev/b$|\", \"r|.*|\"]",
            LvmFilterBuilder.buildFilter(Collections.emptyList(), Collections.singletonList("/dev/b"))
        );
    }

    @Test
    public void buildFilterIgnoresOrder()
    {
        List<String> devices = Arrays.asList("/dev/mapper/c", "/dev/mapper/a", "/dev/mapper/b", "/dev/mapper/d");
        String expected = LvmFilterBuilder.buildFilter(devices);

        List<String> shuffled = new ArrayList<>(devices);
        for (int iteration = 0; iteration < 10; ++iteration)
        {
            Collections.rotate(shuffled, 1);
            if (iteration % 3 == 0)
            {
                Collections.reverse(shuffled);
            }
            assertEquals(expected, LvmFilterBuilder.buildFilter(shuffled));
        }
        assertEquals(expected, LvmFilterBuilder.buildFilter(new HashSet<>(devices)));
    }

    @Test
    public void normalizeDevices()
    {
        assertThat(
            LvmFilterBuilder.normalizeDevices(
                Arrays.asList(" /dev/mapper/b", "/dev/mapper/a", "", "   ", "/dev/mapper/b"),
                Arrays.asList("/dev/mapper/a ", "/dev/sda2")
            )
        ).containsExactly("/dev/mapper/a", "/dev/mapper/b", "/dev/sda2");
    }

    @Test
    public void duplicatesDoNotChangeTheFilter()
    {
        assertEquals(
            LvmFilterBuilder.buildFilter(Arrays.asList("/dev/mapper/a", "/dev/mapper/b")),
            LvmFilterBuilder.buildFilter(Arrays.asList("/dev/mapper/b", "/dev/mapper/a", "/dev/mapper/b"))
        );
    }

    @Test
    public void unsortedListWithDuplicates()
    {
        List<String> devices = new ArrayList<>(Arrays.asList("/dev/mapper/b", "/dev/mapper/a", "/dev/mapper/b"));
        assertEquals(
            "[\"a|^/dev/mapper/a$|^/dev/mapper/b$|\", \"r|.*|\"]",
            LvmFilterBuilder.buildFilter(devices)
        );
    }

    @Test
    public void buildFilterNormalizedSingleDevice()
    {
        assertEquals(
            "[\"a|^/dev/mapper/a$|\", \"r|.*|\"]",
            LvmFilterBuilder.buildFilterNormalized(Collections.singletonList("/dev/mapper/a"))
        );
    }
}
