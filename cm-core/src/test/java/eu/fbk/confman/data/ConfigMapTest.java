package eu.fbk.confman.data;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import org.junit.Assert;
import org.junit.Test;

public class ConfigMapTest {

    @Test
    public void testBuilder() {
        final ConfigMap map = ConfigMap.builder().put("TimeoutPhrase", "Hey")
                .put("Timeout", 1000L).put("Timeout", 500L).build();
        Assert.assertEquals(2, map.size());
        Assert.assertEquals(ConfigValue.of(500L), map.get("Timeout"));
        Assert.assertEquals(ConfigValue.of("Hey"), map.get("TimeoutPhrase"));
        Assert.assertNull(map.get("Missing"));
        Assert.assertEquals("{Timeout=500, TimeoutPhrase=\"Hey\"}", map.toString());
    }

    @Test
    public void testWithLeavesOriginalUnchanged() {
        final ConfigMap map = ConfigMap.builder().put("Timeout", 1000L).build();
        final ConfigMap changed = map.with("Timeout", ConfigValue.of("fast"));
        Assert.assertEquals(ConfigValue.of(1000L), map.get("Timeout"));
        Assert.assertEquals(ConfigValue.of("fast"), changed.get("Timeout"));
    }

    @Test
    public void testCopyOf() {
        final Map<String, Object> source = ImmutableMap.<String, Object>of("a", 1, "b", "x",
                "c", true);
        final ConfigMap map = ConfigMap.copyOf(source);
        Assert.assertEquals(ConfigValue.of(1L), map.get("a"));
        Assert.assertEquals(map, ConfigMap.copyOf(map.asMap()));
        Assert.assertSame(ConfigMap.of(), ConfigMap.copyOf(ImmutableMap.<String, Object>of()));
    }

    @Test
    public void testImmutableView() {
        final ConfigMap map = ConfigMap.builder().put("a", 1L).build();
        try {
            map.asMap().put("b", ConfigValue.of(2L));
            Assert.fail();
        } catch (final UnsupportedOperationException ex) {
            // ok
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyKey() {
        ConfigMap.builder().put("", "value");
    }

}
