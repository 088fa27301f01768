package eu.fbk.confman.data;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.ConfigurationException.Kind;

public class JsonTest {

    @Test
    public void testParse() throws ConfigurationException {
        final ConfigMap map = Json.parse("{\"Timeout\":1000,\"TimeoutPhrase\":\"Hey\","
                + "\"Ratio\":0.5,\"Enabled\":true,\"Big\":9223372036854775807,\"Exp\":1e3}");
        Assert.assertEquals(ConfigValue.of(1000L), map.get("Timeout"));
        Assert.assertEquals(ConfigValue.of("Hey"), map.get("TimeoutPhrase"));
        Assert.assertEquals(ConfigValue.of(0.5), map.get("Ratio"));
        Assert.assertEquals(ConfigValue.of(true), map.get("Enabled"));
        Assert.assertEquals(ConfigValue.of(Long.MAX_VALUE), map.get("Big"));
        Assert.assertEquals(ConfigValue.of(1000.0), map.get("Exp"));
        Assert.assertEquals(ConfigMap.of(), Json.parse("{}"));
    }

    @Test
    public void testIntegerVersusDouble() throws ConfigurationException {
        Assert.assertTrue(Json.parse("{\"a\":500}").get("a").isLong());
        Assert.assertTrue(Json.parse("{\"a\":500.0}").get("a").isDouble());
    }

    @Test
    public void testParseErrors() {
        for (final String text : new String[] { "", "{", "[1,2]", "\"text\"", "42",
                "{\"a\":1} trailing", "{\"a\":1,\"a\":2}", "{\"\":1}", "not json" }) {
            assertFailure(text, Kind.PARSE_ERROR);
        }
    }

    @Test
    public void testTypeErrors() {
        for (final String text : new String[] { "{\"a\":[1]}", "{\"a\":{\"b\":1}}",
                "{\"a\":null}", "{\"a\":92233720368547758070}", "{\"a\":1e400}",
                "{\"a\":-1e400}" }) {
            assertFailure(text, Kind.TYPE_ERROR);
        }
    }

    @Test
    public void testFormat() throws ConfigurationException {
        final ConfigMap map = ConfigMap.builder().put("TimeoutPhrase", "Hey")
                .put("Timeout", 500L).build();
        final String text = Json.format(map);
        Assert.assertTrue(text, text.contains("\n    \"Timeout\": 500,\n"));
        Assert.assertTrue(text, text.contains("\n    \"TimeoutPhrase\": \"Hey\"\n"));
        Assert.assertEquals(map, Json.parse(text));
    }

    @Test
    public void testNonFiniteNotWritten() throws ConfigurationException {
        for (final double value : new double[] { Double.NaN, Double.POSITIVE_INFINITY,
                Double.NEGATIVE_INFINITY }) {
            try {
                ConfigMap.builder().put("Ratio", value);
                Assert.fail("Accepted " + value);
            } catch (final IllegalArgumentException ex) {
                // ok
            }
        }
        final ConfigMap map = ConfigMap.builder().put("Ratio", Double.MAX_VALUE).build();
        Assert.assertEquals(map, Json.parse(Json.format(map)));
    }

    private static void assertFailure(final String text, final Kind kind) {
        try {
            Json.parse(text);
            Assert.fail("Accepted " + text);
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(text, kind, ex.getKind());
        }
    }

}
