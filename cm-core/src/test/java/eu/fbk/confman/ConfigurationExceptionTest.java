package eu.fbk.confman;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.confman.ConfigurationException.Kind;
import eu.fbk.confman.bus.BusException;

public class ConfigurationExceptionTest {

    @Test
    public void testErrorNames() {
        Assert.assertEquals("com.system.configurationManager.Error.InvalidArgument",
                Kind.INVALID_ARGUMENT.getErrorName());
        for (final Kind kind : Kind.values()) {
            Assert.assertSame(kind, Kind.forErrorName(kind.getErrorName()));
        }
        Assert.assertNull(Kind.forErrorName(BusException.FAILED));
        Assert.assertNull(Kind.forErrorName(null));
    }

    @Test
    public void testForFailure() {
        Assert.assertEquals(Kind.NOT_FOUND.getErrorName(), BusException.forFailure(
                new ConfigurationException(Kind.NOT_FOUND, "x")).getErrorName());
        Assert.assertEquals(BusException.INVALID_ARGS, BusException.forFailure(
                new IllegalArgumentException("x")).getErrorName());
        Assert.assertEquals(BusException.FAILED, BusException.forFailure(
                new NullPointerException()).getErrorName());
    }

    @Test
    public void testNames() {
        Assert.assertTrue(Names.isConfigFileName("alpha.JSON"));
        Assert.assertFalse(Names.isConfigFileName(".json"));
        Assert.assertFalse(Names.isConfigFileName("alpha.json.new"));
        Assert.assertEquals("alpha", Names.applicationName(java.nio.file.Paths.get("dir",
                "alpha.Json")));
        Assert.assertEquals(System.getProperty("user.home"), Names.expandHome("~").toString());
    }

}
