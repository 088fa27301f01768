package eu.fbk.confman.server;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;

import org.junit.After;
import org.junit.Assert;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.ConfigurationException.Kind;
import eu.fbk.confman.Names;
import eu.fbk.confman.bus.BusException;
import eu.fbk.confman.bus.LocalBus;
import eu.fbk.confman.bus.MethodCall;
import eu.fbk.confman.bus.Signal;
import eu.fbk.confman.bus.SignalHandler;
import eu.fbk.confman.bus.SignalMatch;
import eu.fbk.confman.data.ConfigFile;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;

public class BrokerTest {

    private static final String SERVICE = "test.configurationManager";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private LocalBus bus;

    private Path dir;

    @Before
    public void setUp() throws Exception {
        this.bus = new LocalBus();
        this.dir = this.folder.newFolder("config").toPath();
    }

    @After
    public void tearDown() {
        this.bus.close();
    }

    @Test
    public void testChangeScenario() throws Exception {
        write("alpha.json", "{\"Timeout\":1000,\"TimeoutPhrase\":\"Hey\"}");
        final Broker broker = new Broker(this.bus, this.dir, false, SERVICE);
        broker.init();
        try {
            Assert.assertEquals(Broker.State.RUNNING, broker.getState());
            Assert.assertEquals(ImmutableList.of("alpha"), broker.getApplicationNames());

            final BlockingQueue<Signal> signals = new LinkedBlockingQueue<Signal>();
            this.bus.subscribe(new SignalMatch(Names.applicationPath(SERVICE, "alpha"),
                    Names.interfaceName(SERVICE), Names.CONFIGURATION_CHANGED),
                    new SignalHandler() {

                        @Override
                        public void handle(final Signal signal) {
                            signals.add(signal);
                        }

                    });

            // (a) the change succeeds
            Assert.assertNull(invoke("alpha", Names.CHANGE_CONFIGURATION, "Timeout",
                    ConfigValue.of(500L)));

            // (b) the configuration reflects the change
            final ConfigMap configuration = (ConfigMap) invoke("alpha", Names.GET_CONFIGURATION);
            Assert.assertEquals(ConfigValue.of(500L), configuration.get("Timeout"));
            Assert.assertEquals(ConfigValue.of("Hey"), configuration.get("TimeoutPhrase"));

            // (c) the file has been rewritten before the call returned
            Assert.assertEquals(configuration, ConfigFile.load(this.dir.resolve("alpha.json")));
            final String text = new String(Files.readAllBytes(this.dir.resolve("alpha.json")),
                    StandardCharsets.UTF_8);
            Assert.assertTrue(text, text.contains("\"Timeout\": 500"));

            // (d) the full configuration is notified
            final Signal signal = signals.poll(5, TimeUnit.SECONDS);
            Assert.assertNotNull(signal);
            Assert.assertEquals(configuration, signal.getArg(0, ConfigMap.class));

        } finally {
            broker.close();
        }
        Assert.assertEquals(Broker.State.STOPPED, broker.getState());
        Assert.assertTrue(broker.awaitTermination(0, TimeUnit.SECONDS));
        assertCallFails("alpha", BusException.SERVICE_UNKNOWN);
    }

    @Test
    public void testCallErrors() throws Exception {
        write("alpha.json", "{\"Timeout\":1000}");
        final Broker broker = new Broker(this.bus, this.dir, false, SERVICE);
        broker.init();
        try {
            assertCallFails(newCall(Names.CHANGE_CONFIGURATION, "", ConfigValue.of(1L)),
                    Kind.INVALID_ARGUMENT.getErrorName());
            assertCallFails(newCall(Names.CHANGE_CONFIGURATION, "Timeout"),
                    Kind.INVALID_ARGUMENT.getErrorName());
            assertCallFails(newCall(Names.CHANGE_CONFIGURATION, "Timeout", ConfigMap.of()),
                    Kind.TYPE_ERROR.getErrorName());
            assertCallFails(newCall("Reload"), BusException.UNKNOWN_METHOD);
            assertCallFails("beta", BusException.UNKNOWN_OBJECT);
            Assert.assertEquals(ConfigValue.of(1000L), broker.getEndpoint("alpha")
                    .getConfiguration().get("Timeout"));
        } finally {
            broker.close();
        }
    }

    @Test
    public void testDuplicateNames() throws Exception {
        write("alpha.json", "{\"Timeout\":1000}");
        Assume.assumeFalse(Files.exists(this.dir.resolve("alpha.JSON")));
        write("alpha.JSON", "{\"Timeout\":2000}");
        final Broker broker = new Broker(this.bus, this.dir, false, SERVICE);
        broker.init();
        try {
            Assert.assertEquals(ImmutableList.of("alpha"), broker.getApplicationNames());
            Assert.assertEquals(this.dir.resolve("alpha.JSON"), broker.getEndpoint("alpha")
                    .getFile());
            Assert.assertEquals(ConfigValue.of(2000L), ((ConfigMap) invoke("alpha",
                    Names.GET_CONFIGURATION)).get("Timeout"));
        } finally {
            broker.close();
        }
    }

    @Test
    public void testEmptyDirectory() throws Exception {
        final Broker broker = new Broker(this.bus, this.dir, false, SERVICE);
        try {
            broker.init();
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.NO_CONFIGS_FOUND, ex.getKind());
        }
        Assert.assertEquals(Broker.State.STOPPED, broker.getState());
        Assert.assertTrue(broker.getApplicationNames().isEmpty());
        // the service name has never been claimed
        this.bus.requestName(SERVICE);
    }

    @Test
    public void testMissingDirectory() throws Exception {
        final Broker broker = new Broker(this.bus, this.dir.resolve("missing"), false, SERVICE);
        try {
            broker.init();
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.CONFIG_DIR_ERROR, ex.getKind());
        }
    }

    @Test
    public void testAllOrNothing() throws Exception {
        write("alpha.json", "{\"Timeout\":1000}");
        write("beta.json", "{\"Timeout\":[1000]}");
        final Broker broker = new Broker(this.bus, this.dir, false, SERVICE);
        try {
            broker.init();
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.TYPE_ERROR, ex.getKind());
        }
        Assert.assertEquals(Broker.State.STOPPED, broker.getState());
        this.bus.requestName(SERVICE);
        assertCallFails("alpha", BusException.UNKNOWN_OBJECT);
    }

    @Test
    public void testSingleInstance() throws Exception {
        write("alpha.json", "{\"Timeout\":1000}");
        final Broker first = new Broker(this.bus, this.dir, false, SERVICE);
        final Broker second = new Broker(this.bus, this.dir, false, SERVICE);
        first.init();
        try {
            second.init();
            Assert.fail();
        } catch (final BusException ex) {
            Assert.assertEquals(BusException.ADDRESS_IN_USE, ex.getErrorName());
        } finally {
            second.close();
        }
        // the failed instance did not withdraw the name or objects of the running one
        Assert.assertEquals(Broker.State.RUNNING, first.getState());
        Assert.assertNotNull(invoke("alpha", Names.GET_CONFIGURATION));
        first.close();
    }

    @Test
    public void testIndependentInstances() throws Exception {
        write("alpha.json", "{\"Timeout\":1000}");
        final Broker first = new Broker(this.bus, this.dir, false, SERVICE);
        final Broker second = new Broker(this.bus, this.dir, false, SERVICE + "2");
        first.init();
        second.init();
        Assert.assertEquals(ImmutableList.of("alpha"), second.getApplicationNames());
        second.close();
        first.close();
    }

    @Test
    public void testRunReturnsOnClose() throws Exception {
        write("alpha.json", "{\"Timeout\":1000}");
        final Broker broker = new Broker(this.bus, this.dir, false, SERVICE);
        broker.init();
        final Thread closer = new Thread() {

            @Override
            public void run() {
                try {
                    Thread.sleep(100);
                } catch (final InterruptedException ex) {
                    // ignore
                }
                broker.close();
            }

        };
        closer.start();
        broker.run();
        Assert.assertEquals(Broker.State.STOPPED, broker.getState());
        closer.join();
        try {
            broker.init();
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // ok
        }
    }

    private void write(final String fileName, final String content) throws Exception {
        Files.write(this.dir.resolve(fileName), content.getBytes(StandardCharsets.UTF_8));
    }

    private MethodCall newCall(final String member, final Object... args) {
        return new MethodCall(SERVICE, Names.applicationPath(SERVICE, "alpha"),
                Names.interfaceName(SERVICE), member, args);
    }

    private Object invoke(final String application, final String member, final Object... args)
            throws BusException {
        return this.bus.call(new MethodCall(SERVICE, Names.applicationPath(SERVICE,
                application), Names.interfaceName(SERVICE), member, args));
    }

    private void assertCallFails(final MethodCall call, final String errorName) {
        try {
            this.bus.call(call);
            Assert.fail();
        } catch (final BusException ex) {
            Assert.assertEquals(errorName, ex.getErrorName());
        }
    }

    private void assertCallFails(final String application, final String errorName) {
        try {
            invoke(application, Names.GET_CONFIGURATION);
            Assert.fail();
        } catch (final BusException ex) {
            Assert.assertEquals(errorName, ex.getErrorName());
        }
    }

}
