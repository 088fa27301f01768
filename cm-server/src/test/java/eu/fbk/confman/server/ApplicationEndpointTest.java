package eu.fbk.confman.server;

import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Assert;
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

public class ApplicationEndpointTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private LocalBus bus;

    private ApplicationEndpoint endpoint;

    private BlockingQueue<Signal> signals;

    @Before
    public void setUp() throws Exception {
        final Path file = this.folder.getRoot().toPath().resolve("app.json");
        ConfigFile.save(file, ConfigMap.builder().put("Timeout", 1000L).build());
        this.bus = new LocalBus();
        this.endpoint = new ApplicationEndpoint(this.bus, Names.DEFAULT_SERVICE_NAME, "app",
                file);
        this.signals = new LinkedBlockingQueue<Signal>();
        this.bus.subscribe(new SignalMatch(this.endpoint.getPath(), null, null),
                new SignalHandler() {

                    @Override
                    public void handle(final Signal signal) {
                        ApplicationEndpointTest.this.signals.add(signal);
                    }

                });
    }

    @After
    public void tearDown() {
        this.bus.close();
    }

    @Test
    public void testIdentity() {
        Assert.assertEquals("app", this.endpoint.getApplicationName());
        Assert.assertEquals("/com/system/configurationManager/Application/app", this.endpoint
                .getPath().toString());
    }

    @Test
    public void testChangeEmitsSnapshot() throws Exception {
        this.endpoint.changeConfiguration("TimeoutPhrase", ConfigValue.of("Ho"));
        final Signal signal = this.signals.poll(5, TimeUnit.SECONDS);
        Assert.assertEquals(Names.CONFIGURATION_CHANGED, signal.getMember());
        Assert.assertEquals(Names.CONFIGURATION_INTERFACE, signal.getInterfaceName());
        Assert.assertEquals(ConfigMap.builder().put("Timeout", 1000L).put("TimeoutPhrase",
                "Ho").build(), signal.getArg(0, ConfigMap.class));
    }

    @Test
    public void testRejectedChangeEmitsNothing() throws Exception {
        try {
            this.endpoint.changeConfiguration("", ConfigValue.of(1L));
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.INVALID_ARGUMENT, ex.getKind());
        }
        this.endpoint.emit(this.endpoint.getConfiguration());
        Assert.assertEquals(this.endpoint.getConfiguration(), this.signals.poll(5,
                TimeUnit.SECONDS).getArg(0, ConfigMap.class));
        Assert.assertTrue(this.signals.isEmpty());
    }

    @Test
    public void testExport() throws Exception {
        final MethodCall call = new MethodCall(null, this.endpoint.getPath(),
                Names.CONFIGURATION_INTERFACE, Names.GET_CONFIGURATION);
        this.endpoint.export();
        Assert.assertEquals(this.endpoint.getConfiguration(), this.bus.call(call));
        this.endpoint.unexport();
        this.endpoint.unexport();
        try {
            this.bus.call(call);
            Assert.fail();
        } catch (final BusException ex) {
            Assert.assertEquals(BusException.UNKNOWN_OBJECT, ex.getErrorName());
        }
    }

    @Test
    public void testMissingFile() {
        try {
            new ApplicationEndpoint(this.bus, Names.DEFAULT_SERVICE_NAME, "missing", this.folder
                    .getRoot().toPath().resolve("missing.json"));
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.NOT_FOUND, ex.getKind());
        }
    }

}
