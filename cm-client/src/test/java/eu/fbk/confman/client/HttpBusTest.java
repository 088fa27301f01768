package eu.fbk.confman.client;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
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
import eu.fbk.confman.bus.BusException;
import eu.fbk.confman.bus.LocalBus;
import eu.fbk.confman.bus.Subscription;
import eu.fbk.confman.data.ConfigFile;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;
import eu.fbk.confman.server.Broker;
import eu.fbk.confman.server.http.HttpBusServer;

public class HttpBusTest {

    private static final String SERVICE = "test.configurationManager";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private LocalBus localBus;

    private Broker broker;

    private HttpBusServer server;

    private HttpBus bus;

    @Before
    public void setUp() throws Exception {
        final Path dir = this.folder.newFolder("config").toPath();
        Files.write(dir.resolve("alpha.json"), "{\"Timeout\":1000,\"TimeoutPhrase\":\"Hey\"}"
                .getBytes(StandardCharsets.UTF_8));
        this.localBus = new LocalBus();
        this.broker = new Broker(this.localBus, dir, false, SERVICE);
        this.broker.init();
        this.server = new HttpBusServer(this.localBus, "127.0.0.1", 0);
        this.server.init();
        this.bus = new HttpBus(this.server.getURI().toString());
    }

    @After
    public void tearDown() {
        this.bus.close();
        this.server.close();
        this.broker.close();
        this.localBus.close();
    }

    @Test
    public void testCalls() throws Exception {
        final String uri = this.server.getURI().toString();
        Assert.assertEquals(uri.substring(0, uri.length() - 1), this.bus.getServerURL());
        final ConfigurationProxy proxy = new ConfigurationProxy(this.bus, SERVICE, "alpha");
        Assert.assertEquals(ConfigValue.of("Hey"), proxy.getConfiguration().get("TimeoutPhrase"));
        proxy.changeConfiguration("Timeout", ConfigValue.of(500L));
        Assert.assertEquals(ConfigValue.of(500L), proxy.getConfiguration().get("Timeout"));
        try {
            proxy.changeConfiguration("", ConfigValue.of(500L));
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.INVALID_ARGUMENT, ex.getKind());
        }
        try {
            new ConfigurationProxy(this.bus, SERVICE, "missing").getConfiguration();
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.IPC_CONNECTION_ERROR, ex.getKind());
        }
    }

    @Test
    public void testSubscribe() throws Exception {
        final ConfigurationProxy proxy = new ConfigurationProxy(this.bus, SERVICE, "alpha");
        final BlockingQueue<ConfigMap> snapshots = new LinkedBlockingQueue<ConfigMap>();
        final Subscription subscription = proxy.subscribe(new ConfigurationListener() {

            @Override
            public void configurationChanged(final ConfigMap configuration) {
                snapshots.add(configuration);
            }

        });

        proxy.changeConfiguration("Timeout", ConfigValue.of(500L));
        proxy.changeConfiguration("TimeoutPhrase", ConfigValue.of("Ho"));
        Assert.assertEquals(ConfigValue.of(500L), snapshots.poll(10, TimeUnit.SECONDS)
                .get("Timeout"));
        Assert.assertEquals(ConfigMap.builder().put("Timeout", 500L)
                .put("TimeoutPhrase", "Ho").build(), snapshots.poll(10, TimeUnit.SECONDS));

        subscription.cancel();
        proxy.changeConfiguration("Timeout", ConfigValue.of(600L));
        Assert.assertNull(snapshots.poll(300, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testUnsupported() {
        try {
            this.bus.requestName(SERVICE);
            Assert.fail();
        } catch (final BusException ex) {
            Assert.assertEquals(BusException.NOT_SUPPORTED, ex.getErrorName());
        }
    }

    @Test
    public void testNoServer() throws Exception {
        final int port;
        final ServerSocket socket = new ServerSocket(0);
        try {
            port = socket.getLocalPort();
        } finally {
            socket.close();
        }
        final HttpBus unreachable = new HttpBus("http://127.0.0.1:" + port + "/", 2000);
        try {
            final ConfigurationProxy proxy = new ConfigurationProxy(unreachable, SERVICE,
                    "alpha");
            try {
                proxy.getConfiguration();
                Assert.fail();
            } catch (final ConfigurationException ex) {
                Assert.assertEquals(Kind.IPC_CONNECTION_ERROR, ex.getKind());
                Assert.assertEquals(BusException.NO_SERVER,
                        ((BusException) ex.getCause()).getErrorName());
            }
            try {
                proxy.subscribe(new ClientCache());
                Assert.fail();
            } catch (final ConfigurationException ex) {
                Assert.assertEquals(Kind.IPC_CONNECTION_ERROR, ex.getKind());
            }
        } finally {
            unreachable.close();
        }
    }

    @Test
    public void testClientApplication() throws Exception {
        final Path path = this.folder.getRoot().toPath().resolve("client/alpha.json");
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final ClientApplication client = new ClientApplication(this.bus, SERVICE, path,
                new ClientCache(50L, "Hey"), new PrintStream(bytes, true, "UTF-8"));
        client.start(false);
        try {
            Assert.assertEquals(ConfigMap.builder().put("Timeout", 50L)
                    .put("TimeoutPhrase", "Hey").build(), ConfigFile.load(path));
            Assert.assertTrue(waitFor(bytes, "Hey"));

            this.broker.getEndpoint("alpha").changeConfiguration("TimeoutPhrase",
                    ConfigValue.of("Ho"));
            Assert.assertTrue(waitFor(bytes, "Ho"));
            Assert.assertEquals(1000L, client.getCache().getTimeout());
            Assert.assertEquals("alpha", client.getProxy().getApplicationName());
            Assert.assertEquals(ConfigValue.of("Ho"), client.getProxy().getConfiguration().get(
                    "TimeoutPhrase"));
        } finally {
            client.close();
        }
    }

    private static boolean waitFor(final ByteArrayOutputStream bytes, final String text)
            throws InterruptedException {
        final long deadline = System.currentTimeMillis() + 10000;
        while (System.currentTimeMillis() < deadline) {
            if (new String(bytes.toByteArray(), StandardCharsets.UTF_8).contains(text)) {
                return true;
            }
            Thread.sleep(10);
        }
        return false;
    }

}
