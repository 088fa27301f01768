package eu.fbk.confman.client;

import java.nio.file.Path;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import eu.fbk.confman.data.ConfigFile;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;

public class ClientCacheTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDefaults() {
        final ClientCache cache = new ClientCache();
        Assert.assertEquals(1000L, cache.getTimeout());
        Assert.assertEquals("Hey", cache.getPhrase());
        try {
            new ClientCache(0L, "Hey");
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // ok
        }
    }

    @Test
    public void testInitializeCreatesFile() throws Exception {
        final Path path = this.folder.getRoot().toPath().resolve("dir/app.json");
        final ClientCache cache = new ClientCache(1000L, "Hey");
        cache.initialize(path, false);
        Assert.assertEquals(ConfigMap.builder().put("Timeout", 1000L).put("TimeoutPhrase", "Hey")
                .build(), ConfigFile.load(path));
    }

    @Test
    public void testInitializeLoadsFile() throws Exception {
        final Path path = this.folder.getRoot().toPath().resolve("app.json");
        ConfigFile.save(path, ConfigMap.builder().put("Timeout", 250L)
                .put("TimeoutPhrase", "Ho").build());

        final ClientCache cache = new ClientCache(1000L, "Hey");
        cache.initialize(path, false);
        Assert.assertEquals(250L, cache.getTimeout());
        Assert.assertEquals("Ho", cache.getPhrase());

        final ClientCache forced = new ClientCache(1000L, "Hey");
        forced.initialize(path, true);
        Assert.assertEquals(1000L, forced.getTimeout());
        Assert.assertEquals(ConfigValue.of(1000L), ConfigFile.load(path).get("Timeout"));
    }

    @Test
    public void testApplyIdempotent() {
        final ClientCache cache = new ClientCache();
        final ConfigMap snapshot = ConfigMap.builder().put("Timeout", 500L)
                .put("TimeoutPhrase", "Ho").put("Other", true).build();
        cache.apply(snapshot);
        Assert.assertEquals(500L, cache.getTimeout());
        Assert.assertEquals("Ho", cache.getPhrase());
        cache.apply(snapshot);
        Assert.assertEquals(500L, cache.getTimeout());
        Assert.assertEquals("Ho", cache.getPhrase());
    }

    @Test
    public void testApplyPartialFailure() {
        final ClientCache cache = new ClientCache();
        cache.apply(ConfigMap.builder().put("Timeout", "fast").put("TimeoutPhrase", "Ho")
                .build());
        Assert.assertEquals(1000L, cache.getTimeout());
        Assert.assertEquals("Ho", cache.getPhrase());

        cache.apply(ConfigMap.builder().put("Timeout", 300L).put("TimeoutPhrase", 42L).build());
        Assert.assertEquals(300L, cache.getTimeout());
        Assert.assertEquals("Ho", cache.getPhrase());

        cache.apply(ConfigMap.builder().put("Timeout", -5L).build());
        Assert.assertEquals(300L, cache.getTimeout());

        cache.apply(ConfigMap.builder().put("Timeout", 300.0).build());
        Assert.assertEquals(300L, cache.getTimeout());
    }

    @Test
    public void testApplyMissingKeys() {
        final ClientCache cache = new ClientCache(700L, "Hi");
        cache.configurationChanged(ConfigMap.of());
        Assert.assertEquals(700L, cache.getTimeout());
        Assert.assertEquals("Hi", cache.getPhrase());
        Assert.assertEquals(ConfigMap.builder().put("Timeout", 700L).put("TimeoutPhrase", "Hi")
                .build(), cache.toConfigMap());
    }

}
