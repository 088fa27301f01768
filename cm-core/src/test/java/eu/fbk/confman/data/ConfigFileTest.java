package eu.fbk.confman.data;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.ConfigurationException.Kind;

public class ConfigFileTest {

    private static final ConfigMap DEFAULTS = ConfigMap.builder().put("Timeout", 1000L)
            .put("TimeoutPhrase", "Hey").build();

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testSaveAndLoad() throws Exception {
        final Path path = this.folder.getRoot().toPath().resolve("alpha.json");
        ConfigFile.save(path, DEFAULTS);
        Assert.assertEquals(DEFAULTS, ConfigFile.load(path));
        Assert.assertFalse(Files.exists(path.resolveSibling("alpha.json.new")));
        final String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        Assert.assertTrue(text, text.contains("\"Timeout\": 1000"));
    }

    @Test
    public void testSaveReplaces() throws Exception {
        final Path path = this.folder.getRoot().toPath().resolve("alpha.json");
        ConfigFile.save(path, DEFAULTS);
        ConfigFile.save(path, DEFAULTS.with("Timeout", ConfigValue.of(500L)));
        Assert.assertEquals(ConfigValue.of(500L), ConfigFile.load(path).get("Timeout"));
    }

    @Test
    public void testLoadFailures() throws Exception {
        final Path missing = this.folder.getRoot().toPath().resolve("missing.json");
        try {
            ConfigFile.load(missing);
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.NOT_FOUND, ex.getKind());
            Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("does not exist"));
        }
        final Path directory = this.folder.newFolder("directory.json").toPath();
        try {
            ConfigFile.load(directory);
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.NOT_FOUND, ex.getKind());
            Assert.assertTrue(ex.getMessage(), ex.getMessage().startsWith("Cannot read"));
        }
        final Path malformed = this.folder.newFile("malformed.json").toPath();
        Files.write(malformed, "{\"Timeout\":".getBytes(StandardCharsets.UTF_8));
        try {
            ConfigFile.load(malformed);
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.PARSE_ERROR, ex.getKind());
        }
    }

    @Test
    public void testSaveQuietly() throws Exception {
        final File file = this.folder.newFile("blocker");
        final Path path = file.toPath().resolve("alpha.json");
        Assert.assertFalse(ConfigFile.saveQuietly(path, DEFAULTS));
        Assert.assertTrue(ConfigFile.saveQuietly(this.folder.getRoot().toPath().resolve(
                "alpha.json"), DEFAULTS));
    }

    @Test
    public void testLoadOrCreate() throws Exception {
        final Path path = this.folder.getRoot().toPath().resolve("sub/dir/client.json");
        Assert.assertEquals(DEFAULTS, ConfigFile.loadOrCreate(path, DEFAULTS, false));
        Assert.assertEquals(DEFAULTS, ConfigFile.load(path));

        final ConfigMap other = DEFAULTS.with("TimeoutPhrase", ConfigValue.of("Ho"));
        Assert.assertEquals(DEFAULTS, ConfigFile.loadOrCreate(path, other, false));
        Assert.assertEquals(other, ConfigFile.loadOrCreate(path, other, true));
        Assert.assertEquals(other, ConfigFile.load(path));
    }

    @Test
    public void testLoadOrCreateUnwritableDirectory() throws Exception {
        final File file = this.folder.newFile("blocker");
        try {
            ConfigFile.loadOrCreate(file.toPath().resolve("client.json"), DEFAULTS, false);
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.CONFIG_DIR_ERROR, ex.getKind());
        }
    }

}
