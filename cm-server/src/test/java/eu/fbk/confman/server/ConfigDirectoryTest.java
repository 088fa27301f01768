package eu.fbk.confman.server;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.ConfigurationException.Kind;

public class ConfigDirectoryTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testScan() throws Exception {
        this.folder.newFile("beta.json");
        this.folder.newFile("alpha.json");
        this.folder.newFile("gamma.JSON");
        this.folder.newFile("notes.txt");
        this.folder.newFile(".json");
        this.folder.newFile("delta.json.new");
        this.folder.newFile("bad name.json");
        this.folder.newFolder("sub");
        this.folder.newFile("sub/epsilon.json");

        final Map<String, Path> files = ConfigDirectory.scan(this.folder.getRoot().toPath(),
                false);
        Assert.assertEquals(ImmutableList.of("alpha", "beta", "gamma"),
                ImmutableList.copyOf(files.keySet()));
        Assert.assertEquals("gamma.JSON", files.get("gamma").getFileName().toString());
    }

    @Test
    public void testRecursiveDuplicates() throws Exception {
        final File sub = this.folder.newFolder("sub");
        this.folder.newFolder("sub", "deeper");
        this.folder.newFile("sub/alpha.json");
        this.folder.newFile("sub/deeper/alpha.json");
        this.folder.newFile("sub/deeper/beta.json");
        this.folder.newFile("zeta.json");

        final Map<String, Path> files = ConfigDirectory.scan(this.folder.getRoot().toPath(),
                true);
        Assert.assertEquals(ImmutableList.of("zeta", "alpha", "beta"),
                ImmutableList.copyOf(files.keySet()));
        Assert.assertEquals(sub.toPath().resolve("alpha.json"), files.get("alpha"));
    }

    @Test
    public void testDuplicatesInOneDirectory() throws Exception {
        this.folder.newFile("alpha.json");
        Assume.assumeFalse(new File(this.folder.getRoot(), "alpha.JSON").exists());
        this.folder.newFile("alpha.JSON");

        final Map<String, Path> files = ConfigDirectory.scan(this.folder.getRoot().toPath(),
                false);
        Assert.assertEquals(ImmutableList.of("alpha"), ImmutableList.copyOf(files.keySet()));
        Assert.assertEquals("alpha.JSON", files.get("alpha").getFileName().toString());
    }

    @Test
    public void testSymbolicLinkCycle() throws Exception {
        final Path root = this.folder.getRoot().toPath();
        this.folder.newFolder("sub");
        this.folder.newFile("sub/alpha.json");
        try {
            Files.createSymbolicLink(root.resolve("sub/loop"), root);
        } catch (final UnsupportedOperationException | IOException ex) {
            Assume.assumeNoException(ex);
        }

        final Map<String, Path> files = ConfigDirectory.scan(root, true);
        Assert.assertEquals(ImmutableList.of("alpha"), ImmutableList.copyOf(files.keySet()));
        Assert.assertEquals(root.resolve("sub/alpha.json"), files.get("alpha"));
    }

    @Test
    public void testEmptyDirectory() throws Exception {
        this.folder.newFile("readme.txt");
        try {
            ConfigDirectory.scan(this.folder.getRoot().toPath(), false);
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertEquals(Kind.NO_CONFIGS_FOUND, ex.getKind());
        }
    }

    @Test
    public void testMissingDirectory() throws Exception {
        for (final Path dir : new Path[] { this.folder.getRoot().toPath().resolve("missing"),
                this.folder.newFile("file.json").toPath() }) {
            try {
                ConfigDirectory.scan(dir, false);
                Assert.fail();
            } catch (final ConfigurationException ex) {
                Assert.assertEquals(Kind.CONFIG_DIR_ERROR, ex.getKind());
            }
        }
    }

}
