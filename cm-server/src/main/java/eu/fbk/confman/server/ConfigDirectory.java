package eu.fbk.confman.server;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.ConfigurationException.Kind;
import eu.fbk.confman.Names;
import eu.fbk.confman.bus.ObjectPath;

/**
 * Discovery of the configuration files of a directory.
 * <p>
 * Entries are visited in lexicographic order of their file names. In recursive mode, the files
 * of a directory are visited before its subdirectories. Each configuration file (extension
 * {@value Names#CONFIG_FILE_EXTENSION}, ignoring case) defines an application named after the
 * file name without extension; when two files define the same application, the first visited
 * wins and the other is skipped with a warning. Files whose name cannot be used in an object
 * path are skipped as well.
 * </p>
 */
public final class ConfigDirectory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigDirectory.class);

    private ConfigDirectory() {
    }

    /**
     * Scans a directory for configuration files.
     *
     * @param dir
     *            the directory
     * @param recursive
     *            true to descend into subdirectories
     * @return a map from application names to configuration files, in discovery order
     * @throws ConfigurationException
     *             with kind {@code CONFIG_DIR_ERROR} if the directory cannot be listed, or with
     *             kind {@code NO_CONFIGS_FOUND} if no configuration file is found
     */
    public static Map<String, Path> scan(final Path dir, final boolean recursive)
            throws ConfigurationException {
        if (!Files.isDirectory(dir)) {
            throw new ConfigurationException(Kind.CONFIG_DIR_ERROR, "Configuration directory "
                    + dir + " does not exist or is not a directory");
        }
        final Map<String, Path> files = Maps.newLinkedHashMap();
        try {
            scan(dir, recursive, files);
        } catch (final IOException ex) {
            throw new ConfigurationException(Kind.CONFIG_DIR_ERROR, "Cannot list " + dir + ": "
                    + ex.getMessage(), ex);
        }
        if (files.isEmpty()) {
            throw new ConfigurationException(Kind.NO_CONFIGS_FOUND,
                    "No configuration file found in " + dir);
        }
        LOGGER.debug("{} configuration files found in {}", files.size(), dir);
        return ImmutableMap.copyOf(files);
    }

    private static void scan(final Path dir, final boolean recursive,
            final Map<String, Path> files) throws IOException {

        final List<Path> entries = Lists.newArrayList();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (final Path entry : stream) {
                entries.add(entry);
            }
        }
        Collections.sort(entries);

        final List<Path> subdirs = Lists.newArrayList();
        for (final Path entry : entries) {
            final String fileName = entry.getFileName().toString();
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                subdirs.add(entry);
            } else if (Files.isRegularFile(entry) && Names.isConfigFileName(fileName)) {
                final String name = Names.applicationName(entry);
                final Path previous = files.get(name);
                if (!ObjectPath.isValidElement(name)) {
                    LOGGER.warn("Skipping {}: '{}' is not a valid application name", entry, name);
                } else if (previous != null) {
                    LOGGER.warn("Skipping {}: application {} already defined by {}", entry,
                            name, previous);
                } else {
                    files.put(name, entry);
                }
            }
        }

        if (recursive) {
            for (final Path subdir : subdirs) {
                scan(subdir, true, files);
            }
        }
    }

}
