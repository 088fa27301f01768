package eu.fbk.confman.data;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.ConfigurationException.Kind;

/**
 * Loading and saving of configuration files.
 * <p>
 * A configuration file is a UTF-8 JSON document (see {@link Json}). Saving is atomic: content is
 * written to a {@code .new} sibling of the target, which then replaces the target, so that a
 * crash never leaves a truncated file behind.
 * </p>
 */
public final class ConfigFile {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigFile.class);

    private static final String NEW_SUFFIX = ".new";

    private ConfigFile() {
    }

    /**
     * Loads the configuration stored in a file.
     *
     * @param path
     *            the file path
     * @return the loaded configuration
     * @throws ConfigurationException
     *             with kind {@code NOT_FOUND} if the file does not exist or cannot be opened
     *             (e.g., permission denied, or the path denotes a directory), with kind
     *             {@code PARSE_ERROR} if the content is not a JSON object, or with kind
     *             {@code TYPE_ERROR} if some value has an unsupported type
     */
    public static ConfigMap load(final Path path) throws ConfigurationException {
        final String text;
        try {
            text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (final NoSuchFileException ex) {
            throw new ConfigurationException(Kind.NOT_FOUND, "File " + path + " does not exist",
                    ex);
        } catch (final IOException ex) {
            throw new ConfigurationException(Kind.NOT_FOUND, "Cannot read " + path + ": "
                    + ex.getMessage(), ex);
        }
        try {
            return Json.parse(text);
        } catch (final ConfigurationException ex) {
            throw new ConfigurationException(ex.getKind(), path + ": " + ex.getMessage(), ex);
        }
    }

    public static void save(final Path path, final ConfigMap map) throws IOException {
        final Path newPath = path.resolveSibling(path.getFileName() + NEW_SUFFIX);
        Files.write(newPath, (Json.format(map) + "\n").getBytes(StandardCharsets.UTF_8));
        try {
            Files.move(newPath, path, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException ex) {
            Files.move(newPath, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Saves a configuration file, logging rather than propagating a failure.
     *
     * @param path
     *            the file path
     * @param map
     *            the configuration to write
     * @return true on success
     */
    public static boolean saveQuietly(final Path path, final ConfigMap map) {
        try {
            save(path, map);
            return true;
        } catch (final Throwable ex) {
            LOGGER.error("Could not save configuration file " + path, ex);
            return false;
        }
    }

    /**
     * Loads a configuration file, creating it from defaults if missing or if so requested.
     *
     * @param path
     *            the file path
     * @param defaults
     *            the configuration written to a newly created file
     * @param force
     *            true to overwrite an existing file with the defaults
     * @return the configuration of the file, that is the defaults if the file has been created
     * @throws ConfigurationException
     *             with kind {@code CONFIG_DIR_ERROR} if the file or its directory cannot be
     *             created, or any failure of {@link #load(Path)}
     */
    public static ConfigMap loadOrCreate(final Path path, final ConfigMap defaults,
            final boolean force) throws ConfigurationException {
        if (!force && Files.exists(path)) {
            return load(path);
        }
        try {
            final Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            save(path, defaults);
        } catch (final IOException ex) {
            throw new ConfigurationException(Kind.CONFIG_DIR_ERROR, "Cannot create " + path
                    + ": " + ex.getMessage(), ex);
        }
        LOGGER.info("Created configuration file {} with default values {}", path, defaults);
        return defaults;
    }

}
