package eu.fbk.confman;

import java.nio.file.Path;
import java.nio.file.Paths;

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;

import eu.fbk.confman.bus.ObjectPath;

/**
 * Well-known names of the configuration manager protocol and of its on-disk layout.
 */
public final class Names {

    /** The bus name claimed by the configuration manager unless configured otherwise. */
    public static final String DEFAULT_SERVICE_NAME = "com.system.configurationManager";

    /** The name of the per-application configuration interface of the default service. */
    public static final String CONFIGURATION_INTERFACE = interfaceName(DEFAULT_SERVICE_NAME);

    /** The method returning the whole configuration of an application. */
    public static final String GET_CONFIGURATION = "GetConfiguration";

    /** The method changing one key of the configuration of an application. */
    public static final String CHANGE_CONFIGURATION = "ChangeConfiguration";

    /** The signal emitted after every successful change. */
    public static final String CONFIGURATION_CHANGED = "ConfigurationChanged";

    /** Prefix of the remote names of configuration failures. */
    public static final String ERROR_NAME_PREFIX = DEFAULT_SERVICE_NAME + ".Error.";

    /** The extension of configuration files, compared ignoring case. */
    public static final String CONFIG_FILE_EXTENSION = ".json";

    /** The configuration directory, relative to the user home, used by the broker. */
    public static final String DEFAULT_CONFIG_DIR = "~/" + DEFAULT_SERVICE_NAME;

    private Names() {
    }

    /**
     * Returns the name of the configuration interface published by a service.
     *
     * @param serviceName
     *            the service name, e.g. {@link #DEFAULT_SERVICE_NAME}
     * @return the interface name
     */
    public static String interfaceName(final String serviceName) {
        return serviceName + ".Application.Configuration";
    }

    /**
     * Returns the object path under which a service exports the configuration of an
     * application.
     *
     * @param serviceName
     *            the service name
     * @param applicationName
     *            the application name
     * @return the object path
     */
    public static ObjectPath applicationPath(final String serviceName,
            final String applicationName) {
        return ObjectPath.forApplication(serviceName, applicationName);
    }

    /**
     * Returns whether the file name specified denotes a configuration file.
     *
     * @param fileName
     *            the file name
     * @return true if the name has the configuration file extension and a non-empty stem
     */
    public static boolean isConfigFileName(final String fileName) {
        return fileName.length() > CONFIG_FILE_EXTENSION.length()
                && Ascii.toLowerCase(fileName).endsWith(CONFIG_FILE_EXTENSION);
    }

    /**
     * Returns the application name associated to a configuration file, i.e., its file name
     * without extension.
     *
     * @param file
     *            the configuration file
     * @return the application name
     */
    public static String applicationName(final Path file) {
        final String fileName = file.getFileName().toString();
        Preconditions.checkArgument(isConfigFileName(fileName), "Not a configuration file: %s",
                file);
        return fileName.substring(0, fileName.length() - CONFIG_FILE_EXTENSION.length());
    }

    /**
     * Resolves a user-supplied path, expanding a leading {@code ~} to the user home directory.
     *
     * @param path
     *            the path string
     * @return the resolved path
     */
    public static Path expandHome(final String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + path.substring(1));
        }
        return Paths.get(path);
    }

}
