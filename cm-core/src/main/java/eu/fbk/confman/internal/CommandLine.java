package eu.fbk.confman.internal;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.net.URI;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.slf4j.Logger;

import ch.qos.logback.classic.Level;

import eu.fbk.confman.Names;

public final class CommandLine {

    /** Exit code of successful runs, including help and version requests. */
    public static final int EXIT_SUCCESS = 0;

    /** Exit code of runs terminated by a syntax error or by a fatal failure. */
    public static final int EXIT_FAILURE = 1;

    private final Map<String, List<String>> optionValues;

    private CommandLine(final Map<String, List<String>> optionValues) {
        this.optionValues = optionValues;
    }

    public boolean hasOption(final String letterOrName) {
        return this.optionValues.containsKey(letterOrName);
    }

    @Nullable
    public <T> T getOptionValue(final String letterOrName, final Class<T> type) {
        final List<String> strings = this.optionValues.get(letterOrName);
        if (strings == null || strings.isEmpty()) {
            return null;
        }
        if (strings.size() > 1) {
            throw new Exception("Multiple values for option '" + letterOrName + "': "
                    + Joiner.on(", ").join(strings), null);
        }
        return convert(strings.get(0), type);
    }

    public <T> T getOptionValue(final String letterOrName, final Class<T> type,
            final T defaultValue) {
        final T value = getOptionValue(letterOrName, type);
        return value != null ? value : defaultValue;
    }

    private static <T> T convert(final String string, final Class<T> type) {
        try {
            final Object result;
            if (type == String.class) {
                result = string;
            } else if (type == Integer.class) {
                result = Integer.valueOf(string);
            } else if (type == Long.class) {
                result = Long.valueOf(string);
            } else if (type == Path.class) {
                result = Names.expandHome(string);
            } else if (type == URI.class) {
                result = new URI(string);
            } else {
                throw new IllegalArgumentException("Unsupported type " + type.getName());
            }
            return type.cast(result);
        } catch (final Throwable ex) {
            throw new Exception("'" + string + "' is not a valid " + type.getSimpleName(), ex);
        }
    }

    /**
     * Reports a failure on standard error and returns the exit code the process should
     * terminate with. A {@link CommandLine.Exception} without message denotes a normal
     * termination after help or version information has been displayed.
     *
     * @param throwable
     *            the failure
     * @param err
     *            the stream where to report the failure
     * @return the exit code
     */
    public static int report(final Throwable throwable, final PrintStream err) {
        if (throwable instanceof Exception) {
            if (throwable.getMessage() == null) {
                return EXIT_SUCCESS;
            }
            err.println("SYNTAX ERROR: " + throwable.getMessage());
        } else {
            err.println("EXECUTION FAILED: " + throwable.getMessage());
        }
        return EXIT_FAILURE;
    }

    public static Parser parser() {
        return new Parser();
    }

    public static final class Parser {

        @Nullable
        private String name;

        @Nullable
        private String header;

        @Nullable
        private String footer;

        @Nullable
        private Logger logger;

        private final Options options;

        private final Set<String> mandatoryOptions;

        private final Map<String, Type> optionTypes;

        public Parser() {
            this.name = null;
            this.header = null;
            this.footer = null;
            this.options = new Options();
            this.mandatoryOptions = new HashSet<>();
            this.optionTypes = Maps.newHashMap();
        }

        public Parser withName(@Nullable final String name) {
            this.name = name;
            return this;
        }

        public Parser withHeader(@Nullable final String header) {
            this.header = header;
            return this;
        }

        public Parser withFooter(@Nullable final String footer) {
            this.footer = footer;
            return this;
        }

        public Parser withLogger(@Nullable final Logger logger) {
            this.logger = logger;
            return this;
        }

        public Parser withOption(@Nullable final String letter, final String name,
                final String description) {

            Preconditions.checkNotNull(name);
            Preconditions.checkArgument(name.length() > 1);
            Preconditions.checkNotNull(description);

            final Option option = new Option(letter, name, false, description);
            this.options.addOption(option);

            return this;
        }

        public Parser withOption(@Nullable final String letter, final String name,
                final String description, final String argName, final Type argType,
                final boolean mandatory) {

            Preconditions.checkNotNull(name);
            Preconditions.checkArgument(name.length() > 1);
            Preconditions.checkNotNull(description);
            Preconditions.checkNotNull(argName);
            Preconditions.checkNotNull(argType);

            final Option option = new Option(letter, name, true, description);
            option.setArgName(argName);
            option.setArgs(1);
            this.options.addOption(option);
            this.optionTypes.put(name, argType);

            if (mandatory) {
                this.mandatoryOptions.add(name);
            }

            return this;
        }

        public CommandLine parse(final String... args) {

            // Add additional options
            if (this.logger != null) {
                this.options.addOption("V", "verbose", false, "enable verbose output");
            }
            this.options.addOption("v", "version", false,
                    "display version information and terminate");
            this.options.addOption("h", "help", false, "display this help message and terminate");

            // Parse options
            org.apache.commons.cli.CommandLine cmd = null;
            try {
                cmd = new DefaultParser().parse(this.options, args);
            } catch (final Throwable ex) {
                printHelp();
                throw new Exception(ex.getMessage(), ex);
            }

            // Handle verbose mode
            if (cmd.hasOption('V') && this.logger instanceof ch.qos.logback.classic.Logger) {
                ((ch.qos.logback.classic.Logger) this.logger).setLevel(Level.DEBUG);
            }

            // Handle version and help commands. Throw an exception to halt execution
            if (cmd.hasOption('v')) {
                printVersion();
                throw new Exception(null);

            } else if (cmd.hasOption('h')) {
                printHelp();
                throw new Exception(null);
            }

            // Check that mandatory options have been specified
            for (final String name : this.mandatoryOptions) {
                if (!cmd.hasOption(name)) {
                    printHelp();
                    throw new Exception("missing mandatory option " + name);
                }
            }

            // Extract and validate options and their arguments
            final Map<String, List<String>> optionValues = Maps.newHashMap();
            for (final Option option : cmd.getOptions()) {
                final List<String> valueList = Lists.newArrayList();
                final String[] values = option.getValues();
                final Type type = this.optionTypes.get(option.getLongOpt());
                if (values != null) {
                    for (final String value : values) {
                        if (type != null && !type.validate(value)) {
                            throw new Exception("invalid value '" + value + "' for option "
                                    + option.getLongOpt() + " (expected " + type.getDescription()
                                    + ")");
                        }
                        valueList.add(value);
                    }
                }
                final List<String> valueSet = ImmutableList.copyOf(valueList);
                optionValues.put(option.getLongOpt(), valueSet);
                if (option.getOpt() != null) {
                    optionValues.put(option.getOpt(), valueSet);
                }
            }

            // Positional arguments are not accepted
            if (!cmd.getArgList().isEmpty()) {
                throw new Exception("unexpected arguments: "
                        + Joiner.on(' ').join(cmd.getArgList()));
            }

            // Create and return the resulting CommandLine object
            return new CommandLine(optionValues);
        }

        private void printVersion() {
            final String version = Util.getVersion("eu.fbk.confman", "cm-core", "(development)");
            final String name = MoreObjects.firstNonNull(this.name, "Version");
            System.out.println(String.format("%s %s\nJava %s (%s)\n", name, version,
                    System.getProperty("java.version"), System.getProperty("java.vendor")));
        }

        private void printHelp() {
            final HelpFormatter formatter = new HelpFormatter();
            final PrintWriter out = new PrintWriter(System.out);
            final String name = MoreObjects.firstNonNull(this.name, "java");
            formatter.printUsage(out, 80, name, this.options);
            if (this.header != null) {
                out.println();
                formatter.printWrapped(out, 80, this.header);
            }
            out.println();
            formatter.printOptions(out, 80, this.options, 2, 2);
            if (this.footer != null) {
                out.println();
                out.println(this.footer);
            }
            out.flush();
        }

    }

    public static final class Exception extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public Exception(@Nullable final String message) {
            super(message);
        }

        public Exception(@Nullable final String message, @Nullable final Throwable cause) {
            super(message, cause);
        }

    }

    public enum Type {

        STRING("a string"),

        POSITIVE_INTEGER("a positive integer"),

        PORT("a port number between 0 and 65535"),

        URI("a URI"),

        FILE("a file path"),

        DIRECTORY("a directory path");

        private final String description;

        private Type(final String description) {
            this.description = description;
        }

        public String getDescription() {
            return this.description;
        }

        public boolean validate(final String string) {
            // Polymorphism not used for performance reasons
            return validate(string, this);
        }

        private static boolean validate(final String string, final Type type) {

            if (type == POSITIVE_INTEGER || type == PORT) {
                try {
                    final long n = Long.parseLong(string);
                    if (type == POSITIVE_INTEGER) {
                        return n > 0L;
                    } else {
                        return n >= 0L && n <= 65535L;
                    }
                } catch (final Throwable ex) {
                    return false;
                }

            } else if (type == URI) {
                try {
                    return new java.net.URI(string).isAbsolute();
                } catch (final Throwable ex) {
                    return false;
                }

            } else if (type == FILE) {
                final java.io.File file = Names.expandHome(string).toFile();
                return !file.exists() || file.isFile();

            } else if (type == DIRECTORY) {
                final java.io.File dir = Names.expandHome(string).toFile();
                return !dir.exists() || dir.isDirectory();
            }

            return !string.isEmpty();
        }

    }

}
