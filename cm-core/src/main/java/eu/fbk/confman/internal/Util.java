package eu.fbk.confman.internal;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import javax.annotation.Nullable;

import com.google.common.util.concurrent.ForwardingListeningExecutorService;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Util {

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    private Util() {
    }

    public static String getVersion(final String groupId, final String artifactId,
            final String defaultValue) {
        final URL url = Util.class.getClassLoader().getResource(
                "META-INF/maven/" + groupId + "/" + artifactId + "/pom.properties");
        String version = defaultValue;
        if (url != null) {
            try {
                final InputStream stream = url.openStream();
                try {
                    final Properties properties = new Properties();
                    properties.load(stream);
                    version = properties.getProperty("version").trim();
                } finally {
                    stream.close();
                }
            } catch (final IOException ex) {
                version = "unknown";
            }
        }
        return version;
    }

    public static void closeQuietly(@Nullable final Object object) {
        if (object instanceof AutoCloseable) {
            try {
                ((AutoCloseable) object).close();
            } catch (final Throwable ex) {
                LOGGER.error("Error closing " + object.getClass().getSimpleName(), ex);
            }
        }
    }

    /**
     * Creates an executor whose tasks run with the MDC of the submitting thread.
     *
     * @param nameFormat
     *            the format of thread names, e.g. {@code bus-dispatch-%d}
     * @param threads
     *            the number of threads, or 0 for an unbounded cached pool
     * @return the created executor
     */
    public static ListeningExecutorService newExecutor(final String nameFormat, final int threads) {
        final ThreadFactory factory = new ThreadFactoryBuilder().setDaemon(true)
                .setNameFormat(nameFormat)
                .setUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {

                    @Override
                    public void uncaughtException(final Thread thread, final Throwable ex) {
                        LOGGER.error("Uncaught exception in thread " + thread.getName(), ex);
                    }

                }).build();
        final ExecutorService executor = threads > 0 ? Executors.newFixedThreadPool(threads,
                factory) : Executors.newCachedThreadPool(factory);
        return new MDCExecutorService(MoreExecutors.listeningDecorator(executor));
    }

    private static final class MDCExecutorService extends ForwardingListeningExecutorService {

        private final ListeningExecutorService delegate;

        MDCExecutorService(final ListeningExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        protected ListeningExecutorService delegate() {
            return this.delegate;
        }

        @Override
        public void execute(final Runnable runnable) {
            this.delegate.execute(wrap(runnable));
        }

        @Override
        public ListenableFuture<?> submit(final Runnable runnable) {
            return this.delegate.submit(wrap(runnable));
        }

        @Override
        public <T> ListenableFuture<T> submit(final Runnable runnable, final T result) {
            return this.delegate.submit(wrap(runnable), result);
        }

        @Override
        public <T> ListenableFuture<T> submit(final Callable<T> callable) {
            return this.delegate.submit(wrap(callable));
        }

        private static Runnable wrap(final Runnable runnable) {
            final Map<String, String> mdc = Logging.getMDC();
            return new Runnable() {

                @Override
                public void run() {
                    final Map<String, String> oldMdc = Logging.getMDC();
                    try {
                        Logging.setMDC(mdc);
                        runnable.run();
                    } finally {
                        Logging.setMDC(oldMdc);
                    }
                }

            };
        }

        private static <T> Callable<T> wrap(final Callable<T> callable) {
            final Map<String, String> mdc = Logging.getMDC();
            return new Callable<T>() {

                @Override
                public T call() throws Exception {
                    final Map<String, String> oldMdc = Logging.getMDC();
                    try {
                        Logging.setMDC(mdc);
                        return callable.call();
                    } finally {
                        Logging.setMDC(oldMdc);
                    }
                }

            };
        }

    }

}
