package eu.fbk.confman.server.http.jaxrs;

import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.glassfish.jersey.media.sse.SseFeature;
import org.glassfish.jersey.server.ServerProperties;

import eu.fbk.confman.bus.Bus;

/**
 * The JAX-RS application exposing a {@code Bus}.
 */
public final class Application extends javax.ws.rs.core.Application {

    private final Bus bus;

    private final Signals signals;

    private final Set<Class<?>> classes;

    private final Set<Object> singletons;

    private final Map<String, Object> properties;

    public Application(final Bus bus) {
        this.bus = Preconditions.checkNotNull(bus);
        this.signals = new Signals(bus);
        this.classes = ImmutableSet.<Class<?>>of(SseFeature.class);
        this.singletons = ImmutableSet.<Object>of(new Calls(bus), this.signals);

        final ImmutableMap.Builder<String, Object> properties = ImmutableMap.builder();
        properties.put(ServerProperties.APPLICATION_NAME, "ConfigurationManager");
        properties.put(ServerProperties.WADL_FEATURE_DISABLE, true);
        properties.put(ServerProperties.JSON_PROCESSING_FEATURE_DISABLE, true); // Jackson used
        properties.put(ServerProperties.MOXY_JSON_FEATURE_DISABLE, true); // not used
        this.properties = properties.build();
    }

    public Bus getBus() {
        return this.bus;
    }

    /**
     * Terminates the open signal streams.
     */
    public void close() {
        this.signals.close();
    }

    @Override
    public Set<Class<?>> getClasses() {
        return this.classes;
    }

    @Override
    public Set<Object> getSingletons() {
        return this.singletons;
    }

    @Override
    public Map<String, Object> getProperties() {
        return this.properties;
    }

}
