package eu.fbk.confman.bus;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * A filter over {@link Signal}s. Each null field matches any value.
 */
public final class SignalMatch {

    @Nullable
    private final ObjectPath path;

    @Nullable
    private final String interfaceName;

    @Nullable
    private final String member;

    public SignalMatch(@Nullable final ObjectPath path, @Nullable final String interfaceName,
            @Nullable final String member) {
        this.path = path;
        this.interfaceName = interfaceName;
        this.member = member;
    }

    @Nullable
    public ObjectPath getPath() {
        return this.path;
    }

    @Nullable
    public String getInterfaceName() {
        return this.interfaceName;
    }

    @Nullable
    public String getMember() {
        return this.member;
    }

    public boolean matches(final Signal signal) {
        return (this.path == null || this.path.equals(signal.getPath()))
                && (this.interfaceName == null || this.interfaceName.equals(signal
                        .getInterfaceName()))
                && (this.member == null || this.member.equals(signal.getMember()));
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof SignalMatch)) {
            return false;
        }
        final SignalMatch other = (SignalMatch) object;
        return Objects.equals(this.path, other.path)
                && Objects.equals(this.interfaceName, other.interfaceName)
                && Objects.equals(this.member, other.member);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.path, this.interfaceName, this.member);
    }

    /**
     * {@inheritDoc} The match is rendered as a D-Bus match rule, e.g.
     * {@code type='signal',path='/a/b',member='Changed'}.
     */
    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder("type='signal'");
        if (this.path != null) {
            builder.append(",path='").append(this.path).append('\'');
        }
        if (this.interfaceName != null) {
            builder.append(",interface='").append(this.interfaceName).append('\'');
        }
        if (this.member != null) {
            builder.append(",member='").append(this.member).append('\'');
        }
        return builder.toString();
    }

}
