package com.amqpclient.config;

import com.amqpclient.address.ConnectionTarget;
import com.amqpclient.connection.ConnectionHandler;
import com.amqpclient.reconnect.ReconnectOptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Options for one connection.
 *
 * Every field is a {@link Setting}, so an instance can describe either a
 * complete configuration or a partial update. {@link #update(ConnectionOptions)}
 * layers a partial update on top of an existing configuration field by field:
 * fields the update does not set keep their previous value. An explicitly
 * empty reconnect URL or failover list clears that field.
 *
 * Instances are immutable.
 */
public final class ConnectionOptions {

    private static final ConnectionOptions EMPTY = new Builder().build();

    // Reconnect related
    private final Setting<String> reconnectUrl;
    private final Setting<List<String>> failoverUrls;
    private final Setting<ReconnectOptions> reconnect;

    // Connection attributes
    private final Setting<String> virtualHost;
    private final Setting<String> user;
    private final Setting<String> password;
    private final Setting<String> saslAllowedMechs;
    private final Setting<Boolean> saslEnabled;
    private final Setting<String> containerId;
    private final Setting<Duration> idleTimeout;
    private final Setting<Integer> maxFrameSize;
    private final Setting<Duration> connectTimeout;
    private final Setting<Boolean> sslEnabled;
    private final Setting<ConnectionHandler> handler;

    private ConnectionOptions(Builder b) {
        this.reconnectUrl = b.reconnectUrl;
        this.failoverUrls = b.failoverUrls;
        this.reconnect = b.reconnect;
        this.virtualHost = b.virtualHost;
        this.user = b.user;
        this.password = b.password;
        this.saslAllowedMechs = b.saslAllowedMechs;
        this.saslEnabled = b.saslEnabled;
        this.containerId = b.containerId;
        this.idleTimeout = b.idleTimeout;
        this.maxFrameSize = b.maxFrameSize;
        this.connectTimeout = b.connectTimeout;
        this.sslEnabled = b.sslEnabled;
        this.handler = b.handler;
    }

    /**
     * Options with nothing set.
     */
    public static ConnectionOptions empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.reconnectUrl = reconnectUrl;
        b.failoverUrls = failoverUrls;
        b.reconnect = reconnect;
        b.virtualHost = virtualHost;
        b.user = user;
        b.password = password;
        b.saslAllowedMechs = saslAllowedMechs;
        b.saslEnabled = saslEnabled;
        b.containerId = containerId;
        b.idleTimeout = idleTimeout;
        b.maxFrameSize = maxFrameSize;
        b.connectTimeout = connectTimeout;
        b.sslEnabled = sslEnabled;
        b.handler = handler;
        return b;
    }

    /**
     * Layer {@code delta} on top of these options.
     *
     * @return new options where each field set in {@code delta} replaces the
     *         field here and every other field is unchanged
     */
    public ConnectionOptions update(ConnectionOptions delta) {
        Objects.requireNonNull(delta, "delta");
        Builder b = new Builder();
        b.reconnectUrl = reconnectUrl.overlay(delta.reconnectUrl);
        b.failoverUrls = failoverUrls.overlay(delta.failoverUrls);
        b.reconnect = reconnect.overlay(delta.reconnect);
        b.virtualHost = virtualHost.overlay(delta.virtualHost);
        b.user = user.overlay(delta.user);
        b.password = password.overlay(delta.password);
        b.saslAllowedMechs = saslAllowedMechs.overlay(delta.saslAllowedMechs);
        b.saslEnabled = saslEnabled.overlay(delta.saslEnabled);
        b.containerId = containerId.overlay(delta.containerId);
        b.idleTimeout = idleTimeout.overlay(delta.idleTimeout);
        b.maxFrameSize = maxFrameSize.overlay(delta.maxFrameSize);
        b.connectTimeout = connectTimeout.overlay(delta.connectTimeout);
        b.sslEnabled = sslEnabled.overlay(delta.sslEnabled);
        b.handler = handler.overlay(delta.handler);
        return b.build();
    }

    /**
     * True if these options set any field that affects where or whether to reconnect.
     */
    public boolean touchesReconnect() {
        return reconnectUrl.isSet() || failoverUrls.isSet() || reconnect.isSet();
    }

    /**
     * The reconnect policy in effect.
     *
     * An explicit policy wins. Without one, a non-empty failover list turns
     * reconnection on with the default policy. Otherwise there is no
     * reconnection.
     */
    public Optional<ReconnectOptions> effectiveReconnect() {
        if (reconnect.isSet()) {
            return Optional.of(reconnect.get());
        }
        if (!failoverUrls.orElse(Collections.emptyList()).isEmpty()) {
            return Optional.of(ReconnectOptions.defaults());
        }
        return Optional.empty();
    }

    /**
     * The sticky override target, if one is set and not cleared.
     */
    public Optional<ConnectionTarget> reconnectTarget() {
        String url = reconnectUrl.orElse("");
        return url.isEmpty() ? Optional.empty() : Optional.of(ConnectionTarget.parse(url));
    }

    public List<ConnectionTarget> failoverTargets() {
        List<String> urls = failoverUrls.orElse(Collections.emptyList());
        List<ConnectionTarget> targets = new ArrayList<>(urls.size());
        for (String url : urls) {
            targets.add(ConnectionTarget.parse(url));
        }
        return targets;
    }

    public Setting<String> reconnectUrl() {
        return reconnectUrl;
    }

    public Setting<List<String>> failoverUrls() {
        return failoverUrls;
    }

    public Setting<ReconnectOptions> reconnect() {
        return reconnect;
    }

    public Setting<String> virtualHost() {
        return virtualHost;
    }

    public Setting<String> user() {
        return user;
    }

    public Setting<String> password() {
        return password;
    }

    public Setting<String> saslAllowedMechs() {
        return saslAllowedMechs;
    }

    public Setting<Boolean> saslEnabled() {
        return saslEnabled;
    }

    public Setting<String> containerId() {
        return containerId;
    }

    public Setting<Duration> idleTimeout() {
        return idleTimeout;
    }

    public Setting<Integer> maxFrameSize() {
        return maxFrameSize;
    }

    public Setting<Duration> connectTimeout() {
        return connectTimeout;
    }

    public Setting<Boolean> sslEnabled() {
        return sslEnabled;
    }

    public Setting<ConnectionHandler> handler() {
        return handler;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionOptions)) return false;
        ConnectionOptions that = (ConnectionOptions) o;
        return reconnectUrl.equals(that.reconnectUrl)
            && failoverUrls.equals(that.failoverUrls)
            && reconnect.equals(that.reconnect)
            && virtualHost.equals(that.virtualHost)
            && user.equals(that.user)
            && password.equals(that.password)
            && saslAllowedMechs.equals(that.saslAllowedMechs)
            && saslEnabled.equals(that.saslEnabled)
            && containerId.equals(that.containerId)
            && idleTimeout.equals(that.idleTimeout)
            && maxFrameSize.equals(that.maxFrameSize)
            && connectTimeout.equals(that.connectTimeout)
            && sslEnabled.equals(that.sslEnabled)
            && handler.equals(that.handler);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reconnectUrl, failoverUrls, reconnect, virtualHost, user, password,
                            saslAllowedMechs, saslEnabled, containerId, idleTimeout, maxFrameSize,
                            connectTimeout, sslEnabled, handler);
    }

    @Override
    public String toString() {
        return "ConnectionOptions{reconnectUrl=" + reconnectUrl
            + ", failoverUrls=" + failoverUrls
            + ", reconnect=" + reconnect
            + ", virtualHost=" + virtualHost
            + ", user=" + user
            + ", password=" + (password.isSet() ? "****" : password)
            + ", saslAllowedMechs=" + saslAllowedMechs
            + ", saslEnabled=" + saslEnabled
            + ", containerId=" + containerId
            + ", idleTimeout=" + idleTimeout
            + ", maxFrameSize=" + maxFrameSize
            + ", connectTimeout=" + connectTimeout
            + ", sslEnabled=" + sslEnabled
            + "}";
    }

    /**
     * Fluent builder. Each call marks its field as set.
     */
    public static final class Builder {
        private Setting<String> reconnectUrl = Setting.unset();
        private Setting<List<String>> failoverUrls = Setting.unset();
        private Setting<ReconnectOptions> reconnect = Setting.unset();
        private Setting<String> virtualHost = Setting.unset();
        private Setting<String> user = Setting.unset();
        private Setting<String> password = Setting.unset();
        private Setting<String> saslAllowedMechs = Setting.unset();
        private Setting<Boolean> saslEnabled = Setting.unset();
        private Setting<String> containerId = Setting.unset();
        private Setting<Duration> idleTimeout = Setting.unset();
        private Setting<Integer> maxFrameSize = Setting.unset();
        private Setting<Duration> connectTimeout = Setting.unset();
        private Setting<Boolean> sslEnabled = Setting.unset();
        private Setting<ConnectionHandler> handler = Setting.unset();

        private Builder() {
        }

        /**
         * Sticky address used for every reconnect attempt. An empty string clears it.
         */
        public Builder reconnectUrl(String url) {
            Objects.requireNonNull(url, "url");
            if (!url.isEmpty()) {
                ConnectionTarget.parse(url);
            }
            this.reconnectUrl = Setting.of(url);
            return this;
        }

        /**
         * Alternate addresses cycled after the original one. An empty list clears them.
         */
        public Builder failoverUrls(List<String> urls) {
            Objects.requireNonNull(urls, "urls");
            List<String> copy = new ArrayList<>(urls.size());
            for (String url : urls) {
                ConnectionTarget.parse(url);
                copy.add(url);
            }
            this.failoverUrls = Setting.of(Collections.unmodifiableList(copy));
            return this;
        }

        public Builder failoverUrls(String... urls) {
            return failoverUrls(Arrays.asList(urls));
        }

        public Builder reconnect(ReconnectOptions reconnect) {
            this.reconnect = Setting.of(reconnect);
            return this;
        }

        /**
         * Host name sent in the AMQP open frame.
         */
        public Builder virtualHost(String virtualHost) {
            this.virtualHost = Setting.of(virtualHost);
            return this;
        }

        public Builder user(String user) {
            this.user = Setting.of(user);
            return this;
        }

        public Builder password(String password) {
            this.password = Setting.of(password);
            return this;
        }

        /**
         * Space separated SASL mechanisms the client may use, e.g. "PLAIN ANONYMOUS".
         */
        public Builder saslAllowedMechs(String mechanisms) {
            this.saslAllowedMechs = Setting.of(mechanisms);
            return this;
        }

        public Builder saslEnabled(boolean enabled) {
            this.saslEnabled = Setting.of(enabled);
            return this;
        }

        public Builder containerId(String containerId) {
            this.containerId = Setting.of(containerId);
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            if (idleTimeout.isNegative()) {
                throw new IllegalArgumentException("Idle timeout must not be negative: " + idleTimeout);
            }
            this.idleTimeout = Setting.of(idleTimeout);
            return this;
        }

        public Builder maxFrameSize(int maxFrameSize) {
            if (maxFrameSize < 512) {
                throw new IllegalArgumentException("Max frame size must be at least 512: " + maxFrameSize);
            }
            this.maxFrameSize = Setting.of(maxFrameSize);
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            if (connectTimeout.isNegative()) {
                throw new IllegalArgumentException("Connect timeout must not be negative: " + connectTimeout);
            }
            this.connectTimeout = Setting.of(connectTimeout);
            return this;
        }

        public Builder sslEnabled(boolean enabled) {
            this.sslEnabled = Setting.of(enabled);
            return this;
        }

        /**
         * Handler receiving the events of this connection instead of the container's handler.
         */
        public Builder handler(ConnectionHandler handler) {
            this.handler = Setting.of(handler);
            return this;
        }

        public ConnectionOptions build() {
            return new ConnectionOptions(this);
        }
    }
}
