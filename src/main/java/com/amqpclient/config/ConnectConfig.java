package com.amqpclient.config;

import java.util.Objects;

/**
 * A connect address together with the options to connect with, as read by
 * {@link ConnectConfigLoader}.
 */
public final class ConnectConfig {

    private final String address;
    private final ConnectionOptions options;

    public ConnectConfig(String address, ConnectionOptions options) {
        this.address = Objects.requireNonNull(address, "address");
        this.options = Objects.requireNonNull(options, "options");
    }

    public String getAddress() {
        return address;
    }

    public ConnectionOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "ConnectConfig{address=" + address + ", options=" + options + "}";
    }
}
