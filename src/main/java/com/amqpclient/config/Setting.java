package com.amqpclient.config;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A configuration value that remembers whether it was explicitly set.
 *
 * "Not set" and "set to the default" are different things when options are
 * layered: only set values replace the value underneath them.
 */
public final class Setting<T> {

    private static final Setting<?> UNSET = new Setting<>(false, null);

    private final boolean set;
    private final T value;

    private Setting(boolean set, T value) {
        this.set = set;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> Setting<T> unset() {
        return (Setting<T>) UNSET;
    }

    public static <T> Setting<T> of(T value) {
        return new Setting<>(true, Objects.requireNonNull(value, "value"));
    }

    public boolean isSet() {
        return set;
    }

    /**
     * @throws NoSuchElementException if the value was never set
     */
    public T get() {
        if (!set) {
            throw new NoSuchElementException("Setting has no value");
        }
        return value;
    }

    public T orElse(T other) {
        return set ? value : other;
    }

    /**
     * Layer {@code update} on top of this setting.
     *
     * @return {@code update} if it is set, otherwise this setting
     */
    public Setting<T> overlay(Setting<T> update) {
        return update.set ? update : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Setting)) return false;
        Setting<?> that = (Setting<?>) o;
        return set == that.set && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(set, value);
    }

    @Override
    public String toString() {
        return set ? String.valueOf(value) : "<unset>";
    }
}
