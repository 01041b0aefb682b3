package io.github.reugn.directive4j.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluated parameters of one directive: ordered positional values plus keyed values.
 * <p>
 * Keys are lower-cased on insertion, so {@code Name: x} and {@code name: x} address the
 * same entry; a repeated key overwrites the earlier value. Instances are immutable.
 */
public final class ParameterList {

    private static final ParameterList EMPTY = new ParameterList(List.of(), Map.of());

    private final List<Value> positional;
    private final Map<String, Value> keyed;

    private ParameterList(List<Value> positional, Map<String, Value> keyed) {
        this.positional = List.copyOf(positional);
        this.keyed = Collections.unmodifiableMap(new LinkedHashMap<>(keyed));
    }

    public static ParameterList empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Lower-cases a parameter key the way every key in this library is normalized.
     *
     * @param key the key as written
     * @return the normalized key
     */
    public static String normalizeKey(String key) {
        return key.toLowerCase(Locale.ROOT);
    }

    public List<Value> positional() {
        return positional;
    }

    public Map<String, Value> keyed() {
        return keyed;
    }

    /**
     * Returns the positional value at {@code index}, if present.
     */
    public Optional<Value> positional(int index) {
        return index >= 0 && index < positional.size() ? Optional.of(positional.get(index)) : Optional.empty();
    }

    /**
     * Returns the keyed value for {@code key} (matched case-insensitively), if present.
     */
    public Optional<Value> get(String key) {
        return Optional.ofNullable(keyed.get(normalizeKey(key)));
    }

    public boolean has(String key) {
        return keyed.containsKey(normalizeKey(key));
    }

    /**
     * Combined count of positional and keyed parameters.
     */
    public int size() {
        return positional.size() + keyed.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Renders the list as directive argument text that evaluates back to an equal list.
     *
     * @return e.g. {@code 'GET', '/users', 'name': 'users.index'}
     */
    public String render() {
        List<String> parts = new ArrayList<>();
        positional.forEach(v -> parts.add(v.render()));
        keyed.forEach((k, v) -> parts.add(Value.of(k).render() + ": " + v.render()));
        return String.join(", ", parts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterList that = (ParameterList) o;
        return positional.equals(that.positional) && keyed.equals(that.keyed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, keyed);
    }

    @Override
    public String toString() {
        return "ParameterList{positional=" + positional + ", keyed=" + keyed + "}";
    }

    /**
     * Accumulates entries in source order.
     */
    public static final class Builder {

        private final List<Value> positional = new ArrayList<>();
        private final Map<String, Value> keyed = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(Value value) {
            positional.add(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String key, Value value) {
            keyed.put(normalizeKey(Objects.requireNonNull(key, "key")), Objects.requireNonNull(value, "value"));
            return this;
        }

        public ParameterList build() {
            return positional.isEmpty() && keyed.isEmpty() ? EMPTY : new ParameterList(positional, keyed);
        }

        Value.ListValue buildList() {
            return new Value.ListValue(positional, keyed);
        }
    }
}
