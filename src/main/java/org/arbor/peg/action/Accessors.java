package org.arbor.peg.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Named, immutable bundle of computed accessors.
 *
 * <p>A bundle is attached to an expression instance and copied by reference into
 * every node that expression produces. Bundles compose: {@link #include(Accessors)}
 * mixes another bundle in underneath this one, so one bundle (for instance a
 * binary operator with {@code left}, {@code right} and {@code value}) can be shared
 * by several expressions that each add their own {@code operator}.
 *
 * <pre>{@code
 * var binary = Accessors.named("BinaryOperator")
 *     .define("value", node -> node.<IntBinaryOperator>get("operator")
 *         .applyAsInt(node.element(0).get("value"), node.element(2).get("value")));
 *
 * var additive = Accessors.named("Additive")
 *     .include(binary)
 *     .define("operator", node -> (IntBinaryOperator) Integer::sum);
 * }</pre>
 */
public final class Accessors {
    private static final Accessors NONE = new Accessors("", Map.of());

    private final String name;
    private final Map<String, Accessor> definitions;

    private Accessors(String name, Map<String, Accessor> definitions) {
        this.name = name;
        this.definitions = definitions;
    }

    /**
     * The empty bundle carried by expressions without attached behavior.
     */
    public static Accessors none() {
        return NONE;
    }

    /**
     * Start an empty bundle with the given name.
     */
    public static Accessors named(String name) {
        return new Accessors(Objects.requireNonNull(name, "name"), Map.of());
    }

    /**
     * Return a copy of this bundle with {@code accessorName} bound to {@code accessor}.
     * An existing definition with the same name is replaced.
     */
    public Accessors define(String accessorName, Accessor accessor) {
        Objects.requireNonNull(accessorName, "accessorName");
        Objects.requireNonNull(accessor, "accessor");
        var merged = new LinkedHashMap<>(definitions);
        merged.put(accessorName, accessor);
        return new Accessors(name, Collections.unmodifiableMap(merged));
    }

    /**
     * Mix {@code other} in underneath this bundle: its definitions are visible,
     * but definitions already present here take precedence.
     */
    public Accessors include(Accessors other) {
        var merged = new LinkedHashMap<>(other.definitions);
        merged.putAll(definitions);
        return new Accessors(name, Collections.unmodifiableMap(merged));
    }

    /**
     * Layer {@code other} on top of this bundle: its definitions win on conflict.
     */
    public Accessors overriddenBy(Accessors other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        var merged = new LinkedHashMap<>(definitions);
        merged.putAll(other.definitions);
        var mergedName = name.isEmpty() ? other.name : name + "+" + other.name;
        return new Accessors(mergedName, Collections.unmodifiableMap(merged));
    }

    public Optional<Accessor> lookup(String accessorName) {
        return Optional.ofNullable(definitions.get(accessorName));
    }

    public boolean defines(String accessorName) {
        return definitions.containsKey(accessorName);
    }

    public Set<String> names() {
        return definitions.keySet();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "Accessors{" + name + ": " + definitions.keySet() + "}";
    }
}
