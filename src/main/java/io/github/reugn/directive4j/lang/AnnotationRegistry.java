package io.github.reugn.directive4j.lang;

import io.github.reugn.directive4j.builtin.BuiltInAnnotations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Maps directive names to the kinds that implement them.
 * <p>
 * A registry is populated once through its {@link Builder} and is read-only afterwards,
 * so any number of expansion passes may share it. Kinds live in one flat namespace
 * regardless of their packages: {@code !Column} resolves to whichever registered class is
 * named {@code ColumnAnnotation}.
 *
 * <p><b>Composition:</b>
 * <ul>
 *   <li>{@link Builder#register} - explicit registration, used by tests and embedding hosts</li>
 *   <li>{@link Builder#registerInstalled} - kinds published through {@link ServiceLoader}
 *       under {@code META-INF/services/io.github.reugn.directive4j.lang.Annotation}</li>
 *   <li>{@link #standard(ClassLoader)} - built-in kinds followed by installed kinds</li>
 * </ul>
 *
 * <p><b>Process-wide Instance:</b>
 * Hosts that prefer a single shared registry call {@link #initialize(AnnotationRegistry)}
 * once at startup, before any comment is parsed, and read it back with {@link #global()}.
 */
public final class AnnotationRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnnotationRegistry.class);

    private static final AtomicReference<AnnotationRegistry> GLOBAL = new AtomicReference<>();

    private final Map<String, AnnotationKind> kinds;

    private AnnotationRegistry(Map<String, AnnotationKind> kinds) {
        this.kinds = Collections.unmodifiableMap(new LinkedHashMap<>(kinds));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a registry holding the built-in kinds plus every kind installed on
     * {@code classLoader}. Installed kinds replace built-ins of the same name.
     *
     * @param classLoader loader used for service discovery
     * @return the registry
     */
    public static AnnotationRegistry standard(ClassLoader classLoader) {
        Builder builder = builder();
        BuiltInAnnotations.registerAll(builder);
        return builder.registerInstalled(classLoader).build();
    }

    /**
     * Publishes {@code registry} as the process-wide registry. May be called once.
     *
     * @param registry the fully populated registry
     * @throws IllegalStateException if a registry was already published
     */
    public static void initialize(AnnotationRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        if (!GLOBAL.compareAndSet(null, registry)) {
            throw new IllegalStateException("The global annotation registry is already initialized.");
        }
        log.debug("Global annotation registry initialized with {}", registry.names());
    }

    /**
     * Returns the process-wide registry.
     *
     * @return the registry published by {@link #initialize(AnnotationRegistry)}
     * @throws IllegalStateException if none was published yet
     */
    public static AnnotationRegistry global() {
        AnnotationRegistry registry = GLOBAL.get();
        if (registry == null) {
            throw new IllegalStateException(
                    "The global annotation registry is not initialized. Call AnnotationRegistry.initialize first.");
        }
        return registry;
    }

    /**
     * Resolves a directive identifier.
     *
     * @param directiveName the identifier written after {@code !}, e.g. {@code "Route"}
     * @return the registered kind
     * @throws UnknownAnnotationException if no kind is registered under
     *                                    {@code directiveName + "Annotation"}
     */
    public AnnotationKind lookup(String directiveName) {
        AnnotationKind kind = kinds.get(directiveName + AnnotationKind.SUFFIX);
        if (kind == null) {
            throw new UnknownAnnotationException(directiveName);
        }
        return kind;
    }

    public boolean contains(String directiveName) {
        return kinds.containsKey(directiveName + AnnotationKind.SUFFIX);
    }

    /**
     * Canonical names of all registered kinds, in registration order.
     */
    public Set<String> names() {
        return kinds.keySet();
    }

    /**
     * Collects kinds before the registry is frozen.
     */
    public static final class Builder {

        private final Map<String, AnnotationKind> kinds = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a kind under its class name. A later registration of the same name wins.
         *
         * @param type    the kind's class, named {@code <Directive>Annotation}
         * @param factory creates fresh instances
         * @return this builder
         * @throws IllegalArgumentException if the class name lacks the {@code Annotation} suffix
         */
        public <T extends Annotation> Builder register(Class<T> type, Supplier<? extends T> factory) {
            return register(AnnotationKind.of(type, factory));
        }

        public Builder register(AnnotationKind kind) {
            AnnotationKind previous = kinds.put(kind.name(), kind);
            if (previous != null && previous.type() != kind.type()) {
                log.debug("Annotation {} re-registered: {} replaces {}",
                        kind.name(), kind.type().getName(), previous.type().getName());
            }
            return this;
        }

        /**
         * Registers every {@link Annotation} implementation published through
         * {@link ServiceLoader} on {@code classLoader}.
         *
         * @param classLoader loader to search
         * @return this builder
         */
        @SuppressWarnings("unchecked")
        public Builder registerInstalled(ClassLoader classLoader) {
            ServiceLoader.load(Annotation.class, classLoader).stream().forEach(provider -> {
                Class<Annotation> type = (Class<Annotation>) provider.type();
                register(type, provider::get);
                log.debug("Registered installed annotation {}", type.getName());
            });
            return this;
        }

        public AnnotationRegistry build() {
            return new AnnotationRegistry(kinds);
        }
    }
}
