package io.github.reugn.directive4j.lang;

import io.github.reugn.directive4j.descriptor.ClassDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Base class for class, method and property directives.
 * <p>
 * New directives are introduced by extending this class, naming the subclass
 * {@code <Directive>Annotation} and registering it with an {@link AnnotationRegistry}.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li><b>Parsed</b> - created by the registry factory and given its {@link ParameterList}</li>
 *   <li><b>Type-checked</b> - the target kind is tested against {@link #isFor()}</li>
 *   <li><b>Validated</b> - {@link #validate(Target)} appends errors using the protected
 *       validation helpers; keys without a binder are reported as invalid</li>
 *   <li><b>Bound</b> - keyed parameters are handed to their binders, positional parameters
 *       land in {@link #values()}</li>
 *   <li><b>Expanded</b> - {@link #expand(Target, ClassDescriptor)} mutates the descriptor</li>
 * </ol>
 * Errors are collected, never thrown one at a time. If any exist after validation or
 * binding, a single {@link AnnotationValidationException} lists all of them and
 * {@code expand} is never called.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * public class TableAnnotation extends Annotation {
 *     public String usage() { return "!Table tableName"; }
 *     public Set<TargetKind> isFor() { return EnumSet.of(TargetKind.CLASS); }
 *
 *     protected void validate(Target target) {
 *         exactParameterCount(1);
 *         acceptsNoKeyedValues();
 *     }
 *
 *     protected void expand(Target target, ClassDescriptor descriptor) {
 *         descriptor.setProperty(ClassDescriptor.TABLE, values().get(0).asText());
 *     }
 * }
 * }</pre>
 */
public abstract class Annotation {

    private static final Logger log = LoggerFactory.getLogger(Annotation.class);

    private final List<String> errors = new ArrayList<>();
    private final List<Value> values = new ArrayList<>();
    private final Map<String, ValueBinder> binders = new LinkedHashMap<>();

    private ParameterList parameters = ParameterList.empty();
    private ExpansionState state = ExpansionState.PARSED;

    /**
     * Receives the value of one keyed parameter during binding.
     * <p>
     * Throwing {@link IllegalArgumentException} turns into a reported error.
     */
    @FunctionalInterface
    protected interface ValueBinder {
        void bind(Value value);
    }

    // ==================== CONTRACT ====================

    /**
     * Describes how the directive is written, shown to users when validation fails.
     *
     * @return e.g. {@code "!Route METHOD, path [, name: routeName]"}
     */
    public abstract String usage();

    /**
     * The kinds of element this directive may decorate. Must not be empty.
     *
     * @return the applicability mask
     */
    public abstract Set<TargetKind> isFor();

    /**
     * Checks the parameters, appending messages through the protected helpers.
     * Runs even when the type check failed so all problems are reported together.
     *
     * @param target the element the directive is attached to
     */
    protected abstract void validate(Target target);

    /**
     * Mutates the descriptor. Only called on instances with no errors, after binding.
     *
     * @param target     the element the directive is attached to
     * @param descriptor the descriptor of the declaring class
     */
    protected abstract void expand(Target target, ClassDescriptor descriptor);

    // ==================== STATE ====================

    /**
     * Canonical kind name, used in every message about this directive.
     *
     * @return the simple class name, e.g. {@code "RouteAnnotation"}
     */
    public final String name() {
        return getClass().getSimpleName();
    }

    /**
     * Hands the evaluated parameters to a freshly created instance.
     *
     * @param parameters the directive's parameters
     * @throws IllegalStateException if the instance already left the {@code PARSED} state
     */
    public final void init(ParameterList parameters) {
        if (state != ExpansionState.PARSED) {
            throw new IllegalStateException(name() + " cannot be re-initialized in state " + state + ".");
        }
        this.parameters = parameters == null ? ParameterList.empty() : parameters;
    }

    /**
     * The parameters awaiting binding.
     *
     * @return the parameters
     * @throws IllegalStateException once binding has released them
     */
    public final ParameterList parameters() {
        if (parameters == null) {
            throw new IllegalStateException(name() + " parameters were released after binding.");
        }
        return parameters;
    }

    /**
     * Errors collected so far.
     */
    public final List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Positional parameters, in source order, once bound.
     */
    public final List<Value> values() {
        return Collections.unmodifiableList(values);
    }

    public final ExpansionState state() {
        return state;
    }

    // ==================== BINDING SETUP ====================

    /**
     * Declares a keyed parameter and the setter that receives it. Keys are case-insensitive.
     * Subclasses call this from their constructor; a key without a binder is rejected as
     * an invalid parameter.
     *
     * @param key    the parameter key
     * @param binder receives the value during binding
     */
    protected final void bind(String key, ValueBinder binder) {
        binders.put(ParameterList.normalizeKey(key), binder);
    }

    protected final void bindText(String key, Consumer<String> setter) {
        bind(key, value -> setter.accept(value.asText()));
    }

    protected final void bindBoolean(String key, Consumer<Boolean> setter) {
        bind(key, value -> setter.accept(value.asBoolean()));
    }

    protected final void bindInt(String key, IntConsumer setter) {
        bind(key, value -> setter.accept(value.asInt()));
    }

    /**
     * Appends an error message.
     *
     * @param message human-readable description of the problem
     */
    protected final void error(String message) {
        errors.add(message);
    }

    // ==================== VALIDATION HELPERS ====================

    /**
     * Reports every key that is not among {@code keys}.
     */
    protected final void acceptedKeys(String... keys) {
        Set<String> accepted = normalizedKeys(keys);
        for (String key : parameters().keyed().keySet()) {
            if (!accepted.contains(key)) {
                error(invalidParameter(key));
            }
        }
    }

    /**
     * Reports every key of {@code keys} that is missing.
     */
    protected final void requiredKeys(String... keys) {
        for (String key : normalizedKeys(keys)) {
            if (!parameters().has(key)) {
                error(name() + " requires a '" + key + "' parameter.");
            }
        }
    }

    /**
     * Reports every positional value whose text is not among {@code accepted}.
     * Comparison is case-sensitive.
     */
    protected final void acceptedKeylessValues(String... accepted) {
        List<String> allowed = Arrays.asList(accepted);
        for (Value value : parameters().positional()) {
            String text = textOf(value);
            if (!allowed.contains(text)) {
                error("Unknown parameter: \"" + text + "\".");
            }
        }
    }

    /**
     * Reports a positional value at {@code index} that is missing or not among {@code accepted}.
     */
    protected final void acceptedIndexedValues(int index, String... accepted) {
        String actual = parameters().positional(index).map(Annotation::textOf).orElse("");
        if (parameters().positional(index).isEmpty() || !Arrays.asList(accepted).contains(actual)) {
            error("Parameter " + index + " is set to \"" + actual + "\". Valid values: "
                    + String.join(", ", accepted) + ".");
        }
    }

    /**
     * When {@code key} is present, reports a value that is not among {@code accepted} after
     * applying {@code normalization} to it.
     */
    protected final void acceptedValuesForKey(String key, CaseNormalization normalization, String... accepted) {
        String normalizedKey = ParameterList.normalizeKey(key);
        Optional<Value> value = parameters().get(normalizedKey);
        if (value.isEmpty()) {
            return;
        }
        String raw = textOf(value.get());
        if (!Arrays.asList(accepted).contains(normalization.apply(raw))) {
            error("The \"" + normalizedKey + "\" parameter is set to \"" + raw + "\". Valid values: "
                    + String.join(", ", accepted) + ".");
        }
    }

    /**
     * Same as {@link #acceptedValuesForKey(String, CaseNormalization, String...)} without case folding.
     */
    protected final void acceptedValuesForKey(String key, String... accepted) {
        acceptedValuesForKey(key, CaseNormalization.NONE, accepted);
    }

    protected final void acceptsNoKeylessValues() {
        acceptedKeylessValues();
    }

    protected final void acceptsNoKeyedValues() {
        acceptedKeys();
    }

    /**
     * Reports every positional or keyed value written as a parenthesized group.
     */
    protected final void acceptsNoGroupedValues() {
        List<Value> positional = parameters().positional();
        for (int i = 0; i < positional.size(); i++) {
            if (positional.get(i) instanceof Value.ListValue) {
                error("Parameter " + i + " must be a single value, not " + positional.get(i).render() + ".");
            }
        }
        parameters().keyed().forEach((key, value) -> {
            if (value instanceof Value.ListValue) {
                error("The \"" + key + "\" parameter must be a single value, not " + value.render() + ".");
            }
        });
    }

    /**
     * Reports a target whose declaring class does not extend {@code baseClassName}.
     */
    protected final void validOnSubclassesOf(Target target, String baseClassName) {
        if (!target.isSubclassOf(baseClassName)) {
            error(name() + " is only valid on objects of type " + baseClassName + ".");
        }
    }

    protected final void minimumParameterCount(int count) {
        if (parameters().size() < count) {
            error(name() + " takes at least " + count + " parameters.");
        }
    }

    protected final void maximumParameterCount(int count) {
        if (parameters().size() > count) {
            error(name() + " takes at most " + count + " parameters.");
        }
    }

    protected final void exactParameterCount(int count) {
        if (parameters().size() != count) {
            error(name() + " requires exactly " + count + " parameters.");
        }
    }

    // ==================== VALUE LOOKUP ====================

    /**
     * Checks whether any positional value, bound or not, has the text {@code text}.
     */
    public final boolean isAValue(String text) {
        return positionalValues().anyMatch(value -> textOf(value).equals(text));
    }

    /**
     * Finds the first positional value whose text is not in {@code excluded}.
     * Used to pick a type out of a list that also carries modifier flags.
     *
     * @param excluded texts to skip
     * @return the first other value, if any
     */
    public final Optional<Value> valueNotIn(String... excluded) {
        List<String> skip = Arrays.asList(excluded);
        return positionalValues().filter(value -> !skip.contains(textOf(value))).findFirst();
    }

    private Stream<Value> positionalValues() {
        Stream<Value> pending = parameters == null ? Stream.empty() : parameters.positional().stream();
        return Stream.concat(pending, values.stream());
    }

    // ==================== EXPANSION ====================

    /**
     * Runs the full lifecycle against {@code descriptor}.
     *
     * @param target     the element the directive is attached to
     * @param descriptor the descriptor of the declaring class
     * @return {@code descriptor}, after {@link #expand} mutated it
     * @throws AnnotationValidationException if any check failed; the descriptor is untouched
     * @throws IllegalStateException         if this instance was already expanded or failed,
     *                                       or if {@link #isFor()} is empty
     */
    public final ClassDescriptor expandAnnotation(Target target, ClassDescriptor descriptor) {
        if (state != ExpansionState.PARSED) {
            throw new IllegalStateException(name() + " cannot be expanded in state " + state + ".");
        }
        Set<TargetKind> applicable = isFor();
        if (applicable == null || applicable.isEmpty()) {
            throw new IllegalStateException(name() + " must be valid on at least one kind of element.");
        }

        boolean typeError = false;
        if (!applicable.contains(target.kind())) {
            error(name() + " is only valid on " + pluralLabels(applicable) + ".");
            typeError = true;
        }
        state = ExpansionState.TYPE_CHECKED;

        validate(target);
        for (String key : parameters().keyed().keySet()) {
            // acceptedKeys may have reported it already
            if (!binders.containsKey(key) && !errors.contains(invalidParameter(key))) {
                error(invalidParameter(key));
            }
        }
        if (!errors.isEmpty()) {
            throw fail(target, typeError);
        }
        state = ExpansionState.VALIDATED;

        bindParameters();
        if (!errors.isEmpty()) {
            throw fail(target, false);
        }
        state = ExpansionState.BOUND;

        expand(target, descriptor);
        state = ExpansionState.EXPANDED;
        log.debug("Expanded {} on {} {}", name(), target.kind().label(), target.elementName());
        return descriptor;
    }

    private void bindParameters() {
        parameters.keyed().forEach((key, value) -> {
            try {
                binders.get(key).bind(value);
            } catch (IllegalArgumentException e) {
                error("Parameter \"" + key + "\" " + e.getMessage() + ".");
            }
        });
        values.addAll(parameters.positional());
        parameters = null;
    }

    private AnnotationValidationException fail(Target target, boolean typeError) {
        state = ExpansionState.FAILED;
        return new AnnotationValidationException(name(), target, usage(), errors, typeError);
    }

    private static String pluralLabels(Set<TargetKind> kinds) {
        return Arrays.stream(TargetKind.values())
                .filter(kinds::contains)
                .map(TargetKind::pluralLabel)
                .collect(Collectors.joining(", "));
    }

    private static Set<String> normalizedKeys(String... keys) {
        return Arrays.stream(keys)
                .map(ParameterList::normalizeKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String invalidParameter(String key) {
        return "Invalid parameter: \"" + key + "\".";
    }

    private static String textOf(Value value) {
        return value instanceof Value.ListValue ? value.render() : value.asText();
    }
}
