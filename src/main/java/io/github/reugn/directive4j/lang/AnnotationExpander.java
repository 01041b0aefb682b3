package io.github.reugn.directive4j.lang;

import io.github.reugn.directive4j.descriptor.ClassDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives directives from comment text to descriptor mutations.
 * <p>
 * For each comment the expander extracts directives with {@link DirectiveParser},
 * evaluates their arguments with {@link ParameterEvaluator}, resolves their kind in the
 * {@link AnnotationRegistry} and runs {@link Annotation#expandAnnotation}. Directives are
 * applied in source order.
 *
 * <p><b>Failure Handling:</b>
 * A failing directive does not stop the others in the same comment. Once every directive
 * was tried, the first failure is thrown and the remaining ones are attached to it as
 * {@linkplain Throwable#getSuppressed() suppressed} exceptions. Directives that succeeded
 * keep their effect on the descriptor. Any other runtime failure of a directive kind is
 * wrapped in an {@link AnnotationException} located at the target.
 *
 * <p>An expander holds no mutable state; one instance may serve concurrent passes over
 * different descriptors.
 */
public final class AnnotationExpander {

    private static final Logger log = LoggerFactory.getLogger(AnnotationExpander.class);

    private final AnnotationRegistry registry;

    public AnnotationExpander(AnnotationRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Creates the annotation instance for one directive.
     *
     * @param invocation the raw directive
     * @param target     the element the comment belongs to, used to locate failures
     * @return an initialized instance in the {@link ExpansionState#PARSED} state
     * @throws AnnotationParseException   if the argument text is malformed
     * @throws UnknownAnnotationException if the directive names no registered kind
     */
    public Annotation instantiate(RawInvocation invocation, Target target) {
        try {
            ParameterList parameters = ParameterEvaluator.evaluate(invocation);
            Annotation annotation = registry.lookup(invocation.name()).newInstance();
            annotation.init(parameters);
            return annotation;
        } catch (AnnotationException e) {
            throw e.locatedAt(target);
        }
    }

    /**
     * Creates instances for every directive in {@code comment}, failing on the first problem.
     *
     * @param comment the documentation comment
     * @param target  the element the comment belongs to
     * @return initialized instances in source order
     */
    public List<Annotation> parse(String comment, Target target) {
        List<Annotation> annotations = new ArrayList<>();
        for (RawInvocation invocation : DirectiveParser.parse(comment)) {
            annotations.add(instantiate(invocation, target));
        }
        return annotations;
    }

    /**
     * Applies every directive of {@code comment} to {@code descriptor}.
     *
     * @param comment    the documentation comment, may be {@code null}
     * @param target     the element the comment belongs to
     * @param descriptor descriptor of the class declaring {@code target}
     * @return {@code descriptor}
     * @throws AnnotationException the first failure, with later ones suppressed
     */
    public ClassDescriptor expand(String comment, Target target, ClassDescriptor descriptor) {
        List<AnnotationException> failures = new ArrayList<>();
        int expanded = 0;

        for (RawInvocation invocation : DirectiveParser.parse(comment)) {
            try {
                instantiate(invocation, target).expandAnnotation(target, descriptor);
                expanded++;
            } catch (AnnotationException e) {
                log.debug("!{} on {} {} failed: {}", invocation.name(), target.kind().label(),
                        target.elementName(), e.getMessage());
                failures.add(e);
            } catch (RuntimeException e) {
                log.debug("!{} on {} {} failed unexpectedly", invocation.name(), target.kind().label(),
                        target.elementName(), e);
                failures.add(unexpected(invocation, target, e));
            }
        }

        if (!failures.isEmpty()) {
            AnnotationException first = failures.get(0);
            failures.stream().skip(1).forEach(first::addSuppressed);
            throw first;
        }
        if (expanded > 0) {
            log.debug("Expanded {} directive(s) on {} {}", expanded, target.kind().label(), target.elementName());
        }
        return descriptor;
    }

    private static AnnotationException unexpected(RawInvocation invocation, Target target, RuntimeException e) {
        return new AnnotationException(invocation.name(), "!" + invocation.name() + " failed on "
                + target.kind().label() + " \"" + target.elementName() + "\": " + e,
                target.filePath(), target.lineNumber(), e);
    }
}
