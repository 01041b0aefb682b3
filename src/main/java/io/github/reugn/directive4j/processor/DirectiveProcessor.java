package io.github.reugn.directive4j.processor;

import com.google.auto.service.AutoService;
import io.github.reugn.directive4j.annotation.Directives;
import io.github.reugn.directive4j.descriptor.ClassDescriptor;
import io.github.reugn.directive4j.lang.AnnotationException;
import io.github.reugn.directive4j.lang.AnnotationExpander;
import io.github.reugn.directive4j.lang.AnnotationRegistry;
import io.github.reugn.directive4j.lang.Target;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Messager;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedOptions;
import javax.annotation.processing.SupportedSourceVersion;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Elements;
import javax.tools.Diagnostic;
import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * Annotation processor that expands Javadoc directives of {@link Directives} classes.
 *
 * <p>Registered via {@link com.google.auto.service.AutoService} for automatic discovery by
 * the Java compiler.
 *
 * <p><b>Processing Pipeline:</b>
 * <ol>
 *   <li><b>Expansion</b> - The class comment is expanded first, then the comment of each
 *       method and field in declaration order, all into one {@link ClassDescriptor}</li>
 *   <li><b>Reporting</b> - Every failing directive becomes a compiler error on the element
 *       whose comment holds it; processing continues with the next element</li>
 *   <li><b>Generation</b> - Classes without failures get a {@code {ClassName}Directives}
 *       companion written by {@link DescriptorGenerator}</li>
 * </ol>
 *
 * <p><b>Options:</b>
 * <table border="1">
 *   <caption>Processor options</caption>
 *   <tr><th>Option</th><th>Default</th><th>Effect</th></tr>
 *   <tr>
 *     <td>{@code directive4j.generate}</td>
 *     <td>{@code true}</td>
 *     <td>{@code false} validates directives without generating companions</td>
 *   </tr>
 *   <tr>
 *     <td>{@code directive4j.verbose}</td>
 *     <td>{@code false}</td>
 *     <td>{@code true} prints a note for every expanded class</td>
 *   </tr>
 * </table>
 *
 * <p><b>Directive Kinds:</b>
 * <p>The built-in kinds are always available. Additional kinds are discovered on the
 * processor path through {@link java.util.ServiceLoader}, see
 * {@link AnnotationRegistry#standard(ClassLoader)}.
 *
 * @see ElementTargets
 * @see DescriptorGenerator
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes("io.github.reugn.directive4j.annotation.Directives")
@SupportedSourceVersion(SourceVersion.RELEASE_17)
@SupportedOptions({DirectiveProcessor.OPTION_GENERATE, DirectiveProcessor.OPTION_VERBOSE})
public class DirectiveProcessor extends AbstractProcessor {

    static final String OPTION_GENERATE = "directive4j.generate";
    static final String OPTION_VERBOSE = "directive4j.verbose";

    private final AnnotationRegistry registry;

    private ErrorReporter errorReporter;
    private AnnotationExpander expander;
    private ElementTargets targets;
    private DescriptorGenerator generator;
    private Elements elementUtils;
    private boolean generate;
    private boolean verbose;

    /**
     * Creates a processor using the standard registry.
     *
     * <p>This no-arg constructor is required for annotation processor discovery via
     * {@link java.util.ServiceLoader}.
     */
    public DirectiveProcessor() {
        this(null);
    }

    /**
     * Creates a processor resolving directives in {@code registry}.
     *
     * @param registry the kinds to use, or {@code null} for the standard registry of the
     *                 processor's class loader
     */
    public DirectiveProcessor(AnnotationRegistry registry) {
        this.registry = registry;
    }

    /**
     * Initializes the processor with the processing environment.
     *
     * @param processingEnv the environment providing access to compiler facilities
     */
    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        Messager messager = processingEnv.getMessager();
        this.errorReporter = (element, message) -> messager.printMessage(Diagnostic.Kind.ERROR, message, element);
        this.expander = new AnnotationExpander(registry != null
                ? registry
                : AnnotationRegistry.standard(DirectiveProcessor.class.getClassLoader()));
        this.targets = new ElementTargets(processingEnv);
        this.generator = new DescriptorGenerator(processingEnv);
        this.elementUtils = processingEnv.getElementUtils();
        this.generate = booleanOption(processingEnv, OPTION_GENERATE, true);
        this.verbose = booleanOption(processingEnv, OPTION_VERBOSE, false);
    }

    /**
     * Expands every {@code @Directives} class of the round.
     *
     * @param annotations the annotation types being processed in this round
     * @param roundEnv    the environment for this processing round
     * @return {@code true} to claim the annotation
     */
    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        for (Element element : roundEnv.getElementsAnnotatedWith(Directives.class)) {
            if (element.getKind() != ElementKind.CLASS) {
                errorReporter.error(element, "@Directives can only be applied to classes");
                continue;
            }
            TypeElement type = (TypeElement) element;
            Optional<ClassDescriptor> descriptor = expandClass(type);
            if (descriptor.isEmpty()) {
                continue;
            }
            if (verbose) {
                processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE,
                        "Expanded directives of " + type.getQualifiedName() + ": " + descriptor.get(), type);
            }
            if (generate && type.getAnnotation(Directives.class).generate()) {
                try {
                    generator.generate(type, descriptor.get());
                } catch (IOException e) {
                    errorReporter.error(type, "Failed to generate directives class: " + e.getMessage());
                }
            }
        }
        return true;
    }

    // ==================== EXPANSION ====================

    /**
     * Expands the comments of a class and its members.
     *
     * @param type the marked class
     * @return the descriptor, or empty if any directive failed
     */
    private Optional<ClassDescriptor> expandClass(TypeElement type) {
        ClassDescriptor descriptor = new ClassDescriptor(type.getQualifiedName().toString());
        boolean failed = !expandComment(type, targets.forClass(type), descriptor);

        for (Element enclosed : type.getEnclosedElements()) {
            Optional<Target> target = targets.forMember(type, enclosed);
            if (target.isPresent() && !expandComment(enclosed, target.get(), descriptor)) {
                failed = true;
            }
        }
        return failed ? Optional.empty() : Optional.of(descriptor);
    }

    private boolean expandComment(Element element, Target target, ClassDescriptor descriptor) {
        String comment = elementUtils.getDocComment(element);
        if (comment == null) {
            return true;
        }
        try {
            expander.expand(comment, target, descriptor);
            return true;
        } catch (AnnotationException e) {
            errorReporter.error(element, e);
            return false;
        }
    }

    private static boolean booleanOption(ProcessingEnvironment processingEnv, String name, boolean defaultValue) {
        String value = processingEnv.getOptions().get(name);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
