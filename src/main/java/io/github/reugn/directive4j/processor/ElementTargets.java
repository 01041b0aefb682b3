package io.github.reugn.directive4j.processor;

import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.util.TreePath;
import com.sun.source.util.Trees;
import io.github.reugn.directive4j.lang.Target;

import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Types;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Describes compiler elements as directive {@link Target}s.
 * <p>
 * This is the reflection side of directive processing: the element kind and names come
 * from {@code javax.lang.model}, the supertypes from {@link Types}, and the file and line
 * from the javac {@link Trees} API.
 *
 * <p><b>Element Mapping:</b>
 * <table border="1">
 *   <caption>Element kinds and their targets</caption>
 *   <tr><th>Element</th><th>Target kind</th><th>Element name</th></tr>
 *   <tr><td>class</td><td>{@code CLASS}</td><td>qualified class name</td></tr>
 *   <tr><td>method</td><td>{@code METHOD}</td><td>method name</td></tr>
 *   <tr><td>field</td><td>{@code PROPERTY}</td><td>field name</td></tr>
 * </table>
 * Other members (constructors, nested types, initializers) carry no directives.
 */
final class ElementTargets {

    private final Types typeUtils;
    private final Trees trees;

    ElementTargets(ProcessingEnvironment processingEnv) {
        this.typeUtils = processingEnv.getTypeUtils();
        this.trees = treesOf(processingEnv);
    }

    /**
     * Describes a class.
     */
    Target forClass(TypeElement type) {
        Location location = locate(type);
        return Target.forClass(type.getQualifiedName().toString(), location.filePath(), location.line(),
                supertypes(type));
    }

    /**
     * Describes a member of {@code owner}.
     *
     * @return the target, or empty if the member kind cannot carry directives
     */
    Optional<Target> forMember(TypeElement owner, Element member) {
        String ownerName = owner.getQualifiedName().toString();
        String memberName = member.getSimpleName().toString();
        return switch (member.getKind()) {
            case METHOD -> {
                Location location = locate(member);
                yield Optional.of(Target.forMethod(ownerName, memberName, location.filePath(), location.line(),
                        supertypes(owner)));
            }
            case FIELD -> {
                Location location = locate(member);
                yield Optional.of(Target.forProperty(ownerName, memberName, location.filePath(), location.line(),
                        supertypes(owner)));
            }
            default -> Optional.empty();
        };
    }

    /**
     * Collects the qualified names of every class and interface {@code type} extends or
     * implements, directly or transitively.
     */
    Set<String> supertypes(TypeElement type) {
        Set<String> names = new LinkedHashSet<>();
        Deque<TypeMirror> pending = new ArrayDeque<>(typeUtils.directSupertypes(type.asType()));
        while (!pending.isEmpty()) {
            TypeMirror supertype = typeUtils.erasure(pending.poll());
            if (supertype.getKind() != TypeKind.DECLARED) {
                continue;
            }
            TypeElement element = (TypeElement) ((DeclaredType) supertype).asElement();
            if (names.add(element.getQualifiedName().toString())) {
                pending.addAll(typeUtils.directSupertypes(supertype));
            }
        }
        return names;
    }

    private Location locate(Element element) {
        if (trees == null) {
            return Location.UNKNOWN;
        }
        TreePath path = trees.getPath(element);
        if (path == null) {
            return Location.UNKNOWN;
        }
        CompilationUnitTree unit = path.getCompilationUnit();
        long position = trees.getSourcePositions().getStartPosition(unit, path.getLeaf());
        long line = position < 0 ? -1 : unit.getLineMap().getLineNumber(position);
        return new Location(unit.getSourceFile().getName(), line);
    }

    private static Trees treesOf(ProcessingEnvironment processingEnv) {
        try {
            return Trees.instance(processingEnv);
        } catch (IllegalArgumentException e) {
            // Not running inside javac: targets are reported without file and line
            return null;
        }
    }

    private record Location(String filePath, long line) {
        static final Location UNKNOWN = new Location(Target.UNKNOWN_FILE, -1);
    }
}
