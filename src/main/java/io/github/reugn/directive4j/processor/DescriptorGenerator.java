package io.github.reugn.directive4j.processor;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeSpec;
import io.github.reugn.directive4j.descriptor.ClassDescriptor;
import io.github.reugn.directive4j.descriptor.ColumnDefinition;
import io.github.reugn.directive4j.descriptor.RelationshipDefinition;
import io.github.reugn.directive4j.descriptor.RouteDefinition;

import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import java.io.IOException;
import java.util.Map;

/**
 * Writes the {@code <ClassName>Directives} companion class of an expanded class.
 *
 * <p>The companion rebuilds the {@link ClassDescriptor} collected at compile time, so
 * applications read directive metadata without parsing comments at runtime.
 *
 * <p><b>Generated Output:</b>
 * <pre>
 * // Source
 * /**
 *  * !Table users
 *  *&#47;
 * public class User { ... }
 *
 * // Generated: UserDirectives.java
 * public final class UserDirectives {
 *     public static ClassDescriptor descriptor() {
 *         ClassDescriptor descriptor = new ClassDescriptor("com.example.User");
 *         descriptor.setProperty("table", "users");
 *         return descriptor;
 *     }
 * }
 * </pre>
 * A new descriptor is built on every call, so callers may modify the returned instance.
 */
final class DescriptorGenerator {

    static final String SUFFIX = "Directives";

    private final ProcessingEnvironment processingEnv;

    DescriptorGenerator(ProcessingEnvironment processingEnv) {
        this.processingEnv = processingEnv;
    }

    /**
     * Generates the companion class of {@code type}.
     *
     * @param type       the expanded class
     * @param descriptor its collected metadata
     * @throws IOException if the source file cannot be written
     */
    void generate(TypeElement type, ClassDescriptor descriptor) throws IOException {
        String packageName = processingEnv.getElementUtils().getPackageOf(type).getQualifiedName().toString();
        String generatedClassName = type.getSimpleName() + SUFFIX;

        MethodSpec constructor = MethodSpec.constructorBuilder()
                .addModifiers(Modifier.PRIVATE)
                .addStatement("throw new $T($S)", UnsupportedOperationException.class, "Utility class")
                .build();

        MethodSpec descriptorMethod = MethodSpec.methodBuilder("descriptor")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(ClassDescriptor.class)
                .addJavadoc("Returns a new descriptor holding the directives of {@link $T}.\n", ClassName.get(type))
                .addCode(descriptorBody(descriptor))
                .build();

        TypeSpec generatedClass = TypeSpec.classBuilder(generatedClassName)
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .addMethod(constructor)
                .addMethod(descriptorMethod)
                .addAnnotation(AnnotationSpec.builder(ClassName.get("javax.annotation.processing", "Generated"))
                        .addMember("value", "$S", DirectiveProcessor.class.getCanonicalName())
                        .build())
                .addJavadoc("Directive metadata of {@link $T}.\n", ClassName.get(type))
                .addJavadoc("<p>Generated by directive4j annotation processor.\n")
                .build();

        JavaFile.builder(packageName, generatedClass)
                .addFileComment("Generated by directive4j annotation processor. Do not modify.")
                .build()
                .writeTo(processingEnv.getFiler());
    }

    // ==================== BODY ====================

    /**
     * Emits one statement per descriptor entry, in the order the directives added them.
     */
    static CodeBlock descriptorBody(ClassDescriptor descriptor) {
        CodeBlock.Builder body = CodeBlock.builder()
                .addStatement("$T descriptor = new $T($S)",
                        ClassDescriptor.class, ClassDescriptor.class, descriptor.className());

        for (Map.Entry<String, String> property : descriptor.properties().entrySet()) {
            body.addStatement("descriptor.setProperty($S, $S)", property.getKey(), property.getValue());
        }
        for (RouteDefinition route : descriptor.routes()) {
            body.addStatement("descriptor.addRoute(new $T($S, $S, $S, $S))", RouteDefinition.class,
                    route.method(), route.path(), route.name(), route.handler());
        }
        for (ColumnDefinition column : descriptor.columns()) {
            body.addStatement("descriptor.addColumn(new $T($S, $S, $L, $L, $L, $S))", ColumnDefinition.class,
                    column.property(), column.type(), column.nullable(), column.primaryKey(),
                    column.autoIncrement(), column.defaultValue());
        }
        for (RelationshipDefinition relationship : descriptor.relationships()) {
            body.addStatement("descriptor.addRelationship(new $T($T.$L, $S, $S, $S, $S, $S))",
                    RelationshipDefinition.class, RelationshipDefinition.Type.class, relationship.type().name(),
                    relationship.name(), relationship.relatedClass(), relationship.foreignKey(),
                    relationship.through(), relationship.onDelete());
        }

        return body.addStatement("return descriptor").build();
    }
}
