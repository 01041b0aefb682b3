package io.github.reugn.directive4j.descriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Structural metadata collected for one class.
 * <p>
 * Directives append routes, columns and relationships and set simple properties such as
 * the table name. The descriptor only records what it is told: consumers such as a router
 * or an ORM mapper interpret the content.
 * <p>
 * Not thread-safe. A descriptor belongs to the pass that builds it.
 */
public final class ClassDescriptor {

    /**
     * Property holding the table a model is stored in.
     */
    public static final String TABLE = "table";

    /**
     * Property holding the data source a model is stored in.
     */
    public static final String SOURCE = "source";

    /**
     * Data source of models that do not name one.
     */
    public static final String DEFAULT_SOURCE = "Default";

    /**
     * Property holding the path prepended to every route of a controller.
     */
    public static final String ROUTE_PREFIX = "routes.prefix";

    private final String className;
    private final List<RouteDefinition> routes = new ArrayList<>();
    private final List<ColumnDefinition> columns = new ArrayList<>();
    private final List<RelationshipDefinition> relationships = new ArrayList<>();
    private final Map<String, String> properties = new LinkedHashMap<>();

    public ClassDescriptor(String className) {
        this.className = Objects.requireNonNull(className, "className");
    }

    public String className() {
        return className;
    }

    public ClassDescriptor addRoute(RouteDefinition route) {
        routes.add(Objects.requireNonNull(route, "route"));
        return this;
    }

    public ClassDescriptor addColumn(ColumnDefinition column) {
        columns.add(Objects.requireNonNull(column, "column"));
        return this;
    }

    public ClassDescriptor addRelationship(RelationshipDefinition relationship) {
        relationships.add(Objects.requireNonNull(relationship, "relationship"));
        return this;
    }

    /**
     * Sets a property, replacing any earlier value.
     *
     * @param key   property name, see the constants of this class
     * @param value property value
     * @return this descriptor
     */
    public ClassDescriptor setProperty(String key, String value) {
        properties.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public Optional<String> property(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    /**
     * The data source, falling back to {@value #DEFAULT_SOURCE}.
     */
    public String source() {
        return property(SOURCE).orElse(DEFAULT_SOURCE);
    }

    public List<RouteDefinition> routes() {
        return Collections.unmodifiableList(routes);
    }

    public List<ColumnDefinition> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Finds the column mapped to {@code property}.
     */
    public Optional<ColumnDefinition> column(String property) {
        return columns.stream().filter(c -> c.property().equals(property)).findFirst();
    }

    public List<RelationshipDefinition> relationships() {
        return Collections.unmodifiableList(relationships);
    }

    public Map<String, String> properties() {
        return Collections.unmodifiableMap(properties);
    }

    public boolean isEmpty() {
        return routes.isEmpty() && columns.isEmpty() && relationships.isEmpty() && properties.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClassDescriptor that = (ClassDescriptor) o;
        return className.equals(that.className)
                && routes.equals(that.routes)
                && columns.equals(that.columns)
                && relationships.equals(that.relationships)
                && properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(className, routes, columns, relationships, properties);
    }

    @Override
    public String toString() {
        return "ClassDescriptor{" + className
                + ", routes=" + routes
                + ", columns=" + columns
                + ", relationships=" + relationships
                + ", properties=" + properties + "}";
    }
}
