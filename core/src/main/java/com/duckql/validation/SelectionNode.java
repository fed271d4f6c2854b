package com.duckql.validation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of a request's selection tree.
 *
 * <p>A node with children is an object-typed expansion; a node without
 * children is a scalar leaf. The tree is delivered already resolved by the
 * request-parsing layer; only its shape matters here.
 *
 * <pre>
 *   // users { name posts { title } }
 *   SelectionNode tree = SelectionNode.object("users",
 *       SelectionNode.leaf("name"),
 *       SelectionNode.object("posts", SelectionNode.leaf("title")));
 * </pre>
 */
public record SelectionNode(String name, List<SelectionNode> children) {

    public SelectionNode {
        Objects.requireNonNull(name, "name must not be null");
        children = children == null ? Collections.emptyList() : List.copyOf(children);
    }

    public static SelectionNode leaf(String name) {
        return new SelectionNode(name, Collections.emptyList());
    }

    public static SelectionNode object(String name, SelectionNode... children) {
        return new SelectionNode(name, Arrays.asList(children));
    }

    /**
     * Builds a one-level selection: an object field with scalar children.
     *
     * @param name the object field name (typically the table)
     * @param fields the scalar field names
     * @return the selection tree
     */
    public static SelectionNode flat(String name, List<String> fields) {
        return new SelectionNode(name, fields.stream().map(SelectionNode::leaf).toList());
    }

    /**
     * Returns whether this is an introspection meta-field ({@code __schema},
     * {@code __type}, {@code __typename}).
     *
     * @return true if the name starts with two underscores
     */
    public boolean isIntrospection() {
        return name.startsWith("__");
    }

    /**
     * Returns the number of object-typed expansions along the deepest path
     * from this node. Scalar leaves contribute nothing.
     *
     * @return the depth; 0 for a scalar leaf
     */
    public int depth() {
        if (children.isEmpty()) {
            return 0;
        }
        int deepest = 0;
        for (SelectionNode child : children) {
            deepest = Math.max(deepest, child.depth());
        }
        return 1 + deepest;
    }
}
