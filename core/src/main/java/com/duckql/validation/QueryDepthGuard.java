package com.duckql.validation;

import com.duckql.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rejects selection trees nested deeper than a configured maximum.
 *
 * <p>Runs before any compilation. Depth counts object-typed expansions only
 * (see {@link SelectionNode#depth()}). Root fields whose names start with
 * {@code __} are introspection meta-requests and are never checked. A guard
 * created without a maximum accepts everything.
 *
 * <p>Example usage:
 * <pre>
 *   QueryDepthGuard guard = QueryDepthGuard.withMaxDepth(3);
 *   guard.check(selection);   // throws ValidationException if too deep
 * </pre>
 */
public final class QueryDepthGuard {

    private static final Logger logger = LoggerFactory.getLogger(QueryDepthGuard.class);

    private static final QueryDepthGuard DISABLED = new QueryDepthGuard(null);

    private final Integer maxDepth;

    private QueryDepthGuard(Integer maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Creates a guard enforcing the given maximum depth.
     *
     * @param maxDepth the maximum allowed depth (at least 1)
     * @return the guard
     * @throws IllegalArgumentException if maxDepth is less than 1
     */
    public static QueryDepthGuard withMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        return new QueryDepthGuard(maxDepth);
    }

    /**
     * Creates a guard from an optional maximum; {@code null} disables it.
     *
     * @param maxDepth the maximum depth, or null for unlimited
     * @return the guard
     */
    public static QueryDepthGuard of(Integer maxDepth) {
        return maxDepth == null ? DISABLED : withMaxDepth(maxDepth);
    }

    public static QueryDepthGuard disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return maxDepth != null;
    }

    public Integer maxDepth() {
        return maxDepth;
    }

    /**
     * Checks a single root selection.
     *
     * @param root the root selection (may be null, which always passes)
     * @throws ValidationException if the depth exceeds the maximum
     */
    public void check(SelectionNode root) {
        check(root == null ? Collections.emptyList() : List.of(root));
    }

    /**
     * Checks every root field of an operation.
     *
     * @param roots the root selections
     * @throws ValidationException if any root exceeds the maximum
     */
    public void check(List<SelectionNode> roots) {
        Objects.requireNonNull(roots, "roots must not be null");
        if (maxDepth == null) {
            return;
        }

        for (SelectionNode root : roots) {
            if (root.isIntrospection()) {
                continue;
            }
            int depth = root.depth();
            if (depth > maxDepth) {
                logger.debug("Rejecting selection '{}' with depth {} (max {})", root.name(), depth, maxDepth);
                throw ValidationException.depthExceeded(depth, maxDepth);
            }
        }
    }
}
