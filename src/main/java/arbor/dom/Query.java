// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.dom;

import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lookups over document trees.
 */
public final class Query {
    private Query() {
    }

    /**
     * Finds the first element, in document order, among the descendants of {@code root} whose {@code id} attribute
     * equals {@code id}. The root itself is not considered.
     *
     * @return The element found, or {@code null} if no descendant carries that id.
     */
    @CheckReturnValue
    public static Node.@Nullable Element getElementById(final Node root, final String id) {
        return findById(childrenOf(root), id);
    }

    private static Node.@Nullable Element findById(final List<Node> nodes, final String id) {
        for (final var node : nodes) {
            if (node instanceof Node.Element element) {
                if (id.equals(element.getAttribute("id"))) {
                    return element;
                }
                final var found = findById(element.children(), id);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static List<Node> childrenOf(final Node node) {
        if (node instanceof Node.Document document) {
            return document.children();
        } else if (node instanceof Node.Element element) {
            return element.children();
        } else {
            return List.of();
        }
    }
}
