// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.dom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The base interface for document tree nodes.
 * <p>
 * Nodes are immutable, and a tree is owned top-down: children don't know their parents. Two trees are
 * {@linkplain Object#equals(Object) equal} iff they have the same shape, tags, attributes and text.
 */
public sealed interface Node {
    /**
     * Retrieves the tag name of this node: the HTML name for elements, {@code "document"} for the root and
     * {@code "#text"} for text.
     */
    String tagName();

    /**
     * The root of a parsed document. It has no attributes, only children.
     */
    record Document(List<Node> children) implements Node {
        public Document {
            children = List.copyOf(children);
        }

        @Override
        public String tagName() {
            return "document";
        }
    }

    /**
     * An element with its attributes and children.
     * <p>
     * Attribute names are unique; the map preserves the order attributes were written in, though that order carries
     * no meaning.
     */
    record Element(Tag tag, Map<String, String> attributes, List<Node> children) implements Node {
        public Element {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            children = List.copyOf(children);
            assert !tag.isVoid() || children.isEmpty() : "Void element with children";
        }

        @Override
        public String tagName() {
            return tag.htmlName();
        }

        /**
         * Retrieves the value of the attribute with the given name, or {@code null} if the element has no such
         * attribute. Attributes written without a value have an empty string value.
         */
        public @Nullable String getAttribute(final String name) {
            return attributes.get(name);
        }
    }

    /**
     * Text content. Never empty, and never starts or ends with whitespace.
     */
    record Text(String text) implements Node {
        @Override
        public String tagName() {
            return "#text";
        }
    }
}
