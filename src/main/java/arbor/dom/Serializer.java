// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.dom;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The tree-to-HTML serializer.
 * <p>
 * Void elements get no end tag, every other element gets an explicit one, and attributes with an empty value are
 * written as bare names.
 * <p>
 * The parser keeps character references as written, so text and attribute values are written verbatim: escaping
 * {@code &} again would turn {@code &amp;} into {@code &amp;amp;}. Only the characters that would change the markup
 * structure are escaped: {@code <} in text, and a double quote in an attribute value that contains both kinds of
 * quotes. A value containing double quotes alone is single-quoted instead. Neither case can arise in a parsed tree, so
 * a parsed tree serializes into markup that parses back into an equal tree, as long as no two text nodes are adjacent.
 */
public final class Serializer {
    private Serializer(final Writer writer) {
        this.writer = writer;
    }

    /**
     * Serializes the tree rooted at {@code rootNode} to HTML, writing the output to the given {@link Writer}. A
     * document node contributes only its children.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void serialize(final Writer writer, final Node rootNode) throws IOException {
        final var serializer = new Serializer(writer);
        serializer.serializeNode(rootNode);
    }

    private void serializeNode(final Node node) throws IOException {
        if (node instanceof Node.Text text) {
            serializeString(text.text(), TextEscaper.instance);
        } else if (node instanceof Node.Element element) {
            serializeElement(element);
        } else if (node instanceof Node.Document document) {
            serializeChildren(document.children());
        }
    }

    private void serializeElement(final Node.Element element) throws IOException {
        final var tagName = element.tagName();
        writer.write('<');
        writer.write(tagName);
        serializeAttributes(element.attributes());
        writer.write('>');
        if (element.tag().isVoid()) {
            return;
        }
        serializeChildren(element.children());
        writer.write("</");
        writer.write(tagName);
        writer.write('>');
    }

    private void serializeChildren(final List<Node> children) throws IOException {
        for (final var child : children) {
            serializeNode(child);
        }
    }

    private void serializeAttributes(final Map<String, String> attributes) throws IOException {
        for (final var attribute : attributes.entrySet()) {
            writer.write(' ');
            writer.write(attribute.getKey());
            final var value = attribute.getValue();
            if (!value.isEmpty()) {
                serializeAttributeValue(value);
            }
        }
    }

    private void serializeAttributeValue(final String value) throws IOException {
        final var hasDoubleQuote = value.indexOf('"') >= 0;
        final var quote = (hasDoubleQuote && value.indexOf('\'') < 0) ? '\'' : '"';
        writer.write('=');
        writer.write(quote);
        if (quote == '"' && hasDoubleQuote) {
            serializeString(value, DoubleQuoteEscaper.instance);
        } else {
            writer.write(value);
        }
        writer.write(quote);
    }

    private void serializeString(final String string, final Escaper escaper) throws IOException {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(string, index, escaper)) >= 0) {
            writer.write(string, index, indexToEscape - index);
            writer.write(Objects.requireNonNull(escaper.escape(string.charAt(indexToEscape))));
            index = indexToEscape + 1;
        }
        if (index < string.length()) {
            writer.write(string, index, string.length() - index);
        }
    }

    private static int findCharacterToEscape(final String string, final int startIndex, final Escaper escaper) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escaper.escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private final Writer writer;

    private sealed interface Escaper permits TextEscaper, DoubleQuoteEscaper {
        @Nullable String escape(char character);
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return (character == '<') ? "&lt;" : null;
        }

        private static final TextEscaper instance = new TextEscaper();
    }

    private static final class DoubleQuoteEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return (character == '"') ? "&quot;" : null;
        }

        private static final DoubleQuoteEscaper instance = new DoubleQuoteEscaper();
    }
}
