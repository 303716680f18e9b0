// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.html;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import arbor.dom.Node;
import arbor.dom.Tag;
import arbor.util.Trace;
import arbor.util.condition.ConditionContext;
import arbor.util.condition.UnhandledErrorError;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * The HTML parser: the means of turning a string of markup into a {@link Node.Document}.
 * <p>
 * The parser handles the subset of HTML that hand-written documents use: elements from the {@link Tag} vocabulary,
 * attributes, text, comments and a leading DOCTYPE. Character references are not decoded, and the contents of
 * {@code <script>} and {@code <style>} are parsed like any other markup.
 * <p>
 * End tags are optional everywhere. An element ends at its own end tag, at the end tag of any enclosing element, at
 * the end of input, or, for elements such as {@code <p>}, {@code <li>} and {@code <td>}, at the start tag of an element
 * that cannot be its child. Void elements such as {@code <br>} end right after their start tag.
 * <p>
 * Only an end tag of an open element stops the content of the current element. An end tag that matches no open
 * element, such as a stray {@code </span>} or any end tag at the top level, is skipped and parsing goes on after it,
 * so content following it still ends up in the tree.
 * <p>
 * Parse errors are signaled as fatal conditions of type {@link ParseErrorCondition}: {@link InvalidTagCondition} for
 * names outside the vocabulary, {@link MalformedInputCondition} for input ending inside a comment, tag or attribute
 * value, and for excessive nesting.
 */
public final class HtmlParser {
    private HtmlParser(final String html) {
        cursor = new Cursor(html);
    }

    /**
     * Parses the given string into a document tree.
     * <p>
     * Empty input, or input with only whitespace, comments and a DOCTYPE, produces a document with no children. The
     * parser keeps no state between calls, so it's safe to call from multiple threads at once.
     */
    @CheckReturnValue
    public static Node.Document parse(final String html) {
        final var parser = new HtmlParser(html);
        return parser.parseDocument();
    }

    private Node.Document parseDocument() {
        try (final var trace = new Trace("Parsing HTML document")) {
            trace.use();
            skipInterElementSpace();
            skipDoctype();
            final var children = new ArrayList<Node>();
            parseContent(children);
            return new Node.Document(children);
        }
    }

    private void skipDoctype() {
        if (!cursor.lookingAt('<') || !doctypeName.equals(cursor.peekTagName(1))) {
            return;
        }
        final var start = cursor.position();
        if (cursor.skipPast('>').hitEof()) {
            throw signalMalformedInput("Expected '>' closing the DOCTYPE but found end of input instead", start);
        }
    }

    /**
     * Parses the content of the innermost open element, or of the document if there is none, appending the nodes
     * found to {@code children}. Stops at the end of input, at an end tag of an open element, or at a start tag that
     * implicitly closes the innermost open element; the tag stopped at is not consumed.
     */
    private void parseContent(final List<Node> children) {
        while (true) {
            skipInterElementSpace();
            if (cursor.reachedEnd()) {
                return;
            }
            if (parseText(children)) {
                continue;
            }

            switch (classifyMarkup()) {
                case START_TAG -> {
                    final var tag = classifyStartTag();
                    final var openElement = openElements.peek();
                    if (openElement != null && EndTagOmission.closes(openElement, tag)) {
                        return;
                    }
                    children.add(parseElement(tag));
                }
                case END_TAG -> {
                    final var tag = classifyEndTag();
                    if (openElements.contains(tag)) {
                        return;
                    }
                    skipEndTag();
                }
                case DECLARATION -> skipDeclaration();
            }
        }
    }

    private boolean parseText(final List<Node> children) {
        if (cursor.peek() == '<') {
            return false;
        }
        final var text = cursor.readUntil('<').strip();
        if (!text.isEmpty()) {
            children.add(new Node.Text(text));
        }
        return true;
    }

    private Node.Element parseElement(final Tag tag) {
        final var start = cursor.position();
        if (openElements.size() >= maxDepth) {
            throw signalMalformedInput(
                "Nesting limit of " + maxDepth + " elements reached, try to limit nesting",
                start
            );
        }
        try (final var trace = new Trace(() -> "Parsing element <" + tag + "> " + describeLocation(start))) {
            trace.use();
            cursor.advance(1 + tag.htmlName().length());
            final var attributes = parseAttributes(tag, start);
            if (tag.isVoid()) {
                return new Node.Element(tag, attributes, List.of());
            }

            final var children = new ArrayList<Node>();
            openElements.push(tag);
            try {
                parseContent(children);
            } finally {
                openElements.pop();
            }
            if (atEndTagOf(tag)) {
                skipEndTag();
            }
            return new Node.Element(tag, attributes, children);
        }
    }

    private Map<String, String> parseAttributes(final Tag tag, final int tagStart) {
        final var attributes = new LinkedHashMap<String, String>();
        while (true) {
            cursor.skipWhitespace();
            if (cursor.reachedEnd()) {
                throw signalMalformedInput(
                    "Expected '>' closing the start tag <" + tag + "> but found end of input instead",
                    tagStart
                );
            }
            switch (cursor.peek()) {
                case '>' -> {
                    cursor.advance(1);
                    return attributes;
                }
                // Self-closing syntax has no meaning in HTML, the slash is simply ignored.
                case '/' -> cursor.advance(1);
                default -> parseAttribute(attributes);
            }
        }
    }

    private void parseAttribute(final Map<String, String> attributes) {
        final var nameStart = cursor.position();
        final var name = cursor.readAttributeName();
        if (name.isEmpty()) {
            throw signalMalformedInput(
                "Expected an attribute name but found '" + cursor.peek() + "' instead",
                nameStart
            );
        }
        cursor.skipWhitespace();
        var value = "";
        if (cursor.lookingAt('=')) {
            cursor.advance(1);
            cursor.skipWhitespace();
            value = parseAttributeValue(name);
        }
        attributes.put(name, value);
    }

    private String parseAttributeValue(final String name) {
        final var valueStart = cursor.position();
        if (cursor.reachedEnd()) {
            throw signalMalformedInput(
                "Expected a value of attribute '" + name + "' but found end of input instead",
                valueStart
            );
        }
        final var quote = cursor.peek();
        if (quote != '"' && quote != '\'') {
            return cursor.readUnquotedAttributeValue();
        }
        cursor.advance(1);
        final var value = cursor.readUntil(quote);
        if (cursor.reachedEnd()) {
            throw signalMalformedInput(
                "Expected closing " + quote + " of attribute '" + name + "' but found end of input instead",
                valueStart
            );
        }
        cursor.advance(1);
        return value;
    }

    private MarkupKind classifyMarkup() {
        if (cursor.lookingAt("</")) {
            return MarkupKind.END_TAG;
        } else if (cursor.lookingAt("<!") || cursor.lookingAt("<?")) {
            return MarkupKind.DECLARATION;
        } else {
            return MarkupKind.START_TAG;
        }
    }

    private Tag classifyStartTag() {
        return resolveTag(cursor.peekTagName(1));
    }

    private Tag classifyEndTag() {
        return resolveTag(cursor.peekTagName(2));
    }

    private Tag resolveTag(final String name) {
        final var tag = Tag.byHtmlName(name);
        if (tag == null) {
            throw ConditionContext.error(new InvalidTagCondition(name, cursor.locationOf(cursor.position())));
        }
        return tag;
    }

    private boolean atEndTagOf(final Tag tag) {
        return cursor.lookingAt("</") && tag.htmlName().equals(cursor.peekTagName(2));
    }

    private void skipEndTag() {
        final var start = cursor.position();
        if (cursor.skipPast('>').hitEof()) {
            throw signalMalformedInput("Expected '>' closing the end tag but found end of input instead", start);
        }
    }

    private void skipDeclaration() {
        final var start = cursor.position();
        if (cursor.skipPast('>').hitEof()) {
            throw signalMalformedInput("Expected '>' closing the declaration but found end of input instead", start);
        }
    }

    private void skipInterElementSpace() {
        while (true) {
            cursor.skipWhitespace();
            if (!cursor.atComment()) {
                return;
            }
            final var start = cursor.position();
            if (cursor.skipComment().hitEof()) {
                throw signalMalformedInput("Expected '-->' closing the comment but found end of input instead", start);
            }
        }
    }

    private String describeLocation(final int offset) {
        final var location = cursor.locationOf(offset);
        return "at line " + location.line() + ", column " + location.column();
    }

    private UnhandledErrorError signalMalformedInput(final String message, final int offset) {
        throw ConditionContext.error(new MalformedInputCondition(message, cursor.locationOf(offset)));
    }

    private static final String doctypeName = "!DOCTYPE";
    private static final int maxDepth = 512;

    private final Cursor cursor;
    private final ArrayDeque<Tag> openElements = new ArrayDeque<>();

    private enum MarkupKind {
        START_TAG,
        END_TAG,
        DECLARATION
    }
}
