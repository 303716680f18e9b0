// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.html;

/**
 * A position in an HTML source string, with the character classification primitives the {@link HtmlParser} is built
 * from.
 * <p>
 * Methods that look for a terminator report whether they ran into the end of input instead of signaling anything;
 * turning that into a parse error is up to the caller, who knows what construct was being read.
 */
final class Cursor {
    Cursor(final String source) {
        this.source = source;
    }

    int position() {
        return position;
    }

    boolean reachedEnd() {
        return position >= source.length();
    }

    /**
     * Returns the current character. Calling this at the end of input is an error, which is not checked.
     */
    char peek() {
        assert !reachedEnd();
        return source.charAt(position);
    }

    boolean lookingAt(final char character) {
        return !reachedEnd() && source.charAt(position) == character;
    }

    boolean lookingAt(final String string) {
        return source.startsWith(string, position);
    }

    void advance(final int count) {
        assert position + count <= source.length();
        position += count;
    }

    void skipWhitespace() {
        while (!reachedEnd() && isWhitespace(source.charAt(position))) {
            position += 1;
        }
    }

    boolean atComment() {
        return lookingAt(commentOpener);
    }

    /**
     * Skips the comment starting at the current position, including its closing {@code -->}. If the comment is never
     * closed, the position is left unchanged.
     */
    HitEof skipComment() {
        assert atComment();
        final var closerIndex = source.indexOf(commentCloser, position + commentOpener.length());
        if (closerIndex < 0) {
            return HitEof.YES;
        }
        position = closerIndex + commentCloser.length();
        return HitEof.NO;
    }

    /**
     * Skips everything up to and including the next occurrence of {@code terminator}. If there is none, the position
     * is left unchanged.
     */
    HitEof skipPast(final char terminator) {
        final var index = source.indexOf(terminator, position);
        if (index < 0) {
            return HitEof.YES;
        }
        position = index + 1;
        return HitEof.NO;
    }

    /**
     * Returns the tag name starting {@code offset} characters after the current position, without moving. The name
     * ends at whitespace, {@code >}, {@code /} or the end of input, and may be empty.
     */
    String peekTagName(final int offset) {
        final var start = Math.min(position + offset, source.length());
        var end = start;
        while (end < source.length() && !endsTagName(source.charAt(end))) {
            end += 1;
        }
        return source.substring(start, end);
    }

    /**
     * Reads everything up to, but not including, the next occurrence of {@code terminator}, or up to the end of input.
     */
    String readUntil(final char terminator) {
        final var start = position;
        final var index = source.indexOf(terminator, start);
        position = (index < 0) ? source.length() : index;
        return source.substring(start, position);
    }

    String readAttributeName() {
        final var start = position;
        while (!reachedEnd() && !endsAttributeName(source.charAt(position))) {
            position += 1;
        }
        return source.substring(start, position);
    }

    String readUnquotedAttributeValue() {
        final var start = position;
        while (!reachedEnd()) {
            final var ch = source.charAt(position);
            if (ch == '>' || isWhitespace(ch)) {
                break;
            }
            position += 1;
        }
        return source.substring(start, position);
    }

    /**
     * Computes the line and column of the given offset. Linear in the offset, so only meant for error reporting and
     * traces.
     */
    SourceLocation locationOf(final int offset) {
        var line = 1;
        var lineStart = 0;
        final var end = Math.min(offset, source.length());
        for (int i = 0; i < end; i += 1) {
            if (source.charAt(i) == '\n') {
                line += 1;
                lineStart = i + 1;
            }
        }
        return new SourceLocation(offset, line, offset - lineStart + 1);
    }

    private static boolean isWhitespace(final char ch) {
        return switch (ch) {
            case ' ', '\t', '\n', '\f', '\r' -> true;
            default -> false;
        };
    }

    private static boolean endsTagName(final char ch) {
        return ch == '>' || ch == '/' || isWhitespace(ch);
    }

    private static boolean endsAttributeName(final char ch) {
        return ch == '=' || endsTagName(ch);
    }

    private static final String commentOpener = "<!--";
    private static final String commentCloser = "-->";

    private final String source;
    private int position = 0;
}
