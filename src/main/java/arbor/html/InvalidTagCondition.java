// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.html;

/**
 * A condition type indicating that a start or end tag names an element outside of the known vocabulary.
 */
public final class InvalidTagCondition extends ParseErrorCondition {
    InvalidTagCondition(final String tagName, final SourceLocation location) {
        super("Invalid HTML tag: '" + tagName + '\'', location);
        this.tagName = tagName;
    }

    /**
     * Retrieves the offending tag name, as written. May be empty.
     */
    public String tagName() {
        return tagName;
    }

    private final String tagName;
}
