// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.html;

import arbor.util.condition.Condition;

/**
 * The base type of conditions signaled when {@link HtmlParser} cannot turn the input into a tree.
 * <p>
 * Parse errors are always signaled as fatal: the parse is abandoned and no partial tree is produced.
 */
public abstract class ParseErrorCondition extends Condition {
    ParseErrorCondition(final String message, final SourceLocation location) {
        super(message);
        this.location = location;
    }

    /**
     * Retrieves the position in the source where the offending construct starts.
     */
    public final SourceLocation location() {
        return location;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + location;
    }

    private final SourceLocation location;
}
