// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.html;

/**
 * A condition type indicating that the markup is structurally broken: the input ended before a construct was closed,
 * an attribute has no name, or elements are nested too deeply.
 */
public final class MalformedInputCondition extends ParseErrorCondition {
    MalformedInputCondition(final String message, final SourceLocation location) {
        super(message, location);
    }
}
