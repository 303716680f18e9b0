// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.html;

/**
 * A position in the parsed source. Lines and columns count from 1, the offset from 0.
 */
public record SourceLocation(int offset, int line, int column) {
    @Override
    public String toString() {
        return "At line " + line + ", column " + column + " (offset " + offset + ')';
    }
}
