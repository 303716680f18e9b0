// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.html;

enum HitEof {
    NO(false),
    YES(true);

    HitEof(final boolean booleanValue) {
        this.booleanValue = booleanValue;
    }

    boolean hitEof() {
        return booleanValue;
    }

    private final boolean booleanValue;
}
