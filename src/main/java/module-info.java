// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * An HTML parser turning markup into an immutable document tree.
 */
module arbor {
    requires static org.checkerframework.checker.qual;
    requires static com.github.spotbugs.annotations;
    requires static org.jetbrains.annotations;
    exports arbor.dom;
    exports arbor.html;
    exports arbor.util;
    exports arbor.util.condition;
    exports arbor.util.condition.exception;
}
