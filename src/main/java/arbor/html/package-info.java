// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The HTML parser, turning markup into {@link arbor.dom.Node} trees, and the conditions it signals on bad input.
 */
package arbor.html;
