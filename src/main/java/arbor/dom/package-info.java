// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The immutable document tree produced by {@link arbor.html.HtmlParser}, and operations over it.
 */
package arbor.dom;
