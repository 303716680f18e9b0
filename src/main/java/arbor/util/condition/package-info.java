// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A small condition and restart system in the style of Common Lisp, used for reporting fatal errors such as parse
 * errors.
 */
package arbor.util.condition;
