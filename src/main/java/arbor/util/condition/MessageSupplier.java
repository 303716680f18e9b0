// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.util.condition;

/**
 * A message computed on demand, for traces whose text is only needed when something goes wrong.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
