// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Persistent singly-linked sequences and the folds every other sequence operation is built from.
 */
package catamorph.util.collection.seq;
