// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Immutable strict binary trees, consumed through a single generic fold.
 */
package catamorph.util.collection.tree;
