// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package catamorph.util.collection.seq;

import java.util.Objects;
import java.util.function.BiFunction;

final class Node<T> extends Sequence<T> {
    Node(final T value, final Sequence<T> rest) {
        this.value = value;
        this.rest = Objects.requireNonNull(rest);
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public T head() {
        return value;
    }

    @Override
    public Sequence<T> tail() {
        return rest;
    }

    @Override
    public Sequence<T> updatedHead(final T value) {
        return new Node<>(value, rest);
    }

    @Override
    <B> B foldRightImpl(final B initial, final BiFunction<? super T, ? super B, ? extends B> function) {
        // NB: deliberately not tail-recursive, one native frame per element.
        return function.apply(value, rest.foldRightImpl(initial, function));
    }

    final T value;
    // Shared, never copied: other sequences may hold the same rest.
    final Sequence<T> rest;
}
