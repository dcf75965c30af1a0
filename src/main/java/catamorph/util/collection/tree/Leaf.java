// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package catamorph.util.collection.tree;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

final class Leaf<T> extends BinaryTree<T> {
    Leaf(final T value) {
        this.value = value;
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public int depth() {
        return 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return object instanceof Leaf<?> other && Objects.equals(value, other.value);
    }

    @Override
    <B> B foldImpl(
        final Function<? super T, ? extends B> leafCase,
        final BiFunction<? super B, ? super B, ? extends B> branchCase
    ) {
        return leafCase.apply(value);
    }

    @Override
    T maximumImpl(final Comparator<? super T> comparator) {
        return value;
    }

    @Override
    <U> BinaryTree<U> mapImpl(final Function<? super T, ? extends U> function) {
        return new Leaf<>(function.apply(value));
    }

    @Override
    void appendTo(final StringBuilder builder) {
        builder.append("Leaf(").append(value).append(')');
    }

    private final T value;
}
