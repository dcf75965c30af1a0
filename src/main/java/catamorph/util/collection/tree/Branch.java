// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package catamorph.util.collection.tree;

import java.util.Comparator;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

final class Branch<T> extends BinaryTree<T> {
    Branch(final BinaryTree<T> left, final BinaryTree<T> right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public int size() {
        return left.size() + right.size() + 1;
    }

    @Override
    public int depth() {
        return Integer.max(left.depth(), right.depth()) + 1;
    }

    @Override
    public int hashCode() {
        return 31 * left.hashCode() + right.hashCode();
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        if (this == object) {
            return true;
        }
        return object instanceof Branch<?> other && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    <B> B foldImpl(
        final Function<? super T, ? extends B> leafCase,
        final BiFunction<? super B, ? super B, ? extends B> branchCase
    ) {
        final B leftResult = left.foldImpl(leafCase, branchCase);
        final B rightResult = right.foldImpl(leafCase, branchCase);
        return branchCase.apply(leftResult, rightResult);
    }

    @Override
    T maximumImpl(final Comparator<? super T> comparator) {
        return greaterOf(comparator, left.maximumImpl(comparator), right.maximumImpl(comparator));
    }

    @Override
    <U> BinaryTree<U> mapImpl(final Function<? super T, ? extends U> function) {
        return new Branch<>(left.mapImpl(function), right.mapImpl(function));
    }

    @Override
    void appendTo(final StringBuilder builder) {
        builder.append("Branch(");
        left.appendTo(builder);
        builder.append(", ");
        right.appendTo(builder);
        builder.append(')');
    }

    private final BinaryTree<T> left;
    private final BinaryTree<T> right;
}
