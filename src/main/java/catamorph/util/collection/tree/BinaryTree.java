// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package catamorph.util.collection.tree;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;

/**
 * An immutable strict binary tree: every tree is either a leaf holding exactly one value, or a branch holding two
 * subtrees and no value of its own. There is no empty tree.
 * <p>
 * {@link #fold(Function, BiFunction)} is the generic way of consuming a tree. Each of {@code size}, {@code depth},
 * {@code maximum} and {@code map} exists twice: as direct structural recursion, and as an instance of {@code fold}
 * (the {@code ViaFold} variants). Both always produce equal results.
 * <p>
 * All operations recurse on the native stack, once per level of the tree.
 * <p>
 * Equality is structural: two trees are equal iff they have the same shape and equal values in the same leaves.
 * {@code null} values are permitted.
 */
public abstract sealed class BinaryTree<T> permits Leaf, Branch {
    BinaryTree() {
    }

    /**
     * Returns a new tree consisting of a single leaf holding the given value.
     */
    public static <T> @NotNull BinaryTree<T> leaf(final T value) {
        return new Leaf<>(value);
    }

    /**
     * Returns a new branch with the given subtrees. The subtrees are shared, not copied.
     */
    public static <T> @NotNull BinaryTree<T> branch(
        final @NotNull BinaryTree<T> left,
        final @NotNull BinaryTree<T> right
    ) {
        return new Branch<>(Objects.requireNonNull(left), Objects.requireNonNull(right));
    }

    /**
     * Returns the greatest value in the given tree according to the natural ordering of its values.
     *
     * @see #maximum(Comparator)
     */
    public static <T extends Comparable<? super T>> T maximum(final @NotNull BinaryTree<T> tree) {
        return tree.maximum(Comparator.<T>naturalOrder());
    }

    /**
     * Same as {@link #maximum(BinaryTree)}, computed with {@link #fold(Function, BiFunction)}.
     */
    public static <T extends Comparable<? super T>> T maximumViaFold(final @NotNull BinaryTree<T> tree) {
        return tree.maximumViaFold(Comparator.<T>naturalOrder());
    }

    /**
     * Replaces every leaf with the result of {@code leafCase} applied to its value, and every branch with the result
     * of {@code branchCase} applied to the already folded subtrees. Both subtrees are always folded, left first,
     * before their results are combined.
     */
    public final <B> B fold(
        final @NotNull Function<? super T, ? extends B> leafCase,
        final @NotNull BiFunction<? super B, ? super B, ? extends B> branchCase
    ) {
        // Check once here, let implementations assume they're non-null.
        Objects.requireNonNull(leafCase);
        Objects.requireNonNull(branchCase);
        return foldImpl(leafCase, branchCase);
    }

    /**
     * Returns the number of nodes in this tree, counting both leaves and branches.
     */
    public abstract int size();

    /**
     * Returns the length of the longest path from the root of this tree to a leaf. A single leaf has depth 0.
     */
    public abstract int depth();

    /**
     * Returns the greatest value in this tree according to the given comparator. If several values are equally
     * great, the leftmost one is returned.
     */
    public final T maximum(final @NotNull Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator);
        return maximumImpl(comparator);
    }

    /**
     * Returns a tree of the same shape as this one, with every value replaced by the result of applying the given
     * function to it.
     */
    @CheckReturnValue
    public final <U> @NotNull BinaryTree<U> map(final @NotNull Function<? super T, ? extends U> function) {
        Objects.requireNonNull(function);
        return mapImpl(function);
    }

    public final int sizeViaFold() {
        return this.<Integer>fold(value -> 1, (left, right) -> left + right + 1);
    }

    public final int depthViaFold() {
        return this.<Integer>fold(value -> 0, (left, right) -> Integer.max(left, right) + 1);
    }

    public final T maximumViaFold(final @NotNull Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator);
        return this.<T>fold(value -> value, (left, right) -> greaterOf(comparator, left, right));
    }

    @CheckReturnValue
    public final <U> @NotNull BinaryTree<U> mapViaFold(final @NotNull Function<? super T, ? extends U> function) {
        Objects.requireNonNull(function);
        return this.<BinaryTree<U>>fold(value -> leaf(function.apply(value)), BinaryTree::branch);
    }

    @Override
    public final @NotNull String toString() {
        final var builder = new StringBuilder();
        appendTo(builder);
        return builder.toString();
    }

    abstract <B> B foldImpl(
        @NotNull Function<? super T, ? extends B> leafCase,
        @NotNull BiFunction<? super B, ? super B, ? extends B> branchCase
    );

    abstract T maximumImpl(@NotNull Comparator<? super T> comparator);

    abstract <U> @NotNull BinaryTree<U> mapImpl(@NotNull Function<? super T, ? extends U> function);

    abstract void appendTo(@NotNull StringBuilder builder);

    static <T> T greaterOf(final @NotNull Comparator<? super T> comparator, final T left, final T right) {
        return (comparator.compare(left, right) >= 0) ? left : right;
    }
}
