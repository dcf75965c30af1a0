// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package catamorph.util.collection.seq;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;

/**
 * Operations on sequences of numbers.
 * <p>
 * These can't be instance methods of {@link Sequence}, because they only make sense for particular element types.
 * Elements must not be {@code null}.
 */
public final class Sequences {
    private Sequences() {
    }

    /**
     * Returns the sum of the given integers, or 0 if there are none. Overflow wraps around.
     * <p>
     * Complexity: linear time, constant stack.
     */
    public static int sum(final @NotNull Sequence<Integer> sequence) {
        return sequence.foldLeft(0, Integer::sum);
    }

    /**
     * Same as {@link #sum(Sequence)}, but computed with
     * {@link Sequence#foldRight(Object, java.util.function.BiFunction)}.
     * <p>
     * Complexity: linear time, linear stack.
     */
    public static int sumViaFoldRight(final @NotNull Sequence<Integer> sequence) {
        return sequence.foldRight(0, Integer::sum);
    }

    /**
     * Returns the product of the given numbers, or 1.0 if there are none.
     * <p>
     * If any element is zero, the result is zero, even if other elements are infinite or NaN.
     * <p>
     * Complexity: linear time, constant stack.
     */
    public static double product(final @NotNull Sequence<Double> sequence) {
        return sequence.foldLeft(1.0, Sequences::multiply);
    }

    /**
     * Same as {@link #product(Sequence)}, but computed with
     * {@link Sequence#foldRight(Object, java.util.function.BiFunction)}.
     * <p>
     * Complexity: linear time, linear stack.
     */
    public static double productViaFoldRight(final @NotNull Sequence<Double> sequence) {
        return sequence.foldRight(1.0, Sequences::multiply);
    }

    /**
     * Returns a sequence of the sums of the elements at the same positions in the two given sequences. The result is
     * as long as the shorter of the two.
     * <p>
     * Complexity: linear in the length of the shorter sequence.
     */
    @CheckReturnValue
    public static @NotNull Sequence<Integer> addPairwise(
        final @NotNull Sequence<Integer> first,
        final @NotNull Sequence<Integer> second
    ) {
        return first.<Integer, Integer>zipWith(second, Integer::sum);
    }

    private static double multiply(final double left, final double right) {
        // Zero absorbs everything, including the infinities that would otherwise turn it into NaN.
        if (left == 0.0 || right == 0.0) {
            return 0.0;
        }
        return left * right;
    }
}
