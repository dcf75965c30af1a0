// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package catamorph.util.collection.seq;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A persistent (immutable, structurally shared) singly-linked sequence.
 * <p>
 * A sequence is either empty or a node holding one element in front of another, already complete, sequence. Nodes
 * are never modified after construction, so any number of sequences may share a common suffix: prepending to a
 * sequence, or appending something in front of it, reuses it by reference instead of copying it.
 * <p>
 * There are no restrictions on what elements are permitted. {@code null} is allowed, just like any other possible
 * element.
 * <p>
 * Every derived operation is expressed in terms of one of the fold primitives: {@link #foldRight(Object, BiFunction)},
 * {@link #foldLeft(Object, BiFunction)}, or {@link #foldRightViaFoldLeft(Object, BiFunction)}. Only the first of
 * these recurses on the native stack, with depth proportional to the length of the sequence; the others, and every
 * operation built on them, use constant stack regardless of length. The exceptions are {@code drop},
 * {@code dropWhile}, {@code init}, {@code zipWith} and {@code hasSubsequence}, which need a counted or paired descent
 * that no single fold provides, and walk the nodes directly.
 * <p>
 * Immutability is shallow: it doesn't extend to the elements themselves. Prefer element types which are immutable
 * themselves.
 * <p>
 * For exact complexity guarantees of each operation, see the corresponding method. For methods that invoke
 * caller-supplied code, the stated complexity assumes that code doesn't depend on the size of the sequence.
 * Exceptions thrown by caller-supplied functions and predicates are passed through to the caller.
 */
public abstract sealed class Sequence<T> implements Iterable<T> permits Empty, Node {
    Sequence() {
    }

    /**
     * Returns the empty sequence, pretending to contain objects of the given type.
     * <p>
     * Complexity: constant time.
     */
    public static <T> @NotNull Sequence<T> empty() {
        return Empty.instance();
    }

    /**
     * Returns a new sequence containing the given elements, in order.
     * <p>
     * The sequence is built from the last element to the first, so no intermediate reversal is needed.
     * <p>
     * Complexity: linear time.
     */
    @SafeVarargs
    public static <T> @NotNull Sequence<T> of(final T... elements) {
        Sequence<T> result = empty();
        for (int i = elements.length - 1; i >= 0; i -= 1) {
            result = result.prepended(elements[i]);
        }
        return result;
    }

    /**
     * Returns a new sequence containing the elements of the given iterable in iteration order.
     * <p>
     * Complexity: constant time if the iterable is already a {@code Sequence}, linear time otherwise.
     */
    public static <T> @NotNull Sequence<T> fromIterable(final @NotNull Iterable<? extends T> iterable) {
        if (iterable instanceof Sequence<? extends T> sequence) {
            return widen(sequence);
        }
        Sequence<T> reversed = empty();
        for (final var element : iterable) {
            reversed = reversed.prepended(element);
        }
        return reversed.reverse();
    }

    /**
     * Returns the concatenation of all the given sequences, in order. If the outer sequence is empty, so is the
     * result.
     * <p>
     * Complexity: linear in the total number of elements.
     */
    public static <T> @NotNull Sequence<T> concat(
        final @NotNull Sequence<? extends Sequence<? extends T>> sequences
    ) {
        return sequences.foldRightViaFoldLeft(
            Sequence.<T>empty(),
            (sequence, accumulator) -> Sequence.<T>widen(sequence).append(accumulator)
        );
    }

    /**
     * Returns the hash code of this sequence. The algorithm used to compute the hash code is the same as that of
     * {@link java.util.List#hashCode()}.
     * <p>
     * Complexity: linear time.
     */
    @Override
    public final int hashCode() {
        int hash = 1;
        for (Sequence<T> current = this; current instanceof Node<T> node; current = node.rest) {
            hash = 31 * hash + Objects.hashCode(node.value);
        }
        return hash;
    }

    /**
     * Returns {@code true} iff the given object is a sequence containing equal elements in the same order.
     * <p>
     * Element equality is determined according to {@link Objects#equals(Object, Object)}.
     * <p>
     * Complexity: linear time, constant if both are the same object.
     */
    @Override
    public final boolean equals(final @Nullable Object object) {
        return object instanceof Sequence<?> other && equalsImpl(other);
    }

    /**
     * Returns a string representation of this sequence.
     * <p>
     * The string representation of a sequence consists of the concatenation of the string representations of its
     * elements, separated by the string {@code ", "}, enclosed in square brackets.
     * <p>
     * Complexity: linear time.
     */
    @Override
    public final @NotNull String toString() {
        if (isEmpty()) {
            return "[]";
        }

        final var builder = new StringBuilder();
        builder.append('[');
        for (Sequence<T> current = this; current instanceof Node<T> node; current = node.rest) {
            builder.append(node.value).append(", ");
        }
        builder.setLength(builder.length() - 2); // Remove final separator.
        builder.append(']');
        return builder.toString();
    }

    /**
     * Returns a new iterator over the elements of this sequence, from the first element to the last.
     * <p>
     * Complexity: constant time.
     */
    @Override
    public final @NotNull Iterator<T> iterator() {
        return new Itr<>(this);
    }

    /**
     * Returns {@code true} iff this sequence contains no elements.
     * <p>
     * Complexity: constant time.
     */
    public abstract boolean isEmpty();

    /**
     * Returns the first element of this sequence.
     * <p>
     * Complexity: constant time.
     *
     * @throws EmptyStructureException if this sequence is empty
     */
    public abstract T head();

    /**
     * Returns this sequence without its first element. The result is shared with this sequence, not copied.
     * <p>
     * The tail of the empty sequence is the empty sequence.
     * <p>
     * Complexity: constant time.
     */
    public abstract @NotNull Sequence<T> tail();

    /**
     * Returns a copy of this sequence with the first element replaced with the given object. Everything after the
     * first element is shared with this sequence.
     * <p>
     * Complexity: constant time.
     *
     * @throws EmptyStructureException if this sequence is empty
     */
    @CheckReturnValue
    public abstract @NotNull Sequence<T> updatedHead(T value);

    /**
     * Returns a sequence with the given element prepended to this one. This sequence becomes the shared rest of
     * the result.
     * <p>
     * Complexity: constant time.
     */
    @CheckReturnValue
    public final @NotNull Sequence<T> prepended(final T value) {
        return new Node<>(value, this);
    }

    /**
     * Combines the elements of this sequence from the last to the first, starting with the given initial value as the
     * rightmost operand: {@code f(x1, f(x2, ... f(xn, initial)))}.
     * <p>
     * This is the direct recursive definition: it recurses once per element on the native stack, and may throw
     * {@link StackOverflowError} for sufficiently long sequences. Prefer
     * {@link #foldRightViaFoldLeft(Object, BiFunction)}, which produces the same result in constant stack.
     * <p>
     * Complexity: linear time, linear stack.
     */
    public final <B> B foldRight(
        final B initial,
        final @NotNull BiFunction<? super T, ? super B, ? extends B> function
    ) {
        Objects.requireNonNull(function); // Check once here, let implementations assume it's non-null.
        return foldRightImpl(initial, function);
    }

    /**
     * Combines the elements of this sequence from the first to the last, starting with the given initial value as the
     * leftmost operand: {@code f(... f(f(initial, x1), x2) ..., xn)}.
     * <p>
     * Complexity: linear time, constant stack.
     */
    public final <B> B foldLeft(
        final B initial,
        final @NotNull BiFunction<? super B, ? super T, ? extends B> function
    ) {
        Objects.requireNonNull(function);
        B accumulator = initial;
        for (Sequence<T> current = this; current instanceof Node<T> node; current = node.rest) {
            accumulator = function.apply(accumulator, node.value);
        }
        return accumulator;
    }

    /**
     * Returns the same result as {@link #foldRight(Object, BiFunction)}, but computed with
     * {@link #foldLeft(Object, BiFunction)} over the reversed sequence, so that it never recurses.
     * <p>
     * The function is applied to the elements from the last to the first, the same order as {@code foldRight}.
     * <p>
     * Complexity: linear time, constant stack.
     */
    public final <B> B foldRightViaFoldLeft(
        final B initial,
        final @NotNull BiFunction<? super T, ? super B, ? extends B> function
    ) {
        Objects.requireNonNull(function);
        return reverse().foldLeft(initial, (accumulator, value) -> function.apply(value, accumulator));
    }

    /**
     * Returns the number of elements in this sequence.
     * <p>
     * Complexity: linear time.
     */
    public final int length() {
        return foldLeft(0, (count, value) -> count + 1);
    }

    /**
     * Returns the number of elements in this sequence, counted with {@link #foldRight(Object, BiFunction)}.
     * <p>
     * Always equal to {@link #length()}, but not stack-safe.
     * <p>
     * Complexity: linear time, linear stack.
     */
    public final int lengthViaFoldRight() {
        return foldRight(0, (value, count) -> count + 1);
    }

    /**
     * Returns a sequence containing the elements of this sequence in the opposite order.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public final @NotNull Sequence<T> reverse() {
        return foldLeft(Sequence.<T>empty(), Sequence::prepended);
    }

    /**
     * Returns a sequence containing the elements of this sequence followed by the elements of the given sequence.
     * <p>
     * The given sequence is shared by the result, not copied; in particular, if this sequence is empty, the given
     * sequence itself is returned.
     * <p>
     * Complexity: linear in the length of this sequence.
     */
    @CheckReturnValue
    public final @NotNull Sequence<T> append(final @NotNull Sequence<? extends T> other) {
        return foldRightViaFoldLeft(Sequence.<T>widen(other), (value, accumulator) -> accumulator.prepended(value));
    }

    /**
     * Returns a sequence containing the results of applying the given function to the elements of this sequence,
     * in order.
     * <p>
     * The function is applied to the elements from the last to the first.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public final <U> @NotNull Sequence<U> map(final @NotNull Function<? super T, ? extends U> function) {
        Objects.requireNonNull(function);
        return foldRightViaFoldLeft(
            Sequence.<U>empty(),
            (value, accumulator) -> accumulator.prepended(function.apply(value))
        );
    }

    /**
     * Returns a sequence containing only the elements of this sequence that satisfy the given predicate, in their
     * original relative order.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public final @NotNull Sequence<T> filter(final @NotNull Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        return foldRightViaFoldLeft(
            Sequence.<T>empty(),
            (value, accumulator) -> predicate.test(value) ? accumulator.prepended(value) : accumulator
        );
    }

    /**
     * Returns the concatenation of the sequences obtained by applying the given function to each element of this
     * sequence, in order. Each element may thus expand to any number of elements, including none.
     * <p>
     * Complexity: linear in the total number of elements produced.
     */
    @CheckReturnValue
    public final <U> @NotNull Sequence<U> flatMap(
        final @NotNull Function<? super T, ? extends Sequence<? extends U>> function
    ) {
        return Sequence.<U>concat(this.<Sequence<? extends U>>map(function));
    }

    /**
     * Returns the same result as {@link #filter(Predicate)}, expressed with {@link #flatMap(Function)}: every
     * element expands to either itself or nothing.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public final @NotNull Sequence<T> filterViaFlatMap(final @NotNull Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        final Sequence<T> none = empty();
        return this.<T>flatMap(value -> predicate.test(value) ? none.prepended(value) : none);
    }

    /**
     * Returns this sequence without its first {@code count} elements.
     * <p>
     * If {@code count} is not positive, this sequence is returned unchanged. Dropping more elements than the sequence
     * contains results in the empty sequence. The result is always a shared suffix of this sequence.
     * <p>
     * Complexity: O(count) time.
     */
    public final @NotNull Sequence<T> drop(final int count) {
        Sequence<T> current = this;
        for (int i = 0; i < count && current instanceof Node<T> node; i += 1) {
            current = node.rest;
        }
        return current;
    }

    /**
     * Returns the longest suffix of this sequence whose first element doesn't satisfy the given predicate.
     * <p>
     * Complexity: linear in the number of elements dropped.
     */
    public final @NotNull Sequence<T> dropWhile(final @NotNull Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        Sequence<T> current = this;
        while (current instanceof Node<T> node && predicate.test(node.value)) {
            current = node.rest;
        }
        return current;
    }

    /**
     * Returns a sequence containing all the elements of this sequence except the last one.
     * <p>
     * Nothing can be shared with this sequence, since the last node changes; the result is a fresh copy.
     * <p>
     * Complexity: linear time.
     *
     * @throws EmptyStructureException if this sequence is empty
     */
    @CheckReturnValue
    public final @NotNull Sequence<T> init() {
        if (!(this instanceof Node<T> first)) {
            throw EmptyStructureException.calledOnEmpty("init");
        }
        Sequence<T> reversed = empty();
        for (var node = first; node.rest instanceof Node<T> next; node = next) {
            reversed = reversed.prepended(node.value);
        }
        return reversed.reverse();
    }

    /**
     * Returns a sequence containing the results of applying the given function to the elements of this sequence and
     * the given sequence at the same positions.
     * <p>
     * The result is as long as the shorter of the two sequences; the excess elements of the longer one are ignored.
     * <p>
     * Complexity: linear in the length of the shorter sequence.
     */
    @CheckReturnValue
    public final <U, R> @NotNull Sequence<R> zipWith(
        final @NotNull Sequence<? extends U> other,
        final @NotNull BiFunction<? super T, ? super U, ? extends R> function
    ) {
        Objects.requireNonNull(function);
        Sequence<R> reversed = empty();
        Sequence<T> left = this;
        Sequence<U> right = widen(other);
        while (left instanceof Node<T> leftNode && right instanceof Node<U> rightNode) {
            reversed = reversed.prepended(function.apply(leftNode.value, rightNode.value));
            left = leftNode.rest;
            right = rightNode.rest;
        }
        return reversed.reverse();
    }

    /**
     * Returns {@code true} iff the elements of the given sequence appear in this sequence contiguously and in the same
     * order, starting at some position. The empty sequence is contained in every sequence.
     * <p>
     * Element equality is determined according to {@link Objects#equals(Object, Object)}.
     * <p>
     * Complexity: O(mn), where {@code m} and {@code n} are the lengths of the two sequences.
     */
    public final boolean hasSubsequence(final @NotNull Sequence<?> candidate) {
        Sequence<T> start = this;
        while (true) {
            if (startsWith(start, candidate)) {
                return true;
            }
            if (!(start instanceof Node<T> node)) {
                return false;
            }
            // Restart the match one element further, not where the partial match failed.
            start = node.rest;
        }
    }

    abstract <B> B foldRightImpl(B initial, @NotNull BiFunction<? super T, ? super B, ? extends B> function);

    @SuppressWarnings("unchecked")
    static <T> @NotNull Sequence<T> widen(final @NotNull Sequence<? extends T> sequence) {
        // Since Sequence is immutable, casting <? extends T> to <T> is fine.
        return (Sequence<T>) sequence;
    }

    private boolean equalsImpl(final @NotNull Sequence<?> other) {
        Sequence<?> ours = this;
        Sequence<?> theirs = other;
        while (ours != theirs) {
            if (!(ours instanceof Node<?> ourNode) || !(theirs instanceof Node<?> theirNode)) {
                // Distinct sequences that aren't both nodes: one of them ended before the other.
                return false;
            }
            if (!Objects.equals(ourNode.value, theirNode.value)) {
                return false;
            }
            ours = ourNode.rest;
            theirs = theirNode.rest;
        }
        return true;
    }

    private static boolean startsWith(final @NotNull Sequence<?> sequence, final @NotNull Sequence<?> prefix) {
        Sequence<?> remaining = sequence;
        Sequence<?> expected = prefix;
        while (expected instanceof Node<?> expectedNode) {
            if (!(remaining instanceof Node<?> actualNode) || !Objects.equals(actualNode.value, expectedNode.value)) {
                return false;
            }
            remaining = actualNode.rest;
            expected = expectedNode.rest;
        }
        return true;
    }

    private static final class Itr<T> implements Iterator<T> {
        private Itr(final @NotNull Sequence<T> first) {
            current = first;
        }

        @Override
        public boolean hasNext() {
            return current instanceof Node<T>;
        }

        @Override
        @SuppressFBWarnings(value = "IT_NO_SUCH_ELEMENT", justification = "It can, SpotBugs is just confused")
        public T next() {
            if (!(current instanceof Node<T> node)) {
                throw new NoSuchElementException("No more elements");
            }
            current = node.rest;
            return node.value;
        }

        private Sequence<T> current;
    }
}
