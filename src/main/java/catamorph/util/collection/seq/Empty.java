// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package catamorph.util.collection.seq;

import java.util.function.BiFunction;

final class Empty<T> extends Sequence<T> {
    private Empty() {
    }

    @SuppressWarnings("unchecked")
    static <T> Empty<T> instance() {
        return (Empty<T>) instance;
    }

    @Override
    public boolean isEmpty() {
        return true;
    }

    @Override
    public T head() {
        throw EmptyStructureException.calledOnEmpty("head");
    }

    @Override
    public Sequence<T> tail() {
        return this;
    }

    @Override
    public Sequence<T> updatedHead(final T value) {
        throw EmptyStructureException.calledOnEmpty("updatedHead");
    }

    @Override
    <B> B foldRightImpl(final B initial, final BiFunction<? super T, ? super B, ? extends B> function) {
        return initial;
    }

    private static final Empty<?> instance = new Empty<>();
}
