// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package catamorph.util.collection.seq;

import java.util.NoSuchElementException;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when an operation that needs at least one element, such as {@link Sequence#head()} or
 * {@link Sequence#init()}, is called on an empty sequence.
 * <p>
 * Since this is the persistent counterpart of asking an empty collection for an element, this class extends
 * {@link NoSuchElementException}.
 */
public final class EmptyStructureException extends NoSuchElementException {
    public EmptyStructureException(final @NotNull String message) {
        super(message);
    }

    static @NotNull EmptyStructureException calledOnEmpty(final @NotNull String operation) {
        return new EmptyStructureException(operation + " called on an empty sequence");
    }

    private static final long serialVersionUID = 1L;
}
