// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package catamorph.test;

import java.security.SecureRandom;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;
import java.util.stream.LongStream;
import catamorph.util.collection.seq.Sequence;
import catamorph.util.collection.tree.BinaryTree;

final class RandomUtils {
    private RandomUtils() {
    }

    static LongStream generateSeeds() {
        return LongStream.generate(secureRandom::nextLong).limit(8);
    }

    static RandomGenerator createGenerator(final long seed) {
        return factory.create(seed);
    }

    static Sequence<Integer> randomInts(final RandomGenerator generator, final int maxLength) {
        final var length = generator.nextInt(maxLength + 1);
        var sequence = Sequence.<Integer>empty();
        for (int i = 0; i < length; i += 1) {
            sequence = sequence.prepended(generator.nextInt(-elementBound, elementBound));
        }
        return sequence;
    }

    static BinaryTree<Integer> randomTree(final RandomGenerator generator, final int maxDepth) {
        // Stop early a quarter of the time, so the trees come out lopsided rather than perfect.
        if (maxDepth == 0 || generator.nextInt(4) == 0) {
            return BinaryTree.leaf(generator.nextInt(-elementBound, elementBound));
        }
        final var left = randomTree(generator, maxDepth - 1);
        final var right = randomTree(generator, maxDepth - 1);
        return BinaryTree.branch(left, right);
    }

    private static final int elementBound = 1_000;
    private static final SecureRandom secureRandom = new SecureRandom();
    private static final RandomGeneratorFactory<?> factory = RandomGeneratorFactory.of("L32X64MixRandom");
}
