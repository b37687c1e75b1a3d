package io.tasktree.core.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/// Weighted shuffle without replacement.
///
/// Repeatedly draws one of the remaining indices with probability proportional
/// to its weight, removes it and appends it to the order. The order is a pure
/// function of the random source's state and the weights, so a seeded source
/// reproduces it.
public final class WeightedShuffle {

    private WeightedShuffle() {}

    /// Returns a permutation of `0 .. weights.length - 1`.
    ///
    /// Zero-weight indices are ordered after all positive ones, uniformly among
    /// themselves.
    ///
    /// @param weights non-negative weights, not null
    /// @param random the random source, not null
    /// @return the visiting order, never null
    /// @throws IllegalArgumentException on a negative or non-finite weight
    public static List<Integer> order(double[] weights, Random random) {
        Objects.requireNonNull(weights, "weights must not be null");
        Objects.requireNonNull(random, "random must not be null");
        List<Integer> remaining = new ArrayList<>(weights.length);
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] < 0 || !Double.isFinite(weights[i])) {
                throw new IllegalArgumentException("Invalid weight at " + i + ": " + weights[i]);
            }
            remaining.add(i);
        }
        List<Integer> order = new ArrayList<>(weights.length);
        while (!remaining.isEmpty()) {
            double total = 0;
            for (int index : remaining) {
                total += weights[index];
            }
            int pick;
            if (total <= 0) {
                pick = random.nextInt(remaining.size());
            } else {
                double target = random.nextDouble() * total;
                pick = remaining.size() - 1;
                double cumulative = 0;
                for (int i = 0; i < remaining.size(); i++) {
                    double weight = weights[remaining.get(i)];
                    cumulative += weight;
                    if (weight > 0 && target < cumulative) {
                        pick = i;
                        break;
                    }
                }
            }
            order.add(remaining.remove(pick));
        }
        return order;
    }

    /// Uniform weights for `count` items.
    ///
    /// @param count number of items
    /// @return an array of ones, never null
    public static double[] uniform(int count) {
        double[] weights = new double[count];
        Arrays.fill(weights, 1.0);
        return weights;
    }
}
