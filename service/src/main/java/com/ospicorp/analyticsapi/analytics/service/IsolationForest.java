package com.ospicorp.analyticsapi.analytics.service;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Isolation forest with automatic contamination: a row is anomalous when its score
 * {@code 2^(-E[h(x)] / c(psi))} exceeds 0.5, where {@code h} is the path length needed to
 * isolate the row and {@code psi} the per-tree subsample size. Trees are grown from a fixed
 * seed, so the same input always yields the same classification.
 */
public class IsolationForest implements AnomalyModel {
  public static final long DEFAULT_SEED = 42L;
  static final int DEFAULT_TREES = 100;
  static final int DEFAULT_MAX_SAMPLES = 256;
  static final double THRESHOLD = 0.5;
  private static final double EULER_GAMMA = 0.5772156649015329;

  private final int trees;
  private final int maxSamples;
  private final long seed;

  public IsolationForest() {
    this(DEFAULT_TREES, DEFAULT_MAX_SAMPLES, DEFAULT_SEED);
  }

  public IsolationForest(int trees, int maxSamples, long seed) {
    if (trees < 1 || maxSamples < 2) {
      throw new IllegalArgumentException("trees must be >= 1 and maxSamples >= 2");
    }
    this.trees = trees;
    this.maxSamples = maxSamples;
    this.seed = seed;
  }

  @Override
  public boolean[] classify(double[][] rows) {
    double[] scores = score(rows);
    boolean[] anomalous = new boolean[scores.length];
    for (int i = 0; i < scores.length; i++) {
      anomalous[i] = scores[i] > THRESHOLD;
    }
    return anomalous;
  }

  public double[] score(double[][] rows) {
    if (rows.length < 2) {
      throw new ModelingException("Isolation forest needs at least 2 rows, got " + rows.length);
    }
    RandomGenerator rng = new Well19937c(seed);
    RandomDataGenerator sampler = new RandomDataGenerator(rng);
    int sampleSize = Math.min(maxSamples, rows.length);
    int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));

    List<Node> forest = new ArrayList<>(trees);
    for (int t = 0; t < trees; t++) {
      int[] sample = sampler.nextPermutation(rows.length, sampleSize);
      forest.add(grow(rows, sample, 0, maxDepth, rng));
    }

    double normaliser = averagePathLength(sampleSize);
    double[] scores = new double[rows.length];
    for (int i = 0; i < rows.length; i++) {
      double total = 0d;
      for (Node tree : forest) {
        total += pathLength(tree, rows[i]);
      }
      scores[i] = Math.pow(2d, -(total / forest.size()) / normaliser);
    }
    return scores;
  }

  private static Node grow(double[][] rows, int[] members, int depth, int maxDepth,
      RandomGenerator rng) {
    if (depth >= maxDepth || members.length <= 1) {
      return Node.leaf(members.length);
    }
    int width = rows[members[0]].length;
    List<double[]> candidates = new ArrayList<>(width);
    for (int feature = 0; feature < width; feature++) {
      double min = Double.POSITIVE_INFINITY;
      double max = Double.NEGATIVE_INFINITY;
      for (int m : members) {
        min = Math.min(min, rows[m][feature]);
        max = Math.max(max, rows[m][feature]);
      }
      if (max > min) {
        candidates.add(new double[] {feature, min, max});
      }
    }
    if (candidates.isEmpty()) {
      return Node.leaf(members.length);
    }
    double[] chosen = candidates.get(rng.nextInt(candidates.size()));
    int feature = (int) chosen[0];
    double split = chosen[1] + rng.nextDouble() * (chosen[2] - chosen[1]);

    int leftCount = 0;
    for (int m : members) {
      if (rows[m][feature] <= split) {
        leftCount++;
      }
    }
    int[] left = new int[leftCount];
    int[] right = new int[members.length - leftCount];
    int l = 0;
    int r = 0;
    for (int m : members) {
      if (rows[m][feature] <= split) {
        left[l++] = m;
      } else {
        right[r++] = m;
      }
    }
    return Node.split(feature, split,
        grow(rows, left, depth + 1, maxDepth, rng),
        grow(rows, right, depth + 1, maxDepth, rng));
  }

  private static double pathLength(Node node, double[] row) {
    int depth = 0;
    while (!node.isLeaf()) {
      node = row[node.feature] <= node.split ? node.left : node.right;
      depth++;
    }
    return depth + averagePathLength(node.size);
  }

  /** Expected path length of an unsuccessful search in a binary search tree of n keys. */
  static double averagePathLength(int n) {
    if (n <= 1) {
      return 0d;
    }
    if (n == 2) {
      return 1d;
    }
    return 2d * (Math.log(n - 1d) + EULER_GAMMA) - 2d * (n - 1d) / n;
  }

  private static final class Node {
    final int feature;
    final double split;
    final Node left;
    final Node right;
    final int size;

    private Node(int feature, double split, Node left, Node right, int size) {
      this.feature = feature;
      this.split = split;
      this.left = left;
      this.right = right;
      this.size = size;
    }

    static Node leaf(int size) {
      return new Node(-1, Double.NaN, null, null, size);
    }

    static Node split(int feature, double split, Node left, Node right) {
      return new Node(feature, split, left, right, left.size + right.size);
    }

    boolean isLeaf() {
      return left == null;
    }
  }
}
