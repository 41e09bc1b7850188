package com.sandy.aiot.vision.pipeline.service.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest (Liu, Ting and Zhou). Scores lie in (0, 1]; values near 1 are isolated quickly.
 * Immutable once trained.
 */
final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final List<Node> trees;
    private final double normalizer;

    private IsolationForest(List<Node> trees, int sampleSize) {
        this.trees = trees;
        this.normalizer = averagePathLength(sampleSize);
    }

    static IsolationForest train(List<double[]> data, int treeCount, int sampleSize, Random random) {
        if (data.isEmpty()) throw new IllegalArgumentException("no training data");
        int psi = Math.min(sampleSize, data.size());
        int heightLimit = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));
        List<Node> trees = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            List<double[]> sample = new ArrayList<>(psi);
            for (int i = 0; i < psi; i++) {
                sample.add(data.get(random.nextInt(data.size())));
            }
            trees.add(build(sample, 0, heightLimit, random));
        }
        return new IsolationForest(trees, psi);
    }

    double score(double[] point) {
        double total = 0;
        for (Node tree : trees) {
            total += pathLength(tree, point, 0);
        }
        double mean = total / trees.size();
        if (normalizer <= 0) return 0.5;
        return Math.pow(2, -mean / normalizer);
    }

    private static Node build(List<double[]> sample, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || sample.size() <= 1) {
            return Node.leaf(sample.size());
        }
        int dims = sample.get(0).length;
        int start = random.nextInt(dims);
        for (int d = 0; d < dims; d++) {
            int attr = (start + d) % dims;
            double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
            for (double[] p : sample) {
                min = Math.min(min, p[attr]);
                max = Math.max(max, p[attr]);
            }
            if (max > min) {
                double split = min + random.nextDouble() * (max - min);
                List<double[]> left = new ArrayList<>();
                List<double[]> right = new ArrayList<>();
                for (double[] p : sample) {
                    if (p[attr] < split) left.add(p);
                    else right.add(p);
                }
                return Node.split(attr, split, build(left, depth + 1, heightLimit, random),
                        build(right, depth + 1, heightLimit, random));
            }
        }
        return Node.leaf(sample.size());
    }

    private static double pathLength(Node node, double[] point, int depth) {
        if (node.left == null) {
            return depth + averagePathLength(node.size);
        }
        return pathLength(point[node.attribute] < node.split ? node.left : node.right, point, depth + 1);
    }

    static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        return 2 * (Math.log(n - 1) + EULER_GAMMA) - 2.0 * (n - 1) / n;
    }

    private static final class Node {
        final int attribute;
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(int attribute, double split, Node left, Node right, int size) {
            this.attribute = attribute;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0, null, null, size);
        }

        static Node split(int attribute, double split, Node left, Node right) {
            return new Node(attribute, split, left, right, 0);
        }
    }
}
