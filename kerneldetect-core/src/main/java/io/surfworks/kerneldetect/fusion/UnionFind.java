package io.surfworks.kerneldetect.fusion;

/**
 * Disjoint-set forest over {@code 0 .. size-1} with path compression.
 *
 * <p>{@link #union(int, int)} always makes the first argument's root the root
 * of the merged set, so a block is identified by the position of the node that
 * started it.
 */
final class UnionFind {

    private final int[] parent;

    UnionFind(int size) {
        parent = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    int find(int x) {
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }

    void union(int keep, int absorb) {
        int keepRoot = find(keep);
        int absorbRoot = find(absorb);
        if (keepRoot != absorbRoot) {
            parent[absorbRoot] = keepRoot;
        }
    }

    boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    int size() {
        return parent.length;
    }
}
