package org.hexroute.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Objects;

/**
 * Min-priority frontier for hex-grid A*.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Decrease-Key Support:</strong> nodes track their own heap slot, so re-inserting a
 * queued node after its cost improved is an O(log n) in-place update instead of a duplicate entry.</li>
 * <li><strong>Reusable Storage:</strong> the backing array grows on demand and survives {@link #clear()},
 * so one instance serves many searches without re-allocation.</li>
 * </ul>
 * </p>
 * <p>Ordering is by ascending f-cost only. Equal-f nodes come out in heap order.</p>
 *
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 */
public final class OpenSet {
    private static final int DEFAULT_CAPACITY = 64;

    // The Binary Heap (1-based indexing for easier parent/child math)
    private SearchNode[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // Diagnostics
    @Getter
    private int peakSize = 0;

    public OpenSet() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param initialCapacity expected frontier size; the heap grows past it when needed.
     * @throws IllegalArgumentException if capacity is not positive.
     */
    public OpenSet(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        this.heap = new SearchNode[initialCapacity + 1];
    }

    /**
     * Inserts a node or restores heap order after its cost changed.
     * <p>
     * <strong>Behavior:</strong>
     * <ul>
     * <li>If {@code node} is not queued: appends it and sifts up.</li>
     * <li>If {@code node} IS queued: re-sifts it in place (Decrease-Key).</li>
     * </ul>
     * </p>
     */
    public void insertOrUpdate(SearchNode node) {
        Objects.requireNonNull(node, "node");

        int existingIdx = node.heapIndex;
        if (existingIdx > 0) {
            if (existingIdx > size || heap[existingIdx] != node) {
                throw new IllegalStateException("node " + node.coordinates + " is queued in another open set");
            }
            swim(existingIdx);
            sink(node.heapIndex);
            return;
        }

        if (size >= heap.length - 1) {
            heap = Arrays.copyOf(heap, heap.length * 2);
        }
        size++;
        heap[size] = node;
        node.heapIndex = size;
        if (size > peakSize) {
            peakSize = size;
        }
        swim(size);
    }

    /**
     * Extracts the node with the lowest f-cost.
     *
     * @throws EmptyQueueException if the set is empty.
     */
    public SearchNode extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Open set is empty");
        }

        SearchNode min = heap[1];
        int lastIndex = size;

        // Single-element fast path.
        if (lastIndex == 1) {
            heap[1] = null;
            min.heapIndex = 0;
            size = 0;
            return min;
        }

        SearchNode last = heap[lastIndex];
        heap[1] = last;
        heap[lastIndex] = null;
        size = lastIndex - 1;

        last.heapIndex = 1;
        min.heapIndex = 0;

        sink(1);
        return min;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Empties the set for a new search. Capacity is kept.
     */
    public void clear() {
        for (int i = 1; i <= size; i++) {
            heap[i].heapIndex = 0;
            heap[i] = null;
        }
        size = 0;
        peakSize = 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        SearchNode n1 = heap[i];
        SearchNode n2 = heap[j];

        heap[i] = n2;
        heap[j] = n1;

        n1.heapIndex = j;
        n2.heapIndex = i;
    }
}
