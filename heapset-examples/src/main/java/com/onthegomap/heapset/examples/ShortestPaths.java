package com.onthegomap.heapset.examples;

import com.carrotsearch.hppc.IntArrayList;
import com.onthegomap.heapset.collection.HeapEntry;
import com.onthegomap.heapset.collection.IndexedHeap;
import com.onthegomap.heapset.collection.MinHeap;
import com.onthegomap.heapset.config.Arguments;
import com.onthegomap.heapset.config.HeapConfig;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes single-source shortest paths over a randomly weighted grid using Dijkstra's algorithm, with an
 * {@link IndexedHeap} lowering the tentative distance of a node in place instead of adding duplicate entries.
 * <p>
 * To run: {@code java -jar heapset-examples.jar --rows=500 --cols=500 --seed=1 --source=0 --arity=4}
 */
public class ShortestPaths {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShortestPaths.class);
  public static final long UNREACHABLE = Long.MAX_VALUE;

  private ShortestPaths() {}

  /**
   * An undirected graph stored as adjacency lists.
   *
   * @param neighbors for each node, the nodes it has an edge to
   * @param weights   for each node, the weight of the edge at the same position in {@code neighbors}
   */
  public record Graph(IntArrayList[] neighbors, IntArrayList[] weights) {

    public static Graph empty(int nodes) {
      IntArrayList[] neighbors = new IntArrayList[nodes];
      IntArrayList[] weights = new IntArrayList[nodes];
      for (int i = 0; i < nodes; i++) {
        neighbors[i] = new IntArrayList();
        weights[i] = new IntArrayList();
      }
      return new Graph(neighbors, weights);
    }

    /**
     * Returns a {@code rows x cols} grid where each node is connected to the nodes above, below, left and right of it
     * by an edge with a random weight in {@code [1, maxWeight]}.
     */
    public static Graph randomGrid(int rows, int cols, int maxWeight, long seed) {
      if (rows <= 0 || cols <= 0) {
        throw new IllegalArgumentException("Grid must have at least one row and column, was " + rows + "x" + cols);
      }
      if (maxWeight < 1) {
        throw new IllegalArgumentException("Maximum edge weight must be >= 1, was " + maxWeight);
      }
      int nodes;
      try {
        nodes = Math.multiplyExact(rows, cols);
      } catch (ArithmeticException e) {
        throw new IllegalArgumentException("Grid of " + rows + "x" + cols + " has too many nodes", e);
      }
      Random random = new Random(seed);
      Graph graph = empty(nodes);
      for (int row = 0; row < rows; row++) {
        for (int col = 0; col < cols; col++) {
          int node = row * cols + col;
          if (col + 1 < cols) {
            graph.addEdge(node, node + 1, 1 + random.nextInt(maxWeight));
          }
          if (row + 1 < rows) {
            graph.addEdge(node, node + cols, 1 + random.nextInt(maxWeight));
          }
        }
      }
      return graph;
    }

    public int nodes() {
      return neighbors.length;
    }

    public void addEdge(int a, int b, int weight) {
      if (weight < 0) {
        throw new IllegalArgumentException("Edge weights must be >= 0, was " + weight);
      }
      neighbors[a].add(b);
      weights[a].add(weight);
      neighbors[b].add(a);
      weights[b].add(weight);
    }
  }

  /**
   * Returns the length of the shortest path from {@code source} to every node in {@code graph}, or
   * {@link #UNREACHABLE} for nodes that cannot be reached.
   */
  public static long[] distances(Graph graph, int source, HeapConfig config) {
    int nodes = graph.nodes();
    if (source < 0 || source >= nodes) {
      throw new IllegalArgumentException("Illegal source: " + source + ", legal range: [0, " + nodes + "[");
    }
    long[] distances = new long[nodes];
    Arrays.fill(distances, UNREACHABLE);
    IndexedHeap<Integer, Long> queue = MinHeap.newIndexedHeap(config, Comparator.<Long>naturalOrder());
    distances[source] = 0;
    queue.insert(source, 0L);
    while (!queue.isEmpty()) {
      HeapEntry<Integer, Long> closest = queue.extractMin();
      int node = closest.element();
      long distance = closest.priority();
      IntArrayList neighbors = graph.neighbors()[node];
      IntArrayList weights = graph.weights()[node];
      for (int i = 0; i < neighbors.size(); i++) {
        int neighbor = neighbors.get(i);
        long candidate = distance + weights.get(i);
        if (candidate < distances[neighbor]) {
          distances[neighbor] = candidate;
          queue.enqueueOrUpdate(neighbor, candidate);
        }
      }
    }
    return distances;
  }

  public static void main(String[] args) {
    run(Arguments.fromArgsOrConfigFile(args));
  }

  static long[] run(Arguments arguments) {
    int rows = arguments.getInteger("rows", "number of rows in the grid", 100);
    int cols = arguments.getInteger("cols", "number of columns in the grid", 100);
    int maxWeight = arguments.getInteger("max_weight", "maximum edge weight", 10);
    long seed = arguments.getLong("seed", "random seed for edge weights", 0);
    int source = arguments.getInteger("source", "node to compute distances from", 0);
    HeapConfig config = HeapConfig.from(arguments);

    LOGGER.info("Building {}x{} grid with seed {}", rows, cols, seed);
    Graph graph = Graph.randomGrid(rows, cols, maxWeight, seed);

    long start = System.nanoTime();
    long[] result = distances(graph, source, config);
    long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

    int farthest = source;
    for (int i = 0; i < result.length; i++) {
      if (result[i] != UNREACHABLE && result[i] > result[farthest]) {
        farthest = i;
      }
    }
    LOGGER.info("Computed distances from node {} to {} nodes in {}ms using a {}-ary heap", source, result.length,
      elapsedMillis, config.arity());
    LOGGER.info("Farthest node is {} at distance {}", farthest, result[farthest]);
    return result;
  }
}
