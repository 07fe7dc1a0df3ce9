/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jpauli.graph;

import io.github.jpauli.algebra.QubitOrder;
import org.agrona.collections.Int2IntHashMap;
import org.agrona.collections.IntArrayList;
import org.agrona.collections.IntHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * An immutable, weighted qubit connectivity graph, either directed or undirected.
 * <p>
 * Nodes are stored in canonical qubit order and addressed internally by their dense ordinal in
 * that order, so every traversal breaks ties the same way and results are deterministic. Edge
 * weights default to 1 and must be non-negative.
 * <p>
 * Build instances with {@link #undirected()} or {@link #directed()}, or use one of the layout
 * factories {@link #path}, {@link #line} and {@link #grid}.
 */
public final class QubitTopology implements QubitGraph {
    private static final Logger LOG = LoggerFactory.getLogger(QubitTopology.class);

    private final boolean directed;
    private final List<Object> nodes;
    private final Map<Object, Integer> ordinals;
    private final int[] edgeFrom;
    private final int[] edgeTo;
    private final double[] edgeWeight;
    // edge ids per node; for undirected graphs out and in both hold every incident edge
    private final IntArrayList[] outEdges;
    private final IntArrayList[] inEdges;
    private final IntArrayList[] incident;

    private QubitTopology(boolean directed, List<Object> nodes, Map<Object, Integer> ordinals,
                          int[] edgeFrom, int[] edgeTo, double[] edgeWeight) {
        this.directed = directed;
        this.nodes = nodes;
        this.ordinals = ordinals;
        this.edgeFrom = edgeFrom;
        this.edgeTo = edgeTo;
        this.edgeWeight = edgeWeight;

        int n = nodes.size();
        outEdges = new IntArrayList[n];
        inEdges = new IntArrayList[n];
        incident = new IntArrayList[n];
        for (int v = 0; v < n; v++) {
            incident[v] = new IntArrayList();
            outEdges[v] = directed ? new IntArrayList() : incident[v];
            inEdges[v] = directed ? new IntArrayList() : incident[v];
        }
        for (int e = 0; e < edgeFrom.length; e++) {
            incident[edgeFrom[e]].addInt(e);
            incident[edgeTo[e]].addInt(e);
            if (directed) {
                outEdges[edgeFrom[e]].addInt(e);
                inEdges[edgeTo[e]].addInt(e);
            }
        }
    }

    public static Builder undirected() {
        return new Builder(false);
    }

    public static Builder directed() {
        return new Builder(true);
    }

    /**
     * @return an undirected path through {@code qubits} in the given order
     */
    public static QubitTopology path(List<?> qubits) {
        return path(qubits, false);
    }

    /**
     * @return a path through {@code qubits} in the given order, edges pointing forward if directed
     */
    public static QubitTopology path(List<?> qubits, boolean directed) {
        var builder = new Builder(directed);
        for (int i = 0; i < qubits.size(); i++) {
            builder.addNode(qubits.get(i));
            if (i > 0) {
                builder.addEdge(qubits.get(i - 1), qubits.get(i));
            }
        }
        return builder.build();
    }

    /**
     * @return the undirected line 0 - 1 - ... - (n-1)
     */
    public static QubitTopology line(int n) {
        var qubits = new ArrayList<Integer>(n);
        for (int i = 0; i < n; i++) {
            qubits.add(i);
        }
        return path(qubits, false);
    }

    /**
     * @return an undirected rows x cols lattice; the qubit in row r and column c is {@code r * cols + c}
     */
    public static QubitTopology grid(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("grid dimensions must be positive, got " + rows + "x" + cols);
        }
        var builder = undirected();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int q = r * cols + c;
                builder.addNode(q);
                if (c + 1 < cols) {
                    builder.addEdge(q, q + 1);
                }
                if (r + 1 < rows) {
                    builder.addEdge(q, q + cols);
                }
            }
        }
        return builder.build();
    }

    @Override
    public List<Object> nodes() {
        return nodes;
    }

    @Override
    public boolean contains(Object node) {
        return ordinals.containsKey(node);
    }

    @Override
    public boolean isDirected() {
        return directed;
    }

    public int edgeCount() {
        return edgeFrom.length;
    }

    /**
     * @return every edge as a {@code [from, to]} pair, sorted by endpoint; undirected edges are
     * listed once, smaller endpoint first
     */
    public List<List<Object>> edges() {
        var edges = new ArrayList<List<Object>>(edgeCount());
        for (int e = 0; e < edgeCount(); e++) {
            edges.add(List.of(nodes.get(edgeFrom[e]), nodes.get(edgeTo[e])));
        }
        return edges;
    }

    /**
     * @return true if there is an edge u -> v, or u - v when undirected
     */
    public boolean hasEdge(Object u, Object v) {
        if (!contains(u) || !contains(v)) {
            return false;
        }
        int a = ordinal(u);
        int b = ordinal(v);
        var edges = outEdges[a];
        for (int i = 0; i < edges.size(); i++) {
            int e = edges.getInt(i);
            if (directed ? edgeTo[e] == b : other(e, a) == b) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the nodes sharing an edge with {@code node} in either direction, in canonical order
     */
    public List<Object> neighbors(Object node) {
        var result = new ArrayList<Object>();
        for (int w : sortedNeighbors(ordinal(node))) {
            result.add(nodes.get(w));
        }
        return result;
    }

    @Override
    public boolean isArborescence() {
        int n = nodes.size();
        if (!directed || n == 0 || edgeCount() != n - 1) {
            return false;
        }
        int root = -1;
        for (int v = 0; v < n; v++) {
            int indegree = inEdges[v].size();
            if (indegree == 0) {
                if (root >= 0) {
                    return false;
                }
                root = v;
            } else if (indegree > 1) {
                return false;
            }
        }
        if (root < 0) {
            return false;
        }

        // n - 1 edges, one root, and every other node has exactly one parent: a tree iff all are reachable
        var seen = new IntHashSet();
        var frontier = new IntArrayList();
        seen.add(root);
        frontier.addInt(root);
        for (int i = 0; i < frontier.size(); i++) {
            var edges = outEdges[frontier.getInt(i)];
            for (int j = 0; j < edges.size(); j++) {
                int w = edgeTo[edges.getInt(j)];
                if (seen.add(w)) {
                    frontier.addInt(w);
                }
            }
        }
        return seen.size() == n;
    }

    @Override
    public QubitTopology steinerTree(Collection<?> terminals) {
        Objects.requireNonNull(terminals);
        if (terminals.isEmpty()) {
            throw new IllegalArgumentException("a Steiner tree needs at least one terminal");
        }
        var terminalSet = new IntHashSet();
        var terminalList = new IntArrayList();
        for (Object t : terminals) {
            int v = ordinal(t);
            if (terminalSet.add(v)) {
                terminalList.addInt(v);
            }
        }
        int[] terms = terminalList.toIntArray();
        Arrays.sort(terms);

        QubitTopology tree;
        if (isArborescence()) {
            tree = prunedArborescence(terminalSet);
        } else if (terms.length == 1) {
            tree = undirected().addNode(nodes.get(terms[0])).build();
        } else {
            tree = kouMarkowskyBerman(terms, terminalSet);
        }
        LOG.debug("Steiner tree over {} terminals spans {} of {} nodes", terms.length, tree.nodes.size(), nodes.size());
        return tree;
    }

    /**
     * Kou, Markowsky and Berman's 2-approximation: a minimum spanning tree of the terminals'
     * metric closure, expanded into shortest paths, re-spanned, and stripped of non-terminal leaves.
     */
    private QubitTopology kouMarkowskyBerman(int[] terms, IntHashSet terminalSet) {
        int n = nodes.size();
        int t = terms.length;
        double[][] dist = new double[t][n];
        int[][] via = new int[t][n];
        for (int i = 0; i < t; i++) {
            shortestPaths(terms[i], dist[i], via[i]);
        }

        // Prim over the closure, expanding each closure edge as it is chosen
        boolean[] inTree = new boolean[t];
        double[] best = new double[t];
        int[] bestFrom = new int[t];
        inTree[0] = true;
        for (int j = 1; j < t; j++) {
            best[j] = dist[0][terms[j]];
        }
        var pathEdges = new IntArrayList();
        for (int added = 1; added < t; added++) {
            int next = -1;
            for (int j = 1; j < t; j++) {
                if (!inTree[j] && (next < 0 || best[j] < best[next])) {
                    next = j;
                }
            }
            if (best[next] == Double.POSITIVE_INFINITY) {
                throw new IllegalArgumentException("qubits " + nodes.get(terms[0]) + " and " + nodes.get(terms[next])
                                                   + " are not connected in " + this);
            }
            inTree[next] = true;

            int source = terms[bestFrom[next]];
            for (int v = terms[next]; v != source; ) {
                int e = via[bestFrom[next]][v];
                if (!pathEdges.containsInt(e)) {
                    pathEdges.addInt(e);
                }
                v = other(e, v);
            }
            for (int j = 1; j < t; j++) {
                if (!inTree[j] && dist[next][terms[j]] < best[j]) {
                    best[j] = dist[next][terms[j]];
                    bestFrom[j] = next;
                }
            }
        }

        // Kruskal over the expanded edges
        int[] candidates = Arrays.stream(pathEdges.toIntArray())
                .boxed()
                .sorted(Comparator.comparingDouble((Integer e) -> edgeWeight[e]).thenComparingInt(e -> e))
                .mapToInt(Integer::intValue)
                .toArray();
        int[] component = new int[n];
        for (int v = 0; v < n; v++) {
            component[v] = v;
        }
        var treeEdges = new IntArrayList();
        for (int e : candidates) {
            int a = find(component, edgeFrom[e]);
            int b = find(component, edgeTo[e]);
            if (a != b) {
                component[a] = b;
                treeEdges.addInt(e);
            }
        }

        // strip non-terminal leaves until none remain
        var degree = new Int2IntHashMap(0);
        for (int i = 0; i < treeEdges.size(); i++) {
            int e = treeEdges.getInt(i);
            degree.put(edgeFrom[e], degree.get(edgeFrom[e]) + 1);
            degree.put(edgeTo[e], degree.get(edgeTo[e]) + 1);
        }
        var kept = new IntArrayList();
        boolean changed = true;
        while (changed) {
            changed = false;
            kept.clear();
            for (int i = 0; i < treeEdges.size(); i++) {
                int e = treeEdges.getInt(i);
                if (isStrippableLeaf(edgeFrom[e], degree, terminalSet) || isStrippableLeaf(edgeTo[e], degree, terminalSet)) {
                    degree.put(edgeFrom[e], degree.get(edgeFrom[e]) - 1);
                    degree.put(edgeTo[e], degree.get(edgeTo[e]) - 1);
                    changed = true;
                } else {
                    kept.addInt(e);
                }
            }
            treeEdges = new IntArrayList();
            for (int i = 0; i < kept.size(); i++) {
                treeEdges.addInt(kept.getInt(i));
            }
        }

        var builder = undirected();
        for (int v : terms) {
            builder.addNode(nodes.get(v));
        }
        for (int i = 0; i < treeEdges.size(); i++) {
            int e = treeEdges.getInt(i);
            builder.addEdge(nodes.get(edgeFrom[e]), nodes.get(edgeTo[e]), edgeWeight[e]);
        }
        return builder.build();
    }

    private static boolean isStrippableLeaf(int v, Int2IntHashMap degree, IntHashSet terminalSet) {
        return degree.get(v) == 1 && !terminalSet.contains(v);
    }

    private static int find(int[] component, int v) {
        while (component[v] != v) {
            component[v] = component[component[v]];
            v = component[v];
        }
        return v;
    }

    /**
     * Dijkstra from {@code source}, ignoring edge direction. {@code via[v]} is the id of the last
     * edge on the chosen shortest path to v, or -1.
     */
    private void shortestPaths(int source, double[] dist, int[] via) {
        int n = nodes.size();
        Arrays.fill(dist, Double.POSITIVE_INFINITY);
        Arrays.fill(via, -1);
        dist[source] = 0;
        boolean[] done = new boolean[n];
        while (true) {
            int u = -1;
            for (int v = 0; v < n; v++) {
                if (!done[v] && dist[v] < Double.POSITIVE_INFINITY && (u < 0 || dist[v] < dist[u])) {
                    u = v;
                }
            }
            if (u < 0) {
                return;
            }
            done[u] = true;
            var edges = incident[u];
            for (int i = 0; i < edges.size(); i++) {
                int e = edges.getInt(i);
                int w = other(e, u);
                double d = dist[u] + edgeWeight[e];
                if (d < dist[w]) {
                    dist[w] = d;
                    via[w] = e;
                }
            }
        }
    }

    /**
     * The smallest sub-arborescence holding every terminal: childless non-terminals are removed
     * repeatedly, then the root is moved down while it is a non-terminal with a single child.
     */
    private QubitTopology prunedArborescence(IntHashSet terminalSet) {
        int n = nodes.size();
        boolean[] kept = new boolean[n];
        Arrays.fill(kept, true);
        int[] children = new int[n];
        int[] parentEdge = new int[n];
        Arrays.fill(parentEdge, -1);
        for (int e = 0; e < edgeCount(); e++) {
            children[edgeFrom[e]]++;
            parentEdge[edgeTo[e]] = e;
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int v = 0; v < n; v++) {
                if (kept[v] && children[v] == 0 && !terminalSet.contains(v)) {
                    kept[v] = false;
                    if (parentEdge[v] >= 0) {
                        children[edgeFrom[parentEdge[v]]]--;
                    }
                    changed = true;
                }
            }
        }

        int root = 0;
        while (parentEdge[root] >= 0) {
            root = edgeFrom[parentEdge[root]];
        }
        while (!terminalSet.contains(root) && children[root] == 1) {
            kept[root] = false;
            var edges = outEdges[root];
            for (int i = 0; i < edges.size(); i++) {
                if (kept[edgeTo[edges.getInt(i)]]) {
                    root = edgeTo[edges.getInt(i)];
                    break;
                }
            }
        }

        var builder = directed();
        for (int v = 0; v < n; v++) {
            if (kept[v]) {
                builder.addNode(nodes.get(v));
            }
        }
        for (int e = 0; e < edgeCount(); e++) {
            if (kept[edgeFrom[e]] && kept[edgeTo[e]]) {
                builder.addEdge(nodes.get(edgeFrom[e]), nodes.get(edgeTo[e]), edgeWeight[e]);
            }
        }
        return builder.build();
    }

    @Override
    public List<Object> center() {
        int n = nodes.size();
        if (n == 0) {
            throw new IllegalArgumentException("the empty graph has no center");
        }
        int[] eccentricity = new int[n];
        int[] hops = new int[n];
        for (int s = 0; s < n; s++) {
            Arrays.fill(hops, -1);
            hops[s] = 0;
            var frontier = new IntArrayList();
            frontier.addInt(s);
            for (int i = 0; i < frontier.size(); i++) {
                int u = frontier.getInt(i);
                var edges = incident[u];
                for (int j = 0; j < edges.size(); j++) {
                    int w = other(edges.getInt(j), u);
                    if (hops[w] < 0) {
                        hops[w] = hops[u] + 1;
                        eccentricity[s] = Math.max(eccentricity[s], hops[w]);
                        frontier.addInt(w);
                    }
                }
            }
            if (frontier.size() != n) {
                throw new IllegalArgumentException("graph is not connected: " + this);
            }
        }

        int min = Arrays.stream(eccentricity).min().getAsInt();
        var center = new ArrayList<Object>();
        for (int v = 0; v < n; v++) {
            if (eccentricity[v] == min) {
                center.add(nodes.get(v));
            }
        }
        return center;
    }

    @Override
    public QubitTopology orientedFrom(Object root) {
        var builder = directed().addNode(root);
        boolean[] seen = new boolean[nodes.size()];
        int r = ordinal(root);
        seen[r] = true;
        // depth-first with an explicit stack; each frame resumes at its next unvisited neighbor
        var frames = new ArrayList<int[]>();
        var cursor = new IntArrayList();
        var owners = new IntArrayList();
        frames.add(sortedNeighbors(r));
        cursor.addInt(0);
        owners.addInt(r);
        while (!frames.isEmpty()) {
            int top = frames.size() - 1;
            int[] neighbors = frames.get(top);
            int i = cursor.getInt(top);
            if (i == neighbors.length) {
                frames.remove(top);
                cursor.removeAt(top);
                owners.removeAt(top);
                continue;
            }
            cursor.setInt(top, i + 1);
            int u = owners.getInt(top);
            int w = neighbors[i];
            if (!seen[w]) {
                seen[w] = true;
                builder.addEdge(nodes.get(u), nodes.get(w), weightBetween(u, w));
                frames.add(sortedNeighbors(w));
                cursor.addInt(0);
                owners.addInt(w);
            }
        }
        return builder.build();
    }

    @Override
    public List<Object> topologicalSort() {
        if (!directed) {
            throw new IllegalStateException("topological sort requires a directed graph");
        }
        int n = nodes.size();
        int[] indegree = new int[n];
        var ready = new PriorityQueue<Integer>();
        for (int v = 0; v < n; v++) {
            indegree[v] = inEdges[v].size();
            if (indegree[v] == 0) {
                ready.add(v);
            }
        }
        var order = new ArrayList<Object>(n);
        while (!ready.isEmpty()) {
            int u = ready.poll();
            order.add(nodes.get(u));
            var edges = outEdges[u];
            for (int i = 0; i < edges.size(); i++) {
                int w = edgeTo[edges.getInt(i)];
                if (--indegree[w] == 0) {
                    ready.add(w);
                }
            }
        }
        if (order.size() != n) {
            throw new IllegalStateException("graph has a cycle: " + this);
        }
        return order;
    }

    @Override
    public List<Object> predecessors(Object node) {
        int v = ordinal(node);
        if (!directed) {
            return neighbors(node);
        }
        var result = new ArrayList<Object>();
        var edges = inEdges[v];
        for (int i = 0; i < edges.size(); i++) {
            result.add(nodes.get(edgeFrom[edges.getInt(i)]));
        }
        return result;
    }

    private int ordinal(Object node) {
        Integer v = ordinals.get(node);
        if (v == null) {
            throw new IllegalArgumentException("qubit " + node + " is not in " + this);
        }
        return v;
    }

    private int other(int edge, int v) {
        return edgeFrom[edge] == v ? edgeTo[edge] : edgeFrom[edge];
    }

    private int[] sortedNeighbors(int u) {
        var edges = incident[u];
        var neighbors = new IntArrayList();
        for (int i = 0; i < edges.size(); i++) {
            int w = other(edges.getInt(i), u);
            if (!neighbors.containsInt(w)) {
                neighbors.addInt(w);
            }
        }
        int[] sorted = neighbors.toIntArray();
        Arrays.sort(sorted);
        return sorted;
    }

    private double weightBetween(int u, int w) {
        double weight = Double.POSITIVE_INFINITY;
        var edges = incident[u];
        for (int i = 0; i < edges.size(); i++) {
            int e = edges.getInt(i);
            if (other(e, u) == w) {
                weight = Math.min(weight, edgeWeight[e]);
            }
        }
        return weight;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(directed ? "QubitTopology(directed, " : "QubitTopology(undirected, ");
        sb.append("nodes=").append(nodes).append(", edges=[");
        for (int e = 0; e < edgeCount(); e++) {
            sb.append(e == 0 ? "" : ", ").append(nodes.get(edgeFrom[e])).append(directed ? "->" : "-").append(nodes.get(edgeTo[e]));
        }
        return sb.append("])").toString();
    }

    /**
     * Collects nodes and edges for a {@link QubitTopology}. Adding an edge adds its endpoints;
     * adding the same edge twice keeps the last weight. Not thread safe.
     */
    public static final class Builder {
        private final boolean directed;
        private final Set<Object> nodes = new HashSet<>();
        private final Map<List<Object>, Double> edges = new LinkedHashMap<>();

        private Builder(boolean directed) {
            this.directed = directed;
        }

        public Builder addNode(Object qubit) {
            nodes.add(QubitOrder.checkQubit(qubit));
            return this;
        }

        public Builder addEdge(Object u, Object v) {
            return addEdge(u, v, 1.0);
        }

        public Builder addEdge(Object u, Object v, double weight) {
            QubitOrder.checkQubit(u);
            QubitOrder.checkQubit(v);
            if (u.equals(v)) {
                throw new IllegalArgumentException("self loop on qubit " + u);
            }
            if (!(weight >= 0) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("edge weight must be finite and non-negative, got " + weight);
            }
            nodes.add(u);
            nodes.add(v);
            if (!directed && QubitOrder.INSTANCE.compare(u, v) > 0) {
                edges.put(List.of(v, u), weight);
            } else {
                edges.put(List.of(u, v), weight);
            }
            return this;
        }

        public QubitTopology build() {
            var sorted = QubitOrder.sorted(nodes);
            var ordinals = new HashMap<Object, Integer>();
            for (int i = 0; i < sorted.size(); i++) {
                ordinals.put(sorted.get(i), i);
            }

            var keys = new ArrayList<>(edges.keySet());
            keys.sort(Comparator.<List<Object>>comparingInt(k -> ordinals.get(k.get(0)))
                              .thenComparingInt(k -> ordinals.get(k.get(1))));
            int m = keys.size();
            int[] from = new int[m];
            int[] to = new int[m];
            double[] weight = new double[m];
            for (int e = 0; e < m; e++) {
                var key = keys.get(e);
                from[e] = ordinals.get(key.get(0));
                to[e] = ordinals.get(key.get(1));
                weight[e] = edges.get(key);
            }
            return new QubitTopology(directed, List.copyOf(sorted), Collections.unmodifiableMap(ordinals), from, to, weight);
        }
    }
}
