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

import java.util.Collection;
import java.util.List;

/**
 * The graph operations needed to route a Pauli exponential over a qubit connectivity graph.
 * <p>
 * Nodes are qubit labels. Implementations are immutable; operations that derive a new graph
 * return a new instance.
 */
public interface QubitGraph {
    /**
     * @return the nodes, in canonical qubit order
     */
    List<Object> nodes();

    boolean contains(Object node);

    boolean isDirected();

    /**
     * @return true if this is a directed tree with every edge oriented away from a single root
     */
    boolean isArborescence();

    /**
     * Returns a tree spanning {@code terminals}, approximately minimizing total edge weight.
     * When this graph is already an arborescence, the result is its smallest sub-arborescence
     * containing every terminal.
     *
     * @throws IllegalArgumentException if a terminal is missing or the terminals are not connected
     */
    QubitGraph steinerTree(Collection<?> terminals);

    /**
     * @return the nodes of minimum eccentricity, counting hops and ignoring edge direction, in
     * canonical qubit order
     */
    List<Object> center();

    /**
     * @return the depth-first arborescence of the nodes reachable from {@code root}, ignoring
     * edge direction
     */
    QubitGraph orientedFrom(Object root);

    /**
     * @return every node, ordered so that each edge points from an earlier node to a later one
     * @throws IllegalStateException if the graph is undirected or has a cycle
     */
    List<Object> topologicalSort();

    /**
     * @return the sources of the edges entering {@code node}; for an undirected graph, its neighbors
     */
    List<Object> predecessors(Object node);
}
