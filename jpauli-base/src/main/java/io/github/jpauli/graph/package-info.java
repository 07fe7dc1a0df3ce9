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

/**
 * Qubit connectivity graphs and the graph algorithms circuit synthesis relies on.
 * <p>
 * {@link io.github.jpauli.graph.QubitGraph} is the narrow view the synthesizer depends on:
 * Steiner trees, centers, arborescence checks and orientation, topological order, and
 * predecessors. {@link io.github.jpauli.graph.QubitTopology} implements it over dense node
 * ordinals using Agrona primitive collections.
 */
package io.github.jpauli.graph;
