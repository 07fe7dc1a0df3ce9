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
 * The Pauli operator algebra.
 * <p>
 * A {@link io.github.jpauli.algebra.Pauli} is a sum of {@link io.github.jpauli.algebra.PauliTerm}s,
 * each a complex coefficient times a tensor product of single-qubit X, Y and Z operators.
 * Elements are kept canonical: factors are sorted by qubit label
 * ({@link io.github.jpauli.algebra.QubitOrder}), identity factors are dropped, terms with equal
 * factors are merged and terms whose coefficients vanish are removed. Two elements that denote
 * the same operator therefore compare equal.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@link io.github.jpauli.algebra.Paulis#sum} and {@link io.github.jpauli.algebra.Paulis#product} -
 *       n-ary sum and product, with the single-qubit rule table of
 *       {@link io.github.jpauli.algebra.PauliOperator}</li>
 *   <li>{@link io.github.jpauli.algebra.Paulis#pow} - non-negative integer powers</li>
 *   <li>{@link io.github.jpauli.algebra.Paulis#close} - approximate equality</li>
 *   <li>{@link io.github.jpauli.algebra.PauliCommutation} - commutation tests and the greedy
 *       partition into commuting sets</li>
 * </ul>
 * <p>
 * Qubit labels may be any non-null {@link java.lang.Comparable}; labels of different classes
 * are ordered by class name first. All types in this package are immutable and thread safe.
 */
package io.github.jpauli.algebra;
