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
 * Exception types raised by jpauli.
 * <p>
 * Every error the library reports is a contract violation by the caller, so all of them are
 * unchecked and extend {@link java.lang.IllegalArgumentException}. They are thrown synchronously,
 * before any value is produced, and are never retried or recovered internally.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.jpauli.exceptions.InvalidOperatorException} - a Pauli term was built
 *       from a symbol outside {I, X, Y, Z}.</li>
 *   <li>{@link io.github.jpauli.exceptions.InvalidExponentException} - a Pauli element was
 *       raised to a negative or non-integral power.</li>
 *   <li>{@link io.github.jpauli.exceptions.NonHermitianTermException} - circuit synthesis was
 *       given a term whose coefficient is not real.</li>
 * </ul>
 */
package io.github.jpauli.exceptions;
