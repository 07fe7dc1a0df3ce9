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

package io.github.jpauli.ops;

import io.github.jpauli.state.State;

import java.util.List;

/**
 * Something that acts on labelled qubits: a Pauli element, a gate or a circuit.
 */
public interface Operation {
    /**
     * @return the qubits this operation acts on
     */
    List<Object> qubits();

    /**
     * Applies this operation to {@code state}.
     *
     * @param state the input state, which must contain every qubit in {@link #qubits()}
     * @return the resulting state; the input is not modified
     */
    State run(State state);
}
