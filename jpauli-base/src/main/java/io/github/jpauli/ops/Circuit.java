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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, ordered sequence of gates. Gates are applied first to last.
 */
public final class Circuit implements Operation, Iterable<Gate> {
    private static final Circuit EMPTY = new Circuit(List.of());

    private final List<Gate> gates;

    private Circuit(List<Gate> gates) {
        this.gates = gates;
    }

    public static Circuit empty() {
        return EMPTY;
    }

    public static Circuit of(Gate... gates) {
        return of(Arrays.asList(gates));
    }

    public static Circuit of(List<? extends Gate> gates) {
        var copy = new ArrayList<Gate>(gates.size());
        for (Gate g : gates) {
            copy.add(Objects.requireNonNull(g));
        }
        return copy.isEmpty() ? EMPTY : new Circuit(Collections.unmodifiableList(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Gate> gates() {
        return gates;
    }

    public int size() {
        return gates.size();
    }

    public boolean isEmpty() {
        return gates.isEmpty();
    }

    /**
     * @return a new circuit with {@code gate} appended
     */
    public Circuit add(Gate gate) {
        return builder().add(this).add(gate).build();
    }

    /**
     * @return a new circuit with the gates of {@code other} appended
     */
    public Circuit add(Circuit other) {
        return builder().add(this).add(other).build();
    }

    /**
     * @return the inverse circuit: the adjoint of every gate, in reverse order
     */
    public Circuit adjoint() {
        var reversed = new ArrayList<Gate>(gates.size());
        for (int i = gates.size() - 1; i >= 0; i--) {
            reversed.add(gates.get(i).adjoint());
        }
        return of(reversed);
    }

    /**
     * @return the qubits acted on, in order of first appearance
     */
    @Override
    public List<Object> qubits() {
        var qubits = new LinkedHashSet<Object>();
        for (Gate g : gates) {
            qubits.addAll(g.qubits());
        }
        return new ArrayList<>(qubits);
    }

    @Override
    public State run(State state) {
        for (Gate g : gates) {
            state = state.apply(g);
        }
        return state;
    }

    @Override
    public Iterator<Gate> iterator() {
        return gates.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Circuit && gates.equals(((Circuit) o).gates));
    }

    @Override
    public int hashCode() {
        return gates.hashCode();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("Circuit[");
        for (int i = 0; i < gates.size(); i++) {
            sb.append(i == 0 ? "" : "; ").append(gates.get(i));
        }
        return sb.append(']').toString();
    }

    /**
     * Accumulates gates for a new {@link Circuit}. Not thread safe.
     */
    public static final class Builder {
        private final List<Gate> gates = new ArrayList<>();

        private Builder() {
        }

        public Builder add(Gate gate) {
            gates.add(Objects.requireNonNull(gate));
            return this;
        }

        public Builder add(Circuit circuit) {
            gates.addAll(circuit.gates);
            return this;
        }

        public int size() {
            return gates.size();
        }

        public Circuit build() {
            return of(gates);
        }
    }
}
