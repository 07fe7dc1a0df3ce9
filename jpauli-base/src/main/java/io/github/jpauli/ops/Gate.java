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

import io.github.jpauli.algebra.QubitOrder;
import io.github.jpauli.state.State;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * A quantum gate: a unitary acting on a fixed, ordered list of qubits.
 * <p>
 * The first qubit of the gate is the most significant bit of the matrix index, so for
 * {@code CNOT(c, t)} row and column {@code 2*c + t} address the basis state |c t>.
 * Gates are immutable.
 */
public abstract class Gate implements Operation {
    private final String name;
    private final List<Object> qubits;

    protected Gate(String name, List<?> qubits) {
        this.name = Objects.requireNonNull(name);
        var checked = new ArrayList<Object>(qubits.size());
        var seen = new HashSet<Object>();
        for (Object q : qubits) {
            if (!seen.add(QubitOrder.checkQubit(q))) {
                throw new IllegalArgumentException(name + " applied twice to qubit " + q);
            }
            checked.add(q);
        }
        this.qubits = List.copyOf(checked);
    }

    public String name() {
        return name;
    }

    @Override
    public List<Object> qubits() {
        return qubits;
    }

    public int qubitCount() {
        return qubits.size();
    }

    /**
     * @return a fresh copy of this gate's unitary, of dimension 2^{@link #qubitCount()}
     */
    public abstract FieldMatrix<Complex> matrix();

    /**
     * @return the inverse (conjugate transpose) of this gate, on the same qubits
     */
    public abstract Gate adjoint();

    /**
     * @return the real parameters of this gate, empty for fixed gates
     */
    public List<Double> params() {
        return List.of();
    }

    @Override
    public State run(State state) {
        return state.apply(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Gate other = (Gate) o;
        return name.equals(other.name) && qubits.equals(other.qubits) && params().equals(other.params());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, qubits, params());
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(name);
        var params = params();
        if (!params.isEmpty()) {
            sb.append('(');
            for (int i = 0; i < params.size(); i++) {
                sb.append(i == 0 ? "" : ", ").append(params.get(i));
            }
            sb.append(')');
        }
        for (Object q : qubits) {
            sb.append(' ').append(q);
        }
        return sb.toString();
    }
}
