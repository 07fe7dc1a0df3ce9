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

package io.github.jpauli.state;

import io.github.jpauli.algebra.QubitOrder;
import io.github.jpauli.math.ComplexUtil;
import io.github.jpauli.ops.Gate;
import io.github.jpauli.ops.Operation;
import io.github.jpauli.util.JPauliProperties;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * A dense vector of 2^n complex amplitudes over an ordered list of n labelled qubits.
 * <p>
 * The first qubit is the most significant bit of the amplitude index, so
 * {@code amplitude(b0, b1, ..., bn-1)} is the amplitude of |b0 b1 ... bn-1>. States are
 * immutable; every operation returns a new state. Amplitudes are not required to be normalized,
 * since applying a Pauli sum generally changes the norm.
 */
public final class State {
    /** Largest number of qubits a dense state may hold. */
    public static final int MAX_QUBITS = 24;

    private final List<Object> qubits;
    private final Complex[] amplitudes;

    private State(List<Object> qubits, Complex[] amplitudes) {
        this.qubits = qubits;
        this.amplitudes = amplitudes;
    }

    /**
     * @param qubits distinct qubit labels
     * @param amplitudes 2^n amplitudes, indexed big-endian over {@code qubits}
     */
    public static State of(List<?> qubits, Complex[] amplitudes) {
        var labels = checkQubits(qubits);
        if (amplitudes.length != 1 << labels.size()) {
            throw new IllegalArgumentException(String.format("%d qubits need %d amplitudes, got %d",
                                                             labels.size(), 1 << labels.size(), amplitudes.length));
        }
        var copy = new Complex[amplitudes.length];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = Objects.requireNonNull(amplitudes[i]);
        }
        return new State(labels, copy);
    }

    /**
     * @return the state |0...0>
     */
    public static State zeros(List<?> qubits) {
        return basis(qubits, new int[qubits.size()]);
    }

    /**
     * @return the computational basis state |bits[0] bits[1] ...>
     */
    public static State basis(List<?> qubits, int... bits) {
        var labels = checkQubits(qubits);
        var amplitudes = new Complex[1 << labels.size()];
        Arrays.fill(amplitudes, Complex.ZERO);
        amplitudes[index(labels.size(), bits)] = Complex.ONE;
        return new State(labels, amplitudes);
    }

    private static List<Object> checkQubits(List<?> qubits) {
        if (qubits.size() > MAX_QUBITS) {
            throw new IllegalArgumentException("at most " + MAX_QUBITS + " qubits are supported, got " + qubits.size());
        }
        var seen = new HashSet<Object>();
        var labels = new ArrayList<Object>(qubits.size());
        for (Object q : qubits) {
            if (!seen.add(QubitOrder.checkQubit(q))) {
                throw new IllegalArgumentException("duplicate qubit " + q);
            }
            labels.add(q);
        }
        return List.copyOf(labels);
    }

    private static int index(int n, int[] bits) {
        if (bits.length != n) {
            throw new IllegalArgumentException("expected " + n + " bits, got " + bits.length);
        }
        int index = 0;
        for (int b : bits) {
            if (b != 0 && b != 1) {
                throw new IllegalArgumentException("bits must be 0 or 1: " + Arrays.toString(bits));
            }
            index = (index << 1) | b;
        }
        return index;
    }

    public List<Object> qubits() {
        return qubits;
    }

    public int qubitCount() {
        return qubits.size();
    }

    public Complex amplitude(int... bits) {
        return amplitudes[index(qubits.size(), bits)];
    }

    /**
     * @return a copy of the amplitude vector
     */
    public Complex[] amplitudes() {
        return amplitudes.clone();
    }

    /**
     * Applies {@code gate} to the qubits it names.
     *
     * @throws IllegalArgumentException if the gate acts on a qubit this state does not hold
     */
    public State apply(Gate gate) {
        int n = qubits.size();
        int k = gate.qubitCount();
        int[] shifts = new int[k];
        int gateMask = 0;
        for (int j = 0; j < k; j++) {
            int pos = qubits.indexOf(gate.qubits().get(j));
            if (pos < 0) {
                throw new IllegalArgumentException("gate " + gate + " acts on qubit " + gate.qubits().get(j)
                                                   + " which is not in " + qubits);
            }
            shifts[j] = n - 1 - pos;
            gateMask |= 1 << shifts[j];
        }

        Complex[][] m = gate.matrix().getData();
        int dim = 1 << k;
        int[] offsets = new int[dim];
        for (int r = 0; r < dim; r++) {
            for (int j = 0; j < k; j++) {
                if (((r >> (k - 1 - j)) & 1) != 0) {
                    offsets[r] |= 1 << shifts[j];
                }
            }
        }

        var out = new Complex[amplitudes.length];
        for (int base = 0; base < amplitudes.length; base++) {
            if ((base & gateMask) != 0) {
                continue;
            }
            for (int r = 0; r < dim; r++) {
                Complex sum = Complex.ZERO;
                for (int c = 0; c < dim; c++) {
                    sum = sum.add(m[r][c].multiply(amplitudes[base | offsets[c]]));
                }
                out[base | offsets[r]] = sum;
            }
        }
        return new State(qubits, out);
    }

    /**
     * @return the result of running {@code operation} on this state
     */
    public State run(Operation operation) {
        return operation.run(this);
    }

    public State scale(Complex factor) {
        var out = new Complex[amplitudes.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = amplitudes[i].multiply(factor);
        }
        return new State(qubits, out);
    }

    /**
     * @return the amplitude-wise sum of this state and {@code other}, which must hold the same
     * qubits in the same order
     */
    public State add(State other) {
        checkSameQubits(other);
        var out = new Complex[amplitudes.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = amplitudes[i].add(other.amplitudes[i]);
        }
        return new State(qubits, out);
    }

    /**
     * @return the inner product &lt;this|other&gt;
     */
    public Complex inner(State other) {
        checkSameQubits(other);
        Complex sum = Complex.ZERO;
        for (int i = 0; i < amplitudes.length; i++) {
            sum = sum.add(amplitudes[i].conjugate().multiply(other.amplitudes[i]));
        }
        return sum;
    }

    public double norm() {
        double sum = 0;
        for (Complex a : amplitudes) {
            sum += ComplexUtil.absSquared(a);
        }
        return FastMath.sqrt(sum);
    }

    /**
     * @return this state scaled to unit norm
     * @throws IllegalStateException if the norm is zero
     */
    public State normalize() {
        double norm = norm();
        if (norm == 0) {
            throw new IllegalStateException("cannot normalize the zero vector");
        }
        return scale(new Complex(1 / norm));
    }

    /**
     * @return true if every amplitude is within {@code tolerance} of the corresponding amplitude
     * of {@code other}
     */
    public boolean isClose(State other, double tolerance) {
        if (!qubits.equals(other.qubits)) {
            return false;
        }
        for (int i = 0; i < amplitudes.length; i++) {
            if (!ComplexUtil.isClose(amplitudes[i], other.amplitudes[i], tolerance)) {
                return false;
            }
        }
        return true;
    }

    public boolean isClose(State other) {
        return isClose(other, JPauliProperties.TOLERANCE);
    }

    private void checkSameQubits(State other) {
        if (!qubits.equals(other.qubits)) {
            throw new IllegalArgumentException("states hold different qubits: " + qubits + " vs " + other.qubits);
        }
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("State").append(qubits).append(" [");
        for (int i = 0; i < amplitudes.length; i++) {
            sb.append(i == 0 ? "" : ", ").append(ComplexUtil.format(amplitudes[i]));
        }
        return sb.append(']').toString();
    }
}
