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

package io.github.jpauli.algebra;

import io.github.jpauli.math.ComplexUtil;
import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One term of a Pauli element: a tensor product of X, Y and Z operators on distinct qubits,
 * times a complex coefficient.
 * <p>
 * Factors are kept sorted by {@link QubitOrder}, and identity factors are never stored, so
 * every term has exactly one representation. A term with no factors is a multiple of the
 * identity. Terms are only created by {@link Pauli} and {@link Paulis}, which maintain these
 * invariants.
 */
public final class PauliTerm {
    /**
     * Lexicographic order over factor sequences; a proper prefix sorts first, so the scalar
     * term sorts before every other term.
     */
    static final Comparator<List<Factor>> FACTOR_ORDER = (a, b) -> {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    private final List<Factor> factors;
    private final Complex coefficient;

    PauliTerm(List<Factor> factors, Complex coefficient) {
        this.factors = factors;
        this.coefficient = withoutNegativeZero(coefficient);
    }

    // adding 0.0 turns -0.0 into 0.0, which Complex.equals and Double.compare tell apart
    private static Complex withoutNegativeZero(Complex c) {
        return new Complex(c.getReal() + 0.0, c.getImaginary() + 0.0);
    }

    /**
     * @return the non-identity factors, in canonical qubit order
     */
    public List<Factor> factors() {
        return factors;
    }

    public Complex coefficient() {
        return coefficient;
    }

    /**
     * @return the number of non-identity factors
     */
    public int size() {
        return factors.size();
    }

    /**
     * @return true if this term is a multiple of the identity
     */
    public boolean isScalar() {
        return factors.isEmpty();
    }

    /**
     * @return the qubits acted on by this term, in canonical order
     */
    public List<Object> qubits() {
        var qubits = new ArrayList<Object>(factors.size());
        for (Factor f : factors) {
            qubits.add(f.qubit);
        }
        return qubits;
    }

    /**
     * @return the operator this term applies to {@code qubit}; {@link PauliOperator#I} if none
     */
    public PauliOperator operatorOn(Object qubit) {
        for (Factor f : factors) {
            if (f.qubit.equals(qubit)) {
                return f.operator;
            }
        }
        return PauliOperator.I;
    }

    /**
     * @return the operator symbols of the factors, e.g. {@code "XZ"}
     */
    public String operators() {
        var sb = new StringBuilder(factors.size());
        for (Factor f : factors) {
            sb.append(f.operator.symbol());
        }
        return sb.toString();
    }

    /**
     * Orders terms by their factor sequences, then by coefficient.
     */
    int compareTo(PauliTerm other) {
        int c = FACTOR_ORDER.compare(factors, other.factors);
        return c != 0 ? c : ComplexUtil.compare(coefficient, other.coefficient);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PauliTerm)) {
            return false;
        }
        PauliTerm other = (PauliTerm) o;
        return factors.equals(other.factors) && coefficient.equals(other.coefficient);
    }

    @Override
    public int hashCode() {
        return 31 * factors.hashCode() + coefficient.hashCode();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("+ ").append(ComplexUtil.format(coefficient));
        for (Factor f : factors) {
            sb.append(' ').append(f);
        }
        return sb.toString();
    }

    /**
     * A single-qubit Pauli operator applied to a labelled qubit.
     */
    public static final class Factor implements Comparable<Factor> {
        private final Object qubit;
        private final PauliOperator operator;

        Factor(Object qubit, PauliOperator operator) {
            this.qubit = Objects.requireNonNull(qubit);
            this.operator = Objects.requireNonNull(operator);
        }

        public Object qubit() {
            return qubit;
        }

        public PauliOperator operator() {
            return operator;
        }

        @Override
        public int compareTo(Factor other) {
            int c = QubitOrder.INSTANCE.compare(qubit, other.qubit);
            return c != 0 ? c : operator.compareTo(other.operator);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Factor)) {
                return false;
            }
            Factor other = (Factor) o;
            return qubit.equals(other.qubit) && operator == other.operator;
        }

        @Override
        public int hashCode() {
            return 31 * qubit.hashCode() + operator.hashCode();
        }

        @Override
        public String toString() {
            return operator.symbol() + "(" + qubit + ")";
        }
    }
}
