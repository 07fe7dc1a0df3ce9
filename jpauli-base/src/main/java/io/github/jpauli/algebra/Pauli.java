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

import io.github.jpauli.algebra.PauliTerm.Factor;
import io.github.jpauli.exceptions.InvalidOperatorException;
import io.github.jpauli.math.ComplexUtil;
import io.github.jpauli.ops.Gate;
import io.github.jpauli.ops.Gates;
import io.github.jpauli.ops.Operation;
import io.github.jpauli.state.State;
import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * An element of the Pauli algebra: a formal sum of {@link PauliTerm}s such as
 * <pre>
 *     Y(1) - 0.5 Z(1) X(2) Y(4)
 * </pre>
 * where X, Y and Z are the single-qubit Pauli operators.
 * <p>
 * Terms are kept sorted by their factor sequences, no two terms share a factor sequence, and
 * no term has a coefficient within {@link io.github.jpauli.util.JPauliProperties#TOLERANCE} of
 * zero. Every element therefore has a unique representation, and equality, ordering and hashing
 * are structural. The empty sum is the zero element; the single scalar term with coefficient 1 is
 * the identity.
 * <p>
 * Instances are immutable. The arithmetic methods delegate to {@link Paulis} and
 * {@link PauliCommutation}.
 */
public final class Pauli implements Operation, Iterable<PauliTerm>, Comparable<Pauli> {
    private static final Pauli ZERO = new Pauli(List.of());
    private static final Pauli IDENTITY = new Pauli(List.of(new PauliTerm(List.of(), Complex.ONE)));

    private final List<PauliTerm> terms;

    /**
     * @param terms canonical terms: sorted, distinct factor sequences, no vanishing coefficient
     */
    Pauli(List<PauliTerm> terms) {
        this.terms = terms;
    }

    /**
     * Creates a single-term element from a sequence of qubits and operator symbols, e.g.
     * {@code term(List.of(0, 1, 3), "XIZ", c)} for c·X(0)Z(3).
     * <p>
     * Identity factors are dropped and the rest sorted into canonical qubit order. If the
     * coefficient is within tolerance of zero, the zero element is returned.
     *
     * @param qubits the qubit labels, one per operator symbol
     * @param operators a string over the alphabet {I, X, Y, Z}
     * @param coefficient the coefficient of the term
     * @return the new element
     * @throws InvalidOperatorException if {@code operators} contains any other symbol
     * @throws IllegalArgumentException if the lengths differ, a label is not usable, or a qubit
     * carries more than one non-identity operator
     */
    public static Pauli term(List<?> qubits, String operators, Complex coefficient) {
        Objects.requireNonNull(qubits);
        Objects.requireNonNull(operators);
        Objects.requireNonNull(coefficient);
        if (!PauliOperator.isValid(operators)) {
            throw new InvalidOperatorException(operators);
        }
        if (qubits.size() != operators.length()) {
            throw new IllegalArgumentException(String.format("%d qubits given for %d operators \"%s\"",
                                                             qubits.size(), operators.length(), operators));
        }
        if (ComplexUtil.isZero(coefficient)) {
            return ZERO;
        }

        var factors = new ArrayList<Factor>(qubits.size());
        for (int i = 0; i < operators.length(); i++) {
            var op = PauliOperator.of(operators.charAt(i));
            if (op != PauliOperator.I) {
                factors.add(new Factor(QubitOrder.checkQubit(qubits.get(i)), op));
            }
        }
        factors.sort(null);
        for (int i = 1; i < factors.size(); i++) {
            if (factors.get(i - 1).qubit().equals(factors.get(i).qubit())) {
                throw new IllegalArgumentException("qubit " + factors.get(i).qubit() + " appears more than once in " + operators);
            }
        }
        return new Pauli(List.of(new PauliTerm(List.copyOf(factors), coefficient)));
    }

    public static Pauli term(List<?> qubits, String operators, double coefficient) {
        return term(qubits, operators, new Complex(coefficient));
    }

    public static Pauli term(List<?> qubits, String operators) {
        return term(qubits, operators, Complex.ONE);
    }

    /**
     * A single Pauli operator on one qubit. {@code 'I'} gives a scalar, whatever the qubit.
     */
    public static Pauli sigma(Object qubit, char operator, Complex coefficient) {
        if (operator == 'I') {
            return scalar(coefficient);
        }
        return term(List.of(qubit), String.valueOf(operator), coefficient);
    }

    public static Pauli sigma(Object qubit, char operator) {
        return sigma(qubit, operator, Complex.ONE);
    }

    /**
     * @return {@code coefficient} times the identity element
     */
    public static Pauli scalar(Complex coefficient) {
        return term(List.of(), "", coefficient);
    }

    public static Pauli scalar(double coefficient) {
        return scalar(new Complex(coefficient));
    }

    /**
     * @return the identity element of the Pauli algebra
     */
    public static Pauli identity() {
        return IDENTITY;
    }

    /**
     * @return the zero element of the Pauli algebra
     */
    public static Pauli zero() {
        return ZERO;
    }

    /**
     * @return the element consisting of the single term {@code term}
     */
    public static Pauli of(PauliTerm term) {
        return ComplexUtil.isZero(term.coefficient()) ? ZERO : new Pauli(List.of(term));
    }

    public static Pauli sX(Object qubit) {
        return sigma(qubit, 'X');
    }

    public static Pauli sX(Object qubit, Complex coefficient) {
        return sigma(qubit, 'X', coefficient);
    }

    public static Pauli sX(Object qubit, double coefficient) {
        return sigma(qubit, 'X', new Complex(coefficient));
    }

    public static Pauli sY(Object qubit) {
        return sigma(qubit, 'Y');
    }

    public static Pauli sY(Object qubit, Complex coefficient) {
        return sigma(qubit, 'Y', coefficient);
    }

    public static Pauli sY(Object qubit, double coefficient) {
        return sigma(qubit, 'Y', new Complex(coefficient));
    }

    public static Pauli sZ(Object qubit) {
        return sigma(qubit, 'Z');
    }

    public static Pauli sZ(Object qubit, Complex coefficient) {
        return sigma(qubit, 'Z', coefficient);
    }

    public static Pauli sZ(Object qubit, double coefficient) {
        return sigma(qubit, 'Z', new Complex(coefficient));
    }

    /**
     * The identity operator. The qubit is irrelevant but kept for symmetry with {@link #sX}.
     */
    public static Pauli sI(Object qubit) {
        return sigma(qubit, 'I');
    }

    public static Pauli sI(Object qubit, Complex coefficient) {
        return sigma(qubit, 'I', coefficient);
    }

    /**
     * @return the terms, in canonical order
     */
    public List<PauliTerm> terms() {
        return terms;
    }

    /**
     * @return the number of terms
     */
    public int size() {
        return terms.size();
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    /**
     * @return true if this is the identity, allowing for rounding in the coefficient
     */
    public boolean isIdentity() {
        return terms.size() == 1 && terms.get(0).isScalar() && ComplexUtil.isClose(terms.get(0).coefficient(), Complex.ONE);
    }

    /**
     * @return true if this is a multiple of the identity (zero included)
     */
    public boolean isScalar() {
        return terms.isEmpty() || (terms.size() == 1 && terms.get(0).isScalar());
    }

    /**
     * @return the qubits acted on by any term, in canonical order
     */
    @Override
    public List<Object> qubits() {
        var qubits = new TreeSet<Object>(QubitOrder.INSTANCE);
        for (PauliTerm term : terms) {
            for (Factor f : term.factors()) {
                qubits.add(f.qubit());
            }
        }
        return new ArrayList<>(qubits);
    }

    @Override
    public Iterator<PauliTerm> iterator() {
        return terms.iterator();
    }

    public Pauli add(Pauli other) {
        return Paulis.sum(this, other);
    }

    public Pauli add(Complex scalar) {
        return Paulis.sum(this, scalar(scalar));
    }

    public Pauli add(double scalar) {
        return add(new Complex(scalar));
    }

    public Pauli subtract(Pauli other) {
        return Paulis.sum(this, other.multiply(-1.0));
    }

    public Pauli multiply(Pauli other) {
        return Paulis.product(this, other);
    }

    public Pauli multiply(Complex scalar) {
        return Paulis.product(this, scalar(scalar));
    }

    public Pauli multiply(double scalar) {
        return multiply(new Complex(scalar));
    }

    public Pauli negate() {
        return multiply(-1.0);
    }

    public Pauli pow(int exponent) {
        return Paulis.pow(this, exponent);
    }

    public boolean commutesWith(Pauli other) {
        return PauliCommutation.commute(this, other);
    }

    /**
     * Applies this element to {@code state} as the linear map sum_k c_k P_k. The result is not
     * normalized.
     */
    @Override
    public State run(State state) {
        State out = state.scale(Complex.ZERO);
        for (PauliTerm term : terms) {
            State res = state.scale(term.coefficient());
            for (Factor f : term.factors()) {
                res = res.apply(gateFor(f));
            }
            out = out.add(res);
        }
        return out;
    }

    private static Gate gateFor(Factor factor) {
        switch (factor.operator()) {
            case X:
                return Gates.x(factor.qubit());
            case Y:
                return Gates.y(factor.qubit());
            case Z:
                return Gates.z(factor.qubit());
            default:
                throw new AssertionError(factor);
        }
    }

    /**
     * Compares term by term; an element whose terms are a prefix of the other's sorts first.
     */
    @Override
    public int compareTo(Pauli other) {
        int n = Math.min(terms.size(), other.terms.size());
        for (int i = 0; i < n; i++) {
            int c = terms.get(i).compareTo(other.terms.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(terms.size(), other.terms.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Pauli && terms.equals(((Pauli) o).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        var sb = new StringBuilder();
        for (PauliTerm term : terms) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(term);
        }
        return sb.toString();
    }
}
