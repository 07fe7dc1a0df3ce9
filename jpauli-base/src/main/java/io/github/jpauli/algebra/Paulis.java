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
import io.github.jpauli.exceptions.InvalidExponentException;
import io.github.jpauli.math.ComplexUtil;
import io.github.jpauli.util.JPauliProperties;
import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sum, product, power and closeness over elements of the Pauli algebra.
 * <p>
 * All operations take canonical {@link Pauli} values and return new canonical values.
 */
public final class Paulis {
    /** Private constructor to prevent instantiation. */
    private Paulis() {
    }

    /**
     * Returns the sum of the given elements. Terms with equal factor sequences are merged by
     * adding their coefficients, and merged terms that cancel to within tolerance are dropped.
     */
    public static Pauli sum(Pauli... elements) {
        return sum(Arrays.asList(elements));
    }

    /**
     * Returns the sum of the given elements; the empty sum is {@link Pauli#zero()}.
     */
    public static Pauli sum(Iterable<Pauli> elements) {
        var merged = new TreeMap<List<Factor>, Complex>(PauliTerm.FACTOR_ORDER);
        for (Pauli element : elements) {
            for (PauliTerm term : element) {
                merged.merge(term.factors(), term.coefficient(), Complex::add);
            }
        }
        return fromMerged(merged);
    }

    private static Pauli fromMerged(Map<List<Factor>, Complex> merged) {
        var terms = new ArrayList<PauliTerm>(merged.size());
        for (var e : merged.entrySet()) {
            if (!ComplexUtil.isZero(e.getValue())) {
                terms.add(new PauliTerm(e.getKey(), e.getValue()));
            }
        }
        return terms.isEmpty() ? Pauli.zero() : new Pauli(Collections.unmodifiableList(terms));
    }

    /**
     * Returns the product of the given elements, in order.
     * <p>
     * Every combination of one term per operand is multiplied out: coefficients are multiplied,
     * and the operators acting on each qubit are folded left to right with the single-qubit
     * product rule of {@link PauliOperator}, accumulating its phase. The resulting terms are
     * then summed. The empty product is {@link Pauli#identity()}.
     */
    public static Pauli product(Pauli... elements) {
        return product(Arrays.asList(elements));
    }

    public static Pauli product(List<Pauli> elements) {
        if (elements.isEmpty()) {
            return Pauli.identity();
        }
        for (Pauli element : elements) {
            if (element.isZero()) {
                return Pauli.zero();
            }
        }

        var merged = new TreeMap<List<Factor>, Complex>(PauliTerm.FACTOR_ORDER);
        int n = elements.size();
        int[] index = new int[n];
        while (true) {
            PauliTerm term = multiplyTerms(elements, index);
            merged.merge(term.factors(), term.coefficient(), Complex::add);

            // advance the rightmost operand fastest
            int k = n - 1;
            while (k >= 0 && ++index[k] == elements.get(k).size()) {
                index[k] = 0;
                k--;
            }
            if (k < 0) {
                break;
            }
        }
        return fromMerged(merged);
    }

    private static PauliTerm multiplyTerms(List<Pauli> elements, int[] index) {
        Complex coefficient = Complex.ONE;
        var folded = new TreeMap<Object, PauliOperator>(QubitOrder.INSTANCE);
        for (int k = 0; k < index.length; k++) {
            PauliTerm term = elements.get(k).terms().get(index[k]);
            coefficient = coefficient.multiply(term.coefficient());
            for (Factor f : term.factors()) {
                PauliOperator left = folded.get(f.qubit());
                if (left == null) {
                    folded.put(f.qubit(), f.operator());
                } else {
                    coefficient = coefficient.multiply(left.phaseTimes(f.operator()));
                    folded.put(f.qubit(), left.times(f.operator()));
                }
            }
        }

        var factors = new ArrayList<Factor>(folded.size());
        for (var e : folded.entrySet()) {
            if (e.getValue() != PauliOperator.I) {
                factors.add(new Factor(e.getKey(), e.getValue()));
            }
        }
        return new PauliTerm(Collections.unmodifiableList(factors), coefficient);
    }

    /**
     * Raises {@code pauli} to a non-negative integer power by repeated squaring.
     *
     * @throws InvalidExponentException if {@code exponent} is negative
     */
    public static Pauli pow(Pauli pauli, int exponent) {
        if (exponent < 0) {
            throw new InvalidExponentException(exponent);
        }
        if (exponent == 0) {
            return Pauli.identity();
        }
        if (exponent == 1) {
            return pauli;
        }

        Pauli y = Pauli.identity();
        Pauli x = pauli;
        int n = exponent;
        while (n > 1) {
            if (n % 2 == 0) {
                x = product(x, x);
                n = n / 2;
            } else {
                y = product(x, y);
                x = product(x, x);
                n = (n - 1) / 2;
            }
        }
        return product(x, y);
    }

    /**
     * As {@link #pow(Pauli, int)}, for exponents that arrive as floating point values.
     *
     * @throws InvalidExponentException if {@code exponent} is negative, not integral, or too large
     */
    public static Pauli pow(Pauli pauli, double exponent) {
        if (!(exponent >= 0) || exponent != Math.rint(exponent) || exponent > Integer.MAX_VALUE) {
            throw new InvalidExponentException(exponent);
        }
        return pow(pauli, (int) exponent);
    }

    /**
     * @return true if the squared coefficients of {@code a - b} sum to at most {@code tolerance}
     */
    public static boolean close(Pauli a, Pauli b, double tolerance) {
        double d = 0;
        for (PauliTerm term : a.subtract(b)) {
            d += ComplexUtil.absSquared(term.coefficient());
        }
        return d <= tolerance;
    }

    /**
     * {@link #close(Pauli, Pauli, double)} with the configured tolerance.
     */
    public static boolean close(Pauli a, Pauli b) {
        return close(a, b, JPauliProperties.TOLERANCE);
    }
}
