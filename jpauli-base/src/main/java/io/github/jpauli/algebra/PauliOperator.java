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

import io.github.jpauli.exceptions.InvalidOperatorException;
import org.apache.commons.math3.complex.Complex;

import static io.github.jpauli.math.ComplexUtil.MINUS_I;

/**
 * The single-qubit Pauli operators, together with their multiplication table.
 * <p>
 * The product of two single-qubit Pauli operators is again a Pauli operator times a phase
 * drawn from {1, i, -i}; e.g. X·Y = iZ and Y·X = -iZ. The table is built once when the class
 * is initialized and never modified afterwards.
 */
public enum PauliOperator {
    /** Identity. Never stored in a {@link PauliTerm}. */
    I,
    X,
    Y,
    Z;

    private static final PauliOperator[][] PRODUCTS = new PauliOperator[4][4];
    private static final Complex[][] PHASES = new Complex[4][4];

    static {
        for (PauliOperator left : values()) {
            for (PauliOperator right : values()) {
                if (left == I) {
                    rule(left, right, right, Complex.ONE);
                } else if (right == I || left == right) {
                    rule(left, right, left == right ? I : left, Complex.ONE);
                }
            }
        }
        rule(X, Y, Z, Complex.I);
        rule(Y, X, Z, MINUS_I);
        rule(Y, Z, X, Complex.I);
        rule(Z, Y, X, MINUS_I);
        rule(Z, X, Y, Complex.I);
        rule(X, Z, Y, MINUS_I);
    }

    private static void rule(PauliOperator left, PauliOperator right, PauliOperator result, Complex phase) {
        PRODUCTS[left.ordinal()][right.ordinal()] = result;
        PHASES[left.ordinal()][right.ordinal()] = phase;
    }

    /**
     * @param symbol one of 'I', 'X', 'Y', 'Z'
     * @return the operator named by {@code symbol}
     * @throws InvalidOperatorException for any other symbol
     */
    public static PauliOperator of(char symbol) {
        switch (symbol) {
            case 'I':
                return I;
            case 'X':
                return X;
            case 'Y':
                return Y;
            case 'Z':
                return Z;
            default:
                throw new InvalidOperatorException(String.valueOf(symbol));
        }
    }

    /**
     * @return true if every character of {@code operators} names a Pauli operator
     */
    public static boolean isValid(String operators) {
        for (int i = 0; i < operators.length(); i++) {
            if ("IXYZ".indexOf(operators.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the one-letter name of this operator
     */
    public char symbol() {
        return name().charAt(0);
    }

    /**
     * The operator part of {@code this · right}.
     */
    public PauliOperator times(PauliOperator right) {
        return PRODUCTS[ordinal()][right.ordinal()];
    }

    /**
     * The phase of {@code this · right}, one of 1, i or -i.
     */
    public Complex phaseTimes(PauliOperator right) {
        return PHASES[ordinal()][right.ordinal()];
    }
}
