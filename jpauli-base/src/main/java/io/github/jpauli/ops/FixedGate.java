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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.MatrixUtils;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static io.github.jpauli.math.ComplexUtil.MINUS_I;
import static org.apache.commons.math3.complex.Complex.I;
import static org.apache.commons.math3.complex.Complex.ONE;
import static org.apache.commons.math3.complex.Complex.ZERO;

/**
 * A gate without parameters.
 */
public final class FixedGate extends Gate {
    /**
     * The available parameter-free gates.
     */
    public enum Kind {
        I(1), X(1), Y(1), Z(1),
        /** Square root of X; RX(pi/2) up to a global phase. */
        V(1),
        V_H(1),
        /** Square root of Y; RY(pi/2) up to a global phase. */
        SQRT_Y(1),
        SQRT_Y_H(1),
        /** Controlled NOT; the first qubit is the control. */
        CNOT(2),
        SWAP(2);

        private final int arity;

        Kind(int arity) {
            this.arity = arity;
        }

        public int arity() {
            return arity;
        }

        public Kind adjoint() {
            switch (this) {
                case V:
                    return V_H;
                case V_H:
                    return V;
                case SQRT_Y:
                    return SQRT_Y_H;
                case SQRT_Y_H:
                    return SQRT_Y;
                default:
                    return this;
            }
        }
    }

    private static final Map<Kind, Complex[][]> MATRICES = new EnumMap<>(Kind.class);

    static {
        Complex half = new Complex(0.5);
        Complex p = ONE.add(I).multiply(half);    // (1+i)/2
        Complex m = ONE.subtract(I).multiply(half);  // (1-i)/2

        MATRICES.put(Kind.I, new Complex[][] {{ONE, ZERO}, {ZERO, ONE}});
        MATRICES.put(Kind.X, new Complex[][] {{ZERO, ONE}, {ONE, ZERO}});
        MATRICES.put(Kind.Y, new Complex[][] {{ZERO, MINUS_I}, {I, ZERO}});
        MATRICES.put(Kind.Z, new Complex[][] {{ONE, ZERO}, {ZERO, ONE.negate()}});
        MATRICES.put(Kind.V, new Complex[][] {{p, m}, {m, p}});
        MATRICES.put(Kind.V_H, new Complex[][] {{m, p}, {p, m}});
        MATRICES.put(Kind.SQRT_Y, new Complex[][] {{p, p.negate()}, {p, p}});
        MATRICES.put(Kind.SQRT_Y_H, new Complex[][] {{m, m}, {m.negate(), m}});
        MATRICES.put(Kind.CNOT, new Complex[][] {
                {ONE, ZERO, ZERO, ZERO},
                {ZERO, ONE, ZERO, ZERO},
                {ZERO, ZERO, ZERO, ONE},
                {ZERO, ZERO, ONE, ZERO}});
        MATRICES.put(Kind.SWAP, new Complex[][] {
                {ONE, ZERO, ZERO, ZERO},
                {ZERO, ZERO, ONE, ZERO},
                {ZERO, ONE, ZERO, ZERO},
                {ZERO, ZERO, ZERO, ONE}});
    }

    private final Kind kind;

    FixedGate(Kind kind, List<?> qubits) {
        super(kind.name(), qubits);
        if (qubits.size() != kind.arity()) {
            throw new IllegalArgumentException(kind + " acts on " + kind.arity() + " qubits, got " + qubits);
        }
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public FieldMatrix<Complex> matrix() {
        return MatrixUtils.createFieldMatrix(MATRICES.get(kind));
    }

    @Override
    public FixedGate adjoint() {
        Kind adjoint = kind.adjoint();
        return adjoint == kind ? this : new FixedGate(adjoint, qubits());
    }
}
