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

import io.github.jpauli.math.ComplexUtil;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.MatrixUtils;

import java.util.List;

/**
 * Rotation about the Z axis, RZ(theta) = exp(-i theta Z / 2) = diag(e^(-i theta/2), e^(i theta/2)).
 */
public final class RzGate extends Gate {
    private final double theta;

    RzGate(double theta, Object qubit) {
        super("RZ", List.of(qubit));
        if (!Double.isFinite(theta)) {
            throw new IllegalArgumentException("rotation angle must be finite, got " + theta);
        }
        this.theta = theta;
    }

    public double theta() {
        return theta;
    }

    @Override
    public List<Double> params() {
        return List.of(theta);
    }

    @Override
    public FieldMatrix<Complex> matrix() {
        return MatrixUtils.createFieldMatrix(new Complex[][] {
                {ComplexUtil.expI(-theta / 2), Complex.ZERO},
                {Complex.ZERO, ComplexUtil.expI(theta / 2)}});
    }

    @Override
    public RzGate adjoint() {
        return new RzGate(-theta, qubits().get(0));
    }
}
