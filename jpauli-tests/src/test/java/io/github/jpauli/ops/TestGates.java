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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.jpauli.TestUtil;
import io.github.jpauli.math.ComplexUtil;
import io.github.jpauli.state.State;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestGates extends RandomizedTest {
    private static final double EPS = 1e-12;

    private static void assertMatrixClose(FieldMatrix<Complex> expected, FieldMatrix<Complex> actual) {
        assertEquals(expected.getRowDimension(), actual.getRowDimension());
        for (int r = 0; r < expected.getRowDimension(); r++) {
            for (int c = 0; c < expected.getColumnDimension(); c++) {
                assertTrue(String.format("entry (%d, %d): expected %s, got %s", r, c, expected.getEntry(r, c), actual.getEntry(r, c)),
                           ComplexUtil.isClose(expected.getEntry(r, c), actual.getEntry(r, c), EPS));
            }
        }
    }

    private static List<Gate> allGates() {
        return List.of(Gates.i(0), Gates.x(0), Gates.y(0), Gates.z(0),
                       Gates.v(0), Gates.vH(0), Gates.sqrtY(0), Gates.sqrtYH(0),
                       Gates.rz(0.3, 0), Gates.rz(-2.5, 0),
                       Gates.cnot(0, 1), Gates.swap(0, 1));
    }

    @Test
    public void testBasisChangeIdentities() {
        var z = Gates.z(0).matrix();
        assertMatrixClose(Gates.x(0).matrix(), Gates.sqrtY(0).matrix().multiply(z).multiply(Gates.sqrtYH(0).matrix()));
        assertMatrixClose(Gates.y(0).matrix(), Gates.vH(0).matrix().multiply(z).multiply(Gates.v(0).matrix()));
    }

    @Test
    public void testSquareRoots() {
        assertMatrixClose(Gates.x(0).matrix(), Gates.v(0).matrix().multiply(Gates.v(0).matrix()));
        assertMatrixClose(Gates.y(0).matrix(), Gates.sqrtY(0).matrix().multiply(Gates.sqrtY(0).matrix()));
    }

    @Test
    public void testAdjointsInvert() {
        for (Gate g : allGates()) {
            var identity = Gates.i(0).matrix();
            if (g.qubitCount() == 2) {
                identity = Gates.cnot(0, 1).matrix().multiply(Gates.cnot(0, 1).matrix());
            }
            assertMatrixClose(identity, g.matrix().multiply(g.adjoint().matrix()));
            assertEquals(g, g.adjoint().adjoint());
            assertEquals(g.qubits(), g.adjoint().qubits());
        }
    }

    @Test
    public void testRz() {
        double theta = TestUtil.randomDouble(getRandom(), -Math.PI, Math.PI);
        var rz = Gates.rz(theta, "q");
        assertEquals(List.of(theta), rz.params());
        assertEquals(-theta, rz.adjoint().theta(), 0);
        var ground = State.basis(List.of("q"), 0);
        var excited = State.basis(List.of("q"), 1);
        assertTrue(rz.run(ground).isClose(ground.scale(ComplexUtil.expI(-theta / 2)), EPS));
        assertTrue(rz.run(excited).isClose(excited.scale(ComplexUtil.expI(theta / 2)), EPS));
        assertThrows(IllegalArgumentException.class, () -> Gates.rz(Double.NaN, 0));
    }

    @Test
    public void testTwoQubitGates() {
        var qubits = List.<Object>of(0, 1);
        assertTrue(Gates.cnot(0, 1).run(State.basis(qubits, 1, 0)).isClose(State.basis(qubits, 1, 1)));
        assertTrue(Gates.cnot(0, 1).run(State.basis(qubits, 0, 1)).isClose(State.basis(qubits, 0, 1)));
        assertTrue(Gates.cnot(1, 0).run(State.basis(qubits, 0, 1)).isClose(State.basis(qubits, 1, 1)));
        assertTrue(Gates.swap(0, 1).run(State.basis(qubits, 1, 0)).isClose(State.basis(qubits, 0, 1)));
        assertThrows(IllegalArgumentException.class, () -> Gates.cnot(0, 0));
    }

    @Test
    public void testEqualityAndNames() {
        assertEquals(Gates.cnot(0, 1), Gates.cnot(0, 1));
        assertNotEquals(Gates.cnot(0, 1), Gates.cnot(1, 0));
        assertNotEquals(Gates.rz(0.5, 0), Gates.rz(0.25, 0));
        assertNotEquals(Gates.v(0), Gates.vH(0));
        assertEquals("CNOT 0 1", Gates.cnot(0, 1).toString());
        assertEquals("RZ(0.5) 2", Gates.rz(0.5, 2).toString());
        assertEquals(FixedGate.Kind.SQRT_Y_H, Gates.sqrtY(0).adjoint().kind());
        assertSame(FixedGate.Kind.SWAP, Gates.swap(0, 1).adjoint().kind());
        assertTrue(Gates.x(0).params().isEmpty());
    }
}
