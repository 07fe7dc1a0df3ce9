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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.jpauli.TestUtil;
import io.github.jpauli.state.State;
import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

import java.util.List;

import static io.github.jpauli.TestUtil.qubits;
import static io.github.jpauli.TestUtil.randomPauli;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestPauliRun extends RandomizedTest {
    private final List<Object> one = List.<Object>of(0);

    @Test
    public void testSingleQubitActions() {
        var ground = State.basis(one, 0);
        var excited = State.basis(one, 1);
        assertTrue(Pauli.sX(0).run(ground).isClose(excited));
        assertTrue(Pauli.sY(0).run(ground).isClose(excited.scale(Complex.I)));
        assertTrue(Pauli.sZ(0).run(excited).isClose(excited.scale(new Complex(-1))));
        assertTrue(Pauli.identity().run(excited).isClose(excited));
        assertTrue(Pauli.zero().run(excited).isClose(State.basis(one, 0).scale(Complex.ZERO)));
    }

    @Test
    public void testLinearCombination() {
        // (X0 + 2 Z1)|01> = |11> - 2|01>
        var qubits = List.<Object>of(0, 1);
        var h = Pauli.sX(0).add(Pauli.sZ(1, 2));
        var out = h.run(State.basis(qubits, 0, 1));
        assertTrue(out.isClose(State.basis(qubits, 1, 1).add(State.basis(qubits, 0, 1).scale(new Complex(-2)))));
    }

    @Test
    public void testProductIsComposition() {
        for (int trial = 0; trial < 20; trial++) {
            var a = randomPauli(getRandom(), qubits(3), 3);
            var b = randomPauli(getRandom(), qubits(3), 3);
            var psi = TestUtil.randomState(getRandom(), qubits(3));
            assertTrue(a.multiply(b).run(psi).isClose(a.run(b.run(psi)), 1e-9));
        }
    }

    @Test
    public void testUnknownQubit() {
        assertThrows(IllegalArgumentException.class, () -> Pauli.sX(5).run(State.zeros(one)));
        assertEquals(List.of(0, 2), Pauli.sX(2).add(Pauli.sZ(0)).qubits());
    }
}
