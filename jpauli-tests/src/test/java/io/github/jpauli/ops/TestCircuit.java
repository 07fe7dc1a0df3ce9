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
import io.github.jpauli.state.State;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestCircuit extends RandomizedTest {
    private Circuit randomCircuit(List<Object> qubits, int size) {
        var builder = Circuit.builder();
        for (int i = 0; i < size; i++) {
            Object a = qubits.get(randomIntBetween(0, qubits.size() - 1));
            Object b = qubits.get(randomIntBetween(0, qubits.size() - 1));
            switch (randomIntBetween(0, 5)) {
                case 0:
                    builder.add(Gates.v(a));
                    break;
                case 1:
                    builder.add(Gates.sqrtY(a));
                    break;
                case 2:
                    builder.add(Gates.rz(TestUtil.randomDouble(getRandom(), -3, 3), a));
                    break;
                case 3:
                    builder.add(Gates.y(a));
                    break;
                default:
                    builder.add(a.equals(b) ? Gates.x(a) : Gates.cnot(a, b));
                    break;
            }
        }
        return builder.build();
    }

    @Test
    public void testEmpty() {
        assertTrue(Circuit.empty().isEmpty());
        assertSame(Circuit.empty(), Circuit.of());
        assertSame(Circuit.empty(), Circuit.builder().build());
        var psi = TestUtil.randomState(getRandom(), TestUtil.qubits(2));
        assertTrue(Circuit.empty().run(psi).isClose(psi));
    }

    @Test
    public void testAppendIsImmutable() {
        var c = Circuit.of(Gates.x(0));
        var d = c.add(Gates.cnot(0, 1));
        assertEquals(1, c.size());
        assertEquals(2, d.size());
        assertEquals(Circuit.of(Gates.x(0), Gates.cnot(0, 1), Gates.x(0)), d.add(c));
        assertEquals(List.of(0, 1), d.qubits());
        assertEquals("Circuit[X 0; CNOT 0 1]", d.toString());
    }

    @Test
    public void testGatesApplyInOrder() {
        var qubits = List.<Object>of(0, 1);
        // X then CNOT flips both; CNOT then X flips only the control
        assertTrue(Circuit.of(Gates.x(0), Gates.cnot(0, 1)).run(State.zeros(qubits)).isClose(State.basis(qubits, 1, 1)));
        assertTrue(Circuit.of(Gates.cnot(0, 1), Gates.x(0)).run(State.zeros(qubits)).isClose(State.basis(qubits, 1, 0)));
    }

    @Test
    public void testAdjointUndoesCircuit() {
        var qubits = TestUtil.qubits(3);
        for (int trial = 0; trial < 20; trial++) {
            var circuit = randomCircuit(qubits, randomIntBetween(1, 20));
            var psi = TestUtil.randomState(getRandom(), qubits);
            assertTrue(circuit.add(circuit.adjoint()).run(psi).isClose(psi, 1e-9));
            assertEquals(circuit.size(), circuit.adjoint().size());

            var reversed = new ArrayList<Gate>();
            for (Gate g : circuit.adjoint()) {
                reversed.add(0, g.adjoint());
            }
            assertEquals(circuit.gates(), reversed);
        }
    }

    @Test
    public void testRunPreservesNorm() {
        var qubits = TestUtil.qubits(3);
        var circuit = randomCircuit(qubits, 30);
        var psi = TestUtil.randomState(getRandom(), qubits);
        assertEquals(1.0, psi.run(circuit).norm(), 1e-9);
    }
}
