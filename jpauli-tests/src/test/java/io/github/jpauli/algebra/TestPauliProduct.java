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
import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

import java.util.List;

import static io.github.jpauli.TestUtil.qubits;
import static io.github.jpauli.TestUtil.randomPauli;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestPauliProduct extends RandomizedTest {
    private static final Complex MINUS_I = new Complex(0, -1);

    @Test
    public void testSingleQubitRules() {
        for (Object q : List.of(0, "a")) {
            assertEquals(Pauli.identity(), Pauli.sX(q).multiply(Pauli.sX(q)));
            assertEquals(Pauli.identity(), Pauli.sY(q).multiply(Pauli.sY(q)));
            assertEquals(Pauli.identity(), Pauli.sZ(q).multiply(Pauli.sZ(q)));

            assertEquals(Pauli.sZ(q, Complex.I), Pauli.sX(q).multiply(Pauli.sY(q)));
            assertEquals(Pauli.sZ(q, MINUS_I), Pauli.sY(q).multiply(Pauli.sX(q)));
            assertEquals(Pauli.sX(q, Complex.I), Pauli.sY(q).multiply(Pauli.sZ(q)));
            assertEquals(Pauli.sX(q, MINUS_I), Pauli.sZ(q).multiply(Pauli.sY(q)));
            assertEquals(Pauli.sY(q, Complex.I), Pauli.sZ(q).multiply(Pauli.sX(q)));
            assertEquals(Pauli.sY(q, MINUS_I), Pauli.sX(q).multiply(Pauli.sZ(q)));
        }
    }

    @Test
    public void testOperatorTable() {
        for (PauliOperator op : PauliOperator.values()) {
            assertEquals(op, PauliOperator.I.times(op));
            assertEquals(op, op.times(PauliOperator.I));
            assertEquals(PauliOperator.I, op.times(op));
            assertEquals(Complex.ONE, op.phaseTimes(op));
        }
    }

    @Test
    public void testDifferentQubitsDoNotInteract() {
        var p = Pauli.sX(0, 2).multiply(Pauli.sZ(1, 3));
        assertEquals(Pauli.term(List.of(0, 1), "XZ", 6), p);
        assertEquals(p, Pauli.sZ(1, 3).multiply(Pauli.sX(0, 2)));
    }

    @Test
    public void testMultiTermExpansion() {
        // (X0 + Z0)(X0 - Z0) = I - XZ + ZX - I = 2 i Y0
        var a = Pauli.sX(0).add(Pauli.sZ(0));
        var b = Pauli.sX(0).subtract(Pauli.sZ(0));
        assertEquals(Pauli.sY(0, new Complex(0, 2)), a.multiply(b));

        // (X0 + Z1)^2 = 2 I + 2 X0 Z1
        var c = Pauli.sX(0).add(Pauli.sZ(1));
        assertEquals(Pauli.scalar(2).add(Pauli.term(List.of(0, 1), "XZ", 2)), c.multiply(c));
    }

    @Test
    public void testZeroAndIdentity() {
        var p = Pauli.sX(0).add(Pauli.sY(1, 0.5));
        assertEquals(Pauli.zero(), p.multiply(Pauli.zero()));
        assertEquals(Pauli.zero(), Paulis.product(Pauli.zero(), p, p));
        assertEquals(p, p.multiply(Pauli.identity()));
        assertEquals(p, Pauli.identity().multiply(p));
        assertEquals(Pauli.identity(), Paulis.product());
        assertEquals(Pauli.identity(), Paulis.product(List.of()));
        assertEquals(p, Paulis.product(p));
    }

    @Test
    public void testScalarMultiplication() {
        var p = Pauli.sX(0).add(Pauli.sY(1));
        assertEquals(Pauli.sX(0, 2).add(Pauli.sY(1, 2)), p.multiply(2));
        assertEquals(Pauli.sX(0, Complex.I).add(Pauli.sY(1, Complex.I)), p.multiply(Complex.I));
        assertEquals(Pauli.zero(), p.multiply(0));
    }

    @Test
    public void testAssociative() {
        for (int trial = 0; trial < 30; trial++) {
            var a = randomPauli(getRandom(), qubits(3), 4);
            var b = randomPauli(getRandom(), qubits(3), 4);
            var c = randomPauli(getRandom(), qubits(3), 4);
            var left = a.multiply(b).multiply(c);
            var right = a.multiply(b.multiply(c));
            assertTrue(left + " vs " + right, Paulis.close(left, right));
            assertTrue(Paulis.close(left, Paulis.product(a, b, c)));
        }
    }

    @Test
    public void testDistributive() {
        for (int trial = 0; trial < 30; trial++) {
            var a = randomPauli(getRandom(), qubits(2), 4);
            var b = randomPauli(getRandom(), qubits(2), 4);
            var c = randomPauli(getRandom(), qubits(2), 4);
            assertTrue(Paulis.close(a.multiply(b.add(c)), a.multiply(b).add(a.multiply(c))));
        }
    }
}
