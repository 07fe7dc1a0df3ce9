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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestPauliSum extends RandomizedTest {
    @Test
    public void testMergesLikeTerms() {
        var sum = Paulis.sum(Pauli.sX(0, 0.5), Pauli.sZ(1), Pauli.sX(0, 0.25));
        assertEquals(2, sum.size());
        assertEquals(Pauli.sX(0, 0.75).add(Pauli.sZ(1)), sum);
    }

    @Test
    public void testDisjointUnion() {
        var a = Pauli.sX(0).add(Pauli.sY(1));
        var b = Pauli.term(List.of(0, 1), "ZZ", 2);
        var sum = a.add(b);
        assertEquals(3, sum.size());
        for (PauliTerm t : a) {
            assertTrue(sum.terms().contains(t));
        }
        for (PauliTerm t : b) {
            assertTrue(sum.terms().contains(t));
        }
    }

    @Test
    public void testCancellation() {
        for (int trial = 0; trial < 50; trial++) {
            var p = randomPauli(getRandom(), qubits(3), 6);
            assertEquals(Pauli.zero(), p.add(p.multiply(-1)));
            assertEquals(Pauli.zero(), p.subtract(p));
            assertEquals(Pauli.zero(), p.add(p.negate()));
        }
    }

    @Test
    public void testEmptySum() {
        assertEquals(Pauli.zero(), Paulis.sum());
        assertEquals(Pauli.zero(), Paulis.sum(List.of()));
        var p = Pauli.sY(4);
        assertEquals(p, Paulis.sum(p));
        assertEquals(p, p.add(Pauli.zero()));
    }

    @Test
    public void testScalarAddition() {
        var p = Pauli.sX(0).add(2.0);
        assertEquals(Paulis.sum(Pauli.scalar(2), Pauli.sX(0)), p);
        assertEquals(Pauli.sX(0), p.add(-2.0));
        assertEquals(Pauli.sX(0).add(Pauli.scalar(Complex.I)), Pauli.sX(0).add(Complex.I));
    }

    @Test
    public void testCommutativeAndAssociative() {
        for (int trial = 0; trial < 50; trial++) {
            var a = randomPauli(getRandom(), qubits(3), 5);
            var b = randomPauli(getRandom(), qubits(3), 5);
            var c = randomPauli(getRandom(), qubits(3), 5);
            assertTrue(Paulis.close(a.add(b), b.add(a)));
            assertTrue(Paulis.close(a.add(b).add(c), a.add(b.add(c))));
            assertTrue(Paulis.close(Paulis.sum(a, b, c), Paulis.sum(c, a, b)));
        }
    }

    @Test
    public void testClose() {
        var a = Pauli.sX(0).add(Pauli.sZ(1));
        assertTrue(Paulis.close(a, a));
        // squared distance 1e-8
        assertTrue(Paulis.close(a, a.add(Pauli.sY(2, 1e-4))));
        // squared distance 1e-4
        assertFalse(Paulis.close(a, a.add(Pauli.sY(2, 1e-2))));
        assertTrue(Paulis.close(a, a.add(Pauli.sY(2, 1e-2)), 1e-3));
        assertFalse(Paulis.close(a, Pauli.sX(0)));
        assertTrue(Paulis.close(Pauli.zero(), Pauli.zero()));
    }
}
