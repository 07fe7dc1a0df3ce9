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
import org.junit.Test;

import java.util.List;

import static io.github.jpauli.TestUtil.qubits;
import static io.github.jpauli.TestUtil.randomPauli;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestPauliCommutation extends RandomizedTest {
    @Test
    public void testKnownPairs() {
        assertFalse(Pauli.sX(0).commutesWith(Pauli.sZ(0)));
        assertTrue(Pauli.sX(0).commutesWith(Pauli.sX(1)));
        assertTrue(Pauli.sZ(0).commutesWith(Pauli.sZ(0).multiply(Pauli.sZ(1))));
        assertTrue(Pauli.term(List.of(0, 1), "XX").commutesWith(Pauli.term(List.of(0, 1), "ZZ")));
        assertFalse(Pauli.term(List.of(0, 1), "XY").commutesWith(Pauli.term(List.of(1, 2), "ZZ")));
        assertTrue(Pauli.identity().commutesWith(Pauli.sY(3)));
        assertTrue(Pauli.zero().commutesWith(Pauli.sY(3)));
    }

    @Test
    public void testAgreesWithProducts() {
        for (int trial = 0; trial < 100; trial++) {
            var a = randomPauli(getRandom(), qubits(3), 3);
            var b = randomPauli(getRandom(), qubits(3), 3);
            boolean commute = PauliCommutation.commute(a, b);
            assertEquals(commute, PauliCommutation.commute(b, a));
            if (commute) {
                assertTrue(Paulis.close(a.multiply(b), b.multiply(a)));
            }
            for (PauliTerm ta : a) {
                for (PauliTerm tb : b) {
                    var pa = Pauli.term(ta.qubits(), ta.operators());
                    var pb = Pauli.term(tb.qubits(), tb.operators());
                    assertEquals(PauliCommutation.termsCommute(ta, tb),
                                 Paulis.close(pa.multiply(pb), pb.multiply(pa)));
                }
            }
        }
    }

    @Test
    public void testGreedyPartition() {
        var h = Pauli.sX(0).add(Pauli.sZ(0)).add(Pauli.sX(1));
        var sets = PauliCommutation.commutingSets(h);
        assertEquals(List.of(Pauli.sX(0).add(Pauli.sX(1)), Pauli.sZ(0)), sets);
    }

    @Test
    public void testTrivialPartitions() {
        assertEquals(List.of(Pauli.zero()), PauliCommutation.commutingSets(Pauli.zero()));
        var single = Pauli.sY(2, 0.5);
        assertEquals(List.of(single), PauliCommutation.commutingSets(single));
    }

    @Test
    public void testPartitionInvariants() {
        for (int trial = 0; trial < 50; trial++) {
            var h = randomPauli(getRandom(), qubits(4), 8);
            var sets = PauliCommutation.commutingSets(h);
            for (Pauli set : sets) {
                assertTrue(PauliCommutation.commute(set, set));
            }
            assertEquals(h, Paulis.sum(sets));
        }
    }
}
