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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Commutation tests and commuting-set partitioning for the Pauli algebra.
 * <p>
 * Two Pauli terms anticommute locally on every qubit where both act with different operators.
 * The terms commute iff the number of such qubits is even (arXiv:1405.5749v2).
 */
public final class PauliCommutation {
    private static final Logger LOG = LoggerFactory.getLogger(PauliCommutation.class);

    /** Private constructor to prevent instantiation. */
    private PauliCommutation() {
    }

    /**
     * @return true if the operator parts of {@code a} and {@code b} commute
     */
    public static boolean termsCommute(PauliTerm a, PauliTerm b) {
        List<Factor> fa = a.factors();
        List<Factor> fb = b.factors();
        int nonSimilar = 0;
        int i = 0;
        int j = 0;
        while (i < fa.size() && j < fb.size()) {
            int c = QubitOrder.INSTANCE.compare(fa.get(i).qubit(), fb.get(j).qubit());
            if (c < 0) {
                i++;
            } else if (c > 0) {
                j++;
            } else {
                if (fa.get(i).operator() != fb.get(j).operator()) {
                    nonSimilar++;
                }
                i++;
                j++;
            }
        }
        return nonSimilar % 2 == 0;
    }

    /**
     * @return true if {@code a · b == b · a}, i.e. every term of {@code a} commutes with every
     * term of {@code b}
     */
    public static boolean commute(Pauli a, Pauli b) {
        for (PauliTerm ta : a) {
            for (PauliTerm tb : b) {
                if (!termsCommute(ta, tb)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Gathers the terms of {@code element} into sets of mutually commuting terms.
     * <p>
     * Terms are visited in canonical order, and each is added to the first set whose accumulated
     * sum it commutes with, or else starts a new set (Raeisi, Wiebe, Sanders, arXiv:1108.4318).
     * This first-fit pass does not attempt to minimize the number of sets, and the grouping
     * depends on term order.
     *
     * @return the commuting sets; their sum is {@code element}. An element with fewer than two
     * terms is returned as the only set.
     */
    public static List<Pauli> commutingSets(Pauli element) {
        if (element.size() < 2) {
            return List.of(element);
        }

        var groups = new ArrayList<Pauli>();
        for (PauliTerm term : element) {
            Pauli single = Pauli.of(term);
            boolean assigned = false;
            for (int i = 0; i < groups.size(); i++) {
                if (commute(groups.get(i), single)) {
                    groups.set(i, groups.get(i).add(single));
                    assigned = true;
                    break;
                }
            }
            if (!assigned) {
                groups.add(single);
            }
        }
        LOG.debug("Gathered {} terms into {} commuting sets", element.size(), groups.size());
        return Collections.unmodifiableList(groups);
    }
}
