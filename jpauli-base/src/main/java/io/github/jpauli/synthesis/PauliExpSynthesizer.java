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

package io.github.jpauli.synthesis;

import io.github.jpauli.algebra.Pauli;
import io.github.jpauli.algebra.PauliTerm;
import io.github.jpauli.algebra.PauliTerm.Factor;
import io.github.jpauli.annotations.VisibleForTesting;
import io.github.jpauli.exceptions.NonHermitianTermException;
import io.github.jpauli.graph.QubitGraph;
import io.github.jpauli.graph.QubitTopology;
import io.github.jpauli.math.ComplexUtil;
import io.github.jpauli.ops.Circuit;
import io.github.jpauli.ops.Gates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

import static io.github.jpauli.util.JPauliProperties.SYNTHESIS_TRACE;

/**
 * Builds circuits implementing exp(-i * alpha * H) for a Hermitian Pauli element H.
 * <p>
 * Each term c * P contributes an independent block: a change of basis taking every factor of P
 * to Z, a ladder of CNOTs (or SWAPs, through qubits P does not act on) that gathers the parity
 * of the active qubits onto the root of a connectivity tree, RZ(2 * c * alpha) on that root, and
 * the ladder and basis change undone. The blocks are exact for commuting terms; for
 * non-commuting terms the result is one first-order product-formula step.
 * <p>
 * When a topology is given, every two-qubit gate acts on one of its edges.
 */
public final class PauliExpSynthesizer {
    private static final Logger LOG = LoggerFactory.getLogger(PauliExpSynthesizer.class);

    private PauliExpSynthesizer() {
    }

    /**
     * @return a circuit for exp(-i * alpha * H) whose entangling gates form a chain over each
     * term's qubits in canonical order
     */
    public static Circuit circuit(Pauli hamiltonian, double alpha) {
        return synthesize(hamiltonian, alpha, null);
    }

    /**
     * @return a circuit for exp(-i * alpha * H) whose two-qubit gates all lie on edges of
     * {@code topology}
     * @throws IllegalArgumentException if a term acts on qubits the topology lacks or does not connect
     */
    public static Circuit circuit(Pauli hamiltonian, double alpha, QubitGraph topology) {
        return synthesize(hamiltonian, alpha, Objects.requireNonNull(topology));
    }

    private static Circuit synthesize(Pauli hamiltonian, double alpha, QubitGraph topology) {
        Objects.requireNonNull(hamiltonian);
        if (!Double.isFinite(alpha)) {
            throw new IllegalArgumentException("alpha must be finite, got " + alpha);
        }
        if (hamiltonian.isZero() || hamiltonian.isIdentity()) {
            return Circuit.empty();
        }

        var builder = Circuit.builder();
        for (PauliTerm term : hamiltonian) {
            if (!ComplexUtil.isReal(term.coefficient())) {
                throw new NonHermitianTermException(term.toString());
            }
            if (term.isScalar()) {
                // global phase
                continue;
            }
            Circuit block = termCircuit(term, term.coefficient().getReal() * alpha, topology);
            if (SYNTHESIS_TRACE) {
                LOG.debug("{} -> {}", term, block);
            } else {
                LOG.trace("{} -> {}", term, block);
            }
            builder.add(block);
        }
        return builder.build();
    }

    /**
     * The block implementing exp(-i * theta * P) for the operator part P of {@code term}.
     */
    @VisibleForTesting
    static Circuit termCircuit(PauliTerm term, double theta, QubitGraph topology) {
        var basis = Circuit.builder();
        for (Factor f : term.factors()) {
            switch (f.operator()) {
                case X:
                    basis.add(Gates.sqrtYH(f.qubit()));
                    break;
                case Y:
                    basis.add(Gates.v(f.qubit()));
                    break;
                default:
                    break;
            }
        }
        Circuit basisChange = basis.build();

        QubitGraph tree = connectivityTree(term.qubits(), topology);
        List<Object> order = tree.topologicalSort();
        Object root = order.get(0);

        var active = new HashSet<Object>(term.qubits());
        var ladder = Circuit.builder();
        for (int i = order.size() - 1; i > 0; i--) {
            Object node = order.get(i);
            Object parent = tree.predecessors(node).get(0);
            if (active.contains(parent)) {
                ladder.add(Gates.cnot(node, parent));
            } else {
                ladder.add(Gates.swap(node, parent));
                active.add(parent);
            }
        }
        Circuit parity = ladder.build();

        Circuit block = basisChange
                .add(parity)
                .add(Gates.rz(2 * theta, root))
                .add(parity.adjoint())
                .add(basisChange.adjoint());
        LOG.debug("Term {} rooted at qubit {}: {} gates", term.operators(), root, block.size());
        return block;
    }

    /**
     * A rooted tree, directed away from its root, spanning {@code qubits} and possibly some
     * intermediate qubits of {@code topology}.
     */
    @VisibleForTesting
    static QubitGraph connectivityTree(List<Object> qubits, QubitGraph topology) {
        if (topology == null) {
            return QubitTopology.path(qubits, true);
        }
        QubitGraph tree = topology.steinerTree(qubits);
        if (tree.isDirected() && tree.isArborescence()) {
            return tree;
        }
        return tree.orientedFrom(tree.center().get(0));
    }
}
