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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Canonical total order over qubit labels.
 * <p>
 * A qubit label is any non-null {@link Comparable} value, typically an {@code Integer} or a
 * {@code String}. Labels of different classes may be mixed in one term, so labels are ordered
 * first by the name of their runtime class and then by natural order within a class. Under this
 * order every integer label sorts before every string label.
 */
public final class QubitOrder implements Comparator<Object> {
    /** The single instance. */
    public static final QubitOrder INSTANCE = new QubitOrder();

    private QubitOrder() {
    }

    @Override
    @SuppressWarnings("unchecked")
    public int compare(Object a, Object b) {
        if (a == b) {
            return 0;
        }
        int byClass = a.getClass().getName().compareTo(b.getClass().getName());
        if (byClass != 0) {
            return byClass;
        }
        return ((Comparable<Object>) a).compareTo(b);
    }

    /**
     * Checks that {@code qubit} can be used as a qubit label.
     *
     * @param qubit the candidate label
     * @return the label itself
     * @throws IllegalArgumentException if the label is null or not {@link Comparable}
     */
    public static Object checkQubit(Object qubit) {
        if (qubit == null) {
            throw new IllegalArgumentException("qubit labels must not be null");
        }
        if (!(qubit instanceof Comparable)) {
            throw new IllegalArgumentException("qubit labels must be Comparable, got " + qubit.getClass().getName());
        }
        return qubit;
    }

    /**
     * Returns the distinct labels of {@code qubits} in canonical order.
     */
    public static List<Object> sorted(Collection<?> qubits) {
        Objects.requireNonNull(qubits);
        var set = new TreeSet<Object>(INSTANCE);
        for (Object q : qubits) {
            set.add(checkQubit(q));
        }
        return new ArrayList<>(set);
    }
}
