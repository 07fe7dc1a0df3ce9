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

import java.util.List;

/**
 * Factory methods for the gates used by jpauli.
 */
public final class Gates {
    /** Private constructor to prevent instantiation. */
    private Gates() {
    }

    public static FixedGate i(Object q0) {
        return new FixedGate(FixedGate.Kind.I, List.of(q0));
    }

    public static FixedGate x(Object q0) {
        return new FixedGate(FixedGate.Kind.X, List.of(q0));
    }

    public static FixedGate y(Object q0) {
        return new FixedGate(FixedGate.Kind.Y, List.of(q0));
    }

    public static FixedGate z(Object q0) {
        return new FixedGate(FixedGate.Kind.Z, List.of(q0));
    }

    /** Square root of X. */
    public static FixedGate v(Object q0) {
        return new FixedGate(FixedGate.Kind.V, List.of(q0));
    }

    public static FixedGate vH(Object q0) {
        return new FixedGate(FixedGate.Kind.V_H, List.of(q0));
    }

    /** Square root of Y. */
    public static FixedGate sqrtY(Object q0) {
        return new FixedGate(FixedGate.Kind.SQRT_Y, List.of(q0));
    }

    public static FixedGate sqrtYH(Object q0) {
        return new FixedGate(FixedGate.Kind.SQRT_Y_H, List.of(q0));
    }

    public static RzGate rz(double theta, Object q0) {
        return new RzGate(theta, q0);
    }

    /**
     * Controlled NOT: flips {@code target} when {@code control} is |1>.
     */
    public static FixedGate cnot(Object control, Object target) {
        return new FixedGate(FixedGate.Kind.CNOT, List.of(control, target));
    }

    public static FixedGate swap(Object q0, Object q1) {
        return new FixedGate(FixedGate.Kind.SWAP, List.of(q0, q1));
    }
}
