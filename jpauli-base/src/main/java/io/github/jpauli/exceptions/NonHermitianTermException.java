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

package io.github.jpauli.exceptions;

/**
 * Thrown by circuit synthesis when a term's coefficient has a non-negligible imaginary part,
 * i.e. the Pauli sum being exponentiated is not Hermitian.
 */
public class NonHermitianTermException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    /**
     * @param term a description of the offending term
     */
    public NonHermitianTermException(String term) {
        super("Pauli term coefficients must be real: " + term);
    }
}
