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
 * Thrown when a Pauli term is built from a symbol other than I, X, Y or Z.
 */
public class InvalidOperatorException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String operators;

    /**
     * @param operators the operator string that was rejected
     */
    public InvalidOperatorException(String operators) {
        super("Valid Pauli operators are I, X, Y, and Z; got \"" + operators + "\"");
        this.operators = operators;
    }

    /**
     * @return the operator string that was rejected
     */
    public String getOperators() {
        return operators;
    }
}
