/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.cyberrisk.api;

/**
 * Thrown at a cancellation checkpoint after a caller has signalled its
 * {@link CancellationToken}. No partial result accompanies this exception.
 */
public class CancelledException extends CyberRiskException {

    private final String phase;

    public CancelledException(String phase) {
        super("computation cancelled at phase '" + phase + "'");
        this.phase = phase;
    }

    /// @return the name of the checkpoint at which cancellation was observed
    public String getPhase() {
        return phase;
    }
}
