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

import java.util.concurrent.atomic.AtomicBoolean;

/// Cooperative cancellation signal shared between a caller and one engine call.
///
/// ## Usage
///
/// ```java
/// CancellationToken token = new CancellationToken();
/// Future<SimulationResult> f = executor.submit(() -> simulator.run(params, token));
/// // later, from another thread
/// token.cancel();
/// ```
///
/// Engines call [#checkpoint(String)] between algorithmic phases. The token
/// is one-shot: once cancelled it stays cancelled.
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CancellationToken parent;

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    /// Returns a token that is never cancelled.
    ///
    /// @return the shared inert token
    public static CancellationToken none() {
        return NONE;
    }

    /// Returns a token that is cancelled when this one is, and that can also be
    /// cancelled on its own without affecting this one.
    ///
    /// @return a new child token
    public CancellationToken newChild() {
        return new CancellationToken(this);
    }

    /// Requests cancellation. Has no effect on [#none()].
    public void cancel() {
        if (this != NONE) {
            cancelled.set(true);
        }
    }

    /// @return true once [#cancel()] has been called on this token or a parent
    public boolean isCancellationRequested() {
        return cancelled.get() || (parent != null && parent.isCancellationRequested());
    }

    /// Throws [CancelledException] if cancellation has been requested.
    ///
    /// @param phase the name of the phase boundary being crossed
    /// @throws CancelledException if this token has been cancelled
    public void checkpoint(String phase) {
        if (isCancellationRequested()) {
            throw new CancelledException(phase);
        }
    }
}
