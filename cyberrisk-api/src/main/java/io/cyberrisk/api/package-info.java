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
/// Error taxonomy and cancellation shared by every cyberrisk engine.
///
/// Input problems surface as [io.cyberrisk.api.InvalidParameterException],
/// undefined probability queries as [io.cyberrisk.api.DivisionByZeroException],
/// and cooperative aborts as [io.cyberrisk.api.CancelledException]. Solver
/// outcomes such as an infeasible program are ordinary return values and do
/// not appear here.
package io.cyberrisk.api;
