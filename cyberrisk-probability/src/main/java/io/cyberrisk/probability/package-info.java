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

/**
 * Joint and conditional probabilities over a two-stage observation process.
 *
 * <p>A {@link io.cyberrisk.probability.JointObservationTable} holds counts of
 * (X, Y) pairs. A {@link io.cyberrisk.probability.DetectionModel} describes a
 * follow-up binary test T, and the
 * {@link io.cyberrisk.probability.ConditionalProbabilityEvaluator} answers
 * marginal, sum-range and posterior questions about them.
 */
package io.cyberrisk.probability;
