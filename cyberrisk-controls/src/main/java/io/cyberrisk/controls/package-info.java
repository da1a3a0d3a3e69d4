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
 * Control effectiveness regression and minimum-cost control deployment.
 *
 * <p>{@link io.cyberrisk.controls.ControlEffectivenessModel} fits how each
 * control type moves safeguard effect and maintenance load;
 * {@link io.cyberrisk.controls.ControlOptimizer} then solves for the
 * cheapest additions that meet a target. The remaining classes evaluate
 * portfolios, returns, budgets and recommendations.
 */
package io.cyberrisk.controls;
