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

package io.cyberrisk.distributions.model;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the serialization type name for a {@link ScalarModel} implementation.
 *
 * <p>The annotated name appears as the {@code "type"} field when a model is
 * written as JSON, and selects the concrete class when it is read back:
 *
 * <pre>{@code
 * {
 *   "type": "pareto",
 *   "scale": 5000.0,
 *   "shape": 2.5
 * }
 * }</pre>
 *
 * @see ScalarModelTypeAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ModelType {
    /**
     * The type name used in JSON serialization. Lowercase with underscores,
     * unique across all ScalarModel implementations.
     *
     * @return the type name
     */
    String value();
}
