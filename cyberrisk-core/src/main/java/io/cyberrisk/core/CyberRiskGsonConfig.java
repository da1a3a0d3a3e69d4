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

package io.cyberrisk.core;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.cyberrisk.distributions.model.ScalarModelTypeAdapterFactory;

/**
 * Shared Gson configuration for requests and results of {@link CyberRiskService}.
 *
 * <ul>
 *   <li>distribution models carry a {@code "type"} discriminator</li>
 *   <li>fields without an explicit name are written in snake_case</li>
 *   <li>NaN and infinities are written as literals, e.g. the cost of an infeasible optimization</li>
 * </ul>
 */
public final class CyberRiskGsonConfig {

    private static final Gson GSON = newBuilder().create();

    private CyberRiskGsonConfig() {
    }

    /**
     * @return the shared, thread-safe Gson instance
     */
    public static Gson gson() {
        return GSON;
    }

    /**
     * @return a builder with the cyber-risk configuration applied, for callers that add their own adapters
     */
    public static GsonBuilder newBuilder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .registerTypeAdapterFactory(ScalarModelTypeAdapterFactory.create());
    }
}
