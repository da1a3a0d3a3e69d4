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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ScalarModelTypeAdapterFactoryTest {

    private final Gson gson = new GsonBuilder()
        .registerTypeAdapterFactory(ScalarModelTypeAdapterFactory.create())
        .create();

    @Test
    void writesTypeFieldFirst() {
        String json = gson.toJson(new ParetoScalarModel(5000.0, 2.5), ScalarModel.class);
        JsonObject obj = JsonParser.parseString(json).getAsJsonObject();
        assertThat(obj.keySet()).containsExactly("type", "scale", "shape");
        assertThat(obj.get("type").getAsString()).isEqualTo("pareto");
    }

    @Test
    void restoresEachRegisteredType() {
        ScalarModel[] models = {
            new TriangularScalarModel(50_000, 200_000, 450_000),
            DiscreteScalarModel.ofCounts(new int[]{0, 1, 2}, new double[]{0.5, 0.3, 0.2}),
            new LogNormalScalarModel(9.0, 1.0),
            new ParetoScalarModel(5000.0, 2.5)
        };
        for (ScalarModel model : models) {
            String json = gson.toJson(model, ScalarModel.class);
            assertThat(gson.fromJson(json, ScalarModel.class)).isEqualTo(model);
        }
    }

    @Test
    void readsConcreteTargetType() {
        TriangularScalarModel model = gson.fromJson(
            "{\"type\":\"triangular\",\"min\":1,\"mode\":2,\"max\":3}", TriangularScalarModel.class);
        assertThat(model.getMean()).isEqualTo(2.0);
    }

    @Test
    void rejectsUnknownType() {
        assertThatThrownBy(() -> gson.fromJson("{\"type\":\"weibull\"}", ScalarModel.class))
            .isInstanceOf(JsonParseException.class)
            .hasMessageContaining("Unknown distribution type: 'weibull'");
    }

    @Test
    void rejectsMissingType() {
        assertThatThrownBy(() -> gson.fromJson("{\"mu\":1.0,\"sigma\":1.0}", ScalarModel.class))
            .isInstanceOf(JsonParseException.class)
            .hasMessageContaining("Missing 'type'");
    }

    @Test
    void validatesRestoredParameters() {
        assertThatThrownBy(() -> gson.fromJson(
            "{\"type\":\"triangular\",\"min\":5,\"mode\":1,\"max\":3}", ScalarModel.class))
            .isInstanceOf(JsonParseException.class)
            .hasMessageContaining("min <= mode <= max");
    }

    @Test
    void rejectsMismatchedTargetType() {
        assertThatThrownBy(() -> gson.fromJson(
            "{\"type\":\"pareto\",\"scale\":1,\"shape\":2}", TriangularScalarModel.class))
            .isInstanceOf(JsonParseException.class);
    }

    @Test
    void duplicateRegistrationFails() {
        ScalarModelTypeAdapterFactory factory = ScalarModelTypeAdapterFactory.create();
        assertThatThrownBy(() -> factory.registerType(ParetoScalarModel.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already registered");
        assertThat(factory.getModelClass("log_normal")).isEqualTo(LogNormalScalarModel.class);
        assertThat(factory.getTypeName(DiscreteScalarModel.class)).isEqualTo("discrete");
    }
}
