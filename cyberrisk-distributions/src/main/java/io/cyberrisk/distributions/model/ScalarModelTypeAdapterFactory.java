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
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.cyberrisk.api.InvalidParameterException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gson {@link TypeAdapterFactory} writing and reading {@link ScalarModel}
 * values with a {@code "type"} discriminator.
 *
 * <pre>{@code
 *  TriangularScalarModel(50000, 200000, 450000)
 *        │
 *        ▼
 *  { "type": "triangular", "min": 50000.0, "mode": 200000.0, "max": 450000.0 }
 *        │
 *        ▼  read: look up "triangular", delegate, validate()
 *  TriangularScalarModel
 * }</pre>
 *
 * <p>Reflection-based deserialization skips constructors, so every model
 * restored here is passed through {@link ScalarModel#validate()} and a bad
 * document fails at read time with a {@link JsonParseException}.
 *
 * @see ModelType
 */
public final class ScalarModelTypeAdapterFactory implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Map<String, Class<? extends ScalarModel>> typeToClass = new LinkedHashMap<>();
    private final Map<Class<? extends ScalarModel>, String> classToType = new LinkedHashMap<>();

    private ScalarModelTypeAdapterFactory() {
    }

    /**
     * Creates a factory with the four loss-model distributions registered.
     *
     * @return a configured factory
     */
    public static ScalarModelTypeAdapterFactory create() {
        ScalarModelTypeAdapterFactory factory = new ScalarModelTypeAdapterFactory();
        factory.registerType(TriangularScalarModel.class);
        factory.registerType(DiscreteScalarModel.class);
        factory.registerType(LogNormalScalarModel.class);
        factory.registerType(ParetoScalarModel.class);
        return factory;
    }

    /**
     * Registers a model class under the name from its {@link ModelType} annotation.
     *
     * @param modelClass the model class to register
     * @throws IllegalArgumentException if the annotation is missing or the name is taken
     */
    public void registerType(Class<? extends ScalarModel> modelClass) {
        ModelType annotation = modelClass.getAnnotation(ModelType.class);
        if (annotation == null) {
            throw new IllegalArgumentException(
                "Class " + modelClass.getName() + " has no @ModelType annotation");
        }
        String typeName = annotation.value();
        Class<? extends ScalarModel> existing = typeToClass.get(typeName);
        if (existing != null) {
            throw new IllegalArgumentException(
                "Type '" + typeName + "' is already registered to " + existing.getName());
        }
        typeToClass.put(typeName, modelClass);
        classToType.put(modelClass, typeName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!ScalarModel.class.isAssignableFrom(type.getRawType())) {
            return null;
        }

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                ScalarModel model = (ScalarModel) value;
                String typeName = classToType.getOrDefault(value.getClass(), model.getModelType());

                TypeAdapter<T> delegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    ScalarModelTypeAdapterFactory.this, TypeToken.get(value.getClass()));
                JsonObject fields = delegate.toJsonTree(value).getAsJsonObject();

                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, typeName);
                for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
                    if (!TYPE_FIELD.equals(entry.getKey())) {
                        result.add(entry.getKey(), entry.getValue());
                    }
                }

                Streams.write(result, out);
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                if (!element.isJsonObject()) {
                    throw new JsonParseException("Expected a distribution object but got: " + element);
                }
                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(TYPE_FIELD)) {
                    throw new JsonParseException("Missing '" + TYPE_FIELD + "' field in distribution: " + obj);
                }

                String typeName = obj.get(TYPE_FIELD).getAsString();
                Class<? extends ScalarModel> targetClass = typeToClass.get(typeName);
                if (targetClass == null) {
                    throw new JsonParseException(
                        "Unknown distribution type: '" + typeName + "'. Known types: " + typeToClass.keySet());
                }
                if (!type.getRawType().isAssignableFrom(targetClass)) {
                    throw new JsonParseException(
                        "Distribution type '" + typeName + "' cannot be read as " + type.getRawType().getSimpleName());
                }

                JsonObject fields = obj.deepCopy();
                fields.remove(TYPE_FIELD);
                ScalarModel model = gson.getDelegateAdapter(ScalarModelTypeAdapterFactory.this,
                    TypeToken.get(targetClass)).fromJsonTree(fields);
                try {
                    model.validate();
                } catch (InvalidParameterException e) {
                    throw new JsonParseException("Invalid '" + typeName + "' distribution: " + e.getMessage(), e);
                }
                return (T) model;
            }
        };
    }

    /**
     * @param modelClass the model class
     * @return the registered type name, or null if not registered
     */
    public String getTypeName(Class<? extends ScalarModel> modelClass) {
        return classToType.get(modelClass);
    }

    /**
     * @param typeName the type name
     * @return the registered model class, or null if not registered
     */
    public Class<? extends ScalarModel> getModelClass(String typeName) {
        return typeToClass.get(typeName);
    }
}
