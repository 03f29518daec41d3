/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalybenchmark.profile;

import static com.amazon.anomalybenchmark.CommonUtils.checkArgument;
import static com.amazon.anomalybenchmark.CommonUtils.checkNotNull;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.net.URL;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;
import lombok.Setter;

import com.amazon.anomalybenchmark.config.CostMatrix;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A profile table read from a JSON document of the form
 *
 * <pre>
 * {
 *   "standard": { "CostMatrix": { "tpWeight": 1.0, "fpWeight": 0.11, "fnWeight": 1.0, "tnWeight": 1.0 } }
 * }
 * </pre>
 *
 * The document is parsed once, when the lookup is created.
 */
public class JsonProfileLookup implements IProfileLookup {

    public static final String DEFAULT_RESOURCE = "/profiles.json";

    private static final TypeReference<LinkedHashMap<String, ProfileDefinition>> PROFILES_TYPE = new TypeReference<LinkedHashMap<String, ProfileDefinition>>() {
    };

    private final MapProfileLookup profiles;

    private JsonProfileLookup(Map<String, ProfileDefinition> definitions) {
        Map<String, CostMatrix> table = new LinkedHashMap<>();
        for (Map.Entry<String, ProfileDefinition> entry : definitions.entrySet()) {
            ProfileDefinition definition = entry.getValue();
            checkArgument(definition != null && definition.getCostMatrix() != null,
                    String.format("profile %s has no CostMatrix", entry.getKey()));
            table.put(entry.getKey(), CostMatrix.fromMap(definition.getCostMatrix()));
        }
        this.profiles = new MapProfileLookup(table);
    }

    /**
     * @return the profiles bundled with this library
     * @throws IOException if the bundled resource cannot be read
     */
    public static JsonProfileLookup fromDefaultResource() throws IOException {
        URL url = JsonProfileLookup.class.getResource(DEFAULT_RESOURCE);
        if (url == null) {
            throw new FileNotFoundException("missing classpath resource " + DEFAULT_RESOURCE);
        }
        return fromUrl(url);
    }

    public static JsonProfileLookup fromUrl(URL url) throws IOException {
        checkNotNull(url, "url must not be null");
        return new JsonProfileLookup(new ObjectMapper().readValue(url, PROFILES_TYPE));
    }

    public static JsonProfileLookup fromReader(Reader reader) throws IOException {
        checkNotNull(reader, "reader must not be null");
        return new JsonProfileLookup(new ObjectMapper().readValue(reader, PROFILES_TYPE));
    }

    public static JsonProfileLookup fromJson(String json) throws IOException {
        checkNotNull(json, "json must not be null");
        return new JsonProfileLookup(new ObjectMapper().readValue(json, PROFILES_TYPE));
    }

    @Override
    public Optional<CostMatrix> lookup(String profileName) {
        return profiles.lookup(profileName);
    }

    @Override
    public Set<String> getProfileNames() {
        return profiles.getProfileNames();
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ProfileDefinition {
        @JsonProperty("CostMatrix")
        private Map<String, Double> costMatrix;
    }
}
