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

import static com.amazon.anomalybenchmark.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.amazon.anomalybenchmark.config.CostMatrix;

/**
 * A fixed, in-memory profile table.
 */
public class MapProfileLookup implements IProfileLookup {

    private final Map<String, CostMatrix> profiles;

    public MapProfileLookup(Map<String, CostMatrix> profiles) {
        checkNotNull(profiles, "profiles must not be null");
        this.profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
    }

    public static MapProfileLookup of(String profileName, CostMatrix costMatrix) {
        return new MapProfileLookup(Collections.singletonMap(profileName, costMatrix));
    }

    @Override
    public Optional<CostMatrix> lookup(String profileName) {
        return Optional.ofNullable(profiles.get(profileName));
    }

    @Override
    public Set<String> getProfileNames() {
        return profiles.keySet();
    }
}
