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

import java.util.Optional;
import java.util.Set;

import com.amazon.anomalybenchmark.config.CostMatrix;

/**
 * A table of named scoring profiles, each of which maps to a cost matrix.
 */
public interface IProfileLookup {

    /**
     * @param profileName the name of a profile, for example "standard"
     * @return the cost matrix of the profile, or empty if no such profile exists
     */
    Optional<CostMatrix> lookup(String profileName);

    /**
     * @return the names of all known profiles
     */
    Set<String> getProfileNames();
}
