/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
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

package org.nvimrpc;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NvimRpcVersionTest {

    @Test
    void getInstanceReturnsSingleton() {
        NvimRpcVersion instance1 = NvimRpcVersion.getInstance();
        NvimRpcVersion instance2 = NvimRpcVersion.getInstance();

        assertThat(instance1).isSameAs(instance2);
        assertThat(NvimRpc.versionInfo()).isSameAs(instance1);
    }

    @Test
    void versionValuesArePopulatedFromPropertiesFile() {
        NvimRpcVersion version = NvimRpcVersion.getInstance();

        // filtered by the resources plugin during the build
        assertThat(version.getVersion()).isNotEqualTo("unknown").isEqualTo(NvimRpc.version());
        assertThat(version.getBuildTime()).isNotEqualTo("unknown");
    }

    @Test
    void parsesSemanticVersionComponents() {
        NvimRpcVersion version = new NvimRpcVersion("1.12.3", "2026-01-01T00:00:00Z");

        assertThat(version.getMajor()).isEqualTo(1);
        assertThat(version.getMinor()).isEqualTo(12);
        assertThat(version.getPatch()).isEqualTo(3);
    }

    @Test
    void ignoresQualifierAfterPatch() {
        NvimRpcVersion version = new NvimRpcVersion("0.3.0-SNAPSHOT", "unknown");

        assertThat(version.getMajor()).isZero();
        assertThat(version.getMinor()).isEqualTo(3);
        assertThat(version.getPatch()).isZero();
    }

    @Test
    void fallsBackToZeroForUnknownVersion() {
        NvimRpcVersion version = new NvimRpcVersion("unknown", "unknown");

        assertThat(version.getMajor()).isZero();
        assertThat(version.getMinor()).isZero();
        assertThat(version.getPatch()).isZero();
    }

    @Test
    void toStringContainsBuildTimeWhenAvailable() {
        NvimRpcVersion version = new NvimRpcVersion("1.0.0", "2026-01-01T00:00:00Z");

        assertThat(version.toString())
                .startsWith("nvim-rpc-java 1.0.0")
                .contains("built: 2026-01-01T00:00:00Z");
        assertThat(new NvimRpcVersion("1.0.0", "unknown")).hasToString("nvim-rpc-java 1.0.0");
    }
}
