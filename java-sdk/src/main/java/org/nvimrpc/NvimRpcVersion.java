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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Provides version information for the SDK.
 *
 * <p>Version information is read from a properties file filtered at build time.
 */
public final class NvimRpcVersion {

    private static final Logger log = LoggerFactory.getLogger(NvimRpcVersion.class);
    private static final String PROPERTIES_FILE = "/nvim-rpc-version.properties";
    private static final String UNKNOWN = "unknown";
    private static final Pattern SEMVER = Pattern.compile("^(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?.*");

    private static final NvimRpcVersion INSTANCE;

    static {
        String version = UNKNOWN;
        String buildTime = UNKNOWN;

        try (InputStream is = NvimRpcVersion.class.getResourceAsStream(PROPERTIES_FILE)) {
            if (is != null) {
                Properties props = new Properties();
                props.load(is);
                version = props.getProperty("version", UNKNOWN);
                buildTime = props.getProperty("buildTime", UNKNOWN);
            }
        } catch (IOException e) {
            log.warn("Failed to read version information from {}", PROPERTIES_FILE, e);
        }

        INSTANCE = new NvimRpcVersion(version, buildTime);
    }

    private final String version;
    private final String buildTime;
    private final int major;
    private final int minor;
    private final int patch;

    NvimRpcVersion(String version, String buildTime) {
        this.version = version;
        this.buildTime = buildTime;
        Matcher matcher = SEMVER.matcher(version);
        if (matcher.matches()) {
            this.major = component(matcher.group(1));
            this.minor = component(matcher.group(2));
            this.patch = component(matcher.group(3));
        } else {
            this.major = 0;
            this.minor = 0;
            this.patch = 0;
        }
    }

    private static int component(String group) {
        return group == null ? 0 : Integer.parseInt(group);
    }

    /**
     * Gets the singleton NvimRpcVersion instance.
     *
     * @return the version information instance
     */
    public static NvimRpcVersion getInstance() {
        return INSTANCE;
    }

    /**
     * Gets the SDK version string.
     *
     * @return the version string (e.g., "1.0.0")
     */
    public String getVersion() {
        return version;
    }

    /**
     * Gets the build timestamp.
     *
     * @return the build time as ISO-8601 string, or "unknown" if not available
     */
    public String getBuildTime() {
        return buildTime;
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("nvim-rpc-java ").append(version);
        if (!UNKNOWN.equals(buildTime)) {
            sb.append(" (built: ").append(buildTime).append(")");
        }
        return sb.toString();
    }
}
