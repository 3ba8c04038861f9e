/*
 * Copyright (c) 2010-2025. Axon Framework
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.axonframework.extensions.tenantconnection.core;

import java.util.regex.Pattern;

/**
 * Identifier of a single tenant. Directly used as the key of cached tenant connections.
 * <p>
 * A tenant key consists of alphanumeric characters, hyphens and underscores only, and is between
 * {@value #MIN_LENGTH} and {@value #MAX_LENGTH} characters long. Keys are validated on construction through
 * {@link #of(String)}, so that an invalid key never reaches a {@code TenantDirectory} or {@code BackendConnector}.
 *
 * @since 4.9.0
 */
public final class TenantKey implements Comparable<TenantKey> {

    /**
     * The minimum length of a tenant key.
     */
    public static final int MIN_LENGTH = 1;
    /**
     * The maximum length of a tenant key.
     */
    public static final int MAX_LENGTH = 100;

    private static final Pattern VALID_KEY = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private final String value;

    private TenantKey(String value) {
        this.value = value;
    }

    /**
     * Construct a {@link TenantKey} for the given {@code value}.
     *
     * @param value the textual tenant identifier
     * @return a validated {@link TenantKey}
     * @throws InvalidTenantKeyException if the given {@code value} is {@code null}, too short, too long or contains
     *                                   characters other than alphanumerics, hyphens and underscores
     */
    public static TenantKey of(String value) {
        if (!isValid(value)) {
            throw new InvalidTenantKeyException(value);
        }
        return new TenantKey(value);
    }

    /**
     * Validates the given {@code value} against the tenant key format, without constructing a {@link TenantKey}.
     *
     * @param value the textual tenant identifier to validate
     * @return {@code true} if the given {@code value} is a valid tenant key, {@code false} otherwise
     */
    public static boolean isValid(String value) {
        if (value == null || value.length() < MIN_LENGTH || value.length() > MAX_LENGTH) {
            return false;
        }
        return VALID_KEY.matcher(value).matches();
    }

    /**
     * The textual tenant identifier.
     *
     * @return the textual tenant identifier
     */
    public String value() {
        return value;
    }

    @Override
    public int compareTo(TenantKey other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TenantKey)) {
            return false;
        }
        TenantKey that = (TenantKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
