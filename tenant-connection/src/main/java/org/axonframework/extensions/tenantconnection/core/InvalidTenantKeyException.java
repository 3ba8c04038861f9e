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

import org.axonframework.common.AxonNonTransientException;

/**
 * Exception thrown when a textual tenant identifier does not match the {@link TenantKey} format.
 * <p>
 * This is a non-transient exception, as the identifier itself is at fault. It is raised before any tenant directory or
 * backend is consulted.
 *
 * @since 4.9.0
 */
public class InvalidTenantKeyException extends AxonNonTransientException {

    private static final long serialVersionUID = -3546587221329044541L;

    private final String rejectedKey;

    /**
     * Construct an {@link InvalidTenantKeyException} for the given {@code rejectedKey}.
     *
     * @param rejectedKey the textual tenant identifier that failed validation
     */
    public InvalidTenantKeyException(String rejectedKey) {
        super("Invalid tenant key [" + rejectedKey + "]. A tenant key should be between " + TenantKey.MIN_LENGTH
                      + " and " + TenantKey.MAX_LENGTH
                      + " characters long and contain only alphanumerics, hyphens and underscores.");
        this.rejectedKey = rejectedKey;
    }

    /**
     * The textual tenant identifier that failed validation.
     *
     * @return the textual tenant identifier that failed validation, may be {@code null}
     */
    public String rejectedKey() {
        return rejectedKey;
    }
}
