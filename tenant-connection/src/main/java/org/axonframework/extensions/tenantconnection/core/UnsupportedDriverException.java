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

import org.axonframework.common.AxonConfigurationException;

/**
 * Exception thrown when a {@link DriverKind} is requested that is unknown or not supported by the configured backend
 * connector. Typically raised while building a connection cache, hence at startup.
 *
 * @since 4.9.0
 */
public class UnsupportedDriverException extends AxonConfigurationException {

    private static final long serialVersionUID = 7385092316749021857L;

    private final String driver;

    /**
     * Construct an {@link UnsupportedDriverException} for the given textual {@code driver}.
     *
     * @param driver the name of the unsupported driver
     */
    public UnsupportedDriverException(String driver) {
        super("Unsupported database driver [" + driver + "]");
        this.driver = driver;
    }

    /**
     * Construct an {@link UnsupportedDriverException} for the given {@code driverKind}.
     *
     * @param driverKind the unsupported driver kind
     */
    public UnsupportedDriverException(DriverKind driverKind) {
        this(String.valueOf(driverKind));
    }

    /**
     * The name of the unsupported driver.
     *
     * @return the name of the unsupported driver
     */
    public String driver() {
        return driver;
    }
}
