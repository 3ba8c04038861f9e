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
package org.axonframework.extensions.tenantconnection.autoconfig;

import org.axonframework.extensions.tenantconnection.core.DriverKind;
import org.axonframework.extensions.tenantconnection.core.UnsupportedDriverException;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Conditions matching on the kind of backend configured through {@code axon.tenant-connection.driver}.
 * <p>
 * An unknown driver matches neither condition.
 *
 * @since 4.9.0
 */
abstract class DriverKindCondition extends SpringBootCondition {

    static final String DRIVER_PROPERTY = "axon.tenant-connection.driver";

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        String driver = context.getEnvironment().getProperty(DRIVER_PROPERTY, "postgresql");
        DriverKind driverKind;
        try {
            driverKind = DriverKind.fromName(driver);
        } catch (UnsupportedDriverException e) {
            return ConditionOutcome.noMatch("unsupported driver [" + driver + "]");
        }
        return matches(driverKind)
                ? ConditionOutcome.match("driver [" + driverKind + "] matched")
                : ConditionOutcome.noMatch("driver [" + driverKind + "] did not match");
    }

    abstract boolean matches(DriverKind driverKind);

    /**
     * Matches the SQL driver kinds.
     */
    static class OnSqlDriver extends DriverKindCondition {

        @Override
        boolean matches(DriverKind driverKind) {
            return driverKind.isSql();
        }
    }

    /**
     * Matches {@link DriverKind#MONGODB}.
     */
    static class OnMongoDriver extends DriverKindCondition {

        @Override
        boolean matches(DriverKind driverKind) {
            return driverKind == DriverKind.MONGODB;
        }
    }
}
