/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.talent.domain.exception;

import me.golemcore.talent.domain.model.EntityKind;

/**
 * Requested employee or project does not exist in the record store. Not
 * retryable: the caller decides how to present the absence.
 */
public class EntityNotFoundException extends RuntimeException {

    private final EntityKind kind;
    private final long entityId;

    public EntityNotFoundException(EntityKind kind, long entityId) {
        super(describe(kind) + " not found: " + entityId);
        this.kind = kind;
        this.entityId = entityId;
    }

    public EntityKind getKind() {
        return kind;
    }

    public long getEntityId() {
        return entityId;
    }

    private static String describe(EntityKind kind) {
        return kind == EntityKind.EMPLOYEE ? "Employee" : "Project";
    }
}
