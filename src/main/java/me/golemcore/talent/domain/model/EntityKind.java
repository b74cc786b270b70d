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

package me.golemcore.talent.domain.model;

/**
 * Kind of an embeddable entity. Each kind owns one collection in the vector
 * index and is matched against its counterpart kind.
 */
public enum EntityKind {

    EMPLOYEE("employees"), PROJECT("projects");

    private final String collection;

    EntityKind(String collection) {
        this.collection = collection;
    }

    public String getCollection() {
        return collection;
    }

    public EntityKind counterpart() {
        return this == EMPLOYEE ? PROJECT : EMPLOYEE;
    }
}
