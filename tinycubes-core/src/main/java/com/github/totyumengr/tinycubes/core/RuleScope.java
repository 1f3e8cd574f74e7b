/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.tinycubes.core;

/**
 * When a {@link Rule} is evaluated.
 * 
 * @author mengran
 *
 */
public enum RuleScope {
    
    /**
     * Every read matching the trigger, at any level. May return {@link Outcome#proceed()}.
     */
    ALL_LEVELS,
    /**
     * Reads of aggregated cells.
     */
    AGGREGATION_LEVEL,
    /**
     * Reads of base-level cells.
     */
    BASE_LEVEL,
    /**
     * Value a base-level row contributes while an aggregate is computed.
     */
    ROLL_UP,
    /**
     * After a successful write, for push-down propagation. Never on reads.
     */
    ON_ENTRY,
    /**
     * Only through {@link Cube#executeCommand(String, String...)}.
     */
    COMMAND
    
}
