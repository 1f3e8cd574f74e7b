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

import java.util.Collections;
import java.util.List;

/**
 * One stored value of a cube.
 * 
 * @author mengran
 *
 */
public class CellRecord {
    
    private final List<String> members;
    private final String measure;
    private final Object value;
    
    CellRecord(List<String> members, String measure, Object value) {
        super();
        this.members = Collections.unmodifiableList(members);
        this.measure = measure;
        this.value = value;
    }

    public List<String> getMembers() {
        return members;
    }

    public String getMeasure() {
        return measure;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "CellRecord [members=" + members + ", measure=" + measure + ", value=" + value + "]";
    }
    
}
