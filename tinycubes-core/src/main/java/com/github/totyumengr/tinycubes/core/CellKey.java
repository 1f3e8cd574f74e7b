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

import java.util.Arrays;

/**
 * Fully resolved address of a cell: aggregation level, one member index per dimension position and the measure.
 * The level is the sum of the member levels, 0 exactly for base-level cells. Used as aggregation cache key.
 * 
 * @author mengran
 *
 */
public final class CellKey {
    
    private final int level;
    private final int[] indices;
    private final int measure;
    private final int hash;
    
    CellKey(int level, int[] indices, int measure) {
        super();
        this.level = level;
        this.indices = indices;
        this.measure = measure;
        this.hash = 31 * (31 * level + Arrays.hashCode(indices)) + measure;
    }

    public int getLevel() {
        return level;
    }
    
    public boolean isBaseLevel() {
        return level == 0;
    }

    public int[] getIndices() {
        return Arrays.copyOf(indices, indices.length);
    }
    
    int[] indices() {
        return indices;
    }
    
    public int getIndex(int position) {
        return indices[position];
    }

    public int getMeasure() {
        return measure;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CellKey)) {
            return false;
        }
        CellKey other = (CellKey) obj;
        return level == other.level && measure == other.measure && Arrays.equals(indices, other.indices);
    }

    @Override
    public String toString() {
        return "CellKey [level=" + level + ", indices=" + Arrays.toString(indices) + ", measure=" + measure + "]";
    }
    
}
