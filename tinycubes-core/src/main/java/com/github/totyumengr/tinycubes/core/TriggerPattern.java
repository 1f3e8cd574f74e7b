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
 * Partial address selecting the cells a {@link Rule} applies to. A cell matches if every constrained dimension
 * position holds the required member and, when a measure is given, the cell is of that measure. Built by
 * {@link Cube#trigger(String...)}.
 * 
 * @author mengran
 *
 */
public final class TriggerPattern {
    
    static final int ANY_MEASURE = -1;
    
    private final String[] tokens;
    private final int[] positions;
    private final int[] members;
    private final int measure;
    
    TriggerPattern(String[] tokens, int[] positions, int[] members, int measure) {
        super();
        this.tokens = tokens;
        this.positions = positions;
        this.members = members;
        this.measure = measure;
    }
    
    public boolean matches(int[] address, int measure) {
        
        if (this.measure != ANY_MEASURE && this.measure != measure) {
            return false;
        }
        for (int i = 0; i < positions.length; i++) {
            if (address[positions[i]] != members[i]) {
                return false;
            }
        }
        return true;
    }
    
    public boolean matches(CellKey key) {
        return matches(key.indices(), key.getMeasure());
    }
    
    boolean references(int position, int member) {
        
        for (int i = 0; i < positions.length; i++) {
            if (positions[i] == position && members[i] == member) {
                return true;
            }
        }
        return false;
    }
    
    public String[] getTokens() {
        return Arrays.copyOf(tokens, tokens.length);
    }
    
    public int getMeasure() {
        return measure;
    }

    @Override
    public String toString() {
        return Arrays.toString(tokens);
    }
    
}
