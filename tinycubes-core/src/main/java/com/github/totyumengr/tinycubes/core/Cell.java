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

import java.util.List;

/**
 * Handle on one cell of a {@link Cube}, used by reports and passed to rules. Values are read live on every call.
 * 
 * <p>Modifiers move the handle to a neighbouring cell: {@code member}, {@code dimension:member},
 * {@code ordinal:member} replace the member of one dimension, a measure name replaces the measure. In a rule,
 * {@code cell.getDouble("Cost")} reads the Cost measure at the same coordinates.
 * 
 * @author mengran
 *
 */
public class Cell {
    
    private final Cube cube;
    private final CellKey key;
    
    Cell(Cube cube, CellKey key) {
        super();
        this.cube = cube;
        this.key = key;
    }
    
    public Cube getCube() {
        return cube;
    }

    public CellKey getKey() {
        return key;
    }
    
    public boolean isBaseLevel() {
        return key.isBaseLevel();
    }
    
    public Object getValue() {
        return cube.getValue(key);
    }
    
    /**
     * @return numeric value, 0.0 for non-numeric values.
     */
    public double getNumericValue() {
        return Cube.toDouble(getValue());
    }
    
    /**
     * @throws InvalidOperationException if the cell is aggregated
     */
    public void setValue(Object value) {
        cube.setValue(key, value);
    }
    
    public Object get(String... modifiers) {
        return cube.getValue(cube.alter(key, modifiers));
    }
    
    public double getDouble(String... modifiers) {
        return Cube.toDouble(get(modifiers));
    }
    
    /**
     * Stored or aggregated value without any read rule. Rules use it to look at their own cell without
     * triggering themselves.
     */
    public Object getBypassRules() {
        return cube.getValueBypassRules(key);
    }
    
    /**
     * @return true if the fact table holds a value at the address of the cell.
     */
    public boolean isStored() {
        return cube.getFactTable().get(key.indices(), key.getMeasure()) != null;
    }
    
    public Cell alter(String... modifiers) {
        return new Cell(cube, cube.alter(key, modifiers));
    }
    
    public Member getMember(int ordinal) {
        return cube.getDimension(ordinal).getMember(key.getIndex(ordinal));
    }
    
    /**
     * @return member of the first occurrence of the dimension.
     */
    public Member getMember(String dimension) {
        
        int ordinal = cube.getDimensionOrdinal(dimension);
        if (ordinal < 0) {
            throw new KeyNotFoundException("Cube '" + cube.getName() + "' has no dimension '" + dimension + "'.");
        }
        return getMember(ordinal);
    }
    
    public String getMeasure() {
        return cube.getMeasure(key.getMeasure());
    }
    
    /**
     * @return member names in dimension order.
     */
    public List<String> getAddress() {
        return cube.memberNames(key.indices());
    }

    @Override
    public String toString() {
        return cube.getName() + cube.describe(key);
    }
    
}
