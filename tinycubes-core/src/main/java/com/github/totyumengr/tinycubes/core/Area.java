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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Supplier;

import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

import com.github.totyumengr.tinycubes.core.FactTable.Record;

/**
 * Subspace of a {@link Cube}: at most one member-set constraint per dimension position plus an optional measure
 * restriction. Unconstrained positions cover the whole dimension, an aggregated member covers its descendants.
 * 
 * <p>{@link #addresses()}, {@link #records()} and the statistics only visit stored rows, found through the
 * fact-table index. {@link #allAddresses()} and {@link #fill(Object)} walk every leaf address and are meant for
 * small areas where empty cells matter.
 * 
 * <p>{@link #times(double)} and friends return a view with a pending operator that is applied to numeric values
 * when the view is read or used as the source of {@link #assign(Area)}.
 * 
 * <p>Writes go through the cube's base-level write path. The cells to visit are pinned before the first write, so
 * source and target may overlap.
 * 
 * @author mengran
 *
 */
public class Area {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(Area.class);
    
    private final Cube cube;
    /**
     * Member indices per position in selector order, null for unconstrained positions.
     */
    private final int[][] constraints;
    private final int[] measures;
    private final DoubleUnaryOperator operator;
    
    Area(Cube cube, Object... selector) {
        super();
        this.cube = cube;
        this.constraints = new int[cube.getDimensionCount()][];
        List<Integer> measureList = new ArrayList<Integer>();
        if (selector != null) {
            for (Object item : selector) {
                if (item instanceof Collection) {
                    addConstraint((Collection<?>) item, measureList);
                } else {
                    addConstraint(Arrays.asList(item), measureList);
                }
            }
        }
        if (measureList.isEmpty()) {
            for (int i = 0; i < cube.getMeasures().size(); i++) {
                measureList.add(i);
            }
        }
        this.measures = measureList.stream().mapToInt(Integer::intValue).toArray();
        this.operator = null;
    }
    
    private Area(Area area, DoubleUnaryOperator operator) {
        super();
        this.cube = area.cube;
        this.constraints = area.constraints;
        this.measures = area.measures;
        this.operator = operator;
    }
    
    private void addConstraint(Collection<?> items, List<Integer> measureList) {
        
        Assert.notEmpty(items, "Area selector item can not empty.");
        int position = -1;
        Set<Integer> members = new LinkedHashSet<Integer>();
        for (Object item : items) {
            int[] resolved = resolve(item);
            if (resolved[0] < 0) {
                if (!measureList.contains(resolved[1])) {
                    measureList.add(resolved[1]);
                }
                continue;
            }
            if (position >= 0 && position != resolved[0]) {
                throw new InvalidCellAddressException("Area selector " + items 
                        + " mixes members of different dimensions.");
            }
            position = resolved[0];
            members.add(resolved[1]);
        }
        if (position < 0) {
            return;
        }
        if (constraints[position] != null) {
            throw new InvalidCellAddressException("Dimension '" + cube.getDimension(position).getName() 
                    + "' appears more than once in the area selector.");
        }
        constraints[position] = members.stream().mapToInt(Integer::intValue).toArray();
    }
    
    private int[] resolve(Object item) {
        
        if (item instanceof Member) {
            Member member = (Member) item;
            int ordinal = cube.getDimensions().indexOf(member.getDimension());
            if (ordinal < 0 || member.getDimension().getMember(member.getIndex()) != member) {
                throw new InvalidCellAddressException("Member " + member + " does not belong to cube '" 
                        + cube.getName() + "'.");
            }
            return new int[] {ordinal, member.getIndex()};
        }
        Assert.isInstanceOf(String.class, item, "Area selector item");
        return cube.resolveToken((String) item);
    }
    
    public Cube getCube() {
        return cube;
    }
    
    // ---------------------------- Views ----------------------------
    
    public Area times(double factor) {
        return withOperator(v -> v * factor);
    }
    
    public Area plus(double value) {
        return withOperator(v -> v + value);
    }
    
    public Area minus(double value) {
        return withOperator(v -> v - value);
    }
    
    public Area dividedBy(double divisor) {
        
        if (divisor == 0.0) {
            throw new InvalidOperationException("Area can not be divided by zero.");
        }
        return withOperator(v -> v / divisor);
    }
    
    private Area withOperator(DoubleUnaryOperator next) {
        return new Area(this, operator == null ? next : operator.andThen(next));
    }
    
    private Object apply(Object value) {
        
        if (operator == null || !(value instanceof Number)) {
            return value;
        }
        return operator.applyAsDouble(((Number) value).doubleValue());
    }
    
    // ---------------------------- Enumeration ----------------------------
    
    private List<Record> rows() {
        RoaringBitmap ids = cube.getFactTable().queryArea(constraints);
        return cube.getFactTable().rows(ids);
    }
    
    /**
     * Stored values of the area, the pending operator applied.
     */
    private List<Pinned> pin() {
        
        List<Pinned> pinned = new ArrayList<Pinned>();
        for (Record record : rows()) {
            for (int measure : measures) {
                Object value = record.getValue(measure);
                if (value != null) {
                    pinned.add(new Pinned(record.getAddress(), measure, apply(value)));
                }
            }
        }
        return pinned;
    }
    
    private static class Pinned {
        
        private final int[] address;
        private final int measure;
        private final Object value;
        
        private Pinned(int[] address, int measure, Object value) {
            this.address = address;
            this.measure = measure;
            this.value = value;
        }
    }
    
    /**
     * Cells holding a stored value, one per row and measure. Enumerated lazily, each call starts over.
     */
    public Iterable<Cell> addresses() {
        
        return new Iterable<Cell>() {
            
            @Override
            public Iterator<Cell> iterator() {
                return new StoredIterator<Cell>((record, measure) -> 
                        new Cell(cube, cube.keyOf(record.getAddress(), measure)));
            }
        };
    }
    
    /**
     * Stored values with member names, the pending operator applied. Enumerated lazily, each call starts over.
     */
    public Iterable<CellRecord> records() {
        
        return new Iterable<CellRecord>() {
            
            @Override
            public Iterator<CellRecord> iterator() {
                return new StoredIterator<CellRecord>((record, measure) -> new CellRecord(
                        cube.memberNames(record.getAddress()), cube.getMeasure(measure), 
                        apply(record.getValue(measure))));
            }
        };
    }
    
    private class StoredIterator<T> implements Iterator<T> {
        
        private final IntIterator ids = cube.getFactTable().queryArea(constraints).getIntIterator();
        private final BiFunction<Record, Integer, T> mapper;
        private Record record;
        private int measureCursor;
        private T next;
        
        private StoredIterator(BiFunction<Record, Integer, T> mapper) {
            this.mapper = mapper;
            advance();
        }
        
        @Override
        public boolean hasNext() {
            return next != null;
        }
        
        @Override
        public T next() {
            
            if (next == null) {
                throw new NoSuchElementException();
            }
            T result = next;
            advance();
            return result;
        }
        
        private void advance() {
            
            next = null;
            while (next == null) {
                if (record != null && measureCursor < measures.length) {
                    int measure = measures[measureCursor++];
                    if (record.getValue(measure) != null) {
                        next = mapper.apply(record, measure);
                    }
                } else if (ids.hasNext()) {
                    // Rows deleted after the query are skipped
                    record = cube.getFactTable().getRecord(ids.next());
                    measureCursor = 0;
                } else {
                    return;
                }
            }
        }
    }
    
    /**
     * @return number of stored values in the area.
     */
    public int count() {
        return pin().size();
    }
    
    /**
     * Every leaf address of the area for every measure, stored or not. Enumerated lazily, each call starts over.
     */
    public Iterable<Cell> allAddresses() {
        
        int[][] leaves = new int[constraints.length][];
        for (int position = 0; position < constraints.length; position++) {
            Dimension dimension = cube.getDimension(position);
            Set<Integer> set = new LinkedHashSet<Integer>();
            if (constraints[position] == null) {
                for (Member member : dimension.memberObjects()) {
                    if (member.isLeaf()) {
                        set.add(member.getIndex());
                    }
                }
            } else {
                for (int index : constraints[position]) {
                    Member member = dimension.getMember(index);
                    if (member.isLeaf()) {
                        set.add(index);
                    } else {
                        for (int leaf : member.baseDescendants) {
                            set.add(leaf);
                        }
                    }
                }
            }
            leaves[position] = set.stream().mapToInt(Integer::intValue).toArray();
        }
        
        return new Iterable<Cell>() {
            
            @Override
            public Iterator<Cell> iterator() {
                return new CartesianIterator(leaves);
            }
        };
    }
    
    private class CartesianIterator implements Iterator<Cell> {
        
        private final int[][] leaves;
        private final int[] cursor;
        private int measureCursor = 0;
        private boolean hasNext;
        
        private CartesianIterator(int[][] leaves) {
            this.leaves = leaves;
            this.cursor = new int[leaves.length];
            boolean empty = measures.length == 0;
            for (int[] l : leaves) {
                empty |= l.length == 0;
            }
            this.hasNext = !empty;
        }

        @Override
        public boolean hasNext() {
            return hasNext;
        }

        @Override
        public Cell next() {
            
            if (!hasNext) {
                throw new NoSuchElementException();
            }
            int[] address = new int[leaves.length];
            for (int i = 0; i < leaves.length; i++) {
                address[i] = leaves[i][cursor[i]];
            }
            Cell cell = new Cell(cube, new CellKey(0, address, measures[measureCursor]));
            advance();
            return cell;
        }
        
        private void advance() {
            
            if (++measureCursor < measures.length) {
                return;
            }
            measureCursor = 0;
            for (int i = leaves.length - 1; i >= 0; i--) {
                if (++cursor[i] < leaves[i].length) {
                    return;
                }
                cursor[i] = 0;
            }
            hasNext = false;
        }
    }
    
    // ---------------------------- Statistics ----------------------------
    
    private double[] numbers() {
        return pin().stream().filter(p -> p.value instanceof Number)
                .mapToDouble(p -> ((Number) p.value).doubleValue()).toArray();
    }
    
    public double sum() {
        return Arrays.stream(numbers()).sum();
    }
    
    /**
     * @return null if the area holds no numeric value.
     */
    public Double min() {
        double[] numbers = numbers();
        return numbers.length == 0 ? null : Arrays.stream(numbers).min().getAsDouble();
    }
    
    public Double max() {
        double[] numbers = numbers();
        return numbers.length == 0 ? null : Arrays.stream(numbers).max().getAsDouble();
    }
    
    public Double avg() {
        double[] numbers = numbers();
        return numbers.length == 0 ? null : Arrays.stream(numbers).average().getAsDouble();
    }
    
    // ---------------------------- Writes ----------------------------
    
    /**
     * Deletes every stored value of the area.
     * 
     * @return number of deleted values
     */
    public int clear() {
        
        List<Pinned> pinned = pin();
        for (Pinned p : pinned) {
            cube.writeRow(p.address, p.measure, null);
        }
        LOGGER.info("Cleared {} values of cube {}", pinned.size(), cube.getName());
        return pinned.size();
    }
    
    /**
     * Writes a constant to every stored cell of the area.
     */
    public int setValue(Object value) {
        return setValue(() -> value);
    }
    
    /**
     * Writes the supplier's result to every stored cell of the area, the supplier is called once per cell.
     */
    public int setValue(Supplier<?> supplier) {
        
        List<Pinned> pinned = pin();
        for (Pinned p : pinned) {
            cube.writeRow(p.address, p.measure, supplier.get());
        }
        LOGGER.info("Set {} values of cube {}", pinned.size(), cube.getName());
        return pinned.size();
    }
    
    /**
     * Writes a constant to every leaf address of the area, stored or not.
     */
    public int fill(Object value) {
        return fill(() -> value);
    }
    
    public int fill(Supplier<?> supplier) {
        
        List<Cell> cells = new ArrayList<Cell>();
        for (Cell cell : allAddresses()) {
            cells.add(cell);
        }
        for (Cell cell : cells) {
            cell.setValue(supplier.get());
        }
        LOGGER.info("Filled {} cells of cube {}", cells.size(), cube.getName());
        return cells.size();
    }
    
    public int multiply(double factor) {
        return transform(v -> v * factor);
    }
    
    public int increment(double value) {
        return transform(v -> v + value);
    }
    
    private int transform(DoubleUnaryOperator op) {
        
        List<Pinned> pinned = pin();
        int count = 0;
        for (Pinned p : pinned) {
            if (p.value instanceof Number) {
                cube.writeRow(p.address, p.measure, op.applyAsDouble(((Number) p.value).doubleValue()));
                count++;
            }
        }
        return count;
    }
    
    /**
     * Replaces the content of this area with the values of {@code source}, the pending operator of the source
     * applied. Both areas must be of the same cube, constrain the same dimensions with the same number of leaf
     * members each and select the same number of measures. Positions whose members differ are remapped by the
     * member's place in the selector.
     * 
     * @return number of copied values
     * @throws InvalidCellAddressException if the shapes are not compatible
     */
    public int assign(Area source) {
        
        Assert.notNull(source, "Source area can not null.");
        if (source.cube != cube) {
            throw new InvalidCellAddressException("Areas of different cubes can not be assigned.");
        }
        for (int position = 0; position < constraints.length; position++) {
            int[] from = source.constraints[position];
            int[] to = constraints[position];
            if ((from == null) != (to == null)) {
                throw new InvalidCellAddressException("Areas constrain different dimensions, '" 
                        + cube.getDimension(position).getName() + "' is constrained only on one side.");
            }
            if (from == null) {
                continue;
            }
            if (from.length != to.length) {
                throw new InvalidCellAddressException("Areas select " + from.length + " and " + to.length 
                        + " members of dimension '" + cube.getDimension(position).getName() + "'.");
            }
            requireLeaves(position, from);
            requireLeaves(position, to);
        }
        if (source.measures.length != measures.length) {
            throw new InvalidCellAddressException("Areas select " + source.measures.length + " and " 
                    + measures.length + " measures.");
        }
        
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        List<Pinned> values = source.pin();
        clear();
        for (Pinned p : values) {
            int[] address = p.address;
            for (int position = 0; position < constraints.length; position++) {
                int[] from = source.constraints[position];
                if (from == null || Arrays.equals(from, constraints[position])) {
                    continue;
                }
                for (int k = 0; k < from.length; k++) {
                    if (from[k] == address[position]) {
                        address[position] = constraints[position][k];
                        break;
                    }
                }
            }
            int measure = p.measure;
            for (int k = 0; k < source.measures.length; k++) {
                if (source.measures[k] == p.measure) {
                    measure = measures[k];
                    break;
                }
            }
            cube.writeRow(address, measure, p.value);
        }
        stopWatch.stop();
        LOGGER.info("Assigned {} values of cube {} using {} ms.", values.size(), cube.getName(), 
                stopWatch.getTotalTimeMillis());
        return values.size();
    }
    
    private void requireLeaves(int position, int[] members) {
        
        Dimension dimension = cube.getDimension(position);
        for (int index : members) {
            if (!dimension.getMember(index).isLeaf()) {
                throw new InvalidCellAddressException("Area assignment needs leaf members but '" 
                        + dimension.getMember(index).getName() + "' of dimension '" + dimension.getName() 
                        + "' is aggregated.");
            }
        }
    }

    @Override
    public String toString() {
        
        StringBuilder sb = new StringBuilder("Area [cube=").append(cube.getName());
        for (int position = 0; position < constraints.length; position++) {
            if (constraints[position] != null) {
                sb.append(", ").append(cube.getDimension(position).getName()).append('=')
                    .append(Arrays.toString(constraints[position]));
            }
        }
        return sb.append(']').toString();
    }
    
}
