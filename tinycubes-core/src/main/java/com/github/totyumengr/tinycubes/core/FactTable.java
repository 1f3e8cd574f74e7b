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
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

/**
 * Fact table of a {@link Cube}. It holds one row per stored base-level address, every row carries one value slot
 * per measure. Non-numeric values are stored like any other value.
 * 
 * <p>Per dimension position a bitmap index maps every member index to the ids of the rows whose address component
 * at that position is the member or one of its descendants. Aggregated cells are answered by intersecting these
 * bitmaps, use <a href="https://github.com/lemire/RoaringBitmap">RoaringBitmap</a>.
 * 
 * <p>Not thread safe, callers serialize writes.
 * 
 * @author mengran
 *
 */
public class FactTable {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(FactTable.class);
    
    /**
     * Member index standing for "any member" in {@link #query(int[])}.
     */
    public static final int WILDCARD = 0;
    
    final Meta meta;
    private final HierarchyProvider hierarchyProvider;
    
    private final Map<Integer, Record> records = new HashMap<Integer, Record>();
    private final Map<RowKey, Record> rowLookup = new HashMap<RowKey, Record>();
    
    /**
     * Bitmap index per dimension position, key is member index.
     */
    private final List<Map<Integer, RoaringBitmap>> bitmapIndex;
    
    private int nextId = 0;
    private long queryCount = 0;
    
    static class Meta {
        
        String name;
        private final List<String> dimColumnNames = new ArrayList<String>();
        private final LinkedHashMap<String, Integer> measureColumnNames = new LinkedHashMap<String, Integer>();

        @Override
        public String toString() {
            return "Meta [name=" + name + ", measure columnNames=" + measureColumnNames.keySet()
                    + ", dimension columnNames=" + dimColumnNames + "]";
        }
    }
    
    /**
     * Supplies the members a row component is indexed under.
     * 
     * @author mengran
     *
     */
    public static interface HierarchyProvider {
        
        /**
         * @param position dimension position in the address
         * @param memberIndex member index stored at that position
         * @return the member index followed by all its ancestors. MUST NOT NULL.
         */
        int[] ancestorsOrSelf(int position, int memberIndex);
    }
    
    /**
     * One stored address and its measure values.
     * @author mengran
     *
     */
    public class Record {
        
        private final int id;
        private final int[] dimOfFact;
        private final Object[] valuesOfFact;
        
        private Record(int id, int[] dimOfFact) {
            super();
            this.id = id;
            this.dimOfFact = dimOfFact;
            this.valuesOfFact = new Object[meta.measureColumnNames.size()];
        }
        
        public int getId() {
            return id;
        }
        
        public int getDim(int position) {
            return dimOfFact[position];
        }
        
        public int[] getAddress() {
            return Arrays.copyOf(dimOfFact, dimOfFact.length);
        }
        
        public Object getValue(int measure) {
            return valuesOfFact[measure];
        }
        
        public Object getValue(String measure) {
            return valuesOfFact[FactTable.this.getMeasureIndex(measure)];
        }
        
        private boolean isEmpty() {
            for (Object value : valuesOfFact) {
                if (value != null) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String toString() {
            return "Record [id=" + id + ", address=" + Arrays.toString(dimOfFact) + "]";
        }
        
    }
    
    /**
     * Structural key over an address tuple.
     */
    private static final class RowKey {
        
        private final int[] address;
        private final int hash;
        
        private RowKey(int[] address) {
            this.address = address;
            this.hash = Arrays.hashCode(address);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof RowKey && Arrays.equals(address, ((RowKey) obj).address);
        }
    }
    
    FactTable(String name, List<String> dimensionNames, List<String> measureNames, 
            HierarchyProvider hierarchyProvider) {
        
        Assert.hasText(name, "Fact-table name can not empty.");
        Assert.notEmpty(dimensionNames, "Fact-table must have a dimension column at least.");
        Assert.notEmpty(measureNames, "Fact-table must have a measure column at least.");
        Assert.notNull(hierarchyProvider, "Hierarchy provider can not null.");
        
        Meta meta = new Meta();
        meta.name = name;
        meta.dimColumnNames.addAll(dimensionNames);
        for (String measure : measureNames) {
            if (meta.measureColumnNames.containsKey(measure)) {
                throw new DuplicateKeyException("Measure " + measure + " has exists.");
            }
            meta.measureColumnNames.put(measure, meta.measureColumnNames.size());
        }
        this.meta = meta;
        this.hierarchyProvider = hierarchyProvider;
        this.bitmapIndex = new ArrayList<Map<Integer, RoaringBitmap>>(dimensionNames.size());
        for (int i = 0; i < dimensionNames.size(); i++) {
            bitmapIndex.add(new HashMap<Integer, RoaringBitmap>());
        }
    }
    
    public String getName() {
        return meta.name;
    }
    
    public int getDimensionCount() {
        return meta.dimColumnNames.size();
    }
    
    /**
     * Measure index by search {@link #meta}.
     * @param measure measure name
     * @return measure index in fact-table
     * @throws KeyNotFoundException if the measure is unknown.
     */
    public int getMeasureIndex(String measure) {
        
        Integer index = measure == null ? null : meta.measureColumnNames.get(measure);
        if (index == null) {
            throw new KeyNotFoundException("'" + measure + "' is not a measure of fact-table " + meta.name);
        }
        return index;
    }
    
    // ---------------------------- Rows ----------------------------
    
    /**
     * @return stored value or null if there is no row or no value for the measure.
     */
    public Object get(int[] address, int measure) {
        
        Record record = rowLookup.get(new RowKey(address));
        return record == null ? null : record.valuesOfFact[measure];
    }
    
    public Record getRecord(int[] address) {
        return rowLookup.get(new RowKey(address));
    }
    
    public Record getRecord(int rowId) {
        return records.get(rowId);
    }
    
    /**
     * Upsert with a non-null value, a null value clears the measure and deletes the row when no measure is left.
     * 
     * @return previous value
     */
    public Object set(int[] address, int measure, Object value) {
        
        Assert.isTrue(address.length == meta.dimColumnNames.size(), "Address must have " 
                + meta.dimColumnNames.size() + " components.");
        RowKey key = new RowKey(address);
        Record record = rowLookup.get(key);
        if (record == null) {
            if (value == null) {
                return null;
            }
            int[] copy = Arrays.copyOf(address, address.length);
            record = new Record(nextId++, copy);
            records.put(record.id, record);
            rowLookup.put(new RowKey(copy), record);
            index(record);
        }
        
        Object previous = record.valuesOfFact[measure];
        record.valuesOfFact[measure] = value;
        if (value == null && record.isEmpty()) {
            delete(record);
        }
        return previous;
    }
    
    private void index(Record record) {
        
        for (int position = 0; position < record.dimOfFact.length; position++) {
            Map<Integer, RoaringBitmap> positionIndex = bitmapIndex.get(position);
            for (int member : hierarchyProvider.ancestorsOrSelf(position, record.dimOfFact[position])) {
                RoaringBitmap bitmap = positionIndex.get(member);
                if (bitmap == null) {
                    bitmap = new RoaringBitmap();
                    positionIndex.put(member, bitmap);
                }
                bitmap.add(record.id);
            }
        }
    }
    
    private void delete(Record record) {
        
        records.remove(record.id);
        rowLookup.remove(new RowKey(record.dimOfFact));
        for (int position = 0; position < record.dimOfFact.length; position++) {
            Map<Integer, RoaringBitmap> positionIndex = bitmapIndex.get(position);
            for (int member : hierarchyProvider.ancestorsOrSelf(position, record.dimOfFact[position])) {
                RoaringBitmap bitmap = positionIndex.get(member);
                if (bitmap != null) {
                    bitmap.remove(record.id);
                    if (bitmap.isEmpty()) {
                        positionIndex.remove(member);
                    }
                }
            }
        }
    }
    
    // ---------------------------- Queries ----------------------------
    
    /**
     * Rows rolling up into an address. A component equal to {@link #WILDCARD} leaves its position unconstrained.
     * 
     * @return row ids, empty if any constrained member has no rows.
     */
    public RoaringBitmap query(int[] address) {
        
        queryCount++;
        List<RoaringBitmap> candidates = new ArrayList<RoaringBitmap>(address.length);
        for (int position = 0; position < address.length; position++) {
            if (address[position] == WILDCARD) {
                continue;
            }
            RoaringBitmap bitmap = bitmapIndex.get(position).get(address[position]);
            if (bitmap == null) {
                return new RoaringBitmap();
            }
            candidates.add(bitmap);
        }
        return intersect(candidates);
    }
    
    /**
     * Rows of a subspace. Members within a position are ORed, positions are ANDed. A null or empty entry leaves
     * the position unconstrained.
     */
    public RoaringBitmap queryArea(int[][] members) {
        
        queryCount++;
        List<RoaringBitmap> candidates = new ArrayList<RoaringBitmap>(members.length);
        for (int position = 0; position < members.length; position++) {
            if (members[position] == null || members[position].length == 0) {
                continue;
            }
            RoaringBitmap ors = new RoaringBitmap();
            for (int member : members[position]) {
                RoaringBitmap o = bitmapIndex.get(position).get(member);
                if (o != null) {
                    ors.or(o);
                }
            }
            if (ors.isEmpty()) {
                return ors;
            }
            candidates.add(ors);
        }
        return intersect(candidates);
    }
    
    private RoaringBitmap intersect(List<RoaringBitmap> candidates) {
        
        if (candidates.isEmpty()) {
            RoaringBitmap all = new RoaringBitmap();
            for (Integer id : records.keySet()) {
                all.add(id);
            }
            return all;
        }
        Collections.sort(candidates, new Comparator<RoaringBitmap>() {
            
            @Override
            public int compare(RoaringBitmap o1, RoaringBitmap o2) {
                return Integer.compare(o1.getCardinality(), o2.getCardinality());
            }
        });
        RoaringBitmap ands = candidates.get(0).clone();
        for (int i = 1; i < candidates.size() && !ands.isEmpty(); i++) {
            ands.and(candidates.get(i));
        }
        return ands;
    }
    
    /**
     * @return records of the given row ids, in id order.
     */
    public List<Record> rows(RoaringBitmap ids) {
        
        List<Record> rows = new ArrayList<Record>(ids.getCardinality());
        ids.forEach((int id) -> {
            Record record = records.get(id);
            if (record != null) {
                rows.add(record);
            }
        });
        return rows;
    }
    
    public Collection<Record> records() {
        return Collections.unmodifiableCollection(records.values());
    }
    
    public int size() {
        return records.size();
    }
    
    /**
     * @return number of {@link #query(int[])} and {@link #queryArea(int[][])} calls since creation.
     */
    public long getQueryCount() {
        return queryCount;
    }
    
    // ---------------------------- Maintenance ----------------------------
    
    /**
     * Purges every row whose component at {@code position} is one of the removed members.
     * 
     * @return number of purged rows
     */
    public int removeMembers(int position, Collection<Integer> memberIndexes) {
        
        if (memberIndexes.isEmpty()) {
            return 0;
        }
        Set<Integer> removed = new HashSet<Integer>(memberIndexes);
        RoaringBitmap obsolete = new RoaringBitmap();
        for (Iterator<Record> it = records.values().iterator(); it.hasNext();) {
            Record record = it.next();
            if (removed.contains(record.dimOfFact[position])) {
                obsolete.add(record.id);
                rowLookup.remove(new RowKey(record.dimOfFact));
                it.remove();
            }
        }
        // The hierarchy of removed members is gone, so strip purged rows from every bucket in one pass
        if (!obsolete.isEmpty()) {
            for (Map<Integer, RoaringBitmap> positionIndex : bitmapIndex) {
                for (Iterator<RoaringBitmap> it = positionIndex.values().iterator(); it.hasNext();) {
                    RoaringBitmap bitmap = it.next();
                    bitmap.andNot(obsolete);
                    if (bitmap.isEmpty()) {
                        it.remove();
                    }
                }
            }
        }
        bitmapIndex.get(position).keySet().removeAll(removed);
        int purged = obsolete.getCardinality();
        LOGGER.info("Removed {} members at position {} of {}, purged {} records.", removed.size(), position, 
                meta.name, purged);
        return purged;
    }
    
    /**
     * Rebuilds the index of one position from the rows, needed after the hierarchy of its dimension changed.
     */
    public void rebuildIndex(int position) {
        
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        Map<Integer, RoaringBitmap> positionIndex = bitmapIndex.get(position);
        positionIndex.clear();
        for (Record record : records.values()) {
            for (int member : hierarchyProvider.ancestorsOrSelf(position, record.dimOfFact[position])) {
                RoaringBitmap bitmap = positionIndex.get(member);
                if (bitmap == null) {
                    bitmap = new RoaringBitmap();
                    positionIndex.put(member, bitmap);
                }
                bitmap.add(record.id);
            }
        }
        int usedBytes = 0;
        for (Entry<Integer, RoaringBitmap> e : positionIndex.entrySet()) {
            e.getValue().runOptimize();
            usedBytes += e.getValue().getSizeInBytes();
        }
        stopWatch.stop();
        LOGGER.info("Rebuilt index of {} position {}: {} records, {} indexes used {} kb in {} ms.", meta.name, 
                position, records.size(), positionIndex.size(), usedBytes / 1024, stopWatch.getTotalTimeMillis());
    }
    
    public void clear() {
        
        records.clear();
        rowLookup.clear();
        for (Map<Integer, RoaringBitmap> positionIndex : bitmapIndex) {
            positionIndex.clear();
        }
        LOGGER.info("Cleared fact-table {}", meta.name);
    }
    
    @Override
    public String toString() {
        return "FactTable [meta=" + meta + ", records=" + records.size() + "]";
    }
    
}
