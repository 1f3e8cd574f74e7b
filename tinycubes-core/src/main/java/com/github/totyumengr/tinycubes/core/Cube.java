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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.ObjectUtils;

import com.github.totyumengr.tinycubes.core.FactTable.Record;

/**
 * Multi-dimensional cube over a set of {@link Dimension}s. Base-level cells are stored in the {@link FactTable},
 * aggregated cells are summed from the rows the fact-table index returns and cached until the next write.
 * 
 * <p>Reading a cell goes through these steps, the first one producing a value wins:
 * <ol>
 *   <li>an {@link RuleScope#ALL_LEVELS} rule matching the cell
 *   <li>base level: a {@link RuleScope#BASE_LEVEL} rule, then the stored value (0.0 if nothing is stored)
 *   <li>aggregated: an {@link RuleScope#AGGREGATION_LEVEL} rule, then the cache, then aggregation
 * </ol>
 * 
 * <p>Any write clears the whole aggregation cache. Rules may write to any cell, tracking which cached aggregates a
 * write can reach is not worth it.
 * 
 * <p>Not thread safe, callers serialize access.
 * 
 * @author mengran
 *
 */
public class Cube {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(Cube.class);
    
    public static final String DEFAULT_MEASURE = "value";
    
    private final Database database;
    private final String name;
    private final List<Dimension> dimensions;
    private final List<String> measures;
    private final FactTable factTable;
    private final Rules rules = new Rules();
    private final RuleInvocationGuard guard;
    private final boolean rounding;
    
    private final Map<CellKey, Double> cache = new HashMap<CellKey, Double>();
    private boolean caching;
    private int defaultMeasure = 0;
    
    private long cellRequestCount = 0;
    private long ruleRequestCount = 0;
    private long aggregationCount = 0;
    
    Cube(Database database, String name, List<Dimension> dimensions, List<String> measures) {
        super();
        this.database = database;
        this.name = name;
        this.dimensions = Collections.unmodifiableList(new ArrayList<Dimension>(dimensions));
        this.measures = Collections.unmodifiableList(new ArrayList<String>(measures));
        List<String> dimensionNames = new ArrayList<String>(dimensions.size());
        for (Dimension dimension : dimensions) {
            dimensionNames.add(dimension.getName());
        }
        this.factTable = new FactTable(name, dimensionNames, measures, 
                (position, memberIndex) -> this.dimensions.get(position).ancestorsOrSelf(memberIndex));
        this.guard = database.getRuleInvocationGuard();
        this.rounding = database.getSettings().isRuleRounding();
        this.caching = database.getSettings().isCaching();
    }
    
    /**
     * Builder pattern class for {@link Cube}, chain model begin with {@link #build(String)} and end with
     * {@link #done()}, which registers the cube on the database.
     * 
     * @author mengran
     *
     */
    public static class CubeBuilder {
        
        private final Database database;
        private String name;
        private List<Dimension> dimensions;
        private List<String> measures;
        
        CubeBuilder(Database database) {
            super();
            this.database = database;
        }
        
        public CubeBuilder build(String name) {
            
            if (this.name != null) {
                throw new IllegalStateException("Previous building " + this.name + " is doing call #done to finish it.");
            }
            Database.checkName(name, "cube");
            if (database.cubeExists(name)) {
                throw new DuplicateKeyException("Cube '" + name + "' already exists in database '" 
                        + database.getName() + "'.");
            }
            this.name = name;
            this.dimensions = new ArrayList<Dimension>();
            this.measures = new ArrayList<String>();
            return this;
        }
        
        public CubeBuilder addDimensions(List<String> dimensionNames) {
            
            requireBuilding();
            for (String dimensionName : dimensionNames) {
                dimensions.add(database.getDimension(dimensionName));
            }
            return this;
        }
        
        public CubeBuilder addMeasures(List<String> measureNames) {
            
            requireBuilding();
            for (String measure : measureNames) {
                Database.checkName(measure, "measure");
                for (String existing : measures) {
                    if (existing.equalsIgnoreCase(measure)) {
                        throw new DuplicateKeyException("Measure " + measure + " has exists.");
                    }
                }
                measures.add(measure);
            }
            return this;
        }
        
        public Cube done() {
            
            requireBuilding();
            Assert.isTrue(dimensions.size() > 0, "Cube must have a dimension at least.");
            if (measures.isEmpty()) {
                measures.add(DEFAULT_MEASURE);
            }
            Cube cube = new Cube(database, name, dimensions, measures);
            name = null;
            database.register(cube);
            LOGGER.info("Build completed: cube {} with dimensions {} and measures {}.", cube.name, 
                    cube.factTable.meta, cube.measures);
            return cube;
        }
        
        private void requireBuilding() {
            if (name == null) {
                throw new IllegalStateException("Current building is not started, call #build first.");
            }
        }
    }
    
    public String getName() {
        return name;
    }
    
    public Database getDatabase() {
        return database;
    }
    
    // ---------------------------- Dimensions and measures ----------------------------
    
    public List<Dimension> getDimensions() {
        return dimensions;
    }
    
    public Dimension getDimension(int ordinal) {
        return dimensions.get(ordinal);
    }
    
    public int getDimensionCount() {
        return dimensions.size();
    }
    
    /**
     * @return first ordinal of the dimension, -1 if the cube does not use it.
     */
    public int getDimensionOrdinal(String dimension) {
        
        for (int i = 0; i < dimensions.size(); i++) {
            if (dimensions.get(i).getName().equalsIgnoreCase(dimension)) {
                return i;
            }
        }
        return -1;
    }
    
    /**
     * @return all ordinals of the dimension, a dimension can be used more than once.
     */
    public List<Integer> getDimensionOrdinals(String dimension) {
        
        List<Integer> ordinals = new ArrayList<Integer>(1);
        for (int i = 0; i < dimensions.size(); i++) {
            if (dimensions.get(i).getName().equalsIgnoreCase(dimension)) {
                ordinals.add(i);
            }
        }
        return ordinals;
    }
    
    boolean uses(Dimension dimension) {
        return dimensions.contains(dimension);
    }
    
    public List<String> getMeasures() {
        return measures;
    }
    
    /**
     * @return measure id, -1 if unknown.
     */
    public int measureIndex(String measure) {
        
        for (int i = 0; i < measures.size(); i++) {
            if (measures.get(i).equalsIgnoreCase(measure)) {
                return i;
            }
        }
        return -1;
    }
    
    public String getMeasure(int measure) {
        return measures.get(measure);
    }
    
    public String getDefaultMeasure() {
        return measures.get(defaultMeasure);
    }
    
    public Cube setDefaultMeasure(String measure) {
        
        int index = measureIndex(measure);
        if (index < 0) {
            throw new KeyNotFoundException("'" + measure + "' is not a measure of cube '" + name + "'.");
        }
        defaultMeasure = index;
        return this;
    }
    
    // ---------------------------- Addressing ----------------------------
    
    /**
     * Resolves one member per dimension, in dimension order, optionally followed by a measure. A member may be
     * given as {@code member} or {@code dimension:member}.
     * 
     * @throws InvalidCellAddressException on wrong arity, unknown members or an unknown measure
     */
    public CellKey resolve(String... address) {
        
        int size = dimensions.size();
        if (address == null || (address.length != size && address.length != size + 1)) {
            throw new InvalidCellAddressException("Cube '" + name + "' expects " + size + " members and an "
                    + "optional measure but got " + ObjectUtils.nullSafeToString(address) + ".");
        }
        int[] indices = new int[size];
        for (int i = 0; i < size; i++) {
            indices[i] = resolveComponent(i, address[i]);
        }
        int measure = defaultMeasure;
        if (address.length > size) {
            measure = measureIndex(address[size]);
            if (measure < 0) {
                throw new InvalidCellAddressException("'" + address[size] + "' is not a measure of cube '" + name 
                        + "'.");
            }
        }
        return keyOf(indices, measure);
    }
    
    private int resolveComponent(int position, String component) {
        
        Dimension dimension = dimensions.get(position);
        int index = dimension.indexOf(component);
        if (index < 0 && component != null) {
            int colon = component.indexOf(':');
            if (colon > 0 && dimension.getName().equalsIgnoreCase(component.substring(0, colon))) {
                index = dimension.indexOf(component.substring(colon + 1));
            }
        }
        if (index < 0) {
            throw new InvalidCellAddressException("'" + component + "' is not a member of dimension '" 
                    + dimension.getName() + "' at position " + position + " of cube '" + name + "'.");
        }
        return index;
    }
    
    CellKey keyOf(int[] indices, int measure) {
        
        int level = 0;
        for (int i = 0; i < indices.length; i++) {
            Member member = dimensions.get(i).getMember(indices[i]);
            if (member == null) {
                throw new InvalidCellAddressException("Member index " + indices[i] + " does not exist in dimension '" 
                        + dimensions.get(i).getName() + "'.");
            }
            level += member.getLevel();
        }
        return new CellKey(level, indices, measure);
    }
    
    /**
     * Resolves a cell modifier: {@code member}, {@code dimension:member}, {@code ordinal:member} or a measure
     * name. A bare name is looked up in the dimensions in order, then in the measures.
     * 
     * @return {position, member index}, position -1 stands for a measure with the measure id as second element.
     * @throws InvalidCellAddressException if the token resolves to nothing
     */
    int[] resolveToken(String token) {
        
        Assert.hasText(token, "Cell modifier can not empty.");
        int colon = token.indexOf(':');
        if (colon > 0) {
            String prefix = token.substring(0, colon);
            String member = token.substring(colon + 1);
            int position = -1;
            if (prefix.chars().allMatch(Character::isDigit)) {
                position = Integer.parseInt(prefix);
                if (position >= dimensions.size()) {
                    throw new InvalidCellAddressException("Cube '" + name + "' has no dimension ordinal " + position 
                            + ".");
                }
            } else {
                position = getDimensionOrdinal(prefix);
            }
            if (position >= 0) {
                int index = dimensions.get(position).indexOf(member);
                if (index < 0) {
                    throw new InvalidCellAddressException("'" + member + "' is not a member of dimension '" 
                            + dimensions.get(position).getName() + "'.");
                }
                return new int[] {position, index};
            }
        }
        for (int i = 0; i < dimensions.size(); i++) {
            int index = dimensions.get(i).indexOf(token);
            if (index >= 0) {
                return new int[] {i, index};
            }
        }
        int measure = measureIndex(token);
        if (measure >= 0) {
            return new int[] {-1, measure};
        }
        throw new InvalidCellAddressException("'" + token + "' is neither a member nor a measure of cube '" 
                + name + "'.");
    }
    
    /**
     * @return key of {@code base} with the modifiers applied.
     */
    CellKey alter(CellKey base, String... modifiers) {
        
        int[] indices = base.getIndices();
        int measure = base.getMeasure();
        for (String modifier : modifiers) {
            int[] resolved = resolveToken(modifier);
            if (resolved[0] < 0) {
                measure = resolved[1];
            } else {
                indices[resolved[0]] = resolved[1];
            }
        }
        return keyOf(indices, measure);
    }
    
    /**
     * Builds a trigger from cell modifiers. No tokens means every cell.
     */
    public TriggerPattern trigger(String... tokens) {
        
        List<Integer> positions = new ArrayList<Integer>(tokens.length);
        List<Integer> members = new ArrayList<Integer>(tokens.length);
        int measure = TriggerPattern.ANY_MEASURE;
        for (String token : tokens) {
            int[] resolved = resolveToken(token);
            if (resolved[0] < 0) {
                if (measure != TriggerPattern.ANY_MEASURE && measure != resolved[1]) {
                    throw new InvalidCellAddressException("Trigger " + Arrays.toString(tokens) 
                            + " names more than one measure.");
                }
                measure = resolved[1];
            } else {
                positions.add(resolved[0]);
                members.add(resolved[1]);
            }
        }
        return new TriggerPattern(Arrays.copyOf(tokens, tokens.length), 
                positions.stream().mapToInt(Integer::intValue).toArray(), 
                members.stream().mapToInt(Integer::intValue).toArray(), measure);
    }
    
    // ---------------------------- Read ----------------------------
    
    public Object get(String... address) {
        return getValue(resolve(address));
    }
    
    /**
     * @return numeric value of the cell, 0.0 for non-numeric values.
     */
    public double getDouble(String... address) {
        return toDouble(get(address));
    }
    
    public Cell cell(String... address) {
        return new Cell(this, resolve(address));
    }
    
    Object getValue(CellKey key) {
        
        cellRequestCount++;
        Rule rule = rules.match(RuleScope.ALL_LEVELS, key.indices(), key.getMeasure());
        if (rule != null) {
            Outcome outcome = invokeRule(rule, new Cell(this, key));
            if (!outcome.isProceed()) {
                return outcome.getValue();
            }
        }
        return evaluate(key, true);
    }
    
    /**
     * Stored or aggregated value, ignoring all read rules.
     */
    Object getValueBypassRules(CellKey key) {
        
        cellRequestCount++;
        return evaluate(key, false);
    }
    
    private Object evaluate(CellKey key, boolean applyRules) {
        
        if (key.isBaseLevel()) {
            if (applyRules) {
                Rule rule = rules.match(RuleScope.BASE_LEVEL, key.indices(), key.getMeasure());
                if (rule != null) {
                    Outcome outcome = invokeRule(rule, new Cell(this, key));
                    if (!outcome.isProceed()) {
                        return outcome.getValue();
                    }
                }
            }
            Object value = factTable.get(key.indices(), key.getMeasure());
            return value == null ? 0.0 : value;
        }
        
        if (applyRules) {
            Rule rule = rules.match(RuleScope.AGGREGATION_LEVEL, key.indices(), key.getMeasure());
            if (rule != null) {
                Outcome outcome = invokeRule(rule, new Cell(this, key));
                if (!outcome.isProceed()) {
                    return outcome.getValue();
                }
            }
        }
        return aggregate(key);
    }
    
    private double aggregate(CellKey key) {
        
        if (caching) {
            Double cached = cache.get(key);
            if (cached != null) {
                return cached;
            }
        }
        
        long enterTime = System.currentTimeMillis();
        int[] indices = key.indices();
        int measure = key.getMeasure();
        boolean weighted = false;
        for (int i = 0; i < indices.length; i++) {
            weighted |= dimensions.get(i).isWeighted() && !dimensions.get(i).getMember(indices[i]).isLeaf();
        }
        boolean rollUp = rules.hasRules(RuleScope.ROLL_UP);
        
        RoaringBitmap ids = factTable.query(indices);
        double total = 0;
        int rows = 0;
        for (Record record : factTable.rows(ids)) {
            Object value = record.getValue(measure);
            if (rollUp) {
                Rule rule = rules.match(RuleScope.ROLL_UP, record.getAddress(), measure);
                if (rule != null) {
                    Outcome outcome = invokeRule(rule, new Cell(this, keyOf(record.getAddress(), measure)));
                    if (!outcome.isProceed()) {
                        value = outcome.getValue();
                    }
                }
            }
            if (!(value instanceof Number)) {
                continue;
            }
            double contribution = ((Number) value).doubleValue();
            if (weighted) {
                for (int i = 0; i < indices.length; i++) {
                    contribution *= dimensions.get(i).weightTo(record.getDim(i), indices[i]);
                }
            }
            total += contribution;
            rows++;
        }
        aggregationCount += rows;
        
        if (caching) {
            cache.put(key, total);
        }
        LOGGER.debug("Aggregated {} of cube {} over {} records, result {} using {} ms.", key, name, rows, total, 
                System.currentTimeMillis() - enterTime);
        return total;
    }
    
    // ---------------------------- Write ----------------------------
    
    public void set(List<String> address, Object value) {
        setValue(resolve(address.toArray(new String[address.size()])), value);
    }
    
    public void set(String[] address, Object value) {
        setValue(resolve(address), value);
    }
    
    /**
     * Writes a base-level cell, clears the aggregation cache and fires the first matching
     * {@link RuleScope#ON_ENTRY} rule. Numbers are stored as {@link Double}, null deletes the value.
     * 
     * @throws InvalidOperationException for aggregated cells
     */
    void setValue(CellKey key, Object value) {
        
        if (!key.isBaseLevel()) {
            throw new InvalidOperationException("Cube '" + name + "' can not write to aggregated cell " 
                    + describe(key) + ". Only base-level cells are stored.");
        }
        Object normalized = value instanceof Number ? Double.valueOf(((Number) value).doubleValue()) : value;
        factTable.set(key.indices(), key.getMeasure(), normalized);
        cache.clear();
        
        Rule rule = rules.match(RuleScope.ON_ENTRY, key.indices(), key.getMeasure());
        if (rule != null) {
            invokeRule(rule, new Cell(this, key));
        }
    }
    
    /**
     * Writes a stored row of an area. Base-level cells go through {@link #setValue(CellKey, Object)}, rows kept on
     * members that became aggregated after they were written are updated in place without rules.
     */
    void writeRow(int[] indices, int measure, Object value) {
        
        CellKey key = keyOf(indices, measure);
        if (key.isBaseLevel()) {
            setValue(key, value);
            return;
        }
        LOGGER.debug("Cube {} writes row {} stored on aggregated members.", name, describe(key));
        setStored(indices, measure, value instanceof Number ? Double.valueOf(((Number) value).doubleValue()) : value);
    }
    
    /**
     * Writes a base-level row directly, no rules. Used to restore pinned rows.
     */
    void setStored(int[] indices, int measure, Object value) {
        factTable.set(indices, measure, value);
        cache.clear();
    }
    
    public Area area(Object... selector) {
        return new Area(this, selector);
    }
    
    /**
     * Removes all facts.
     */
    public void clear() {
        factTable.clear();
        cache.clear();
    }
    
    // ---------------------------- Rules ----------------------------
    
    public Cube registerRule(Rule rule) {
        
        Assert.notNull(rule, "Rule can not null.");
        rules.register(rule);
        cache.clear();
        LOGGER.info("Registered rule {} on cube {}", rule, name);
        return this;
    }
    
    /**
     * @param trigger cell modifiers, see {@link #trigger(String...)}
     */
    public Cube registerRule(String ruleName, RuleScope scope, RuleFunction function, String... trigger) {
        return registerRule(Rules.of(ruleName, scope, trigger(trigger), function));
    }
    
    public boolean removeRule(String ruleName) {
        
        boolean removed = rules.remove(ruleName);
        if (removed) {
            cache.clear();
            LOGGER.info("Removed rule {} from cube {}", ruleName, name);
        }
        return removed;
    }
    
    public void removeAllRules() {
        rules.clear();
        cache.clear();
    }
    
    public List<Rule> getRules() {
        return rules.all();
    }
    
    /**
     * Runs a {@link RuleScope#COMMAND} rule on a cell.
     * 
     * @return value produced by the rule, null if it returned {@link Outcome#proceed()}
     */
    public Object executeCommand(String ruleName, String... address) {
        
        Rule rule = rules.get(ruleName);
        if (rule == null) {
            throw new KeyNotFoundException("Rule '" + ruleName + "' is not registered on cube '" + name + "'.");
        }
        if (rule.getScope() != RuleScope.COMMAND) {
            throw new InvalidOperationException("Rule '" + ruleName + "' is a " + rule.getScope() 
                    + " rule, only COMMAND rules can be executed.");
        }
        CellKey key = resolve(address);
        if (!rule.getTrigger().matches(key)) {
            throw new InvalidOperationException("Command '" + ruleName + "' does not apply to cell " 
                    + describe(key) + ".");
        }
        LOGGER.info("Execute command {} on cube {} cell {}", ruleName, name, describe(key));
        return invokeRule(rule, new Cell(this, key)).getValue();
    }
    
    private Outcome invokeRule(Rule rule, Cell cell) {
        
        ruleRequestCount++;
        guard.enter(rule);
        Outcome outcome;
        try {
            outcome = rule.invoke(cell);
        } catch (RuleException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RuleException("Rule '" + rule.getName() + "' failed on cell " + describe(cell.getKey()) 
                    + " of cube '" + name + "': " + e.getMessage(), e);
        } finally {
            guard.exit();
        }
        if (outcome == null) {
            throw new RuleException("Rule '" + rule.getName() + "' returned no outcome.");
        }
        if (outcome.isError()) {
            throw new RuleException("Rule '" + rule.getName() + "' reported an error on cell " 
                    + describe(cell.getKey()) + ": " + outcome.getMessage());
        }
        if (rounding && outcome.getValue() instanceof Number) {
            return Outcome.of(Rules.round(((Number) outcome.getValue()).doubleValue()));
        }
        return outcome;
    }
    
    // ---------------------------- Maintenance ----------------------------
    
    /**
     * Called by the database after a dimension of this cube committed.
     */
    void dimensionCommitted(Dimension dimension, Set<Integer> removed, boolean hierarchyChanged) {
        
        for (int position = 0; position < dimensions.size(); position++) {
            if (dimensions.get(position) != dimension) {
                continue;
            }
            if (!removed.isEmpty()) {
                factTable.removeMembers(position, removed);
                for (Rule rule : rules.removeReferencing(position, removed)) {
                    LOGGER.warn("Dropped rule {} of cube {}, its trigger refers to a removed member.", rule, name);
                }
            }
            if (hierarchyChanged) {
                factTable.rebuildIndex(position);
            }
        }
        cache.clear();
    }
    
    boolean isRuleRounding() {
        return rounding;
    }
    
    public void flushCache() {
        cache.clear();
    }
    
    public boolean isCaching() {
        return caching;
    }
    
    public Cube setCaching(boolean caching) {
        this.caching = caching;
        if (!caching) {
            cache.clear();
        }
        return this;
    }
    
    int getCacheSize() {
        return cache.size();
    }
    
    FactTable getFactTable() {
        return factTable;
    }
    
    /**
     * @return number of stored base-level rows.
     */
    public int getCellsCount() {
        return factTable.size();
    }
    
    /**
     * @return all stored values, one record per row and non-null measure.
     */
    public List<CellRecord> records() {
        
        List<CellRecord> result = new ArrayList<CellRecord>(factTable.size());
        for (Record record : factTable.records()) {
            List<String> members = memberNames(record.getAddress());
            for (int measure = 0; measure < measures.size(); measure++) {
                Object value = record.getValue(measure);
                if (value != null) {
                    result.add(new CellRecord(members, measures.get(measure), value));
                }
            }
        }
        return result;
    }
    
    List<String> memberNames(int[] indices) {
        
        List<String> names = new ArrayList<String>(indices.length);
        for (int i = 0; i < indices.length; i++) {
            names.add(dimensions.get(i).getMember(indices[i]).getName());
        }
        return names;
    }
    
    String describe(CellKey key) {
        
        List<String> names = new ArrayList<String>(key.indices().length + 1);
        for (int i = 0; i < key.indices().length; i++) {
            Member member = dimensions.get(i).getMember(key.getIndex(i));
            names.add(member == null ? String.valueOf(key.getIndex(i)) : member.getName());
        }
        names.add(measures.get(key.getMeasure()));
        return names.toString();
    }
    
    static double toDouble(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }
    
    // ---------------------------- Counters ----------------------------

    public long getCellRequestCount() {
        return cellRequestCount;
    }

    public long getRuleRequestCount() {
        return ruleRequestCount;
    }

    public long getAggregationCount() {
        return aggregationCount;
    }
    
    public void resetCounters() {
        cellRequestCount = 0;
        ruleRequestCount = 0;
        aggregationCount = 0;
    }

    @Override
    public String toString() {
        return "Cube [name=" + name + ", factTable=" + factTable + "]";
    }
    
}
