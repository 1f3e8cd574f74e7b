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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.ClassUtils;
import org.springframework.util.LinkedCaseInsensitiveMap;
import org.springframework.util.NumberUtils;
import org.springframework.util.ObjectUtils;
import org.springframework.util.PatternMatchUtils;
import org.springframework.util.StopWatch;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.tinycubes.core.DimensionSnapshot.MemberSnapshot;
import com.github.totyumengr.tinycubes.core.DimensionSnapshot.SubsetSnapshot;

/**
 * Hierarchy of members a {@link Cube} is addressed by. Members are kept in an arena keyed by integer index, the
 * parent/child graph is a pair of index lists per member and must stay acyclic.
 * 
 * <p>Structural changes (add, remove, rename members, add edges, clear) are only allowed between
 * {@link #beginEdit()} and {@link #commit()}/{@link #rollback()}. Commit recomputes levels, ancestor sets, base
 * descendant sets and effective weights and reports removed member indices to the owning {@link Database}.
 * Attributes, aliases, descriptions, formats and subsets can be changed at any time.
 * 
 * <p>Member names, aliases, attribute and subset names are case-insensitive.
 * 
 * @author mengran
 *
 */
public class Dimension {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(Dimension.class);
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    /**
     * Reserved, stands for "any member" in addresses and fact-table queries.
     */
    public static final String WILDCARD = "*";
    
    private final Database database;
    private final String name;
    private String description;
    
    private final Map<Integer, Member> members = new TreeMap<Integer, Member>();
    private final Map<String, Integer> lookup = new LinkedCaseInsensitiveMap<Integer>();
    private final Map<String, Integer> aliases = new LinkedCaseInsensitiveMap<Integer>();
    private final Map<String, Class<?>> attributeTypes = new LinkedCaseInsensitiveMap<Class<?>>();
    private final Map<String, Subset> subsets = new LinkedCaseInsensitiveMap<Subset>();
    
    private MemberIndexManager indexManager = new MemberIndexManager();
    
    private boolean editing = false;
    private boolean structureChanged = false;
    private EditRecovery recovery;
    private boolean weighted = false;
    
    /**
     * Hands out member indices. Index 0 is never used, freed indices are reused lowest first.
     */
    static class MemberIndexManager {
        
        private TreeSet<Integer> free = new TreeSet<Integer>();
        private int next = 1;
        
        int pop() {
            if (free.isEmpty()) {
                return next++;
            }
            return free.pollFirst();
        }
        
        void push(int index) {
            Assert.isTrue(index > 0 && index < next, "Index " + index + " was never handed out.");
            free.add(index);
        }
        
        /**
         * Take a specific index, used when members are restored with their original indices.
         */
        void claim(int index) {
            Assert.isTrue(index > 0, "Member index must be greater than 0.");
            if (index >= next) {
                for (int i = next; i < index; i++) {
                    free.add(i);
                }
                next = index + 1;
            } else {
                free.remove(index);
            }
        }
        
        void reset() {
            free.clear();
            next = 1;
        }
        
        MemberIndexManager copy() {
            MemberIndexManager copy = new MemberIndexManager();
            copy.free = new TreeSet<Integer>(free);
            copy.next = next;
            return copy;
        }
        
        int getNext() {
            return next;
        }
    }
    
    /**
     * State captured by {@link Dimension#beginEdit()}. Member objects are kept by identity, so commit can tell a
     * removed member from a renamed one and rollback can hand the same objects back.
     */
    private static class EditRecovery {
        
        private DimensionSnapshot snapshot;
        private Map<Integer, Member> members;
        private Map<String, Subset> subsets;
        private Map<String, Class<?>> attributeTypes;
        private MemberIndexManager indexManager;
    }
    
    Dimension(Database database, String name, String description) {
        super();
        Assert.hasText(name, "Dimension name can not empty.");
        this.database = database;
        this.name = name;
        this.description = StringUtils.hasText(description) ? description : name;
    }
    
    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
    
    public Database getDatabase() {
        return database;
    }

    // ---------------------------- Edit lifecycle ----------------------------
    
    public Dimension beginEdit() {
        
        if (editing) {
            throw new DimensionEditModeException("Dimension '" + name + "' is already in edit mode.");
        }
        EditRecovery r = new EditRecovery();
        r.snapshot = toSnapshot();
        r.members = new HashMap<Integer, Member>(members);
        r.subsets = new LinkedCaseInsensitiveMap<Subset>();
        for (Entry<String, Subset> e : subsets.entrySet()) {
            r.subsets.put(e.getKey(), e.getValue().copy());
        }
        r.attributeTypes = new LinkedCaseInsensitiveMap<Class<?>>();
        r.attributeTypes.putAll(attributeTypes);
        r.indexManager = indexManager.copy();
        
        recovery = r;
        editing = true;
        structureChanged = false;
        LOGGER.debug("Begin edit of dimension {}", name);
        return this;
    }
    
    public boolean isEditing() {
        return editing;
    }
    
    /**
     * Ends the edit transaction, recomputes the hierarchy and reports removed members to the database. If the
     * recomputation fails the dimension is put back into its state before {@link #beginEdit()}.
     */
    public Dimension commit() {
        
        requireEditing("commit");
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        
        Set<Integer> removed = new TreeSet<Integer>();
        boolean changed = structureChanged;
        try {
            updateHierarchy();
            for (Entry<Integer, Member> e : recovery.members.entrySet()) {
                if (members.get(e.getKey()) != e.getValue()) {
                    removed.add(e.getKey());
                }
            }
        } catch (RuntimeException e) {
            LOGGER.error("Failed to commit dimension {}, restoring state before edit.", name);
            restore();
            throw e;
        }
        
        for (Subset subset : subsets.values()) {
            subset.invalidate();
        }
        editing = false;
        recovery = null;
        stopWatch.stop();
        LOGGER.info("Committed dimension {} with {} members, {} removed, hierarchy recomputed in {} ms.", 
                name, members.size(), removed.size(), stopWatch.getTotalTimeMillis());
        
        if (database != null) {
            database.dimensionCommitted(this, removed, changed || !removed.isEmpty());
        }
        return this;
    }
    
    /**
     * Ends the edit transaction and restores the state captured by {@link #beginEdit()}.
     */
    public Dimension rollback() {
        
        requireEditing("rollback");
        restore();
        LOGGER.info("Rolled back dimension {}", name);
        return this;
    }
    
    private void restore() {
        
        EditRecovery r = recovery;
        // Members created during the edit may already carry facts
        Set<Integer> created = new TreeSet<Integer>(members.keySet());
        created.removeAll(r.members.keySet());
        members.clear();
        lookup.clear();
        aliases.clear();
        for (MemberSnapshot ms : r.snapshot.members.values()) {
            Member m = r.members.get(ms.index);
            m.setName(ms.name);
            m.setDescription(ms.description);
            m.setFormat(ms.format);
            m.clearEdges();
            m.parents.addAll(ms.parents);
            m.children.addAll(ms.children);
            for (Integer parent : ms.parents) {
                Double weight = ms.weights.get(parent);
                m.weights.put(parent, weight == null ? 1.0 : weight);
            }
            m.attributes.clear();
            m.attributes.putAll(ms.attributes);
            members.put(ms.index, m);
            lookup.put(ms.name, ms.index);
        }
        for (Entry<String, String> e : r.snapshot.aliases.entrySet()) {
            aliases.put(e.getKey(), lookup.get(e.getValue()));
        }
        subsets.clear();
        subsets.putAll(r.subsets);
        attributeTypes.clear();
        attributeTypes.putAll(r.attributeTypes);
        indexManager = r.indexManager;
        
        // Derived fields are only written on commit, a failed commit may have left them half done.
        updateHierarchy();
        editing = false;
        recovery = null;
        
        if (database != null && !created.isEmpty()) {
            LOGGER.info("Dimension {} dropped members {} created during the edit.", name, created);
            database.dimensionCommitted(this, created, true);
        }
    }
    
    private void requireEditing(String operation) {
        if (!editing) {
            throw new DimensionEditModeException("Failed to " + operation + ". Dimension '" + name 
                    + "' is not in edit mode.");
        }
    }
    
    // ---------------------------- Structure ----------------------------
    
    public int addMember(String member) {
        return addMember(member, null, 1.0, null);
    }
    
    public int addMember(String member, String parent) {
        return addMember(member, parent, 1.0, null);
    }
    
    public int addMember(String member, String parent, double weight) {
        return addMember(member, parent, weight, null);
    }
    
    /**
     * Adds a member, idempotent on the name. An existing member gets its description updated and, if a parent is
     * given, the parent edge added. A missing parent is created.
     * 
     * @param member member name
     * @param parent parent name, can be null
     * @param weight weight the member aggregates into the parent with
     * @param description description, can be null
     * @return index of the member
     * @throws InvalidKeyException on names containing tab, newline or carriage return
     * @throws CircularReferenceException if the edge would make the member its own ancestor
     */
    public int addMember(String member, String parent, double weight, String description) {
        
        requireEditing("add member '" + member + "'");
        int index = getOrCreate(member);
        if (description != null) {
            members.get(index).setDescription(description);
        }
        if (parent != null) {
            int parentIndex = getOrCreate(parent);
            addEdge(index, parentIndex, weight);
        }
        return index;
    }
    
    /**
     * Adds a parent and its children, each child with weight 1.0.
     */
    public Dimension addMany(String parent, List<String> children) {
        return addMany(parent, children, 1.0);
    }
    
    /**
     * Adds a parent and its children, all children with the same weight.
     */
    public Dimension addMany(String parent, List<String> children, double weight) {
        
        requireEditing("add members to '" + parent + "'");
        for (String child : children) {
            checkMemberName(child);
        }
        getOrCreate(parent);
        for (String child : children) {
            addMember(child, parent, weight);
        }
        return this;
    }
    
    /**
     * Adds a parent and its children with one weight per child.
     */
    public Dimension addMany(String parent, List<String> children, List<Double> weights) {
        
        requireEditing("add members to '" + parent + "'");
        Assert.notNull(weights, "Weights can not null.");
        Assert.isTrue(children.size() == weights.size(), "Weights must mirror children, expected " 
                + children.size() + " weights but got " + weights.size() + ".");
        getOrCreate(parent);
        for (int i = 0; i < children.size(); i++) {
            Double weight = weights.get(i);
            addMember(children.get(i), parent, weight == null ? 1.0 : weight);
        }
        return this;
    }
    
    /**
     * Adds members without parents.
     */
    public Dimension addMany(List<String> members) {
        
        requireEditing("add members");
        for (String member : members) {
            checkMemberName(member);
        }
        for (String member : members) {
            getOrCreate(member);
        }
        return this;
    }
    
    /**
     * Adds members together with their children, {@code children.get(i)} lists the children of
     * {@code members.get(i)} and may be null or empty.
     */
    public Dimension addMany(List<String> members, List<List<String>> children) {
        
        Assert.isTrue(children == null || children.size() == members.size(), 
                "Children must mirror members, one child list per member.");
        addMany(members);
        if (children != null) {
            for (int i = 0; i < members.size(); i++) {
                List<String> c = children.get(i);
                if (c != null && !c.isEmpty()) {
                    addMany(members.get(i), c);
                }
            }
        }
        return this;
    }
    
    /**
     * Adds a whole tree with weight 1.0 everywhere.
     * 
     * @see #addTree(Map, Map)
     */
    public Dimension addTree(Map<String, ?> tree) {
        return addTree(tree, null);
    }
    
    /**
     * Adds a whole tree. Keys of {@code tree} are members, a value is null (no children), a {@code List} of child
     * names or a nested {@code Map} of the same shape. {@code weights} mirrors the shape: per member either a
     * {@code Number} for all its children, a {@code List} with one weight per child, or a nested {@code Map}.
     * Missing weights default to 1.0.
     */
    public Dimension addTree(Map<String, ?> tree, Map<String, ?> weights) {
        
        requireEditing("add member tree");
        addSubtree(null, tree, weights, 1.0);
        return this;
    }
    
    @SuppressWarnings("unchecked")
    private void addSubtree(String parent, Map<String, ?> tree, Map<String, ?> weights, double inherited) {
        
        for (Entry<String, ?> e : tree.entrySet()) {
            String member = e.getKey();
            Object children = e.getValue();
            Object weight = weights == null ? null : weights.get(member);
            if (parent == null) {
                getOrCreate(member);
            } else {
                addMember(member, parent, inherited);
            }
            
            if (children == null) {
                continue;
            }
            if (children instanceof Map) {
                if (weight instanceof Map) {
                    addSubtree(member, (Map<String, ?>) children, (Map<String, ?>) weight, 1.0);
                } else {
                    addSubtree(member, (Map<String, ?>) children, null, weightOf(member, weight));
                }
            } else if (children instanceof List) {
                List<String> childList = (List<String>) children;
                if (weight instanceof List) {
                    addMany(member, childList, (List<Double>) weight);
                } else {
                    addMany(member, childList, weightOf(member, weight));
                }
            } else {
                throw new IllegalArgumentException("Unexpected children type " + children.getClass().getName() 
                        + " for member '" + member + "' of dimension '" + name + "'.");
            }
        }
    }
    
    private double weightOf(String member, Object weight) {
        if (weight == null) {
            return 1.0;
        }
        Assert.isInstanceOf(Number.class, weight, "Weight of member '" + member + "' must be a number.");
        return ((Number) weight).doubleValue();
    }
    
    private int getOrCreate(String member) {
        
        checkMemberName(member);
        Integer index = lookup.get(member);
        if (index != null) {
            return index;
        }
        if (aliases.containsKey(member)) {
            throw new DuplicateKeyException("Failed to add member '" + member + "' to dimension '" + name 
                    + "'. The name is already used as an alias.");
        }
        int newIndex = indexManager.pop();
        members.put(newIndex, new Member(this, newIndex, member));
        lookup.put(member, newIndex);
        structureChanged = true;
        return newIndex;
    }
    
    private void addEdge(int child, int parent, double weight) {
        
        Member c = members.get(child);
        Member p = members.get(parent);
        if (c.parents.contains(parent)) {
            c.weights.put(parent, weight);
            structureChanged = true;
            return;
        }
        if (child == parent || isAncestor(child, parent)) {
            throw new CircularReferenceException("Failed to add '" + c.getName() + "' as child of '" + p.getName() 
                    + "' in dimension '" + name + "'. '" + c.getName() + "' would become its own ancestor.");
        }
        c.parents.add(parent);
        c.weights.put(parent, weight);
        p.children.add(child);
        structureChanged = true;
    }
    
    /**
     * Walks up from {@code from} over the current, uncommitted, graph.
     * 
     * @return true if {@code candidate} is {@code from} itself or one of its ancestors
     */
    private boolean isAncestor(int candidate, int from) {
        
        Set<Integer> visited = new HashSet<Integer>();
        List<Integer> stack = new ArrayList<Integer>();
        stack.add(from);
        while (!stack.isEmpty()) {
            int current = stack.remove(stack.size() - 1);
            if (current == candidate) {
                return true;
            }
            if (visited.add(current)) {
                stack.addAll(members.get(current).parents);
            }
        }
        return false;
    }
    
    /**
     * Removes members from the dimension. All names are checked before anything is removed.
     * 
     * @throws KeyNotFoundException if one of the members does not exist
     */
    public Dimension removeMember(String... members) {
        return removeMembers(Arrays.asList(members));
    }
    
    public Dimension removeMembers(Collection<String> names) {
        
        requireEditing("remove members");
        List<Integer> indexes = new ArrayList<Integer>(names.size());
        for (String member : names) {
            Integer index = lookup.get(member);
            if (index == null) {
                throw new KeyNotFoundException("Failed to remove member(s). '" + member 
                        + "' is not a member of dimension '" + name + "'.");
            }
            indexes.add(index);
        }
        for (Integer index : indexes) {
            removeIndex(index);
        }
        return this;
    }
    
    private void removeIndex(int index) {
        
        Member m = members.remove(index);
        if (m == null) {
            return;
        }
        for (Integer parent : m.parents) {
            Member p = members.get(parent);
            if (p != null) {
                p.children.remove(Integer.valueOf(index));
            }
        }
        for (Integer child : m.children) {
            Member c = members.get(child);
            if (c != null) {
                c.parents.remove(Integer.valueOf(index));
                c.weights.remove(index);
            }
        }
        lookup.remove(m.getName());
        for (String alias : new ArrayList<String>(aliases.keySet())) {
            if (aliases.get(alias) == index) {
                aliases.remove(alias);
            }
        }
        for (Subset subset : subsets.values()) {
            subset.removeIndex(index);
        }
        indexManager.push(index);
        structureChanged = true;
    }
    
    /**
     * Renames a member in place. Index, edges, attributes and subset membership are kept.
     */
    public Dimension renameMember(String member, String newName) {
        
        requireEditing("rename member '" + member + "'");
        Integer index = lookup.get(member);
        if (index == null) {
            throw new KeyNotFoundException("Failed to rename. '" + member + "' is not a member of dimension '" 
                    + name + "'.");
        }
        checkMemberName(newName);
        Integer existing = lookup.get(newName);
        if ((existing != null && !existing.equals(index)) || aliases.containsKey(newName)) {
            throw new DuplicateKeyException("Failed to rename '" + member + "'. '" + newName 
                    + "' already exists in dimension '" + name + "'.");
        }
        Member m = members.get(index);
        lookup.remove(m.getName());
        m.setName(newName);
        lookup.put(newName, index);
        return this;
    }
    
    /**
     * Removes all members. Attribute definitions are kept, static subsets become empty.
     */
    public Dimension clear() {
        
        requireEditing("clear");
        for (Integer index : new ArrayList<Integer>(members.keySet())) {
            removeIndex(index);
        }
        return this;
    }
    
    private void checkMemberName(String member) {
        
        if (!StringUtils.hasLength(member) || member.indexOf('\t') >= 0 || member.indexOf('\n') >= 0 
                || member.indexOf('\r') >= 0) {
            throw new InvalidKeyException("Invalid member name '" + member + "' for dimension '" + name 
                    + "'. Empty names and '\\t', '\\n' or '\\r' characters are not supported.");
        }
        if (WILDCARD.equals(member)) {
            throw new InvalidKeyException("'" + WILDCARD + "' is reserved and not a valid member name.");
        }
    }
    
    // ---------------------------- Hierarchy ----------------------------
    
    /**
     * Recomputes all derived member fields from the current graph. Results are collected first and written in
     * one pass at the end.
     */
    private void updateHierarchy() {
        
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        
        Map<Integer, Integer> levels = new HashMap<Integer, Integer>(members.size());
        for (Integer index : members.keySet()) {
            levelOf(index, levels);
        }
        
        Map<Integer, LinkedHashMap<Integer, Double>> ancestors = new HashMap<Integer, LinkedHashMap<Integer, Double>>();
        Map<Integer, int[]> baseDescendants = new HashMap<Integer, int[]>();
        boolean anyWeight = false;
        for (Member m : members.values()) {
            LinkedHashMap<Integer, Double> effective = new LinkedHashMap<Integer, Double>();
            collectAncestors(m, 1.0, effective);
            ancestors.put(m.getIndex(), effective);
            
            if (!m.children.isEmpty()) {
                LinkedHashSet<Integer> leaves = new LinkedHashSet<Integer>();
                collectLeaves(m, leaves);
                baseDescendants.put(m.getIndex(), leaves.stream().mapToInt(Integer::intValue).toArray());
            }
            for (Double weight : m.weights.values()) {
                anyWeight |= weight != 1.0;
            }
        }
        
        for (Member m : members.values()) {
            LinkedHashMap<Integer, Double> effective = ancestors.get(m.getIndex());
            m.level = levels.get(m.getIndex());
            m.ancestors = effective.keySet().stream().mapToInt(Integer::intValue).toArray();
            m.effectiveWeights = Collections.unmodifiableMap(effective);
            int[] leaves = baseDescendants.get(m.getIndex());
            m.baseDescendants = leaves == null ? Member.EMPTY : leaves;
        }
        weighted = anyWeight;
        
        stopWatch.stop();
        LOGGER.debug("Recomputed hierarchy of dimension {} in {} ms, weighted {}", name, 
                stopWatch.getTotalTimeMillis(), weighted);
    }
    
    private int levelOf(int index, Map<Integer, Integer> levels) {
        
        Integer level = levels.get(index);
        if (level != null) {
            return level;
        }
        int max = -1;
        for (Integer child : members.get(index).children) {
            max = Math.max(max, levelOf(child, levels));
        }
        levels.put(index, max + 1);
        return max + 1;
    }
    
    /**
     * Depth first in parent registration order, the first path reaching an ancestor defines its weight.
     */
    private void collectAncestors(Member m, double weight, Map<Integer, Double> effective) {
        
        for (Integer parent : m.parents) {
            if (!effective.containsKey(parent)) {
                double w = weight * m.getWeight(parent);
                effective.put(parent, w);
                collectAncestors(members.get(parent), w, effective);
            }
        }
    }
    
    private void collectLeaves(Member m, Set<Integer> leaves) {
        
        for (Integer child : m.children) {
            Member c = members.get(child);
            if (c.children.isEmpty()) {
                leaves.add(child);
            } else {
                collectLeaves(c, leaves);
            }
        }
    }
    
    /**
     * @return the member index followed by all its ancestors, the buckets a fact row is indexed under. While an edit
     *         is open the hierarchy before the edit answers, the one rows were indexed with.
     */
    int[] ancestorsOrSelf(int index) {
        
        Member m = recovery != null ? recovery.members.get(index) : null;
        if (m == null) {
            m = members.get(index);
        }
        if (m == null) {
            return new int[] {index};
        }
        int[] result = new int[m.ancestors.length + 1];
        result[0] = index;
        System.arraycopy(m.ancestors, 0, result, 1, m.ancestors.length);
        return result;
    }
    
    /**
     * @return effective weight {@code index} contributes to {@code ancestor} with, 1.0 for the member itself.
     */
    double weightTo(int index, int ancestor) {
        
        if (index == ancestor) {
            return 1.0;
        }
        Member m = members.get(index);
        if (m == null) {
            return 1.0;
        }
        Double weight = m.effectiveWeights.get(ancestor);
        return weight == null ? 1.0 : weight;
    }
    
    /**
     * @return true if any parent edge has a weight other than 1.0, as of the last commit.
     */
    public boolean isWeighted() {
        return weighted;
    }
    
    // ---------------------------- Members ----------------------------
    
    public boolean memberExists(String member) {
        return member != null && (lookup.containsKey(member) || aliases.containsKey(member));
    }
    
    /**
     * @return member index for a member name or alias, -1 if unknown.
     */
    public int indexOf(String member) {
        
        if (member == null) {
            return -1;
        }
        Integer index = lookup.get(member);
        if (index == null) {
            index = aliases.get(member);
        }
        return index == null ? -1 : index;
    }
    
    /**
     * @throws KeyNotFoundException for unknown members
     */
    public int getMemberIndex(String member) {
        
        int index = indexOf(member);
        if (index < 0) {
            throw new KeyNotFoundException("'" + member + "' is not a member of dimension '" + name + "'.");
        }
        return index;
    }
    
    public Member getMember(String member) {
        return members.get(getMemberIndex(member));
    }
    
    /**
     * @return the member or null if no member has this index.
     */
    public Member getMember(int index) {
        return members.get(index);
    }
    
    Collection<Member> memberObjects() {
        return Collections.unmodifiableCollection(members.values());
    }
    
    /**
     * @return member names in index order.
     */
    public List<String> getMembers() {
        return names(members.values());
    }
    
    public List<String> getLeaves() {
        return names(members.values().stream().filter(m -> m.children.isEmpty()).collect(Collectors.toList()));
    }
    
    public List<String> getAggregatedMembers() {
        return names(members.values().stream().filter(m -> !m.children.isEmpty()).collect(Collectors.toList()));
    }
    
    public List<String> getRootMembers() {
        return names(members.values().stream().filter(m -> m.parents.isEmpty()).collect(Collectors.toList()));
    }
    
    public List<String> getMembersByLevel(int level) {
        return names(members.values().stream().filter(m -> m.level == level).collect(Collectors.toList()));
    }
    
    public int getTopLevel() {
        return members.values().stream().mapToInt(Member::getLevel).max().orElse(0);
    }
    
    /**
     * @return first member in index order, null if the dimension is empty.
     */
    public String getFirstMember() {
        return members.isEmpty() ? null : members.values().iterator().next().getName();
    }
    
    public List<String> getParents(String member) {
        return namesOf(getMember(member).parents);
    }
    
    public List<String> getChildren(String member) {
        return namesOf(getMember(member).children);
    }
    
    public List<String> getBaseDescendants(String member) {
        
        Member m = getMember(member);
        List<Integer> indexes = new ArrayList<Integer>(m.baseDescendants.length);
        for (int index : m.baseDescendants) {
            indexes.add(index);
        }
        return namesOf(indexes);
    }
    
    public int getLevel(String member) {
        return getMember(member).getLevel();
    }
    
    public int size() {
        return members.size();
    }
    
    private List<String> names(Collection<Member> list) {
        return list.stream().map(Member::getName).collect(Collectors.toList());
    }
    
    private List<String> namesOf(Collection<Integer> indexes) {
        return indexes.stream().map(i -> members.get(i).getName()).collect(Collectors.toList());
    }
    
    public Dimension setMemberDescription(String member, String description) {
        getMember(member).setDescription(description);
        return this;
    }
    
    public Dimension setFormat(String member, String format) {
        getMember(member).setFormat(format);
        return this;
    }
    
    public String getFormat(String member) {
        return getMember(member).getFormat();
    }
    
    // ---------------------------- Aliases ----------------------------
    
    public Dimension addAlias(String member, String alias) {
        
        int index = getMemberIndex(member);
        checkMemberName(alias);
        if (lookup.containsKey(alias) || aliases.containsKey(alias)) {
            throw new DuplicateKeyException("Failed to add alias '" + alias + "' to dimension '" + name 
                    + "'. The name is already used.");
        }
        aliases.put(alias, index);
        return this;
    }
    
    public Dimension removeAlias(String alias) {
        
        if (aliases.remove(alias) == null) {
            throw new KeyNotFoundException("'" + alias + "' is not an alias of dimension '" + name + "'.");
        }
        return this;
    }
    
    /**
     * @return name of the member the alias stands for.
     */
    public String resolveAlias(String alias) {
        
        Integer index = aliases.get(alias);
        if (index == null) {
            throw new KeyNotFoundException("'" + alias + "' is not an alias of dimension '" + name + "'.");
        }
        return members.get(index).getName();
    }
    
    public boolean aliasExists(String alias) {
        return aliases.containsKey(alias);
    }
    
    public List<String> getAliases(String member) {
        
        int index = getMemberIndex(member);
        return aliases.entrySet().stream().filter(e -> e.getValue() == index).map(Entry::getKey)
                .collect(Collectors.toList());
    }
    
    // ---------------------------- Attributes ----------------------------
    
    public Dimension addAttribute(String attribute, Class<?> type) {
        
        Database.checkName(attribute, "attribute");
        Assert.notNull(type, "Attribute type can not null.");
        if (attributeTypes.containsKey(attribute)) {
            throw new DuplicateKeyException("Attribute '" + attribute + "' already exists in dimension '" 
                    + name + "'.");
        }
        attributeTypes.put(attribute, type);
        return this;
    }
    
    public boolean attributeExists(String attribute) {
        return attributeTypes.containsKey(attribute);
    }
    
    public Class<?> getAttributeType(String attribute) {
        return requireAttribute(attribute);
    }
    
    public List<String> getAttributes() {
        return new ArrayList<String>(attributeTypes.keySet());
    }
    
    public Dimension renameAttribute(String attribute, String newName) {
        
        Class<?> type = requireAttribute(attribute);
        Database.checkName(newName, "attribute");
        if (attributeTypes.containsKey(newName) && !attribute.equalsIgnoreCase(newName)) {
            throw new DuplicateKeyException("Attribute '" + newName + "' already exists in dimension '" 
                    + name + "'.");
        }
        attributeTypes.remove(attribute);
        attributeTypes.put(newName, type);
        for (Member m : members.values()) {
            if (m.attributes.containsKey(attribute)) {
                Object value = m.attributes.remove(attribute);
                m.attributes.put(newName, value);
            }
        }
        return this;
    }
    
    public Dimension removeAttribute(String attribute) {
        
        requireAttribute(attribute);
        attributeTypes.remove(attribute);
        for (Member m : members.values()) {
            m.attributes.remove(attribute);
        }
        return this;
    }
    
    /**
     * Sets an attribute value, a null value removes it.
     * 
     * @throws IllegalArgumentException if the value does not match the attribute type
     */
    public Dimension setAttribute(String member, String attribute, Object value) {
        
        Member m = getMember(member);
        Class<?> type = requireAttribute(attribute);
        if (value == null) {
            m.attributes.remove(attribute);
            return this;
        }
        Assert.isInstanceOf(type, value, "Value of attribute '" + attribute + "'");
        m.attributes.put(attribute, value);
        return this;
    }
    
    public Object getAttribute(String member, String attribute) {
        
        Member m = getMember(member);
        requireAttribute(attribute);
        return m.attributes.get(attribute);
    }
    
    public Dimension removeAttributeValue(String member, String attribute) {
        return setAttribute(member, attribute, null);
    }
    
    /**
     * Members whose attribute equals the value. A string value containing {@code *} is matched as a pattern.
     */
    public List<String> getMembersByAttribute(String attribute, Object value) {
        
        requireAttribute(attribute);
        Map<String, Object> criteria = new HashMap<String, Object>(1);
        criteria.put(attribute, value);
        return namesOf(matchAttributes(criteria));
    }
    
    List<Integer> matchAttributes(Map<String, Object> criteria) {
        
        List<Integer> result = new ArrayList<Integer>();
        for (Member m : members.values()) {
            boolean match = true;
            for (Entry<String, Object> c : criteria.entrySet()) {
                if (!attributeMatches(m.attributes.get(c.getKey()), c.getValue())) {
                    match = false;
                    break;
                }
            }
            if (match) {
                result.add(m.getIndex());
            }
        }
        return result;
    }
    
    private boolean attributeMatches(Object actual, Object expected) {
        
        if (expected instanceof String && ((String) expected).indexOf('*') >= 0) {
            return actual != null && PatternMatchUtils.simpleMatch((String) expected, actual.toString());
        }
        return ObjectUtils.nullSafeEquals(actual, expected);
    }
    
    private Class<?> requireAttribute(String attribute) {
        
        Class<?> type = attributeTypes.get(attribute);
        if (type == null) {
            throw new KeyNotFoundException("'" + attribute + "' is not an attribute of dimension '" + name + "'.");
        }
        return type;
    }
    
    // ---------------------------- Subsets ----------------------------
    
    /**
     * Adds a static subset.
     */
    public Dimension addSubset(String subset, List<String> members) {
        
        checkNewSubset(subset);
        List<Integer> indexes = new ArrayList<Integer>(members.size());
        for (String member : members) {
            int index = getMemberIndex(member);
            if (!indexes.contains(index)) {
                indexes.add(index);
            }
        }
        subsets.put(subset, Subset.ofMembers(this, subset, indexes));
        return this;
    }
    
    /**
     * Adds a subset of all members matching every attribute criterion.
     */
    public Dimension addSubset(String subset, boolean volatileSubset, Map<String, Object> criteria) {
        
        checkNewSubset(subset);
        Assert.notEmpty(criteria, "Attribute criteria can not empty.");
        for (String attribute : criteria.keySet()) {
            requireAttribute(attribute);
        }
        subsets.put(subset, Subset.ofAttributes(this, subset, volatileSubset, criteria));
        return this;
    }
    
    public Dimension addSubset(String subset, boolean volatileSubset, SubsetCallback callback) {
        
        checkNewSubset(subset);
        Assert.notNull(callback, "Subset callback can not null.");
        subsets.put(subset, Subset.ofCallback(this, subset, volatileSubset, callback));
        return this;
    }
    
    private void checkNewSubset(String subset) {
        
        Database.checkName(subset, "subset");
        if (subsets.containsKey(subset)) {
            throw new DuplicateKeyException("Subset '" + subset + "' already exists in dimension '" + name + "'.");
        }
    }
    
    public Subset getSubset(String subset) {
        
        Subset s = subsets.get(subset);
        if (s == null) {
            throw new KeyNotFoundException("'" + subset + "' is not a subset of dimension '" + name + "'.");
        }
        return s;
    }
    
    public boolean subsetExists(String subset) {
        return subsets.containsKey(subset);
    }
    
    public List<String> getSubsets() {
        return new ArrayList<String>(subsets.keySet());
    }
    
    public Dimension removeSubset(String subset) {
        
        getSubset(subset);
        subsets.remove(subset);
        return this;
    }
    
    public Dimension renameSubset(String subset, String newName) {
        
        Subset s = getSubset(subset);
        Database.checkName(newName, "subset");
        if (subsets.containsKey(newName) && !subset.equalsIgnoreCase(newName)) {
            throw new DuplicateKeyException("Subset '" + newName + "' already exists in dimension '" + name + "'.");
        }
        subsets.remove(subset);
        s.setName(newName);
        subsets.put(newName, s);
        return this;
    }
    
    // ---------------------------- Snapshots ----------------------------
    
    public DimensionSnapshot toSnapshot() {
        
        DimensionSnapshot snapshot = new DimensionSnapshot();
        snapshot.name = name;
        snapshot.description = description;
        snapshot.count = members.size();
        for (Member m : members.values()) {
            MemberSnapshot ms = new MemberSnapshot();
            ms.index = m.getIndex();
            ms.name = m.getName();
            ms.description = m.getDescription();
            ms.format = m.getFormat();
            ms.parents.addAll(m.parents);
            ms.children.addAll(m.children);
            for (Entry<Integer, Double> w : m.weights.entrySet()) {
                if (w.getValue() != 1.0) {
                    ms.weights.put(w.getKey(), w.getValue());
                }
            }
            for (int a : m.ancestors) {
                ms.ancestors.add(a);
            }
            for (int d : m.baseDescendants) {
                ms.baseDescendants.add(d);
            }
            ms.level = m.level;
            ms.attributes.putAll(m.attributes);
            snapshot.members.put(ms.index, ms);
            snapshot.lookup.put(ms.name, ms.index);
        }
        for (Entry<String, Integer> e : aliases.entrySet()) {
            snapshot.aliases.put(e.getKey(), members.get(e.getValue()).getName());
        }
        for (Entry<String, Class<?>> e : attributeTypes.entrySet()) {
            snapshot.attributes.put(e.getKey(), e.getValue().getName());
        }
        for (Subset subset : subsets.values()) {
            if (subset.isCallback()) {
                continue;
            }
            SubsetSnapshot ss = new SubsetSnapshot();
            ss.name = subset.getName();
            ss.volatileSubset = subset.isVolatile();
            if (subset.isStatic()) {
                ss.members = namesOf(subset.getStaticMembers());
            } else {
                ss.criteria = new LinkedHashMap<String, Object>(subset.getCriteria());
            }
            snapshot.subsets.add(ss);
        }
        return snapshot;
    }
    
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toSnapshot());
        } catch (JsonProcessingException e) {
            throw new CubeException("Failed to serialize dimension '" + name + "'.", e);
        }
    }
    
    public Dimension fromJson(String json) {
        
        Assert.hasText(json, "Dimension json can not empty.");
        DimensionSnapshot snapshot;
        try {
            snapshot = MAPPER.readValue(json, DimensionSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new CubeException("Failed to read dimension '" + name + "' from json.", e);
        }
        return loadSnapshot(snapshot);
    }
    
    /**
     * Replaces the content of this dimension with a snapshot. Members are replayed with their indices inside an
     * edit transaction and committed, derived fields of the snapshot are ignored. Members already present under
     * the same index and name are kept, so facts stored for them survive.
     */
    public Dimension loadSnapshot(DimensionSnapshot snapshot) {
        
        Assert.notNull(snapshot, "Dimension snapshot can not null.");
        boolean started = !editing;
        if (started) {
            beginEdit();
        }
        try {
            replay(snapshot);
            if (started) {
                commit();
            }
        } catch (RuntimeException e) {
            if (started && editing) {
                rollback();
            }
            throw e;
        }
        LOGGER.info("Loaded dimension {} from snapshot with {} members", name, members.size());
        return this;
    }
    
    private void replay(DimensionSnapshot snapshot) {
        
        for (Member m : new ArrayList<Member>(members.values())) {
            MemberSnapshot ms = snapshot.members.get(m.getIndex());
            if (ms == null || !m.getName().equalsIgnoreCase(ms.name)) {
                removeIndex(m.getIndex());
            } else {
                m.clearEdges();
            }
        }
        aliases.clear();
        subsets.clear();
        attributeTypes.clear();
        for (Entry<String, String> e : snapshot.attributes.entrySet()) {
            attributeTypes.put(e.getKey(), ClassUtils.resolveClassName(e.getValue(), 
                    ClassUtils.getDefaultClassLoader()));
        }
        
        for (MemberSnapshot ms : snapshot.members.values()) {
            checkMemberName(ms.name);
            Member m = members.get(ms.index);
            if (m == null) {
                if (lookup.containsKey(ms.name)) {
                    throw new DuplicateKeyException("Snapshot of dimension '" + name + "' contains member '" 
                            + ms.name + "' twice.");
                }
                indexManager.claim(ms.index);
                m = new Member(this, ms.index, ms.name);
                members.put(ms.index, m);
            } else {
                lookup.remove(m.getName());
                m.setName(ms.name);
            }
            lookup.put(ms.name, ms.index);
            m.setDescription(ms.description == null ? ms.name : ms.description);
            m.setFormat(ms.format);
            m.attributes.clear();
            for (Entry<String, Object> a : ms.attributes.entrySet()) {
                m.attributes.put(a.getKey(), coerce(a.getKey(), a.getValue()));
            }
            structureChanged = true;
        }
        
        for (MemberSnapshot ms : snapshot.members.values()) {
            for (Integer child : ms.children) {
                MemberSnapshot cs = snapshot.members.get(child);
                Assert.notNull(cs, "Snapshot of dimension '" + name + "' refers to unknown member index " + child);
                Double weight = cs.weights.get(ms.index);
                addEdge(child, ms.index, weight == null ? 1.0 : weight);
            }
        }
        for (MemberSnapshot ms : snapshot.members.values()) {
            Member m = members.get(ms.index);
            List<Integer> ordered = new ArrayList<Integer>(ms.parents);
            ordered.retainAll(m.parents);
            for (Integer parent : m.parents) {
                if (!ordered.contains(parent)) {
                    ordered.add(parent);
                }
            }
            m.parents.clear();
            m.parents.addAll(ordered);
        }
        
        for (Entry<String, String> e : snapshot.aliases.entrySet()) {
            addAlias(e.getValue(), e.getKey());
        }
        for (SubsetSnapshot ss : snapshot.subsets) {
            if (ss.members != null) {
                addSubset(ss.name, ss.members);
            } else if (ss.criteria != null) {
                addSubset(ss.name, ss.volatileSubset, ss.criteria);
            }
        }
    }
    
    /**
     * Json numbers come back as the narrowest type, bring them to the declared attribute type.
     */
    @SuppressWarnings("unchecked")
    private Object coerce(String attribute, Object value) {
        
        Class<?> type = requireAttribute(attribute);
        if (value instanceof Number && Number.class.isAssignableFrom(type) && !type.isInstance(value)) {
            return NumberUtils.convertNumberToTargetClass((Number) value, (Class<Number>) type);
        }
        if (value != null) {
            Assert.isInstanceOf(type, value, "Value of attribute '" + attribute + "'");
        }
        return value;
    }

    @Override
    public String toString() {
        return "Dimension [name=" + name + ", members=" + members.size() + ", editing=" + editing + "]";
    }
    
}
