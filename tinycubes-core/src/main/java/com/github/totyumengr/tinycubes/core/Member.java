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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.util.LinkedCaseInsensitiveMap;

/**
 * One member of a {@link Dimension}. Members live in the dimension's arena and reference each other by their
 * integer index only, the parent/child graph never holds object references.
 * 
 * <p>Structural fields are changed by the owning {@link Dimension} only. The derived fields ({@link #getLevel()},
 * ancestors, base descendants, effective weights) are valid after {@link Dimension#commit()}.
 * 
 * @author mengran
 *
 */
public class Member {
    
    static final int[] EMPTY = new int[0];
    
    private final Dimension dimension;
    private final int index;
    private String name;
    private String description;
    private String format;
    
    final List<Integer> parents = new ArrayList<Integer>(2);
    final List<Integer> children = new ArrayList<Integer>(0);
    /**
     * Key is parent index, value the weight this member aggregates into that parent with.
     */
    final Map<Integer, Double> weights = new LinkedHashMap<Integer, Double>(2);
    final Map<String, Object> attributes = new LinkedCaseInsensitiveMap<Object>(0);
    
    // Derived on commit
    int level;
    int[] ancestors = EMPTY;
    int[] baseDescendants = EMPTY;
    Map<Integer, Double> effectiveWeights = Collections.emptyMap();
    
    Member(Dimension dimension, int index, String name) {
        super();
        this.dimension = dimension;
        this.index = index;
        this.name = name;
        this.description = name;
    }

    public Dimension getDimension() {
        return dimension;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }
    
    void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }
    
    void setDescription(String description) {
        this.description = description;
    }

    public String getFormat() {
        return format;
    }
    
    void setFormat(String format) {
        this.format = format;
    }

    /**
     * @return 0 for leaves, otherwise 1 + the highest level of the children.
     */
    public int getLevel() {
        return level;
    }
    
    public boolean isLeaf() {
        return level == 0;
    }
    
    public boolean isRoot() {
        return parents.isEmpty();
    }

    public List<Integer> getParentIndexes() {
        return Collections.unmodifiableList(parents);
    }

    public List<Integer> getChildIndexes() {
        return Collections.unmodifiableList(children);
    }
    
    /**
     * @param parentIndex index of a direct parent
     * @return weight of the edge to that parent, 1.0 if there is no such edge.
     */
    public double getWeight(int parentIndex) {
        Double weight = weights.get(parentIndex);
        return weight == null ? 1.0 : weight;
    }

    /**
     * @return all transitive ancestors.
     */
    public int[] getAncestorIndexes() {
        return Arrays.copyOf(ancestors, ancestors.length);
    }

    /**
     * @return leaves below this member, empty for a leaf.
     */
    public int[] getBaseDescendantIndexes() {
        return Arrays.copyOf(baseDescendants, baseDescendants.length);
    }
    
    public Object getAttribute(String attribute) {
        return attributes.get(attribute);
    }
    
    /**
     * Detach all edges, used when the dimension rebuilds a member from a snapshot.
     */
    void clearEdges() {
        parents.clear();
        children.clear();
        weights.clear();
    }
    
    List<Integer> copyParents() {
        return new ArrayList<Integer>(parents);
    }

    @Override
    public String toString() {
        return dimension.getName() + ":" + name;
    }
    
}
