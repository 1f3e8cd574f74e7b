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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named list of members of one {@link Dimension}. Three flavours:
 * <ul>
 *   <li>static: a fixed member list, kept in sync when members are removed or renamed.
 *   <li>attribute: all members whose attributes match every criterion.
 *   <li>callback: members returned by a {@link SubsetCallback}.
 * </ul>
 * Dynamic subsets are evaluated lazily and cached until the next {@link Dimension#commit()}, volatile ones are
 * evaluated on each access.
 * 
 * @author mengran
 *
 */
public class Subset {
    
    private final Dimension dimension;
    private String name;
    private final boolean volatileSubset;
    
    private final List<Integer> staticMembers;
    private final Map<String, Object> criteria;
    private final SubsetCallback callback;
    
    private List<Integer> cached;
    
    private Subset(Dimension dimension, String name, boolean volatileSubset, List<Integer> staticMembers,
            Map<String, Object> criteria, SubsetCallback callback) {
        super();
        this.dimension = dimension;
        this.name = name;
        this.volatileSubset = volatileSubset;
        this.staticMembers = staticMembers;
        this.criteria = criteria;
        this.callback = callback;
    }
    
    static Subset ofMembers(Dimension dimension, String name, List<Integer> members) {
        return new Subset(dimension, name, false, new ArrayList<Integer>(members), null, null);
    }
    
    static Subset ofAttributes(Dimension dimension, String name, boolean volatileSubset, Map<String, Object> criteria) {
        return new Subset(dimension, name, volatileSubset, null, new LinkedHashMap<String, Object>(criteria), null);
    }
    
    static Subset ofCallback(Dimension dimension, String name, boolean volatileSubset, SubsetCallback callback) {
        return new Subset(dimension, name, volatileSubset, null, null, callback);
    }
    
    Subset copy() {
        return new Subset(dimension, name, volatileSubset, 
                staticMembers == null ? null : new ArrayList<Integer>(staticMembers), criteria, callback);
    }

    public String getName() {
        return name;
    }
    
    void setName(String name) {
        this.name = name;
    }

    public boolean isVolatile() {
        return volatileSubset;
    }
    
    public boolean isStatic() {
        return staticMembers != null;
    }
    
    public boolean isCallback() {
        return callback != null;
    }
    
    Map<String, Object> getCriteria() {
        return criteria == null ? null : Collections.unmodifiableMap(criteria);
    }
    
    /**
     * @return member names in subset order.
     */
    public List<String> getMembers() {
        
        List<Integer> indexes = evaluate();
        List<String> names = new ArrayList<String>(indexes.size());
        for (Integer index : indexes) {
            names.add(dimension.getMember(index).getName());
        }
        return names;
    }
    
    public boolean contains(String member) {
        
        int index = dimension.indexOf(member);
        return index > 0 && evaluate().contains(index);
    }
    
    public int size() {
        return evaluate().size();
    }
    
    List<Integer> evaluate() {
        
        if (staticMembers != null) {
            return Collections.unmodifiableList(staticMembers);
        }
        if (cached != null && !volatileSubset) {
            return cached;
        }
        List<Integer> result = new ArrayList<Integer>();
        if (criteria != null) {
            result.addAll(dimension.matchAttributes(criteria));
        } else {
            Collection<String> names = callback.evaluate(dimension, name);
            if (names != null) {
                for (String member : names) {
                    int index = dimension.indexOf(member);
                    if (index < 0) {
                        throw new KeyNotFoundException("Subset '" + name + "' returned '" + member 
                                + "' which is not a member of dimension '" + dimension.getName() + "'.");
                    }
                    if (!result.contains(index)) {
                        result.add(index);
                    }
                }
            }
        }
        cached = Collections.unmodifiableList(result);
        return cached;
    }
    
    void invalidate() {
        cached = null;
    }
    
    /**
     * Member removal, static lists forget the index.
     */
    void removeIndex(Integer index) {
        if (staticMembers != null) {
            staticMembers.remove(index);
        }
        cached = null;
    }
    
    List<Integer> getStaticMembers() {
        return staticMembers;
    }

    @Override
    public String toString() {
        return "Subset [name=" + name + ", dimension=" + dimension.getName() + "]";
    }
    
}
