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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Serializable picture of a {@link Dimension}, the format exchanged with persistence. Levels, ancestors and base
 * descendants are written for readers but ignored on load, {@link Dimension#loadSnapshot(DimensionSnapshot)}
 * derives them again.
 * 
 * @author mengran
 *
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DimensionSnapshot {
    
    public String content = "dimension";
    public String name;
    public String description;
    public int count;
    /**
     * Member index to member, ordered by index.
     */
    public Map<Integer, MemberSnapshot> members = new LinkedHashMap<Integer, MemberSnapshot>();
    public Map<String, Integer> lookup = new LinkedHashMap<String, Integer>();
    public Map<String, String> aliases = new LinkedHashMap<String, String>();
    /**
     * Attribute name to value type class name.
     */
    public Map<String, String> attributes = new LinkedHashMap<String, String>();
    public List<SubsetSnapshot> subsets = new ArrayList<SubsetSnapshot>();
    
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MemberSnapshot {
        
        public int index;
        public String name;
        public String description;
        public String format;
        public List<Integer> parents = new ArrayList<Integer>();
        public List<Integer> children = new ArrayList<Integer>();
        /**
         * Parent index to weight, edges with weight 1.0 are left out.
         */
        public Map<Integer, Double> weights = new LinkedHashMap<Integer, Double>();
        public List<Integer> ancestors = new ArrayList<Integer>();
        public List<Integer> baseDescendants = new ArrayList<Integer>();
        public int level;
        public Map<String, Object> attributes = new LinkedHashMap<String, Object>();
    }
    
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SubsetSnapshot {
        
        public String name;
        public boolean volatileSubset;
        public List<String> members;
        public Map<String, Object> criteria;
    }

}
