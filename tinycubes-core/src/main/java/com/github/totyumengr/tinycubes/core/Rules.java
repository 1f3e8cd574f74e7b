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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.springframework.util.Assert;
import org.springframework.util.LinkedCaseInsensitiveMap;

/**
 * Rules registered on one {@link Cube}, kept per scope in registration order. Lookup is first match wins.
 * 
 * @author mengran
 *
 */
public class Rules {
    
    private final Map<RuleScope, List<Rule>> byScope = new EnumMap<RuleScope, List<Rule>>(RuleScope.class);
    private final Map<String, Rule> byName = new LinkedCaseInsensitiveMap<Rule>();
    
    public Rules() {
        super();
        for (RuleScope scope : RuleScope.values()) {
            byScope.put(scope, new ArrayList<Rule>());
        }
    }
    
    /**
     * {@link Rule} backed by a {@link RuleFunction}.
     * @author mengran
     *
     */
    static class FunctionRule implements Rule {
        
        private final String name;
        private final RuleScope scope;
        private final TriggerPattern trigger;
        private final RuleFunction function;
        
        FunctionRule(String name, RuleScope scope, TriggerPattern trigger, RuleFunction function) {
            super();
            this.name = name;
            this.scope = scope;
            this.trigger = trigger;
            this.function = function;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public RuleScope getScope() {
            return scope;
        }

        @Override
        public TriggerPattern getTrigger() {
            return trigger;
        }

        @Override
        public Outcome invoke(Cell cell) {
            Object result = function.apply(cell);
            return result instanceof Outcome ? (Outcome) result : Outcome.of(result);
        }

        @Override
        public String toString() {
            return "Rule [name=" + name + ", scope=" + scope + ", trigger=" + trigger + "]";
        }
    }
    
    public static Rule of(String name, RuleScope scope, TriggerPattern trigger, RuleFunction function) {
        
        Assert.hasText(name, "Rule name can not empty.");
        Assert.notNull(scope, "Rule scope can not null.");
        Assert.notNull(trigger, "Rule trigger can not null.");
        Assert.notNull(function, "Rule function can not null.");
        return new FunctionRule(name, scope, trigger, function);
    }
    
    void register(Rule rule) {
        
        if (byName.containsKey(rule.getName())) {
            throw new DuplicateKeyException("Rule '" + rule.getName() + "' is already registered.");
        }
        byName.put(rule.getName(), rule);
        byScope.get(rule.getScope()).add(rule);
    }
    
    boolean remove(String name) {
        
        Rule rule = byName.remove(name);
        if (rule == null) {
            return false;
        }
        byScope.get(rule.getScope()).remove(rule);
        return true;
    }
    
    /**
     * Drops rules whose trigger refers to a member that no longer exists.
     * 
     * @return the dropped rules
     */
    List<Rule> removeReferencing(int position, Iterable<Integer> members) {
        
        List<Rule> dropped = new ArrayList<Rule>();
        for (Iterator<Rule> it = byName.values().iterator(); it.hasNext();) {
            Rule rule = it.next();
            for (Integer member : members) {
                if (rule.getTrigger().references(position, member)) {
                    dropped.add(rule);
                    break;
                }
            }
        }
        for (Rule rule : dropped) {
            remove(rule.getName());
        }
        return dropped;
    }
    
    void clear() {
        
        byName.clear();
        for (List<Rule> rules : byScope.values()) {
            rules.clear();
        }
    }
    
    /**
     * @return first rule of the scope whose trigger matches, null if none.
     */
    Rule match(RuleScope scope, int[] address, int measure) {
        
        for (Rule rule : byScope.get(scope)) {
            if (rule.getTrigger().matches(address, measure)) {
                return rule;
            }
        }
        return null;
    }
    
    boolean hasRules(RuleScope scope) {
        return !byScope.get(scope).isEmpty();
    }
    
    Rule get(String name) {
        return byName.get(name);
    }
    
    /**
     * @return all rules in registration order within each scope.
     */
    List<Rule> all() {
        
        List<Rule> all = new ArrayList<Rule>(byName.size());
        for (List<Rule> rules : byScope.values()) {
            all.addAll(rules);
        }
        return Collections.unmodifiableList(all);
    }
    
    int size() {
        return byName.size();
    }
    
    /**
     * Rounds rule results by magnitude: below 1 to 10 decimal places, above 100000 to 4, otherwise to 6. Keeps
     * float drift of chained rule calculations from piling up.
     */
    public static double round(double value) {
        
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double magnitude = Math.abs(value);
        int scale = magnitude < 1 ? 10 : (magnitude > 100000 ? 4 : 6);
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
    
}
