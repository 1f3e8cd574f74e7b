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

import org.springframework.util.Assert;

/**
 * Bounds nested rule invocation. Rules may read and write cubes, which may trigger further rules, every nesting
 * level enters the guard once. Shared by all cubes of a {@link Database}.
 * 
 * @author mengran
 *
 */
public class RuleInvocationGuard {
    
    private final int maxDepth;
    private int depth = 0;
    
    public RuleInvocationGuard(int maxDepth) {
        super();
        Assert.isTrue(maxDepth > 0, "Rule max depth must be positive.");
        this.maxDepth = maxDepth;
    }
    
    /**
     * @throws RuleCycleException if the maximum depth is already reached
     */
    void enter(Rule rule) {
        
        if (depth >= maxDepth) {
            throw new RuleCycleException("Rule '" + rule.getName() + "' exceeds the maximum rule nesting depth of " 
                    + maxDepth + ". Rules probably trigger each other.");
        }
        depth++;
    }
    
    void exit() {
        depth--;
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
    
}
