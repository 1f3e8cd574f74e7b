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
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.LinkedCaseInsensitiveMap;

import com.github.totyumengr.tinycubes.core.Cube.CubeBuilder;

/**
 * Container of dimensions and cubes. Forwards dimension commits to the cubes using the dimension and owns the
 * {@link RuleInvocationGuard} shared by its cubes.
 * 
 * @author mengran
 *
 */
public class Database {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(Database.class);
    
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");
    
    private final String name;
    private final DatabaseSettings settings;
    private final RuleInvocationGuard ruleInvocationGuard;
    
    private final Map<String, Dimension> dimensions = new LinkedCaseInsensitiveMap<Dimension>();
    private final Map<String, Cube> cubes = new LinkedCaseInsensitiveMap<Cube>();
    
    /**
     * Database with settings from {@link DatabaseSettings#load()}.
     */
    public Database(String name) {
        this(name, DatabaseSettings.load());
    }
    
    public Database(String name, DatabaseSettings settings) {
        super();
        checkName(name, "database");
        Assert.notNull(settings, "Settings can not null.");
        this.name = name;
        this.settings = settings;
        this.ruleInvocationGuard = new RuleInvocationGuard(settings.getRuleMaxDepth());
        LOGGER.info("Created database {} with {}", name, settings);
    }
    
    /**
     * @throws InvalidKeyException unless the name consists of letters, digits, '_' and '-'
     */
    static void checkName(String name, String kind) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidKeyException("Invalid " + kind + " name '" + name 
                    + "'. Only letters, digits, '_' and '-' are supported.");
        }
    }

    public String getName() {
        return name;
    }

    public DatabaseSettings getSettings() {
        return settings;
    }

    RuleInvocationGuard getRuleInvocationGuard() {
        return ruleInvocationGuard;
    }
    
    // ---------------------------- Dimensions ----------------------------
    
    public Dimension addDimension(String dimension) {
        return addDimension(dimension, null);
    }
    
    public Dimension addDimension(String dimension, String description) {
        
        checkName(dimension, "dimension");
        if (dimensions.containsKey(dimension)) {
            throw new DuplicateKeyException("Dimension '" + dimension + "' already exists in database '" + name 
                    + "'.");
        }
        Dimension d = new Dimension(this, dimension, description);
        dimensions.put(dimension, d);
        LOGGER.info("Added dimension {} to database {}", dimension, name);
        return d;
    }
    
    public Dimension getDimension(String dimension) {
        
        Dimension d = dimensions.get(dimension);
        if (d == null) {
            throw new KeyNotFoundException("Dimension '" + dimension + "' does not exist in database '" + name + "'.");
        }
        return d;
    }
    
    public boolean dimensionExists(String dimension) {
        return dimensions.containsKey(dimension);
    }
    
    public List<Dimension> getDimensions() {
        return new ArrayList<Dimension>(dimensions.values());
    }
    
    /**
     * @throws InvalidOperationException if a cube still uses the dimension
     */
    public void removeDimension(String dimension) {
        
        Dimension d = getDimension(dimension);
        for (Cube cube : cubes.values()) {
            if (cube.uses(d)) {
                throw new InvalidOperationException("Dimension '" + dimension + "' is used by cube '" 
                        + cube.getName() + "'.");
            }
        }
        dimensions.remove(dimension);
        LOGGER.info("Removed dimension {} from database {}", dimension, name);
    }
    
    /**
     * Forwards a dimension commit to every cube using the dimension.
     */
    void dimensionCommitted(Dimension dimension, Set<Integer> removed, boolean hierarchyChanged) {
        
        for (Cube cube : cubes.values()) {
            if (cube.uses(dimension)) {
                cube.dimensionCommitted(dimension, removed, hierarchyChanged);
            }
        }
    }
    
    // ---------------------------- Cubes ----------------------------
    
    /**
     * @return builder for a new cube, the cube is registered by {@link CubeBuilder#done()}.
     */
    public CubeBuilder buildCube(String cube) {
        return new CubeBuilder(this).build(cube);
    }
    
    /**
     * Adds a cube with the single measure {@value Cube#DEFAULT_MEASURE}.
     */
    public Cube addCube(String cube, List<String> dimensionNames) {
        return addCube(cube, dimensionNames, null);
    }
    
    public Cube addCube(String cube, List<String> dimensionNames, List<String> measures) {
        
        CubeBuilder builder = buildCube(cube).addDimensions(dimensionNames);
        if (measures != null) {
            builder.addMeasures(measures);
        }
        return builder.done();
    }
    
    public Cube addCube(String cube, String... dimensionNames) {
        return addCube(cube, Arrays.asList(dimensionNames));
    }
    
    void register(Cube cube) {
        cubes.put(cube.getName(), cube);
    }
    
    public Cube getCube(String cube) {
        
        Cube c = cubes.get(cube);
        if (c == null) {
            throw new KeyNotFoundException("Cube '" + cube + "' does not exist in database '" + name + "'.");
        }
        return c;
    }
    
    public boolean cubeExists(String cube) {
        return cubes.containsKey(cube);
    }
    
    public List<Cube> getCubes() {
        return new ArrayList<Cube>(cubes.values());
    }
    
    public void removeCube(String cube) {
        
        getCube(cube);
        cubes.remove(cube);
        LOGGER.info("Removed cube {} from database {}", cube, name);
    }
    
    /**
     * Clears the aggregation cache of every cube.
     */
    public void flushCache() {
        for (Cube cube : cubes.values()) {
            cube.flushCache();
        }
    }

    @Override
    public String toString() {
        return "Database [name=" + name + ", dimensions=" + dimensions.keySet() + ", cubes=" + cubes.keySet() + "]";
    }
    
}
