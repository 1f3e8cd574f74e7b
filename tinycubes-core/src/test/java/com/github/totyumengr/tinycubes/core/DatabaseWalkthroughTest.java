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

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

/**
 * Walks one database through loading, rules, a dimension edit and a snapshot, step by step.
 * 
 * @author mengran
 *
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class DatabaseWalkthroughTest {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseWalkthroughTest.class);
    
    private static Database database;
    private static Cube cube;
    
    @BeforeClass
    public static void prepare() throws Throwable {
        
        String dataFile = System.getProperty("dataFile", "sales_2014.data");
        
        database = new Database("DatabaseWalkthroughTest");
        Dimension months = database.addDimension("months");
        months.beginEdit();
        months.addMany("Q1", Arrays.asList("Jan", "Feb", "Mar"));
        months.addMany("Q2", Arrays.asList("Apr", "May", "Jun"));
        months.addMany("Q3", Arrays.asList("Jul", "Aug", "Sep"));
        months.addMany("Q4", Arrays.asList("Oct", "Nov", "Dec"));
        months.addMany("Year", Arrays.asList("Q1", "Q2", "Q3", "Q4"));
        months.commit();
        Dimension regions = database.addDimension("regions");
        regions.beginEdit();
        regions.addMany("Total", Arrays.asList("North", "South"));
        regions.commit();
        cube = database.buildCube("sales").addDimensions(Arrays.asList("months", "regions"))
                .addMeasures(Arrays.asList("Sales", "Cost", "Profit")).done();
        
        long startTime = System.currentTimeMillis();
        LOGGER.info("prepare {} - start: {}", dataFile, startTime);
        ClassPathResource resource = new ClassPathResource(dataFile);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line = null;
            while ((line = reader.readLine()) != null) {
                String[] split = line.split("\t");
                cube.set(new String[] {split[0], split[1], split[2]}, Double.valueOf(split[3]));
            }
        }
        LOGGER.info("prepare - end: {}, {}ms", System.currentTimeMillis(), System.currentTimeMillis() - startTime);
    }
    
    @Test
    public void test_1_1_Load() {
        
        Assert.assertEquals(5, cube.getCellsCount());
        Assert.assertEquals(8, cube.records().size());
    }
    
    @Test
    public void test_1_2_Aggregate() {
        
        Assert.assertEquals(175.0, cube.getDouble("Q1", "North", "Sales"), 0.0);
        Assert.assertEquals(315.0, cube.getDouble("Year", "Total", "Sales"), 0.0);
        Assert.assertEquals(70.0, cube.getDouble("Year", "Total", "Cost"), 0.0);
    }
    
    @Test
    public void test_2_1_CalculatedProfit() {
        
        FormulaCompiler.register(cube, "[Profit] = [Sales] - [Cost]");
        Assert.assertEquals(105.0, cube.getDouble("Q1", "North", "Profit"), 0.0);
        Assert.assertEquals(60.0, cube.getDouble("Jan", "North", "Profit"), 0.0);
    }
    
    @Test
    public void test_2_2_PushDownCost() {
        
        FormulaCompiler.register(cube, "P:[Cost] = [Sales] * 0.75");
        cube.set(new String[] {"Apr", "South", "Sales"}, 200);
        Assert.assertEquals(150.0, cube.getDouble("Apr", "South", "Cost"), 0.0);
        Assert.assertEquals(50.0, cube.getDouble("Q2", "Total", "Profit"), 0.0);
    }
    
    @Test
    public void test_3_1_RemoveMember() {
        
        Dimension months = database.getDimension("months");
        months.beginEdit();
        months.removeMember("Feb");
        months.commit();
        
        Assert.assertFalse(months.getLeaves().contains("Feb"));
        Assert.assertEquals(125.0, cube.getDouble("Q1", "North", "Sales"), 0.0);
        Assert.assertEquals(75.0, cube.getDouble("Q1", "North", "Profit"), 0.0);
        Assert.assertEquals(2, cube.getRules().size());
    }
    
    @Test(expected = InvalidOperationException.class)
    public void test_3_2_WriteAggregated() {
        cube.set(new String[] {"Q1", "North", "Sales"}, 5.0);
    }
    
    @Test
    public void test_4_1_Snapshot() {
        
        Dimension months = database.getDimension("months");
        String json = months.toJson();
        LOGGER.debug("Snapshot of months: {}", json);
        
        Database copy = new Database("copy", new DatabaseSettings());
        Dimension restored = copy.addDimension("months").fromJson(json);
        Assert.assertEquals(months.getLeaves(), restored.getLeaves());
        Assert.assertEquals(months.getMemberIndex("Mar"), restored.getMemberIndex("Mar"));
        Assert.assertEquals(2, restored.getLevel("Year"));
    }
    
}
