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
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * @author mengran
 *
 */
public class AreaTest {
    
    private Database database;
    private Dimension months;
    private Dimension regions;
    private Cube cube;
    
    @Before
    public void prepare() {
        
        database = new Database("AreaTest", new DatabaseSettings());
        months = database.addDimension("months");
        months.beginEdit();
        months.addMany("Q1", Arrays.asList("Jan", "Feb", "Mar"));
        months.addMany("Q2", Arrays.asList("Apr", "May", "Jun"));
        months.addMany("H1", Arrays.asList("Q1", "Q2"));
        months.commit();
        regions = database.addDimension("regions");
        regions.beginEdit();
        regions.addMany("Total", Arrays.asList("North", "South"));
        regions.commit();
        cube = database.addCube("sales", Arrays.asList("months", "regions"), Arrays.asList("Sales", "Cost"));
        
        set("Jan", "North", "Sales", 10);
        set("Feb", "North", "Sales", 20);
        set("Mar", "South", "Sales", 30);
        set("Jan", "North", "Cost", 5);
    }
    
    private void set(String month, String region, String measure, Object value) {
        cube.set(new String[] {month, region, measure}, value);
    }
    
    private double get(String month, String region, String measure) {
        return cube.getDouble(month, region, measure);
    }
    
    private static <T> List<T> toList(Iterable<T> iterable) {
        
        List<T> list = new ArrayList<T>();
        for (T t : iterable) {
            list.add(t);
        }
        return list;
    }
    
    @Test
    public void testSelectors() {
        
        Assert.assertEquals(4, cube.area().count());
        Assert.assertEquals(4, cube.area("Q1").count());
        Assert.assertEquals(3, cube.area("Q1", "Sales").count());
        Assert.assertEquals(3, cube.area("North").count());
        Assert.assertEquals(1, cube.area("North", "Cost").count());
        Assert.assertEquals(3, cube.area(Arrays.asList("Jan", "Feb")).count());
        Assert.assertEquals(2, cube.area(months.getMember("Jan")).count());
        Assert.assertEquals(1, cube.area(Arrays.asList(months.getMember("Mar"), months.getMember("Apr"))).count());
        Assert.assertEquals(0, cube.area("Q2").count());
        Assert.assertEquals(3, cube.area("regions:Total", "Sales").count());
    }
    
    @Test
    public void testInvalidSelectors() {
        
        Object[][] selectors = new Object[][] {
            {"Jan", "Feb"}, 
            {Arrays.asList("Jan", "North")}, 
            {"Nowhere"}, 
            {regions.getMember("North"), "South"}
        };
        for (Object[] selector : selectors) {
            try {
                cube.area(selector);
                Assert.fail("Accepted selector " + Arrays.toString(selector));
            } catch (InvalidCellAddressException e) {
                // expected
            }
        }
        
        Cube plan = database.addCube("plan", "months");
        try {
            plan.area(regions.getMember("North"));
            Assert.fail("Accepted a member of a foreign dimension");
        } catch (InvalidCellAddressException e) {
            // expected
        }
    }
    
    @Test
    public void testStatistics() {
        
        Area q1Sales = cube.area("Q1", "Sales");
        Assert.assertEquals(60.0, q1Sales.sum(), 0.0);
        Assert.assertEquals(10.0, q1Sales.min(), 0.0);
        Assert.assertEquals(30.0, q1Sales.max(), 0.0);
        Assert.assertEquals(20.0, q1Sales.avg(), 0.0);
        Assert.assertEquals(35.0, cube.area("North").sum(), 0.0);
        
        Area q2 = cube.area("Q2");
        Assert.assertEquals(0.0, q2.sum(), 0.0);
        Assert.assertNull(q2.min());
        Assert.assertNull(q2.max());
        Assert.assertNull(q2.avg());
        
        set("Feb", "South", "Sales", "n/a");
        Assert.assertEquals(4, cube.area("Q1", "Sales").count());
        Assert.assertEquals(20.0, cube.area("Q1", "Sales").avg(), 0.0);
    }
    
    @Test
    public void testViews() {
        
        Area q1Sales = cube.area("Q1", "Sales");
        Assert.assertEquals(120.0, q1Sales.times(2).sum(), 0.0);
        Assert.assertEquals(63.0, q1Sales.plus(1).sum(), 0.0);
        Assert.assertEquals(57.0, q1Sales.minus(1).sum(), 0.0);
        Assert.assertEquals(6.0, q1Sales.dividedBy(10).sum(), 0.0);
        Assert.assertEquals(22.0, q1Sales.plus(1).times(2).min(), 0.0);
        // Views never write
        Assert.assertEquals(60.0, q1Sales.sum(), 0.0);
        
        try {
            q1Sales.dividedBy(0);
            Assert.fail("Division by zero accepted");
        } catch (InvalidOperationException e) {
            // expected
        }
    }
    
    @Test
    public void testEnumeration() {
        
        List<Cell> cells = toList(cube.area("North", "Cost").addresses());
        Assert.assertEquals(1, cells.size());
        Assert.assertEquals(Arrays.asList("Jan", "North"), cells.get(0).getAddress());
        Assert.assertEquals("Cost", cells.get(0).getMeasure());
        
        List<CellRecord> records = toList(cube.area("North", "Cost").times(3).records());
        Assert.assertEquals(1, records.size());
        Assert.assertEquals(15.0, records.get(0).getValue());
        
        List<Cell> all = new ArrayList<Cell>();
        for (Cell cell : cube.area("Q1", "North", "Sales").allAddresses()) {
            all.add(cell);
        }
        Assert.assertEquals(3, all.size());
        Assert.assertEquals(Arrays.asList("Jan", "North"), all.get(0).getAddress());
        Assert.assertEquals(Arrays.asList("Mar", "North"), all.get(2).getAddress());
        
        int count = 0;
        for (Cell cell : cube.area("Q1").allAddresses()) {
            Assert.assertTrue(cell.isBaseLevel());
            count++;
        }
        Assert.assertEquals(3 * 2 * 2, count);
    }
    
    @Test
    public void testEnumerationIsLazyAndRestartable() {
        
        Iterable<Cell> cells = cube.area("North").addresses();
        Iterable<CellRecord> records = cube.area("North", "Sales").records();
        set("Feb", "North", "Cost", 2);
        
        Assert.assertEquals(4, toList(cells).size());
        Assert.assertEquals(4, toList(cells).size());
        Assert.assertEquals(2, toList(records).size());
        
        Iterator<Cell> it = cells.iterator();
        Assert.assertTrue(it.hasNext());
        cube.area("North").clear();
        Assert.assertNotNull(it.next());
        Assert.assertFalse(it.hasNext());
        Assert.assertEquals(0, toList(cells).size());
        Assert.assertFalse(records.iterator().hasNext());
        try {
            records.iterator().next();
            Assert.fail("Exhausted enumeration returned a record");
        } catch (NoSuchElementException e) {
            // expected
        }
    }
    
    @Test
    public void testWritesReachRowsOfMemberTurnedAggregated() {
        
        months.beginEdit();
        months.addMember("Jan-1", "Jan");
        months.commit();
        
        Assert.assertEquals(3, cube.area("Q1", "Sales").multiply(2));
        Assert.assertEquals(20.0, get("Jan", "North", "Sales"), 0.0);
        Assert.assertEquals(60.0, get("Q1", "North", "Sales"), 0.0);
        
        Assert.assertEquals(3, cube.area("South").assign(cube.area("North")));
        Assert.assertEquals(20.0, get("Jan", "South", "Sales"), 0.0);
        Assert.assertEquals(5.0, get("Jan", "South", "Cost"), 0.0);
        Assert.assertEquals(0.0, get("Mar", "South", "Sales"), 0.0);
        
        Assert.assertEquals(6, cube.area("Q1").clear());
        Assert.assertEquals(0, cube.area().count());
        Assert.assertEquals(0.0, get("Q1", "Total", "Sales"), 0.0);
    }
    
    @Test
    public void testClear() {
        
        Assert.assertEquals(3, cube.area("North").clear());
        Assert.assertEquals(1, cube.getCellsCount());
        Assert.assertEquals(30.0, get("H1", "Total", "Sales"), 0.0);
        Assert.assertEquals(0, cube.area("Q2").clear());
    }
    
    @Test
    public void testSetValueAndFill() {
        
        Assert.assertEquals(3, cube.area("Q1", "Sales").setValue(1));
        Assert.assertEquals(3.0, get("Q1", "Total", "Sales"), 0.0);
        Assert.assertEquals(5.0, get("Jan", "North", "Cost"), 0.0);
        
        Assert.assertEquals(3, cube.area("Q2", "North", "Cost").fill(7));
        Assert.assertEquals(21.0, get("Q2", "North", "Cost"), 0.0);
        Assert.assertEquals(0.0, get("Q2", "South", "Cost"), 0.0);
        
        AtomicInteger sequence = new AtomicInteger();
        Assert.assertEquals(6, cube.area("Q2", "Sales").fill(() -> sequence.incrementAndGet()));
        Assert.assertEquals(21.0, get("Q2", "Total", "Sales"), 0.0);
    }
    
    @Test
    public void testMultiplyAndIncrement() {
        
        set("Feb", "South", "Sales", "n/a");
        Assert.assertEquals(3, cube.area("Sales").multiply(10));
        Assert.assertEquals(100.0, get("Jan", "North", "Sales"), 0.0);
        Assert.assertEquals("n/a", cube.get("Feb", "South", "Sales"));
        Assert.assertEquals(3, cube.area("North").increment(1));
        Assert.assertEquals(6.0, get("Jan", "North", "Cost"), 0.0);
        Assert.assertEquals(201.0, get("Feb", "North", "Sales"), 0.0);
    }
    
    @Test
    public void testCopyBetweenRegions() {
        
        Assert.assertEquals(3, cube.area("South").assign(cube.area("North")));
        Assert.assertEquals(10.0, get("Jan", "South", "Sales"), 0.0);
        Assert.assertEquals(20.0, get("Feb", "South", "Sales"), 0.0);
        Assert.assertEquals(5.0, get("Jan", "South", "Cost"), 0.0);
        // Previous content of the target is replaced
        Assert.assertEquals(0.0, get("Mar", "South", "Sales"), 0.0);
        // Source is untouched
        Assert.assertEquals(35.0, cube.area("North").sum(), 0.0);
        
        cube.area("North").assign(cube.area("South").times(2));
        Assert.assertEquals(20.0, get("Jan", "North", "Sales"), 0.0);
        Assert.assertEquals(10.0, get("Jan", "North", "Cost"), 0.0);
    }
    
    @Test
    public void testOverlappingShift() {
        
        set("Mar", "North", "Sales", 30);
        Area target = cube.area(Arrays.asList("Feb", "Mar", "Apr"), "North");
        Area source = cube.area(Arrays.asList("Jan", "Feb", "Mar"), "North");
        Assert.assertEquals(4, target.assign(source));
        
        Assert.assertEquals(10.0, get("Jan", "North", "Sales"), 0.0);
        Assert.assertEquals(10.0, get("Feb", "North", "Sales"), 0.0);
        Assert.assertEquals(20.0, get("Mar", "North", "Sales"), 0.0);
        Assert.assertEquals(30.0, get("Apr", "North", "Sales"), 0.0);
        Assert.assertEquals(5.0, get("Jan", "North", "Cost"), 0.0);
        Assert.assertEquals(5.0, get("Feb", "North", "Cost"), 0.0);
        Assert.assertEquals(30.0, get("Mar", "South", "Sales"), 0.0);
    }
    
    @Test
    public void testMeasuresAreMappedBySelectorOrder() {
        
        cube.area("Sales", "North").assign(cube.area("Cost", "North"));
        Assert.assertEquals(5.0, get("Jan", "North", "Sales"), 0.0);
        Assert.assertEquals(0.0, get("Feb", "North", "Sales"), 0.0);
        Assert.assertEquals(5.0, get("Jan", "North", "Cost"), 0.0);
    }
    
    @Test
    public void testIncompatibleShapes() {
        
        Area[][] pairs = new Area[][] {
            {cube.area("South"), cube.area("Q1")}, 
            {cube.area(Arrays.asList("Jan", "Feb")), cube.area("Jan")}, 
            {cube.area("Q2"), cube.area("Q1")}, 
            {cube.area("South", "Sales"), cube.area("North")}, 
            {cube.area("South"), database.addCube("plan", "months", "regions").area("North")}
        };
        for (Area[] pair : pairs) {
            try {
                pair[0].assign(pair[1]);
                Assert.fail("Assigned " + pair[1] + " to " + pair[0]);
            } catch (InvalidCellAddressException e) {
                // expected
            }
        }
        Assert.assertEquals(4, cube.records().size());
    }
    
    @Test
    public void testBulkWritesFireEntryRules() {
        
        cube.registerRule("cost-ratio", RuleScope.ON_ENTRY, cell -> {
            cell.alter("Cost").setValue(cell.getNumericValue() * 0.75);
            return Outcome.proceed();
        }, "Sales");
        
        cube.area("North", "Sales").setValue(100);
        Assert.assertEquals(75.0, get("Jan", "North", "Cost"), 0.0);
        Assert.assertEquals(75.0, get("Feb", "North", "Cost"), 0.0);
        Assert.assertEquals(0.0, get("Mar", "South", "Cost"), 0.0);
        
        cube.area("South").assign(cube.area("North"));
        Assert.assertEquals(75.0, get("Feb", "South", "Cost"), 0.0);
    }
    
}
