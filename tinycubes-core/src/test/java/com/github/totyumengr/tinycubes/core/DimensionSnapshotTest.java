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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.tinycubes.core.DimensionSnapshot.MemberSnapshot;

/**
 * @author mengran
 *
 */
public class DimensionSnapshotTest {
    
    private Database database;
    private Dimension months;
    
    @Before
    public void prepare() {
        
        database = new Database("SnapshotTest", new DatabaseSettings());
        months = database.addDimension("months", "Months of the year");
        months.beginEdit();
        months.addMany("Q1", Arrays.asList("Jan", "Feb", "Mar"));
        months.addMember("Q1", "Year");
        months.addMember("Q2", "Year", 0.5);
        months.addMany("Q2", Arrays.asList("Apr", "May", "Jun"));
        months.removeMember("Feb");
        months.addMember("Feb2", "Q1");
        months.commit();
        
        months.addAttribute("days", Integer.class);
        months.addAttribute("code", Long.class);
        months.setAttribute("Jan", "days", 31);
        months.setAttribute("Jan", "code", 7L);
        months.addAlias("Jan", "January");
        months.setFormat("Jan", "0.0");
        months.addSubset("firstHalf", Arrays.asList("Jan", "Apr"));
        Map<String, Object> criteria = new HashMap<String, Object>();
        criteria.put("days", 31);
        months.addSubset("long", true, criteria);
        months.addSubset("computed", false, (dimension, name) -> dimension.getLeaves());
    }
    
    @Test
    public void testSnapshotContent() {
        
        DimensionSnapshot snapshot = months.toSnapshot();
        Assert.assertEquals("months", snapshot.name);
        Assert.assertEquals("Months of the year", snapshot.description);
        Assert.assertEquals(months.size(), snapshot.count);
        
        MemberSnapshot jan = snapshot.members.get(months.getMemberIndex("Jan"));
        Assert.assertEquals("Jan", jan.name);
        Assert.assertEquals(0, jan.level);
        Assert.assertEquals(Arrays.asList(months.getMemberIndex("Q1"), months.getMemberIndex("Year")), jan.ancestors);
        Assert.assertEquals(31, jan.attributes.get("days"));
        Assert.assertEquals("0.0", jan.format);
        
        MemberSnapshot q2 = snapshot.members.get(months.getMemberIndex("Q2"));
        Assert.assertEquals(0.5, q2.weights.get(months.getMemberIndex("Year")), 0.0);
        Assert.assertEquals("Jan", snapshot.aliases.get("January"));
        Assert.assertEquals("java.lang.Long", snapshot.attributes.get("code"));
        // Callback subsets can not be serialized
        Assert.assertEquals(2, snapshot.subsets.size());
    }
    
    @Test
    public void testJsonRoundTrip() {
        
        String json = months.toJson();
        Dimension copy = database.addDimension("copy");
        copy.fromJson(json);
        
        Assert.assertEquals(months.getMembers(), copy.getMembers());
        for (String member : months.getMembers()) {
            Assert.assertEquals(member, months.getMemberIndex(member), copy.getMemberIndex(member));
            Assert.assertEquals(member, months.getLevel(member), copy.getLevel(member));
            Assert.assertEquals(member, months.getParents(member), copy.getParents(member));
            Assert.assertEquals(member, months.getChildren(member), copy.getChildren(member));
        }
        Assert.assertEquals(Arrays.asList("Jan", "Mar", "Feb2", "Apr", "May", "Jun"), 
                copy.getBaseDescendants("Year"));
        Assert.assertEquals(0.5, copy.getMember("Q2").getWeight(copy.getMemberIndex("Year")), 0.0);
        Assert.assertTrue(copy.isWeighted());
        Assert.assertEquals(31, copy.getAttribute("Jan", "days"));
        Assert.assertEquals(7L, copy.getAttribute("Jan", "code"));
        Assert.assertEquals("0.0", copy.getFormat("Jan"));
        Assert.assertEquals("Jan", copy.resolveAlias("January"));
        Assert.assertEquals(Arrays.asList("Jan", "Apr"), copy.getSubset("firstHalf").getMembers());
        Assert.assertEquals(Arrays.asList("Jan"), copy.getSubset("long").getMembers());
        Assert.assertTrue(copy.getSubset("long").isVolatile());
        Assert.assertFalse(copy.subsetExists("computed"));
        Assert.assertFalse(copy.isEditing());
        
        // Index allocation continues after the restored indices
        copy.beginEdit();
        Assert.assertEquals(10, copy.addMember("Jul"));
        copy.commit();
    }
    
    @Test
    public void testDerivedFieldsAreRecomputed() throws Exception {
        
        DimensionSnapshot snapshot = months.toSnapshot();
        for (MemberSnapshot ms : snapshot.members.values()) {
            ms.level = 99;
            ms.ancestors.clear();
            ms.baseDescendants.clear();
        }
        ObjectMapper mapper = new ObjectMapper();
        Dimension copy = database.addDimension("copy");
        copy.fromJson(mapper.writeValueAsString(snapshot));
        
        Assert.assertEquals(2, copy.getLevel("Year"));
        Assert.assertEquals(0, copy.getLevel("Jan"));
        Assert.assertEquals(2, copy.getMember("Jan").getAncestorIndexes().length);
        Assert.assertEquals(3, copy.getBaseDescendants("Q1").size());
    }
    
    @Test
    public void testReloadKeepsFactsOfUnchangedMembers() {
        
        Dimension regions = database.addDimension("regions");
        regions.beginEdit();
        regions.addMany("Total", Arrays.asList("North", "South"));
        regions.commit();
        Cube cube = database.addCube("sales", "months", "regions");
        cube.set(new String[] {"Jan", "North"}, 10);
        cube.set(new String[] {"Mar", "North"}, 5);
        
        DimensionSnapshot snapshot = months.toSnapshot();
        MemberSnapshot mar = snapshot.members.remove(months.getMemberIndex("Mar"));
        snapshot.members.get(months.getMemberIndex("Q1")).children.remove(Integer.valueOf(mar.index));
        months.loadSnapshot(snapshot);
        
        Assert.assertFalse(months.memberExists("Mar"));
        Assert.assertEquals(10.0, cube.getDouble("Jan", "North"), 0.0);
        Assert.assertEquals(10.0, cube.getDouble("Q1", "Total"), 0.0);
        Assert.assertEquals(1, cube.getCellsCount());
    }
    
    @Test
    public void testFailedLoadLeavesDimensionUnchanged() {
        
        DimensionSnapshot snapshot = months.toSnapshot();
        int jan = months.getMemberIndex("Jan");
        int year = months.getMemberIndex("Year");
        // Year below Jan closes a cycle
        snapshot.members.get(jan).children.add(year);
        snapshot.members.get(year).parents.add(jan);
        snapshot.members.get(year).name = "Annual";
        
        try {
            months.loadSnapshot(snapshot);
            Assert.fail("Cyclic snapshot loaded");
        } catch (CircularReferenceException e) {
            // expected
        }
        Assert.assertFalse(months.isEditing());
        Assert.assertTrue(months.memberExists("Year"));
        Assert.assertFalse(months.memberExists("Annual"));
        Assert.assertEquals(2, months.getLevel("Year"));
        Assert.assertTrue(months.getChildren("Jan").isEmpty());
        Assert.assertEquals("Jan", months.resolveAlias("January"));
    }
    
}
