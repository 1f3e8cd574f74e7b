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
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * @author mengran
 *
 */
public class DimensionAttributesSubsetsTest {
    
    private Dimension months;
    
    @Before
    public void prepare() {
        
        Database database = new Database("AttributesTest", new DatabaseSettings());
        months = database.addDimension("months");
        months.beginEdit();
        months.addMany("Q1", Arrays.asList("Jan", "Feb", "Mar"));
        months.commit();
        months.addAttribute("color", String.class);
        months.addAttribute("days", Integer.class);
        months.setAttribute("Jan", "color", "red");
        months.setAttribute("Feb", "color", "blue");
        months.setAttribute("Jan", "days", 31);
        months.setAttribute("Feb", "days", 28);
    }
    
    @Test
    public void testAttributes() {
        
        Assert.assertEquals("red", months.getAttribute("jan", "COLOR"));
        Assert.assertEquals(28, months.getAttribute("Feb", "days"));
        Assert.assertNull(months.getAttribute("Mar", "days"));
        Assert.assertEquals(Integer.class, months.getAttributeType("days"));
        Assert.assertEquals(Arrays.asList("color", "days"), months.getAttributes());
        Assert.assertEquals(Arrays.asList("Feb"), months.getMembersByAttribute("days", 28));
        Assert.assertEquals(Arrays.asList("Jan"), months.getMembersByAttribute("color", "r*"));
        
        months.removeAttributeValue("Jan", "color");
        Assert.assertNull(months.getAttribute("Jan", "color"));
    }
    
    @Test(expected = IllegalArgumentException.class)
    public void testAttributeTypeIsChecked() {
        months.setAttribute("Mar", "days", "thirty-one");
    }
    
    @Test(expected = KeyNotFoundException.class)
    public void testUnknownAttribute() {
        months.setAttribute("Mar", "weather", "cold");
    }
    
    @Test
    public void testAttributeNames() {
        
        try {
            months.addAttribute("color", String.class);
            Assert.fail("Duplicate attribute accepted");
        } catch (DuplicateKeyException e) {
            // expected
        }
        try {
            months.addAttribute("bad name", String.class);
            Assert.fail("Invalid attribute name accepted");
        } catch (InvalidKeyException e) {
            // expected
        }
        
        months.renameAttribute("color", "colour");
        Assert.assertFalse(months.attributeExists("color"));
        Assert.assertEquals("red", months.getAttribute("Jan", "colour"));
        
        months.removeAttribute("colour");
        Assert.assertFalse(months.attributeExists("colour"));
    }
    
    @Test
    public void testStaticSubset() {
        
        months.addSubset("winter", Arrays.asList("Jan", "Feb"));
        Subset winter = months.getSubset("WINTER");
        Assert.assertTrue(winter.isStatic());
        Assert.assertEquals(Arrays.asList("Jan", "Feb"), winter.getMembers());
        Assert.assertTrue(winter.contains("feb"));
        
        months.beginEdit();
        months.renameMember("Jan", "January");
        months.removeMember("Feb");
        months.commit();
        Assert.assertEquals(Arrays.asList("January"), months.getSubset("winter").getMembers());
    }
    
    @Test
    public void testAttributeSubset() {
        
        Map<String, Object> criteria = new HashMap<String, Object>();
        criteria.put("color", "red");
        months.addSubset("reds", false, criteria);
        months.addSubset("liveReds", true, criteria);
        Assert.assertEquals(Arrays.asList("Jan"), months.getSubset("reds").getMembers());
        Assert.assertEquals(Arrays.asList("Jan"), months.getSubset("liveReds").getMembers());
        
        months.setAttribute("Feb", "color", "red");
        // Cached until the next commit
        Assert.assertEquals(Arrays.asList("Jan"), months.getSubset("reds").getMembers());
        Assert.assertEquals(Arrays.asList("Jan", "Feb"), months.getSubset("liveReds").getMembers());
        
        months.beginEdit();
        months.commit();
        Assert.assertEquals(Arrays.asList("Jan", "Feb"), months.getSubset("reds").getMembers());
    }
    
    @Test
    public void testCallbackSubset() {
        
        AtomicInteger calls = new AtomicInteger();
        months.addSubset("cached", false, (dimension, name) -> {
            calls.incrementAndGet();
            return Arrays.asList("Mar", "Jan");
        });
        months.addSubset("volatile", true, (dimension, name) -> {
            calls.incrementAndGet();
            return dimension.getLeaves();
        });
        
        Assert.assertEquals(Arrays.asList("Mar", "Jan"), months.getSubset("cached").getMembers());
        Assert.assertEquals(2, months.getSubset("cached").size());
        Assert.assertEquals(1, calls.get());
        
        Assert.assertEquals(3, months.getSubset("volatile").size());
        Assert.assertEquals(3, months.getSubset("volatile").size());
        Assert.assertEquals(3, calls.get());
    }
    
    @Test(expected = KeyNotFoundException.class)
    public void testCallbackReturningUnknownMember() {
        months.addSubset("broken", true, (dimension, name) -> Collections.singletonList("Dec"));
        months.getSubset("broken").getMembers();
    }
    
    @Test
    public void testSubsetManagement() {
        
        months.addSubset("first", Arrays.asList("Jan"));
        Assert.assertTrue(months.subsetExists("first"));
        try {
            months.addSubset("first", Arrays.asList("Feb"));
            Assert.fail("Duplicate subset accepted");
        } catch (DuplicateKeyException e) {
            // expected
        }
        try {
            months.addSubset("unknown", Arrays.asList("Dec"));
            Assert.fail("Subset with unknown member accepted");
        } catch (KeyNotFoundException e) {
            // expected
        }
        months.renameSubset("first", "opening");
        Assert.assertEquals(Arrays.asList("opening"), months.getSubsets());
        Assert.assertEquals("opening", months.getSubset("opening").getName());
        months.removeSubset("opening");
        Assert.assertFalse(months.subsetExists("opening"));
    }
    
    @Test
    public void testAliases() {
        
        months.addAlias("Jan", "January");
        months.addAlias("Jan", "01");
        Assert.assertTrue(months.memberExists("january"));
        Assert.assertEquals(months.getMemberIndex("Jan"), months.getMemberIndex("01"));
        Assert.assertEquals("Jan", months.resolveAlias("JANUARY"));
        Assert.assertEquals(Arrays.asList("January", "01"), months.getAliases("Jan"));
        
        try {
            months.addAlias("Feb", "January");
            Assert.fail("Duplicate alias accepted");
        } catch (DuplicateKeyException e) {
            // expected
        }
        try {
            months.addAlias("Feb", "Mar");
            Assert.fail("Alias equal to a member accepted");
        } catch (DuplicateKeyException e) {
            // expected
        }
        months.beginEdit();
        try {
            months.addMember("January");
            Assert.fail("Member equal to an alias accepted");
        } catch (DuplicateKeyException e) {
            // expected
        }
        months.removeMember("Jan");
        months.commit();
        Assert.assertFalse(months.aliasExists("January"));
        
        months.addAlias("Feb", "February");
        months.removeAlias("February");
        Assert.assertFalse(months.memberExists("February"));
    }
    
    @Test
    public void testDescriptionAndFormat() {
        
        Assert.assertEquals("Jan", months.getMember("Jan").getDescription());
        months.setMemberDescription("Jan", "January");
        months.setFormat("Jan", "#,##0.00");
        Assert.assertEquals("January", months.getMember("Jan").getDescription());
        Assert.assertEquals("#,##0.00", months.getFormat("Jan"));
        Assert.assertEquals("months:Jan", months.getMember("Jan").toString());
    }
    
}
