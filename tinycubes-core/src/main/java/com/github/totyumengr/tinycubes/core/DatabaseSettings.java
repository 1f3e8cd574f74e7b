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

import java.io.IOException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Engine configuration. Defaults come from classpath resource {@value #RESOURCE}, every key can be overridden by
 * a JVM system property with the same name.
 * 
 * @author mengran
 *
 */
public class DatabaseSettings {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseSettings.class);
    
    public static final String RESOURCE = "tinycubes.properties";
    
    public static final String CACHING = "tinycubes.caching";
    public static final String RULE_MAX_DEPTH = "tinycubes.rules.max-depth";
    public static final String RULE_ROUNDING = "tinycubes.rules.rounding";
    
    private boolean caching = true;
    private int ruleMaxDepth = 64;
    private boolean ruleRounding = true;
    
    /**
     * Settings with built-in defaults only, nothing is read.
     */
    public DatabaseSettings() {
        super();
    }
    
    /**
     * @return settings from {@value #RESOURCE} (if present) overridden by system properties.
     */
    public static DatabaseSettings load() {
        
        Properties properties = new Properties();
        ClassPathResource resource = new ClassPathResource(RESOURCE);
        if (resource.exists()) {
            try {
                PropertiesLoaderUtils.fillProperties(properties, resource);
            } catch (IOException e) {
                throw new IllegalStateException("Can not read " + RESOURCE, e);
            }
        }
        for (String key : new String[] {CACHING, RULE_MAX_DEPTH, RULE_ROUNDING}) {
            String value = System.getProperty(key);
            if (StringUtils.hasText(value)) {
                properties.setProperty(key, value);
            }
        }
        DatabaseSettings settings = from(properties);
        LOGGER.debug("Loaded settings {}", settings);
        return settings;
    }
    
    public static DatabaseSettings from(Properties properties) {
        
        DatabaseSettings settings = new DatabaseSettings();
        String value = properties.getProperty(CACHING);
        if (StringUtils.hasText(value)) {
            settings.setCaching(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(RULE_MAX_DEPTH);
        if (StringUtils.hasText(value)) {
            try {
                settings.setRuleMaxDepth(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(RULE_MAX_DEPTH + " must be an integer but was '" + value + "'.", e);
            }
        }
        value = properties.getProperty(RULE_ROUNDING);
        if (StringUtils.hasText(value)) {
            settings.setRuleRounding(Boolean.parseBoolean(value.trim()));
        }
        return settings;
    }

    public boolean isCaching() {
        return caching;
    }

    public DatabaseSettings setCaching(boolean caching) {
        this.caching = caching;
        return this;
    }

    public int getRuleMaxDepth() {
        return ruleMaxDepth;
    }

    public DatabaseSettings setRuleMaxDepth(int ruleMaxDepth) {
        Assert.isTrue(ruleMaxDepth > 0, "Rule max depth must be positive.");
        this.ruleMaxDepth = ruleMaxDepth;
        return this;
    }

    public boolean isRuleRounding() {
        return ruleRounding;
    }

    public DatabaseSettings setRuleRounding(boolean ruleRounding) {
        this.ruleRounding = ruleRounding;
        return this;
    }

    @Override
    public String toString() {
        return "DatabaseSettings [caching=" + caching + ", ruleMaxDepth=" + ruleMaxDepth + ", ruleRounding="
                + ruleRounding + "]";
    }
    
}
