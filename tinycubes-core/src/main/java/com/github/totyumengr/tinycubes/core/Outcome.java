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

/**
 * Result of a rule invocation: proceed with normal lookup, a value, or an error.
 * 
 * @author mengran
 *
 */
public final class Outcome {
    
    private static final Outcome PROCEED = new Outcome(Kind.PROCEED, null, null);
    
    public static enum Kind {
        PROCEED, VALUE, ERROR
    }
    
    private final Kind kind;
    private final Object value;
    private final String message;
    
    private Outcome(Kind kind, Object value, String message) {
        super();
        this.kind = kind;
        this.value = value;
        this.message = message;
    }
    
    /**
     * No override, continue with the stored or aggregated value.
     */
    public static Outcome proceed() {
        return PROCEED;
    }
    
    public static Outcome of(Object value) {
        return new Outcome(Kind.VALUE, value, null);
    }
    
    public static Outcome error(String message) {
        return new Outcome(Kind.ERROR, null, message);
    }

    public Kind getKind() {
        return kind;
    }
    
    public boolean isProceed() {
        return kind == Kind.PROCEED;
    }
    
    public boolean isError() {
        return kind == Kind.ERROR;
    }

    public Object getValue() {
        return value;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        switch (kind) {
        case VALUE:
            return "Outcome [" + value + "]";
        case ERROR:
            return "Outcome [error=" + message + "]";
        default:
            return "Outcome [proceed]";
        }
    }
    
}
