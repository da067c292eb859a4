// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.letrec.common;

import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Load a 'key = value' file onto the static fields of a config class.
 * Only public static fields annotated with {@link ConfField} are settable.
 */
public class ConfigBase {
    private static final Logger LOG = LogManager.getLogger(ConfigBase.class);

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface ConfField {
        boolean mutable() default false;

        String[] description() default {};
    }

    protected ConfigBase() {
    }

    /** load the file at the given path onto {@link Config} */
    public static void init(String configFile) throws ConfigException {
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(configFile)) {
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigException("failed to read config file " + configFile, e);
        }
        initFromProperties(Config.class, props);
        LOG.info("loaded {} config item(s) from {}", props.size(), configFile);
    }

    /**
     * Set every property onto the matching field of the config class.
     * An unknown key fails the whole load before any field is touched.
     */
    public static void initFromProperties(Class<?> confClass, Properties props) throws ConfigException {
        Map<String, Field> fields = getConfFields(confClass);
        for (String key : props.stringPropertyNames()) {
            if (!fields.containsKey(key)) {
                throw new ConfigException("unknown config item: " + key);
            }
        }
        for (String key : props.stringPropertyNames()) {
            setConfigField(fields.get(key), props.getProperty(key).trim());
        }
    }

    /** current value of every config item, keyed by name */
    public static Map<String, String> dump(Class<?> confClass) {
        Map<String, String> result = new TreeMap<>();
        for (Map.Entry<String, Field> entry : getConfFields(confClass).entrySet()) {
            try {
                Object value = entry.getValue().get(null);
                result.put(entry.getKey(),
                        value instanceof String[] ? String.join(",", (String[]) value) : String.valueOf(value));
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("can not read config item " + entry.getKey(), e);
            }
        }
        return result;
    }

    private static Map<String, Field> getConfFields(Class<?> confClass) {
        Map<String, Field> fields = new TreeMap<>();
        for (Field field : confClass.getFields()) {
            if (field.isAnnotationPresent(ConfField.class) && Modifier.isStatic(field.getModifiers())) {
                fields.put(field.getName(), field);
            }
        }
        return fields;
    }

    private static void setConfigField(Field field, String value) throws ConfigException {
        Class<?> type = field.getType();
        try {
            if (type == int.class) {
                field.setInt(null, Integer.parseInt(value));
            } else if (type == long.class) {
                field.setLong(null, Long.parseLong(value));
            } else if (type == boolean.class) {
                field.setBoolean(null, parseBoolean(field.getName(), value));
            } else if (type == double.class) {
                field.setDouble(null, Double.parseDouble(value));
            } else if (type == String.class) {
                field.set(null, value);
            } else if (type == String[].class) {
                field.set(null, Strings.isNullOrEmpty(value)
                        ? new String[0]
                        : Arrays.stream(value.split(",")).map(String::trim).toArray(String[]::new));
            } else {
                throw new ConfigException("unsupported type " + type.getSimpleName() + " of " + field.getName());
            }
        } catch (NumberFormatException e) {
            throw new ConfigException("invalid value '" + value + "' for " + field.getName(), e);
        } catch (IllegalAccessException e) {
            throw new ConfigException("can not set config item " + field.getName(), e);
        }
    }

    private static boolean parseBoolean(String name, String value) throws ConfigException {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigException("invalid value '" + value + "' for " + name);
    }
}
