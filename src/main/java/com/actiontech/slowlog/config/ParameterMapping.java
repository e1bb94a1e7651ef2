/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.BeanInfo;
import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Copies string properties onto the writable bean properties of the same name.
 */
public final class ParameterMapping {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParameterMapping.class);
    private static final Map<Class<?>, PropertyDescriptor[]> DESCRIPTORS = new ConcurrentHashMap<>();

    private ParameterMapping() {
    }

    /**
     * every mapped or unconvertible key is removed from src, what is left was not recognized
     */
    public static void mapping(Object target, Properties src) throws IllegalAccessException, InvocationTargetException {
        for (PropertyDescriptor pd : getDescriptors(target.getClass())) {
            String name = pd.getName();
            String valStr = src.getProperty(name);
            Method method = pd.getWriteMethod();
            if (valStr == null || method == null) {
                continue;
            }
            Class<?> cls = pd.getPropertyType();
            Object value;
            try {
                value = convert(cls, valStr.trim());
            } catch (NumberFormatException nfe) {
                LOGGER.warn(getTypeErrorMessage(name, valStr, cls));
                src.remove(name);
                continue;
            }
            if (value == null) {
                LOGGER.warn("unsupported type of property [ " + name + " ]");
            } else {
                method.invoke(target, value);
            }
            src.remove(name);
        }
    }

    /**
     * @return the names of the writable properties of the class
     */
    public static List<String> getPropertyNames(Class<?> clazz) {
        List<String> names = new ArrayList<>();
        for (PropertyDescriptor pd : getDescriptors(clazz)) {
            if (pd.getWriteMethod() != null) {
                names.add(pd.getName());
            }
        }
        return names;
    }

    private static PropertyDescriptor[] getDescriptors(Class<?> clazz) {
        PropertyDescriptor[] pds = DESCRIPTORS.get(clazz);
        if (pds != null) {
            return pds;
        }
        List<PropertyDescriptor> list = new ArrayList<>();
        try {
            BeanInfo beanInfo = Introspector.getBeanInfo(clazz, Object.class);
            for (PropertyDescriptor pd : beanInfo.getPropertyDescriptors()) {
                if (null != pd.getPropertyType()) {
                    list.add(pd);
                }
            }
        } catch (IntrospectionException ie) {
            LOGGER.info("ParameterMappingError", ie);
        }
        pds = list.toArray(new PropertyDescriptor[0]);
        DESCRIPTORS.put(clazz, pds);
        return pds;
    }

    private static Object convert(Class<?> cls, String string) {
        if (cls.equals(String.class)) {
            return string;
        } else if (cls.equals(Boolean.TYPE)) {
            return Boolean.valueOf(string);
        } else if (cls.equals(Integer.TYPE)) {
            return Integer.valueOf(string);
        } else if (cls.equals(Long.TYPE)) {
            return Long.valueOf(string);
        } else if (cls.equals(Double.TYPE)) {
            return Double.valueOf(string);
        }
        return null;
    }

    private static String getTypeErrorMessage(String name, String values, Class<?> cls) {
        return "property [ " + name + " ] '" + values + "' data type should be " + cls.toString();
    }
}
