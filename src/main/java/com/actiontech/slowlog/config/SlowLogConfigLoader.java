/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.config;

import com.google.common.base.Joiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.reflect.InvocationTargetException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Loads {@link SlowLogConfig} from the classpath file slowlog.cnf, one {@code -Dkey=value} per line,
 * then lets JVM system properties of the same name override it.
 */
public final class SlowLogConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(SlowLogConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "/slowlog.cnf";

    private SlowLogConfigLoader() {
    }

    public static SlowLogConfig load() throws IOException {
        return load(CONFIG_FILE_NAME, System.getProperties());
    }

    public static SlowLogConfig load(String resource, Properties systemProperties) throws IOException {
        SlowLogConfig config = new SlowLogConfig();
        Properties pros = readConf(resource);
        for (String name : ParameterMapping.getPropertyNames(SlowLogConfig.class)) {
            String value = systemProperties.getProperty(name);
            if (value != null) {
                pros.setProperty(name, value);
            }
        }
        try {
            ParameterMapping.mapping(config, pros);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IOException("can't apply " + resource, e);
        }
        if (!pros.isEmpty()) {
            LOGGER.warn("These properties in {} are not recognized: {}", resource, Joiner.on(",").join(pros.keySet()));
        }
        LOGGER.info("load config: {}", config);
        return config;
    }

    static Properties readConf(String resource) throws IOException {
        Properties pros = new Properties();
        try (InputStream configIS = SlowLogConfigLoader.class.getResourceAsStream(resource)) {
            if (configIS == null) {
                LOGGER.info("{} is not exists, use default config", resource);
                return pros;
            }
            BufferedReader in = new BufferedReader(new InputStreamReader(configIS, StandardCharsets.UTF_8));
            for (String line; (line = in.readLine()) != null; ) {
                line = line.trim();
                if (line.length() == 0 || line.startsWith("#")) {
                    continue;
                }
                int ind = line.indexOf('=');
                if (ind < 0) {
                    throw new IOException(resource + " format error:" + line);
                }
                String key = line.substring(0, ind).trim();
                String value = line.substring(ind + 1).trim();
                if (key.startsWith("-D")) {
                    pros.setProperty(key.substring(2), value);
                } else {
                    throw new IOException(resource + " format error:" + line);
                }
            }
        } catch (IOException e) {
            LOGGER.warn("read " + resource + " error:", e);
            throw e;
        }
        return pros;
    }
}
