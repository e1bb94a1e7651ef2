/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Locale;

/**
 * Settings read from slowlog.cnf, see {@link SlowLogConfigLoader}.
 */
public final class SlowLogConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(SlowLogConfig.class);
    private static final String WARNING_FORMAT = "Property [ %s ] '%s' in slowlog.cnf is illegal, you may need use the default value %s replaced";

    public static final String OUTPUT_REPORT = "report";
    public static final String OUTPUT_JSON = "json";

    private String charset = "UTF-8";
    private String malformedStatsPolicy = "skip";
    private String outputFormat = OUTPUT_REPORT;
    private int reportTopN = 0;

    public String getCharset() {
        return charset;
    }

    @SuppressWarnings("unused")
    public void setCharset(String charset) {
        if (isSupported(charset)) {
            this.charset = charset;
        } else {
            LOGGER.warn(String.format(WARNING_FORMAT, "charset", charset, this.charset));
        }
    }

    private static boolean isSupported(String charset) {
        try {
            return charset != null && Charset.isSupported(charset);
        } catch (IllegalCharsetNameException e) {
            return false;
        }
    }

    public String getMalformedStatsPolicy() {
        return malformedStatsPolicy;
    }

    @SuppressWarnings("unused")
    public void setMalformedStatsPolicy(String malformedStatsPolicy) {
        if (MalformedStatsPolicy.of(malformedStatsPolicy) != null) {
            this.malformedStatsPolicy = malformedStatsPolicy.trim().toLowerCase(Locale.ROOT);
        } else {
            LOGGER.warn(String.format(WARNING_FORMAT, "malformedStatsPolicy", malformedStatsPolicy, this.malformedStatsPolicy));
        }
    }

    public MalformedStatsPolicy getStatsPolicy() {
        return MalformedStatsPolicy.of(malformedStatsPolicy);
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    @SuppressWarnings("unused")
    public void setOutputFormat(String outputFormat) {
        if (OUTPUT_REPORT.equalsIgnoreCase(outputFormat) || OUTPUT_JSON.equalsIgnoreCase(outputFormat)) {
            this.outputFormat = outputFormat.toLowerCase(Locale.ROOT);
        } else {
            LOGGER.warn(String.format(WARNING_FORMAT, "outputFormat", outputFormat, this.outputFormat));
        }
    }

    public int getReportTopN() {
        return reportTopN;
    }

    @SuppressWarnings("unused")
    public void setReportTopN(int reportTopN) {
        if (reportTopN >= 0) {
            this.reportTopN = reportTopN;
        } else {
            LOGGER.warn(String.format(WARNING_FORMAT, "reportTopN", reportTopN, this.reportTopN));
        }
    }

    @Override
    public String toString() {
        return "SlowLogConfig [charset=" + charset + ", malformedStatsPolicy=" + malformedStatsPolicy +
                ", outputFormat=" + outputFormat + ", reportTopN=" + reportTopN + "]";
    }
}
