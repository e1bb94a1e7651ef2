/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.parser;

/**
 * A statement could not be normalized.
 */
public class QueryFormatException extends Exception {
    private static final long serialVersionUID = 2853194603912836012L;

    public enum ErrorCode {
        PARSE_ERROR,
        INVALID_QUERY
    }

    private final ErrorCode errorCode;

    private QueryFormatException(ErrorCode errorCode, String errorDesc, Throwable cause) {
        super(errorCode + ":" + errorDesc, cause);
        this.errorCode = errorCode;
    }

    public static QueryFormatException parseError(String parserMessage, Throwable cause) {
        return new QueryFormatException(ErrorCode.PARSE_ERROR, "Failed to parse query: " + parserMessage, cause);
    }

    public static QueryFormatException invalidQuery() {
        return new QueryFormatException(ErrorCode.INVALID_QUERY, "No valid SQL statement found", null);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
