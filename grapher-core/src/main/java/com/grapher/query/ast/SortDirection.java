package com.grapher.query.ast;

/** Sort order of an ORDER BY item. */
public enum SortDirection {
    ASC,
    DESC
}
