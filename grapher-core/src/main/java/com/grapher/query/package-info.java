/**
 * The pattern query language: scanner, parser and executor.
 *
 * <p>{@link com.grapher.query.QueryEngine} is the usual entry point.
 * Parse failures are {@link com.grapher.query.ParseException}s; execution
 * failures are {@link com.grapher.query.QueryStructureException} and
 * {@link com.grapher.query.QueryExecutionException}. All of them are
 * checked.</p>
 */
package com.grapher.query;
