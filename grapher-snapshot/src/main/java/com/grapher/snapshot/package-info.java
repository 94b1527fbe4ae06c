/**
 * JSON snapshots of graph stores.
 */
package com.grapher.snapshot;
