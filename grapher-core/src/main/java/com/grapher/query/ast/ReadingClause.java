package com.grapher.query.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A {@code MATCH} or {@code OPTIONAL MATCH} clause.
 *
 * @param optional whether the clause was written OPTIONAL MATCH
 * @param patterns comma-separated patterns
 * @param where the WHERE expression, if any
 */
public record ReadingClause(boolean optional,
                            List<MatchPattern> patterns,
                            Optional<Expr> where) {

    /**
     * Copies the patterns.
     *
     * @param optional whether the clause is optional
     * @param patterns the patterns
     * @param where the WHERE expression
     */
    public ReadingClause {
        patterns = List.copyOf(patterns);
        Objects.requireNonNull(where, "where");
    }

    @Override
    public String toString() {
        String text = (optional ? "OPTIONAL MATCH " : "MATCH ")
            + patterns.stream().map(MatchPattern::toString)
                .collect(Collectors.joining(", "));
        return where.map(w -> text + " WHERE " + w).orElse(text);
    }
}
