package com.conveyal.stopboard.loader;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides what happens when an imported row collides with a row already in the store under the same primary key.
 * Either the existing row is left untouched (insert-only), or a fixed list of columns is overwritten with the
 * incoming values and every other column keeps its stored value.
 *
 * Keeping the list explicit per table makes it easy to see which columns a re-import is authoritative for. Insert-only
 * tables such as agency and calendar protect manually curated values from regressions in a newly published feed.
 */
public class MergePolicy {

    private final ImmutableList<String> overwrittenColumns;

    private MergePolicy (List<String> overwrittenColumns) {
        this.overwrittenColumns = ImmutableList.copyOf(overwrittenColumns);
    }

    /** Existing rows are never modified by a re-import. */
    public static MergePolicy insertOnly () {
        return new MergePolicy(ImmutableList.of());
    }

    /** On conflict, only the named columns take the incoming values. */
    public static MergePolicy overwrite (String... columns) {
        if (columns.length == 0) {
            throw new IllegalArgumentException("An overwrite policy must name at least one column, use insertOnly()");
        }
        return new MergePolicy(ImmutableList.copyOf(columns));
    }

    public boolean isInsertOnly () {
        return overwrittenColumns.isEmpty();
    }

    public List<String> getOverwrittenColumns () {
        return overwrittenColumns;
    }

    /**
     * @return true if an existing row's value in this column is replaced when the same key is imported again.
     */
    public boolean overwrites (String column) {
        return overwrittenColumns.contains(column);
    }

    /**
     * Render the conflict clause appended to an insert statement. The syntax is shared by PostgreSQL (9.5+) and
     * SQLite (3.24+).
     */
    public String conflictClause (List<String> keyColumns) {
        String target = String.join(", ", keyColumns);
        if (isInsertOnly()) return String.format("on conflict (%s) do nothing", target);
        String assignments = overwrittenColumns.stream()
            .map(column -> String.format("%s = excluded.%s", column, column))
            .collect(Collectors.joining(", "));
        return String.format("on conflict (%s) do update set %s", target, assignments);
    }

    @Override
    public String toString () {
        return isInsertOnly() ? "insert-only" : "overwrite " + overwrittenColumns;
    }
}
