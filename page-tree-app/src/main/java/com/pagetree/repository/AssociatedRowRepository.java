package com.pagetree.repository;

import com.pagetree.model.AssociatedRows;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

import java.sql.SQLDataException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs caller-supplied queries that yield page ids, optionally followed by
 * extra columns that are recorded per id.
 */
public class AssociatedRowRepository {

    private final JdbcTemplate jdbc;
    private final AssociatedRows associatedRows;

    public AssociatedRowRepository(JdbcTemplate jdbc, AssociatedRows associatedRows) {
        this.jdbc = jdbc;
        this.associatedRows = associatedRows;
    }

    /**
     * Execute {@code sql} and return the ids of its first column in row order.
     * The query must project exactly {@code nFields} columns after the id; when
     * {@code nFields} is positive their values are stored against each id,
     * NULL becoming the empty string.
     *
     * @param sql     id-yielding query
     * @param nFields number of associated columns after the id
     * @return ids in result order, duplicates kept
     */
    public List<Integer> findIds(String sql, int nFields) {
        List<Integer> ids = new ArrayList<>();
        RowCallbackHandler handler = rs -> {
            int columns = rs.getMetaData().getColumnCount();
            if (columns != nFields + 1) {
                throw new SQLDataException(
                    "Expected " + (nFields + 1) + " columns (id + " + nFields + " fields) but query returned " + columns);
            }
            int id = Columns.requiredInt(rs, 1);
            if (nFields > 0) {
                List<String> values = new ArrayList<>(nFields);
                for (int i = 0; i < nFields; i++) {
                    values.add(Columns.optionalString(rs, i + 2));
                }
                associatedRows.put(id, values);
            }
            ids.add(id);
        };
        jdbc.query(sql, handler);
        return ids;
    }
}
