package com.pagetree.repository;

import com.pagetree.model.DomainRow;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;

public class DomainRepository {

    private final JdbcTemplate jdbc;
    private final String domainsQuery;

    // root page id, domain name, forced
    private static final RowMapper<DomainRow> DOMAIN_MAPPER = (rs, rowNum) -> new DomainRow(
        Columns.requiredInt(rs, 1),
        Columns.requiredString(rs, 2),
        rs.getBoolean(3)
    );

    public DomainRepository(JdbcTemplate jdbc, String domainsQuery) {
        this.jdbc = jdbc;
        this.domainsQuery = domainsQuery;
    }

    /**
     * Domain bindings in the order the configured query sorts them.
     * The order decides which binding wins for a root, so it must not be changed here.
     */
    public List<DomainRow> findAllByPriority() {
        return jdbc.query(domainsQuery, DOMAIN_MAPPER);
    }
}
