package com.pagetree.repository;

import com.pagetree.model.PageRow;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;

public class PageRepository {

    private final JdbcTemplate jdbc;
    private final String pagesQuery;

    // uid, pid, is_siteroot
    private static final RowMapper<PageRow> PAGE_MAPPER = (rs, rowNum) -> new PageRow(
        Columns.requiredInt(rs, 1),
        Columns.requiredInt(rs, 2),
        rs.getBoolean(3)
    );

    public PageRepository(JdbcTemplate jdbc, String pagesQuery) {
        this.jdbc = jdbc;
        this.pagesQuery = pagesQuery;
    }

    public List<PageRow> findAll() {
        return jdbc.query(pagesQuery, PAGE_MAPPER);
    }
}
