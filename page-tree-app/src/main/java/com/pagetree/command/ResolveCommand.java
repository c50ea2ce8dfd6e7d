package com.pagetree.command;

import com.pagetree.config.DataSourceConnector;
import com.pagetree.config.ResolverConfig;
import com.pagetree.exception.QueryException;
import com.pagetree.exception.UsageException;
import com.pagetree.model.AssociatedRows;
import com.pagetree.model.ResolverOptions;
import com.pagetree.repository.AssociatedRowRepository;
import com.pagetree.repository.DomainRepository;
import com.pagetree.repository.PageRepository;
import com.pagetree.service.HierarchyIndex;
import com.pagetree.service.OutputFormatter;
import com.pagetree.service.RelationLoader;
import com.pagetree.service.SelectionCombinator;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * One resolver run: connect, load the page tree, run the optional id query,
 * select ids and print them.
 */
@Component
public class ResolveCommand {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    private final ResolverConfig config;
    private final DataSourceConnector connector;
    private final RelationLoader relationLoader;
    private final SelectionCombinator selectionCombinator;
    private final OutputFormatter outputFormatter;

    public ResolveCommand(ResolverConfig config,
                          DataSourceConnector connector,
                          RelationLoader relationLoader,
                          SelectionCombinator selectionCombinator,
                          OutputFormatter outputFormatter) {
        this.config = config;
        this.connector = connector;
        this.relationLoader = relationLoader;
        this.selectionCombinator = selectionCombinator;
        this.outputFormatter = outputFormatter;
    }

    public void execute(ResolverOptions options, PrintStream out) {
        if (options.dsn() == null || options.dsn().isBlank()) {
            throw new UsageException("must have DSN as argument (--dsn=<jdbc url>)");
        }

        try (HikariDataSource dataSource = connector.connect(options.dsn())) {
            JdbcTemplate jdbc = new JdbcTemplate(dataSource);

            HierarchyIndex index = relationLoader.load(
                    new PageRepository(jdbc, config.getQueries().getPages()),
                    new DomainRepository(jdbc, config.getQueries().getDomains()));

            AssociatedRows associatedRows = new AssociatedRows();
            List<Integer> queryIds = null;
            if (options.hasQuery()) {
                queryIds = runQuery(new AssociatedRowRepository(jdbc, associatedRows), options.query(), options.nFields());
            }

            List<Integer> ids = selectionCombinator.combine(
                    index, options.hasPageId() ? options.pageId() : null, queryIds, options.children(), options.roots());
            log.info("Selected {} page ids", ids.size());

            if (options.csv()) {
                out.println(outputFormatter.idList(ids));
            } else {
                outputFormatter.urlLines(index, ids, options.nFields(), associatedRows)
                        .forEach(out::println);
            }
            out.flush();
        }
    }

    private List<Integer> runQuery(AssociatedRowRepository repository, String sql, int nFields) {
        log.debug("Running id query with {} associated fields: {}", nFields, sql);
        try {
            List<Integer> ids = repository.findIds(sql, nFields);
            log.debug("Id query returned {} rows", ids.size());
            return ids;
        } catch (DataAccessException e) {
            throw new QueryException("cannot execute argument query: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
