package com.pagetree.command;

import com.pagetree.exception.ResolverException;
import com.pagetree.exception.UsageException;
import com.pagetree.model.ResolverOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.util.concurrent.Callable;

/**
 * Command line surface of the resolver. Single-dash spellings are accepted
 * alongside the double-dash ones.
 */
@Command(
        name = "page-tree",
        mixinStandardHelpOptions = true,
        description = "Resolve page ids into site URLs, or into related page ids"
)
public class ResolveCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCli.class);

    @Option(names = {"--dsn", "-dsn"}, required = true, description = "JDBC connection string of the page database")
    String dsn;

    @Option(names = {"--pid", "-pid"}, defaultValue = "0", description = "Page ID")
    int pageId;

    @Option(names = {"--query", "-query"}, description = "A select that yields a list of page IDs")
    String query;

    @Option(names = {"--nfields", "-nfields"}, defaultValue = "0",
            description = "Number of fields selected by --query besides the page id")
    int nFields;

    @Option(names = {"--children", "-children"}, arity = "0..1", defaultValue = "false",
            description = "Select children pages")
    boolean children;

    @Option(names = {"--roots", "-roots"}, arity = "0..1", defaultValue = "false",
            description = "Select root pages")
    boolean roots;

    @Option(names = {"--csv", "-csv"}, arity = "0..1", defaultValue = "false",
            description = "Print the selected ids as one comma separated line instead of URLs")
    boolean csv;

    private final ResolveCommand command;
    private final PrintStream out;

    public ResolveCli(ResolveCommand command, PrintStream out) {
        this.command = command;
        this.out = out;
    }

    @Override
    public Integer call() {
        try {
            command.execute(toOptions(), out);
            return 0;
        } catch (ResolverException e) {
            log.error(e.getMessage(), e.getCause());
            return 1;
        }
    }

    ResolverOptions toOptions() {
        if (nFields < 0) {
            throw new UsageException("--nfields must not be negative, got " + nFields);
        }
        return new ResolverOptions(dsn, pageId, query, nFields, children, roots, csv);
    }
}
