package com.pagetree.model;

/**
 * Options of a single resolver run, as given on the command line.
 *
 * @param dsn      JDBC connection string
 * @param pageId   explicit page id, only used when greater than zero
 * @param query    id-yielding SQL, may be null
 * @param nFields  number of columns the query projects after the id
 * @param children expand every selected id to its descendants
 * @param roots    collapse every selected id to its site root
 * @param csv      print a comma separated id list instead of URLs
 */
public record ResolverOptions(
    String dsn,
    int pageId,
    String query,
    int nFields,
    boolean children,
    boolean roots,
    boolean csv
) {
    public boolean hasPageId() {
        return pageId > 0;
    }

    public boolean hasQuery() {
        return query != null && !query.isEmpty();
    }
}
