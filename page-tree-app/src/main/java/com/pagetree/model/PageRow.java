package com.pagetree.model;

/**
 * One row of the pages relation.
 *
 * @param uid      page id
 * @param pid      parent page id, 0 for a top-level page
 * @param siteRoot whether the page is flagged as the root of a site
 */
public record PageRow(
    int uid,
    int pid,
    boolean siteRoot
) {
    /**
     * Top-level pages count as roots whatever their flag says.
     */
    public boolean isRoot() {
        return siteRoot || pid == 0;
    }
}
