package com.pagetree.service;

import com.pagetree.exception.NoSelectionException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the explicit page id and the ids of the ad-hoc query into the final
 * list of ids to print.
 *
 * With the children flag every seed contributes its descendants, with the
 * roots flag its site root; both flags together contribute both. Without
 * either flag the seeds pass through, and query ids then replace whatever the
 * explicit id contributed.
 */
@Service
public class SelectionCombinator {

    /**
     * @param index    loaded page tree
     * @param pageId   explicit id, ignored unless greater than zero; may be null
     * @param queryIds ids returned by the ad-hoc query, or null when no query ran
     * @param children expand seeds to their descendants
     * @param roots    collapse seeds to their site root
     * @return selected ids in order, duplicates kept
     * @throws NoSelectionException when nothing is selected
     */
    public List<Integer> combine(HierarchyIndex index,
                                 Integer pageId,
                                 List<Integer> queryIds,
                                 boolean children,
                                 boolean roots) {
        List<Integer> ids = new ArrayList<>();

        if (pageId != null && pageId > 0) {
            if (children) {
                ids.addAll(index.descendants(pageId));
            }
            if (roots) {
                ids.add(index.root(pageId));
            }
            if (!children && !roots) {
                ids.add(pageId);
            }
        }

        if (queryIds != null) {
            if (children) {
                for (Integer queryId : queryIds) {
                    ids.addAll(index.descendants(queryId));
                }
            }
            if (roots) {
                for (Integer queryId : queryIds) {
                    ids.add(index.root(queryId));
                }
            }
            if (!children && !roots) {
                ids = new ArrayList<>(queryIds);
            }
        }

        if (ids.isEmpty()) {
            throw new NoSelectionException();
        }
        return ids;
    }
}
