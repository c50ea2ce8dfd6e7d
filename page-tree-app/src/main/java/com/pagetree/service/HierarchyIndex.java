package com.pagetree.service;

import com.pagetree.exception.CycleException;
import com.pagetree.model.DomainRow;
import com.pagetree.model.PageRow;

import java.util.*;

/**
 * In-memory view of the page tree: parent pointers, site roots and the domain
 * bound to each root. Built once from the loaded rows and never modified.
 */
public final class HierarchyIndex {

    /** Returned by {@link #root(int)} when the parent chain breaks before a root. */
    public static final int NO_ROOT = 0;

    private final Map<Integer, Integer> parents;
    private final Map<Integer, List<Integer>> children;
    private final Set<Integer> roots;
    private final Map<Integer, String> domains;

    private HierarchyIndex(Map<Integer, Integer> parents,
                           Map<Integer, List<Integer>> children,
                           Set<Integer> roots,
                           Map<Integer, String> domains) {
        this.parents = parents;
        this.children = children;
        this.roots = roots;
        this.domains = domains;
    }

    /**
     * Build the index from the pages relation and the domains relation.
     *
     * @param pages   page rows; a later row for the same uid replaces the parent of an earlier one
     * @param domains domain rows in priority order; the first row per root wins unless a later one is forced
     * @return the index
     */
    public static HierarchyIndex build(List<PageRow> pages, List<DomainRow> domains) {
        Map<Integer, Integer> parents = new LinkedHashMap<>();
        Set<Integer> roots = new HashSet<>();
        for (PageRow page : pages) {
            parents.put(page.uid(), page.pid());
            if (page.isRoot()) {
                roots.add(page.uid());
            }
        }

        Map<Integer, List<Integer>> children = new HashMap<>();
        parents.forEach((uid, pid) -> children.computeIfAbsent(pid, k -> new ArrayList<>()).add(uid));

        Map<Integer, String> bindings = new HashMap<>();
        for (DomainRow domain : domains) {
            if (bindings.containsKey(domain.rootId()) && !domain.forced()) {
                continue;
            }
            bindings.put(domain.rootId(), domain.domainName());
        }

        children.replaceAll((pid, list) -> List.copyOf(list));
        return new HierarchyIndex(
                Collections.unmodifiableMap(parents),
                Collections.unmodifiableMap(children),
                Collections.unmodifiableSet(roots),
                Collections.unmodifiableMap(bindings)
        );
    }

    public boolean isRoot(int id) {
        return roots.contains(id);
    }

    /**
     * Walk parent pointers up from {@code id} to the first root.
     *
     * @return {@code id} itself when it is a root, the root above it, or
     *         {@link #NO_ROOT} when an id on the way up is not a known page
     * @throws CycleException when the walk comes back to a page already passed
     */
    public int root(int id) {
        if (isRoot(id)) {
            return id;
        }
        Set<Integer> visited = new HashSet<>();
        visited.add(id);
        int current = id;
        while (true) {
            Integer parent = parents.get(current);
            if (parent == null) {
                return NO_ROOT;
            }
            if (isRoot(parent)) {
                return parent;
            }
            if (!visited.add(parent)) {
                throw new CycleException(id, parent);
            }
            current = parent;
        }
    }

    /**
     * All pages below {@code id} at any depth, depth first, each child
     * followed by its own subtree. {@code id} itself is not included.
     *
     * @throws CycleException when a page is reached twice, which only happens
     *         if parent pointers form a loop
     */
    public List<Integer> descendants(int id) {
        List<Integer> result = new ArrayList<>();
        Set<Integer> visited = new HashSet<>();
        visited.add(id);

        Deque<Iterator<Integer>> stack = new ArrayDeque<>();
        stack.push(childrenOf(id).iterator());
        while (!stack.isEmpty()) {
            Iterator<Integer> level = stack.peek();
            if (!level.hasNext()) {
                stack.pop();
                continue;
            }
            int child = level.next();
            if (!visited.add(child)) {
                throw new CycleException(id, child);
            }
            result.add(child);
            stack.push(childrenOf(child).iterator());
        }
        return result;
    }

    /**
     * @return the domain bound to {@code rootId}, or the empty string when none is
     */
    public String domain(int rootId) {
        return domains.getOrDefault(rootId, "");
    }

    public int pageCount() {
        return parents.size();
    }

    public int rootCount() {
        return roots.size();
    }

    public int domainCount() {
        return domains.size();
    }

    private List<Integer> childrenOf(int id) {
        return children.getOrDefault(id, List.of());
    }
}
