package com.pagetree.service;

import com.pagetree.config.ResolverConfig;
import com.pagetree.model.AssociatedRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class OutputFormatter {

    private static final Logger log = LoggerFactory.getLogger(OutputFormatter.class);

    private final ResolverConfig config;

    public OutputFormatter(ResolverConfig config) {
        this.config = config;
    }

    /**
     * All ids on one line, joined by the configured separator.
     */
    public String idList(List<Integer> ids) {
        return ids.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(config.getListSeparator()));
    }

    /**
     * One line per id whose site root has a domain: the page URL, or with
     * {@code nFields > 0} a CSV row of the quoted URL followed by the id's
     * associated values. Ids without a domain produce no line.
     */
    public List<String> urlLines(HierarchyIndex index, List<Integer> ids, int nFields, AssociatedRows associatedRows) {
        List<String> lines = new ArrayList<>(ids.size());
        for (Integer id : ids) {
            int root = index.root(id);
            String domain = index.domain(root);
            if (domain.isEmpty()) {
                log.debug("Skipping page {}: no domain bound to site root {}", id, root);
                continue;
            }
            String url = pageUrl(domain, id);
            if (nFields > 0) {
                lines.add(csvRow(url, associatedRows.get(id), nFields));
            } else {
                lines.add(url);
            }
        }
        return lines;
    }

    String pageUrl(String domain, int id) {
        return String.format(config.getUrlPattern(), domain, id);
    }

    private String csvRow(String url, List<String> values, int nFields) {
        StringBuilder row = new StringBuilder();
        row.append('"').append(url).append('"');
        for (int i = 0; i < nFields; i++) {
            // ids that did not come from the query have no values
            String value = i < values.size() ? values.get(i) : "";
            row.append(",\"").append(value.replace("\"", "\\\"")).append('"');
        }
        return row.toString();
    }
}
