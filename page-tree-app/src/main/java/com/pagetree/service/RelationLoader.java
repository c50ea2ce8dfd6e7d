package com.pagetree.service;

import com.pagetree.exception.LoadException;
import com.pagetree.model.DomainRow;
import com.pagetree.model.PageRow;
import com.pagetree.repository.DomainRepository;
import com.pagetree.repository.PageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class RelationLoader {

    private static final Logger log = LoggerFactory.getLogger(RelationLoader.class);

    /**
     * Read both relations and build the index from them.
     * Either read failing aborts the load; no partial index is returned.
     *
     * @throws LoadException when a query fails or a row cannot be decoded
     */
    public HierarchyIndex load(PageRepository pageRepository, DomainRepository domainRepository) {
        List<PageRow> pages;
        try {
            pages = pageRepository.findAll();
        } catch (DataAccessException e) {
            throw new LoadException("Cannot read pages: " + e.getMostSpecificCause().getMessage(), e);
        }

        List<DomainRow> domains;
        try {
            domains = domainRepository.findAllByPriority();
        } catch (DataAccessException e) {
            throw new LoadException("Cannot read domains: " + e.getMostSpecificCause().getMessage(), e);
        }

        HierarchyIndex index = HierarchyIndex.build(pages, domains);
        log.info("Loaded {} pages, {} site roots, {} domains",
                index.pageCount(), index.rootCount(), index.domainCount());
        return index;
    }
}
