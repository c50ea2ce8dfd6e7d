package com.pagetree.service;

import com.pagetree.exception.LoadException;
import com.pagetree.model.DomainRow;
import com.pagetree.model.PageRow;
import com.pagetree.repository.DomainRepository;
import com.pagetree.repository.PageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RelationLoaderTest {

    private PageRepository pageRepository;
    private DomainRepository domainRepository;
    private RelationLoader loader;

    @BeforeEach
    void setUp() {
        pageRepository = mock(PageRepository.class);
        domainRepository = mock(DomainRepository.class);
        loader = new RelationLoader();
    }

    @Test
    void buildsIndexFromBothRelations() {
        when(pageRepository.findAll()).thenReturn(List.of(
                new PageRow(1, 0, false),
                new PageRow(2, 1, false)
        ));
        when(domainRepository.findAllByPriority()).thenReturn(List.of(
                new DomainRow(1, "example.com", false)
        ));

        HierarchyIndex index = loader.load(pageRepository, domainRepository);

        assertThat(index.root(2)).isEqualTo(1);
        assertThat(index.domain(1)).isEqualTo("example.com");
        assertThat(index.pageCount()).isEqualTo(2);
    }

    @Test
    void wrapsPageQueryFailure() {
        when(pageRepository.findAll()).thenThrow(new BadSqlGrammarException(
                "pages", "SELECT uid, pid, is_siteroot FROM pages", new SQLException("Table 'pages' doesn't exist")));

        assertThatThrownBy(() -> loader.load(pageRepository, domainRepository))
                .isInstanceOf(LoadException.class)
                .hasMessage("Cannot read pages: Table 'pages' doesn't exist")
                .hasCauseInstanceOf(BadSqlGrammarException.class);
        verify(domainRepository, never()).findAllByPriority();
    }

    @Test
    void wrapsDomainQueryFailure() {
        when(pageRepository.findAll()).thenReturn(List.of(new PageRow(1, 0, false)));
        when(domainRepository.findAllByPriority()).thenThrow(new BadSqlGrammarException(
                "domains", "SELECT pid, domainName, forced FROM sys_domain", new SQLException("Unknown column 'sorting'")));

        assertThatThrownBy(() -> loader.load(pageRepository, domainRepository))
                .isInstanceOf(LoadException.class)
                .hasMessageStartingWith("Cannot read domains");
    }
}
