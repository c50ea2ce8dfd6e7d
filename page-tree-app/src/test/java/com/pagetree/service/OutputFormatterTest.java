package com.pagetree.service;

import com.pagetree.config.ResolverConfig;
import com.pagetree.model.AssociatedRows;
import com.pagetree.model.DomainRow;
import com.pagetree.model.PageRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OutputFormatterTest {

    private static final HierarchyIndex INDEX = HierarchyIndex.build(List.of(
            new PageRow(1, 0, false),
            new PageRow(2, 1, false),
            new PageRow(3, 2, false),
            new PageRow(20, 0, false),
            new PageRow(21, 20, false)
    ), List.of(new DomainRow(1, "example.com", false)));

    private ResolverConfig config;
    private OutputFormatter formatter;

    @BeforeEach
    void setUp() {
        config = new ResolverConfig();
        formatter = new OutputFormatter(config);
    }

    @Nested
    @DisplayName("idList")
    class IdList {

        @Test
        void joinsWithCommaAndSpace() {
            assertThat(formatter.idList(List.of(3, 4, 5))).isEqualTo("3, 4, 5");
        }

        @Test
        void singleIdHasNoSeparator() {
            assertThat(formatter.idList(List.of(42))).isEqualTo("42");
        }

        @Test
        void usesConfiguredSeparator() {
            config.setListSeparator(",");

            assertThat(formatter.idList(List.of(1, 2))).isEqualTo("1,2");
        }
    }

    @Nested
    @DisplayName("urlLines")
    class UrlLines {

        @Test
        void buildsUrlFromRootDomain() {
            assertThat(formatter.urlLines(INDEX, List.of(3), 0, new AssociatedRows()))
                    .containsExactly("https://example.com/index.php?id=3");
        }

        @Test
        void skipsIdsWhoseRootHasNoDomain() {
            List<Integer> ids = List.of(21, 1, 999, 2, 20);

            List<String> lines = formatter.urlLines(INDEX, ids, 0, new AssociatedRows());

            long resolvable = ids.stream().filter(id -> !INDEX.domain(INDEX.root(id)).isEmpty()).count();
            assertThat(lines).hasSize((int) resolvable);
            assertThat(lines).containsExactly(
                    "https://example.com/index.php?id=1",
                    "https://example.com/index.php?id=2"
            );
        }

        @Test
        void keepsDuplicateIds() {
            assertThat(formatter.urlLines(INDEX, List.of(2, 2), 0, new AssociatedRows())).hasSize(2);
        }

        @Test
        void usesConfiguredUrlPattern() {
            config.setUrlPattern("http://%s/?id=%d");

            assertThat(formatter.urlLines(INDEX, List.of(2), 0, new AssociatedRows()))
                    .containsExactly("http://example.com/?id=2");
        }

        @Test
        void writesQuotedCsvRowWithAssociatedValues() {
            AssociatedRows rows = new AssociatedRows();
            rows.put(3, List.of("Team \"A\"", "alice"));

            assertThat(formatter.urlLines(INDEX, List.of(3), 2, rows))
                    .containsExactly("\"https://example.com/index.php?id=3\",\"Team \\\"A\\\"\",\"alice\"");
        }

        @Test
        void writesEmptyFieldsForIdsWithoutAssociatedValues() {
            AssociatedRows rows = new AssociatedRows();
            rows.put(3, List.of("x", "y"));

            assertThat(formatter.urlLines(INDEX, List.of(3, 2), 2, rows))
                    .containsExactly(
                            "\"https://example.com/index.php?id=3\",\"x\",\"y\"",
                            "\"https://example.com/index.php?id=2\",\"\",\"\""
                    );
        }
    }
}
