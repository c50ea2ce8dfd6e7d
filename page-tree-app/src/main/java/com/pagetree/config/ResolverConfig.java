package com.pagetree.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Queries and output settings of the resolver.
 * Defined in application.yml under 'pagetree'.
 */
@Configuration
@ConfigurationProperties(prefix = "pagetree")
public class ResolverConfig {

    private Queries queries = new Queries();
    private Datasource datasource = new Datasource();
    private String urlPattern = "https://%s/index.php?id=%d";
    private String listSeparator = ", ";

    public Queries getQueries() { return queries; }
    public void setQueries(Queries queries) { this.queries = queries; }

    public Datasource getDatasource() { return datasource; }
    public void setDatasource(Datasource datasource) { this.datasource = datasource; }

    public String getUrlPattern() { return urlPattern; }
    public void setUrlPattern(String urlPattern) { this.urlPattern = urlPattern; }

    public String getListSeparator() { return listSeparator; }
    public void setListSeparator(String listSeparator) { this.listSeparator = listSeparator; }

    /**
     * Startup queries. Columns are read by position, not by name.
     */
    public static class Queries {
        // uid, pid, is_siteroot
        private String pages = "SELECT uid, pid, is_siteroot FROM pages";
        // root page id, domain name, forced; ordered by priority
        private String domains = "SELECT pid, domainName, forced FROM sys_domain ORDER BY sorting ASC";

        public String getPages() { return pages; }
        public void setPages(String pages) { this.pages = pages; }

        public String getDomains() { return domains; }
        public void setDomains(String domains) { this.domains = domains; }
    }

    /**
     * Credentials for connection strings that do not carry them, and pool sizing.
     */
    public static class Datasource {
        private String username;
        private String password;
        private int poolSize = 1;
        private long connectionTimeoutMs = 10_000;

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

        public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
        public void setConnectionTimeoutMs(long connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }
    }
}
