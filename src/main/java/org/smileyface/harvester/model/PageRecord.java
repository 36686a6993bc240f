package org.smileyface.harvester.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * One crawled (or attempted) page. A missing or unknown {@code parentUrl} makes the page a root of its site graph.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageRecord {

    private String url;
    private String domain;
    private int depth;
    private String parentUrl;
    private String title;
    private String contentType;      // search, form, listing, detail, page
    private Boolean requiresJs;
    private Integer linksFound;
    private List<String> keywords;   // configured keywords found on the page
    private Map<String, Double> keywordScores;
    private Integer statusCode;      // HTTP status of the last fetch
    private CrawlStatus crawlStatus = CrawlStatus.PENDING;
    private String errorMessage;
    private Long crawledAt;          // epoch millis

    public PageRecord() {
        // for JSON mapping
    }

    public PageRecord(String url, String domain, int depth, String parentUrl) {
        this.url = url;
        this.domain = domain;
        this.depth = depth;
        this.parentUrl = parentUrl;
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }

    public int getDepth() { return depth; }
    public void setDepth(int depth) { this.depth = depth; }

    public String getParentUrl() { return parentUrl; }
    public void setParentUrl(String parentUrl) { this.parentUrl = parentUrl; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getContentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }

    public Boolean getRequiresJs() { return requiresJs; }
    public void setRequiresJs(Boolean requiresJs) { this.requiresJs = requiresJs; }

    public Integer getLinksFound() { return linksFound; }
    public void setLinksFound(Integer linksFound) { this.linksFound = linksFound; }

    public List<String> getKeywords() { return keywords; }
    public void setKeywords(List<String> keywords) { this.keywords = keywords; }

    public Map<String, Double> getKeywordScores() { return keywordScores; }
    public void setKeywordScores(Map<String, Double> keywordScores) { this.keywordScores = keywordScores; }

    public Integer getStatusCode() { return statusCode; }
    public void setStatusCode(Integer statusCode) { this.statusCode = statusCode; }

    public CrawlStatus getCrawlStatus() { return crawlStatus; }
    public void setCrawlStatus(CrawlStatus crawlStatus) { this.crawlStatus = crawlStatus; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Long getCrawledAt() { return crawledAt; }
    public void setCrawledAt(Long crawledAt) { this.crawledAt = crawledAt; }

    @Override
    public String toString() {
        return "PageRecord{url='" + url + "', depth=" + depth + ", parentUrl='" + parentUrl + "', status=" + crawlStatus + '}';
    }
}
