package org.smileyface.harvester.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A resource referenced by a crawled page. Stored once per asset URL, attributed to the first page it was seen on.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageAsset {

    private String url;
    private AssetType assetType;
    private String pageUrl;
    private String domain;
    private String altText;          // images only
    private Integer width;
    private Integer height;
    private Long discoveredAt;       // epoch millis

    public PageAsset() {
        // for JSON mapping
    }

    public PageAsset(String url, AssetType assetType, String pageUrl, String domain) {
        this.url = url;
        this.assetType = assetType;
        this.pageUrl = pageUrl;
        this.domain = domain;
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public AssetType getAssetType() { return assetType; }
    public void setAssetType(AssetType assetType) { this.assetType = assetType; }

    public String getPageUrl() { return pageUrl; }
    public void setPageUrl(String pageUrl) { this.pageUrl = pageUrl; }

    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }

    public String getAltText() { return altText; }
    public void setAltText(String altText) { this.altText = altText; }

    public Integer getWidth() { return width; }
    public void setWidth(Integer width) { this.width = width; }

    public Integer getHeight() { return height; }
    public void setHeight(Integer height) { this.height = height; }

    public Long getDiscoveredAt() { return discoveredAt; }
    public void setDiscoveredAt(Long discoveredAt) { this.discoveredAt = discoveredAt; }

    @Override
    public String toString() {
        return "PageAsset{" + assetType + " " + url + '}';
    }
}
