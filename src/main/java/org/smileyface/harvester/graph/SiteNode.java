package org.smileyface.harvester.graph;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SiteNode {

    private String url;
    private String title;
    private int depth;
    private String contentType;
    private List<SiteNode> children = new ArrayList<>();

    public SiteNode() {
        // for JSON mapping
    }

    public SiteNode(String url, String title, int depth, String contentType) {
        this.url = url;
        this.title = title;
        this.depth = depth;
        this.contentType = contentType;
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public int getDepth() { return depth; }
    public void setDepth(int depth) { this.depth = depth; }

    public String getContentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }

    public List<SiteNode> getChildren() { return children; }
    public void setChildren(List<SiteNode> children) { this.children = children != null ? children : new ArrayList<>(); }
}
