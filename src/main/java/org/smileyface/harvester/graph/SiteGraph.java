package org.smileyface.harvester.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Forest of crawled pages for one domain. Every input page appears exactly once.
 */
public class SiteGraph {

    private String domain;
    private String rootUrl;
    private int totalPages;
    private int maxDepth;
    /** Page count per crawl depth; keys are depths as strings so the graph stores as a plain document. */
    private Map<String, Integer> pagesByDepth = new LinkedHashMap<>();
    private List<SiteNode> roots = new ArrayList<>();
    private Long generatedAt;

    public SiteGraph() {
        // for JSON mapping
    }

    /**
     * URLs of every node in depth-first pre-order.
     */
    public List<String> flattenUrls() {
        List<String> out = new ArrayList<>(totalPages);
        walk(n -> out.add(n.getUrl()));
        return out;
    }

    public List<SiteNode> pagesAtDepth(int depth) {
        List<SiteNode> out = new ArrayList<>();
        walk(n -> {
            if (n.getDepth() == depth) out.add(n);
        });
        return out;
    }

    private void walk(Consumer<SiteNode> visitor) {
        for (SiteNode root : roots) {
            Deque<SiteNode> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                SiteNode n = stack.pop();
                visitor.accept(n);
                List<SiteNode> children = n.getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
    }

    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }

    public String getRootUrl() { return rootUrl; }
    public void setRootUrl(String rootUrl) { this.rootUrl = rootUrl; }

    public int getTotalPages() { return totalPages; }
    public void setTotalPages(int totalPages) { this.totalPages = totalPages; }

    public int getMaxDepth() { return maxDepth; }
    public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

    public Map<String, Integer> getPagesByDepth() { return pagesByDepth; }
    public void setPagesByDepth(Map<String, Integer> pagesByDepth) { this.pagesByDepth = pagesByDepth != null ? pagesByDepth : new LinkedHashMap<>(); }

    public List<SiteNode> getRoots() { return roots; }
    public void setRoots(List<SiteNode> roots) { this.roots = roots != null ? roots : new ArrayList<>(); }

    public Long getGeneratedAt() { return generatedAt; }
    public void setGeneratedAt(Long generatedAt) { this.generatedAt = generatedAt; }
}
