package org.smileyface.harvester.graph;

import org.smileyface.harvester.model.PageRecord;
import org.smileyface.harvester.util.CrawlerUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds a {@link SiteGraph} from flat page records linked by {@code parentUrl}.
 *
 * <p>Traversal starts from the depth-0 pages, else from the page at the given root URL, else from the first
 * page. Pages never reached (missing parent, or a parent cycle) become additional roots, so the number of
 * nodes always equals the number of distinct input URLs.</p>
 */
public class SiteGraphBuilder {

    public SiteGraph build(String domain, String rootUrl, List<PageRecord> pages) {
        Map<String, PageRecord> byUrl = new LinkedHashMap<>();
        for (PageRecord p : pages) {
            if (p != null && p.getUrl() != null) byUrl.putIfAbsent(p.getUrl(), p);
        }

        Map<String, List<String>> children = new LinkedHashMap<>();
        for (PageRecord p : byUrl.values()) {
            String parent = p.getParentUrl();
            if (parent != null && !parent.equals(p.getUrl()) && byUrl.containsKey(parent)) {
                children.computeIfAbsent(parent, k -> new ArrayList<>()).add(p.getUrl());
            }
        }

        Set<String> visited = new HashSet<>();
        List<SiteNode> roots = new ArrayList<>();
        for (String start : initialRoots(byUrl, rootUrl)) {
            if (!visited.contains(start)) roots.add(traverse(start, byUrl, children, visited));
        }
        for (String url : byUrl.keySet()) {
            if (!visited.contains(url)) roots.add(traverse(url, byUrl, children, visited));
        }

        SiteGraph graph = new SiteGraph();
        graph.setDomain(domain);
        graph.setRootUrl(rootUrl != null ? rootUrl : roots.isEmpty() ? null : roots.get(0).getUrl());
        graph.setRoots(roots);
        graph.setTotalPages(visited.size());
        Map<Integer, Integer> perDepth = new TreeMap<>();
        int maxDepth = 0;
        for (PageRecord p : byUrl.values()) {
            perDepth.merge(p.getDepth(), 1, Integer::sum);
            maxDepth = Math.max(maxDepth, p.getDepth());
        }
        Map<String, Integer> pagesByDepth = new LinkedHashMap<>();
        perDepth.forEach((d, n) -> pagesByDepth.put(String.valueOf(d), n));
        graph.setPagesByDepth(pagesByDepth);
        graph.setMaxDepth(maxDepth);
        return graph;
    }

    private static List<String> initialRoots(Map<String, PageRecord> byUrl, String rootUrl) {
        List<String> out = new ArrayList<>();
        for (PageRecord p : byUrl.values()) {
            if (p.getDepth() == 0) out.add(p.getUrl());
        }
        if (!out.isEmpty()) return out;
        if (rootUrl != null) {
            String normalized = Objects.requireNonNullElse(CrawlerUtils.normalizeUrl(rootUrl), rootUrl);
            if (byUrl.containsKey(normalized)) return List.of(normalized);
            if (byUrl.containsKey(rootUrl)) return List.of(rootUrl);
        }
        if (!byUrl.isEmpty()) out.add(byUrl.keySet().iterator().next());
        return out;
    }

    /**
     * Iterative depth-first traversal so deep sites cannot overflow the call stack.
     */
    private static SiteNode traverse(String start, Map<String, PageRecord> byUrl, Map<String, List<String>> children,
                                     Set<String> visited) {
        SiteNode root = node(byUrl.get(start));
        visited.add(start);
        Deque<SiteNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SiteNode current = stack.pop();
            for (String child : children.getOrDefault(current.getUrl(), List.of())) {
                if (!visited.add(child)) continue;
                SiteNode childNode = node(byUrl.get(child));
                current.getChildren().add(childNode);
                stack.push(childNode);
            }
        }
        return root;
    }

    private static SiteNode node(PageRecord p) {
        return new SiteNode(p.getUrl(), p.getTitle(), p.getDepth(), p.getContentType());
    }
}
