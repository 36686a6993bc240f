package org.smileyface.harvester.crawler;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsed robots.txt for one host, reduced to the group that applies to our user agent.
 * The longest matching Allow/Disallow prefix wins; ties go to Allow.
 */
public final class RobotsRules {

    private static final RobotsRules ALLOW_ALL = new RobotsRules(List.of(), List.of(), List.of());

    private final List<String> allow;
    private final List<String> disallow;
    private final List<String> sitemaps;

    private RobotsRules(List<String> allow, List<String> disallow, List<String> sitemaps) {
        this.allow = List.copyOf(allow);
        this.disallow = List.copyOf(disallow);
        this.sitemaps = List.copyOf(sitemaps);
    }

    public static RobotsRules allowAll() {
        return ALLOW_ALL;
    }

    /**
     * @param userAgent our full user agent string; its product token (before {@code /}) is matched
     */
    public static RobotsRules parse(String content, String userAgent) {
        if (content == null || content.isBlank()) return ALLOW_ALL;
        String token = productToken(userAgent);

        List<String> specificAllow = new ArrayList<>();
        List<String> specificDisallow = new ArrayList<>();
        List<String> wildcardAllow = new ArrayList<>();
        List<String> wildcardDisallow = new ArrayList<>();
        List<String> sitemaps = new ArrayList<>();
        boolean specificSeen = false;

        List<String> groupAgents = new ArrayList<>();
        boolean inRules = false;
        for (String rawLine : content.split("\\r?\\n")) {
            String line = rawLine;
            int hash = line.indexOf('#');
            if (hash >= 0) line = line.substring(0, hash);
            int colon = line.indexOf(':');
            if (colon < 0) continue;
            String field = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            switch (field) {
                case "user-agent" -> {
                    if (inRules) {
                        groupAgents.clear();
                        inRules = false;
                    }
                    groupAgents.add(value.toLowerCase(Locale.ROOT));
                }
                case "allow", "disallow" -> {
                    inRules = true;
                    boolean specific = !token.isEmpty() && groupAgents.stream().anyMatch(a -> !a.equals("*") && token.contains(a));
                    boolean wildcard = groupAgents.contains("*");
                    if (specific) specificSeen = true;
                    if (value.isEmpty()) continue; // "Disallow:" with no path allows everything
                    if (specific) (field.equals("allow") ? specificAllow : specificDisallow).add(value);
                    else if (wildcard) (field.equals("allow") ? wildcardAllow : wildcardDisallow).add(value);
                }
                case "sitemap" -> {
                    if (!value.isEmpty()) sitemaps.add(value);
                }
                default -> { }
            }
        }
        return specificSeen
                ? new RobotsRules(specificAllow, specificDisallow, sitemaps)
                : new RobotsRules(wildcardAllow, wildcardDisallow, sitemaps);
    }

    /**
     * @param pathAndQuery path (plus query) of the URL, starting with {@code /}
     */
    public boolean isAllowed(String pathAndQuery) {
        String path = pathAndQuery == null || pathAndQuery.isEmpty() ? "/" : pathAndQuery;
        int bestAllow = longestMatch(allow, path);
        int bestDisallow = longestMatch(disallow, path);
        return bestDisallow < 0 || bestAllow >= bestDisallow;
    }

    public List<String> getSitemaps() {
        return sitemaps;
    }

    private static int longestMatch(List<String> prefixes, String path) {
        int best = -1;
        for (String p : prefixes) {
            if (matches(p, path) && p.length() > best) best = p.length();
        }
        return best;
    }

    /**
     * Prefix match supporting {@code *} wildcards and a trailing {@code $} anchor.
     */
    private static boolean matches(String pattern, String path) {
        boolean anchored = pattern.endsWith("$");
        String p = anchored ? pattern.substring(0, pattern.length() - 1) : pattern;
        StringBuilder regex = new StringBuilder("^");
        for (String part : p.split("\\*", -1)) {
            if (regex.length() > 1) regex.append(".*");
            regex.append(Pattern.quote(part));
        }
        if (anchored) regex.append('$');
        return Pattern.compile(regex.toString()).matcher(path).find();
    }

    private static String productToken(String userAgent) {
        if (userAgent == null) return "";
        String t = userAgent.trim().toLowerCase(Locale.ROOT);
        int slash = t.indexOf('/');
        return slash > 0 ? t.substring(0, slash) : t;
    }
}
