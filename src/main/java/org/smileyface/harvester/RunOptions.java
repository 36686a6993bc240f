package org.smileyface.harvester;

import org.smileyface.harvester.service.CrawlMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command line of a harvester run. Options take their value either as {@code --name value} or
 * {@code --name=value}; {@code --resume} and {@code --reset} are flags.
 */
public class RunOptions {

    public static final String JOB_CRAWL = "crawl";
    public static final String JOB_PIPELINE = "pipeline";

    private static final Set<String> FLAGS = Set.of("resume", "reset");
    private static final Set<String> VALUED = Set.of(
            "job", "mode", "threads", "limit", "stage", "url", "max-depth", "instance-id");

    private String job = JOB_CRAWL;
    private CrawlMode mode = CrawlMode.SINGLE;
    private Integer threads;
    private Integer limit;
    private Integer stage;
    private boolean resume;
    private boolean reset;
    private final List<String> urls = new ArrayList<>();
    private Integer maxDepth;
    private String instanceId;

    /**
     * @throws IllegalArgumentException on an unknown option, a missing value, or a malformed number
     */
    public static RunOptions parse(String... args) {
        RunOptions o = new RunOptions();
        if (args == null) return o;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            String name = arg.substring(2);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            if (FLAGS.contains(name)) {
                if (value != null) throw new IllegalArgumentException("--" + name + " takes no value");
                if ("resume".equals(name)) o.resume = true;
                else o.reset = true;
                continue;
            }
            if (!VALUED.contains(name)) {
                // Spring's own options (--spring.profiles.active=..., --crawler.maxDepth=...) pass through
                if (name.contains(".")) continue;
                throw new IllegalArgumentException("Unknown option --" + name);
            }
            if (value == null) {
                if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
                    throw new IllegalArgumentException("Option --" + name + " needs a value");
                }
                value = args[++i];
            }
            o.set(name, value);
        }
        return o;
    }

    private void set(String name, String value) {
        switch (name) {
            case "job" -> {
                String j = value.trim().toLowerCase(Locale.ROOT);
                if (!JOB_CRAWL.equals(j) && !JOB_PIPELINE.equals(j)) {
                    throw new IllegalArgumentException("--job must be crawl or pipeline, got " + value);
                }
                job = j;
            }
            case "mode" -> {
                try {
                    mode = CrawlMode.parse(value);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("--mode must be single, threaded or distributed, got " + value);
                }
            }
            case "threads" -> threads = positive(name, value);
            case "limit" -> limit = positive(name, value);
            case "stage" -> stage = number(name, value);
            case "url" -> urls.add(value);
            case "max-depth" -> maxDepth = number(name, value);
            case "instance-id" -> instanceId = value;
            default -> throw new IllegalArgumentException("Unknown option --" + name);
        }
    }

    private static int number(String name, String value) {
        try {
            int n = Integer.parseInt(value.trim());
            if (n < 0) throw new IllegalArgumentException("--" + name + " must not be negative");
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects a number, got " + value);
        }
    }

    private static int positive(String name, String value) {
        int n = number(name, value);
        if (n == 0) throw new IllegalArgumentException("--" + name + " must be positive");
        return n;
    }

    public String getJob() { return job; }
    public CrawlMode getMode() { return mode; }
    public Integer getThreads() { return threads; }
    public Integer getLimit() { return limit; }
    public Integer getStage() { return stage; }
    public boolean isResume() { return resume; }
    public boolean isReset() { return reset; }
    public List<String> getUrls() { return urls; }
    public Integer getMaxDepth() { return maxDepth; }
    public String getInstanceId() { return instanceId; }

    /**
     * Worker count for the chosen mode: one in single mode, otherwise {@code --threads} or {@code fallback}.
     */
    public int workers(int fallback) {
        if (mode == CrawlMode.SINGLE) return 1;
        return threads != null ? threads : fallback;
    }

    @Override
    public String toString() {
        return "RunOptions{job=" + job + ", mode=" + mode + ", threads=" + threads + ", limit=" + limit
                + ", stage=" + stage + ", resume=" + resume + ", reset=" + reset + ", urls=" + urls
                + ", maxDepth=" + maxDepth + ", instanceId=" + instanceId + '}';
    }
}
