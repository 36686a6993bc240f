package org.smileyface.harvester.crawler;

import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;

/**
 * Fetches a small text resource such as robots.txt or a sitemap.
 */
@FunctionalInterface
public interface TextFetcher {

    /**
     * @return the body, or null when the server answered with an error status
     * @throws IOException on transport failure
     */
    String fetch(String url) throws IOException;

    static TextFetcher jsoup(String userAgent, int timeoutMs) {
        return url -> {
            Connection.Response res = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(Math.max(0, timeoutMs))
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .execute();
            return res.statusCode() >= 400 ? null : res.body();
        };
    }
}
