package com.deepansh.wordplay.research;

import com.deepansh.wordplay.exception.ResearchException;

/**
 * Web research collaborator used by the web_search and scrape_webpage tools.
 */
public interface WebResearchClient {

    /**
     * Searches the web. Provider failures degrade to simulated results with
     * {@link SearchResults#error()} set; this method does not throw for them.
     *
     * @param source a hint such as "web" or "academic"; providers may ignore it
     */
    SearchResults search(String query, String source);

    /**
     * Fetches a page and extracts its readable text.
     *
     * @throws ResearchException for invalid URLs, HTTP errors, or pages with too little text
     */
    ScrapedPage scrape(String url);
}
