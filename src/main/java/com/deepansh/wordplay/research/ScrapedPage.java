package com.deepansh.wordplay.research;

public record ScrapedPage(String title, String content, int wordCount, String domain) {}
