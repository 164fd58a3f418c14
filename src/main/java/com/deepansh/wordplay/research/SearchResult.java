package com.deepansh.wordplay.research;

public record SearchResult(String title, String snippet, String url) {}
