package com.deepansh.wordplay.research;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal HTML-to-text extraction: drops script/style/nav blocks and tags, decodes the
 * common entities and collapses whitespace.
 */
final class HtmlText {

    private static final Pattern TITLE = Pattern.compile("(?is)<title[^>]*>(.*?)</title>");
    private static final Pattern NON_CONTENT = Pattern.compile(
            "(?is)<(script|style|noscript|nav|header|footer|aside|svg|form)[^>]*>.*?</\\1>");
    private static final Pattern COMMENT = Pattern.compile("(?s)<!--.*?-->");
    private static final Pattern BLOCK_END = Pattern.compile("(?i)</(p|h[1-6]|li|div|article|section|br)\\s*>|<br\\s*/?>");
    private static final Pattern TAG = Pattern.compile("(?s)<[^>]+>");
    private static final Pattern SPACES = Pattern.compile("[ \\t\\x0B\\f\\r]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n+");

    private HtmlText() {
    }

    static String title(String html) {
        Matcher m = TITLE.matcher(html);
        return m.find() ? decode(m.group(1)).strip() : null;
    }

    static String text(String html) {
        String text = COMMENT.matcher(html).replaceAll(" ");
        text = NON_CONTENT.matcher(text).replaceAll(" ");
        text = BLOCK_END.matcher(text).replaceAll("\n\n");
        text = TAG.matcher(text).replaceAll(" ");
        text = decode(text);
        text = SPACES.matcher(text).replaceAll(" ");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.strip();
    }

    private static String decode(String s) {
        return s.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
