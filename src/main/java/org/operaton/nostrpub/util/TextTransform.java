package org.operaton.nostrpub.util;

/**
 * Converts note bodies between the fediverse's HTML and Nostr's markdown-flavoured plain text.
 */
public interface TextTransform {

    /**
     * Converts HTML content to plain text. Links whose text differs from their target become {@code [text](url)}.
     */
    String htmlToMarkdown(String html);

    /**
     * Converts plain text to HTML paragraphs with linked URLs.
     */
    String markdownToHtml(String markdown);
}
