package org.operaton.nostrpub.util;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex based {@link TextTransform}. Covers the HTML subset Mastodon-like servers emit:
 * paragraphs, line breaks, links, mention and hashtag anchors.
 */
@Component
public class SimpleTextTransform implements TextTransform {

    private static final Pattern ANCHOR = Pattern.compile(
        "<a\\s[^>]*?href=\"([^\"]*)\"[^>]*>(.*?)</a>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(x?)([0-9a-fA-F]+);");
    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"]+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?)]+$");

    @Override
    public String htmlToMarkdown(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String text = html
            .replaceAll("(?i)<br\\s*/?>", "\n")
            .replaceAll("(?i)</p>\\s*<p[^>]*>", "\n\n")
            .replaceAll("(?i)<p[^>]*>", "")
            .replaceAll("(?i)</p>", "\n");

        Matcher matcher = ANCHOR.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String href = decodeEntities(matcher.group(1));
            String label = decodeEntities(stripTags(matcher.group(2))).trim();
            String replacement = label.isEmpty() || label.equals(href) ? href : "[" + label + "](" + href + ")";
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);

        return decodeEntities(stripTags(sb.toString())).trim();
    }

    @Override
    public String markdownToHtml(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        StringBuilder html = new StringBuilder();
        for (String paragraph : markdown.trim().split("\\n\\s*\\n")) {
            html.append("<p>")
                .append(linkify(paragraph).replace("\n", "<br>"))
                .append("</p>");
        }
        return html.toString();
    }

    /**
     * Turns bare URLs into anchors. Matches on raw text; every piece is escaped afterwards.
     */
    private static String linkify(String text) {
        Matcher matcher = URL.matcher(text);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            String url = matcher.group();
            String trailing = "";
            Matcher punctuation = TRAILING_PUNCTUATION.matcher(url);
            if (punctuation.find()) {
                trailing = punctuation.group();
                url = url.substring(0, punctuation.start());
            }
            String href = escape(url);
            sb.append(escape(text.substring(last, matcher.start())))
                .append("<a href=\"").append(href)
                .append("\" target=\"_blank\" rel=\"nofollow noopener noreferrer\">")
                .append(href).append("</a>")
                .append(escape(trailing));
            last = matcher.end();
        }
        sb.append(escape(text.substring(last)));
        return sb.toString();
    }

    private static String stripTags(String html) {
        return html.replaceAll("<[^>]+>", "");
    }

    private static String escape(String text) {
        return text
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;");
    }

    private static String decodeEntities(String text) {
        Matcher matcher = NUMERIC_ENTITY.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            int codePoint;
            try {
                codePoint = Integer.parseInt(matcher.group(2), matcher.group(1).isEmpty() ? 10 : 16);
            } catch (NumberFormatException e) {
                codePoint = '?';
            }
            String decoded = Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : "?";
            matcher.appendReplacement(sb, Matcher.quoteReplacement(decoded));
        }
        matcher.appendTail(sb);
        return sb.toString()
            .replace("&lt;", "<")
            .replace("&gt;", ">")
            .replace("&quot;", "\"")
            .replace("&apos;", "'")
            .replace("&nbsp;", " ")
            .replace("&amp;", "&");
    }
}
