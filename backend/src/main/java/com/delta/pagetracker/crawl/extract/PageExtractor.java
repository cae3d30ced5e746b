package com.delta.pagetracker.crawl.extract;

import com.delta.pagetracker.crawl.model.Heading;
import com.delta.pagetracker.crawl.model.PageMetadata;
import com.delta.pagetracker.crawl.model.ScrapedPage;
import com.delta.pagetracker.crawl.template.WebsiteTemplate;
import com.delta.pagetracker.crawl.util.HashUtils;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class PageExtractor {
    static final int MIN_PRIORITY_CONTENT_CHARS = 100;
    static final int WORDS_PER_MINUTE = 200;

    private static final List<String> DEFAULT_EXCLUDED = List.of(
        "script", "style", "nav", "header", "footer", "aside", ".nav", ".navigation", ".menu",
        ".advertisement", ".ads", ".cookie-banner"
    );
    private static final List<String> DEFAULT_CONTENT = List.of(
        "article", "main", ".content", ".post-content", ".entry-content", ".article-content", "#content",
        "#main-content", ".main-content"
    );
    private static final List<String> DEFAULT_TITLE = List.of("h1", "title");

    public ScrapedPage extract(
        String html,
        String url,
        int depth,
        String parentUrl,
        WebsiteTemplate template,
        Instant fetchedAt
    ) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        String content = extractContent(document, template);
        String title = extractTitle(document, template);
        int wordCount = countWords(content);

        boolean authors = template == null || template.metadata().extractAuthors();
        boolean dates = template == null || template.metadata().extractDates();
        boolean images = template == null || template.behaviors().extractImages();

        PageMetadata metadata = new PageMetadata(
            hostOf(url),
            extractLinks(document),
            images ? extractImages(document) : List.of(),
            extractHeadings(document),
            extractDescription(document, template),
            firstNonBlank(
                metaContent(document, "meta[name=keywords]"),
                metaContent(document, "meta[property=article:tag]")
            ),
            authors ? extractAuthor(document) : null,
            dates ? extractPublished(document) : null,
            dates ? extractModified(document) : null,
            extractLanguage(document),
            wordCount,
            readingTimeMinutes(wordCount),
            depth,
            parentUrl,
            null,
            null
        );
        return new ScrapedPage(url, title, content, HashUtils.sha256Hex(content), metadata, fetchedAt);
    }

    String extractContent(Document document, WebsiteTemplate template) {
        Document working = document.clone();
        List<String> excluded = template == null ? DEFAULT_EXCLUDED : template.selectors().excludeElements();
        for (String selector : excluded) {
            safeSelect(working, selector).remove();
        }
        List<String> priority = template == null ? DEFAULT_CONTENT : template.selectors().contentPriority();
        for (String selector : priority) {
            Elements matches = safeSelect(working, selector);
            if (matches.isEmpty()) {
                continue;
            }
            String text = matches.text().trim();
            if (text.length() > MIN_PRIORITY_CONTENT_CHARS) {
                return StringUtils.normalizeSpace(text);
            }
        }
        Element body = working.body();
        return body == null ? "" : StringUtils.normalizeSpace(body.text());
    }

    String extractTitle(Document document, WebsiteTemplate template) {
        List<String> selectors = template == null ? DEFAULT_TITLE : template.selectors().titleSelectors();
        for (String selector : selectors) {
            for (Element element : safeSelect(document, selector)) {
                String text = StringUtils.normalizeSpace(element.text());
                if (StringUtils.isNotBlank(text)) {
                    return text;
                }
            }
        }
        String fallback = firstNonBlank(document.title(), textOf(document.selectFirst("h1")));
        return fallback == null ? "Untitled" : StringUtils.normalizeSpace(fallback);
    }

    private String extractDescription(Document document, WebsiteTemplate template) {
        String fromMeta = firstNonBlank(
            metaContent(document, "meta[name=description]"),
            metaContent(document, "meta[property=og:description]"),
            metaContent(document, "meta[name=twitter:description]"),
            metaContent(document, "meta[property=article:description]")
        );
        if (fromMeta != null || template == null) {
            return fromMeta;
        }
        for (String selector : template.selectors().descriptionSelectors()) {
            Element element = first(document, selector);
            if (element == null) {
                continue;
            }
            String value = "meta".equals(element.normalName()) ? element.attr("content") : element.text();
            if (StringUtils.isNotBlank(value)) {
                return StringUtils.normalizeSpace(value);
            }
        }
        return null;
    }

    private String extractAuthor(Document document) {
        return firstNonBlank(
            metaContent(document, "meta[name=author]"),
            metaContent(document, "meta[property=article:author]"),
            metaContent(document, "meta[name=twitter:creator]"),
            textOf(document.selectFirst("[rel=author]")),
            itemprop(document, "author")
        );
    }

    private String extractPublished(Document document) {
        Element time = document.selectFirst("time[datetime]");
        return firstNonBlank(
            metaContent(document, "meta[property=article:published_time]"),
            metaContent(document, "meta[name=date]"),
            time == null ? null : time.attr("datetime"),
            itemprop(document, "datePublished")
        );
    }

    private String extractModified(Document document) {
        return firstNonBlank(
            metaContent(document, "meta[property=article:modified_time]"),
            metaContent(document, "meta[property=og:updated_time]"),
            metaContent(document, "meta[name=last-modified]"),
            itemprop(document, "dateModified")
        );
    }

    private String extractLanguage(Document document) {
        Element html = document.selectFirst("html");
        return firstNonBlank(
            html == null ? null : html.attr("lang"),
            metaContent(document, "meta[http-equiv=content-language]"),
            metaContent(document, "meta[name=language]")
        );
    }

    List<String> extractLinks(Document document) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href").trim();
            if (href.isEmpty() || href.startsWith("#") || href.toLowerCase(Locale.ROOT).startsWith("javascript:")) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            if (isHttp(absolute)) {
                links.add(absolute);
            }
        }
        return new ArrayList<>(links);
    }

    List<String> extractImages(Document document) {
        Set<String> images = new LinkedHashSet<>();
        for (Element image : document.select("img[src], img[data-src], img[data-lazy-src]")) {
            String attribute = image.hasAttr("src") && !image.attr("src").isBlank()
                ? "src"
                : image.hasAttr("data-src") ? "data-src" : "data-lazy-src";
            String absolute = image.absUrl(attribute);
            if (isHttp(absolute)) {
                images.add(absolute);
            }
        }
        return new ArrayList<>(images);
    }

    List<Heading> extractHeadings(Document document) {
        List<Heading> headings = new ArrayList<>();
        for (Element element : document.select("h1, h2, h3, h4, h5, h6")) {
            String text = StringUtils.normalizeSpace(element.text());
            if (StringUtils.isBlank(text)) {
                continue;
            }
            int level = element.normalName().charAt(1) - '0';
            headings.add(new Heading(level, text));
        }
        return headings;
    }

    static int countWords(String content) {
        if (StringUtils.isBlank(content)) {
            return 0;
        }
        return content.trim().split("\\s+").length;
    }

    static int readingTimeMinutes(int wordCount) {
        if (wordCount <= 0) {
            return 0;
        }
        return (int) Math.ceil(wordCount / (double) WORDS_PER_MINUTE);
    }

    private static Elements safeSelect(Document document, String selector) {
        try {
            return document.select(selector);
        } catch (Selector.SelectorParseException e) {
            return new Elements();
        }
    }

    private static Element first(Document document, String selector) {
        Elements matches = safeSelect(document, selector);
        return matches.isEmpty() ? null : matches.get(0);
    }

    private static String metaContent(Document document, String selector) {
        Element element = document.selectFirst(selector);
        return element == null ? null : StringUtils.trimToNull(element.attr("content"));
    }

    private static String itemprop(Document document, String property) {
        Element element = document.selectFirst("[itemprop=" + property + "]");
        if (element == null) {
            return null;
        }
        return firstNonBlank(element.attr("content"), element.attr("datetime"), element.text());
    }

    private static String textOf(Element element) {
        return element == null ? null : StringUtils.trimToNull(element.text());
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                return value.trim();
            }
        }
        return null;
    }

    private static boolean isHttp(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private static String hostOf(String url) {
        try {
            URI uri = new URI(url);
            return uri.getHost();
        } catch (Exception ignored) {
            return null;
        }
    }
}
