package com.delta.pagetracker.crawl.template;

import com.delta.pagetracker.crawl.template.WebsiteTemplate.Behaviors;
import com.delta.pagetracker.crawl.template.WebsiteTemplate.CrawlLimits;
import com.delta.pagetracker.crawl.template.WebsiteTemplate.MetadataFlags;
import com.delta.pagetracker.crawl.template.WebsiteTemplate.Selectors;
import com.delta.pagetracker.crawl.template.WebsiteTemplate.UrlPatterns;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
public class TemplateCatalog {
    public static final String DOCUMENTATION_DEEP = "documentation-deep";
    public static final String CORPORATE_COMPREHENSIVE = "corporate-comprehensive";
    public static final String NEWS_BLOG_AGGRESSIVE = "news-blog-aggressive";
    public static final String ECOMMERCE_CATALOG = "ecommerce-catalog";
    public static final String WIKI_KNOWLEDGE = "wiki-knowledge";
    public static final String SOCIAL_PLATFORM = "social-platform";
    public static final String CUSTOM_AGGRESSIVE = "custom-aggressive";

    private static final List<WebsiteTemplate> TEMPLATES = List.of(
        new WebsiteTemplate(
            DOCUMENTATION_DEEP,
            "Documentation Deep Dive",
            "Comprehensive scraping for documentation sites, APIs, guides, and technical content",
            TemplateCategory.DOCUMENTATION,
            new CrawlLimits(5, 100, 30_000, 1_000, true),
            new Selectors(
                List.of("main", "article", ".content", ".documentation", ".docs-content", ".guide-content",
                    ".api-docs", ".markdown-body", "#content", ".post-content"),
                List.of("nav", "header", "footer", ".sidebar", ".navigation", ".breadcrumb",
                    ".table-of-contents", ".search", ".comments", ".social-share"),
                List.of("/docs/", "/documentation/", "/guide/", "/api/", "/reference/", "/tutorial/",
                    "/help/", "/manual/", "/wiki/"),
                List.of("h1", ".page-title", ".doc-title", "title"),
                List.of("meta[name=description]", ".description", ".summary", ".lead")
            ),
            new UrlPatterns(
                List.of("docs", "documentation", "guide", "api", "reference", "tutorial", "help", "manual", "wiki"),
                List.of("login", "register", "admin", "dashboard", "profile", "settings"),
                List.of("*/docs/*", "*/documentation/*", "*/guide/*", "*/api/*", "*/reference/*",
                    "*/tutorial/*", "*/help/*", "*/manual/*", "*/wiki/*")
            ),
            new MetadataFlags(true, true, true, true, true),
            new Behaviors(true, true, true, true, true)
        ),
        new WebsiteTemplate(
            CORPORATE_COMPREHENSIVE,
            "Corporate Site Complete",
            "Full corporate website analysis including products, services, news, and resources",
            TemplateCategory.CORPORATE,
            new CrawlLimits(4, 150, 45_000, 2_000, true),
            new Selectors(
                List.of("main", "article", ".content", ".page-content", ".main-content", ".hero-content",
                    ".product-info", ".service-description", ".news-content", "#content"),
                List.of("nav", "header", "footer", ".cookie-banner", ".chat-widget", ".social-media",
                    ".advertisement", ".popup", ".modal"),
                List.of("/products/", "/services/", "/solutions/", "/about/", "/news/", "/press/",
                    "/resources/", "/support/", "/contact/", "/careers/"),
                List.of("h1", ".page-title", ".hero-title", "title"),
                List.of("meta[name=description]", ".page-description", ".hero-description", ".summary")
            ),
            new UrlPatterns(
                List.of("products", "services", "solutions", "about", "news", "press", "resources", "support", "careers"),
                List.of("login", "register", "admin", "checkout", "cart", "account"),
                List.of("*/products/*", "*/services/*", "*/solutions/*", "*/about/*", "*/news/*",
                    "*/press/*", "*/resources/*", "*/support/*", "*/careers/*")
            ),
            new MetadataFlags(true, true, true, true, false),
            new Behaviors(true, true, true, true, true)
        ),
        new WebsiteTemplate(
            NEWS_BLOG_AGGRESSIVE,
            "News & Blog Aggressive",
            "Comprehensive news site and blog scraping with article extraction",
            TemplateCategory.NEWS,
            new CrawlLimits(3, 200, 20_000, 800, false),
            new Selectors(
                List.of("article", ".article-content", ".post-content", ".entry-content", ".news-content",
                    ".blog-content", "main", ".content"),
                List.of("nav", "header", "footer", ".sidebar", ".comments", ".social-share",
                    ".related-articles", ".advertisement", ".newsletter-signup"),
                List.of("/article/", "/post/", "/news/", "/blog/", "/story/", "/category/", "/tag/", "/archive/"),
                List.of("h1", ".article-title", ".post-title", ".headline"),
                List.of("meta[name=description]", ".article-summary", ".excerpt", ".lead")
            ),
            new UrlPatterns(
                List.of("article", "post", "news", "blog", "story", "category", "tag"),
                List.of("login", "register", "subscribe", "newsletter", "admin"),
                List.of("*/article/*", "*/post/*", "*/news/*", "*/blog/*", "*/story/*", "*/category/*", "*/tag/*")
            ),
            new MetadataFlags(true, true, true, true, true),
            new Behaviors(true, true, true, true, false)
        ),
        new WebsiteTemplate(
            ECOMMERCE_CATALOG,
            "E-commerce Catalog",
            "Product catalog scraping with pricing, descriptions, and specifications",
            TemplateCategory.ECOMMERCE,
            new CrawlLimits(4, 300, 30_000, 1_500, false),
            new Selectors(
                List.of(".product-content", ".product-description", ".product-details", ".item-description",
                    "main", ".content", ".catalog-content"),
                List.of("nav", "header", "footer", ".cart", ".checkout", ".reviews", ".recommendations",
                    ".social-share", ".advertisement"),
                List.of("/product/", "/item/", "/catalog/", "/category/", "/shop/", "/store/", "/collection/"),
                List.of("h1", ".product-title", ".item-title", ".product-name"),
                List.of("meta[name=description]", ".product-description", ".product-summary", ".item-description")
            ),
            new UrlPatterns(
                List.of("product", "item", "catalog", "category", "shop", "store", "collection"),
                List.of("cart", "checkout", "payment", "account", "login", "register"),
                List.of("*/product/*", "*/item/*", "*/catalog/*", "*/category/*", "*/shop/*", "*/store/*",
                    "*/collection/*")
            ),
            new MetadataFlags(false, false, false, true, true),
            new Behaviors(true, true, true, true, false)
        ),
        new WebsiteTemplate(
            WIKI_KNOWLEDGE,
            "Wiki Knowledge Base",
            "Comprehensive wiki and knowledge base scraping with cross-references",
            TemplateCategory.WIKI,
            new CrawlLimits(6, 500, 25_000, 500, true),
            new Selectors(
                List.of(".mw-content-text", ".wiki-content", "#content", "main", "article", ".page-content",
                    ".entry-content"),
                List.of("nav", "header", "footer", ".sidebar", ".navigation", ".toc", ".references",
                    ".infobox", ".navbox"),
                List.of("/wiki/", "/page/", "/article/", "/entry/", "/topic/", "/category/", "/namespace/"),
                List.of("h1", ".firstHeading", ".page-title", "title"),
                List.of("meta[name=description]", ".page-summary", ".description")
            ),
            new UrlPatterns(
                List.of("wiki", "page", "article", "entry", "topic", "category"),
                List.of("talk", "user", "special", "help", "template"),
                List.of("*/wiki/*", "*/page/*", "*/article/*", "*/entry/*", "*/topic/*", "*/category/*")
            ),
            new MetadataFlags(true, true, true, true, true),
            new Behaviors(true, true, true, true, true)
        ),
        new WebsiteTemplate(
            SOCIAL_PLATFORM,
            "Social Platform",
            "Social media and community platform scraping (public content only)",
            TemplateCategory.SOCIAL,
            new CrawlLimits(3, 100, 15_000, 2_000, true),
            new Selectors(
                List.of(".post-content", ".message-content", ".comment-content", ".status-content", "main",
                    ".content", "article"),
                List.of("nav", "header", "footer", ".sidebar", ".advertisement", ".suggested-content",
                    ".social-actions", ".share-buttons"),
                List.of("/post/", "/status/", "/profile/", "/user/", "/topic/", "/discussion/", "/thread/"),
                List.of("h1", ".post-title", ".status-title", "title"),
                List.of("meta[name=description]", ".post-summary", ".description")
            ),
            new UrlPatterns(
                List.of("post", "status", "profile", "user", "topic", "discussion", "thread"),
                List.of("login", "register", "settings", "private", "admin"),
                List.of("*/post/*", "*/status/*", "*/profile/*", "*/user/*", "*/topic/*", "*/discussion/*",
                    "*/thread/*")
            ),
            new MetadataFlags(true, true, true, false, true),
            new Behaviors(true, false, true, false, false)
        ),
        new WebsiteTemplate(
            CUSTOM_AGGRESSIVE,
            "Custom Aggressive",
            "Maximum depth scraping for unknown sites - use with caution",
            TemplateCategory.CUSTOM,
            new CrawlLimits(8, 1_000, 60_000, 3_000, true),
            new Selectors(
                List.of("main", "article", ".content", ".main-content", ".page-content", "#content",
                    ".entry-content", ".post-content", "body"),
                List.of("nav", "header", "footer", "script", "style", ".advertisement", ".popup", ".modal",
                    ".cookie-banner"),
                List.of("*"),
                List.of("h1", ".title", ".page-title", "title"),
                List.of("meta[name=description]", ".description", ".summary")
            ),
            new UrlPatterns(
                List.of("*"),
                List.of("javascript:", "mailto:", "tel:", "#", "data:"),
                List.of("*")
            ),
            new MetadataFlags(true, true, true, true, true),
            new Behaviors(false, true, true, true, true)
        )
    );

    private final Clock clock;

    public TemplateCatalog() {
        this(Clock.systemUTC());
    }

    TemplateCatalog(Clock clock) {
        this.clock = clock;
    }

    public List<WebsiteTemplate> listTemplates() {
        return TEMPLATES;
    }

    public Optional<WebsiteTemplate> getTemplateById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String key = id.trim();
        return TEMPLATES.stream().filter(template -> template.id().equals(key)).findFirst();
    }

    public List<WebsiteTemplate> getTemplatesByCategory(TemplateCategory category) {
        return TEMPLATES.stream().filter(template -> template.category() == category).toList();
    }

    public WebsiteTemplate suggestTemplateForUrl(String url) {
        String host = "";
        String path = "";
        try {
            URI uri = new URI(url == null ? "" : url.trim());
            host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        } catch (Exception ignored) {
            return require(CORPORATE_COMPREHENSIVE);
        }

        if (host.contains("docs") || path.contains("/docs/")
            || host.contains("documentation") || path.contains("/documentation/")) {
            return require(DOCUMENTATION_DEEP);
        }
        if (host.contains("wiki") || path.contains("/wiki/") || host.contains("confluence")) {
            return require(WIKI_KNOWLEDGE);
        }
        if (host.contains("shop") || host.contains("store")
            || path.contains("/product/") || path.contains("/catalog/")
            || host.contains("amazon") || host.contains("ebay")
            || host.contains("etsy") || host.contains("shopify")) {
            return require(ECOMMERCE_CATALOG);
        }
        if (host.contains("news") || host.contains("blog")
            || path.contains("/blog/") || path.contains("/news/")
            || path.contains("/article/") || path.contains("/post/")) {
            return require(NEWS_BLOG_AGGRESSIVE);
        }
        if (host.contains("reddit") || host.contains("forum")
            || host.contains("community") || host.contains("discord")
            || path.contains("/forum/") || path.contains("/community/")) {
            return require(SOCIAL_PLATFORM);
        }
        return require(CORPORATE_COMPREHENSIVE);
    }

    public WebsiteTemplate createCustomTemplate(
        String name,
        int maxDepth,
        int maxPages,
        List<String> includePatterns,
        List<String> excludePatterns
    ) {
        List<String> include = includePatterns == null ? List.of() : List.copyOf(includePatterns);
        List<String> exclude = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        List<String> follow = include.isEmpty() ? List.of("*") : include;
        String label = name == null || name.isBlank() ? "Custom" : name.trim();
        return new WebsiteTemplate(
            "custom-" + clock.millis(),
            label,
            "Custom template: " + label,
            TemplateCategory.CUSTOM,
            new CrawlLimits(Math.max(0, maxDepth), Math.max(1, maxPages), 30_000, 1_500, true),
            new Selectors(
                List.of("main", "article", ".content", "#content", "body"),
                List.of("nav", "header", "footer", "script", "style"),
                follow,
                List.of("h1", ".title", "title"),
                List.of("meta[name=description]", ".description")
            ),
            new UrlPatterns(include, exclude, follow),
            new MetadataFlags(true, true, true, true, true),
            new Behaviors(true, true, true, true, true)
        );
    }

    private static WebsiteTemplate require(String id) {
        return TEMPLATES.stream()
            .filter(template -> template.id().equals(id))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Built-in template missing: " + id));
    }
}
