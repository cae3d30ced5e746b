package com.delta.pagetracker.crawl.auth;

import org.jsoup.nodes.Document;

public interface LoginDetector {
    LoginDetection detect(Document document, String url);
}
