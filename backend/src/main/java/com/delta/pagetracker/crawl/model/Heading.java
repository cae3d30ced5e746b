package com.delta.pagetracker.crawl.model;

public record Heading(int level, String text) {
    public String label() {
        return "H" + level + ": " + text;
    }
}
