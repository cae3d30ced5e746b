package com.delta.pagetracker.crawl.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PageMetadata(
    String domain,
    List<String> links,
    List<String> images,
    List<Heading> headings,
    String description,
    String keywords,
    String author,
    String publishedDate,
    String modifiedDate,
    String language,
    int wordCount,
    int readingTimeMinutes,
    int depth,
    String parentUrl,
    String contentType,
    String authMethod
) {
    public PageMetadata {
        links = links == null ? List.of() : List.copyOf(links);
        images = images == null ? List.of() : List.copyOf(images);
        headings = headings == null ? List.of() : List.copyOf(headings);
    }

    public PageMetadata withAccess(String authMethod, String contentType) {
        return new PageMetadata(
            domain,
            links,
            images,
            headings,
            description,
            keywords,
            author,
            publishedDate,
            modifiedDate,
            language,
            wordCount,
            readingTimeMinutes,
            depth,
            parentUrl,
            contentType,
            authMethod
        );
    }
}
