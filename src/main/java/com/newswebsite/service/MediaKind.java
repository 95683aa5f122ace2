package com.newswebsite.service;

/**
 * What is being uploaded, which decides the object store's resource type and folder.
 */
public enum MediaKind {
    IMAGE("image", "news_images", "Error uploading image file"),
    PDF("raw", "blog_pdfs", "Error uploading PDF file");

    private final String resourceType;
    private final String folder;
    private final String failureMessage;

    MediaKind(String resourceType, String folder, String failureMessage) {
        this.resourceType = resourceType;
        this.folder = folder;
        this.failureMessage = failureMessage;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getFolder() {
        return folder;
    }

    public String getFailureMessage() {
        return failureMessage;
    }
}
