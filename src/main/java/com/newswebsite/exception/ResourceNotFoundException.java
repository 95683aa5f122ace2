package com.newswebsite.exception;

public class ResourceNotFoundException extends NewsWebsiteException {

    private final String resource;

    public ResourceNotFoundException(String resource) {
        super(resource + " not found");
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
