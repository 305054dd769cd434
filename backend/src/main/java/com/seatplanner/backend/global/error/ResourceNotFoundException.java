package com.seatplanner.backend.global.error;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends ProblemException {

    private final String resource;
    private final Object key;

    public ResourceNotFoundException(String resource, Object key) {
        super(HttpStatus.NOT_FOUND,
                resource.toUpperCase().replace(' ', '_') + "_NOT_FOUND",
                "%s %s not found".formatted(resource, key));
        this.resource = resource;
        this.key = key;
    }

    public String getResource() {
        return resource;
    }

    public Object getKey() {
        return key;
    }
}
