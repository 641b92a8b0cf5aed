package com.skillmap.resource;

import com.skillmap.resource.ResourceModels.ResourceLink;

import java.util.List;

/**
 * Source of learning links for skills the curated catalog does not cover.
 * Implementations may block on I/O; they return an empty list when they are
 * not configured or the lookup fails.
 */
public interface ResourceResolver {

    /**
     * @throws IllegalArgumentException if {@code maxResults} is negative
     */
    List<ResourceLink> lookup(String skillName, int maxResults);
}
