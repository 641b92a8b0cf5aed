package com.skillmap.resource;

import com.skillmap.config.SkillMapProperties;
import com.skillmap.resource.ResourceModels.LearningResource;
import com.skillmap.resource.ResourceModels.ResourceKind;
import com.skillmap.resource.ResourceModels.ResourceLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class ResourceLookupService {
    private static final Logger log = LoggerFactory.getLogger(ResourceLookupService.class);

    private final CuratedResourceCatalog catalog;
    private final ResourceResolver resolver;
    private final ExecutorService executor;
    private final SkillMapProperties.External external;

    public ResourceLookupService(CuratedResourceCatalog catalog,
                                 ResourceResolver resolver,
                                 @Qualifier("resourceLookupExecutor") ExecutorService executor,
                                 SkillMapProperties properties) {
        this.catalog = catalog;
        this.resolver = resolver;
        this.executor = executor;
        this.external = properties.getResources().getExternal();
    }

    public Map<String, List<LearningResource>> resolveAll(Collection<String> skills) {
        Map<String, List<LearningResource>> resolved = new LinkedHashMap<>();
        Map<String, CompletableFuture<List<LearningResource>>> pending = new LinkedHashMap<>();

        for (String skill : skills) {
            if (resolved.containsKey(skill) || pending.containsKey(skill)) continue;
            List<LearningResource> curated = catalog.find(skill);
            if (!curated.isEmpty()) {
                resolved.put(skill, curated);
            } else if (!external.isEnabled()) {
                resolved.put(skill, List.of());
            } else {
                pending.put(skill, lookupAsync(skill));
            }
        }

        pending.forEach((skill, future) -> resolved.put(skill, future.join()));

        Map<String, List<LearningResource>> ordered = new LinkedHashMap<>();
        for (String skill : skills) {
            ordered.put(skill, resolved.getOrDefault(skill, List.of()));
        }
        return ordered;
    }

    public List<LearningResource> resolve(String skill) {
        return resolveAll(List.of(skill)).getOrDefault(skill, List.of());
    }

    // the timeout starts when a worker picks the lookup up, so queueing behind other lookups does not count
    private CompletableFuture<List<LearningResource>> lookupAsync(String skill) {
        log.debug("No curated resources for '{}', asking external resolver", skill);
        CompletableFuture<List<LearningResource>> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                if (result.isDone()) return;
                result.orTimeout(external.getTimeoutMs(), TimeUnit.MILLISECONDS);
                try {
                    result.complete(fetchExternal(skill));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule resource lookup for '{}': {}", skill, e.getMessage());
            return CompletableFuture.completedFuture(List.of());
        }
        // interrupts the resolver so a timed-out call does not keep running
        result.whenComplete((links, ex) -> {
            if (ex != null) task.cancel(true);
        });
        return result.exceptionally(ex -> {
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof TimeoutException) {
                log.warn("Resource lookup for '{}' timed out after {} ms", skill, external.getTimeoutMs());
            } else {
                log.warn("Resource lookup for '{}' failed: {}", skill, cause.toString());
            }
            return List.of();
        });
    }

    private List<LearningResource> fetchExternal(String skill) {
        List<ResourceLink> links = resolver.lookup(skill, external.getMaxResults());
        if (links == null) return List.of();
        return links.stream()
                .filter(Objects::nonNull)
                .map(l -> new LearningResource(l.title(), l.url(), ResourceKind.EXTERNAL))
                .toList();
    }
}
