package com.skillmap.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillmap.resource.CuratedResourceCatalog;
import com.skillmap.resource.ResourceResolver;
import com.skillmap.resource.YouTubeResourceResolver;
import com.skillmap.table.SkillTable;
import com.skillmap.table.SkillTableLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SkillMapConfig {

    @Bean
    public SkillTable skillTable(SkillTableLoader loader) {
        return loader.load();
    }

    @Bean
    public CuratedResourceCatalog curatedResourceCatalog(ResourceLoader resourceLoader,
                                                         ObjectMapper objectMapper,
                                                         SkillMapProperties properties) {
        return CuratedResourceCatalog.load(resourceLoader, objectMapper, properties.getCatalog().getLocation());
    }

    @Bean(name = "resourceLookupExecutor", destroyMethod = "shutdown")
    public ExecutorService resourceLookupExecutor(SkillMapProperties properties) {
        return Executors.newFixedThreadPool(properties.getResources().getExternal().getConcurrency());
    }

    @Bean
    public ResourceResolver resourceResolver(SkillMapProperties properties) {
        SkillMapProperties.External external = properties.getResources().getExternal();
        Duration timeout = Duration.ofMillis(external.getTimeoutMs());
        HttpClient httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);

        RestClient restClient = RestClient.builder()
                .baseUrl(external.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader("Accept", "application/json")
                .build();
        return new YouTubeResourceResolver(restClient, external);
    }
}
