package com.tripflow.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripflow.common.properties.ProviderProperties;
import com.tripflow.pojo.model.payload.ImagePayload;
import com.tripflow.pojo.model.payload.ImageRef;
import com.tripflow.pojo.model.source.GatherRequest;
import com.tripflow.pojo.model.source.ProviderType;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Google Custom Search 图片搜索，每个主题取第一张。需要 options.cx。
 */
@Component
public class ImageProviderAdapter extends AbstractHttpProviderAdapter {

    private static final int MAX_SUBJECTS = 4;

    public ImageProviderAdapter(@Qualifier("providerHttpClient") HttpClient httpClient,
                                ObjectMapper objectMapper,
                                ProviderProperties providerProperties) {
        super(httpClient, objectMapper, providerProperties);
    }

    @Override
    public ProviderType type() {
        return ProviderType.IMAGES;
    }

    @Override
    protected ProviderProperties.Settings settings() {
        return providerProperties.getImages();
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://www.googleapis.com/customsearch/v1";
    }

    @Override
    protected String sourceName() {
        return "google-cse";
    }

    @Override
    public boolean isConfigured() {
        return super.isConfigured() && StringUtils.hasText(option("cx", null));
    }

    @Override
    protected CompletableFuture<ImagePayload> doFetch(GatherRequest request, Duration timeout) {
        List<String> subjects = subjects(request);
        List<CompletableFuture<ImageRef>> calls = new ArrayList<>();
        for (String subject : subjects) {
            calls.add(fetchOne(subject, timeout));
        }
        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).thenApply(v -> {
            ImagePayload payload = new ImagePayload();
            for (CompletableFuture<ImageRef> call : calls) {
                ImageRef ref = call.join();
                if (ref != null) {
                    payload.getImages().add(ref);
                }
            }
            return payload;
        });
    }

    static List<String> subjects(GatherRequest request) {
        Set<String> subjects = new LinkedHashSet<>();
        subjects.add(request.getDestination());
        if (request.getPlaces() != null) {
            subjects.addAll(request.getPlaces());
        }
        if (request.getInterests() != null) {
            for (String interest : request.getInterests()) {
                subjects.add(request.getDestination() + " " + interest);
            }
        }
        List<String> list = new ArrayList<>(subjects);
        return list.subList(0, Math.min(MAX_SUBJECTS, list.size()));
    }

    private CompletableFuture<ImageRef> fetchOne(String subject, Duration timeout) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", subject);
        params.put("searchType", "image");
        params.put("num", "1");
        params.put("safe", "active");
        params.put("key", settings().getApiKey());
        params.put("cx", option("cx", null));
        URI uri = URI.create(baseUrl() + "?" + query(params));
        return getJson(uri, timeout, null).thenApply(root -> {
            String link = root.path("items").path(0).path("link").asText(null);
            return link == null ? null : new ImageRef(subject, link, false);
        });
    }
}
