package com.example.seer.collaborator;

import com.example.seer.exception.CollaboratorException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Posts JSON to a collaborator endpoint and maps the JSON answer. Any
 * transport error, non-2xx status or unreadable body becomes a
 * {@link CollaboratorException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpCollaboratorClient {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final int MAX_ERROR_BODY = 500;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public <T> T post(String collaborator, String url, Object body, Class<T> responseType) {
        if (url == null || url.isBlank()) {
            throw new CollaboratorException(collaborator, "endpoint not configured");
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException(collaborator, "could not serialize request", e);
        }

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                log.error("{} call failed: {} {}", collaborator, response.code(), abbreviate(text));
                throw new CollaboratorException(collaborator, "HTTP " + response.code() + ": " + abbreviate(text));
            }
            if (text.isBlank()) {
                throw new CollaboratorException(collaborator, "empty response body");
            }
            return objectMapper.readValue(text, responseType);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException(collaborator, "unreadable response: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CollaboratorException(collaborator, e.getMessage(), e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() > MAX_ERROR_BODY ? text.substring(0, MAX_ERROR_BODY) + "..." : text;
    }
}
