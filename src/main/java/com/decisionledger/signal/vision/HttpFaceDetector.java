package com.decisionledger.signal.vision;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link FaceDetector} backed by a remote detection service. Posts the raw
 * image bytes and reads a {@link FaceDetection} back.
 */
public class HttpFaceDetector implements FaceDetector {

    private final WebClient webClient;
    private final String path;

    public HttpFaceDetector(WebClient webClient, String path) {
        this.webClient = Objects.requireNonNull(webClient, "webClient is required");
        this.path = path == null || path.isBlank() ? "/detect/faces" : path;
    }

    @Override
    public FaceDetection detect(byte[] image, Duration timeout) {
        FaceDetection detection = webClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_OCTET_STREAM)
            .bodyValue(image)
            .retrieve()
            .bodyToMono(FaceDetection.class)
            .timeout(timeout)
            .block();
        if (detection == null) {
            throw new IllegalStateException("face detector returned an empty body");
        }
        return detection;
    }
}
