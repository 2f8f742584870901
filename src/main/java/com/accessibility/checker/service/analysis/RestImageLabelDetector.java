package com.accessibility.checker.service.analysis;

import com.accessibility.checker.config.AccessibilityProperties;
import com.accessibility.checker.dto.LabelDetection;
import com.accessibility.checker.exception.ImageAnalysisException;
import com.accessibility.checker.model.FailureKind;
import com.accessibility.checker.model.ImageRef;
import com.accessibility.checker.service.connector.ServiceConnector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.Map;

/**
 * Label detector talking to the image-analysis service over HTTP.
 *
 * <p>Throttling (429), server errors and I/O timeouts are reported as transient;
 * rejected input, error bodies and unreadable responses as permanent.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RestImageLabelDetector implements ImageLabelDetector {

    public static final String SERVICE_ID = "image-analysis";

    private final ServiceConnector serviceConnector;
    private final AccessibilityProperties properties;

    @Override
    public LabelDetection detectLabels(ImageRef image) {
        RestTemplate client = serviceConnector.getClient(SERVICE_ID);
        String base = serviceConnector.getBaseUrl(SERVICE_ID);
        String url = (base.endsWith("/") ? base : base + "/") + "detect-labels";

        Map<String, Object> requestBody = Map.of(
                "container", image.getContainer(),
                "key", image.getKey(),
                "maxLabels", properties.getAnalysis().getMaxLabels(),
                "minConfidence", properties.getAnalysis().getMinConfidence()
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));

        log.debug("Requesting labels for {}", image);
        try {
            ResponseEntity<LabelDetection> response = client.postForEntity(
                    url, new HttpEntity<>(requestBody, headers), LabelDetection.class);

            LabelDetection detection = response.getBody();
            if (detection == null) {
                throw ImageAnalysisException.permanentFailure("Empty response from image-analysis service");
            }
            if (detection.getError() != null && !detection.getError().isBlank()) {
                throw ImageAnalysisException.permanentFailure("Image-analysis service error: " + detection.getError());
            }
            if (detection.getLabels() == null) {
                throw ImageAnalysisException.permanentFailure("Malformed response: labels missing");
            }
            return detection;

        } catch (HttpClientErrorException.TooManyRequests e) {
            throw ImageAnalysisException.transientFailure("Image-analysis service throttled the request", e);
        } catch (HttpClientErrorException e) {
            throw new ImageAnalysisException(
                    "Image rejected (" + e.getStatusCode().value() + "): " + e.getStatusText(),
                    FailureKind.PERMANENT, e);
        } catch (HttpServerErrorException e) {
            throw ImageAnalysisException.transientFailure(
                    "Image-analysis service unavailable (" + e.getStatusCode().value() + ")", e);
        } catch (ResourceAccessException e) {
            throw ImageAnalysisException.transientFailure("Image-analysis call timed out or failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ImageAnalysisException("Unreadable image-analysis response: " + e.getMessage(),
                    FailureKind.PERMANENT, e);
        }
    }
}
