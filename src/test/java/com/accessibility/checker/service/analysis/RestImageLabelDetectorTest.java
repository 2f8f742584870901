package com.accessibility.checker.service.analysis;

import com.accessibility.checker.config.AccessibilityProperties;
import com.accessibility.checker.dto.LabelDetection;
import com.accessibility.checker.exception.ImageAnalysisException;
import com.accessibility.checker.model.FailureKind;
import com.accessibility.checker.model.ImageRef;
import com.accessibility.checker.service.connector.ServiceConnector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestImageLabelDetectorTest {

    private static final String URL = "http://image-analysis.test/detect-labels";
    private static final ImageRef IMAGE = ImageRef.of("home-photos", "ramp.jpg");

    private MockRestServiceServer server;
    private RestImageLabelDetector detector;

    @BeforeEach
    void setUp() {
        AccessibilityProperties properties = new AccessibilityProperties();
        AccessibilityProperties.ServiceEndpoint endpoint = new AccessibilityProperties.ServiceEndpoint();
        endpoint.setBaseUrl("http://image-analysis.test/");
        properties.getServices().put(RestImageLabelDetector.SERVICE_ID, endpoint);

        ServiceConnector connector = new ServiceConnector(new RestTemplateBuilder(), properties);
        server = MockRestServiceServer.bindTo(connector.getClient(RestImageLabelDetector.SERVICE_ID)).build();
        detector = new RestImageLabelDetector(connector, properties);
    }

    @Test
    void postsImageReferenceAndParsesLabels() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.container").value("home-photos"))
                .andExpect(jsonPath("$.key").value("ramp.jpg"))
                .andExpect(jsonPath("$.maxLabels").value(50))
                .andExpect(jsonPath("$.minConfidence").value(70.0))
                .andRespond(withSuccess("""
                        {"labels": [{"name": "Ramp", "confidence": 95.2}, {"name": "Sofa", "confidence": 80.0}]}
                        """, MediaType.APPLICATION_JSON));

        LabelDetection detection = detector.detectLabels(IMAGE);

        assertThat(detection.getLabels()).extracting(LabelDetection.DetectedLabel::getName)
                .containsExactly("Ramp", "Sofa");
        server.verify();
    }

    @Test
    void reportsThrottlingAsTransient() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThat(failureKind()).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void reportsServerErrorAsTransient() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThat(failureKind()).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void reportsIoTimeoutAsTransient() {
        server.expect(requestTo(URL)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThat(failureKind()).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void reportsRejectedImageAsPermanent() {
        server.expect(requestTo(URL)).andRespond(withBadRequest());

        assertThat(failureKind()).isEqualTo(FailureKind.PERMANENT);
    }

    @Test
    void reportsErrorBodyAsPermanent() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"error\": \"InvalidImageFormat\"}", MediaType.APPLICATION_JSON));

        ImageAnalysisException exception = catchThrowableOfType(
                () -> detector.detectLabels(IMAGE), ImageAnalysisException.class);

        assertThat(exception.getKind()).isEqualTo(FailureKind.PERMANENT);
        assertThat(exception.getMessage()).contains("InvalidImageFormat");
    }

    @Test
    void reportsUnreadableResponseAsPermanent() {
        server.expect(requestTo(URL)).andRespond(withSuccess("not json", MediaType.APPLICATION_JSON));

        assertThat(failureKind()).isEqualTo(FailureKind.PERMANENT);
    }

    private FailureKind failureKind() {
        ImageAnalysisException exception = catchThrowableOfType(
                () -> detector.detectLabels(IMAGE), ImageAnalysisException.class);
        assertThat(exception).isNotNull();
        return exception.getKind();
    }
}
