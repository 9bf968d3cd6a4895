package io.jobgtm.mock;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders an injected failure the way the scraper service reports errors, so the pipeline sees a
 * {@code success=false} body next to the HTTP status. 503 answers carry {@code Retry-After}.
 */
@Provider
public class MockFailureMapper implements ExceptionMapper<MockFailure> {

    private static final Logger LOG = Logger.getLogger(MockFailureMapper.class);

    @Override
    public Response toResponse(MockFailure e) {
        boolean retryable = e.getStatus() >= 500;
        LOG.debugf("Injected %d on %s after %dms", (Object) e.getStatus(), e.getEndpoint(), e.getDelayMs());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", e.getTitle());
        body.put("endpoint", e.getEndpoint());
        body.put("retryable", retryable);
        body.put("at", OffsetDateTime.now(ZoneOffset.UTC).toString());

        Response.ResponseBuilder rb = Response.status(e.getStatus())
                .header(MockBehaviour.DELAY_HEADER, e.getDelayMs())
                .type(MediaType.APPLICATION_JSON)
                .entity(body);
        if (e.getStatus() == 503) {
            rb.header(HttpHeaders.RETRY_AFTER, 1);
        }
        return rb.build();
    }
}
