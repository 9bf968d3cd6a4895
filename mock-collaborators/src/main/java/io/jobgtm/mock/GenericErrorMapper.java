package io.jobgtm.mock;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Renders every unexpected error as JSON, keeping the status of framework errors such as 404.
 */
@Provider
public class GenericErrorMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GenericErrorMapper.class);

    @Override
    public Response toResponse(Throwable ex) {
        int status = ex instanceof WebApplicationException wae ? wae.getResponse().getStatus() : 500;
        if (status >= 500) {
            LOG.errorf(ex, "Unhandled error in mock endpoint");
        }
        var body = Map.of(
                "success", false,
                "error", Response.Status.fromStatusCode(status) == null
                        ? "Error" : Response.Status.fromStatusCode(status).getReasonPhrase(),
                "detail", String.valueOf(ex.getMessage()));
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }
}
