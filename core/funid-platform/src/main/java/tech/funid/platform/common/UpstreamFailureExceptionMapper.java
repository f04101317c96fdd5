package tech.funid.platform.common;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Upstream failures are reported as {@code 500 server_error}, never as a 4xx.
 */
@Provider
public class UpstreamFailureExceptionMapper implements ExceptionMapper<UpstreamFailureException> {

    private static final Logger LOG = Logger.getLogger(UpstreamFailureExceptionMapper.class);

    @Override
    public Response toResponse(UpstreamFailureException exception) {
        LOG.errorf(exception, "Upstream failure: %s", exception.getMessage());
        return ServerErrors.response();
    }
}
