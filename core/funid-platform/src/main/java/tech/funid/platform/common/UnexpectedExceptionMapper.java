package tech.funid.platform.common;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Last-resort mapper. Anything not handled by a more specific mapper becomes
 * {@code 500 server_error} without exposing the stack trace. JAX-RS exceptions
 * keep the response they already carry (404, 405, 415 and so on).
 */
@Provider
public class UnexpectedExceptionMapper implements ExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(UnexpectedExceptionMapper.class);

    @Override
    public Response toResponse(RuntimeException exception) {
        if (exception instanceof WebApplicationException web) {
            return web.getResponse();
        }
        LOG.errorf(exception, "Unhandled exception: %s", exception.getMessage());
        return ServerErrors.response();
    }
}
