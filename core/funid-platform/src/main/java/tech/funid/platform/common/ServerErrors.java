package tech.funid.platform.common;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.Map;

final class ServerErrors {

    private ServerErrors() {
    }

    static Response response() {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
            .type(MediaType.APPLICATION_JSON)
            .entity(Map.of(
                "error", "server_error",
                "error_description", "The server encountered an unexpected error"))
            .build();
    }
}
