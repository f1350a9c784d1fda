package org.neuralchilli.sentinel.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.neuralchilli.sentinel.backend.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

@Provider
public class BackendUnavailableMapper implements ExceptionMapper<BackendUnavailableException> {

    private static final Logger log = LoggerFactory.getLogger(BackendUnavailableMapper.class);

    @Override
    public Response toResponse(BackendUnavailableException e) {
        log.warn("Status query failed: {}", e.getMessage());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", e.getMessage()))
                .build();
    }
}
