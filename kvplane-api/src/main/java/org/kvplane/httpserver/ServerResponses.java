package org.kvplane.httpserver;

import org.kvplane.enums.StatusEnum;
import org.kvplane.exception.KvPlaneException;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON error bodies shared by the route servers
 */
final class ServerResponses {

    private ServerResponses() {
    }

    static Mono<ServerResponse> json(Object body) {
        return ServerResponse.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body);
    }

    static Mono<ServerResponse> error(Throwable e) {
        StatusEnum status;
        if (e instanceof KvPlaneException) {
            status = statusOf(((KvPlaneException) e).getCode());
        } else if (e instanceof ServerWebInputException || e instanceof DecodingException) {
            status = StatusEnum.BAD_REQUEST;
        } else {
            status = StatusEnum.INTERNAL_ERROR;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", status.getCode());
        body.put("name", status.getName());
        body.put("message", e.getMessage());
        return ServerResponse.status(httpStatus(status))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body);
    }

    static Mono<ServerResponse> badRequest(String message) {
        return error(StatusEnum.BAD_REQUEST.toException(message));
    }

    private static StatusEnum statusOf(int code) {
        for (StatusEnum status : StatusEnum.values()) {
            if (status.getCode() == code) {
                return status;
            }
        }
        return StatusEnum.INTERNAL_ERROR;
    }

    static HttpStatus httpStatus(StatusEnum status) {
        switch (status) {
            case BAD_REQUEST:
                return HttpStatus.BAD_REQUEST;
            case DUPLICATE_REQUEST:
                return HttpStatus.CONFLICT;
            case NO_ELIGIBLE_WORKER:
            case SCHEDULER_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
