package com.quashbugs.prpulse.exception;

import lombok.Getter;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;

/**
 * Failure talking to a git or chat provider. Never retried in-process; the schedule's next due tick
 * is the retry.
 */
@Getter
public class ProviderApiException extends RuntimeException {

    public enum Kind {
        AUTH_EXPIRED,
        RATE_LIMITED,
        TIMEOUT,
        SERVER_ERROR,
        CLIENT_ERROR,
        NETWORK
    }

    private final String provider;
    private final Kind kind;
    private final Integer status;

    public ProviderApiException(String provider, Kind kind, Integer status, String message) {
        super(message);
        this.provider = provider;
        this.kind = kind;
        this.status = status;
    }

    public ProviderApiException(String provider, Kind kind, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
        this.status = status;
    }

    public static ProviderApiException from(String provider, RestClientException e) {
        if (e instanceof HttpStatusCodeException statusException) {
            int status = statusException.getStatusCode().value();
            if (status == 401) {
                return new ProviderApiException(provider, Kind.AUTH_EXPIRED, status,
                        provider + " token expired or invalid", e);
            }
            if (status == 429) {
                return new ProviderApiException(provider, Kind.RATE_LIMITED, status,
                        provider + " API rate limit exceeded", e);
            }
            Kind kind = statusException.getStatusCode().is5xxServerError() ? Kind.SERVER_ERROR : Kind.CLIENT_ERROR;
            return new ProviderApiException(provider, kind, status,
                    provider + " API error: " + status + " " + statusException.getResponseBodyAsString(), e);
        }
        if (e instanceof ResourceAccessException && e.getCause() instanceof SocketTimeoutException) {
            return new ProviderApiException(provider, Kind.TIMEOUT, null, provider + " API call timed out", e);
        }
        return new ProviderApiException(provider, Kind.NETWORK, null, provider + " API unreachable: " + e.getMessage(), e);
    }
}
