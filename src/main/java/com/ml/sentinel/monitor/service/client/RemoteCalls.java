package com.ml.sentinel.monitor.service.client;

import com.ml.sentinel.monitor.common.constants.SentinelConsts;
import com.ml.sentinel.monitor.common.exception.TransientIOException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.util.function.Supplier;

/**
 * Translates RestTemplate outcomes into {@link TransientIOException} with a
 * stable error code, so every collaborator fails the same way.
 */
public final class RemoteCalls {

    private RemoteCalls() {
    }

    public static String url(String baseUrl, String path) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl).path(path).toUriString();
    }

    /**
     * Runs the call and returns the body of a 2xx answer.
     */
    public static <T> T exchange(String what, Supplier<ResponseEntity<T>> call) {
        ResponseEntity<T> response = send(what, call);
        T body = response.getBody();
        if (body == null) {
            throw new TransientIOException(SentinelConsts.ERR_BAD_RESPONSE,
                    what + " returned an empty body", response.getStatusCode().value(), null);
        }
        return body;
    }

    /**
     * Runs the call and requires a 2xx status; the body may be empty.
     */
    public static <T> ResponseEntity<T> send(String what, Supplier<ResponseEntity<T>> call) {
        ResponseEntity<T> response;
        try {
            response = call.get();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            String code = e.getStatusCode().is4xxClientError()
                    ? SentinelConsts.ERR_HTTP_CLIENT
                    : SentinelConsts.ERR_HTTP_SERVER;
            throw new TransientIOException(code, what + " failed with HTTP " + status, status, e);
        } catch (ResourceAccessException e) {
            boolean timeout = hasCause(e, SocketTimeoutException.class);
            throw new TransientIOException(
                    timeout ? SentinelConsts.ERR_TIMEOUT : SentinelConsts.ERR_UNREACHABLE,
                    what + (timeout ? " timed out" : " unreachable: " + e.getMessage()), e);
        } catch (RestClientException e) {
            throw new TransientIOException(SentinelConsts.ERR_BAD_RESPONSE,
                    what + " returned an unreadable answer: " + e.getMessage(), e);
        }
        if (response == null || !response.getStatusCode().is2xxSuccessful()) {
            int status = response == null ? 0 : response.getStatusCode().value();
            throw new TransientIOException(SentinelConsts.ERR_BAD_RESPONSE,
                    what + " answered with status " + status, status, null);
        }
        return response;
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (type.isInstance(c)) return true;
            if (c.getCause() == c) break;
        }
        return false;
    }
}
