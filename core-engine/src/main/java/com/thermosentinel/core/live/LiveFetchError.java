package com.thermosentinel.core.live;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Objects;

/**
 * Structured failure of a live-reading fetch.
 *
 * <p>
 * {@code message} is the provider's own text when the provider sent one
 * (e.g. {@code "city not found"}) and is shown to the user verbatim.
 * {@code httpStatus} is {@code null} for failures below HTTP, such as a
 * refused connection or a timeout.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LiveFetchError implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String message;
    private final Integer httpStatus;

    private LiveFetchError(String message, Integer httpStatus) {
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.httpStatus = httpStatus;
    }

    public static LiveFetchError of(String message) {
        return new LiveFetchError(message, null);
    }

    public static LiveFetchError of(String message, int httpStatus) {
        return new LiveFetchError(message, httpStatus);
    }

    public String getMessage() {
        return message;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LiveFetchError that))
            return false;
        return message.equals(that.message) && Objects.equals(httpStatus, that.httpStatus);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, httpStatus);
    }

    @Override
    public String toString() {
        return "LiveFetchError{" +
                "message='" + message + '\'' +
                (httpStatus != null ? ", httpStatus=" + httpStatus : "") +
                '}';
    }
}
