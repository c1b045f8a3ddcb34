package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A typed spreadsheet error: the kind (which fixes the displayed code),
 * a human-readable message, and optional structured details such as the
 * offending reference or the cycle path.
 */
public final class CellError {

    private final ErrorKind kind;
    private final String message;
    private final Map<String, String> details;

    public CellError(ErrorKind kind, String message) {
        this(kind, message, Collections.emptyMap());
    }

    public CellError(ErrorKind kind, String message, Map<String, String> details) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static CellError of(ErrorKind kind, String message, String detailKey, String detailValue) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put(detailKey, detailValue);
        return new CellError(kind, message, details);
    }

    @JsonIgnore
    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return kind.getCode();
    }

    public String getMessage() {
        return message;
    }

    public Map<String, String> getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellError)) {
            return false;
        }
        CellError that = (CellError) o;
        return kind == that.kind && Objects.equals(message, that.message) && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, details);
    }

    @Override
    public String toString() {
        return kind.getCode() + " " + message;
    }
}
