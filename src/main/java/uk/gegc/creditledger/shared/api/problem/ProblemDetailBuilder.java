package uk.gegc.creditledger.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

import java.net.URI;
import java.time.Instant;

/**
 * Builds the RFC 7807 bodies returned by the ledger API and the security entry points.
 * Every body carries a short {@code code} taken from its type URI, so clients can branch
 * on {@code insufficient-funds} without parsing the URI.
 */
public final class ProblemDetailBuilder {

    static final String CODE_PROPERTY = "code";
    static final String TIMESTAMP_PROPERTY = "timestamp";

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * @param request may be null outside a servlet request; the {@code instance} field is then left empty
     */
    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail,
                                       HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (request != null) {
            problem.setInstance(URI.create(request.getRequestURI()));
        }
        problem.setProperty(CODE_PROPERTY, codeOf(type));
        problem.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problem;
    }

    static String codeOf(URI type) {
        String path = type.getPath();
        if (path == null || path.isEmpty()) {
            return type.toString();
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
