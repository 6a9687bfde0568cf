package de.leidenheit.ate.core.execution;

import de.leidenheit.ate.core.model.ResolvedRequest;
import de.leidenheit.ate.infrastructure.http.HttpResponseObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Records dispatched requests and answers them with canned responses.
 */
public class RecordingTransport implements HttpTransport {

    private final List<ResolvedRequest> requests = new ArrayList<>();
    private final Function<ResolvedRequest, HttpResponseObject> responder;

    public RecordingTransport(final Function<ResolvedRequest, HttpResponseObject> responder) {
        this.responder = responder;
    }

    public static RecordingTransport respondingWith(final int statusCode, final String body) {
        return new RecordingTransport(request -> response(statusCode, body, Map.of()));
    }

    public static HttpResponseObject response(final int statusCode, final String body, final Map<String, String> headers) {
        Map<String, String> caseInsensitiveHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        caseInsensitiveHeaders.putAll(headers);
        return HttpResponseObject.builder()
                .statusCode(statusCode)
                .headers(caseInsensitiveHeaders)
                .cookies(Map.of())
                .body(body)
                .elapsedMillis(5)
                .build();
    }

    @Override
    public ResponseObject dispatch(final ResolvedRequest request) {
        requests.add(request);
        return responder.apply(request);
    }

    public List<ResolvedRequest> getRequests() {
        return requests;
    }

    public ResolvedRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
