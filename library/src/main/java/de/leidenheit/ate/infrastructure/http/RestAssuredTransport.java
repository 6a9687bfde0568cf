package de.leidenheit.ate.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import de.leidenheit.ate.core.exception.AteUnsupportedException;
import de.leidenheit.ate.core.exception.ParamsException;
import de.leidenheit.ate.core.execution.HttpTransport;
import de.leidenheit.ate.core.execution.ResponseObject;
import de.leidenheit.ate.core.model.ResolvedRequest;
import io.restassured.RestAssured;
import io.restassured.config.HttpClientConfig;
import io.restassured.config.RestAssuredConfig;
import io.restassured.http.ContentType;
import io.restassured.http.Header;
import io.restassured.http.Method;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link HttpTransport} backed by REST Assured.
 * <p>
 * Supported request options: {@code headers}, {@code params}, {@code cookies}, {@code json},
 * {@code data}, {@code body}, {@code auth}, {@code allow_redirects} and {@code timeout} (seconds).
 */
@Slf4j
public class RestAssuredTransport implements HttpTransport {

    private final TransportOptions options;

    public RestAssuredTransport() {
        this(TransportOptions.ofDefault());
    }

    public RestAssuredTransport(final TransportOptions options) {
        this.options = options;
    }

    @Override
    public ResponseObject dispatch(final ResolvedRequest request) {
        var requestSpecification = RestAssured.given();
        if (options.isRelaxedHttpsValidation()) requestSpecification.relaxedHTTPSValidation();
        if (options.isLogRequests()) requestSpecification.log().all();

        if (Objects.nonNull(request.getOptions())) {
            request.getOptions().fields()
                    .forEachRemaining(option -> applyOption(requestSpecification, option.getKey(), option.getValue()));
        }

        var response = requestSpecification.request(toMethod(request.getMethod()), request.getUrl());
        if (options.isLogResponses()) response.then().log().all();
        log.debug("{} {} -> {} ({} ms)", request.getMethod(), request.getUrl(), response.statusCode(), response.getTime());

        return toResponseObject(response);
    }

    private void applyOption(final RequestSpecification requestSpecification, final String key, final JsonNode value) {
        switch (key) {
            case "headers" -> requireObject(key, value).fields()
                    .forEachRemaining(header -> requestSpecification.header(header.getKey(), stringify(header.getValue())));
            case "params" -> requireObject(key, value).fields()
                    .forEachRemaining(param -> requestSpecification.queryParam(param.getKey(), toValues(param.getValue())));
            case "cookies" -> requireObject(key, value).fields()
                    .forEachRemaining(cookie -> requestSpecification.cookie(cookie.getKey(), stringify(cookie.getValue())));
            case "json" -> requestSpecification
                    .contentType(ContentType.JSON)
                    .body(value.toString());
            case "data" -> {
                if (value.isObject()) {
                    requestSpecification.contentType(ContentType.URLENC);
                    value.fields().forEachRemaining(param -> requestSpecification.formParam(param.getKey(), toValues(param.getValue())));
                } else {
                    requestSpecification.body(stringify(value));
                }
            }
            case "body" -> requestSpecification.body(stringify(value));
            case "auth" -> {
                if (!value.isArray() || value.size() != 2) {
                    throw new ParamsException("Request option 'auth' must be [user, password]");
                }
                requestSpecification.auth().preemptive().basic(value.get(0).asText(), value.get(1).asText());
            }
            case "allow_redirects" -> requestSpecification.redirects().follow(value.asBoolean());
            case "timeout" -> {
                var millis = (int) (value.asDouble() * 1000);
                requestSpecification.config(RestAssuredConfig.config().httpClient(HttpClientConfig.httpClientConfig()
                        .setParam("http.connection.timeout", millis)
                        .setParam("http.socket.timeout", millis)));
            }
            default -> throw new AteUnsupportedException("Unsupported request option '%s'".formatted(key));
        }
    }

    private Method toMethod(final String method) {
        try {
            return Method.valueOf(method.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ParamsException("Unsupported HTTP method '%s'".formatted(method));
        }
    }

    private HttpResponseObject toResponseObject(final Response response) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Header header : response.getHeaders().asList()) {
            // repeated headers are joined the way HTTP allows
            headers.merge(header.getName(), header.getValue(), (first, second) -> first + ", " + second);
        }

        return HttpResponseObject.builder()
                .statusCode(response.statusCode())
                .headers(headers)
                .cookies(new LinkedHashMap<>(response.getCookies()))
                .body(response.getBody().asString())
                .elapsedMillis(response.getTime())
                .build();
    }

    private JsonNode requireObject(final String key, final JsonNode value) {
        if (!value.isObject()) throw new ParamsException("Request option '%s' must be a mapping".formatted(key));
        return value;
    }

    private List<String> toValues(final JsonNode value) {
        List<String> values = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(item -> values.add(stringify(item)));
        } else {
            values.add(stringify(value));
        }
        return values;
    }

    private String stringify(final JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
