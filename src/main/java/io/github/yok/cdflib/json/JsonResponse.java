package io.github.yok.cdflib.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON object sent back to a client, built member by member.
 *
 * <pre>
 * JsonResponse response = new JsonResponse();
 * response.setValue("ok", true);
 * response.setValue("items", items);
 * response.getHeaders().forEach(httpResponse::setHeader);
 * response.writeTo(httpResponse.getOutputStream());
 * </pre>
 *
 * <p>
 * Subclasses may override {@link #toJson()} to tailor the output.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class JsonResponse {

    // Response is never cached by the client
    private static final Map<String, String> HEADERS =
            ImmutableMap.of("Content-Type", JsonRequest.CONTENT_TYPE, "Expires", "-1");

    private final ObjectMapper mapper = new ObjectMapper();
    // Members in insertion order
    private final Map<String, Object> values = new LinkedHashMap<>();

    public void setValue(String key, Object value) {
        values.put(key, value);
    }

    /**
     * Returns a member already set.
     *
     * @param key member name
     * @return member value; {@code null} if not set
     */
    public Object getValue(String key) {
        return values.get(key);
    }

    /**
     * Returns the HTTP headers to send with the body.
     *
     * @return {@code Content-Type} and {@code Expires} headers
     */
    public Map<String, String> getHeaders() {
        return HEADERS;
    }

    /**
     * Encodes the members as a JSON object.
     *
     * @return JSON text
     * @throws IllegalStateException if a member value cannot be serialized
     */
    public String toJson() {
        try {
            return mapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Response cannot be encoded as JSON", e);
        }
    }

    /**
     * Writes {@link #toJson()} as UTF-8. The stream is not closed.
     *
     * @param out destination, typically the HTTP response body
     * @throws IOException if writing fails
     * @throws IllegalStateException if a member value cannot be serialized
     */
    public final void writeTo(OutputStream out) throws IOException {
        out.write(toJson().getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
