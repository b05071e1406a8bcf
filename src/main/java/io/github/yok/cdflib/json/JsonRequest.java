package io.github.yok.cdflib.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Parsed body of a JSON request.
 *
 * <p>
 * The body is decoded into plain Java values: objects become {@link Map}s, arrays {@link List}s,
 * and numbers, strings and booleans their boxed types. Values are looked up by key when the
 * top-level value is an object, or by index when it is an array.
 * </p>
 *
 * <pre>
 * JsonRequest request = new JsonRequest();
 * request.load("POST", "application/json", body);
 * if (request.hasKeys("username", "password")) {
 *     String user = (String) request.getValueByKey("username");
 * }
 * </pre>
 *
 * <p>
 * Subclasses may override {@link #parseCallback()} to validate or extract fields once parsing has
 * succeeded.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JsonRequest {

    /**
     * Only content type accepted by {@link #load(String, String, InputStream)}.
     */
    public static final String CONTENT_TYPE = "application/json";

    /**
     * Deepest accepted nesting of arrays and objects.
     */
    public static final int MAX_NESTING_DEPTH = 15;

    private final ObjectMapper mapper = new ObjectMapper(JsonFactory.builder()
            .streamReadConstraints(
                    StreamReadConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build())
            .build()).enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private Object data;
    private boolean parsed;

    /**
     * Parses the body of an HTTP request.
     *
     * @param method request method; must be {@code POST}
     * @param contentType value of the {@code Content-Type} header; must be
     *        {@value #CONTENT_TYPE}, parameters such as {@code charset} are ignored
     * @param body request body, read to the end but not closed
     * @throws JsonException if the request is not a JSON POST or the body is not valid JSON
     * @throws IOException if the body cannot be read
     */
    public final void load(String method, String contentType, InputStream body)
            throws JsonException, IOException {
        parsed = false;
        if (!"POST".equalsIgnoreCase(StringUtils.trim(method))) {
            throw new JsonException("Incorrect protocol", JsonErrorCode.INVALID_REQUEST);
        }
        String mediaType = StringUtils.trim(StringUtils.substringBefore(contentType, ";"));
        if (!CONTENT_TYPE.equalsIgnoreCase(mediaType)) {
            throw new JsonException("Expecting JSON", JsonErrorCode.INVALID_REQUEST);
        }
        parse(decode(IOUtils.toByteArray(body)));
    }

    /**
     * Parses a JSON document held in a string.
     *
     * @param input JSON text
     * @return {@code false} if {@code input} is {@code null}, {@code true} once parsed
     * @throws JsonException if the text is not valid JSON
     */
    public final boolean loadFromString(String input) throws JsonException {
        parsed = false;
        if (input == null) {
            return false;
        }
        parse(input);
        return true;
    }

    /**
     * Called after every successful parse. Does nothing by default.
     *
     * @throws JsonException to reject the request; the request then counts as not parsed
     */
    protected void parseCallback() throws JsonException {
        // extension point
    }

    protected boolean isParsed() {
        return parsed;
    }

    /**
     * Returns a member of the top-level object.
     *
     * @param key member name
     * @return member value; {@code null} if absent, JSON {@code null}, or the top level is not an
     *         object
     * @throws IllegalStateException if nothing has been parsed
     */
    public Object getValueByKey(String key) {
        requireParsed();
        return data instanceof Map ? ((Map<?, ?>) data).get(key) : null;
    }

    /**
     * Returns an element of the top-level array, or the member of the top-level object whose name
     * is the decimal index.
     *
     * @param index position
     * @return element; {@code null} if out of range or the top level is a scalar
     * @throws IllegalStateException if nothing has been parsed
     */
    public Object getValueByIndex(int index) {
        requireParsed();
        if (data instanceof List) {
            List<?> list = (List<?>) data;
            return index >= 0 && index < list.size() ? list.get(index) : null;
        }
        if (data instanceof Map) {
            return ((Map<?, ?>) data).get(Integer.toString(index));
        }
        return null;
    }

    public boolean hasKeys(String... keys) {
        return hasKeys(Arrays.asList(keys));
    }

    /**
     * Returns {@code true} if the top-level object has every given member.
     *
     * @param keys member names
     * @return {@code true} if all are present, even when their value is JSON {@code null}
     * @throws IllegalStateException if nothing has been parsed
     */
    public boolean hasKeys(Collection<String> keys) {
        requireParsed();
        if (!(data instanceof Map)) {
            return keys.isEmpty();
        }
        return ((Map<?, ?>) data).keySet().containsAll(keys);
    }

    /**
     * Returns the number of top-level members or elements.
     *
     * @return size of the top-level object or array; {@code 0} for {@code null}, {@code 1} for a
     *         scalar
     * @throws IllegalStateException if nothing has been parsed
     */
    public int getSize() {
        requireParsed();
        if (data instanceof Map) {
            return ((Map<?, ?>) data).size();
        }
        if (data instanceof List) {
            return ((List<?>) data).size();
        }
        return data == null ? 0 : 1;
    }

    private void requireParsed() {
        if (!parsed) {
            throw new IllegalStateException("JSON request has not been parsed");
        }
    }

    private static String decode(byte[] body) throws JsonException {
        try {
            return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(body)).toString();
        } catch (CharacterCodingException e) {
            throw new JsonException("Malformed UTF-8 characters, possibly incorrectly encoded",
                    JsonErrorCode.PARSE_ERROR, e);
        }
    }

    private void parse(String input) throws JsonException {
        try {
            data = mapper.readValue(input, Object.class);
        } catch (JsonProcessingException e) {
            throw new JsonException(describe(e), JsonErrorCode.PARSE_ERROR, e);
        }
        parsed = true;
        log.debug("JSON request parsed. size={}", getSize());
        try {
            parseCallback();
        } catch (JsonException e) {
            parsed = false;
            throw e;
        }
    }

    private static String describe(JsonProcessingException e) {
        if (ExceptionUtils.indexOfType(e, StreamConstraintsException.class) >= 0) {
            return "The maximum stack depth has been exceeded";
        }
        if (e instanceof JsonParseException) {
            return StringUtils.contains(e.getOriginalMessage(), "CTRL-CHAR")
                    ? "Control character error, possibly incorrectly encoded"
                    : "Syntax error";
        }
        // empty input and trailing tokens
        if (e instanceof MismatchedInputException) {
            return "Syntax error";
        }
        return "Unidentified JSON error";
    }
}
