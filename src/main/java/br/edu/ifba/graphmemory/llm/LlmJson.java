package br.edu.ifba.graphmemory.llm;

import br.edu.ifba.graphmemory.exception.EmptyResponseException;
import br.edu.ifba.graphmemory.exception.MalformedOutputException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of JSON answers from language models.
 *
 * <p>Models often wrap JSON in markdown fences or add prose around it; the first JSON
 * object in the response is used.</p>
 */
public final class LlmJson {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);

    private LlmJson() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws EmptyResponseException   if the response is null or blank
     * @throws MalformedOutputException if no JSON object can be read from it
     */
    @NotNull
    public static JsonNode parseObject(@Nullable String response, @NotNull String operation) {
        if (response == null || response.isBlank()) {
            throw new EmptyResponseException(operation + " returned an empty response");
        }
        String candidate = response.trim();
        Matcher fenced = FENCE.matcher(candidate);
        if (fenced.find()) {
            candidate = fenced.group(1).trim();
        }
        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new MalformedOutputException(operation + " returned no JSON object: " + abbreviate(response));
        }
        try {
            JsonNode node = MAPPER.readTree(candidate.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                throw new MalformedOutputException(operation + " returned JSON that is not an object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedOutputException(operation + " returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Plain-text answers, trimmed.
     *
     * @throws EmptyResponseException if the response is null or blank
     */
    @NotNull
    public static String requireText(@Nullable String response, @NotNull String operation) {
        if (response == null || response.isBlank()) {
            throw new EmptyResponseException(operation + " returned an empty response");
        }
        return response.trim();
    }

    @Nullable
    static String text(@NotNull JsonNode node, @NotNull String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * ISO-8601 instants; a bare date means its start in UTC. Unparseable values are null.
     */
    @Nullable
    static Instant instant(@NotNull JsonNode node, @NotNull String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static String abbreviate(String response) {
        String trimmed = response.trim();
        return trimmed.length() > 120 ? trimmed.substring(0, 120) + "..." : trimmed;
    }
}
