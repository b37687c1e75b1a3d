package io.tasktree.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.logging.Logger;

/// Default {@link JsonLoader}: strict Jackson parsing first, then a
/// {@link JsonRepair repair} pass parsed leniently.
public class JacksonJsonLoader implements JsonLoader {

    private static final Logger logger = Logger.getLogger(JacksonJsonLoader.class.getName());

    private static final ObjectMapper STRICT = JsonMapper.builder().build();

    private static final ObjectMapper LENIENT =
            JsonMapper.builder()
                    .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                    .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
                    .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                    .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                    .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                    .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
                    .build();

    @Override
    public Object load(String text) throws JsonProcessingException {
        try {
            return STRICT.readValue(text, Object.class);
        } catch (JsonProcessingException strictFailure) {
            String repaired = JsonRepair.repair(text);
            logger.fine("Strict JSON parse failed, retrying with repaired text: " + repaired);
            return LENIENT.readValue(repaired, Object.class);
        }
    }
}
