package com.eyelevel.lotprocessor.common.json.jackson;

import com.eyelevel.lotprocessor.common.json.JsonSerializer;
import com.eyelevel.lotprocessor.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Produces the canonical JSON form that HMAC signatures are computed over.
 *
 * <p>The output is byte-for-byte what clients produce with
 * {@code json.dumps(value, sort_keys=True, separators=(",", ":"))}:
 * <ul>
 *     <li>object keys sorted, for both maps and bean/record properties;</li>
 *     <li>no whitespace between tokens;</li>
 *     <li>every character outside printable ASCII written as a six-character escape with lowercase hex digits,
 *     except the short escapes {@code \b \t \n \f \r}.</li>
 * </ul>
 */
@Slf4j
@Component("canonicalJsonSerializer")
public class CanonicalJsonSerializer implements JsonSerializer {

    private final JsonMapper canonicalMapper;
    private final ObjectWriter canonicalWriter;

    public CanonicalJsonSerializer() {
        this.canonicalMapper = JsonMapper.builder()
                                         .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                                         .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                                         .configure(SerializationFeature.INDENT_OUTPUT, false)
                                         .build();
        this.canonicalWriter = canonicalMapper.writer().with(new AsciiOnlyEscapes());
    }

    /**
     * Trees are written as plain maps and lists, since object nodes keep their insertion order.
     */
    @Override
    public <T> String serialize(T object) {
        try {
            if (object instanceof JsonNode node) {
                return canonicalWriter.writeValueAsString(canonicalMapper.convertValue(node, Object.class));
            }
            return canonicalWriter.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            log.error("Error serializing object to canonical JSON", e);
            throw new JsonParsingException("Error serializing object to canonical JSON", e);
        }
    }

    private static final class AsciiOnlyEscapes extends CharacterEscapes {

        private static final long serialVersionUID = 1L;

        private final int[] asciiEscapes;

        AsciiOnlyEscapes() {
            int[] escapes = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int ch = 0; ch < 0x20; ch++) {
                if (ch != '\b' && ch != '\t' && ch != '\n' && ch != '\f' && ch != '\r') {
                    escapes[ch] = CharacterEscapes.ESCAPE_CUSTOM;
                }
            }
            escapes[0x7F] = CharacterEscapes.ESCAPE_CUSTOM;
            this.asciiEscapes = escapes;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            if (ch < 0x20 || ch >= 0x7F) {
                return new SerializedString(String.format("\\u%04x", ch));
            }
            return null;
        }
    }
}
