package com.eyelevel.lotprocessor.common.json;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Defines the contract for parsing JSON data.
 *
 * <p>Typed parsing is used for provider responses with a known shape; tree parsing is used for
 * result envelopes whose shape varies and has to be classified.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a byte array into a Java object of the specified type.
     *
     * @param jsonBytes The JSON data as a byte array.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     *
     * @throws com.eyelevel.lotprocessor.exception.json.JsonParsingException if the JSON is invalid.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);

    /**
     * Parses a JSON document into a navigable tree.
     *
     * @param json The JSON data as a string.
     *
     * @return The root node, never {@code null}.
     *
     * @throws com.eyelevel.lotprocessor.exception.json.JsonParsingException if the JSON is invalid.
     */
    JsonNode parseTree(String json);

    /**
     * Binds an already parsed tree to a Java object of the specified type.
     *
     * @throws com.eyelevel.lotprocessor.exception.json.JsonParsingException if the tree does not fit the type.
     */
    <T> T treeToValue(JsonNode node, Class<T> valueType);
}
