package com.example.webhookrelay.service;

import com.example.webhookrelay.exception.InvalidPayloadException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Turns a raw webhook body into a JSON object, repairing typographic quotes
 * that partner systems paste into otherwise valid JSON.
 */
@Component
@RequiredArgsConstructor
public class PayloadParser {

    private static final char LEFT_DOUBLE_QUOTE = '\u201C';
    private static final char RIGHT_DOUBLE_QUOTE = '\u201D';
    private static final char LEFT_SINGLE_QUOTE = '\u2018';
    private static final char RIGHT_SINGLE_QUOTE = '\u2019';

    private final ObjectMapper objectMapper;

    public JsonNode parse(byte[] body) {
        if (body == null || body.length == 0) {
            throw new InvalidPayloadException("request body is empty");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(repairQuotes(decodeUtf8(body)));
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException(e.getOriginalMessage(), e);
        }

        if (node == null || !node.isObject()) {
            throw new InvalidPayloadException("expected a JSON object");
        }
        return node;
    }

    static String repairQuotes(String text) {
        return text
                .replace(LEFT_DOUBLE_QUOTE, '"')
                .replace(RIGHT_DOUBLE_QUOTE, '"')
                .replace(LEFT_SINGLE_QUOTE, '\'')
                .replace(RIGHT_SINGLE_QUOTE, '\'');
    }

    private static String decodeUtf8(byte[] body) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(body))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidPayloadException("body is not valid UTF-8 (" + e.getMessage() + ")", e);
        }
    }
}
