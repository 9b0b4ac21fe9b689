package com.tasknexus.channel.feishu.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * TextContentCodec
 * =============================================================================
 * Encodes and decodes the content payload of Feishu {@code text} messages.
 *
 * <p>Feishu carries message content as a JSON document serialized into a
 * string field. For the {@code text} type the document is
 * {@code {"text": "..."}}. Other message types are not decoded here.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class TextContentCodec
{
    public static final String TEXT_MESSAGE_TYPE = "text";

    private static final String TEXT_FIELD = "text";

    private final ObjectMapper mapper;

    public TextContentCodec() {
        this(new ObjectMapper());
    }

    public TextContentCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Extract the text from a {@code text} content document.
     *
     * @return the text, or an empty string if the document has no {@code text} field
     * @throws FeishuDecodeException if the content is absent, not valid JSON,
     *         or not a JSON object
     */
    public String decode(String content) {
        if (content == null) {
            throw new FeishuDecodeException("text message has no content");
        }

        final JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new FeishuDecodeException("malformed text content: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new FeishuDecodeException("text content is not a JSON object");
        }
        return root.path(TEXT_FIELD).asText("");
    }

    /**
     * Build the {@code text} content document for an outbound message.
     */
    public String encode(String text) {
        ObjectNode node = mapper.createObjectNode();
        node.put(TEXT_FIELD, text);
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // An ObjectNode holding a single string cannot fail to serialize.
            throw new IllegalStateException("failed to encode text content", e);
        }
    }
}
