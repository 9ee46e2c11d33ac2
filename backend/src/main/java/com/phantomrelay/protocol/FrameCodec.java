package com.phantomrelay.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON text frames in and out of the relay.
 */
public class FrameCodec {

    private final ObjectMapper objectMapper;

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses one inbound text frame.
     *
     * @throws MalformedFrameException if the text is not a JSON object or a
     *         field has a shape the envelope cannot hold
     */
    public InboundFrame decode(String text) {
        try {
            JsonNode tree = objectMapper.readTree(text);
            if (tree == null || !tree.isObject()) {
                throw new MalformedFrameException();
            }
            return objectMapper.treeToValue(tree, InboundFrame.class);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException(e);
        }
    }

    public String encode(OutboundFrame frame) throws JsonProcessingException {
        return objectMapper.writeValueAsString(frame);
    }
}
