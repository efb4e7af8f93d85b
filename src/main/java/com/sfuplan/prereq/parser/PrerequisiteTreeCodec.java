package com.sfuplan.prereq.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sfuplan.prereq.domain.PrerequisiteNode;
import com.sfuplan.prereq.exception.MalformedPrerequisiteTreeException;
import org.springframework.stereotype.Component;

@Component
public class PrerequisiteTreeCodec {
    private final ObjectMapper objectMapper;

    public PrerequisiteTreeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(PrerequisiteNode tree) {
        if (tree == null) return null;
        try {
            return objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize prerequisite tree", e);
        }
    }

    public PrerequisiteNode decode(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, PrerequisiteNode.class);
        } catch (JsonProcessingException e) {
            throw new MalformedPrerequisiteTreeException("Cannot decode prerequisite tree: " + json, e);
        }
    }
}
