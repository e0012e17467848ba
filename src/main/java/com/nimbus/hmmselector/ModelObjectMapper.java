package com.nimbus.hmmselector;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.nimbus.hmmselector.model.SequenceModel;

/**
 * Jackson mapper shared by trained model files and selector config files. Models are written
 * indented so saved vocabularies stay readable, and every {@link SequenceModel} carries its
 * implementation class so a file can be reloaded without knowing which fitter produced it.
 * A file with anything after its root value is rejected rather than silently truncated.
 */
public class ModelObjectMapper {

    public static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .addMixIn(SequenceModel.class, SequenceModelTypeInfo.class)
            .build();

    @JsonTypeInfo(use = JsonTypeInfo.Id.CLASS, include = JsonTypeInfo.As.PROPERTY, property = "@class")
    private abstract static class SequenceModelTypeInfo {}

    private ModelObjectMapper() {}
}
