package com.nimbus.hmmselector.selector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nimbus.hmmselector.ModelObjectMapper;
import com.nimbus.hmmselector.model.SequenceModel;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered item to model mapping produced by one selector over a dataset, ready for
 * recognition. Items for which no model could be selected are not present.
 */
public class TrainedModels {

    @JsonProperty("selector")
    private final SelectorType selector;
    @JsonProperty("models")
    private final Map<String, SequenceModel> models;

    @JsonCreator
    public TrainedModels(
            @JsonProperty("selector") SelectorType selector,
            @JsonProperty("models") Map<String, SequenceModel> models) {
        if (selector == null)
            throw new IllegalArgumentException("Selector type cannot be null");

        this.selector = selector;
        this.models = Collections.unmodifiableMap(models != null ? new LinkedHashMap<>(models) : new LinkedHashMap<>());
    }

    public static TrainedModels loadModels(Path path) throws IOException {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return ModelObjectMapper.MAPPER.readValue(inputStream, TrainedModels.class);
        } catch (IOException e) {
            throw new IOException("Failed to load models from " + path, e);
        }
    }

    /**
     * Save every model to the provided file path as JSON for reloading later
     * @param path File path to save to, e.g. /data/words.json
     */
    public void saveModels(Path path) throws IOException {
        try (OutputStream outputStream = Files.newOutputStream(path)) {
            ModelObjectMapper.MAPPER.writeValue(outputStream, this);
        } catch (IOException e) {
            throw new IOException("Failed to save models to " + path, e);
        }
    }

    public SelectorType getSelector() {
        return selector;
    }

    /**
     * @return Unmodifiable models in training order
     */
    public Map<String, SequenceModel> getModels() {
        return models;
    }

    public SequenceModel get(String item) {
        return models.get(item);
    }

    public List<String> items() {
        return new ArrayList<>(models.keySet());
    }

    public int size() {
        return models.size();
    }

}
