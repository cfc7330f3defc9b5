package com.thicket.db.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.thicket.db.model.ParsedModel;
import com.thicket.db.util.JsonUtil;

import java.nio.file.Path;

/**
 * Wire format between a worker and the build: one JSON object
 * {@code {"model": {...}, "labels": {...}}} on the worker's standard output.
 */
public class ParsedModelCodec {

    public String encode(ParsedModel parsed) throws JsonProcessingException {
        return JsonUtil.mapper().writeValueAsString(parsed);
    }

    public ParsedModel decode(String output, Path assetFile) throws RecordParseException {
        if (output == null || output.isBlank()) {
            throw new RecordParseException(assetFile, "worker produced no output");
        }

        ParsedModel parsed;
        try {
            parsed = JsonUtil.mapper().readValue(output, ParsedModel.class);
        } catch (JsonProcessingException e) {
            throw new RecordParseException(assetFile, "malformed worker output: " + e.getOriginalMessage(), e);
        }

        if (parsed == null || parsed.getModel() == null) {
            throw new RecordParseException(assetFile, "worker output has no model record");
        }
        if (parsed.getModel().getName() == null || parsed.getModel().getName().isEmpty()) {
            throw new RecordParseException(assetFile, "worker output has a model without a name");
        }
        return parsed;
    }
}
