package com.parametric.nodegraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import lombok.extern.log4j.Log4j2;

/**
 * JSON reader/writer for {@link GraphDocument}s.
 */
@Log4j2
public final class GraphDocumentMapper {
    private final ObjectMapper mapper;

    public GraphDocumentMapper() {
        this(new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public GraphDocumentMapper(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String write(GraphDocument document) throws JsonProcessingException {
        return mapper.writeValueAsString(document);
    }

    public void write(GraphDocument document, Path path) throws IOException {
        Files.writeString(path, write(document));
        log.debug("Wrote {} nodes, {} connections, {} components to {}", document.getNodes().size(),
                document.getConnections().size(), document.getComponents().size(), path);
    }

    public GraphDocument read(String json) throws JsonProcessingException {
        return mapper.readValue(json, GraphDocument.class);
    }

    public GraphDocument read(Path path) throws IOException {
        GraphDocument document = read(Files.readString(path));
        log.debug("Read {} nodes, {} connections from {}", document.getNodes().size(),
                document.getConnections().size(), path);
        return document;
    }
}
