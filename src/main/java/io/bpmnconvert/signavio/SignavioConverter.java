package io.bpmnconvert.signavio;

import io.bpmnconvert.signavio.bpmn.BpmnXmlBuilder;
import io.bpmnconvert.signavio.config.ConverterConfig;
import io.bpmnconvert.signavio.diagnostics.Diagnostics;
import io.bpmnconvert.signavio.json.SignavioJsonLoader;
import io.bpmnconvert.signavio.layout.CoordinateTransformer;
import io.bpmnconvert.signavio.models.ProcessModel;
import io.bpmnconvert.signavio.resolve.ReferenceResolver;
import io.bpmnconvert.signavio.stencil.StencilMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts a single Signavio JSON document into BPMN 2.0 XML.
 * <p>
 * Stages run in a fixed order on one {@link ProcessModel}: load, map stencils, resolve
 * references, transform coordinates, build XML. Instances hold only the configuration and
 * can be shared between threads.
 */
public class SignavioConverter {
    private static final Logger log = LoggerFactory.getLogger(SignavioConverter.class);

    private final ConverterConfig config;

    public SignavioConverter(ConverterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Converter config must not be null");
        }
        this.config = config;
    }

    public ConverterConfig getConfig() {
        return config;
    }

    /**
     * @throws io.bpmnconvert.signavio.json.StructuralParseException when the content is not a Signavio document
     */
    public ConvertedDocument convert(byte[] content) {
        Diagnostics diagnostics = new Diagnostics();
        ProcessModel model = SignavioJsonLoader.load(content, diagnostics);
        log.debug("Loaded {} shapes and {} connectors", model.getNodes().size() - 1, model.getEdges().size());

        StencilMapper.map(model, diagnostics);
        ReferenceResolver.resolve(model, config, diagnostics);
        CoordinateTransformer.transform(model, config, diagnostics);
        Document doc = BpmnXmlBuilder.build(model, config, diagnostics);

        String xml = BpmnXmlBuilder.toXmlString(doc);
        log.debug("Built BPMN document with {} elements and {} diagnostics",
                model.getLiveNodes().size() + model.getLiveEdges().size(), diagnostics.size());
        return new ConvertedDocument(xml, diagnostics);
    }

    public ConvertedDocument convert(Path inputFile) {
        byte[] content;
        try {
            content = Files.readAllBytes(inputFile);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read Signavio JSON file: " + inputFile, e);
        }
        return convert(content);
    }

    /**
     * Converts {@code inputFile} and writes the XML to {@code outputFile}, creating parent directories.
     */
    public ConvertedDocument convertFile(Path inputFile, Path outputFile) {
        ConvertedDocument result = convert(inputFile);
        BpmnXmlBuilder.writeBpmnDocument(result.xml(), outputFile);
        log.info("Converted {} -> {}", inputFile, outputFile);
        return result;
    }
}
