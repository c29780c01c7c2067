package io.bpmnconvert.signavio.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class ConverterConfigHelper {
    public static final String DEFAULT_CONFIG_RESOURCE = "converter-config.json";

    public static ConverterConfig loadConfigFile(String configFilePath) throws IOException {
        ObjectMapper mapper = new ObjectMapper();

        return validate(mapper.readValue(new File(configFilePath), ConverterConfig.class), configFilePath);
    }

    /**
     * Loads the configuration bundled with the converter, falling back to the built-in
     * defaults when the resource is not on the classpath.
     */
    public static ConverterConfig loadDefault() {
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream stream = ConverterConfigHelper.class.getClassLoader()
                .getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (stream == null) {
                return new ConverterConfig();
            }
            return validate(mapper.readValue(stream, ConverterConfig.class), DEFAULT_CONFIG_RESOURCE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read default converter config: " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    /**
     * Checks the fields that end up as XML ids or attributes.
     *
     * @throws IllegalArgumentException naming the offending field
     */
    public static ConverterConfig validate(ConverterConfig config, String source) {
        requireNcName(config.definitionsId, "definitionsId", source);
        requireNcName(config.collaborationId, "collaborationId", source);
        requireNcName(config.defaultProcessId, "defaultProcessId", source);
        if (config.targetNamespace == null || config.targetNamespace.isBlank()) {
            throw new IllegalArgumentException("Config '" + source + "': targetNamespace must not be empty");
        }
        if (config.outputExtension == null || config.outputExtension.isBlank()) {
            config.outputExtension = ".bpmn";
        }
        if (config.extensionNamespaces != null) {
            for (String prefix : config.extensionNamespaces.keySet()) {
                requireNcName(prefix, "extensionNamespaces prefix", source);
                if (prefix.equals("bpmn") || prefix.equals("bpmndi") || prefix.equals("dc")
                        || prefix.equals("di") || prefix.equals("xsi")) {
                    throw new IllegalArgumentException(
                            "Config '" + source + "': prefix '" + prefix + "' is reserved");
                }
            }
        }
        return config;
    }

    private static void requireNcName(String value, String field, String source) {
        if (value == null || !value.matches("[A-Za-z_][A-Za-z0-9_.-]*")) {
            throw new IllegalArgumentException(
                    "Config '" + source + "': " + field + " is not a valid XML id: " + value);
        }
    }
}
