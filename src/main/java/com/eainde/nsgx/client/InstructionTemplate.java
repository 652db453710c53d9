package com.eainde.nsgx.client;

import com.eainde.nsgx.exception.NsgxException;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * System instructions for the extractor, with the known catalog injected at
 * {@value #CATALOG_PLACEHOLDER}.
 */
public final class InstructionTemplate {

    public static final String CATALOG_PLACEHOLDER = "{{KNOWN_ENUMS_JSON}}";

    private final String template;

    public InstructionTemplate(String template) {
        this.template = template;
    }

    public static InstructionTemplate load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return new InstructionTemplate(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new NsgxException("Failed to load instruction template " + resource.getDescription(), e);
        }
    }

    public String render(String knownEnumsJson) {
        return template.replace(CATALOG_PLACEHOLDER, knownEnumsJson);
    }
}
