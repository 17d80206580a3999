package com.netaudit.topology.discovery.parse;

import com.netaudit.topology.config.AuditorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class TemplateOutputParser implements OutputParser {
    private static final Logger log = LoggerFactory.getLogger(TemplateOutputParser.class);

    private final AuditorProperties properties;
    private final ResourceLoader resourceLoader;
    private final Map<String, ParseTemplate> cache = new ConcurrentHashMap<>();

    public TemplateOutputParser(AuditorProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @Override
    public List<Map<String, String>> parse(String rawText, String template) {
        return load(template).apply(rawText);
    }

    @Override
    public void requireTemplate(String template) {
        load(template);
    }

    private ParseTemplate load(String template) {
        if (template == null || template.isBlank()) {
            throw new TemplateUnavailableException("template name is empty");
        }
        return cache.computeIfAbsent(template.trim(), this::read);
    }

    private ParseTemplate read(String template) {
        String location = properties.getTemplates().getLocation() + template;
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new TemplateUnavailableException("template not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            ParseTemplate parsed = ParseTemplate.compile(template, new String(in.readAllBytes(), StandardCharsets.UTF_8));
            log.debug("Loaded parse template {}", location);
            return parsed;
        } catch (IOException e) {
            throw new TemplateUnavailableException("template unreadable: " + location, e);
        }
    }
}
