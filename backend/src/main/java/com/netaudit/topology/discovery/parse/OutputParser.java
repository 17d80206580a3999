package com.netaudit.topology.discovery.parse;

import java.util.List;
import java.util.Map;

/**
 * Turns raw command output into rows of named fields.
 */
public interface OutputParser {

    List<Map<String, String>> parse(String rawText, String template);

    /**
     * Fails with {@link TemplateUnavailableException} when a template cannot be loaded.
     */
    void requireTemplate(String template);
}
