package uk.gegc.paperdigest.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extra line-filter patterns appended after the built-in boilerplate rules.
 * Each entry is a regular expression matched case-insensitively against the start of a trimmed line.
 */
@Component
@ConfigurationProperties(prefix = "extraction.boilerplate")
@Data
public class BoilerplateFilterConfig {

    private List<String> extraPatterns = new ArrayList<>();
}
