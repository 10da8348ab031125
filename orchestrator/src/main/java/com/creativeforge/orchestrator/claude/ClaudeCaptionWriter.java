package com.creativeforge.orchestrator.claude;

import com.creativeforge.orchestrator.ai.CapabilityException;
import com.creativeforge.orchestrator.ai.CaptionGenerationCapability;
import com.creativeforge.orchestrator.claude.ClaudeClient.Message;
import com.creativeforge.orchestrator.model.OutputLanguage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Caption capability backed by Claude.
 *
 * The stage builds the creative brief; this class adds the language-specific
 * system prompt, strips quoting the model sometimes adds, and maps API errors
 * to the retry taxonomy.
 */
@Component
public class ClaudeCaptionWriter implements CaptionGenerationCapability {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCaptionWriter.class);

    private final ClaudeClient claude;
    private final String       model;

    public ClaudeCaptionWriter(ClaudeClient claude,
                               @Value("${anthropic.model:claude-sonnet-4-6}") String model) {
        this.claude = claude;
        this.model  = model;
    }

    @Override
    public String generate(String prompt, OutputLanguage language) {
        try {
            String reply = claude.complete(model, List.of(new Message("user", prompt)),
                    CaptionPrompts.system(language));
            return CaptionPrompts.clean(reply);
        } catch (ClaudeClient.ClaudeApiException e) {
            log.warn("Caption request rejected with HTTP {}", e.statusCode());
            throw CapabilityException.forStatus(e.statusCode(), e.getMessage());
        } catch (UncheckedIOException | IllegalStateException e) {
            throw CapabilityException.transientFailure("Caption request failed: " + e.getMessage(), e);
        }
    }
}
