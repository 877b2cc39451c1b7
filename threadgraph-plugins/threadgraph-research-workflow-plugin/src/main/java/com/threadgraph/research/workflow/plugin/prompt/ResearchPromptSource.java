package com.threadgraph.research.workflow.plugin.prompt;

import com.ibm.icu.text.MessageFormat;
import com.threadgraph.integration.exception.ThreadGraphStageRuntimeException;
import com.threadgraph.research.workflow.plugin.exception.ResearchWorkflowErrorCodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.context.NoSuchMessageException;
import org.springframework.context.support.ResourceBundleMessageSource;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Loads prompt templates from a resource bundle and fills in named arguments.
 */
@Slf4j
public final class ResearchPromptSource {

    public static final String DEFAULT_BASENAME = "prompts/research_workflow_prompts";

    private final String baseName;
    private final MessageSource messageSource;
    private final Locale locale;

    public ResearchPromptSource() {
        this(DEFAULT_BASENAME, Locale.ROOT);
    }

    public ResearchPromptSource(String baseName, Locale locale) {
        ResourceBundleMessageSource source = new ResourceBundleMessageSource();
        source.setBundleClassLoader(ResearchPromptSource.class.getClassLoader());
        source.setDefaultEncoding(StandardCharsets.UTF_8.name());
        source.setFallbackToSystemLocale(false);
        source.setBasename(baseName);
        this.baseName = baseName;
        this.messageSource = source;
        this.locale = locale;
    }

    public String get(String key) {
        return render(key, Map.of());
    }

    /**
     * @throws ThreadGraphStageRuntimeException with {@code PROMPT_TEMPLATE_MISSING} when the key is not defined
     */
    public String render(String key, Map<String, Object> arguments) {
        String template;
        try {
            // null args: the ICU formatter below handles the named parameters
            template = messageSource.getMessage(key, null, locale);
        } catch (NoSuchMessageException e) {
            log.error("Prompt template {} not found in {}", key, baseName);
            throw new ThreadGraphStageRuntimeException(
                    ResearchWorkflowErrorCodes.PROMPT_TEMPLATE_MISSING, Map.of("key", key), e);
        }
        if (arguments == null || arguments.isEmpty()) {
            return template;
        }
        return new MessageFormat(template, locale).format(arguments);
    }
}
